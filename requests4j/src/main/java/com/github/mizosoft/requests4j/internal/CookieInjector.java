/*
 * Copyright (c) 2024 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.requests4j.internal;

import com.github.mizosoft.requests4j.Client;
import com.github.mizosoft.requests4j.RequestArguments;
import java.net.HttpCookie;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reconciles a request's explicit cookie jar, its cookie map and its client's jar. An explicit jar
 * replaces the client's for the request only. Otherwise, the cookie map is saved into the client's
 * jar for the request's URI, alongside the cookies already stored there.
 */
public final class CookieInjector {
  private CookieInjector() {}

  /**
   * Applies the cookie settings of the given arguments and returns the client to execute the
   * request with.
   *
   * @throws IllegalArgumentException if a cookie name is not a valid cookie name
   */
  public static Client inject(RequestArguments arguments, URI uri) {
    var client = arguments.client();
    var cookieJar = arguments.cookieJar();
    if (cookieJar != null) {
      return client.withCookieJar(cookieJar);
    }
    if (!arguments.cookies().isEmpty()) {
      // Stored cookies for the URI stay, so adding the new ones is enough to send both.
      client.cookieJar().setCookies(uri, toHttpCookies(arguments.cookies()));
    }
    return client;
  }

  static List<HttpCookie> toHttpCookies(Map<String, String> cookies) {
    var httpCookies = new ArrayList<HttpCookie>(cookies.size());
    cookies.forEach(
        (name, value) -> {
          var cookie = new HttpCookie(name, value);
          cookie.setVersion(0);
          httpCookies.add(cookie);
        });
    return httpCookies;
  }
}
