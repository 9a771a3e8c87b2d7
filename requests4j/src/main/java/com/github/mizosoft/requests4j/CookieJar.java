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

package com.github.mizosoft.requests4j;

import java.net.CookieManager;
import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.URI;
import java.util.List;

/**
 * A store of cookies scoped to URLs. A {@link Client} saves the cookies it receives into its jar
 * and sends back the ones the jar returns for each request's URL.
 *
 * <p>Implementations shared by a {@link Session} used from multiple threads must be thread-safe.
 * The jars returned by {@link #create()} are.
 */
public interface CookieJar {

  /** Returns the cookies to send with a request to the given URI. */
  List<HttpCookie> cookies(URI uri);

  /**
   * Stores the given cookies as received from the given URI. Cookies that don't specify a path are
   * scoped to the URI's default path, and cookies that don't specify a domain are only sent back to
   * the URI's host.
   */
  void setCookies(URI uri, List<HttpCookie> cookies);

  /** Returns a new thread-safe in-memory {@code CookieJar}. */
  static CookieJar create() {
    return ofStore(new CookieManager().getCookieStore());
  }

  /** Returns a {@code CookieJar} that saves cookies into the given {@code CookieStore}. */
  static CookieJar ofStore(CookieStore store) {
    return new StoreCookieJar(store);
  }
}
