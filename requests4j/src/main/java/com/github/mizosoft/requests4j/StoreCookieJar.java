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

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A {@link CookieJar} on top of a {@code java.net.CookieStore}. */
final class StoreCookieJar implements CookieJar {
  private static final Logger logger = System.getLogger(StoreCookieJar.class.getName());

  private final CookieStore store;

  StoreCookieJar(CookieStore store) {
    this.store = requireNonNull(store);
  }

  @Override
  public List<HttpCookie> cookies(URI uri) {
    // The store takes care of domain matching and expiry.
    var requestPath = pathOf(uri);
    boolean secure = "https".equalsIgnoreCase(uri.getScheme());
    var cookies = new ArrayList<HttpCookie>();
    for (var cookie : store.get(uri)) {
      if ((secure || !cookie.getSecure()) && pathMatches(requestPath, cookie.getPath())) {
        cookies.add(cookie);
      }
    }
    // Cookies with longer paths are listed first.
    cookies.sort(
        Comparator.comparingInt((HttpCookie cookie) -> lengthOf(cookie.getPath())).reversed());
    return cookies;
  }

  @Override
  public void setCookies(URI uri, List<HttpCookie> cookies) {
    var host = uri.getHost();
    for (var cookie : cookies) {
      var domain = cookie.getDomain();
      if (domain != null && (host == null || !HttpCookie.domainMatches(domain, host))) {
        logger.log(
            Level.DEBUG, () -> "rejecting cookie " + cookie.getName() + " for domain " + domain);
        continue;
      }
      if (cookie.getPath() == null) {
        cookie.setPath(defaultPath(uri));
      }
      store.add(uri, cookie);
    }
  }

  /** Returns the default path of a cookie set by a response to the given URI (RFC 6265 5.1.4). */
  static String defaultPath(URI uri) {
    var path = uri.getRawPath();
    if (path == null || !path.startsWith("/")) {
      return "/";
    }
    int lastSlash = path.lastIndexOf('/');
    return lastSlash == 0 ? "/" : path.substring(0, lastSlash);
  }

  private static String pathOf(URI uri) {
    var path = uri.getRawPath();
    return path == null || path.isEmpty() ? "/" : path;
  }

  // RFC 6265 5.1.4
  private static boolean pathMatches(String requestPath, @Nullable String cookiePath) {
    if (cookiePath == null || requestPath.equals(cookiePath)) {
      return true;
    }
    return requestPath.startsWith(cookiePath)
        && (cookiePath.endsWith("/") || requestPath.charAt(cookiePath.length()) == '/');
  }

  private static int lengthOf(@Nullable String path) {
    return path != null ? path.length() : 0;
  }
}
