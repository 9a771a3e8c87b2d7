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

import static com.github.mizosoft.requests4j.internal.Validate.requireNonNegative;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.util.List;

/**
 * Decides whether a {@link Client} follows a redirect. The policy is consulted before each
 * follow-up request is sent, and rejects it by throwing.
 */
@FunctionalInterface
public interface RedirectPolicy {

  /**
   * Checks whether the given follow-up request may be sent.
   *
   * @param next the request that follows the redirect
   * @param via the requests sent so far, oldest first
   * @throws IOException to stop following redirects, in which case the exception propagates to the
   *     caller of {@link Client#send(HttpRequest)}
   */
  void checkRedirect(HttpRequest next, List<HttpRequest> via) throws IOException;

  /**
   * Returns a policy that follows up to {@code maxRedirects} redirects and throws a {@link
   * TooManyRedirectsException} on the next one. A limit of {@code 0} rejects every redirect.
   */
  static RedirectPolicy limit(int maxRedirects) {
    requireNonNegative(maxRedirects, "maxRedirects");
    return (next, via) -> {
      int redirectCount = via.size() - 1;
      if (redirectCount >= maxRedirects) {
        throw new TooManyRedirectsException(next.uri(), redirectCount);
      }
    };
  }
}
