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

import java.io.IOException;
import java.net.URI;

/** Thrown when a redirect is not followed because the redirect limit has been reached. */
public class TooManyRedirectsException extends IOException {
  private static final long serialVersionUID = 1L;

  private final URI location;
  private final int redirectCount;

  public TooManyRedirectsException(URI location, int redirectCount) {
    super("stopped after " + redirectCount + " redirects, next location: " + location);
    this.location = location;
    this.redirectCount = redirectCount;
  }

  /** Returns the location of the redirect that wasn't followed. */
  public URI location() {
    return location;
  }

  /** Returns the number of redirects followed before giving up. */
  public int redirectCount() {
    return redirectCount;
  }
}
