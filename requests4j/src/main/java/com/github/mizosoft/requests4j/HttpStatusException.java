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

/** Thrown by {@link Response#raiseForStatus()} for a client or server error status code. */
public class HttpStatusException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final URI uri;

  public HttpStatusException(int statusCode, URI uri) {
    super(describe(statusCode) + " " + statusCode + " for url: " + uri);
    this.statusCode = statusCode;
    this.uri = uri;
  }

  public int statusCode() {
    return statusCode;
  }

  public URI uri() {
    return uri;
  }

  private static String describe(int statusCode) {
    return HttpStatus.isClientError(statusCode) ? "Client Error" : "Server Error";
  }
}
