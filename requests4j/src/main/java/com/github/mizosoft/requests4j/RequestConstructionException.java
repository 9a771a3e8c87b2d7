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

import java.io.IOException;

/**
 * Thrown when a request can't be assembled from its options. The {@link #stage() stage} tells at
 * which step of the assembly the failure happened, and the cause carries the underlying error: a
 * {@link java.net.MalformedURLException} for an unparsable URL, an {@link EncodingException} or an
 * {@code IOException} for a body that couldn't be encoded, or an {@code IllegalArgumentException}
 * for a method, URL or header rejected by {@code java.net.http}.
 */
public class RequestConstructionException extends IOException {
  private static final long serialVersionUID = 1L;

  private final Stage stage;

  public RequestConstructionException(Stage stage, String message, Throwable cause) {
    super("[" + stage + "] " + message, cause);
    this.stage = requireNonNull(stage);
  }

  /** Returns the assembly step that failed. */
  public Stage stage() {
    return stage;
  }

  /** The steps of request assembly, in the order they run. */
  public enum Stage {
    /** Merging query parameters into the URL. */
    URL,

    /** Encoding the request body. */
    BODY,

    /** Building the request from its method, URL, body and timeout. */
    REQUEST,

    /** Setting authentication, headers and cookies. */
    HEADERS
  }
}
