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

import static com.github.mizosoft.requests4j.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

/**
 * The content of a JSON request body. A payload is either text or bytes that already hold a JSON
 * document, which are sent as-is, or an arbitrary object that is serialized with Jackson when the
 * body is encoded. The {@link #kind() kind} tells which of {@link #text()}, {@link #bytes()} or
 * {@link #value()} holds the content.
 */
public final class JsonPayload {
  private final Kind kind;
  private final Object content;

  private JsonPayload(Kind kind, Object content) {
    this.kind = kind;
    this.content = requireNonNull(content);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the JSON text of a {@link Kind#RAW_TEXT} payload.
   *
   * @throws IllegalStateException if this payload is of another kind
   */
  public String text() {
    requireKind(Kind.RAW_TEXT);
    return (String) content;
  }

  /**
   * Returns a copy of the JSON bytes of a {@link Kind#RAW_BYTES} payload.
   *
   * @throws IllegalStateException if this payload is of another kind
   */
  public byte[] bytes() {
    requireKind(Kind.RAW_BYTES);
    return ((byte[]) content).clone();
  }

  /**
   * Returns the object of a {@link Kind#STRUCTURED} payload.
   *
   * @throws IllegalStateException if this payload is of another kind
   */
  public Object value() {
    requireKind(Kind.STRUCTURED);
    return content;
  }

  private void requireKind(Kind expected) {
    requireState(kind == expected, "expected a %s payload but was %s", expected, kind);
  }

  @Override
  public String toString() {
    return "JsonPayload[" + kind + "]";
  }

  /** Returns a payload of already serialized JSON text. */
  public static JsonPayload ofText(String json) {
    return new JsonPayload(Kind.RAW_TEXT, json);
  }

  /** Returns a payload of already serialized JSON bytes. */
  public static JsonPayload ofBytes(byte[] json) {
    return new JsonPayload(Kind.RAW_BYTES, json.clone());
  }

  /** Returns a payload of an object to be serialized when the body is encoded. */
  public static JsonPayload of(Object value) {
    return new JsonPayload(Kind.STRUCTURED, value);
  }

  /** The kinds of JSON payloads. */
  public enum Kind {
    RAW_TEXT,
    RAW_BYTES,
    STRUCTURED
  }
}
