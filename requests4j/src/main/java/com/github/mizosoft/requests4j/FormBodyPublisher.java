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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Flow.Subscriber;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * A {@code BodyPublisher} for form submission using the {@code application/x-www-form-urlencoded}
 * request type. Fields are encoded with their keys in ascending order.
 */
public final class FormBodyPublisher implements MimeBodyPublisher {
  private final QueryValues fields;
  private @MonotonicNonNull String encodedString;

  private FormBodyPublisher(QueryValues fields) {
    this.fields = fields;
  }

  /** Returns the url-encoded string of this body's fields. */
  public String encodedString() {
    var result = encodedString;
    if (result == null) {
      result = fields.encode();
      encodedString = result;
    }
    return result;
  }

  /** Returns the first value of the field with the given name. */
  public Optional<String> firstValue(String name) {
    return fields.first(name);
  }

  /** Returns this body's fields. */
  public Map<String, List<String>> fields() {
    return fields.toMap();
  }

  @Override
  public MediaType mediaType() {
    return MediaType.APPLICATION_FORM_URLENCODED;
  }

  @Override
  public long contentLength() {
    // Characters are ASCII so 1 byte each.
    return encodedString().length();
  }

  @Override
  public void subscribe(Subscriber<? super ByteBuffer> subscriber) {
    requireNonNull(subscriber);
    BodyPublishers.ofString(encodedString(), US_ASCII).subscribe(subscriber);
  }

  /** Returns a {@code FormBodyPublisher} with each of the given map's entries as a field. */
  public static FormBodyPublisher of(Map<String, String> fields) {
    var builder = newBuilder();
    fields.forEach(builder::set);
    return builder.build();
  }

  /** Returns a new {@code FormBodyPublisher.Builder}. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code FormBodyPublisher} instances. */
  public static final class Builder {
    private final QueryValues fields = QueryValues.create();

    Builder() {}

    /** Adds a field with the given name and value. */
    @CanIgnoreReturnValue
    public Builder add(String name, String value) {
      fields.add(name, value);
      return this;
    }

    /** Sets the field with the given name to the given value, replacing any previous values. */
    @CanIgnoreReturnValue
    public Builder set(String name, String value) {
      fields.set(name, value);
      return this;
    }

    /** Returns a new {@code FormBodyPublisher} with the added fields. */
    public FormBodyPublisher build() {
      return new FormBodyPublisher(QueryValues.create().addAll(fields));
    }
  }
}
