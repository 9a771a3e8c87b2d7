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

import static com.github.mizosoft.requests4j.internal.HttpChars.requireHeaderName;
import static com.github.mizosoft.requests4j.internal.HttpChars.requireHeaderValue;
import static com.github.mizosoft.requests4j.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * The settings every request starts from: default headers, the default redirect limit and the
 * {@code ObjectMapper} used for JSON bodies, structured query objects and response decoding.
 * Instances are immutable and can be shared freely.
 */
public final class RequestDefaults {
  /** The {@code User-Agent} sent by default. */
  public static final String USER_AGENT = "requests4j/1.0";

  private static final RequestDefaults STANDARD =
      newBuilder()
          .header("User-Agent", USER_AGENT)
          .header("Accept", "*/*")
          .redirectLimit(Client.DEFAULT_REDIRECT_LIMIT)
          .mapper(new JsonMapper())
          .build();

  private final Map<String, String> headers;
  private final int redirectLimit;
  private final ObjectMapper mapper;

  private RequestDefaults(Builder builder) {
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.redirectLimit = builder.redirectLimit;
    this.mapper = builder.mapper;
  }

  /** Returns the headers every request starts with. */
  public Map<String, String> headers() {
    return headers;
  }

  /** Returns the redirect limit used when a request doesn't set a positive one. */
  public int redirectLimit() {
    return redirectLimit;
  }

  /** Returns the mapper used for JSON encoding and decoding. */
  public ObjectMapper mapper() {
    return mapper;
  }

  /** Returns a builder that starts with this instance's settings. */
  public Builder toBuilder() {
    var builder = new Builder();
    builder.headers.putAll(headers);
    builder.redirectLimit = redirectLimit;
    builder.mapper = mapper;
    return builder;
  }

  @Override
  public String toString() {
    return "RequestDefaults[headers=" + headers + ", redirectLimit=" + redirectLimit + "]";
  }

  /**
   * Returns the stock defaults: {@code User-Agent: requests4j/1.0}, {@code Accept: *}{@code /*}, a
   * redirect limit of {@value Client#DEFAULT_REDIRECT_LIMIT} and a plain {@code JsonMapper}.
   */
  public static RequestDefaults standard() {
    return STANDARD;
  }

  /** Returns a new builder with no headers, the default redirect limit and a plain mapper. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code RequestDefaults}. */
  public static final class Builder {
    // Case-insensitive so that setting a header twice with different cases keeps one entry.
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private int redirectLimit = Client.DEFAULT_REDIRECT_LIMIT;
    private ObjectMapper mapper;

    Builder() {
      mapper = new JsonMapper();
    }

    /** Sets a default header, replacing any previous value for the same name. */
    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      requireHeaderName(name);
      requireHeaderValue(value);
      headers.remove(name); // Keep the latest spelling of the name.
      headers.put(name, value);
      return this;
    }

    /** Removes a default header. */
    @CanIgnoreReturnValue
    public Builder removeHeader(String name) {
      headers.remove(requireNonNull(name));
      return this;
    }

    /** Sets the redirect limit used when a request doesn't set a positive one. */
    @CanIgnoreReturnValue
    public Builder redirectLimit(int redirectLimit) {
      requireArgument(redirectLimit > 0, "non-positive redirectLimit: %d", redirectLimit);
      this.redirectLimit = redirectLimit;
      return this;
    }

    /** Sets the mapper used for JSON encoding and decoding. */
    @CanIgnoreReturnValue
    public Builder mapper(ObjectMapper mapper) {
      this.mapper = requireNonNull(mapper);
      return this;
    }

    public RequestDefaults build() {
      return new RequestDefaults(this);
    }
  }
}
