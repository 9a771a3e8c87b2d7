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

import static com.github.mizosoft.requests4j.internal.HttpChars.QUOTED_PAIR;
import static com.github.mizosoft.requests4j.internal.HttpChars.quoteIfNeeded;
import static com.github.mizosoft.requests4j.internal.HttpChars.requireToken;
import static com.github.mizosoft.requests4j.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A MIME type as written in a {@code Content-Type} header. Type, subtype and parameter names are
 * case-insensitive and are kept in lower-case.
 */
public final class MediaType {
  private static final String CHARSET_ATTRIBUTE = "charset";

  /** {@code application/json} */
  public static final MediaType APPLICATION_JSON = new MediaType("application", "json");

  /** {@code application/x-www-form-urlencoded} */
  public static final MediaType APPLICATION_FORM_URLENCODED =
      new MediaType("application", "x-www-form-urlencoded");

  /** {@code application/octet-stream} */
  public static final MediaType APPLICATION_OCTET_STREAM =
      new MediaType("application", "octet-stream");

  /** {@code multipart/form-data} */
  public static final MediaType MULTIPART_FORM_DATA = new MediaType("multipart", "form-data");

  /** {@code text/plain} */
  public static final MediaType TEXT_PLAIN = new MediaType("text", "plain");

  private final String type;
  private final String subtype;
  private final Map<String, String> parameters;
  private @MonotonicNonNull String lazyToString;

  private MediaType(String type, String subtype) {
    this(type, subtype, Map.of());
  }

  private MediaType(String type, String subtype, Map<String, String> parameters) {
    this.type = type;
    this.subtype = subtype;
    this.parameters = parameters;
  }

  /** Returns the general type. */
  public String type() {
    return type;
  }

  /** Returns the subtype. */
  public String subtype() {
    return subtype;
  }

  /** Returns an immutable map of this media type's parameters. */
  public Map<String, String> parameters() {
    return parameters;
  }

  /**
   * Returns the charset named by the {@code charset} parameter, or an empty {@code Optional} if
   * there's no such parameter or the JVM doesn't know the charset.
   */
  public Optional<Charset> charset() {
    var charsetName = parameters.get(CHARSET_ATTRIBUTE);
    if (charsetName == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Charset.forName(charsetName));
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      return Optional.empty();
    }
  }

  /**
   * Returns a new {@code MediaType} with this instance's type, subtype and parameters, with the
   * given parameter added or replaced.
   *
   * @throws IllegalArgumentException if the given name or value is invalid
   */
  public MediaType withParameter(String name, String value) {
    var parameters = new LinkedHashMap<>(this.parameters);
    parameters.put(normalizeToken(name), requireValidParameterValue(value));
    return new MediaType(type, subtype, Collections.unmodifiableMap(parameters));
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof MediaType)) {
      return false;
    }
    var other = (MediaType) obj;
    return type.equals(other.type)
        && subtype.equals(other.subtype)
        && parameters.equals(other.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, subtype, parameters);
  }

  /** Returns this media type in the format of a {@code Content-Type} header value. */
  @Override
  public String toString() {
    var toString = lazyToString;
    if (toString == null) {
      var sb = new StringBuilder().append(type).append('/').append(subtype);
      parameters.forEach(
          (name, value) -> sb.append("; ").append(name).append('=').append(quoteIfNeeded(value)));
      toString = sb.toString();
      lazyToString = toString;
    }
    return toString;
  }

  /**
   * Returns a new {@code MediaType} with the given type and subtype.
   *
   * @throws IllegalArgumentException if the given type or subtype is not a valid token
   */
  public static MediaType of(String type, String subtype) {
    return new MediaType(normalizeToken(type), normalizeToken(subtype));
  }

  /**
   * Parses the given {@code Content-Type} value. Quoted parameter values are unquoted. Parameters
   * separated by {@code ;} inside quoted strings aren't supported.
   *
   * @throws IllegalArgumentException if the given value is not a valid media type
   */
  public static MediaType parse(String value) {
    var segments = value.split(";");
    var typeAndSubtype = segments[0].trim();
    int slash = typeAndSubtype.indexOf('/');
    requireArgument(slash > 0, "couldn't parse: '%s'", value);
    var mediaType =
        of(typeAndSubtype.substring(0, slash), typeAndSubtype.substring(slash + 1).trim());
    for (int i = 1; i < segments.length; i++) {
      var parameter = segments[i].trim();
      if (parameter.isEmpty()) {
        continue;
      }
      int equals = parameter.indexOf('=');
      requireArgument(equals > 0, "couldn't parse parameter '%s' in: '%s'", parameter, value);
      mediaType =
          mediaType.withParameter(
              parameter.substring(0, equals).trim(), unquote(parameter.substring(equals + 1)));
    }
    return mediaType;
  }

  private static String unquote(String value) {
    var trimmed = value.trim();
    if (trimmed.length() < 2 || trimmed.charAt(0) != '"' || !trimmed.endsWith("\"")) {
      return trimmed;
    }
    var unquoted = new StringBuilder();
    for (int i = 1; i < trimmed.length() - 1; i++) {
      char c = trimmed.charAt(i);
      if (c == '\\' && i + 1 < trimmed.length() - 1) {
        c = trimmed.charAt(++i);
      }
      unquoted.append(c);
    }
    return unquoted.toString();
  }

  private static String normalizeToken(String token) {
    return requireToken(requireNonNull(token)).toLowerCase(Locale.ROOT);
  }

  private static String requireValidParameterValue(String value) {
    requireArgument(QUOTED_PAIR.allMatch(value), "illegal parameter value: '%s'", value);
    return value;
  }
}
