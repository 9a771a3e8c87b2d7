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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.MalformedURLException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * An ordered multimap of query parameters, as found in a URL's query string or in an {@code
 * application/x-www-form-urlencoded} body. Keys keep their insertion order, and so do the values of
 * each key. The {@link #encode() encoded form} however lists keys in ascending order, which makes
 * the output independent of how the parameters were collected.
 */
public final class QueryValues {
  private final Map<String, List<String>> values = new LinkedHashMap<>();

  private QueryValues() {}

  /**
   * Sets the given key to the given value, replacing all values previously associated with the
   * key.
   */
  @CanIgnoreReturnValue
  public QueryValues set(String key, String value) {
    requireNonNull(value);
    var keyValues = values.computeIfAbsent(requireNonNull(key), __ -> new ArrayList<>());
    keyValues.clear();
    keyValues.add(value);
    return this;
  }

  /** Adds the given value to the values associated with the given key. */
  @CanIgnoreReturnValue
  public QueryValues add(String key, String value) {
    requireNonNull(value);
    values.computeIfAbsent(requireNonNull(key), __ -> new ArrayList<>()).add(value);
    return this;
  }

  /** Sets each of the given map's keys to its value. */
  @CanIgnoreReturnValue
  public QueryValues setAll(Map<String, String> values) {
    values.forEach(this::set);
    return this;
  }

  /** Adds all values of the given {@code QueryValues}. */
  @CanIgnoreReturnValue
  public QueryValues addAll(QueryValues other) {
    other.values.forEach((key, keyValues) -> keyValues.forEach(value -> add(key, value)));
    return this;
  }

  /** Returns the first value associated with the given key. */
  public Optional<String> first(String key) {
    var keyValues = values.getOrDefault(key, List.of());
    return keyValues.isEmpty() ? Optional.empty() : Optional.of(keyValues.get(0));
  }

  /** Returns an immutable list of the values associated with the given key. */
  public List<String> all(String key) {
    return List.copyOf(values.getOrDefault(key, List.of()));
  }

  /** Returns an immutable set of the keys in insertion order. */
  public Set<String> keys() {
    return Collections.unmodifiableSet(values.keySet());
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Returns an immutable deep copy of this instance's content. */
  public Map<String, List<String>> toMap() {
    var copy = new LinkedHashMap<String, List<String>>();
    values.forEach((key, keyValues) -> copy.put(key, List.copyOf(keyValues)));
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the url-encoded form of these values: {@code key=value} pairs joined by {@code &}, keys
   * sorted in ascending order and each key's values in insertion order.
   */
  public String encode() {
    var joiner = new StringJoiner("&");
    new TreeMap<>(values)
        .forEach(
            (key, keyValues) -> {
              var escapedKey = escape(key);
              keyValues.forEach(value -> joiner.add(escapedKey + "=" + escape(value)));
            });
    return joiner.toString();
  }

  @Override
  public String toString() {
    return encode();
  }

  /** Returns a new empty {@code QueryValues}. */
  public static QueryValues create() {
    return new QueryValues();
  }

  /**
   * Parses the given raw query string. Pairs are separated by {@code &} and empty pairs are
   * skipped. A pair without {@code =} is taken as a key with an empty value.
   *
   * @throws MalformedURLException if a pair contains a {@code ;} or an invalid escape sequence
   */
  public static QueryValues parse(String rawQuery) throws MalformedURLException {
    var queryValues = new QueryValues();
    for (var pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      if (pair.indexOf(';') >= 0) {
        throw new MalformedURLException("invalid semicolon separator in query: '" + pair + "'");
      }
      int equals = pair.indexOf('=');
      var key = equals >= 0 ? pair.substring(0, equals) : pair;
      var value = equals >= 0 ? pair.substring(equals + 1) : "";
      queryValues.add(unescape(key), unescape(value));
    }
    return queryValues;
  }

  /**
   * Escapes the given string for use as a query key or value. Letters, digits and {@code -_.~} are
   * left as-is, a space becomes {@code +} and everything else is percent-encoded as UTF-8.
   */
  public static String escape(String value) {
    // URLEncoder leaves '*' as-is and percent-encodes '~', the opposite of RFC 3986.
    return URLEncoder.encode(value, UTF_8).replace("*", "%2A").replace("%7E", "~");
  }

  private static String unescape(String value) throws MalformedURLException {
    try {
      return URLDecoder.decode(value, UTF_8);
    } catch (IllegalArgumentException e) {
      var malformed = new MalformedURLException("invalid escape in query: '" + value + "'");
      malformed.initCause(e);
      throw malformed;
    }
  }
}
