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

package com.github.mizosoft.requests4j.internal;

import static com.github.mizosoft.requests4j.internal.Validate.requireArgument;

/** Character classes of the HTTP grammar. */
public final class HttpChars {
  private HttpChars() {} // non-instantiable

  // token          = 1*tchar
  // tchar          = "!" / "#" / "$" / "%" / "&" / "'" / "*"
  //                    / "+" / "-" / "." / "^" / "_" / "`" / "|" / "~"
  //                    / DIGIT / ALPHA
  public static final Matcher TOKEN = Matcher.anyOf("!#$%&'*+-.^_`|~").or(Matcher.alphaNumeric());

  // field-value    = *( field-vchar [ 1*( SP / HTAB ) field-vchar ] )
  // obs-fold & obs-text are rejected.
  public static final Matcher FIELD_VALUE = Matcher.inRange(0x21, 0x7E).or(Matcher.anyOf(" \t"));

  // quoted-pair    = "\" ( HTAB / SP / VCHAR )
  public static final Matcher QUOTED_PAIR = Matcher.inRange(0x21, 0x7E).or(Matcher.anyOf(" \t"));

  // bcharnospace := DIGIT / ALPHA / "'" / "(" / ")" / "+" / "_" / "," / "-" / "." / "/" / ":" /
  //                 "=" / "?"
  public static final Matcher BOUNDARY = Matcher.anyOf("'()+_,-./:=? ").or(Matcher.alphaNumeric());

  public static boolean isToken(CharSequence value) {
    return value.length() > 0 && TOKEN.allMatch(value);
  }

  public static String requireToken(String value) {
    requireArgument(isToken(value), "illegal token: '%s'", value);
    return value;
  }

  public static String requireHeaderName(String name) {
    requireArgument(isToken(name), "illegal header name: '%s'", name);
    return name;
  }

  public static String requireHeaderValue(String value) {
    requireArgument(FIELD_VALUE.allMatch(value), "illegal header value: '%s'", value);
    return value;
  }

  /** Quotes the given value unless it's already a token, escaping {@code "} and {@code \}. */
  public static String quoteIfNeeded(String value) {
    if (isToken(value)) {
      return value;
    }
    var quoted = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"' || c == '\\') {
        quoted.append('\\');
      }
      quoted.append(c);
    }
    return quoted.append('"').toString();
  }

  @FunctionalInterface
  public interface Matcher {
    boolean matches(char c);

    default boolean allMatch(CharSequence value) {
      return value.chars().allMatch(c -> matches((char) c));
    }

    default Matcher or(Matcher other) {
      return c -> matches(c) || other.matches(c);
    }

    static Matcher alphaNumeric() {
      return c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    static Matcher anyOf(String chars) {
      return c -> chars.indexOf(c) >= 0;
    }

    static Matcher inRange(int from, int to) {
      requireArgument(from <= to, "illegal range [%d, %d]", from, to);
      return c -> c >= from && c <= to;
    }
  }
}
