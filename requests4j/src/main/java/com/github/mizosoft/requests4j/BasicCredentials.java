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

import java.util.Base64;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A username and password pair for HTTP Basic authentication (RFC 7617). The pair is encoded as
 * the Base64 of {@code username:password} in UTF-8. Either part may contain a colon and is encoded
 * as-is, but {@link #parse(String)} splits the decoded pair on its first colon, so a username with
 * a colon doesn't parse back into the same pair.
 */
public final class BasicCredentials {
  private static final String SCHEME = "Basic";

  private final String username;
  private final String password;

  private BasicCredentials(String username, String password) {
    this.username = username;
    this.password = password;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  /** Returns the value of an {@code Authorization} header carrying these credentials. */
  public String toHeaderValue() {
    return SCHEME
        + " "
        + Base64.getEncoder().encodeToString((username + ":" + password).getBytes(UTF_8));
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof BasicCredentials)) {
      return false;
    }
    var other = (BasicCredentials) obj;
    return username.equals(other.username) && password.equals(other.password);
  }

  @Override
  public int hashCode() {
    return 31 * username.hashCode() + password.hashCode();
  }

  @Override
  public String toString() {
    return "BasicCredentials[username=" + username + ", password=****]";
  }

  /** Returns credentials with the given username and password. */
  public static BasicCredentials of(String username, String password) {
    return new BasicCredentials(requireNonNull(username), requireNonNull(password));
  }

  /**
   * Parses the value of an {@code Authorization} header, returning an empty optional if it doesn't
   * carry well-formed Basic credentials.
   */
  public static Optional<BasicCredentials> parse(String headerValue) {
    var value = headerValue.trim();
    if (value.length() <= SCHEME.length()
        || !value.regionMatches(true, 0, SCHEME, 0, SCHEME.length())
        || value.charAt(SCHEME.length()) != ' ') {
      return Optional.empty();
    }

    String decoded;
    try {
      var encoded = value.substring(SCHEME.length() + 1).trim();
      decoded = new String(Base64.getDecoder().decode(encoded), UTF_8);
    } catch (IllegalArgumentException notBase64) {
      return Optional.empty();
    }
    int colon = decoded.indexOf(':');
    if (colon < 0) {
      return Optional.empty();
    }
    return Optional.of(
        new BasicCredentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
  }
}
