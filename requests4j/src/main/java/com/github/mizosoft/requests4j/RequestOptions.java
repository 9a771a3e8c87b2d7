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

import static com.github.mizosoft.requests4j.internal.Validate.requireArgument;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static factories for the stock {@link RequestOption options}.
 *
 * <p>Options taking a map merge it into what earlier options of the same kind set, with the given
 * map's values winning on colliding keys. All other options replace what earlier options set. The
 * given maps are copied when the option is created.
 *
 * <pre>{@code
 * var response = Requests.post(
 *     "https://example.com/submit",
 *     params(Map.of("page", "1")),
 *     auth("user", "pass"),
 *     data(Map.of("name", "value")));
 * }</pre>
 */
public final class RequestOptions {
  private RequestOptions() {}

  /** Sets the given headers, replacing values of previously set headers with the same name. */
  public static RequestOption headers(Map<String, String> headers) {
    var copy = copyOf(headers);
    return arguments -> arguments.headers().putAll(copy);
  }

  /** Sets a single header. */
  public static RequestOption header(String name, String value) {
    return headers(Map.of(name, value));
  }

  /** Sets the given query parameters on the request's URL, replacing any existing values. */
  public static RequestOption params(Map<String, String> params) {
    var copy = copyOf(params);
    return arguments -> arguments.params().putAll(copy);
  }

  /** Sets a single query parameter. */
  public static RequestOption param(String key, String value) {
    return params(Map.of(key, value));
  }

  /**
   * Adds the fields of the given object to the request URL's query. The object is converted with
   * the {@link RequestDefaults#mapper() defaults' mapper}: collections become repeated keys and
   * nested objects become {@code parent[child]} keys. This option has no effect if {@link
   * #params(Map) params} are also set.
   */
  public static RequestOption objectParam(Object object) {
    requireNonNull(object);
    return arguments -> arguments.objectParam(object);
  }

  /** Authenticates the request with HTTP Basic authentication. */
  public static RequestOption auth(String username, String password) {
    return auth(BasicCredentials.of(username, password));
  }

  /** Authenticates the request with HTTP Basic authentication. */
  public static RequestOption auth(BasicCredentials credentials) {
    requireNonNull(credentials);
    return arguments -> arguments.auth(credentials);
  }

  /**
   * Adds the given cookies to the client's jar for the request's URL, so that they're sent along
   * with the jar's stored cookies. Has no effect if a {@link #cookieJar(CookieJar) cookie jar} is
   * set.
   */
  public static RequestOption cookies(Map<String, String> cookies) {
    var copy = copyOf(cookies);
    return arguments -> arguments.cookies().putAll(copy);
  }

  /** Adds a single cookie. */
  public static RequestOption cookie(String name, String value) {
    return cookies(Map.of(name, value));
  }

  /** Uses the given jar instead of the client's own for this request. */
  public static RequestOption cookieJar(CookieJar cookieJar) {
    requireNonNull(cookieJar);
    return arguments -> arguments.cookieJar(cookieJar);
  }

  /** Executes the request with the given client. */
  public static RequestOption client(Client client) {
    requireNonNull(client);
    return arguments -> arguments.client(client);
  }

  /** Sends the given publisher's content verbatim. No {@code Content-Type} is inferred. */
  public static RequestOption body(BodyPublisher body) {
    requireNonNull(body);
    return arguments -> arguments.body(body);
  }

  /** Sends the given string encoded in UTF-8. */
  public static RequestOption body(String body) {
    return body(BodyPublishers.ofString(body, UTF_8));
  }

  public static RequestOption body(byte[] body) {
    return body(BodyPublishers.ofByteArray(body.clone()));
  }

  /**
   * Sends the given stream's content, which can only be read once. A redirect that would send the
   * content again, like a 307 or 308, is therefore not followed.
   */
  public static RequestOption body(InputStream body) {
    requireNonNull(body);
    return body(BodyPublishers.ofInputStream(() -> body));
  }

  /**
   * Sends the given file's content verbatim.
   *
   * @throws FileNotFoundException if the file doesn't exist
   */
  public static RequestOption fileContent(Path file) throws FileNotFoundException {
    return body(BodyPublishers.ofFile(file));
  }

  /** Sends the given JSON text as an {@code application/json} body. */
  public static RequestOption json(String json) {
    return json(JsonPayload.ofText(json));
  }

  /** Sends the given JSON bytes as an {@code application/json} body. */
  public static RequestOption json(byte[] json) {
    return json(JsonPayload.ofBytes(json));
  }

  /**
   * Sends the given value serialized with the {@link RequestDefaults#mapper() defaults' mapper} as
   * an {@code application/json} body.
   */
  public static RequestOption json(Object value) {
    return json(JsonPayload.of(value));
  }

  public static RequestOption json(JsonPayload payload) {
    requireNonNull(payload);
    return arguments -> arguments.json(payload);
  }

  /** Uploads the given files as a {@code multipart/form-data} body. */
  public static RequestOption files(FileField... files) {
    var copy = List.of(files);
    return arguments -> arguments.files().addAll(copy);
  }

  /**
   * Uploads the given file as a {@code multipart/form-data} body.
   *
   * @throws IOException if the file can't be opened
   */
  public static RequestOption file(String fieldName, Path file) throws IOException {
    return files(FileField.of(fieldName, file));
  }

  /**
   * Sends the given form fields. They're sent URL-encoded unless files are also uploaded, in which
   * case they become text parts of the multipart body.
   */
  public static RequestOption data(Map<String, String> data) {
    var copy = copyOf(data);
    return arguments -> arguments.data().putAll(copy);
  }

  /** Sends a single form field. */
  public static RequestOption datum(String key, String value) {
    return data(Map.of(key, value));
  }

  /** Sets the request's timeout. {@link Duration#ZERO} means no timeout. */
  public static RequestOption timeout(Duration timeout) {
    requireArgument(!timeout.isNegative(), "negative timeout: %s", timeout);
    return arguments -> arguments.timeout(timeout);
  }

  /** Sets the maximum number of redirects to follow. Non-positive values mean the default. */
  public static RequestOption redirectLimit(int redirectLimit) {
    return arguments -> arguments.redirectLimit(redirectLimit);
  }

  /** Returns an option that applies the given options in order. */
  public static RequestOption all(RequestOption... options) {
    var copy = List.of(options);
    return arguments -> copy.forEach(option -> option.apply(arguments));
  }

  private static Map<String, String> copyOf(Map<String, String> map) {
    var copy = new LinkedHashMap<String, String>();
    map.forEach((key, value) -> copy.put(requireNonNull(key), requireNonNull(value)));
    return copy;
  }
}
