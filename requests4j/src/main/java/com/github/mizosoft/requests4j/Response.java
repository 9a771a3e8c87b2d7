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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.HttpCookie;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * A response whose body has been read into memory. The body can be read any number of times as
 * bytes, text or JSON.
 */
public final class Response {
  private static final Logger logger = System.getLogger(Response.class.getName());

  private final HttpResponse<byte[]> response;
  private final ObjectMapper mapper;

  Response(HttpResponse<byte[]> response, ObjectMapper mapper) {
    this.response = requireNonNull(response);
    this.mapper = requireNonNull(mapper);
  }

  public int statusCode() {
    return response.statusCode();
  }

  /** Returns {@code true} if the status code is less than 400. */
  public boolean ok() {
    return response.statusCode() < 400;
  }

  /**
   * Throws if the status code denotes a client or server error.
   *
   * @throws HttpStatusException if the status code is 4xx or 5xx
   */
  @CanIgnoreReturnValue
  public Response raiseForStatus() throws HttpStatusException {
    int statusCode = response.statusCode();
    if (HttpStatus.isClientError(statusCode) || HttpStatus.isServerError(statusCode)) {
      throw new HttpStatusException(statusCode, response.uri());
    }
    return this;
  }

  public HttpHeaders headers() {
    return response.headers();
  }

  /** Returns the URI of the final request, which differs from the original one after redirects. */
  public URI uri() {
    return response.uri();
  }

  /** Returns the request that got this response. */
  public HttpRequest request() {
    return response.request();
  }

  /** Returns the underlying {@code HttpResponse}. */
  public HttpResponse<byte[]> raw() {
    return response;
  }

  /** Returns a copy of the body. */
  public byte[] content() {
    return response.body().clone();
  }

  /** Returns the body decoded with the {@code Content-Type}'s charset, or UTF-8 if there's none. */
  public String text() {
    return new String(response.body(), charset());
  }

  /**
   * Deserializes the body into an instance of the given type.
   *
   * @throws IOException if the body is not valid JSON or doesn't map to the type
   */
  public <T> T json(Class<T> type) throws IOException {
    return mapper.readValue(response.body(), type);
  }

  /**
   * Deserializes the body into an instance of the given generic type.
   *
   * @throws IOException if the body is not valid JSON or doesn't map to the type
   */
  public <T> T json(TypeReference<T> type) throws IOException {
    return mapper.readValue(response.body(), type);
  }

  /**
   * Parses the body into a JSON tree.
   *
   * @throws IOException if the body is not valid JSON
   */
  public JsonNode jsonTree() throws IOException {
    return mapper.readTree(response.body());
  }

  /** Returns the cookies set by this response. Malformed {@code Set-Cookie} headers are skipped. */
  public List<HttpCookie> cookies() {
    var cookies = new ArrayList<HttpCookie>();
    for (var value : response.headers().allValues("Set-Cookie")) {
      try {
        cookies.addAll(HttpCookie.parse(value));
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "skipping malformed Set-Cookie: " + value, e);
      }
    }
    return cookies;
  }

  private Charset charset() {
    var contentType = response.headers().firstValue("Content-Type");
    if (contentType.isEmpty()) {
      return UTF_8;
    }
    try {
      return MediaType.parse(contentType.get()).charset().orElse(UTF_8);
    } catch (IllegalArgumentException e) {
      logger.log(Level.DEBUG, () -> "malformed Content-Type: " + contentType.get());
      return UTF_8;
    }
  }

  @Override
  public String toString() {
    return "Response["
        + response.request().method()
        + " "
        + response.uri()
        + " -> "
        + statusCode()
        + "]";
  }
}
