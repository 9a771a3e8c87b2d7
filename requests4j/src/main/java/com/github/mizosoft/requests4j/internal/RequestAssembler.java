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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.requests4j.Client;
import com.github.mizosoft.requests4j.RedirectPolicy;
import com.github.mizosoft.requests4j.RequestArguments;
import com.github.mizosoft.requests4j.RequestConstructionException;
import com.github.mizosoft.requests4j.RequestConstructionException.Stage;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.http.HttpRequest;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Turns a method, a URL and a request's {@link RequestArguments} into an {@code HttpRequest} and
 * the {@link Client} to execute it with. Assembly runs in this order: query merging, body encoding,
 * building the request, Basic authentication, headers then cookies. A header set through the
 * arguments therefore overrides the inferred {@code Content-Type} and the {@code Authorization}
 * header set by authentication.
 */
public final class RequestAssembler {
  private static final Logger logger = System.getLogger(RequestAssembler.class.getName());

  private RequestAssembler() {}

  /**
   * Assembles a request.
   *
   * @throws RequestConstructionException if any step fails, with the failed step as its stage and
   *     the underlying error as its cause
   */
  public static AssembledRequest assemble(String method, String url, RequestArguments arguments)
      throws RequestConstructionException {
    requireNonNull(method);
    requireNonNull(url);

    String resolvedUrl;
    try {
      resolvedUrl = resolveUrl(url, arguments);
    } catch (IOException e) {
      BodyEncoder.discard(arguments, e);
      throw new RequestConstructionException(Stage.URL, "couldn't merge query into " + url, e);
    }

    BodyEncoder.EncodedBody body;
    try {
      body = BodyEncoder.encode(arguments);
    } catch (IOException e) {
      throw new RequestConstructionException(Stage.BODY, "couldn't encode body", e);
    }

    HttpRequest.Builder builder;
    URI uri;
    try {
      uri = URI.create(resolvedUrl);
      var newBuilder = HttpRequest.newBuilder(uri).method(method, body.publisher());
      var timeout = arguments.timeout();
      if (!timeout.isZero()) {
        newBuilder.timeout(timeout);
      }
      body.mediaType()
          .ifPresent(mediaType -> newBuilder.setHeader("Content-Type", mediaType.toString()));
      builder = newBuilder;
    } catch (IllegalArgumentException e) {
      throw new RequestConstructionException(
          Stage.REQUEST, "invalid request: " + method + " " + resolvedUrl, e);
    }

    Client client;
    try {
      var auth = arguments.auth();
      if (auth != null) {
        builder.setHeader("Authorization", auth.toHeaderValue());
      }
      arguments.headers().forEach(builder::setHeader);
      client = CookieInjector.inject(arguments, uri);
      var cookies = cookieHeader(arguments, client, uri);
      if (cookies.isPresent()) {
        builder.setHeader("Cookie", cookies.get());
      }
    } catch (IllegalArgumentException e) {
      throw new RequestConstructionException(
          Stage.HEADERS, "couldn't set headers: " + e.getMessage(), e);
    }

    return new AssembledRequest(
        builder.build(),
        client.withRedirectPolicy(RedirectPolicy.limit(arguments.effectiveRedirectLimit())));
  }

  private static String resolveUrl(String url, RequestArguments arguments) throws IOException {
    var objectParam = arguments.objectParam();
    if (!arguments.params().isEmpty()) {
      if (objectParam != null) {
        logger.log(Level.DEBUG, () -> "ignoring objectParam as params are set for " + url);
      }
      return UrlQueries.setParams(url, arguments.params());
    } else if (objectParam != null) {
      return UrlQueries.addObject(url, objectParam, arguments.defaults().mapper());
    }
    return url;
  }

  /** Joins a {@code Cookie} header set through the arguments with the jar's cookies for the URI. */
  private static Optional<String> cookieHeader(
      RequestArguments arguments, Client client, URI uri) {
    var joiner = new StringJoiner("; ");
    joiner.setEmptyValue("");
    var explicit = arguments.headers().get("Cookie");
    if (explicit != null && !explicit.isEmpty()) {
      joiner.add(explicit);
    }
    for (var cookie : client.cookieJar().cookies(uri)) {
      joiner.add(cookie.getName() + "=" + cookie.getValue());
    }
    var value = joiner.toString();
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }

  /** An assembled request and the client to execute it with. */
  public static final class AssembledRequest {
    private final HttpRequest request;
    private final Client client;

    AssembledRequest(HttpRequest request, Client client) {
      this.request = request;
      this.client = client;
    }

    public HttpRequest request() {
      return request;
    }

    /**
     * Returns the client to execute the request with. Its cookie jar and redirect policy reflect
     * the request's arguments.
     */
    public Client client() {
      return client;
    }
  }
}
