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

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.net.http.HttpRequest;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sends requests through one {@link Client}, so that cookies stored by a response are sent with
 * later requests. Each call starts from the session's {@link RequestDefaults} and client, then
 * applies the given options on top. A {@link RequestOptions#cookieJar(CookieJar) cookieJar} option
 * swaps the jar for one call without touching the session's.
 *
 * <p>A session can be used from multiple threads as long as its client's cookie jar is thread-safe,
 * which is the case for jars created by {@link CookieJar#create()}.
 *
 * <pre>{@code
 * var session = Session.create();
 * session.post("https://example.com/login", data(Map.of("user", "me", "password", "secret")));
 * var profile = session.get("https://example.com/profile"); // Sends the login cookie.
 * }</pre>
 */
public final class Session {
  private final Client client;
  private final RequestDefaults defaults;

  private Session(Client client, RequestDefaults defaults) {
    this.client = client;
    this.defaults = defaults;
  }

  /** Returns the client requests are sent through. */
  public Client client() {
    return client;
  }

  /** Returns the jar shared by this session's requests. */
  public CookieJar cookieJar() {
    return client.cookieJar();
  }

  public RequestDefaults defaults() {
    return defaults;
  }

  /**
   * Assembles a request without sending it. Cookies passed as options are still saved into the
   * session's jar.
   *
   * @throws RequestConstructionException if the request can't be assembled
   */
  public HttpRequest newRequest(String method, String url, RequestOption... options)
      throws RequestConstructionException {
    return Requests.assemble(method, url, newArguments(), options).request();
  }

  /**
   * Assembles and sends a request, returning its response once the body is read.
   *
   * @throws RequestConstructionException if the request can't be assembled
   * @throws TooManyRedirectsException if more redirects are met than the request's limit
   * @throws IOException if sending the request or reading the response fails
   * @throws InterruptedException if interrupted while waiting for the response
   */
  public Response request(String method, String url, RequestOption... options)
      throws IOException, InterruptedException {
    return Requests.execute(method, url, newArguments(), options);
  }

  public Response get(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("GET", url, options);
  }

  public Response post(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("POST", url, options);
  }

  public Response put(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("PUT", url, options);
  }

  public Response patch(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("PATCH", url, options);
  }

  public Response delete(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("DELETE", url, options);
  }

  public Response head(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("HEAD", url, options);
  }

  public Response options(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("OPTIONS", url, options);
  }

  private RequestArguments newArguments() {
    return RequestArguments.create(defaults, client);
  }

  /** Returns a session with a new client and standard defaults. */
  public static Session create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code Session} instances. */
  public static final class Builder {
    private @Nullable Client client;
    private @Nullable CookieJar cookieJar;
    private RequestDefaults defaults = RequestDefaults.standard();

    Builder() {}

    /** Sets the client requests are sent through. A new one is created by default. */
    @CanIgnoreReturnValue
    public Builder client(Client client) {
      this.client = requireNonNull(client);
      return this;
    }

    /** Sets the jar shared by the session's requests, replacing the client's own. */
    @CanIgnoreReturnValue
    public Builder cookieJar(CookieJar cookieJar) {
      this.cookieJar = requireNonNull(cookieJar);
      return this;
    }

    /** Sets the defaults each request starts from. */
    @CanIgnoreReturnValue
    public Builder defaults(RequestDefaults defaults) {
      this.defaults = requireNonNull(defaults);
      return this;
    }

    public Session build() {
      var sessionClient = client != null ? client : Client.create();
      if (cookieJar != null) {
        sessionClient = sessionClient.withCookieJar(cookieJar);
      }
      return new Session(sessionClient, defaults);
    }
  }
}
