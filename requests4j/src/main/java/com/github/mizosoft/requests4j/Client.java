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
import static com.github.mizosoft.requests4j.internal.Validate.requireNonNegative;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.HttpCookie;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpClient.Version;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.Executor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Executes requests over a backend {@code HttpClient}, managing cookies and redirects itself.
 *
 * <p>Every response's {@code Set-Cookie} headers are saved into the client's {@link CookieJar}, and
 * the jar's cookies are sent with each request that doesn't already carry a {@code Cookie} header.
 * Redirects (301, 302, 303, 307 & 308) are followed as long as the client's {@link RedirectPolicy}
 * allows, with 303 (and 301 & 302 for {@code POST}) switching to a body-less {@code GET}. The
 * {@code Authorization} header is dropped when a redirect leads to a different host. A redirect
 * that keeps a body of unknown length, which might not be readable twice, isn't followed and is
 * returned as the final response.
 *
 * <p>A {@code Client} is immutable. The {@code with*} methods return a client that shares this
 * one's backend but differs in one setting, which is cheap as no new backend is created.
 */
public final class Client {
  private static final Logger logger = System.getLogger(Client.class.getName());

  /** The number of redirects followed by default. */
  public static final int DEFAULT_REDIRECT_LIMIT = 10;

  private final HttpClient backend;
  private final CookieJar cookieJar;
  private final RedirectPolicy redirectPolicy;
  private final @Nullable Duration timeout;

  private Client(
      HttpClient backend,
      CookieJar cookieJar,
      RedirectPolicy redirectPolicy,
      @Nullable Duration timeout) {
    this.backend = backend;
    this.cookieJar = cookieJar;
    this.redirectPolicy = redirectPolicy;
    this.timeout = timeout;
  }

  /** Returns the {@code HttpClient} requests are sent with. */
  public HttpClient backend() {
    return backend;
  }

  /** Returns the jar cookies are saved into and read from. */
  public CookieJar cookieJar() {
    return cookieJar;
  }

  /** Returns the policy consulted before following each redirect. */
  public RedirectPolicy redirectPolicy() {
    return redirectPolicy;
  }

  /** Returns the timeout applied to requests that don't set their own. */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /** Returns a client that shares this client's backend but uses the given cookie jar. */
  public Client withCookieJar(CookieJar cookieJar) {
    return new Client(backend, requireNonNull(cookieJar), redirectPolicy, timeout);
  }

  /** Returns a client that shares this client's backend but uses the given redirect policy. */
  public Client withRedirectPolicy(RedirectPolicy redirectPolicy) {
    return new Client(backend, cookieJar, requireNonNull(redirectPolicy), timeout);
  }

  /**
   * Returns a client that shares this client's backend but applies the given timeout to requests
   * that don't set their own.
   */
  public Client withTimeout(Duration timeout) {
    return new Client(backend, cookieJar, redirectPolicy, requirePositive(timeout));
  }

  /**
   * Sends the given request, following redirects, and returns the final response with its body
   * read into memory.
   *
   * @throws TooManyRedirectsException if the redirect policy stops following redirects with it
   * @throws IOException if sending fails or the redirect policy throws
   * @throws InterruptedException if interrupted while waiting for the response
   */
  public HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException {
    var current = withDefaults(request);
    var via = new ArrayList<HttpRequest>();
    while (true) {
      via.add(current);
      var response = backend.send(current, BodyHandlers.ofByteArray());
      saveCookies(current.uri(), response.headers());

      var redirected = redirectedRequest(current, response);
      if (redirected == null) {
        return response;
      }
      redirectPolicy.checkRedirect(redirected, List.copyOf(via));
      logger.log(
          Level.DEBUG,
          () ->
              "following "
                  + response.statusCode()
                  + " redirect from "
                  + response.uri()
                  + " to "
                  + redirected.uri());
      current = redirected;
    }
  }

  private HttpRequest withDefaults(HttpRequest request) {
    boolean addTimeout = request.timeout().isEmpty() && timeout != null;
    boolean addCookies = request.headers().firstValue("Cookie").isEmpty();
    if (!addTimeout && !addCookies) {
      return request;
    }
    var builder = HttpRequest.newBuilder(request, (name, value) -> true);
    if (addTimeout) {
      builder.timeout(requireNonNull(timeout));
    }
    if (addCookies) {
      cookieHeader(cookieJar.cookies(request.uri()))
          .ifPresent(cookies -> builder.header("Cookie", cookies));
    }
    return builder.build();
  }

  private void saveCookies(URI uri, HttpHeaders headers) {
    var cookies = new ArrayList<HttpCookie>();
    for (var value : headers.allValues("Set-Cookie")) {
      try {
        cookies.addAll(HttpCookie.parse(value));
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "ignoring malformed Set-Cookie from " + uri + ": " + value, e);
      }
    }
    if (!cookies.isEmpty()) {
      cookieJar.setCookies(uri, cookies);
    }
  }

  private @Nullable HttpRequest redirectedRequest(
      HttpRequest request, HttpResponse<?> response) throws IOException {
    int statusCode = response.statusCode();
    if (!HttpStatus.isFollowableRedirect(statusCode)) {
      return null;
    }
    var location = response.headers().firstValue("Location").orElse(null);
    if (location == null) {
      return null; // Nowhere to go, so the redirect is the final response.
    }

    URI redirectedUri;
    try {
      redirectedUri = request.uri().resolve(location);
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid redirect location: " + location, e);
    }
    var scheme = redirectedUri.getScheme();
    if (scheme == null
        || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IOException("unsupported redirect location: " + redirectedUri);
    }

    var newMethod = redirectedMethod(request.method(), statusCode);
    boolean retainBody = statusCode != 303 && request.method().equals(newMethod);
    var body = request.bodyPublisher().orElseGet(BodyPublishers::noBody);
    if (retainBody && body.contentLength() < 0) {
      // A body of unknown length may be a one-shot stream that can't be sent again.
      logger.log(
          Level.DEBUG,
          () -> "not following " + statusCode + " redirect with a body that can't be replayed");
      return null;
    }
    boolean sameHost =
        request.uri().getHost() != null
            && request.uri().getHost().equalsIgnoreCase(redirectedUri.getHost());
    var builder =
        HttpRequest.newBuilder(
            request,
            (name, value) ->
                !name.equalsIgnoreCase("Cookie")
                    && (retainBody || !name.equalsIgnoreCase("Content-Type"))
                    && (sameHost || !name.equalsIgnoreCase("Authorization")));
    builder
        .uri(redirectedUri)
        .method(
            newMethod,
            retainBody ? body : BodyPublishers.noBody());
    cookieHeader(cookieJar.cookies(redirectedUri))
        .ifPresent(cookies -> builder.header("Cookie", cookies));
    return builder.build();
  }

  private static String redirectedMethod(String originalMethod, int statusCode) {
    switch (statusCode) {
      case 301:
      case 302:
        return originalMethod.equals("POST") ? "GET" : originalMethod;
      case 303:
        return originalMethod.equals("HEAD") ? "HEAD" : "GET";
      default:
        return originalMethod;
    }
  }

  /** Returns the value of a {@code Cookie} header carrying the given cookies, if any. */
  static Optional<String> cookieHeader(List<HttpCookie> cookies) {
    if (cookies.isEmpty()) {
      return Optional.empty();
    }
    var joiner = new StringJoiner("; ");
    cookies.forEach(cookie -> joiner.add(cookie.getName() + "=" + cookie.getValue()));
    return Optional.of(joiner.toString());
  }

  private static Duration requirePositive(Duration duration) {
    requireArgument(
        !(duration.isNegative() || duration.isZero()), "non-positive duration: %s", duration);
    return duration;
  }

  /** Returns a {@code Client} with a new backend and an empty in-memory cookie jar. */
  public static Client create() {
    return newBuilder().build();
  }

  /** Returns a new {@code Client.Builder}. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code Client} instances. */
  public static final class Builder {
    private @Nullable HttpClient backend;
    private @Nullable CookieJar cookieJar;
    private RedirectPolicy redirectPolicy = RedirectPolicy.limit(DEFAULT_REDIRECT_LIMIT);
    private @Nullable Duration timeout;
    private @Nullable Duration connectTimeout;
    private @Nullable Executor executor;
    private @Nullable Version version;

    Builder() {}

    /**
     * Sets a prebuilt {@code HttpClient} to send requests with. The backend must not follow
     * redirects nor have a cookie handler, as both are handled by the {@code Client}. Settings that
     * configure a new backend are ignored when a prebuilt one is set.
     *
     * @throws IllegalArgumentException if the backend follows redirects or has a cookie handler
     */
    @CanIgnoreReturnValue
    public Builder backend(HttpClient backend) {
      requireArgument(
          backend.followRedirects() == Redirect.NEVER, "backend must not follow redirects");
      requireArgument(backend.cookieHandler().isEmpty(), "backend must not handle cookies");
      this.backend = backend;
      return this;
    }

    /** Sets the cookie jar. A new in-memory jar is used by default. */
    @CanIgnoreReturnValue
    public Builder cookieJar(CookieJar cookieJar) {
      this.cookieJar = requireNonNull(cookieJar);
      return this;
    }

    /**
     * Sets the redirect policy. By default, up to {@value Client#DEFAULT_REDIRECT_LIMIT} redirects
     * are followed.
     */
    @CanIgnoreReturnValue
    public Builder redirectPolicy(RedirectPolicy redirectPolicy) {
      this.redirectPolicy = requireNonNull(redirectPolicy);
      return this;
    }

    /** Sets the maximum number of redirects to follow. */
    @CanIgnoreReturnValue
    public Builder redirectLimit(int redirectLimit) {
      requireNonNegative(redirectLimit, "redirectLimit");
      return redirectPolicy(RedirectPolicy.limit(redirectLimit));
    }

    /** Sets the timeout applied to requests that don't set their own. */
    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositive(timeout);
      return this;
    }

    /** Sets the connect timeout of a newly created backend. */
    @CanIgnoreReturnValue
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = requirePositive(connectTimeout);
      return this;
    }

    /** Sets the executor of a newly created backend. */
    @CanIgnoreReturnValue
    public Builder executor(Executor executor) {
      this.executor = requireNonNull(executor);
      return this;
    }

    /** Sets the preferred HTTP version of a newly created backend. */
    @CanIgnoreReturnValue
    public Builder version(Version version) {
      this.version = requireNonNull(version);
      return this;
    }

    /** Returns a new {@code Client}. */
    public Client build() {
      return new Client(
          backend != null ? backend : buildBackend(),
          cookieJar != null ? cookieJar : CookieJar.create(),
          redirectPolicy,
          timeout);
    }

    private HttpClient buildBackend() {
      var builder = HttpClient.newBuilder().followRedirects(Redirect.NEVER);
      if (connectTimeout != null) {
        builder.connectTimeout(connectTimeout);
      }
      if (executor != null) {
        builder.executor(executor);
      }
      if (version != null) {
        builder.version(version);
      }
      return builder.build();
    }
  }
}
