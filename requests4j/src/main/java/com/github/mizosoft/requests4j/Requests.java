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

import com.github.mizosoft.requests4j.internal.RequestAssembler;
import com.github.mizosoft.requests4j.internal.RequestAssembler.AssembledRequest;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpRequest;

/**
 * Entry points for one-off requests. Each call starts from {@link RequestDefaults#standard()} and
 * a client with an empty cookie jar, so no state carries over between calls. Use a {@link Session}
 * to keep cookies across requests.
 *
 * <pre>{@code
 * var response = Requests.get(
 *     "https://example.com/search", param("q", "java"), header("Accept", "application/json"));
 * response.raiseForStatus();
 * var results = response.jsonTree();
 * }</pre>
 */
public final class Requests {
  private Requests() {}

  /**
   * Assembles a request without sending it.
   *
   * @throws RequestConstructionException if the request can't be assembled
   */
  public static HttpRequest newRequest(String method, String url, RequestOption... options)
      throws RequestConstructionException {
    return assemble(method, url, newArguments(), options).request();
  }

  /**
   * Assembles and sends a request, returning its response once the body is read.
   *
   * @throws RequestConstructionException if the request can't be assembled
   * @throws TooManyRedirectsException if more redirects are met than the request's limit
   * @throws IOException if sending the request or reading the response fails
   * @throws InterruptedException if interrupted while waiting for the response
   */
  public static Response request(String method, String url, RequestOption... options)
      throws IOException, InterruptedException {
    return execute(method, url, newArguments(), options);
  }

  /** Sends a {@code GET} request. */
  public static Response get(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("GET", url, options);
  }

  /** Sends a {@code POST} request. */
  public static Response post(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("POST", url, options);
  }

  /** Sends a {@code PUT} request. */
  public static Response put(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("PUT", url, options);
  }

  /** Sends a {@code PATCH} request. */
  public static Response patch(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("PATCH", url, options);
  }

  /** Sends a {@code DELETE} request. */
  public static Response delete(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("DELETE", url, options);
  }

  /** Sends a {@code HEAD} request. */
  public static Response head(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("HEAD", url, options);
  }

  /** Sends an {@code OPTIONS} request. */
  public static Response options(String url, RequestOption... options)
      throws IOException, InterruptedException {
    return request("OPTIONS", url, options);
  }

  static AssembledRequest assemble(
      String method, String url, RequestArguments arguments, RequestOption[] options)
      throws RequestConstructionException {
    requireNonNull(method);
    requireNonNull(url);
    for (var option : options) {
      option.apply(arguments);
    }
    return RequestAssembler.assemble(method, url, arguments);
  }

  static Response execute(
      String method, String url, RequestArguments arguments, RequestOption[] options)
      throws IOException, InterruptedException {
    var assembled = assemble(method, url, arguments, options);
    return new Response(
        assembled.client().send(assembled.request()), arguments.defaults().mapper());
  }

  private static RequestArguments newArguments() {
    return RequestArguments.create(
        RequestDefaults.standard(),
        Client.newBuilder().backend(SharedBackendHolder.BACKEND).build());
  }

  /** Holds the backend shared by one-off requests, created on first use. */
  private static final class SharedBackendHolder {
    static final HttpClient BACKEND =
        HttpClient.newBuilder().followRedirects(Redirect.NEVER).build();
  }
}
