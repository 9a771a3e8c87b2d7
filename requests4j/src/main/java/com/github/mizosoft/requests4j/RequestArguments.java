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

import java.net.http.HttpRequest.BodyPublisher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything that shapes one request: headers, query parameters, authentication, cookies, the body
 * sources and the execution settings. A fresh instance is created for each request and mutated by
 * the {@link RequestOption options} passed to it, in the order they're given.
 *
 * <p>The map and list accessors return live, mutable views. Options merge into them, so applying
 * two {@link RequestOptions#data(Map) data} options yields the union of both maps with the later
 * values winning. Scalar settings are replaced by later options.
 *
 * <p>At most one body source takes effect, in the order {@code body}, {@code json}, {@code files}
 * then {@code data}. When {@code files} wins, {@code data} entries become ordinary form fields of
 * the multipart body.
 */
public final class RequestArguments {
  private final RequestDefaults defaults;
  private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
  private final Map<String, String> params = new LinkedHashMap<>();
  private final Map<String, String> cookies = new LinkedHashMap<>();
  private final Map<String, String> data = new LinkedHashMap<>();
  private final List<FileField> files = new ArrayList<>();

  private Client client;
  private @Nullable CookieJar cookieJar;
  private @Nullable Object objectParam;
  private @Nullable BasicCredentials auth;
  private @Nullable BodyPublisher body;
  private @Nullable JsonPayload json;
  private int redirectLimit;
  private Duration timeout = Duration.ZERO;

  private RequestArguments(RequestDefaults defaults, Client client) {
    this.defaults = requireNonNull(defaults);
    this.client = requireNonNull(client);
    headers.putAll(defaults.headers());
    redirectLimit = defaults.redirectLimit();
  }

  /** Returns the defaults these arguments were seeded from. */
  public RequestDefaults defaults() {
    return defaults;
  }

  /** Returns the client executing the request. */
  public Client client() {
    return client;
  }

  public void client(Client client) {
    this.client = requireNonNull(client);
  }

  /** Returns the request headers, keyed case-insensitively. */
  public Map<String, String> headers() {
    return headers;
  }

  /** Returns the query parameters set on the request's URL. */
  public Map<String, String> params() {
    return params;
  }

  /** Returns the object whose fields are added to the URL's query if no {@code params} are set. */
  public @Nullable Object objectParam() {
    return objectParam;
  }

  public void objectParam(Object objectParam) {
    this.objectParam = requireNonNull(objectParam);
  }

  public @Nullable BasicCredentials auth() {
    return auth;
  }

  public void auth(BasicCredentials auth) {
    this.auth = requireNonNull(auth);
  }

  /** Returns the cookies added to the jar for the request's URL. Ignored if a jar is set. */
  public Map<String, String> cookies() {
    return cookies;
  }

  /** Returns the jar replacing the client's own for this request, if any. */
  public @Nullable CookieJar cookieJar() {
    return cookieJar;
  }

  public void cookieJar(CookieJar cookieJar) {
    this.cookieJar = requireNonNull(cookieJar);
  }

  /** Returns the raw body, sent verbatim. */
  public @Nullable BodyPublisher body() {
    return body;
  }

  public void body(BodyPublisher body) {
    this.body = requireNonNull(body);
  }

  public @Nullable JsonPayload json() {
    return json;
  }

  public void json(JsonPayload json) {
    this.json = requireNonNull(json);
  }

  /** Returns the files uploaded as a {@code multipart/form-data} body. */
  public List<FileField> files() {
    return files;
  }

  /** Returns the form fields, sent URL-encoded or as text parts of a multipart body. */
  public Map<String, String> data() {
    return data;
  }

  /** Returns the maximum number of redirects to follow. Non-positive values mean the default. */
  public int redirectLimit() {
    return redirectLimit;
  }

  public void redirectLimit(int redirectLimit) {
    this.redirectLimit = redirectLimit;
  }

  /** Returns the request's timeout, where {@link Duration#ZERO} means none is set. */
  public Duration timeout() {
    return timeout;
  }

  public void timeout(Duration timeout) {
    this.timeout = requireNonNull(timeout);
  }

  /** Returns the redirect limit to apply, falling back to the default for non-positive values. */
  public int effectiveRedirectLimit() {
    return redirectLimit > 0 ? redirectLimit : defaults.redirectLimit();
  }

  /** Returns new arguments seeded with the given defaults and executed by the given client. */
  public static RequestArguments create(RequestDefaults defaults, Client client) {
    return new RequestArguments(defaults, client);
  }
}
