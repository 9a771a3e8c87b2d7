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

import static com.github.mizosoft.requests4j.RequestOptions.body;
import static com.github.mizosoft.requests4j.RequestOptions.json;
import static com.github.mizosoft.requests4j.RequestOptions.param;
import static com.github.mizosoft.requests4j.RequestOptions.redirectLimit;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIOException;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.mizosoft.requests4j.testing.MockWebServerExtension;
import java.io.ByteArrayInputStream;
import java.net.HttpCookie;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(MockWebServerExtension.class)
class ResponseTest {
  private MockWebServer server;

  @BeforeEach
  void setUp(MockWebServer server) {
    this.server = server;
  }

  @Test
  void successfulResponse() throws Exception {
    server.enqueue(new MockResponse().setBody("hello"));

    var response = Requests.get(url("/search"), param("q", "java"));
    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.ok()).isTrue();
    assertThat(response.raiseForStatus()).isSameAs(response);
    assertThat(response.text()).isEqualTo("hello");
    assertThat(response.content()).isEqualTo("hello".getBytes(UTF_8));
    assertThat(response.request().method()).isEqualTo("GET");
    assertThat(server.takeRequest().getPath()).isEqualTo("/search?q=java");
  }

  @Test
  void errorStatus() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(404));

    var response = Requests.get(url("/missing"));
    assertThat(response.ok()).isFalse();
    assertThatExceptionOfType(HttpStatusException.class)
        .isThrownBy(response::raiseForStatus)
        .satisfies(e -> assertThat(e.statusCode()).isEqualTo(404))
        .satisfies(e -> assertThat(e.uri()).isEqualTo(server.url("/missing").uri()));
  }

  @Test
  void textUsesContentTypeCharset() throws Exception {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "text/plain; charset=ISO-8859-1")
            .setBody(new Buffer().write("café".getBytes(ISO_8859_1))));

    assertThat(Requests.get(url("/")).text()).isEqualTo("café");
  }

  @Test
  void textDefaultsToUtf8() throws Exception {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "text/plain")
            .setBody(new Buffer().write("café".getBytes(UTF_8))));

    assertThat(Requests.get(url("/")).text()).isEqualTo("café");
  }

  @Test
  void jsonResponse() throws Exception {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"x\":1,\"y\":2}"));
    server.enqueue(new MockResponse().setBody("[1,2,3]"));
    server.enqueue(new MockResponse().setBody("{\"name\":\"requests4j\"}"));

    var point = Requests.get(url("/")).json(Point.class);
    assertThat(point.x).isEqualTo(1);
    assertThat(point.y).isEqualTo(2);
    assertThat(Requests.get(url("/")).json(new TypeReference<List<Integer>>() {}))
        .containsExactly(1, 2, 3);
    assertThat(Requests.get(url("/")).jsonTree().get("name").asText()).isEqualTo("requests4j");
  }

  @Test
  void invalidJson() throws Exception {
    server.enqueue(new MockResponse().setBody("not json"));
    var response = Requests.get(url("/"));
    assertThatIOException().isThrownBy(response::jsonTree);
  }

  @Test
  void cookies() throws Exception {
    server.enqueue(
        new MockResponse()
            .addHeader("Set-Cookie", "a=1; Path=/")
            .addHeader("Set-Cookie", "malformed")
            .addHeader("Set-Cookie", "b=2"));

    assertThat(Requests.get(url("/")).cookies())
        .extracting(HttpCookie::getName, HttpCookie::getValue)
        .containsExactly(tuple("a", "1"), tuple("b", "2"));
  }

  @Test
  void jsonRequestBody() throws Exception {
    server.enqueue(new MockResponse());

    Requests.post(url("/"), json(Map.of("k", "v")));
    var request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getHeader("Content-Type")).startsWith("application/json");
    assertThat(request.getBody().readUtf8()).isEqualTo("{\"k\":\"v\"}");
  }

  @Test
  void redirectLimitOption() {
    server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/b"));
    server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/c"));

    assertThatExceptionOfType(TooManyRedirectsException.class)
        .isThrownBy(() -> Requests.get(url("/a"), redirectLimit(1)));
  }

  @Test
  void streamedBodyIsNotResentOnRedirect() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(308).setHeader("Location", "/next"));
    server.enqueue(new MockResponse());

    var response =
        Requests.post(url("/"), body(new ByteArrayInputStream("payload".getBytes(UTF_8))));
    assertThat(response.statusCode()).isEqualTo(308);
    assertThat(response.ok()).isTrue();
    assertThat(server.takeRequest().getBody().readUtf8()).isEqualTo("payload");
    assertThat(server.getRequestCount()).isOne();
  }

  @Test
  void oneOffRequestsDoNotShareCookies() throws Exception {
    server.enqueue(new MockResponse().addHeader("Set-Cookie", "a=1"));
    server.enqueue(new MockResponse());

    Requests.get(url("/"));
    Requests.get(url("/"));
    server.takeRequest();
    assertThat(server.takeRequest().getHeader("Cookie")).isNull();
  }

  @Test
  void toStringShowsExchange() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(201));
    assertThat(Requests.put(url("/r")).toString())
        .isEqualTo("Response[PUT " + server.url("/r").uri() + " -> 201]");
  }

  private String url(String path) {
    return server.url(path).toString();
  }

  static final class Point {
    public int x;
    public int y;
  }
}
