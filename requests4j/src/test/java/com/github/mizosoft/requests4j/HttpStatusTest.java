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

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HttpStatusTest {
  @Test
  void classifiesStatusCodes() {
    assertThat(HttpStatus.isSuccessful(200)).isTrue();
    assertThat(HttpStatus.isSuccessful(299)).isTrue();
    assertThat(HttpStatus.isSuccessful(300)).isFalse();
    assertThat(HttpStatus.isRedirection(302)).isTrue();
    assertThat(HttpStatus.isClientError(404)).isTrue();
    assertThat(HttpStatus.isClientError(500)).isFalse();
    assertThat(HttpStatus.isServerError(503)).isTrue();
    assertThat(HttpStatus.isServerError(600)).isFalse();
  }

  @ParameterizedTest
  @ValueSource(ints = {301, 302, 303, 307, 308})
  void followableRedirects(int statusCode) {
    assertThat(HttpStatus.isFollowableRedirect(statusCode)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {200, 300, 304, 305, 306, 404})
  void unfollowableStatusCodes(int statusCode) {
    assertThat(HttpStatus.isFollowableRedirect(statusCode)).isFalse();
  }

  @Test
  void statusExceptionMessage() {
    var exception = new HttpStatusException(404, URI.create("http://example.com/"));
    assertThat(exception.statusCode()).isEqualTo(404);
    assertThat(exception.getMessage()).contains("404").contains("Client Error");
  }
}
