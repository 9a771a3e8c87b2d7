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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import com.github.mizosoft.requests4j.testing.BodyCollector;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MultipartBodyPublisherTest {
  @Test
  void textAndFileParts() throws IOException {
    var body =
        MultipartBodyPublisher.newBuilder()
            .boundary("my_boundary")
            .filePart(
                "file1", "upload.txt", new ByteArrayInputStream("file content".getBytes(UTF_8)))
            .textPart("field1", "value1")
            .build();
    var expected =
        "--my_boundary\r\n"
            + "Content-Disposition: form-data; name=\"file1\"; filename=\"upload.txt\"\r\n"
            + "Content-Type: application/octet-stream\r\n"
            + "\r\n"
            + "file content"
            + "\r\n--my_boundary\r\n"
            + "Content-Disposition: form-data; name=\"field1\"\r\n"
            + "\r\n"
            + "value1"
            + "\r\n--my_boundary--\r\n";
    assertThat(body.mediaType()).hasToString("multipart/form-data; boundary=my_boundary");
    assertThat(body.boundary()).isEqualTo("my_boundary");
    assertThat(body.parts()).hasSize(2);
    assertThat(BodyCollector.collectUtf8(body)).isEqualTo(expected);
    assertThat(body.contentLength()).isEqualTo(expected.getBytes(UTF_8).length);
  }

  @Test
  void contentLengthMatchesPublishedBytes() {
    var body =
        MultipartBodyPublisher.newBuilder()
            .textPart("greeting", "héllo wörld")
            .formPart(
                "data",
                "data.bin",
                new byte[] {0, 1, 2, (byte) 0xff},
                MediaType.APPLICATION_OCTET_STREAM)
            .build();
    assertThat(BodyCollector.collect(body)).hasSize((int) body.contentLength());

    // Can be published more than once.
    assertThat(BodyCollector.collect(body)).isEqualTo(BodyCollector.collect(body));
  }

  @Test
  void generatesBoundaryIfAbsent() {
    var body = MultipartBodyPublisher.newBuilder().textPart("a", "b").build();
    assertThat(body.boundary()).isNotEmpty();
    assertThat(body.mediaType().parameters()).containsEntry("boundary", body.boundary());
  }

  @Test
  void escapesQuotesInNames() {
    var body =
        MultipartBodyPublisher.newBuilder().boundary("b").textPart("a\"b\\c", "value").build();
    assertThat(body.parts().get(0).headers())
        .containsEntry("Content-Disposition", "form-data; name=\"a\\\"b\\\\c\"");
  }

  @Test
  void customPart() {
    var part = MultipartBodyPublisher.Part.create(Map.of("X-Custom", "yes"), new byte[] {1});
    var body = MultipartBodyPublisher.newBuilder().boundary("b").part(part).build();
    assertThat(BodyCollector.collectUtf8(body))
        .isEqualTo("--b\r\nX-Custom: yes\r\n\r\n\u0001\r\n--b--\r\n");
  }

  @Test
  void noParts() {
    assertThatIllegalStateException().isThrownBy(() -> MultipartBodyPublisher.newBuilder().build());
  }

  @Test
  void invalidBoundary() {
    var builder = MultipartBodyPublisher.newBuilder();
    assertThatIllegalArgumentException().isThrownBy(() -> builder.boundary(""));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.boundary("a".repeat(71)));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.boundary("ends with space "));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.boundary("no\"quotes"));
  }

  @Test
  void nonMultipartMediaType() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> MultipartBodyPublisher.newBuilder().mediaType(MediaType.TEXT_PLAIN));
  }

  @Test
  void invalidPartHeader() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> MultipartBodyPublisher.Part.create(Map.of("Bad Name", "v"), new byte[0]));
  }
}
