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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIOException;

import com.github.mizosoft.requests4j.Client;
import com.github.mizosoft.requests4j.EncodingException;
import com.github.mizosoft.requests4j.FileField;
import com.github.mizosoft.requests4j.JsonPayload;
import com.github.mizosoft.requests4j.MediaType;
import com.github.mizosoft.requests4j.RequestArguments;
import com.github.mizosoft.requests4j.RequestDefaults;
import com.github.mizosoft.requests4j.testing.BodyCollector;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest.BodyPublishers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BodyEncoderTest {
  private static final Client CLIENT = Client.create();

  private RequestArguments arguments;

  @BeforeEach
  void setUp() {
    arguments = RequestArguments.create(RequestDefaults.standard(), CLIENT);
  }

  @Test
  void noSource() throws IOException {
    var body = BodyEncoder.encode(arguments);
    assertThat(body.isEmpty()).isTrue();
    assertThat(body.mediaType()).isEmpty();
    assertThat(body.publisher().contentLength()).isZero();
  }

  @Test
  void rawBodyHasNoMediaType() throws IOException {
    arguments.body(BodyPublishers.ofString("raw"));
    arguments.json(JsonPayload.ofText("{}"));
    arguments.data().put("a", "b");
    var body = BodyEncoder.encode(arguments);
    assertThat(body.mediaType()).isEmpty();
    assertThat(BodyCollector.collectUtf8(body.publisher())).isEqualTo("raw");
  }

  @Test
  void jsonWinsOverFormAndFiles() throws IOException {
    var file = new TrackingInputStream("content");
    arguments.files().add(FileField.of("f", "f.txt", file));
    arguments.data().put("a", "b");
    arguments.json(JsonPayload.of(new int[] {1, 2}));
    var body = BodyEncoder.encode(arguments);
    assertThat(body.mediaType()).hasValue(MediaType.APPLICATION_JSON);
    assertThat(BodyCollector.collectUtf8(body.publisher())).isEqualTo("[1,2]");
    assertThat(file.closeCount).isOne();
  }

  @Test
  void filesWinOverForm() throws IOException {
    arguments.files().add(FileField.of("f", "f.txt", new TrackingInputStream("content")));
    arguments.data().put("a", "b");
    var body = BodyEncoder.encode(arguments);
    assertThat(body.mediaType())
        .hasValueSatisfying(mediaType -> assertThat(mediaType.subtype()).isEqualTo("form-data"));
    assertThat(BodyCollector.collectUtf8(body.publisher()))
        .contains("content")
        .contains("name=\"a\"\r\n\r\nb");
  }

  @Test
  void form() throws IOException {
    arguments.data().put("b", "2");
    arguments.data().put("a", "1");
    var body = BodyEncoder.encode(arguments);
    assertThat(body.mediaType()).hasValue(MediaType.APPLICATION_FORM_URLENCODED);
    assertThat(BodyCollector.collectUtf8(body.publisher())).isEqualTo("a=1&b=2");
  }

  @Test
  void jsonTextAndBytesAreSentAsIs() throws IOException {
    arguments.json(JsonPayload.ofText("{\"a\": 1}"));
    assertThat(BodyCollector.collectUtf8(BodyEncoder.encode(arguments).publisher()))
        .isEqualTo("{\"a\": 1}");

    arguments.json(JsonPayload.ofBytes("[true]".getBytes(UTF_8)));
    var body = BodyEncoder.encode(arguments);
    assertThat(body.mediaType()).hasValue(MediaType.APPLICATION_JSON);
    assertThat(BodyCollector.collectUtf8(body.publisher())).isEqualTo("[true]");
  }

  @Test
  void unserializableJson() {
    arguments.json(JsonPayload.of(new Object()));
    assertThatExceptionOfType(EncodingException.class)
        .isThrownBy(() -> BodyEncoder.encode(arguments));
  }

  @Test
  void fileStreamsAreClosedExactlyOnce() throws IOException {
    var first = new TrackingInputStream("first");
    var second = new TrackingInputStream("second");
    arguments.files().add(FileField.of("a", "a.txt", first));
    arguments.files().add(FileField.of("b", "b.txt", second));
    BodyEncoder.encode(arguments);
    assertThat(first.closeCount).isOne();
    assertThat(second.closeCount).isOne();
  }

  @Test
  void fileStreamsAreClosedOnReadFailure() {
    var failing = new TrackingInputStream("").failOnRead();
    var other = new TrackingInputStream("other");
    arguments.files().add(FileField.of("a", "a.txt", failing));
    arguments.files().add(FileField.of("b", "b.txt", other));
    assertThatIOException()
        .isThrownBy(() -> BodyEncoder.encode(arguments))
        .withMessage("read failure");
    assertThat(failing.closeCount).isOne();
    assertThat(other.closeCount).isOne();
  }

  @Test
  void fileStreamsAreClosedOnJsonFailure() {
    var file = new TrackingInputStream("content");
    arguments.files().add(FileField.of("a", "a.txt", file));
    arguments.json(JsonPayload.of(new Object()));
    assertThatExceptionOfType(EncodingException.class)
        .isThrownBy(() -> BodyEncoder.encode(arguments));
    assertThat(file.closeCount).isOne();
  }

  @Test
  void closeFailuresAreReported() {
    var failing = new TrackingInputStream("a").failOnClose();
    var other = new TrackingInputStream("b");
    arguments.files().add(FileField.of("a", "a.txt", failing));
    arguments.files().add(FileField.of("b", "b.txt", other));
    assertThatIOException()
        .isThrownBy(() -> BodyEncoder.encode(arguments))
        .withMessage("close failure");
    assertThat(other.closeCount).isOne();
  }

  @Test
  void closeFailuresAreSuppressedByEncodingFailure() {
    var file = new TrackingInputStream("a").failOnClose();
    arguments.files().add(FileField.of("a", "a.txt", file));
    arguments.json(JsonPayload.of(new Object()));
    assertThatExceptionOfType(EncodingException.class)
        .isThrownBy(() -> BodyEncoder.encode(arguments))
        .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
  }

  @Test
  void discardClosesFiles() {
    var file = new TrackingInputStream("a");
    arguments.files().add(FileField.of("a", "a.txt", file));
    BodyEncoder.discard(arguments, new IOException("failed elsewhere"));
    assertThat(file.closeCount).isOne();
  }

  static final class TrackingInputStream extends InputStream {
    private final InputStream delegate;
    private boolean failOnRead;
    private boolean failOnClose;
    int closeCount;

    TrackingInputStream(String content) {
      delegate = new ByteArrayInputStream(content.getBytes(UTF_8));
    }

    TrackingInputStream failOnRead() {
      failOnRead = true;
      return this;
    }

    TrackingInputStream failOnClose() {
      failOnClose = true;
      return this;
    }

    @Override
    public int read() throws IOException {
      if (failOnRead) {
        throw new IOException("read failure");
      }
      return delegate.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      if (failOnRead) {
        throw new IOException("read failure");
      }
      return delegate.read(b, off, len);
    }

    @Override
    public void close() throws IOException {
      closeCount++;
      if (failOnClose) {
        throw new IOException("close failure");
      }
    }
  }
}
