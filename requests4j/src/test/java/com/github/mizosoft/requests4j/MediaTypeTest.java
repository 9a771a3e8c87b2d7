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

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.api.Test;

class MediaTypeTest {
  @Test
  void constants() {
    assertThat(MediaType.APPLICATION_JSON).hasToString("application/json");
    assertThat(MediaType.APPLICATION_FORM_URLENCODED)
        .hasToString("application/x-www-form-urlencoded");
    assertThat(MediaType.APPLICATION_OCTET_STREAM).hasToString("application/octet-stream");
    assertThat(MediaType.MULTIPART_FORM_DATA).hasToString("multipart/form-data");
    assertThat(MediaType.TEXT_PLAIN).hasToString("text/plain");
  }

  @Test
  void parseWithParameters() {
    var mediaType = MediaType.parse("Text/HTML; Charset=\"ISO-8859-1\"; q=1");
    assertThat(mediaType.type()).isEqualTo("text");
    assertThat(mediaType.subtype()).isEqualTo("html");
    assertThat(mediaType.parameters())
        .containsEntry("charset", "ISO-8859-1")
        .containsEntry("q", "1");
    assertThat(mediaType.charset()).hasValue(ISO_8859_1);
  }

  @Test
  void quotesParameterValuesIfNeeded() {
    assertThat(MediaType.of("multipart", "form-data").withParameter("boundary", "a b"))
        .hasToString("multipart/form-data; boundary=\"a b\"");
  }

  @Test
  void unknownCharset() {
    assertThat(MediaType.parse("text/plain; charset=not-a-charset").charset()).isEmpty();
  }

  @Test
  void equality() {
    assertThat(MediaType.parse("application/json")).isEqualTo(MediaType.APPLICATION_JSON);
  }

  @Test
  void malformed() {
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.parse("textplain"));
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.parse("text/plain; charset"));
    assertThatIllegalArgumentException().isThrownBy(() -> MediaType.of("te xt", "plain"));
  }
}
