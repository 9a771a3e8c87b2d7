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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.mizosoft.requests4j.EncodingException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryObjectsTest {
  private final JsonMapper mapper = new JsonMapper();

  @Test
  void flattensScalarsArraysAndNestedObjects() throws EncodingException {
    var values = QueryObjects.toQueryValues(new Query(), mapper);
    assertThat(values.all("name")).containsExactly("x");
    assertThat(values.all("page")).containsExactly("2");
    assertThat(values.all("ids")).containsExactly("3", "1", "2");
    assertThat(values.all("range[from]")).containsExactly("1");
    assertThat(values.all("range[to]")).containsExactly("9");
    assertThat(values.keys()).doesNotContain("missing");
  }

  @Test
  void renamedProperty() throws EncodingException {
    assertThat(QueryObjects.toQueryValues(new Renamed(), mapper).encode()).isEqualTo("user_id=7");
  }

  @Test
  void mapsAreObjects() throws EncodingException {
    assertThat(QueryObjects.toQueryValues(Map.of("k", List.of("a", "b")), mapper).encode())
        .isEqualTo("k=a&k=b");
  }

  @Test
  void nonObjectRoot() {
    assertThatExceptionOfType(EncodingException.class)
        .isThrownBy(() -> QueryObjects.toQueryValues("text", mapper));
    assertThatExceptionOfType(EncodingException.class)
        .isThrownBy(() -> QueryObjects.toQueryValues(List.of(1, 2), mapper));
  }

  @Test
  void unserializableObject() {
    assertThatExceptionOfType(EncodingException.class)
        .isThrownBy(() -> QueryObjects.toQueryValues(new Object(), mapper));
  }

  public static final class Query {
    public String name = "x";
    public int page = 2;
    public List<Integer> ids = List.of(3, 1, 2);
    public Range range = new Range();
    public String missing = null;
  }

  public static final class Range {
    public int from = 1;
    public int to = 9;
  }

  public static final class Renamed {
    @JsonProperty("user_id")
    public long userId = 7;
  }
}
