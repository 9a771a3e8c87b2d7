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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mizosoft.requests4j.EncodingException;
import com.github.mizosoft.requests4j.QueryValues;

/**
 * Flattens an object into query parameters using Jackson's view of the object's properties. Scalar
 * properties become a single value, arrays and collections become a repeated key with one value per
 * element in declaration order, nested objects become {@code parent[child]} keys and {@code null}s
 * are skipped. Property names follow the mapper's naming, so {@code @JsonProperty} renames a key.
 */
public final class QueryObjects {
  private QueryObjects() {}

  public static QueryValues toQueryValues(Object object, ObjectMapper mapper)
      throws EncodingException {
    JsonNode tree;
    try {
      tree = mapper.valueToTree(object);
    } catch (IllegalArgumentException e) {
      throw new EncodingException("couldn't convert " + object.getClass() + " to a query", e);
    }
    if (tree == null || !tree.isObject()) {
      throw new EncodingException(
          "expected an object with properties, found: "
              + (tree != null ? tree.getNodeType() : "null"));
    }
    var values = QueryValues.create();
    tree.fields().forEachRemaining(field -> flatten(field.getKey(), field.getValue(), values));
    return values;
  }

  private static void flatten(String key, JsonNode node, QueryValues values) {
    if (node.isNull() || node.isMissingNode()) {
      return;
    }
    if (node.isArray()) {
      node.forEach(
          element -> {
            if (element.isContainerNode()) {
              flatten(key, element, values);
            } else if (!element.isNull()) {
              values.add(key, element.asText());
            }
          });
    } else if (node.isObject()) {
      node.fields()
          .forEachRemaining(
              field -> flatten(key + "[" + field.getKey() + "]", field.getValue(), values));
    } else {
      values.add(key, node.asText());
    }
  }
}
