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

import static java.util.Objects.requireNonNullElse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mizosoft.requests4j.EncodingException;
import com.github.mizosoft.requests4j.QueryValues;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Merges query parameters into a URL's existing query string. The rewritten query is re-encoded as
 * a whole (keys in ascending order) and put back in place of the old one, leaving the scheme,
 * authority, path and fragment untouched.
 */
public final class UrlQueries {
  private UrlQueries() {}

  /**
   * Sets each of the given parameters in the URL's query, overwriting any values the query already
   * has for the same key.
   */
  public static String setParams(String url, Map<String, String> params)
      throws MalformedURLException {
    if (params.isEmpty()) {
      return url;
    }
    return rewriteQuery(url, query -> query.setAll(params));
  }

  /**
   * Adds the properties of the given object to the URL's query, keeping values the query already
   * has for the same keys.
   */
  public static String addObject(String url, Object object, ObjectMapper mapper)
      throws MalformedURLException, EncodingException {
    var objectValues = QueryObjects.toQueryValues(object, mapper);
    return rewriteQuery(url, query -> query.addAll(objectValues));
  }

  private static String rewriteQuery(String url, Consumer<QueryValues> rewriter)
      throws MalformedURLException {
    var uri = parse(url);
    var query = QueryValues.parse(requireNonNullElse(uri.getRawQuery(), ""));
    rewriter.accept(query);
    return withRawQuery(uri, query.encode());
  }

  private static URI parse(String url) throws MalformedURLException {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      var malformed = new MalformedURLException(e.getMessage());
      malformed.initCause(e);
      throw malformed;
    }
    if (uri.isOpaque()) {
      throw new MalformedURLException("URL has no hierarchical part: '" + url + "'");
    }
    return uri;
  }

  private static String withRawQuery(URI uri, String rawQuery) {
    var sb = new StringBuilder();
    if (uri.getScheme() != null) {
      sb.append(uri.getScheme()).append(':');
    }
    if (uri.getRawAuthority() != null) {
      sb.append("//").append(uri.getRawAuthority());
    }
    sb.append(requireNonNullElse(uri.getRawPath(), ""));
    if (!rawQuery.isEmpty()) {
      sb.append('?').append(rawQuery);
    }
    if (uri.getRawFragment() != null) {
      sb.append('#').append(uri.getRawFragment());
    }
    return sb.toString();
  }
}
