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

import static com.github.mizosoft.requests4j.internal.HttpChars.BOUNDARY;
import static com.github.mizosoft.requests4j.internal.HttpChars.requireHeaderName;
import static com.github.mizosoft.requests4j.internal.HttpChars.requireHeaderValue;
import static com.github.mizosoft.requests4j.internal.Validate.requireArgument;
import static com.github.mizosoft.requests4j.internal.Validate.requireState;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Flow.Subscriber;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code BodyPublisher} for <a href="https://tools.ietf.org/html/rfc7578">multipart/form-data</a>
 * bodies. The body is rendered in memory when the publisher is built, so its content length is
 * always known and it can be published any number of times.
 */
public final class MultipartBodyPublisher implements MimeBodyPublisher {
  private static final String BOUNDARY_ATTRIBUTE = "boundary";

  private final List<Part> parts;
  private final MediaType mediaType;
  private final String boundary;
  private final byte[] content;

  private MultipartBodyPublisher(List<Part> parts, MediaType mediaType) {
    this.parts = parts;
    this.mediaType = mediaType;

    var boundary = mediaType.parameters().get(BOUNDARY_ATTRIBUTE);
    requireArgument(boundary != null, "missing boundary");
    this.boundary = boundary;
    this.content = render(boundary, parts);
  }

  /** Returns the boundary of this multipart body. */
  public String boundary() {
    return boundary;
  }

  /** Returns an immutable list containing this body's parts. */
  public List<Part> parts() {
    return parts;
  }

  @Override
  public MediaType mediaType() {
    return mediaType;
  }

  @Override
  public long contentLength() {
    return content.length;
  }

  @Override
  public void subscribe(Subscriber<? super ByteBuffer> subscriber) {
    requireNonNull(subscriber);
    BodyPublishers.ofByteArray(content).subscribe(subscriber);
  }

  private static byte[] render(String boundary, List<Part> parts) {
    var out = new ByteArrayOutputStream();
    for (int i = 0; i < parts.size(); i++) {
      var part = parts.get(i);
      var metadata = new StringBuilder();
      BoundaryAppender.get(i).append(metadata, boundary);
      part.headers.forEach(
          (name, value) -> metadata.append(name).append(": ").append(value).append("\r\n"));
      metadata.append("\r\n");
      out.writeBytes(metadata.toString().getBytes(UTF_8));
      out.writeBytes(part.content);
    }
    var closing = new StringBuilder();
    BoundaryAppender.LAST.append(closing, boundary);
    out.writeBytes(closing.toString().getBytes(UTF_8));
    return out.toByteArray();
  }

  /** Returns a new {@code MultipartBodyPublisher.Builder}. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** A part in a multipart request body. */
  public static final class Part {
    private final Map<String, String> headers;
    private final byte[] content;

    private Part(Map<String, String> headers, byte[] content) {
      this.headers = headers;
      this.content = content;
    }

    /** Returns this part's headers in the order they're written. */
    public Map<String, String> headers() {
      return headers;
    }

    /** Returns a copy of this part's content. */
    public byte[] content() {
      return content.clone();
    }

    /**
     * Returns a new {@code Part} with the given headers and content.
     *
     * @throws IllegalArgumentException if any of the given headers is invalid
     */
    public static Part create(Map<String, String> headers, byte[] content) {
      var headersCopy = new LinkedHashMap<String, String>();
      headers.forEach(
          (name, value) -> headersCopy.put(requireHeaderName(name), requireHeaderValue(value)));
      return new Part(Collections.unmodifiableMap(headersCopy), content.clone());
    }
  }

  /**
   * A builder of {@code MultipartBodyPublisher} instances. The default multipart subtype used by
   * the builder is {@code form-data}.
   */
  public static final class Builder {
    private static final int MAX_BOUNDARY_LENGTH = 70;

    private final List<Part> parts = new ArrayList<>();
    private MediaType mediaType = MediaType.MULTIPART_FORM_DATA;

    Builder() {}

    /**
     * Sets the boundary of the multipart body.
     *
     * @throws IllegalArgumentException if the boundary is invalid
     */
    @CanIgnoreReturnValue
    public Builder boundary(String boundary) {
      mediaType = mediaType.withParameter(BOUNDARY_ATTRIBUTE, requireValidBoundary(boundary));
      return this;
    }

    /**
     * Sets the media type of the multipart body. If the given media type has a boundary parameter,
     * it will be used as the body's boundary.
     *
     * @throws IllegalArgumentException if the given media type is not a multipart type or if it has
     *     an invalid boundary parameter
     */
    @CanIgnoreReturnValue
    public Builder mediaType(MediaType mediaType) {
      requireArgument(
          mediaType.type().equals("multipart"), "not a multipart type: %s", mediaType.type());
      var boundary = mediaType.parameters().get(BOUNDARY_ATTRIBUTE);
      if (boundary != null) {
        requireValidBoundary(boundary);
      }
      this.mediaType = mediaType;
      return this;
    }

    /** Adds the given part. */
    @CanIgnoreReturnValue
    public Builder part(Part part) {
      parts.add(requireNonNull(part));
      return this;
    }

    /** Adds a form field with the given name and value, encoded as UTF-8. */
    @CanIgnoreReturnValue
    public Builder textPart(String name, String value) {
      return part(new Part(formHeaders(name, null, null), value.getBytes(UTF_8)));
    }

    /** Adds a file form field with the given name, filename, content and media type. */
    @CanIgnoreReturnValue
    public Builder formPart(String name, String filename, byte[] content, MediaType mediaType) {
      return part(new Part(formHeaders(name, filename, mediaType), content.clone()));
    }

    /**
     * Adds an {@code application/octet-stream} file form field with the given name and filename,
     * reading its content from the given stream till its end. The stream is not closed.
     *
     * @throws IOException if reading the stream fails
     */
    @CanIgnoreReturnValue
    public Builder filePart(String name, String filename, InputStream content)
        throws IOException {
      var bytes = content.readAllBytes();
      return part(new Part(formHeaders(name, filename, MediaType.APPLICATION_OCTET_STREAM), bytes));
    }

    /**
     * Returns a new {@code MultipartBodyPublisher}. If no boundary has been set, a randomly
     * generated one is used.
     *
     * @throws IllegalStateException if no part was added
     */
    public MultipartBodyPublisher build() {
      var partsCopy = List.copyOf(parts);
      requireState(!partsCopy.isEmpty(), "at least one part must be added");
      var localMediaType = mediaType;
      if (!localMediaType.parameters().containsKey(BOUNDARY_ATTRIBUTE)) {
        localMediaType =
            localMediaType.withParameter(BOUNDARY_ATTRIBUTE, UUID.randomUUID().toString());
      }
      return new MultipartBodyPublisher(partsCopy, localMediaType);
    }

    @CanIgnoreReturnValue
    private static String requireValidBoundary(String boundary) {
      requireArgument(
          boundary.length() <= MAX_BOUNDARY_LENGTH && !boundary.isEmpty(),
          "illegal boundary length: %s",
          boundary.length());
      requireArgument(
          BOUNDARY.allMatch(boundary) && !boundary.endsWith(" "),
          "illegal boundary: '%s'",
          boundary);
      return boundary;
    }

    private static Map<String, String> formHeaders(
        String name, @Nullable String filename, @Nullable MediaType mediaType) {
      var contentDisposition = new StringBuilder();
      appendEscaped(contentDisposition.append("form-data; name="), name);
      if (filename != null) {
        appendEscaped(contentDisposition.append("; filename="), filename);
      }
      var headers = new LinkedHashMap<String, String>();
      headers.put("Content-Disposition", contentDisposition.toString());
      if (mediaType != null) {
        headers.put("Content-Type", mediaType.toString());
      }
      return Collections.unmodifiableMap(headers);
    }

    private static void appendEscaped(StringBuilder target, String field) {
      target.append('"');
      for (int i = 0; i < field.length(); i++) {
        char c = field.charAt(i);
        if (c == '\\' || c == '"') {
          target.append('\\');
        }
        target.append(c);
      }
      target.append('"');
    }
  }

  /** Strategy for appending the boundary across parts. */
  private enum BoundaryAppender {
    FIRST("--", "\r\n"),
    MIDDLE("\r\n--", "\r\n"),
    LAST("\r\n--", "--\r\n");

    private final String prefix;
    private final String suffix;

    BoundaryAppender(String prefix, String suffix) {
      this.prefix = prefix;
      this.suffix = suffix;
    }

    void append(StringBuilder target, String boundary) {
      target.append(prefix).append(boundary).append(suffix);
    }

    static BoundaryAppender get(int partIndex) {
      return partIndex == 0 ? FIRST : MIDDLE;
    }
  }
}
