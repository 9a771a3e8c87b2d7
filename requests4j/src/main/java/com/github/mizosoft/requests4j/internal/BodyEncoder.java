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
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mizosoft.requests4j.EncodingException;
import com.github.mizosoft.requests4j.FileField;
import com.github.mizosoft.requests4j.FormBodyPublisher;
import com.github.mizosoft.requests4j.JsonPayload;
import com.github.mizosoft.requests4j.MediaType;
import com.github.mizosoft.requests4j.MultipartBodyPublisher;
import com.github.mizosoft.requests4j.RequestArguments;
import java.io.IOException;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Picks the body of a request from its arguments. The first present source wins, in the order
 * {@code body}, {@code json}, {@code files} then {@code data}. The streams of all given files are
 * closed once encoding is done, whether it succeeds or not and whether the files win or not.
 */
public final class BodyEncoder {
  private BodyEncoder() {}

  /**
   * Encodes the body of a request with the given arguments.
   *
   * @throws EncodingException if the JSON value can't be serialized or the multipart body can't be
   *     built
   * @throws IOException if reading or closing a file fails
   */
  public static EncodedBody encode(RequestArguments arguments) throws IOException {
    var files = arguments.files();
    EncodedBody encoded;
    try {
      encoded = select(arguments);
    } catch (IOException | RuntimeException e) {
      closeAll(files, e);
      throw e;
    }
    var closeFailure = closeAll(files, null);
    if (closeFailure != null) {
      throw closeFailure;
    }
    return encoded;
  }

  /**
   * Closes the streams of the files in the given arguments without encoding them, for when assembly
   * fails before the body is encoded. Close failures are added as suppressed to the given cause.
   */
  public static void discard(RequestArguments arguments, Throwable cause) {
    closeAll(arguments.files(), requireNonNull(cause));
  }

  private static EncodedBody select(RequestArguments arguments) throws IOException {
    var body = arguments.body();
    if (body != null) {
      return new EncodedBody(body, null);
    }
    var json = arguments.json();
    if (json != null) {
      return new EncodedBody(
          BodyPublishers.ofByteArray(jsonBytes(json, arguments.defaults().mapper())),
          MediaType.APPLICATION_JSON);
    }
    if (!arguments.files().isEmpty()) {
      var multipart = multipart(arguments.files(), arguments.data());
      return new EncodedBody(multipart, multipart.mediaType());
    }
    if (!arguments.data().isEmpty()) {
      var form = FormBodyPublisher.of(arguments.data());
      return new EncodedBody(form, form.mediaType());
    }
    return EncodedBody.NONE;
  }

  private static byte[] jsonBytes(JsonPayload json, ObjectMapper mapper)
      throws EncodingException {
    switch (json.kind()) {
      case RAW_TEXT:
        return json.text().getBytes(UTF_8);
      case RAW_BYTES:
        return json.bytes();
      case STRUCTURED:
        var value = json.value();
        try {
          return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
          throw new EncodingException("couldn't serialize " + value.getClass().getName(), e);
        }
      default:
        throw new AssertionError("unexpected kind: " + json.kind());
    }
  }

  private static MultipartBodyPublisher multipart(List<FileField> files, Map<String, String> data)
      throws IOException {
    var builder = MultipartBodyPublisher.newBuilder();
    try {
      for (var file : files) {
        builder.filePart(file.fieldName(), file.fileName(), file.content());
      }
      data.forEach(builder::textPart);
      return builder.build();
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new EncodingException("couldn't build multipart body: " + e.getMessage(), e);
    }
  }

  /**
   * Closes the streams of the given files. Failures are added as suppressed to {@code primary} if
   * present, otherwise the first one is returned with the rest suppressed by it.
   */
  private static @Nullable IOException closeAll(
      List<FileField> files, @Nullable Throwable primary) {
    @Nullable IOException firstFailure = null;
    for (var file : files) {
      try {
        file.content().close();
      } catch (IOException e) {
        if (primary != null) {
          primary.addSuppressed(e);
        } else if (firstFailure == null) {
          firstFailure = e;
        } else {
          firstFailure.addSuppressed(e);
        }
      }
    }
    return firstFailure;
  }

  /** A request body with the {@code Content-Type} inferred from its source, if any. */
  public static final class EncodedBody {
    static final EncodedBody NONE = new EncodedBody(BodyPublishers.noBody(), null);

    private final BodyPublisher publisher;
    private final @Nullable MediaType mediaType;

    EncodedBody(BodyPublisher publisher, @Nullable MediaType mediaType) {
      this.publisher = requireNonNull(publisher);
      this.mediaType = mediaType;
    }

    public BodyPublisher publisher() {
      return publisher;
    }

    public Optional<MediaType> mediaType() {
      return Optional.ofNullable(mediaType);
    }

    /** Returns whether no body source was present. */
    public boolean isEmpty() {
      return this == NONE;
    }
  }
}
