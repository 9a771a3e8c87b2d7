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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A file to upload as a field of a {@code multipart/form-data} body.
 *
 * <p>Passing a {@code FileField} to a request hands over its content stream: the stream is read
 * and closed exactly once while the body is encoded, whether encoding succeeds or not. A {@code
 * FileField} must therefore not be shared between requests.
 */
public final class FileField {
  private final String fieldName;
  private final String fileName;
  private final InputStream content;

  private FileField(String fieldName, String fileName, InputStream content) {
    this.fieldName = requireNonNull(fieldName);
    this.fileName = requireNonNull(fileName);
    this.content = requireNonNull(content);
  }

  /** Returns the name of the form field. */
  public String fieldName() {
    return fieldName;
  }

  /** Returns the name of the uploaded file. */
  public String fileName() {
    return fileName;
  }

  /** Returns the stream of the file's content. */
  public InputStream content() {
    return content;
  }

  @Override
  public String toString() {
    return "FileField[fieldName=" + fieldName + ", fileName=" + fileName + "]";
  }

  /** Returns a {@code FileField} reading its content from the given stream. */
  public static FileField of(String fieldName, String fileName, InputStream content) {
    return new FileField(fieldName, fileName, content);
  }

  /**
   * Returns a {@code FileField} for the given file, named after the path's file name component.
   *
   * @throws IOException if the file can't be opened
   */
  public static FileField of(String fieldName, Path file) throws IOException {
    var fileNameComponent = file.getFileName();
    var fileName = fileNameComponent != null ? fileNameComponent.toString() : "";
    return new FileField(fieldName, fileName, Files.newInputStream(file));
  }
}
