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

package com.github.mizosoft.requests4j.testing;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/** Drains a body publisher into memory. */
public final class BodyCollector implements Flow.Subscriber<ByteBuffer> {
  private final CompletableFuture<byte[]> body = new CompletableFuture<>();
  private final List<ByteBuffer> buffers = new ArrayList<>();

  public BodyCollector() {}

  @Override
  public void onSubscribe(Flow.Subscription subscription) {
    subscription.request(Long.MAX_VALUE);
  }

  @Override
  public void onNext(ByteBuffer item) {
    buffers.add(requireNonNull(item));
  }

  @Override
  public void onError(Throwable throwable) {
    body.completeExceptionally(requireNonNull(throwable));
  }

  @Override
  public void onComplete() {
    var collected = new byte[buffers.stream().mapToInt(ByteBuffer::remaining).sum()];
    int position = 0;
    for (var buffer : buffers) {
      int length = buffer.remaining();
      buffer.get(collected, position, length);
      position += length;
    }
    body.complete(collected);
  }

  public static byte[] collect(Flow.Publisher<ByteBuffer> publisher) {
    var collector = new BodyCollector();
    publisher.subscribe(collector);
    return collector.body.join();
  }

  public static String collectUtf8(Flow.Publisher<ByteBuffer> publisher) {
    return new String(collect(publisher), UTF_8);
  }
}
