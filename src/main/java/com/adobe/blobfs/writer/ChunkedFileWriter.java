/*
Copyright 2021 Adobe. All rights reserved.
This file is licensed to you under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License. You may obtain a copy
of the License at http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software distributed under
the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR REPRESENTATIONS
OF ANY KIND, either express or implied. See the License for the specific language
governing permissions and limitations under the License.
*/

package com.adobe.blobfs.writer;

import com.adobe.blobfs.storage.api.BlobStore;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * {@link FileWriter} buffering data in memory and flushing it to an append blob in chunks of at most
 * the configured maximum chunk size.
 */
public class ChunkedFileWriter extends OutputStream implements FileWriter {

  private static final Logger LOG = LoggerFactory.getLogger(ChunkedFileWriter.class);

  private final String path;
  private final String key;
  private final BlobStore blobStore;
  private final ChunkAppender appender;
  private final byte[] buffer;

  private int buffered;
  private long size;
  private WriterState state = WriterState.OPEN;

  /**
   * @param path virtual path, for messages.
   * @param key key of an existing append blob.
   * @param initialSize size of the blob when the session starts.
   */
  public ChunkedFileWriter(String path, String key, long initialSize, BlobStore blobStore, int maxChunkSize) {
    Preconditions.checkArgument(initialSize >= 0);
    this.path = Preconditions.checkNotNull(path);
    this.key = Preconditions.checkNotNull(key);
    this.blobStore = Preconditions.checkNotNull(blobStore);
    this.appender = new ChunkAppender(blobStore, key, maxChunkSize);
    this.buffer = new byte[maxChunkSize];
    this.size = initialSize;
  }

  @Override
  public void write(int b) throws IOException {
    write(new byte[] {(byte) b}, 0, 1);
  }

  @Override
  public void write(byte[] data, int offset, int length) throws IOException {
    Preconditions.checkPositionIndexes(offset, offset + length, data.length);
    state.transition(WriterOperation.WRITE);

    int accepted = 0;
    try {
      while (accepted < length) {
        if (buffered == buffer.length) {
          // left full by a failed flush
          flushBuffer();
          continue;
        }

        int remaining = length - accepted;
        if (buffered == 0 && remaining >= buffer.length) {
          int direct = remaining - remaining % buffer.length;
          try {
            appender.append(data, offset + accepted, direct);
          } catch (ChunkAppendException e) {
            accepted += (int) e.getBytesAppended();
            throw e;
          }
          accepted += direct;
        } else {
          int copied = Math.min(buffer.length - buffered, remaining);
          System.arraycopy(data, offset + accepted, buffer, buffered, copied);
          buffered += copied;
          accepted += copied;
          if (buffered == buffer.length) {
            flushBuffer();
          }
        }
      }
    } finally {
      size += accepted;
    }
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public WriterState state() {
    return state;
  }

  @Override
  public void commit() throws IOException {
    WriterState next = state.transition(WriterOperation.COMMIT);
    flushBuffer();
    state = next;
    LOG.debug("Committed {} bytes to {}", size, path);
  }

  @Override
  public void cancel() throws IOException {
    state = state.transition(WriterOperation.CANCEL);
    buffered = 0;
    blobStore.delete(key);
    LOG.debug("Cancelled write to {}", path);
  }

  @Override
  public void close() throws IOException {
    WriterState previous = state;
    state = state.transition(WriterOperation.CLOSE);
    if (previous == WriterState.OPEN) {
      LOG.debug("Closing {} without commit, flushing {} buffered bytes", path, buffered);
      flushBuffer();
    }
  }

  private void flushBuffer() throws IOException {
    if (buffered == 0) {
      return;
    }
    appender.append(buffer, 0, buffered);
    buffered = 0;
  }

  @Override
  public String toString() {
    return "ChunkedFileWriter{path=" + path + ", size=" + size + ", state=" + state + "}";
  }
}
