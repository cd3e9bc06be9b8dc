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

import java.io.IOException;

/**
 * Appends arbitrarily large blocks to an append-capable blob, one bounded chunk per backend call.
 */
public class ChunkAppender {

  private final BlobStore blobStore;
  private final String key;
  private final int maxChunkSize;

  public ChunkAppender(BlobStore blobStore, String key, int maxChunkSize) {
    this.blobStore = Preconditions.checkNotNull(blobStore);
    this.key = Preconditions.checkNotNull(key);
    Preconditions.checkArgument(maxChunkSize > 0, "Chunk size must be positive");
    this.maxChunkSize = maxChunkSize;
  }

  /**
   * Appends {@code length} bytes in increasing offset order, stopping at the first failure.
   *
   * @return the number of bytes appended, always {@code length}.
   * @throws ChunkAppendException carrying the number of bytes appended before the failure.
   */
  public long append(byte[] data, int offset, int length) throws ChunkAppendException {
    Preconditions.checkPositionIndexes(offset, offset + length, data.length);
    long appended = 0;
    for (int position = 0; position < length; position += maxChunkSize) {
      int chunkLength = Math.min(maxChunkSize, length - position);
      try {
        blobStore.appendChunk(key, data, offset + position, chunkLength);
      } catch (IOException e) {
        throw new ChunkAppendException(key, appended, e);
      }
      appended += chunkLength;
    }
    return appended;
  }
}
