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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import com.adobe.blobfs.storage.InMemoryBlobStore;
import com.adobe.blobfs.storage.api.BlobStoreException;

import com.google.common.collect.ImmutableList;

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class ChunkAppenderTest {

  private static final String KEY = "upload";

  private InMemoryBlobStore blobStore;
  private ChunkAppender appender;

  @Before
  public void setup() throws IOException {
    blobStore = new InMemoryBlobStore();
    blobStore.createAppendable(KEY);
    appender = new ChunkAppender(blobStore, KEY, 4);
  }

  @Test
  public void testBlockIsSplitInBoundedChunksInOrder() throws IOException {
    byte[] data = "abcdefghij".getBytes(StandardCharsets.UTF_8);

    assertEquals(10, appender.append(data, 0, data.length));

    assertEquals(ImmutableList.of(4, 4, 2), blobStore.getAppendedChunkSizes(KEY));
    assertArrayEquals(data, blobStore.getContent(KEY));
  }

  @Test
  public void testOffsetIntoSourceArrayIsHonoured() throws IOException {
    byte[] data = "xxabcdefyy".getBytes(StandardCharsets.UTF_8);

    appender.append(data, 2, 6);

    assertEquals(ImmutableList.of(4, 2), blobStore.getAppendedChunkSizes(KEY));
    assertArrayEquals("abcdef".getBytes(StandardCharsets.UTF_8), blobStore.getContent(KEY));
  }

  @Test
  public void testFailureReportsBytesAppendedBeforeIt() {
    BlobStoreException error = new BlobStoreException("append failed");
    blobStore.failAfter(InMemoryBlobStore.Operation.APPEND_CHUNK, 2, error);

    try {
      appender.append(new byte[12], 0, 12);
      fail("Expected append to fail");
    } catch (ChunkAppendException e) {
      assertEquals(8, e.getBytesAppended());
      assertEquals(KEY, e.getKey());
      assertSame(error, e.getCause());
    }
    assertEquals(3, blobStore.countCalls(InMemoryBlobStore.Operation.APPEND_CHUNK));
    assertEquals(8, blobStore.getContent(KEY).length);
  }

  @Test
  public void testEmptyBlockMakesNoBackendCall() throws IOException {
    assertEquals(0, appender.append(new byte[4], 0, 0));

    assertEquals(0, blobStore.countCalls(InMemoryBlobStore.Operation.APPEND_CHUNK));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testChunkSizeMustBePositive() {
    new ChunkAppender(blobStore, KEY, 0);
  }
}
