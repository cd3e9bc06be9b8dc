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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.adobe.blobfs.storage.InMemoryBlobStore;
import com.adobe.blobfs.storage.InMemoryBlobStore.Operation;
import com.adobe.blobfs.storage.api.BlobStoreException;

import com.google.common.collect.ImmutableList;

import com.tngtech.java.junit.dataprovider.DataProvider;
import com.tngtech.java.junit.dataprovider.DataProviderRunner;
import com.tngtech.java.junit.dataprovider.UseDataProvider;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RunWith(DataProviderRunner.class)
public class ChunkedFileWriterTest {

  private static final String PATH = "/upload";
  private static final String KEY = "registry/upload";
  private static final int CHUNK_SIZE = 4;

  private InMemoryBlobStore blobStore;
  private ChunkedFileWriter writer;

  @DataProvider
  public static Object[][] payloadSizes() {
    return new Object[][] {
        new Object[] {5},
        new Object[] {8},
        new Object[] {10},
        new Object[] {17},
    };
  }

  @Before
  public void setup() throws IOException {
    blobStore = new InMemoryBlobStore();
    blobStore.createAppendable(KEY);
    writer = new ChunkedFileWriter(PATH, KEY, 0, blobStore, CHUNK_SIZE);
  }

  @Test
  @UseDataProvider("payloadSizes")
  public void testLargeWriteProducesCeilOfSizeOverChunkAppends(int size) throws IOException {
    byte[] data = payload(size);

    writer.write(data, 0, size);
    writer.commit();

    List<Integer> chunks = blobStore.getAppendedChunkSizes(KEY);
    assertEquals((size + CHUNK_SIZE - 1) / CHUNK_SIZE, chunks.size());
    for (int chunk : chunks) {
      assertTrue(chunk <= CHUNK_SIZE);
    }
    assertArrayEquals(data, blobStore.getContent(KEY));
    assertEquals(size, writer.size());
  }

  @Test
  public void testSmallWritesAreBufferedUntilChunkIsFull() throws IOException {
    byte[] data = payload(10);
    for (int i = 0; i < data.length; i++) {
      writer.write(data, i, 1);
    }

    assertEquals(ImmutableList.of(4, 4), blobStore.getAppendedChunkSizes(KEY));
    assertEquals(10, writer.size());

    writer.commit();

    assertEquals(ImmutableList.of(4, 4, 2), blobStore.getAppendedChunkSizes(KEY));
    assertArrayEquals(data, blobStore.getContent(KEY));
  }

  @Test
  public void testWriteFillsPartialBufferBeforeAppendingDirectly() throws IOException {
    byte[] data = payload(9);

    writer.write(data, 0, 3);
    writer.write(data, 3, 6);
    writer.commit();

    assertEquals(ImmutableList.of(4, 4, 1), blobStore.getAppendedChunkSizes(KEY));
    assertArrayEquals(data, blobStore.getContent(KEY));
  }

  @Test
  public void testSingleByteWrites() throws IOException {
    writer.write('a');
    writer.write('b');
    writer.commit();

    assertArrayEquals("ab".getBytes(StandardCharsets.UTF_8), blobStore.getContent(KEY));
  }

  @Test
  public void testSizeIncludesInitialSize() throws IOException {
    ChunkedFileWriter resumed = new ChunkedFileWriter(PATH, KEY, 6, blobStore, CHUNK_SIZE);

    resumed.write(payload(2), 0, 2);

    assertEquals(8, resumed.size());
  }

  @Test
  public void testWriteAfterCommitIsRejected() throws IOException {
    writer.commit();

    expectStateException(() -> writer.write(payload(1), 0, 1), "Cannot write: writer already committed");
    expectStateException(() -> writer.commit(), "Cannot commit: writer already committed");
    expectStateException(() -> writer.cancel(), "Cannot cancel: writer already committed");
  }

  @Test
  public void testWriteAfterCancelIsRejected() throws IOException {
    writer.cancel();

    expectStateException(() -> writer.write(payload(1), 0, 1), "Cannot write: writer already cancelled");
    expectStateException(() -> writer.commit(), "Cannot commit: writer already cancelled");
  }

  @Test
  public void testCloseIsAcceptedExactlyOnce() throws IOException {
    writer.commit();
    writer.close();

    assertEquals(WriterState.CLOSED, writer.state());
    expectStateException(() -> writer.close(), "Cannot close: writer already closed");
    expectStateException(() -> writer.write(payload(1), 0, 1), "Cannot write: writer already closed");
  }

  @Test
  public void testCloseWithoutCommitFlushesBufferedData() throws IOException {
    writer.write(payload(2), 0, 2);

    writer.close();

    assertEquals(WriterState.CLOSED, writer.state());
    assertArrayEquals(payload(2), blobStore.getContent(KEY));
  }

  @Test
  public void testCloseAfterCancelDoesNotTouchBackend() throws IOException {
    writer.write(payload(2), 0, 2);
    writer.cancel();
    blobStore.resetCalls();

    writer.close();

    assertTrue(blobStore.getCalls().isEmpty());
  }

  @Test
  public void testCancelDiscardsBufferAndDeletesBlob() throws IOException {
    writer.write(payload(6), 0, 6);

    writer.cancel();

    assertEquals(WriterState.CANCELLED, writer.state());
    assertNull(blobStore.getContent(KEY));
    assertEquals(ImmutableList.of(4), blobStore.getAppendedChunkSizes(KEY));
  }

  @Test
  public void testFailedCommitLeavesWriterOpen() throws IOException {
    writer.write(payload(2), 0, 2);
    blobStore.failNext(Operation.APPEND_CHUNK, new BlobStoreException("append failed"));

    try {
      writer.commit();
      fail("Expected commit to fail");
    } catch (ChunkAppendException e) {
      assertEquals(0, e.getBytesAppended());
    }
    assertEquals(WriterState.OPEN, writer.state());

    writer.commit();

    assertEquals(WriterState.COMMITTED, writer.state());
    assertArrayEquals(payload(2), blobStore.getContent(KEY));
  }

  @Test
  public void testFailedDirectAppendCountsDurableBytes() throws IOException {
    blobStore.failAfter(Operation.APPEND_CHUNK, 1, new BlobStoreException("append failed"));

    try {
      writer.write(payload(12), 0, 12);
      fail("Expected write to fail");
    } catch (ChunkAppendException e) {
      assertEquals(4, e.getBytesAppended());
    }

    assertEquals(4, writer.size());
    assertEquals(WriterState.OPEN, writer.state());
  }

  @Test
  public void testFullBufferLeftByFailedFlushIsRetriedOnNextWrite() throws IOException {
    byte[] data = payload(5);
    writer.write(data, 0, 3);
    blobStore.failNext(Operation.APPEND_CHUNK, new BlobStoreException("append failed"));

    try {
      writer.write(data, 3, 1);
      fail("Expected flush to fail");
    } catch (ChunkAppendException e) {
      assertEquals(4, writer.size());
    }

    writer.write(data, 4, 1);
    writer.commit();

    assertArrayEquals(data, blobStore.getContent(KEY));
    assertEquals(5, writer.size());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testOutOfBoundsWriteIsRejected() throws IOException {
    writer.write(payload(2), 1, 2);
  }

  private static void expectStateException(WriterCall call, String message) throws IOException {
    try {
      call.run();
      fail("Expected " + message);
    } catch (WriterStateException e) {
      assertEquals(message, e.getMessage());
    }
  }

  private static byte[] payload(int size) {
    byte[] data = new byte[size];
    for (int i = 0; i < size; i++) {
      data[i] = (byte) ('a' + i % 26);
    }
    return data;
  }

  @FunctionalInterface
  private interface WriterCall {
    void run() throws IOException;
  }
}
