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

package com.adobe.blobfs.driver;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.adobe.blobfs.common.configuration.DriverConfiguration;
import com.adobe.blobfs.common.configuration.TestDriverConfigurations;
import com.adobe.blobfs.common.exceptions.InvalidOffsetException;
import com.adobe.blobfs.common.exceptions.InvalidVirtualPathException;
import com.adobe.blobfs.common.exceptions.PathNotFoundException;
import com.adobe.blobfs.common.exceptions.SizeLimitExceededException;
import com.adobe.blobfs.driver.api.VirtualEntry;
import com.adobe.blobfs.storage.InMemoryBlobStore;
import com.adobe.blobfs.storage.InMemoryBlobStore.Operation;
import com.adobe.blobfs.storage.api.BlobStoreException;
import com.adobe.blobfs.storage.api.BlobType;
import com.adobe.blobfs.writer.FileWriter;

import com.google.common.collect.ImmutableList;

import org.apache.commons.io.IOUtils;
import org.apache.hadoop.conf.Configuration;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

public class BlobStorageDriverTest {

  private static final int CHUNK_SIZE = 4;

  private InMemoryBlobStore blobStore;
  private BlobStorageDriver driver;

  @Before
  public void setup() {
    blobStore = new InMemoryBlobStore();
    driver = new BlobStorageDriver(blobStore, TestDriverConfigurations.withRootAndChunkSize("/registry", CHUNK_SIZE));
  }

  @Test
  public void testPutThenStatListAndDeleteDirectory() throws IOException {
    driver.putContent("/a/b", bytes("hi"));

    VirtualEntry directory = driver.stat("/a");
    assertTrue(directory.isDirectory());
    assertEquals("/a", directory.getPath());
    assertEquals(Collections.singletonList("/a/b"), driver.list("/a"));

    driver.delete("/a");

    assertFalse(blobStore.getKeys().contains("registry/a/b"));
    try {
      driver.stat("/a");
      fail("Expected /a to be gone");
    } catch (PathNotFoundException e) {
      assertEquals("/a", e.getPath());
    }
  }

  @Test
  public void testPutThenGetReturnsContent() throws IOException {
    driver.putContent("/docker/manifest", bytes("{}"));

    assertArrayEquals(bytes("{}"), driver.getContent("/docker/manifest"));
    assertArrayEquals(bytes("{}"), blobStore.getContent("registry/docker/manifest"));
    assertEquals(BlobType.BLOCK, blobStore.getType("registry/docker/manifest"));
  }

  @Test
  public void testStatOfFileReturnsSizeAndModificationTime() throws IOException {
    driver.putContent("/f", bytes("hello"));

    VirtualEntry.File file = driver.stat("/f").asFile();

    assertEquals("/f", file.getPath());
    assertEquals(5, file.getSize());
    assertEquals(blobStore.properties("registry/f").getLastModified(), file.getModificationTime());
  }

  @Test
  public void testStatOfRootIsAlwaysADirectory() throws IOException {
    assertTrue(driver.stat("/").isDirectory());
    assertTrue(blobStore.getCalls().isEmpty());
  }

  @Test(expected = PathNotFoundException.class)
  public void testStatOfMissingPathThrowsNotFound() throws IOException {
    driver.stat("/missing");
  }

  @Test
  public void testStatDoesNotMistakeSiblingWithCommonPrefixForDirectory() throws IOException {
    driver.putContent("/dirty", bytes("x"));

    try {
      driver.stat("/dir");
      fail("Expected /dir to be missing");
    } catch (PathNotFoundException e) {
      assertEquals("/dir", e.getPath());
    }
  }

  @Test(expected = PathNotFoundException.class)
  public void testGetOfMissingFileThrowsNotFound() throws IOException {
    driver.getContent("/missing");
  }

  @Test
  public void testPutAboveLimitIsRejectedBeforeAnyBackendCall() throws IOException {
    Configuration configuration = new Configuration(false);
    configuration.set(DriverConfiguration.CONTAINER, "registry");
    configuration.setLong(DriverConfiguration.MAX_PUT_SIZE, 3L);
    BlobStorageDriver limitedDriver = new BlobStorageDriver(blobStore, TestDriverConfigurations.of(configuration));

    try {
      limitedDriver.putContent("/f", bytes("four"));
      fail("Expected size limit to be enforced");
    } catch (SizeLimitExceededException e) {
      assertEquals(4, e.getSize());
      assertEquals(3, e.getLimit());
    }
    assertTrue(blobStore.getCalls().isEmpty());

    limitedDriver.putContent("/f", bytes("abc"));
    assertArrayEquals(bytes("abc"), blobStore.getContent("f"));
  }

  @Test
  public void testPutOverExistingBlockBlobDoesNotDeleteIt() throws IOException {
    driver.putContent("/f", bytes("old"));
    blobStore.resetCalls();

    driver.putContent("/f", bytes("new"));

    assertFalse(blobStore.getCalls().contains(Operation.DELETE));
    assertArrayEquals(bytes("new"), driver.getContent("/f"));
  }

  @Test
  public void testPutReplacesLegacyAppendBlob() throws IOException {
    blobStore.seed("registry/f", bytes("legacy"), BlobType.APPEND);

    driver.putContent("/f", bytes("new"));

    assertArrayEquals(bytes("new"), driver.getContent("/f"));
    assertEquals(BlobType.BLOCK, blobStore.getType("registry/f"));
  }

  @Test
  public void testFailedPutAfterLegacyBlobDeletionLosesPreviousContent() throws IOException {
    blobStore.seed("registry/f", bytes("legacy"), BlobType.APPEND);
    blobStore.failNext(Operation.PUT, new BlobStoreException("put failed"));

    try {
      driver.putContent("/f", bytes("new"));
      fail("Expected put to fail");
    } catch (BlobStoreException e) {
      assertEquals("put failed", e.getMessage());
    }

    assertNull(blobStore.getContent("registry/f"));
    try {
      driver.getContent("/f");
      fail("Expected previous content to be gone");
    } catch (PathNotFoundException e) {
      assertEquals("/f", e.getPath());
    }
  }

  @Test
  public void testDeleteIncompatibleBlobIgnoresMissingAndBlockBlobs() throws IOException {
    blobStore.seed("block", bytes("x"), BlobType.BLOCK);

    driver.deleteIncompatibleBlob("missing");
    driver.deleteIncompatibleBlob("block");

    assertEquals(ImmutableList.of("block"), blobStore.getKeys());
  }

  @Test
  public void testReaderStartsAtOffset() throws IOException {
    driver.putContent("/f", bytes("hello world"));

    try (InputStream in = driver.reader("/f", 6)) {
      assertEquals("world", IOUtils.toString(in, StandardCharsets.UTF_8));
    }
    try (InputStream in = driver.reader("/f", 0)) {
      assertEquals("hello world", IOUtils.toString(in, StandardCharsets.UTF_8));
    }
  }

  @Test
  public void testReaderAtOrPastEndIsEmpty() throws IOException {
    driver.putContent("/f", bytes("hello"));

    try (InputStream in = driver.reader("/f", 5)) {
      assertEquals(-1, in.read());
    }
    try (InputStream in = driver.reader("/f", 50)) {
      assertEquals(-1, in.read());
    }
  }

  @Test(expected = InvalidOffsetException.class)
  public void testReaderRejectsNegativeOffset() throws IOException {
    driver.putContent("/f", bytes("hello"));

    driver.reader("/f", -1);
  }

  @Test(expected = PathNotFoundException.class)
  public void testReaderOfMissingFileThrowsNotFound() throws IOException {
    driver.reader("/missing", 0);
  }

  @Test
  public void testListOfEmptyRootIsEmpty() throws IOException {
    assertTrue(driver.list("/").isEmpty());
  }

  @Test(expected = PathNotFoundException.class)
  public void testListOfMissingDirectoryThrowsNotFound() throws IOException {
    driver.list("/missing");
  }

  @Test
  public void testListReturnsSortedDirectChildren() throws IOException {
    driver.putContent("/z", bytes("1"));
    driver.putContent("/b/x", bytes("2"));
    driver.putContent("/b/y/z", bytes("3"));
    driver.putContent("/a", bytes("4"));

    assertEquals(ImmutableList.of("/a", "/b", "/z"), driver.list("/"));
    assertEquals(ImmutableList.of("/b/x", "/b/y"), driver.list("/b"));
  }

  @Test
  public void testMoveCopiesThenDeletesSource() throws IOException {
    driver.putContent("/src", bytes("data"));

    driver.move("/src", "/dir/dst");

    assertArrayEquals(bytes("data"), driver.getContent("/dir/dst"));
    assertFalse(blobStore.getKeys().contains("registry/src"));
  }

  @Test
  public void testMoveOfMissingSourceThrowsNotFoundForSource() throws IOException {
    try {
      driver.move("/missing", "/dst");
      fail("Expected move to fail");
    } catch (PathNotFoundException e) {
      assertEquals("/missing", e.getPath());
    }
  }

  @Test
  public void testDeleteOfFileDoesNotList() throws IOException {
    driver.putContent("/f", bytes("x"));
    blobStore.resetCalls();

    driver.delete("/f");

    assertEquals(ImmutableList.of(Operation.DELETE_IF_EXISTS), blobStore.getCalls());
  }

  @Test
  public void testDeleteOfDirectoryRemovesEveryDescendantOnly() throws IOException {
    driver.putContent("/d/a", bytes("1"));
    driver.putContent("/d/e/b", bytes("2"));
    driver.putContent("/dx", bytes("3"));

    driver.delete("/d");

    assertEquals(ImmutableList.of("registry/dx"), blobStore.getKeys());
  }

  @Test(expected = PathNotFoundException.class)
  public void testDeleteOfMissingPathThrowsNotFound() throws IOException {
    driver.delete("/missing");
  }

  @Test
  public void testWriterOnMissingPathCreatesEmptyFile() throws IOException {
    try (FileWriter writer = driver.writer("/upload", false)) {
      assertEquals(0, writer.size());
      assertEquals(BlobType.APPEND, blobStore.getType("registry/upload"));
    }
  }

  @Test(expected = PathNotFoundException.class)
  public void testAppendToMissingPathThrowsNotFound() throws IOException {
    driver.writer("/missing", true);
  }

  @Test
  public void testWriterWithoutAppendResetsExistingFile() throws IOException {
    try (FileWriter writer = driver.writer("/upload", false)) {
      writer.write(bytes("first"), 0, 5);
      writer.commit();
    }

    try (FileWriter writer = driver.writer("/upload", false)) {
      assertEquals(0, writer.size());
      writer.commit();
    }
    assertEquals(0, driver.stat("/upload").asFile().getSize());
  }

  @Test
  public void testAppendResumesAtBackendSize() throws IOException {
    try (FileWriter writer = driver.writer("/upload", false)) {
      writer.write(bytes("hello "), 0, 6);
      writer.commit();
    }

    try (FileWriter writer = driver.writer("/upload", true)) {
      assertEquals(6, writer.size());
      writer.write(bytes("world"), 0, 5);
      writer.commit();
      assertEquals(11, writer.size());
    }

    assertArrayEquals(bytes("hello world"), driver.getContent("/upload"));
  }

  @Test
  public void testCancelThenStatThrowsNotFound() throws IOException {
    FileWriter writer = driver.writer("/upload", false);
    writer.write(bytes("abcdefghij"), 0, 10);
    writer.cancel();
    writer.close();

    try {
      driver.stat("/upload");
      fail("Expected cancelled upload to be gone");
    } catch (PathNotFoundException e) {
      assertEquals("/upload", e.getPath());
    }
  }

  @Test
  public void testInvalidPathsAreRejectedBeforeAnyBackendCall() throws IOException {
    String[] invalidPaths = {"", "relative", "/trailing/", "/a//b", "/bad char"};
    for (String path : invalidPaths) {
      expectInvalid(() -> driver.getContent(path));
      expectInvalid(() -> driver.putContent(path, bytes("x")));
      expectInvalid(() -> driver.reader(path, 0));
      expectInvalid(() -> driver.writer(path, false));
      expectInvalid(() -> driver.stat(path));
      expectInvalid(() -> driver.list(path));
      expectInvalid(() -> driver.delete(path));
      expectInvalid(() -> driver.move(path, "/ok"));
      expectInvalid(() -> driver.move("/ok", path));
      expectInvalid(() -> driver.walk(path, entry -> java.nio.file.FileVisitResult.CONTINUE));
    }
    expectInvalid(() -> driver.delete("/"));
    expectInvalid(() -> driver.getContent("/"));

    assertTrue(blobStore.getCalls().isEmpty());
  }

  @Test
  public void testNameAndClose() throws IOException {
    assertEquals("azure", driver.name());

    driver.close();

    assertTrue(blobStore.isClosed());
  }

  @Test
  public void testEmptyRootDirectoryMapsPathsToTopLevelKeys() throws IOException {
    BlobStorageDriver rootless = new BlobStorageDriver(blobStore, TestDriverConfigurations.withRoot(""));

    rootless.putContent("/a/b", bytes("x"));

    assertEquals(ImmutableList.of("a/b"), blobStore.getKeys());
    assertEquals(ImmutableList.of("/a"), rootless.list("/"));
  }

  private static void expectInvalid(DriverCall call) throws IOException {
    try {
      call.run();
      fail("Expected path to be rejected");
    } catch (InvalidVirtualPathException e) {
      // expected
    }
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  @FunctionalInterface
  private interface DriverCall {
    void run() throws IOException;
  }
}
