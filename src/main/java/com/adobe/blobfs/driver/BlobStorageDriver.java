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

import com.adobe.blobfs.common.configuration.DriverConfiguration;
import com.adobe.blobfs.common.exceptions.InvalidOffsetException;
import com.adobe.blobfs.common.exceptions.PathNotFoundException;
import com.adobe.blobfs.common.exceptions.SizeLimitExceededException;
import com.adobe.blobfs.driver.api.StorageDriver;
import com.adobe.blobfs.driver.api.VirtualEntry;
import com.adobe.blobfs.driver.walk.EntryVisitor;
import com.adobe.blobfs.driver.walk.SynchronousTreeWalker;
import com.adobe.blobfs.storage.api.BlobNotFoundException;
import com.adobe.blobfs.storage.api.BlobProperties;
import com.adobe.blobfs.storage.api.BlobStore;
import com.adobe.blobfs.storage.api.BlobType;
import com.adobe.blobfs.storage.api.ListingPage;
import com.adobe.blobfs.writer.ChunkedFileWriter;
import com.adobe.blobfs.writer.FileWriter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * {@link StorageDriver} implementation translating virtual paths to keys of a {@link BlobStore}.
 */
public class BlobStorageDriver implements StorageDriver {

  public static final String NAME = "azure";

  private static final Logger LOG = LoggerFactory.getLogger(BlobStorageDriver.class);

  private final BlobStore blobStore;
  private final PathMapper pathMapper;
  private final BlobLister lister;
  private final int maxChunkSize;
  private final long maxPutSize;
  private final int statPageSize;

  public BlobStorageDriver(BlobStore blobStore, DriverConfiguration configuration) {
    this.blobStore = Preconditions.checkNotNull(blobStore);
    Preconditions.checkNotNull(configuration);
    this.pathMapper = new PathMapper(configuration.getRootDirectory());
    this.lister = new BlobLister(blobStore, pathMapper, configuration.getListPageSize());
    this.maxChunkSize = configuration.getMaxChunkSize();
    this.maxPutSize = configuration.getMaxPutSize();
    this.statPageSize = configuration.getStatPageSize();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public byte[] getContent(String path) throws IOException {
    VirtualPaths.checkValid(path);
    try {
      return blobStore.get(pathMapper.toBlobKey(path));
    } catch (BlobNotFoundException e) {
      throw new PathNotFoundException(path, e);
    }
  }

  @Override
  public void putContent(String path, byte[] content) throws IOException {
    VirtualPaths.checkValid(path);
    Preconditions.checkNotNull(content);
    if (content.length > maxPutSize) {
      throw new SizeLimitExceededException(path, content.length, maxPutSize);
    }

    String key = pathMapper.toBlobKey(path);
    deleteIncompatibleBlob(key);
    blobStore.put(key, content);
    LOG.debug("Stored {} bytes at {}", content.length, path);
  }

  /**
   * Blobs written by older versions may be append blobs, which a whole-object put cannot replace.
   * Such a blob is deleted first. Until the following put succeeds the path does not exist, and if the
   * put fails the previous content is lost.
   */
  @VisibleForTesting
  void deleteIncompatibleBlob(String key) throws IOException {
    if (!blobStore.exists(key)) {
      return;
    }
    BlobType blobType = blobStore.properties(key).getBlobType();
    if (blobType != BlobType.BLOCK) {
      LOG.warn("Deleting {} blob {} before replacing it with a block blob", blobType, key);
      blobStore.delete(key);
    }
  }

  @Override
  public InputStream reader(String path, long offset) throws IOException {
    VirtualPaths.checkValid(path);
    if (offset < 0) {
      throw new InvalidOffsetException(path, offset);
    }

    String key = pathMapper.toBlobKey(path);
    try {
      BlobProperties properties = blobStore.properties(key);
      if (offset >= properties.getSize()) {
        return new ByteArrayInputStream(new byte[0]);
      }
      return blobStore.openRange(key, offset);
    } catch (BlobNotFoundException e) {
      throw new PathNotFoundException(path, e);
    }
  }

  @Override
  public FileWriter writer(String path, boolean append) throws IOException {
    VirtualPaths.checkValid(path);
    String key = pathMapper.toBlobKey(path);

    long initialSize = 0;
    if (blobStore.exists(key)) {
      if (append) {
        initialSize = blobStore.properties(key).getSize();
      } else {
        blobStore.delete(key);
        blobStore.createAppendable(key);
      }
    } else {
      if (append) {
        throw new PathNotFoundException(path);
      }
      blobStore.createAppendable(key);
    }

    LOG.debug("Opened writer on {} at offset {}", path, initialSize);
    return new ChunkedFileWriter(path, key, initialSize, blobStore, maxChunkSize);
  }

  @Override
  public VirtualEntry stat(String path) throws IOException {
    VirtualPaths.checkValidOrRoot(path);
    if (VirtualPaths.ROOT.equals(path)) {
      return VirtualEntry.directory(path);
    }

    String key = pathMapper.toBlobKey(path);
    if (blobStore.exists(key)) {
      BlobProperties properties;
      try {
        properties = blobStore.properties(key);
      } catch (BlobNotFoundException e) {
        throw new PathNotFoundException(path, e);
      }
      return VirtualEntry.file(path, properties.getSize(), properties.getLastModified());
    }

    ListingPage page = blobStore.listPage(VirtualPaths.asDirectoryPrefix(key), null, statPageSize);
    if (!page.getKeys().isEmpty()) {
      return VirtualEntry.directory(path);
    }
    throw new PathNotFoundException(path);
  }

  @Override
  public List<String> list(String path) throws IOException {
    VirtualPaths.checkValidOrRoot(path);
    String directory = VirtualPaths.ROOT.equals(path) ? "" : path;

    List<String> blobs = lister.listBlobs(directory);
    Set<String> children = BlobLister.directDescendants(blobs, directory);
    if (!directory.isEmpty() && children.isEmpty()) {
      throw new PathNotFoundException(path);
    }
    return ImmutableList.copyOf(Ordering.natural().sortedCopy(children));
  }

  @Override
  public void move(String sourcePath, String destinationPath) throws IOException {
    VirtualPaths.checkValid(sourcePath);
    VirtualPaths.checkValid(destinationPath);

    String sourceKey = pathMapper.toBlobKey(sourcePath);
    try {
      blobStore.copy(sourceKey, pathMapper.toBlobKey(destinationPath));
    } catch (BlobNotFoundException e) {
      throw new PathNotFoundException(sourcePath, e);
    }
    blobStore.delete(sourceKey);
    LOG.debug("Moved {} to {}", sourcePath, destinationPath);
  }

  @Override
  public void delete(String path) throws IOException {
    VirtualPaths.checkValid(path);
    if (blobStore.deleteIfExists(pathMapper.toBlobKey(path))) {
      LOG.debug("Deleted {}", path);
      return;
    }

    List<String> descendants = lister.listBlobs(path);
    if (descendants.isEmpty()) {
      throw new PathNotFoundException(path);
    }
    for (String descendant : descendants) {
      blobStore.delete(pathMapper.toBlobKey(descendant));
    }
    LOG.debug("Deleted {} blobs under {}", descendants.size(), path);
  }

  @Override
  public void walk(String path, EntryVisitor visitor) throws IOException {
    VirtualPaths.checkValidOrRoot(path);
    Preconditions.checkNotNull(visitor);
    new SynchronousTreeWalker(this).walk(path, visitor);
  }

  @Override
  public void close() throws IOException {
    blobStore.close();
  }
}
