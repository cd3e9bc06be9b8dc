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

package com.adobe.blobfs.storage.api;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * Interface modelling a flat, key addressed blob store (e.g. an Azure storage container).
 * Keys are plain strings; there is no notion of directories at this level.
 * <p>
 * Implementations report a missing key with {@link BlobNotFoundException} and wrap any other backend
 * failure in {@link BlobStoreException}. Retries, if any, are the implementation's business.
 */
public interface BlobStore extends Closeable {

  /**
   * Reads the whole content of the given key.
   * @param key
   * @return the blob content.
   * @throws BlobNotFoundException if the key does not exist.
   * @throws IOException in case of IO error.
   */
  byte[] get(String key) throws IOException;

  /**
   * Stores the content as a block blob, overwriting any existing block blob at the same key.
   * Callers are responsible for staying under the backend's single call size limit.
   * @param key
   * @param content
   * @throws IOException in case of IO error.
   */
  void put(String key, byte[] content) throws IOException;

  /**
   * Opens the key for reading starting at the given byte offset.
   * @param key
   * @param offset must be lower than the blob size.
   * @return an {@link InputStream} that the client can use to read data.
   * @throws BlobNotFoundException if the key does not exist.
   * @throws IOException in case of IO error.
   */
  InputStream openRange(String key, long offset) throws IOException;

  /**
   * @param key
   * @return the current properties of the blob.
   * @throws BlobNotFoundException if the key does not exist.
   * @throws IOException in case of IO error.
   */
  BlobProperties properties(String key) throws IOException;

  /**
   * Check whether the given key exists.
   * @param key
   * @throws IOException in case of IO error.
   */
  boolean exists(String key) throws IOException;

  /**
   * Deletes the given key if present.
   * @param key
   * @return true if a blob was deleted, false if there was nothing to delete.
   * @throws IOException in case of IO error.
   */
  boolean deleteIfExists(String key) throws IOException;

  /**
   * Deletes the given key.
   * @param key
   * @throws BlobNotFoundException if the key does not exist.
   * @throws IOException in case of IO error.
   */
  void delete(String key) throws IOException;

  /**
   * Lists a single page of keys starting with the given prefix.
   * @param prefix
   * @param marker continuation marker returned by the previous page, or null for the first page.
   * @param maxResults upper bound on the number of keys in the returned page.
   * @throws IOException in case of IO error.
   */
  ListingPage listPage(String prefix, String marker, int maxResults) throws IOException;

  /**
   * Creates an empty append-capable blob at the given key, replacing any existing blob.
   * @param key
   * @throws IOException in case of IO error.
   */
  void createAppendable(String key) throws IOException;

  /**
   * Appends a single chunk to an append-capable blob.
   * @param key
   * @param data
   * @param offset position in {@code data} of the first byte to append.
   * @param length number of bytes to append, bounded by the backend's maximum chunk size.
   * @throws BlobNotFoundException if the key does not exist.
   * @throws IOException in case of IO error, including when the blob is not append-capable.
   */
  void appendChunk(String key, byte[] data, int offset, int length) throws IOException;

  /**
   * Server side copy of a blob.
   * @param sourceKey
   * @param destinationKey
   * @throws BlobNotFoundException if the source does not exist.
   * @throws IOException in case of IO error.
   */
  void copy(String sourceKey, String destinationKey) throws IOException;

  /**
   * Creates the namespace (e.g. the container) backing this store. Idempotent.
   * @throws IOException in case of IO error.
   */
  void createContainerIfAbsent() throws IOException;
}
