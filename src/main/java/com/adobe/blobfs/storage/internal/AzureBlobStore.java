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

package com.adobe.blobfs.storage.internal;

import com.adobe.blobfs.storage.api.BlobNotFoundException;
import com.adobe.blobfs.storage.api.BlobProperties;
import com.adobe.blobfs.storage.api.BlobStore;
import com.adobe.blobfs.storage.api.BlobStoreException;
import com.adobe.blobfs.storage.api.BlobType;
import com.adobe.blobfs.storage.api.ListingPage;

import com.azure.core.http.rest.PagedResponse;
import com.azure.core.util.polling.LongRunningOperationStatus;
import com.azure.core.util.polling.PollResponse;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.models.BlobCopyInfo;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobRange;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.models.ListBlobsOptions;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;

/**
 * Implementation of {@link BlobStore} backed by an Azure Storage blob container.
 * Whole-object writes use block blobs, chunked writes use append blobs.
 */
public class AzureBlobStore implements BlobStore {

  private static final Duration COPY_POLL_INTERVAL = Duration.ofSeconds(1);

  private static final Logger LOG = LoggerFactory.getLogger(AzureBlobStore.class);

  private final BlobContainerClient containerClient;
  // appended to copy source URLs, the service authorizes the source read with it
  private final Optional<String> sharedAccessSignature;

  public AzureBlobStore(BlobContainerClient containerClient) {
    this(containerClient, Optional.empty());
  }

  public AzureBlobStore(BlobContainerClient containerClient, Optional<String> sharedAccessSignature) {
    this.containerClient = Preconditions.checkNotNull(containerClient);
    this.sharedAccessSignature = Preconditions.checkNotNull(sharedAccessSignature);
  }

  @Override
  public byte[] get(String key) throws IOException {
    return execute(key, () -> blob(key).downloadContent().toBytes());
  }

  @Override
  public void put(String key, byte[] content) throws IOException {
    execute(key, () -> {
      blob(key).getBlockBlobClient().upload(new ByteArrayInputStream(content), content.length, true);
      return null;
    });
  }

  @Override
  public InputStream openRange(String key, long offset) throws IOException {
    return execute(key, () -> blob(key).openInputStream(new BlobRange(offset), null));
  }

  @Override
  public BlobProperties properties(String key) throws IOException {
    com.azure.storage.blob.models.BlobProperties properties = execute(key, () -> blob(key).getProperties());
    return BlobProperties.builder()
        .size(properties.getBlobSize())
        .lastModified(properties.getLastModified().toInstant())
        .blobType(toBlobType(properties.getBlobType()))
        .build();
  }

  @Override
  public boolean exists(String key) throws IOException {
    return execute(key, () -> Boolean.TRUE.equals(blob(key).exists()));
  }

  @Override
  public boolean deleteIfExists(String key) throws IOException {
    return execute(key, () -> blob(key).deleteIfExists());
  }

  @Override
  public void delete(String key) throws IOException {
    execute(key, () -> {
      blob(key).delete();
      return null;
    });
  }

  @Override
  public ListingPage listPage(String prefix, String marker, int maxResults) throws IOException {
    ListBlobsOptions options = new ListBlobsOptions()
        .setPrefix(prefix)
        .setMaxResultsPerPage(maxResults);
    try {
      Iterable<PagedResponse<BlobItem>> pages = Strings.isNullOrEmpty(marker)
          ? containerClient.listBlobs(options, null).iterableByPage()
          : containerClient.listBlobs(options, null).iterableByPage(marker);
      Iterator<PagedResponse<BlobItem>> iterator = pages.iterator();
      if (!iterator.hasNext()) {
        return ListingPage.builder().build();
      }

      PagedResponse<BlobItem> page = iterator.next();
      ListingPage.Builder builder = ListingPage.builder();
      for (BlobItem item : page.getValue()) {
        builder.addKeys(item.getName());
      }
      String nextMarker = Strings.emptyToNull(page.getContinuationToken());
      if (nextMarker != null) {
        builder.nextMarker(nextMarker);
      }
      return builder.build();
    } catch (BlobStorageException e) {
      throw new BlobStoreException("Failed to list prefix " + prefix, e);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  @Override
  public void createAppendable(String key) throws IOException {
    execute(key, () -> blob(key).getAppendBlobClient().create(true));
  }

  @Override
  public void appendChunk(String key, byte[] data, int offset, int length) throws IOException {
    execute(key, () -> blob(key).getAppendBlobClient()
        .appendBlock(new ByteArrayInputStream(data, offset, length), length));
  }

  @Override
  public void copy(String sourceKey, String destinationKey) throws IOException {
    String sourceUrl = copySourceUrl(blob(sourceKey).getBlobUrl());
    PollResponse<BlobCopyInfo> response = execute(sourceKey, () -> blob(destinationKey)
        .beginCopy(sourceUrl, COPY_POLL_INTERVAL)
        .waitForCompletion());
    if (response.getStatus() != LongRunningOperationStatus.SUCCESSFULLY_COMPLETED) {
      throw new BlobStoreException(String.format("Copy of %s to %s ended with status %s",
                                                 sourceKey, destinationKey, response.getStatus()));
    }
  }

  @Override
  public void createContainerIfAbsent() throws IOException {
    try {
      if (containerClient.createIfNotExists()) {
        LOG.info("Created container {}", containerClient.getBlobContainerName());
      }
    } catch (BlobStorageException e) {
      throw new BlobStoreException("Failed to create container " + containerClient.getBlobContainerName(), e);
    }
  }

  @Override
  public void close() {
    // the container client owns no resources of its own
  }

  private String copySourceUrl(String blobUrl) {
    if (!sharedAccessSignature.isPresent()) {
      return blobUrl;
    }
    return blobUrl + (blobUrl.indexOf('?') < 0 ? '?' : '&') + sharedAccessSignature.get();
  }

  private BlobClient blob(String key) {
    return containerClient.getBlobClient(key);
  }

  private static BlobType toBlobType(com.azure.storage.blob.models.BlobType blobType) {
    switch (blobType) {
      case APPEND_BLOB:
        return BlobType.APPEND;
      case PAGE_BLOB:
        return BlobType.PAGE;
      default:
        return BlobType.BLOCK;
    }
  }

  /**
   * Runs a SDK call, mapping 404 responses to {@link BlobNotFoundException} and every other
   * storage error to {@link BlobStoreException}.
   */
  private static <T> T execute(String key, AzureCall<T> call) throws IOException {
    try {
      return call.call();
    } catch (BlobStorageException e) {
      if (e.getStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
        throw new BlobNotFoundException(key, e);
      }
      throw new BlobStoreException(String.format("Request for %s failed with status %d", key, e.getStatusCode()), e);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  @FunctionalInterface
  private interface AzureCall<T> {
    T call();
  }
}
