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

package com.adobe.blobfs.common.configuration;

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Provides configuration information for a specific driver instance.
 * Every key can be overridden for a single container by suffixing it with the container name,
 * e.g. {@code blobfs.root.directory.registry} wins over {@code blobfs.root.directory}.
 */
public class DriverConfiguration {

  public static final String CONTAINER = "blobfs.container";
  public static final String ROOT_DIRECTORY = "blobfs.root.directory";
  public static final String MAX_CHUNK_SIZE = "blobfs.writer.max.chunk.size";
  public static final String MAX_PUT_SIZE = "blobfs.put.max.size";
  public static final String LIST_PAGE_SIZE = "blobfs.list.page.size";
  public static final String STAT_PAGE_SIZE = "blobfs.stat.page.size";
  public static final String STORAGE_FACTORY_CLASS = "blobfs.storage.factory.class";

  public static final int DEFAULT_MAX_CHUNK_SIZE = 4 * 1024 * 1024;
  // max size for block blobs uploaded via a single "Put Blob" call
  public static final long DEFAULT_MAX_PUT_SIZE = 256L * 1024 * 1024;
  public static final int DEFAULT_LIST_PAGE_SIZE = 5000;
  public static final int DEFAULT_STAT_PAGE_SIZE = 1;

  private final String container;
  private final KeyValueConfiguration globalConfiguration;
  private final KeyValueConfiguration containerAwareConfiguration;

  public DriverConfiguration(KeyValueConfiguration keyValueConfiguration) {
    this.globalConfiguration = Preconditions.checkNotNull(keyValueConfiguration);
    this.container = keyValueConfiguration.getString(CONTAINER);
    this.containerAwareConfiguration = new FilteringKeyValueConfiguration(keyValueConfiguration, container);
  }

  public String getContainer() {
    return container;
  }

  public String getRootDirectory() {
    return getString(ROOT_DIRECTORY, "");
  }

  public int getMaxChunkSize() {
    return positive(MAX_CHUNK_SIZE, getInt(MAX_CHUNK_SIZE, DEFAULT_MAX_CHUNK_SIZE));
  }

  public long getMaxPutSize() {
    long value = getLong(MAX_PUT_SIZE, DEFAULT_MAX_PUT_SIZE);
    Preconditions.checkState(value > 0, "%s must be positive but was %s", MAX_PUT_SIZE, value);
    return value;
  }

  public int getListPageSize() {
    return positive(LIST_PAGE_SIZE, getInt(LIST_PAGE_SIZE, DEFAULT_LIST_PAGE_SIZE));
  }

  public int getStatPageSize() {
    return positive(STAT_PAGE_SIZE, getInt(STAT_PAGE_SIZE, DEFAULT_STAT_PAGE_SIZE));
  }

  public int getInt(String key, int defaultValue) {
    return containerAwareConfiguration.getInt(key, globalConfiguration.getInt(key, defaultValue));
  }

  public long getLong(String key, long defaultValue) {
    return containerAwareConfiguration.getLong(key, globalConfiguration.getLong(key, defaultValue));
  }

  public String getString(String key, String defaultValue) {
    return getOptionalString(key).orElse(defaultValue);
  }

  public Optional<String> getOptionalString(String key) {
    Optional<String> containerValue = containerAwareConfiguration.getOptionalString(key);
    return containerValue.isPresent() ? containerValue : globalConfiguration.getOptionalString(key);
  }

  private static int positive(String key, int value) {
    Preconditions.checkState(value > 0, "%s must be positive but was %s", key, value);
    return value;
  }
}
