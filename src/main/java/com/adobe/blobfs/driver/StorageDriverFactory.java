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

import com.adobe.blobfs.common.ImplementationResolver;
import com.adobe.blobfs.common.configuration.DriverConfiguration;
import com.adobe.blobfs.common.configuration.HadoopKeyValueConfiguration;
import com.adobe.blobfs.driver.api.StorageDriver;
import com.adobe.blobfs.storage.api.BlobStore;
import com.adobe.blobfs.storage.api.BlobStoreFactory;
import com.adobe.blobfs.storage.internal.AzureBlobStoreFactory;

import com.google.common.base.Preconditions;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Builds {@link StorageDriver} instances from a Hadoop configuration.
 * The blob store implementation is bound through {@link DriverConfiguration#STORAGE_FACTORY_CLASS}.
 */
public final class StorageDriverFactory {

  private static final Logger LOG = LoggerFactory.getLogger(StorageDriverFactory.class);

  private StorageDriverFactory() {
    // no instances
  }

  public static StorageDriver create(Configuration hadoopConfiguration) throws IOException {
    Preconditions.checkNotNull(hadoopConfiguration);
    DriverConfiguration configuration =
        new DriverConfiguration(new HadoopKeyValueConfiguration(hadoopConfiguration));

    BlobStoreFactory blobStoreFactory = new ImplementationResolver(hadoopConfiguration)
        .resolve(DriverConfiguration.STORAGE_FACTORY_CLASS, AzureBlobStoreFactory.class, BlobStoreFactory.class);
    BlobStore blobStore = blobStoreFactory.create(configuration);
    try {
      blobStore.createContainerIfAbsent();
    } catch (IOException e) {
      blobStore.close();
      throw e;
    }

    LOG.info("Created driver for container {} with root directory '{}'",
             configuration.getContainer(), configuration.getRootDirectory());
    return new BlobStorageDriver(blobStore, configuration);
  }
}
