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

import com.adobe.blobfs.common.configuration.DriverConfiguration;
import com.adobe.blobfs.storage.api.BlobStore;
import com.adobe.blobfs.storage.api.BlobStoreFactory;
import com.adobe.blobfs.storage.internal.exceptions.BlobStoreCreationException;

import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.common.StorageSharedKeyCredential;
import com.azure.storage.common.policy.RequestRetryOptions;
import com.azure.storage.common.policy.RetryPolicyType;
import com.google.common.annotations.VisibleForTesting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Factory for {@link AzureBlobStore}. The client is built either from a connection string or from
 * an account name and key; transport retries are delegated to the SDK retry policy.
 */
public class AzureBlobStoreFactory implements BlobStoreFactory {

  private static final Logger LOG = LoggerFactory.getLogger(AzureBlobStoreFactory.class);

  @Override
  public BlobStore create(DriverConfiguration configuration) {
    AzureBlobStoreConfiguration azureConfiguration = new AzureBlobStoreConfiguration(configuration);
    try {
      BlobServiceClient serviceClient = newClientBuilder(azureConfiguration).buildClient();
      LOG.info("Using container {} of {}", azureConfiguration.getContainer(), serviceClient.getAccountUrl());
      return new AzureBlobStore(serviceClient.getBlobContainerClient(azureConfiguration.getContainer()),
                                azureConfiguration.getSharedAccessSignature());
    } catch (Exception e) {
      throw new BlobStoreCreationException("Unable to create AzureBlobStore", e);
    }
  }

  @VisibleForTesting
  BlobServiceClientBuilder newClientBuilder(AzureBlobStoreConfiguration azureConfiguration) {
    RequestRetryOptions retryOptions = new RequestRetryOptions(RetryPolicyType.EXPONENTIAL,
                                                               azureConfiguration.getMaxTries(),
                                                               azureConfiguration.getTryTimeoutSeconds(),
                                                               null,
                                                               null,
                                                               null);
    BlobServiceClientBuilder builder = new BlobServiceClientBuilder().retryOptions(retryOptions);

    Optional<String> connectionString = azureConfiguration.getConnectionString();
    if (connectionString.isPresent()) {
      return builder.connectionString(connectionString.get());
    }
    return builder
        .endpoint(azureConfiguration.getEndpoint())
        .credential(new StorageSharedKeyCredential(azureConfiguration.getAccountName(),
                                                   azureConfiguration.getAccountKey()));
  }
}
