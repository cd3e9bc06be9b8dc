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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.util.Optional;

public class AzureBlobStoreConfiguration {

  public static final String CONNECTION_STRING = "blobfs.azure.connection.string";
  public static final String ACCOUNT_NAME = "blobfs.azure.account.name";
  public static final String ACCOUNT_KEY = "blobfs.azure.account.key";
  public static final String ENDPOINT = "blobfs.azure.endpoint";
  public static final String MAX_TRIES = "blobfs.azure.max.tries";
  public static final String TRY_TIMEOUT_SECONDS = "blobfs.azure.try.timeout.seconds";

  private static final String DEFAULT_ENDPOINT_FORMAT = "https://%s.blob.core.windows.net";
  private static final String SHARED_ACCESS_SIGNATURE = "SharedAccessSignature";

  private final DriverConfiguration configuration;

  public AzureBlobStoreConfiguration(DriverConfiguration configuration) {
    this.configuration = Preconditions.checkNotNull(configuration);
  }

  public String getContainer() {
    return configuration.getContainer();
  }

  /**
   * @return The connection string, when the store should be reached through one.
   */
  public Optional<String> getConnectionString() {
    return configuration.getOptionalString(CONNECTION_STRING);
  }

  /**
   * @return The SAS token carried by the connection string, without its leading '?'.
   */
  public Optional<String> getSharedAccessSignature() {
    return getConnectionString().flatMap(connectionString -> {
      for (String setting : Splitter.on(';').trimResults().omitEmptyStrings().split(connectionString)) {
        int separator = setting.indexOf('=');
        if (separator > 0 && SHARED_ACCESS_SIGNATURE.equalsIgnoreCase(setting.substring(0, separator))) {
          return Optional.ofNullable(Strings.emptyToNull(CharMatcher.is('?').trimLeadingFrom(setting.substring(separator + 1))));
        }
      }
      return Optional.empty();
    });
  }

  public String getAccountName() {
    return required(ACCOUNT_NAME);
  }

  public String getAccountKey() {
    return required(ACCOUNT_KEY);
  }

  public String getEndpoint() {
    return configuration.getOptionalString(ENDPOINT)
        .orElseGet(() -> String.format(DEFAULT_ENDPOINT_FORMAT, getAccountName()));
  }

  public int getMaxTries() {
    return configuration.getInt(MAX_TRIES, 4);
  }

  public int getTryTimeoutSeconds() {
    return configuration.getInt(TRY_TIMEOUT_SECONDS, 60);
  }

  private String required(String key) {
    return configuration.getOptionalString(key)
        .orElseThrow(() -> new IllegalStateException("No " + key + " parameter provided"));
  }
}
