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
 * Implementation of {@link KeyValueConfiguration} that looks up keys carrying a specific suffix
 * (e.g. {@code blobfs.root.directory.<container>}).
 */
public class FilteringKeyValueConfiguration implements KeyValueConfiguration {

  private final KeyValueConfiguration keyValueConfiguration;
  private final String filter;

  public FilteringKeyValueConfiguration(KeyValueConfiguration keyValueConfiguration, String filter) {
    this.keyValueConfiguration = Preconditions.checkNotNull(keyValueConfiguration);
    this.filter = Preconditions.checkNotNull(filter);
  }

  @Override
  public int getInt(String key, int defaultValue) {
    return keyValueConfiguration.getInt(appendFilter(key), defaultValue);
  }

  @Override
  public long getLong(String key, long defaultValue) {
    return keyValueConfiguration.getLong(appendFilter(key), defaultValue);
  }

  @Override
  public String getString(String key, String defaultValue) {
    return keyValueConfiguration.getString(appendFilter(key), defaultValue);
  }

  @Override
  public Optional<String> getOptionalString(String key) {
    return keyValueConfiguration.getOptionalString(appendFilter(key));
  }

  @Override
  public String getString(String key) {
    return keyValueConfiguration.getString(appendFilter(key));
  }

  private String appendFilter(String propName) {
    return propName + "." + filter;
  }
}
