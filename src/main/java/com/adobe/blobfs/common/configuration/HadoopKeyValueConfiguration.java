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
import com.google.common.base.Strings;

import org.apache.hadoop.conf.Configuration;

import java.util.Optional;

/**
 * {@link KeyValueConfiguration} view over a Hadoop {@link Configuration}.
 */
public class HadoopKeyValueConfiguration implements KeyValueConfiguration {

  private final Configuration configuration;

  public HadoopKeyValueConfiguration(Configuration configuration) {
    this.configuration = Preconditions.checkNotNull(configuration);
  }

  @Override
  public int getInt(String key, int defaultValue) {
    return configuration.getInt(key, defaultValue);
  }

  @Override
  public long getLong(String key, long defaultValue) {
    return configuration.getLong(key, defaultValue);
  }

  @Override
  public String getString(String key, String defaultValue) {
    return configuration.get(key, defaultValue);
  }

  @Override
  public Optional<String> getOptionalString(String key) {
    return Optional.ofNullable(Strings.emptyToNull(configuration.get(key)));
  }

  @Override
  public String getString(String key) {
    return getOptionalString(key)
        .orElseThrow(() -> new IllegalArgumentException("No value configured for " + key));
  }
}
