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

package com.adobe.blobfs.common;

import com.google.common.base.Preconditions;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * Helper used to instantiate types bound dynamically in the Hadoop config.
 * Instances implementing {@link org.apache.hadoop.conf.Configurable} receive the configuration.
 */
public class ImplementationResolver {

  private final Configuration configuration;

  public ImplementationResolver(Configuration configuration) {
    this.configuration = Preconditions.checkNotNull(configuration);
  }

  /**
   * @param key Configuration key holding the fully qualified class name.
   * @param defaultImplementation Used when the key is not set.
   * @param contract The type the configured class must implement.
   * @throws RuntimeException if the configured class cannot be loaded or does not implement {@code contract}.
   */
  public <T> T resolve(String key, Class<? extends T> defaultImplementation, Class<T> contract) {
    Class<? extends T> type = configuration.getClass(key, defaultImplementation, contract);
    Preconditions.checkArgument(type != null, "No implementation bound to %s", key);
    return ReflectionUtils.newInstance(type, configuration);
  }
}
