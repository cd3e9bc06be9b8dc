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

import com.google.common.base.Preconditions;

import org.immutables.value.Value;

import java.time.Instant;

/**
 * Properties of a single blob as reported by the {@link BlobStore}.
 */
@Value.Immutable
@Value.Style(strictBuilder = true, typeImmutable = "*")
public abstract class AbstractBlobProperties {

  /**
   * @return The blob size in bytes.
   */
  public abstract long getSize();

  public abstract Instant getLastModified();

  public abstract BlobType getBlobType();

  @Value.Check
  protected void validate() {
    Preconditions.checkState(getSize() >= 0);
  }
}
