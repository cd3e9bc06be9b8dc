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

package com.adobe.blobfs.common.exceptions;

import java.io.IOException;

/**
 * Thrown when a whole-object upload is larger than what the backend accepts in a single call.
 * Raised before any request is sent.
 */
public class SizeLimitExceededException extends IOException {

  private final long size;
  private final long limit;

  public SizeLimitExceededException(String path, long size, long limit) {
    super(String.format("Uploading %d bytes to %s in a single call is not supported; limit: %d bytes",
                        size, path, limit));
    this.size = size;
    this.limit = limit;
  }

  public long getSize() {
    return size;
  }

  public long getLimit() {
    return limit;
  }
}
