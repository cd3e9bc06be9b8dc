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

package com.adobe.blobfs.writer;

import java.io.IOException;

/**
 * Raised when appending a chunk fails. Chunks appended before the failure are durable.
 */
public class ChunkAppendException extends IOException {

  private final String key;
  private final long bytesAppended;

  public ChunkAppendException(String key, long bytesAppended, Throwable cause) {
    super(String.format("Append to %s failed after %d bytes", key, bytesAppended), cause);
    this.key = key;
    this.bytesAppended = bytesAppended;
  }

  public String getKey() {
    return key;
  }

  public long getBytesAppended() {
    return bytesAppended;
  }
}
