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

import java.io.FileNotFoundException;

public class BlobNotFoundException extends FileNotFoundException {

  private final String key;

  public BlobNotFoundException(String key) {
    super("Blob not found: " + key);
    this.key = key;
  }

  public BlobNotFoundException(String key, Throwable cause) {
    this(key);
    initCause(cause);
  }

  public String getKey() {
    return key;
  }
}
