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

public class InvalidVirtualPathException extends IOException {

  private final String path;

  public InvalidVirtualPathException(String path) {
    super(String.format("Invalid path: %s", path));
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
