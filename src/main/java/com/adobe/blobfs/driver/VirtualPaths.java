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

package com.adobe.blobfs.driver;

import com.adobe.blobfs.common.exceptions.InvalidVirtualPathException;

import java.util.regex.Pattern;

public final class VirtualPaths {

  public static final String ROOT = "/";

  private static final Pattern VALID_PATH = Pattern.compile("^(/[A-Za-z0-9._-]+)+$");

  private VirtualPaths() {}

  public static boolean isValid(String path) {
    return path != null && VALID_PATH.matcher(path).matches();
  }

  public static String checkValid(String path) throws InvalidVirtualPathException {
    if (!isValid(path)) {
      throw new InvalidVirtualPathException(path);
    }
    return path;
  }

  /**
   * Same as {@link #checkValid(String)} but also accepts the root path.
   */
  public static String checkValidOrRoot(String path) throws InvalidVirtualPathException {
    if (ROOT.equals(path)) {
      return path;
    }
    return checkValid(path);
  }

  /**
   * Appends a trailing separator unless the path is empty or already ends with one.
   */
  public static String asDirectoryPrefix(String path) {
    if (path.isEmpty() || path.endsWith("/")) {
      return path;
    }
    return path + "/";
  }
}
