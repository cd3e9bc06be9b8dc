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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * Translates virtual paths ("/a/b") to blob keys under a configured root directory and back.
 */
public class PathMapper {

  private static final CharMatcher SEPARATOR = CharMatcher.is('/');

  private final String rootDirectory;
  private final String rootPrefix;
  // with an empty root prefix there is nothing to strip, but listed keys still need a leading separator
  private final String rootReplacement;

  public PathMapper(String rootDirectory) {
    this.rootDirectory = Preconditions.checkNotNull(rootDirectory);
    this.rootPrefix = toBlobKey("");
    this.rootReplacement = rootPrefix.isEmpty() ? "/" : "";
  }

  /**
   * @return The blob key for the given virtual path, e.g. "/x" maps to "root/x", or to "x" for an empty root.
   */
  public String toBlobKey(String virtualPath) {
    return SEPARATOR.trimLeadingFrom(SEPARATOR.trimTrailingFrom(rootDirectory) + virtualPath);
  }

  /**
   * Inverse of {@link #toBlobKey(String)} for keys returned by a listing.
   */
  public String toVirtualPath(String blobKey) {
    int index = blobKey.indexOf(rootPrefix);
    if (index < 0) {
      return blobKey;
    }
    return blobKey.substring(0, index) + rootReplacement + blobKey.substring(index + rootPrefix.length());
  }
}
