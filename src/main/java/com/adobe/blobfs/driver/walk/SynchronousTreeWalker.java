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

package com.adobe.blobfs.driver.walk;

import com.adobe.blobfs.common.exceptions.PathNotFoundException;
import com.adobe.blobfs.driver.api.StorageDriver;
import com.adobe.blobfs.driver.api.VirtualEntry;

import com.google.common.base.Preconditions;
import com.google.common.collect.Ordering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.util.List;

/** Implements a synchronous depth first walk of the virtual tree. */
public class SynchronousTreeWalker {

  private static final Logger LOG = LoggerFactory.getLogger(SynchronousTreeWalker.class);

  private final StorageDriver driver;

  public SynchronousTreeWalker(StorageDriver driver) {
    this.driver = Preconditions.checkNotNull(driver);
  }

  /**
   * Visits every descendant of {@code root}, children in lexical order, parents before children.
   * The root itself is not visited.
   *
   * @return false if the visitor terminated the walk, true otherwise.
   * @throws IOException raised by the driver or the visitor, unchanged.
   */
  public boolean walk(String root, EntryVisitor visitor) throws IOException {
    return recursiveWalk(root, visitor);
  }

  private boolean recursiveWalk(String directory, EntryVisitor visitor) throws IOException {
    List<String> children = Ordering.natural().sortedCopy(driver.list(directory));

    for (String child : children) {
      VirtualEntry entry;
      try {
        entry = driver.stat(child);
      } catch (PathNotFoundException e) {
        LOG.debug("{} was removed while walking {}", child, directory);
        continue;
      }

      FileVisitResult result = visitor.visit(entry);
      if (result == FileVisitResult.TERMINATE) {
        return false;
      }
      if (result == FileVisitResult.SKIP_SIBLINGS) {
        return true;
      }
      if (entry.isDirectory() && result == FileVisitResult.CONTINUE && !recursiveWalk(child, visitor)) {
        return false;
      }
    }
    return true;
  }
}
