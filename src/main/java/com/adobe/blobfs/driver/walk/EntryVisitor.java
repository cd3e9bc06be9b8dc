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

import com.adobe.blobfs.driver.api.VirtualEntry;

import java.io.IOException;
import java.nio.file.FileVisitResult;

/**
 * Callback invoked for every entry reached by a walk.
 * <p>
 * {@link FileVisitResult#SKIP_SUBTREE} prevents descending into a directory,
 * {@link FileVisitResult#SKIP_SIBLINGS} ends the walk of the current directory and
 * {@link FileVisitResult#TERMINATE} stops the whole walk.
 */
@FunctionalInterface
public interface EntryVisitor {

  FileVisitResult visit(VirtualEntry entry) throws IOException;
}
