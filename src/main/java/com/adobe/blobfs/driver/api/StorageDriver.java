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

package com.adobe.blobfs.driver.api;

import com.adobe.blobfs.driver.walk.EntryVisitor;
import com.adobe.blobfs.writer.FileWriter;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Hierarchical filesystem view over a flat blob store.
 * <p>
 * Paths are absolute, "/" separated, with components made of letters, digits, '.', '_' and '-'.
 * Directories do not exist on their own: a directory is any path that prefixes at least one blob.
 * Missing paths are reported with {@link com.adobe.blobfs.common.exceptions.PathNotFoundException}.
 */
public interface StorageDriver extends Closeable {

  /**
   * @return the name of the driver, used for display.
   */
  String name();

  /**
   * Reads the whole content of a file.
   * @param path
   * @throws IOException in case of IO error.
   */
  byte[] getContent(String path) throws IOException;

  /**
   * Stores the whole content of a file in a single backend call, replacing any previous content.
   * @param path
   * @param content
   * @throws com.adobe.blobfs.common.exceptions.SizeLimitExceededException if the content exceeds the
   *     configured single call limit.
   * @throws IOException in case of IO error.
   */
  void putContent(String path, byte[] content) throws IOException;

  /**
   * Opens a file for reading from the given offset. Offsets at or past the end yield an empty stream.
   * @param path
   * @param offset
   * @throws IOException in case of IO error.
   */
  InputStream reader(String path, long offset) throws IOException;

  /**
   * Opens a resumable writer session on a file.
   * @param path
   * @param append continue an existing file instead of truncating it. The file must exist.
   * @throws IOException in case of IO error.
   */
  FileWriter writer(String path, boolean append) throws IOException;

  /**
   * @param path a file, a directory or "/".
   * @return the file's metadata or a directory marker.
   * @throws IOException in case of IO error.
   */
  VirtualEntry stat(String path) throws IOException;

  /**
   * Lists the direct children of a directory.
   * @param path a directory or "/".
   * @return sorted absolute paths of the children.
   * @throws IOException in case of IO error.
   */
  List<String> list(String path) throws IOException;

  /**
   * Moves a file. Not atomic: the destination may exist alongside the source if the final delete fails.
   * @param sourcePath
   * @param destinationPath
   * @throws IOException in case of IO error.
   */
  void move(String sourcePath, String destinationPath) throws IOException;

  /**
   * Deletes a file or, recursively, a directory.
   * @param path
   * @throws IOException in case of IO error.
   */
  void delete(String path) throws IOException;

  /**
   * Walks the tree below {@code path} depth first.
   * @param path a directory or "/".
   * @param visitor
   * @throws IOException in case of IO error.
   */
  void walk(String path, EntryVisitor visitor) throws IOException;
}
