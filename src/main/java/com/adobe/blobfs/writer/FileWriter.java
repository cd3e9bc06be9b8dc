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

import java.io.Closeable;
import java.io.IOException;

/**
 * A resumable write session on a single file.
 * <p>
 * Data is durable only after {@link #commit()}; {@link #cancel()} discards the file.
 * Either way the session must be closed. Sessions are not safe for concurrent use.
 */
public interface FileWriter extends Closeable {

  /**
   * @throws WriterStateException if the session is no longer open.
   * @throws IOException in case of IO error. Bytes appended before the failure count towards {@link #size()}.
   */
  void write(byte[] data, int offset, int length) throws IOException;

  /**
   * @return bytes accepted so far, durable or buffered, including the size the session resumed from.
   */
  long size();

  /**
   * Flushes all buffered data. A failed flush leaves the session open.
   * @throws WriterStateException if the session is no longer open.
   * @throws IOException in case of IO error.
   */
  void commit() throws IOException;

  /**
   * Discards buffered data and deletes the file.
   * @throws WriterStateException if the session is no longer open.
   * @throws IOException in case of IO error.
   */
  void cancel() throws IOException;

  WriterState state();
}
