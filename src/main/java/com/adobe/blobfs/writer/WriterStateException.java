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

/**
 * Raised when a writer operation is not allowed in the session's current state.
 */
public class WriterStateException extends IllegalStateException {

  private final WriterState state;
  private final WriterOperation operation;

  public WriterStateException(WriterState state, WriterOperation operation) {
    super(String.format("Cannot %s: writer already %s", operation.displayName(), state.displayName()));
    this.state = state;
    this.operation = operation;
  }

  public WriterState getState() {
    return state;
  }

  public WriterOperation getOperation() {
    return operation;
  }
}
