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

import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * Lifecycle of a writer session: OPEN, then optionally COMMITTED or CANCELLED, then CLOSED.
 */
public enum WriterState {
  OPEN,
  COMMITTED,
  CANCELLED,
  CLOSED;

  private static final Table<WriterState, WriterOperation, WriterState> TRANSITIONS =
      ImmutableTable.<WriterState, WriterOperation, WriterState>builder()
          .put(OPEN, WriterOperation.WRITE, OPEN)
          .put(OPEN, WriterOperation.COMMIT, COMMITTED)
          .put(OPEN, WriterOperation.CANCEL, CANCELLED)
          .put(OPEN, WriterOperation.CLOSE, CLOSED)
          .put(COMMITTED, WriterOperation.CLOSE, CLOSED)
          .put(CANCELLED, WriterOperation.CLOSE, CLOSED)
          .build();

  public boolean permits(WriterOperation operation) {
    return TRANSITIONS.contains(this, operation);
  }

  /**
   * @return the state reached by applying {@code operation} in this state.
   * @throws WriterStateException if the operation is not allowed in this state.
   */
  public WriterState transition(WriterOperation operation) {
    WriterState next = TRANSITIONS.get(this, operation);
    if (next == null) {
      throw new WriterStateException(this, operation);
    }
    return next;
  }

  String displayName() {
    return name().toLowerCase();
  }
}
