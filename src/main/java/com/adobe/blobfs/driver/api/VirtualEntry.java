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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a stat call: either a {@link File} backed by a blob or a synthetic {@link Directory}
 * inferred from blobs sharing the path as a prefix. Directories carry no metadata.
 */
public abstract class VirtualEntry {

  private final String path;

  private VirtualEntry(String path) {
    this.path = Preconditions.checkNotNull(path);
  }

  public static File file(String path, long size, Instant modificationTime) {
    return new File(path, size, modificationTime);
  }

  public static Directory directory(String path) {
    return new Directory(path);
  }

  public String getPath() {
    return path;
  }

  public abstract boolean isDirectory();

  /**
   * @throws IllegalStateException if this entry is a directory.
   */
  public File asFile() {
    if (isDirectory()) {
      throw new IllegalStateException(path + " is a directory");
    }
    return (File) this;
  }

  public static final class File extends VirtualEntry {

    private final long size;
    private final Instant modificationTime;

    private File(String path, long size, Instant modificationTime) {
      super(path);
      Preconditions.checkArgument(size >= 0);
      this.size = size;
      this.modificationTime = Preconditions.checkNotNull(modificationTime);
    }

    public long getSize() {
      return size;
    }

    public Instant getModificationTime() {
      return modificationTime;
    }

    @Override
    public boolean isDirectory() {
      return false;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof File)) {
        return false;
      }
      File other = (File) o;
      return getPath().equals(other.getPath())
          && size == other.size
          && modificationTime.equals(other.modificationTime);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getPath(), size, modificationTime);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("File")
          .add("path", getPath())
          .add("size", size)
          .add("modificationTime", modificationTime)
          .toString();
    }
  }

  public static final class Directory extends VirtualEntry {

    private Directory(String path) {
      super(path);
    }

    @Override
    public boolean isDirectory() {
      return true;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Directory && getPath().equals(((Directory) o).getPath());
    }

    @Override
    public int hashCode() {
      return getPath().hashCode();
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("Directory").add("path", getPath()).toString();
    }
  }
}
