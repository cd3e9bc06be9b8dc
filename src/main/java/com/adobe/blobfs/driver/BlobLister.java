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

import com.adobe.blobfs.storage.api.BlobStore;
import com.adobe.blobfs.storage.api.ListingContractViolationException;
import com.adobe.blobfs.storage.api.ListingPage;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds directory semantics on top of flat prefix listings.
 */
public class BlobLister {

  private static final Logger LOG = LoggerFactory.getLogger(BlobLister.class);

  private final BlobStore blobStore;
  private final PathMapper pathMapper;
  private final int pageSize;

  public BlobLister(BlobStore blobStore, PathMapper pathMapper, int pageSize) {
    this.blobStore = Preconditions.checkNotNull(blobStore);
    this.pathMapper = Preconditions.checkNotNull(pathMapper);
    Preconditions.checkArgument(pageSize > 0);
    this.pageSize = pageSize;
  }

  /**
   * Lists every blob below the given virtual directory, at any depth.
   *
   * @param virtualPath the directory to list, "" for the root.
   * @return virtual paths of all blobs under the directory.
   * @throws ListingContractViolationException if the backend repeats a continuation marker;
   *     the exception carries the paths listed until then.
   * @throws IOException in case of IO error.
   */
  public List<String> listBlobs(String virtualPath) throws IOException {
    String directory = virtualPath.isEmpty() ? VirtualPaths.ROOT : VirtualPaths.asDirectoryPrefix(virtualPath);
    ListingPages pages = pages(pathMapper.toBlobKey(directory));

    List<String> out = new ArrayList<>();
    try {
      for (ListingPage page : pages) {
        for (String key : page.getKeys()) {
          out.add(pathMapper.toVirtualPath(key));
        }
      }
    } catch (UncheckedIOException e) {
      if (e.getCause() instanceof ListingContractViolationException) {
        throw ((ListingContractViolationException) e.getCause()).withPartialResults(out);
      }
      throw e.getCause();
    }

    LOG.debug("Listed {} blobs under {}", out.size(), directory);
    return out;
  }

  public ListingPages pages(String keyPrefix) {
    return new ListingPages(blobStore, keyPrefix, pageSize);
  }

  /**
   * Finds the direct descendants (blobs or virtual directories) of a prefix among a collection of
   * blob paths. Paths must start with "/".
   * <p>
   * Example: direct descendants of "/" in {"/foo", "/bar/1", "/bar/2"} are {"/foo", "/bar"},
   * direct descendants of "/bar" are {"/bar/1", "/bar/2"}.
   */
  public static Set<String> directDescendants(Collection<String> paths, String prefix) {
    String directory = prefix.startsWith("/") ? prefix : "/" + prefix;
    directory = VirtualPaths.asDirectoryPrefix(directory);

    Set<String> out = new LinkedHashSet<>();
    for (String path : paths) {
      if (!path.startsWith(directory)) {
        continue;
      }
      String relative = path.substring(directory.length());
      int separator = relative.indexOf('/');
      if (separator < 0) {
        out.add(path);
      } else {
        out.add(directory + relative.substring(0, separator));
      }
    }
    return out;
  }
}
