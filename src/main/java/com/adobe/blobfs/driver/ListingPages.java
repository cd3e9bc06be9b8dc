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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lazy sequence of listing pages for a key prefix. Pages are fetched one at a time, as the iterator advances.
 * Every call to {@link #iterator()} restarts the listing from the first page.
 * <p>
 * Backend failures surface as {@link UncheckedIOException}. A continuation marker that was already used
 * ends the iteration with a {@link ListingContractViolationException} as cause.
 */
public class ListingPages implements Iterable<ListingPage> {

  private final BlobStore blobStore;
  private final String prefix;
  private final int pageSize;

  public ListingPages(BlobStore blobStore, String prefix, int pageSize) {
    this.blobStore = Preconditions.checkNotNull(blobStore);
    this.prefix = Preconditions.checkNotNull(prefix);
    Preconditions.checkArgument(pageSize > 0);
    this.pageSize = pageSize;
  }

  @Override
  public Iterator<ListingPage> iterator() {
    return new PageIterator();
  }

  private class PageIterator implements Iterator<ListingPage> {

    private final Set<String> usedMarkers = new HashSet<>();
    private ListingPage currentPage;

    @Override
    public boolean hasNext() {
      return currentPage == null || !currentPage.isLastPage();
    }

    @Override
    public ListingPage next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }

      String marker = currentPage == null ? null : currentPage.getNextMarker().get();
      if (marker != null && !usedMarkers.add(marker)) {
        throw new UncheckedIOException(new ListingContractViolationException(prefix, marker));
      }

      try {
        currentPage = blobStore.listPage(prefix, marker, pageSize);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return currentPage;
    }
  }
}
