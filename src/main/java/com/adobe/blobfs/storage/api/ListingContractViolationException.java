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

package com.adobe.blobfs.storage.api;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when a paginated listing hands back a continuation marker that was already used.
 * Carries whatever was listed before the violation was detected.
 */
public class ListingContractViolationException extends BlobStoreException {

  private final String prefix;
  private final String marker;
  private final List<String> partialResults;

  public ListingContractViolationException(String prefix, String marker) {
    this(prefix, marker, ImmutableList.of());
  }

  public ListingContractViolationException(String prefix, String marker, List<String> partialResults) {
    super(String.format("Listing of prefix '%s' returned repeated continuation marker '%s'", prefix, marker));
    this.prefix = prefix;
    this.marker = marker;
    this.partialResults = ImmutableList.copyOf(partialResults);
  }

  public ListingContractViolationException withPartialResults(List<String> results) {
    ListingContractViolationException withResults = new ListingContractViolationException(prefix, marker, results);
    withResults.setStackTrace(getStackTrace());
    return withResults;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getMarker() {
    return marker;
  }

  public List<String> getPartialResults() {
    return partialResults;
  }
}
