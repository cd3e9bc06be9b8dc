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

package com.adobe.blobfs.shell.commands;

import com.adobe.blobfs.driver.VirtualPaths;
import com.adobe.blobfs.driver.api.StorageDriver;
import com.adobe.blobfs.driver.api.VirtualEntry;
import com.github.rvesse.airline.annotations.Arguments;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileVisitResult;

@Command(name = "tree", description = "Print the tree below a directory, one entry per line")
public class TreeCommand extends DriverCommand {

  private static final CharMatcher SEPARATOR = CharMatcher.is('/');

  @Arguments(title = "path", description = "Directory to walk, defaults to /")
  private String path = VirtualPaths.ROOT;

  @Option(name = "--max-depth", description = "Do not descend more than this many levels, 0 for no limit")
  private int maxDepth = 0;

  @Override
  protected void execute(StorageDriver driver, PrintStream out) throws IOException {
    int rootDepth = depth(path);
    driver.walk(path, entry -> {
      int level = depth(entry.getPath()) - rootDepth;
      out.println(Strings.repeat("  ", level - 1) + describe(entry));
      if (entry.isDirectory() && maxDepth > 0 && level >= maxDepth) {
        return FileVisitResult.SKIP_SUBTREE;
      }
      return FileVisitResult.CONTINUE;
    });
  }

  private static String describe(VirtualEntry entry) {
    String name = entry.getPath().substring(entry.getPath().lastIndexOf('/') + 1);
    return entry.isDirectory() ? name + "/" : name + " (" + entry.asFile().getSize() + ")";
  }

  private static int depth(String path) {
    return SEPARATOR.countIn(SEPARATOR.trimTrailingFrom(path));
  }
}
