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

import com.adobe.blobfs.driver.api.StorageDriver;
import com.adobe.blobfs.driver.api.VirtualEntry;
import com.github.rvesse.airline.annotations.Arguments;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.restrictions.Required;

import java.io.IOException;
import java.io.PrintStream;

@Command(name = "stat", description = "Print the type, size and modification time of a path")
public class StatCommand extends DriverCommand {

  @Arguments(title = "path", description = "File or directory")
  @Required
  private String path;

  @Override
  protected void execute(StorageDriver driver, PrintStream out) throws IOException {
    out.println(format(driver.stat(path)));
  }

  static String format(VirtualEntry entry) {
    if (entry.isDirectory()) {
      return entry.getPath() + "\tdirectory";
    }
    VirtualEntry.File file = entry.asFile();
    return String.format("%s\tfile\t%d\t%s", file.getPath(), file.getSize(), file.getModificationTime());
  }
}
