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
import com.github.rvesse.airline.annotations.Arguments;
import com.github.rvesse.airline.annotations.Command;

import java.io.IOException;
import java.io.PrintStream;

@Command(
    name = "ls",
    description = "List the direct children of a directory. Command example: blobfs ls -D blobfs.container=registry /docker")
public class ListCommand extends DriverCommand {

  @Arguments(title = "path", description = "Directory to list, defaults to /")
  private String path = "/";

  @Override
  protected void execute(StorageDriver driver, PrintStream out) throws IOException {
    for (String child : driver.list(path)) {
      out.println(child);
    }
  }
}
