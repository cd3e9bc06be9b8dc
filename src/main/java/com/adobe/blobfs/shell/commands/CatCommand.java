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
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.annotations.restrictions.Required;
import com.google.common.io.ByteStreams;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;

@Command(name = "cat", description = "Print the content of a file")
public class CatCommand extends DriverCommand {

  @Arguments(title = "path", description = "File to print")
  @Required
  private String path;

  @Option(name = "--offset", description = "Byte offset to start reading from")
  private long offset = 0;

  @Override
  protected void execute(StorageDriver driver, PrintStream out) throws IOException {
    try (InputStream in = driver.reader(path, offset)) {
      ByteStreams.copy(in, out);
    }
  }
}
