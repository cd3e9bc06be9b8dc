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
import com.github.rvesse.airline.annotations.restrictions.Required;

import java.io.IOException;
import java.io.PrintStream;

@Command(name = "rm", description = "Delete a file, or a directory with everything below it")
public class DeleteCommand extends DriverCommand {

  @Arguments(title = "path", description = "File or directory to delete")
  @Required
  private String path;

  @Override
  protected void execute(StorageDriver driver, PrintStream out) throws IOException {
    driver.delete(path);
  }
}
