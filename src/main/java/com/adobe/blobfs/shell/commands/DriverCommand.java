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

import com.adobe.blobfs.driver.StorageDriverFactory;
import com.adobe.blobfs.driver.api.StorageDriver;
import com.github.rvesse.airline.annotations.Option;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for commands operating on a {@link StorageDriver} built from the command line configuration.
 */
public abstract class DriverCommand implements Runnable {

  @Option(
      name = "--conf",
      description = "Hadoop XML configuration file. May be repeated, later files win")
  private List<String> configurationFiles = new ArrayList<>();

  @Option(
      name = "-D",
      description = "Configuration override in the form key=value. May be repeated")
  private List<String> overrides = new ArrayList<>();

  @Override
  public void run() {
    try (StorageDriver driver = StorageDriverFactory.create(configuration())) {
      execute(driver, System.out);
      System.out.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  protected abstract void execute(StorageDriver driver, PrintStream out) throws IOException;

  @VisibleForTesting
  Configuration configuration() {
    Configuration configuration = new Configuration(true);
    for (String file : configurationFiles) {
      configuration.addResource(new Path(file));
    }
    for (String override : overrides) {
      int separator = override.indexOf('=');
      Preconditions.checkArgument(separator > 0, "Expected key=value but got %s", override);
      configuration.set(override.substring(0, separator), override.substring(separator + 1));
    }
    return configuration;
  }
}
