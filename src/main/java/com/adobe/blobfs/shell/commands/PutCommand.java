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
import com.adobe.blobfs.writer.FileWriter;
import com.github.rvesse.airline.annotations.Arguments;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Command(
    name = "put",
    description = "Upload a local file. Command example: blobfs put --stream ./layer.tar /docker/blobs/layer")
public class PutCommand extends DriverCommand {

  private static final Logger LOG = LoggerFactory.getLogger(PutCommand.class);
  private static final int BUFFER_SIZE = 64 * 1024;

  @Arguments(title = {"source", "destination"}, description = "Local file and destination path")
  private List<String> paths = new ArrayList<>();

  @Option(name = "--stream", description = "Upload through a chunked writer session instead of a single put")
  private boolean stream;

  @Option(name = "--append", description = "Append to an existing file. Implies --stream")
  private boolean append;

  @Override
  protected void execute(StorageDriver driver, PrintStream out) throws IOException {
    Preconditions.checkArgument(paths.size() == 2, "Expected a source and a destination");
    java.nio.file.Path source = Paths.get(paths.get(0));
    String destination = paths.get(1);

    if (!stream && !append) {
      driver.putContent(destination, Files.readAllBytes(source));
      return;
    }

    FileWriter writer = driver.writer(destination, append);
    try (InputStream in = Files.newInputStream(source)) {
      byte[] buffer = new byte[BUFFER_SIZE];
      int read;
      while ((read = in.read(buffer)) != -1) {
        writer.write(buffer, 0, read);
      }
      writer.commit();
    } catch (IOException e) {
      LOG.warn("Upload of {} failed, cancelling", source);
      try {
        writer.cancel();
      } catch (IOException cancelFailure) {
        e.addSuppressed(cancelFailure);
      }
      throw e;
    } finally {
      writer.close();
    }
    LOG.info("Uploaded {} bytes to {}", writer.size(), destination);
  }
}
