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

package com.adobe.blobfs.shell;

import com.adobe.blobfs.shell.commands.CatCommand;
import com.adobe.blobfs.shell.commands.DeleteCommand;
import com.adobe.blobfs.shell.commands.ListCommand;
import com.adobe.blobfs.shell.commands.MoveCommand;
import com.adobe.blobfs.shell.commands.PutCommand;
import com.adobe.blobfs.shell.commands.StatCommand;
import com.adobe.blobfs.shell.commands.TreeCommand;
import com.github.rvesse.airline.annotations.Cli;
import com.github.rvesse.airline.help.Help;
import com.github.rvesse.airline.parser.errors.ParseException;
import org.apache.log4j.PropertyConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

@Cli(
    name = "blobfs",
    description = "blobfs cli",
    commands = {
        ListCommand.class,
        StatCommand.class,
        CatCommand.class,
        PutCommand.class,
        DeleteCommand.class,
        MoveCommand.class,
        TreeCommand.class,
        Help.class
    })
public class BlobFsCli {
  private static final Logger LOG = LoggerFactory.getLogger(BlobFsCli.class);

  public static void main(String[] args) throws IOException {
    try (InputStream is = ClassLoader.getSystemResourceAsStream("conf/blobfs_cli.log4j.properties")) {
      if (is != null) {
        PropertyConfigurator.configure(is);
      }
    }
    System.exit(execute(args));
  }

  /**
   * Parses and runs a command line.
   * @return the process exit status.
   */
  static int execute(String[] args) {
    com.github.rvesse.airline.Cli<Runnable> cli =
        new com.github.rvesse.airline.Cli<>(BlobFsCli.class);
    CliHelper cliHelper = new CliHelper();
    Optional<? extends Runnable> cmd = cliHelper.parseCli(cli, args);
    if (!cmd.isPresent()) {
      LOG.info("Parsing failed. Early exit.");
      return CommandStatus.FAILED.getStatus();
    }
    CommandStatus cmdStatus = cliHelper.executeCmd(cmd.get());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Exiting with Code {}", cmdStatus.getStatus());
    }
    return cmdStatus.getStatus();
  }

  private enum CommandStatus {
    SUCCESSFUL(0),
    FAILED(1);

    private final int status;

    CommandStatus(int status) {
      this.status = status;
    }

    public int getStatus() {
      return status;
    }
  }

  private static class CliHelper {
    private <T extends Runnable> Optional<T> parseCli(
        com.github.rvesse.airline.Cli<T> cli, String[] args) {
      try {
        return Optional.ofNullable(cli.parse(args));
      } catch (ParseException pe) {
        LOG.error("Parse error: ", pe);
      } catch (Exception e) {
        LOG.error("Unexpected error: ", e);
      }
      return Optional.empty();
    }

    /**
     * @return CommandStatus enum which holds the status of running cmd
     */
    private <T extends Runnable> CommandStatus executeCmd(T cmd) {
      try {
        cmd.run();
        return CommandStatus.SUCCESSFUL;
      } catch (Exception e) {
        LOG.error("Command threw error: ", e);
      }
      return CommandStatus.FAILED;
    }
  }
}
