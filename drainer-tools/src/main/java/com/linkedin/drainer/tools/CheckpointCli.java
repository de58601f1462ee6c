/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.tools;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

import org.apache.commons.cli.BasicParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.linkedin.drainer.checkpoint.Checkpoint;
import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.provider.CheckpointProviders;
import com.linkedin.drainer.common.DrainerRuntimeException;

/**
 * The main class containing the entry point of the checkpoint command line utility. Reads the stored checkpoint of
 * a drainer or overwrites it, e.g. to make a drainer resume from a chosen commit ts.
 */
public class CheckpointCli {

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILURE = 2;

  private CheckpointCli() {
  }

  private enum Operation {
    READ,
    WRITE
  }

  private static Options buildOptions() {
    Options options = new Options();
    options.addOption(OptionUtils.createOption(OptionConstants.OPT_SHORT_TYPE, OptionConstants.OPT_LONG_TYPE,
        OptionConstants.OPT_ARG_TYPE, true, OptionConstants.OPT_DESC_TYPE));
    options.addOption(OptionUtils.createOption(OptionConstants.OPT_SHORT_CONFIG, OptionConstants.OPT_LONG_CONFIG,
        OptionConstants.OPT_ARG_CONFIG, true, OptionConstants.OPT_DESC_CONFIG));
    options.addOption(OptionUtils.createOption(OptionConstants.OPT_SHORT_OPERATION, OptionConstants.OPT_LONG_OPERATION,
        OptionConstants.OPT_ARG_OPERATION, true, OptionConstants.OPT_DESC_OPERATION));
    options.addOption(OptionUtils.createOption(OptionConstants.OPT_SHORT_COMMIT_TS, OptionConstants.OPT_LONG_COMMIT_TS,
        OptionConstants.OPT_ARG_COMMIT_TS, false, OptionConstants.OPT_DESC_COMMIT_TS));
    options.addOption(OptionUtils.createOption(OptionConstants.OPT_SHORT_HELP, OptionConstants.OPT_LONG_HELP, null,
        false, OptionConstants.OPT_DESC_HELP));
    return options;
  }

  private static void printHelp(Options options, PrintStream out) {
    PrintWriter writer = new PrintWriter(out);
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "CheckpointCli",
        "Console app to read or overwrite drainer checkpoints.", options, HelpFormatter.DEFAULT_LEFT_PAD,
        HelpFormatter.DEFAULT_DESC_PAD, "", true);
    writer.flush();
  }

  /**
   * The entry point of the checkpoint command line utility
   */
  public static void main(String[] args) {
    int exitCode = run(args, System.out);
    if (exitCode != EXIT_OK) {
      System.exit(exitCode);
    }
  }

  /**
   * Run the utility, printing to {@code out}.
   * @return the process exit code
   */
  static int run(String[] args, PrintStream out) {
    Options options = buildOptions();
    for (String arg : args) {
      if (arg.equals("-" + OptionConstants.OPT_SHORT_HELP) || arg.equals("--" + OptionConstants.OPT_LONG_HELP)) {
        printHelp(options, out);
        return EXIT_OK;
      }
    }

    CommandLineParser parser = new BasicParser();
    CommandLine cmd;
    Operation op;
    long commitTs = 0;
    try {
      cmd = parser.parse(options, args);
      op = Operation.valueOf(cmd.getOptionValue(OptionConstants.OPT_SHORT_OPERATION).toUpperCase(Locale.ROOT));
      if (op == Operation.WRITE) {
        if (!cmd.hasOption(OptionConstants.OPT_SHORT_COMMIT_TS)) {
          throw new ParseException(
              String.format("Required option: %s is not passed", OptionConstants.OPT_LONG_COMMIT_TS));
        }
        commitTs = Long.parseLong(cmd.getOptionValue(OptionConstants.OPT_SHORT_COMMIT_TS).trim());
      }
    } catch (ParseException | IllegalArgumentException e) {
      out.println("Failed to parse the arguments. " + e.getMessage());
      printHelp(options, out);
      return EXIT_USAGE;
    }

    String typeName = cmd.getOptionValue(OptionConstants.OPT_SHORT_TYPE);
    try (Checkpoint checkpoint = CheckpointProviders.newCheckpoint(typeName,
        loadConfig(cmd.getOptionValue(OptionConstants.OPT_SHORT_CONFIG)))) {
      checkpoint.load();
      switch (op) {
        case READ:
          out.println(checkpoint);
          break;
        case WRITE:
          out.println("Current checkpoint: " + checkpoint);
          checkpoint.save(commitTs);
          out.println("Saved checkpoint: " + checkpoint);
          break;
        default:
          throw new IllegalStateException("unhandled operation " + op);
      }
    } catch (DrainerRuntimeException | IllegalArgumentException e) {
      out.println(e.toString());
      return EXIT_FAILURE;
    }
    return EXIT_OK;
  }

  private static CheckpointConfig loadConfig(String path) {
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)) {
      props.load(reader);
    } catch (IOException e) {
      throw new DrainerRuntimeException("Failed to read config file " + path, e);
    }
    return CheckpointConfig.fromDrainerProperties(props);
  }
}
