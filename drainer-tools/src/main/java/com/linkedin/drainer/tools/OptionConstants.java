/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.tools;

/**
 * String constants for options used with {@link CheckpointCli}
 */
public final class OptionConstants {

  private OptionConstants() {
  }

  public static final String OPT_SHORT_TYPE = "t";
  public static final String OPT_LONG_TYPE = "type";
  public static final String OPT_ARG_TYPE = "CHECKPOINT_TYPE";
  public static final String OPT_DESC_TYPE = "Checkpoint type, one of [mysql, tidb, file, kafka, flash]";

  public static final String OPT_SHORT_CONFIG = "c";
  public static final String OPT_LONG_CONFIG = "config";
  public static final String OPT_ARG_CONFIG = "CONFIG_FILE";
  public static final String OPT_DESC_CONFIG = "Drainer properties file holding the checkpoint.* properties";

  public static final String OPT_SHORT_OPERATION = "o";
  public static final String OPT_LONG_OPERATION = "operation";
  public static final String OPT_ARG_OPERATION = "CHECKPOINT_OPERATION";
  public static final String OPT_DESC_OPERATION = "Operation to perform accepted values [READ, WRITE]";

  public static final String OPT_SHORT_COMMIT_TS = "s";
  public static final String OPT_LONG_COMMIT_TS = "commitTs";
  public static final String OPT_ARG_COMMIT_TS = "COMMIT_TS";
  public static final String OPT_DESC_COMMIT_TS = "Commit ts to store, required by WRITE";

  public static final String OPT_SHORT_HELP = "h";
  public static final String OPT_LONG_HELP = "help";
  public static final String OPT_DESC_HELP = "Display this message";
}
