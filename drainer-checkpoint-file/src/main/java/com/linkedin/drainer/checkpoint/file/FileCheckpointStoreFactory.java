/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.file;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.lang3.Validate;

import com.linkedin.drainer.checkpoint.CheckpointConfig;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.checkpoint.CheckpointStoreFactory;
import com.linkedin.drainer.checkpoint.CheckpointType;


/**
 * Creates {@link FileCheckpointStore}s in the configured {@code dir}.
 */
public class FileCheckpointStoreFactory implements CheckpointStoreFactory {

  @Override
  public CheckpointStore createStore(CheckpointType type, CheckpointConfig config) {
    Validate.isTrue(type == CheckpointType.FILE, "unexpected checkpoint type " + type);
    String dir = config.requireDir();
    Path path;
    try {
      path = Paths.get(dir);
    } catch (InvalidPathException e) {
      throw new IllegalArgumentException(CheckpointConfig.CONFIG_DIR + " has value " + dir
          + " which is not a valid path.", e);
    }
    return new FileCheckpointStore(path);
  }
}
