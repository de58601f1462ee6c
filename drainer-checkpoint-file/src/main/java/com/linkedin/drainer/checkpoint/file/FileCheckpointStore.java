/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.checkpoint.file;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linkedin.drainer.checkpoint.CheckpointRecord;
import com.linkedin.drainer.checkpoint.CheckpointStorageException;
import com.linkedin.drainer.checkpoint.CheckpointStore;
import com.linkedin.drainer.common.ErrorLogger;
import com.linkedin.drainer.common.FileUtils;


/**
 * Keeps the checkpoint in {@code <dir>/savepoint}. Every save rewrites the whole file through a temp file and an
 * atomic rename, so a crash in the middle of a save leaves the previous checkpoint readable.
 */
public class FileCheckpointStore implements CheckpointStore {
  private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);

  public static final String SAVEPOINT_FILE_NAME = "savepoint";

  private final Path _file;

  /**
   * Constructor for FileCheckpointStore. Creates the directory if it does not exist.
   * @param dir directory holding the savepoint file
   * @throws CheckpointStorageException if the directory cannot be created
   */
  public FileCheckpointStore(Path dir) {
    Validate.notNull(dir, "null checkpoint directory");
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to create checkpoint directory " + dir, e,
          CheckpointStorageException::new);
    }
    _file = dir.resolve(SAVEPOINT_FILE_NAME);
    if (Files.exists(FileUtils.tempFileFor(_file))) {
      LOG.warn("Found unfinished checkpoint file {}, it will be overwritten by the next save",
          FileUtils.tempFileFor(_file));
    }
    LOG.info("Using checkpoint file {}", _file);
  }

  public Path getFile() {
    return _file;
  }

  @Override
  public CheckpointRecord load() {
    byte[] data;
    try {
      data = Files.readAllBytes(_file);
    } catch (NoSuchFileException e) {
      LOG.info("Checkpoint file {} does not exist", _file);
      return null;
    } catch (IOException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to read checkpoint file " + _file, e,
          CheckpointStorageException::new);
    }
    return CheckpointRecord.fromJson(new String(data, StandardCharsets.UTF_8), _file.toString());
  }

  @Override
  public void save(CheckpointRecord record) {
    try {
      FileUtils.writeFileAtomic(_file, record.toJson().getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw ErrorLogger.logAndWrap(LOG, "Failed to write checkpoint " + record + " to " + _file, e,
          CheckpointStorageException::new);
    }
  }

  @Override
  public void close() {
    // every save is complete on disk when it returns, nothing is held open in between
    LOG.debug("Closed checkpoint file {}", _file);
  }

  @Override
  public String toString() {
    return "FileCheckpointStore{file=" + _file + "}";
  }
}
