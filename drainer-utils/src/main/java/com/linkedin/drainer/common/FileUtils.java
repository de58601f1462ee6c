/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.common;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Class that contains the helper utility methods for File system operations.
 */
public final class FileUtils {

  private static final Logger LOG = LoggerFactory.getLogger(FileUtils.class.getName());

  static final String TEMP_SUFFIX = ".tmp";

  private FileUtils() {
  }

  /**
   * Constructs a random directory with the prefix in the temp folder.
   * @param dirPrefix
   *   Prefix to be used for the directory that needs to be created.
   * @return
   *   Path of the directory that is created.
   */
  public static Path constructRandomDirectoryInTempDir(String dirPrefix) {
    try {
      Path dir = Files.createTempDirectory(dirPrefix);
      dir.toFile().deleteOnExit();
      return dir;
    } catch (IOException e) {
      throw ErrorLogger.logAndWrap(LOG, "could not create temp directory with prefix " + dirPrefix, e,
          DrainerRuntimeException::new);
    }
  }

  /**
   * Path of the scratch file {@link #writeFileAtomic(Path, byte[])} writes before renaming it over {@code target}.
   */
  public static Path tempFileFor(Path target) {
    return target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
  }

  /**
   * Replace the content of {@code target} so that readers observe either the old or the new content, never a mix.
   * The data is written to a sibling temp file, forced to disk and then renamed over the target.
   * @param target file to replace
   * @param data new content
   * @throws IOException if any step fails; the previous content of {@code target} is left intact
   */
  public static void writeFileAtomic(Path target, byte[] data) throws IOException {
    Path temp = tempFileFor(target);
    try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
        StandardOpenOption.TRUNCATE_EXISTING)) {
      ByteBuffer buffer = ByteBuffer.wrap(data);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }

    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOG.warn("Atomic move not supported for {}, falling back to a plain replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Delete the folder and all its contents recursively.
   * @param path
   *  Path that needs to be deleted.
   * @throws IOException if a file cannot be deleted
   */
  public static void deleteRecursively(Path path) throws IOException {
    if (!Files.exists(path)) {
      return;
    }
    if (Files.isDirectory(path)) {
      try (Stream<Path> children = Files.list(path)) {
        for (Path child : (Iterable<Path>) children::iterator) {
          deleteRecursively(child);
        }
      }
    }
    Files.delete(path);
  }
}
