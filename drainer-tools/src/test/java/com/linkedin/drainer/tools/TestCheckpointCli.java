/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.tools;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.linkedin.drainer.common.FileUtils;


public class TestCheckpointCli {

  private Path _dir;
  private Path _configFile;
  private ByteArrayOutputStream _output;
  private PrintStream _out;

  @BeforeMethod(alwaysRun = true)
  public void setup() throws IOException {
    _dir = FileUtils.constructRandomDirectoryInTempDir("checkpoint-cli");
    _configFile = _dir.resolve("drainer.properties");
    Files.write(_configFile, ("checkpoint.dir=" + _dir.resolve("data").toString().replace("\\", "/") + "\n"
        + "checkpoint.clusterId=6842\n"
        + "syncer.workerCount=16\n").getBytes(StandardCharsets.UTF_8));
    _output = new ByteArrayOutputStream();
    _out = new PrintStream(_output, true, "UTF-8");
  }

  @AfterMethod(alwaysRun = true)
  public void teardown() throws IOException {
    FileUtils.deleteRecursively(_dir);
  }

  private String output() {
    return new String(_output.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void testReadWithoutCheckpoint() {
    int exitCode = CheckpointCli.run(new String[]{"-t", "file", "-c", _configFile.toString(), "-o", "READ"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_OK);
    Assert.assertTrue(output().contains("binlog commitTS = 0"), output());
  }

  @Test
  public void testWriteThenRead() {
    int exitCode = CheckpointCli.run(new String[]{"--type", "file", "--config", _configFile.toString(),
        "--operation", "write", "--commitTs", "417890573541376001"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_OK);
    Assert.assertTrue(output().contains("Saved checkpoint: binlog commitTS = 417890573541376001"), output());

    _output.reset();
    exitCode = CheckpointCli.run(new String[]{"-t", "file", "-c", _configFile.toString(), "-o", "READ"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_OK);
    Assert.assertTrue(output().contains("binlog commitTS = 417890573541376001"), output());
  }

  @Test
  public void testWriteRequiresCommitTs() {
    int exitCode = CheckpointCli.run(new String[]{"-t", "file", "-c", _configFile.toString(), "-o", "WRITE"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_USAGE);
    Assert.assertTrue(output().contains("commitTs"), output());
  }

  @Test
  public void testMissingRequiredOption() {
    int exitCode = CheckpointCli.run(new String[]{"-t", "file", "-o", "READ"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_USAGE);
    Assert.assertTrue(output().startsWith("Failed to parse the arguments."), output());
  }

  @Test
  public void testUnknownOperation() {
    int exitCode = CheckpointCli.run(new String[]{"-t", "file", "-c", _configFile.toString(), "-o", "DROP"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_USAGE);
  }

  @Test
  public void testUnsupportedType() {
    int exitCode = CheckpointCli.run(new String[]{"-t", "nosuch", "-c", _configFile.toString(), "-o", "READ"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_FAILURE);
    Assert.assertTrue(output().contains("unsupported checkpoint type nosuch"), output());
  }

  @Test
  public void testMissingConfigFile() {
    int exitCode = CheckpointCli.run(
        new String[]{"-t", "file", "-c", _dir.resolve("absent.properties").toString(), "-o", "READ"}, _out);
    Assert.assertEquals(exitCode, CheckpointCli.EXIT_FAILURE);
    Assert.assertTrue(output().contains("Failed to read config file"), output());
  }

  @Test
  public void testHelp() {
    Assert.assertEquals(CheckpointCli.run(new String[]{"-h"}, _out), CheckpointCli.EXIT_OK);
    Assert.assertTrue(output().contains("usage: CheckpointCli"), output());
  }
}
