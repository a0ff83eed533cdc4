/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.persisteddata;

import com.linkedin.metricwatch.common.config.ConfigException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A {@link StateStore} that keeps every document as a UTF-8 file in a directory. A document is first written to a
 * temporary file in the same directory, then moved over the previous version.
 */
public class FileStateStore implements StateStore {
  private static final Logger LOG = LoggerFactory.getLogger(FileStateStore.class);
  public static final String STATE_STORE_DIR_CONFIG = "state.store.dir";
  private static final String TEMP_SUFFIX = ".tmp";
  private Path _directory;

  public FileStateStore() {

  }

  public FileStateStore(Path directory) {
    _directory = directory;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object dir = configs.get(STATE_STORE_DIR_CONFIG);
    if (dir == null || dir.toString().trim().isEmpty()) {
      throw new ConfigException(STATE_STORE_DIR_CONFIG, dir, "State store directory must be specified.");
    }
    _directory = Paths.get(dir.toString().trim());
  }

  @Override
  public String read(String name) throws IOException {
    Path file = resolve(name);
    if (!Files.exists(file)) {
      return null;
    }
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }

  @Override
  public synchronized void write(String name, String content) throws IOException {
    Path file = resolve(name);
    Files.createDirectories(_directory);
    Path temp = Files.createTempFile(_directory, name, TEMP_SUFFIX);
    try {
      Files.write(temp, content.getBytes(StandardCharsets.UTF_8));
      try {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        LOG.debug("Atomic move is not supported in {}, falling back to a plain replace.", _directory);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /**
   * @return The directory that holds the documents.
   */
  public Path directory() {
    return _directory;
  }

  private Path resolve(String name) {
    if (_directory == null) {
      throw new IllegalStateException("File state store is not configured.");
    }
    return _directory.resolve(name);
  }
}
