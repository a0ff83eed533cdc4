/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.persisteddata;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;


/**
 * A {@link StateStore} that keeps the documents in memory. Nothing survives a restart of the process.
 */
public class MemoryStateStore implements StateStore {
  private final Map<String, String> _documents = new ConcurrentHashMap<>();

  @Override
  public void configure(Map<String, ?> configs) {

  }

  @Override
  public String read(String name) {
    return _documents.get(name);
  }

  @Override
  public void write(String name, String content) {
    _documents.put(name, content);
  }
}
