/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.persisteddata;

import com.linkedin.metricwatch.common.MetricWatchConfigurable;
import java.io.IOException;


/**
 * A minimal storage for named state documents. Implementations must be thread safe.
 * <p>
 * Implementations are instantiated reflectively and configured through
 * {@link MetricWatchConfigurable#configure(java.util.Map)}, so they must have a public no-argument constructor.
 */
public interface StateStore extends MetricWatchConfigurable {

  /**
   * Read the document with the given name.
   *
   * @param name Name of the document.
   * @return The content of the document, or {@code null} if no such document exists.
   * @throws IOException if the document exists but cannot be read.
   */
  String read(String name) throws IOException;

  /**
   * Replace the document with the given name. A reader never observes a partially written document.
   *
   * @param name Name of the document.
   * @param content The new content of the document.
   * @throws IOException if the document cannot be written.
   */
  void write(String name, String content) throws IOException;
}
