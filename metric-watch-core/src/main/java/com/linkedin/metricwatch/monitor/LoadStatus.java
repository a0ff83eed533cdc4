/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.monitor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The outcome of loading persisted state.
 *
 * <ul>
 *   <li>{@link #LOADED}: The persisted document was read and applied.</li>
 *   <li>{@link #MISSING}: No persisted document exists, the state starts empty.</li>
 *   <li>{@link #CORRUPT}: The persisted document could not be parsed, the state starts empty.</li>
 * </ul>
 */
public enum LoadStatus {
  LOADED, MISSING, CORRUPT;

  private static final List<LoadStatus> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<LoadStatus> cachedValues() {
    return CACHED_VALUES;
  }
}
