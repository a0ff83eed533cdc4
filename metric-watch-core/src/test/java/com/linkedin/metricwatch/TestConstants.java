/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch;

public final class TestConstants {
  public static final String ERROR_COUNT = "error_count";
  public static final String CONTEXT_USAGE = "context_usage";
  public static final String COST = "cost";
  // 2023-11-14T22:13:20Z
  public static final long START_MS = 1_700_000_000_000L;
  public static final long MINUTE_MS = 60_000L;
  public static final long HOUR_MS = 3_600_000L;

  private TestConstants() {

  }
}
