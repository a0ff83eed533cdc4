/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.monitor.sampling;

import com.linkedin.metricwatch.common.utils.AutoCloseableLock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * A bounded, time ordered history of a single metric.
 * <p>
 * The samples are kept in a fixed size circular buffer. The buffer is always sorted by sample time: a sample that
 * arrives out of order is inserted at its position, and once the buffer is full the oldest sample is evicted. A
 * sample that is older than every retained sample of a full series is dropped. As a result, the retained samples are
 * always the {@code capacity} most recent samples by time.
 * <p>
 * Writers are serialized by a write lock. Readers get a copy taken under the read lock, so a reader never observes a
 * partially applied insertion or eviction.
 */
public class MetricSeries {
  private final String _metricName;
  private final MetricSample[] _buffer;
  private final ReadWriteLock _lock;
  // Physical index of the oldest sample.
  private int _start;
  private int _size;

  public MetricSeries(String metricName, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Capacity of metric series " + metricName + " must be positive, got " + capacity);
    }
    _metricName = metricName;
    _buffer = new MetricSample[capacity];
    _lock = new ReentrantReadWriteLock();
    _start = 0;
    _size = 0;
  }

  /**
   * Add the given sample to this series.
   *
   * @param sample The sample to add.
   * @return {@code true} if the sample is retained, {@code false} if it was dropped because it is older than every
   * sample of a full series.
   */
  public boolean append(MetricSample sample) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      int capacity = _buffer.length;
      // Position after the last sample whose time is not greater than the new one keeps equal timestamps in arrival order.
      int pos = upperBound(sample.timeMs());
      if (_size == capacity) {
        if (pos == 0) {
          return false;
        }
        // Evict the oldest sample.
        _buffer[_start] = null;
        _start = (_start + 1) % capacity;
        _size--;
        pos--;
      }
      for (int i = _size; i > pos; i--) {
        _buffer[physical(i)] = _buffer[physical(i - 1)];
      }
      _buffer[physical(pos)] = sample;
      _size++;
      return true;
    }
  }

  /**
   * @param n Maximum number of samples to return.
   * @return A copy of the most recent {@code n} samples (or fewer if the history is shorter), oldest first.
   */
  public List<MetricSample> tail(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("Number of samples cannot be negative, got " + n);
    }
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      int count = Math.min(n, _size);
      List<MetricSample> result = new ArrayList<>(count);
      for (int i = _size - count; i < _size; i++) {
        result.add(_buffer[physical(i)]);
      }
      return result;
    }
  }

  /**
   * @return A copy of all the retained samples, oldest first.
   */
  public List<MetricSample> all() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return tail(_size);
    }
  }

  /**
   * @return The newest sample, or {@code null} if the series is empty.
   */
  public MetricSample latest() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _size == 0 ? null : _buffer[physical(_size - 1)];
    }
  }

  /**
   * @return Number of retained samples.
   */
  public int size() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _size;
    }
  }

  public int capacity() {
    return _buffer.length;
  }

  public String metricName() {
    return _metricName;
  }

  /**
   * @return The values of the retained samples, oldest first.
   */
  public List<Double> values() {
    List<MetricSample> samples = all();
    List<Double> values = new ArrayList<>(samples.size());
    for (MetricSample sample : samples) {
      values.add(sample.value());
    }
    return Collections.unmodifiableList(values);
  }

  private int physical(int logicalIndex) {
    return (_start + logicalIndex) % _buffer.length;
  }

  /**
   * @return The first logical index whose sample time is greater than the given time, or the size of the series.
   */
  private int upperBound(long timeMs) {
    int low = 0;
    int high = _size;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (_buffer[physical(mid)].timeMs() <= timeMs) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
}
