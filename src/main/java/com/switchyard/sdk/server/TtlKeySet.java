package com.switchyard.sdk.server;

import java.io.Closeable;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A concurrent set of keys that is emptied wholesale at a fixed interval, so a key is remembered for
 * at most one interval. Used to tell first-seen exposures from repeats.
 */
final class TtlKeySet implements Closeable {
  static final Duration DEFAULT_RESET_INTERVAL = Duration.ofMinutes(1);
  
  // Bounds memory if the key space is huge between resets.
  static final int MAX_KEYS = 100000;
  
  private volatile Set<String> keys = ConcurrentHashMap.newKeySet();
  private final ScheduledFuture<?> resetTask;
  
  /**
   * Creates an instance. If {@code executor} is null, the set is only emptied by {@link #reset()}.
   */
  TtlKeySet(ScheduledExecutorService executor, Duration resetInterval) {
    if (executor == null) {
      resetTask = null;
    } else {
      long millis = resetInterval.toMillis();
      resetTask = executor.scheduleAtFixedRate(this::reset, millis, millis, TimeUnit.MILLISECONDS);
    }
  }
  
  /**
   * Adds a key.
   * 
   * @return true if the key was not already present
   */
  boolean add(String key) {
    Set<String> current = keys;
    if (current.size() >= MAX_KEYS) {
      reset();
      current = keys;
    }
    return current.add(key);
  }
  
  boolean contains(String key) {
    return keys.contains(key);
  }
  
  void reset() {
    keys = ConcurrentHashMap.newKeySet();
  }
  
  @Override
  public void close() {
    if (resetTask != null) {
      resetTask.cancel(false);
    }
    reset();
  }
}
