package com.switchyard.sdk.server;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.switchyard.sdk.server.subsystems.ObservabilityClient;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * The single funnel for unexpected faults inside the SDK. Public operations run through
 * {@link #capture(String, Supplier, Supplier)}, which turns any {@link RuntimeException} into the
 * operation's safe fallback.
 * <p>
 * Identical faults (same exception class and message) are logged at error level only the first
 * time and at debug level after that, so an outage cannot flood the application's log.
 */
final class ErrorBoundary {
  // Distinct faults remembered for deduplication before the set starts over.
  static final int MAX_SEEN_FAULTS = 1000;
  
  private final LDLogger logger;
  private final ObservabilityClient observabilityClient;
  private final Set<String> seen = ConcurrentHashMap.newKeySet();
  
  ErrorBoundary(LDLogger logger, ObservabilityClient observabilityClient) {
    this.logger = logger;
    this.observabilityClient = observabilityClient;
  }
  
  <T> T capture(String tag, Supplier<T> task, Supplier<T> fallback) {
    try {
      return task.get();
    } catch (RuntimeException e) {
      logException(tag, e, false);
      return fallback.get();
    }
  }
  
  void capture(String tag, Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      logException(tag, e, false);
    }
  }
  
  /**
   * Reports a fault. With {@code bypassDedupe}, it is logged at error level even if it was seen before.
   */
  void logException(String tag, Throwable e, boolean bypassDedupe) {
    String key = e.getClass().getName() + ":" + e.getMessage();
    if (seen.size() >= MAX_SEEN_FAULTS) {
      seen.clear();
    }
    boolean first = seen.add(key);
    if (first || bypassDedupe) {
      logger.error("Unexpected error in {}: {}", tag, LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      if (observabilityClient != null) {
        try {
          observabilityClient.error(tag, e);
        } catch (RuntimeException oe) {
          logger.warn("Observability client failed to record an error: {}", LogValues.exceptionSummary(oe));
        }
      }
    } else {
      logger.debug("Repeated error in {}: {}", tag, LogValues.exceptionSummary(e));
    }
  }
}
