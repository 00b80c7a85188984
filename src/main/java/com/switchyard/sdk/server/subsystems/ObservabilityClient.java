package com.switchyard.sdk.server.subsystems;

import java.util.Map;

/**
 * Receives internal SDK errors and measurements, for applications that forward them to their own
 * monitoring system. Implementations must not throw.
 */
public interface ObservabilityClient {
  /**
   * Reports an internal error. Each distinct error is reported once.
   * 
   * @param tag the operation that failed
   * @param error the exception
   */
  void error(String tag, Throwable error);
  
  /**
   * Records a measurement, such as the latency of a spec sync.
   * 
   * @param metricName the metric
   * @param value the measured value
   * @param tags extra dimensions
   */
  void distribution(String metricName, double value, Map<String, String> tags);
}
