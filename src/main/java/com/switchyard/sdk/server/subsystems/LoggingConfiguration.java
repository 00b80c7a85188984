package com.switchyard.sdk.server.subsystems;

import com.launchdarkly.logging.LDLogAdapter;
import com.switchyard.sdk.server.integrations.LoggingConfigurationBuilder;

import java.time.Duration;

/**
 * Encapsulates the SDK's general logging configuration.
 * <p>
 * Use {@link LoggingConfigurationBuilder} to construct an instance.
 */
public final class LoggingConfiguration {
  private final String baseLoggerName;
  private final LDLogAdapter logAdapter;
  private final Duration logSyncOutageAsErrorAfter;

  /**
   * Creates an instance.
   * 
   * @param baseLoggerName see {@link #getBaseLoggerName()}
   * @param logAdapter see {@link #getLogAdapter()}
   * @param logSyncOutageAsErrorAfter see {@link #getLogSyncOutageAsErrorAfter()}
   */
  public LoggingConfiguration(
      String baseLoggerName,
      LDLogAdapter logAdapter,
      Duration logSyncOutageAsErrorAfter
      ) {
    this.baseLoggerName = baseLoggerName;
    this.logAdapter = logAdapter;
    this.logSyncOutageAsErrorAfter = logSyncOutageAsErrorAfter;
  }

  /**
   * Returns the configured base logger name.
   * 
   * @return the base logger name
   */
  public String getBaseLoggerName() {
    return baseLoggerName;
  }

  /**
   * Returns the configured logging adapter.
   * 
   * @return the logging adapter
   */
  public LDLogAdapter getLogAdapter() {
    return logAdapter;
  }

  /**
   * The time threshold, if any, after which the SDK will log a spec sync outage at {@code ERROR}
   * level instead of {@code WARN} level.
   * 
   * @return the error logging threshold, or null
   */
  public Duration getLogSyncOutageAsErrorAfter() {
    return logSyncOutageAsErrorAfter;
  }
}
