package com.switchyard.sdk.server.integrations;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;
import com.switchyard.sdk.server.Components;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.LoggingConfiguration;

import java.time.Duration;

/**
 * Contains methods for configuring the SDK's logging behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#logging()}, change its properties with the methods of this class, and pass it
 * to {@link com.switchyard.sdk.server.SwitchyardConfig.Builder#logging(ComponentConfigurer)}:
 * <pre><code>
 *     SwitchyardConfig config = new SwitchyardConfig.Builder()
 *         .logging(
 *           Components.logging()
 *             .logSyncOutageAsErrorAfter(Duration.ofSeconds(300))
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#logging()}.
 */
public abstract class LoggingConfigurationBuilder implements ComponentConfigurer<LoggingConfiguration> {
  /**
   * The default value for {@link #logSyncOutageAsErrorAfter(Duration)}: two minutes.
   */
  public static final Duration DEFAULT_LOG_SYNC_OUTAGE_AS_ERROR_AFTER = Duration.ofMinutes(2);
  
  protected String baseName = null;
  protected Duration logSyncOutageAsErrorAfter = DEFAULT_LOG_SYNC_OUTAGE_AS_ERROR_AFTER;
  protected LDLogAdapter logAdapter = null;
  protected LDLogLevel minimumLevel = null;
  
  /**
   * Specifies the implementation of logging to use.
   * <p>
   * The default logging destination, if no adapter is specified, depends on whether
   * <a href="https://www.slf4j.org/">SLF4J</a> is present in the classpath. If it is, then the SDK uses
   * {@link com.launchdarkly.logging.LDSLF4J#adapter()}, causing output to go to SLF4J. If SLF4J is not
   * present in the classpath, the SDK uses {@link Logs#toConsole()} instead, causing output to go to
   * the {@code System.err} stream.
   * <p>
   * If you don't need to customize any options other than the adapter, you can call
   * {@link Components#logging(LDLogAdapter)} as a shortcut.
   * 
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return the builder
   */
  public LoggingConfigurationBuilder adapter(LDLogAdapter logAdapter) {
    this.logAdapter = logAdapter;
    return this;
  }

  /**
   * Specifies a custom base logger name.
   * <p>
   * By default, the SDK uses a base logger name of <code>com.switchyard.sdk.server.SwitchyardClient</code>.
   * Messages are logged either under this name, or with a suffix to indicate what general area of
   * functionality is involved:
   * <ul>
   * <li> <code>.DataSource</code>: syncing specs and id lists. </li>
   * <li> <code>.DataStore</code>: the in-memory spec store and persisted values. </li> 
   * <li> <code>.Evaluation</code>: problems in evaluating a gate, config or layer. </li>
   * <li> <code>.Events</code>: delivery of exposure and custom events. </li>
   * <li> <code>.ErrorBoundary</code>: unexpected internal errors. </li>
   * <li> <code>.Diagnostics</code>: timing markers. </li>
   * </ul>
   * 
   * @param name the base logger name
   * @return the builder
   */
  public LoggingConfigurationBuilder baseLoggerName(String name) {
    this.baseName = name;
    return this;
  }
  
  /**
   * Specifies the lowest level of logging to enable.
   * <p>
   * This is only applicable when using an implementation of logging that does not have its own
   * external configuration mechanism, such as {@link Logs#toConsole()}. If not specified, the default
   * minimum level is {@link LDLogLevel#INFO}.
   * 
   * @param minimumLevel the lowest level of logging to enable
   * @return the builder
   */
  public LoggingConfigurationBuilder level(LDLogLevel minimumLevel) {
    this.minimumLevel = minimumLevel;
    return this;
  }
  
  /**
   * Sets how long spec syncs may keep failing before the SDK logs the outage at {@code ERROR} level.
   * <p>
   * The default is {@link #DEFAULT_LOG_SYNC_OUTAGE_AS_ERROR_AFTER}. Setting it to {@code null}
   * disables the error.
   * 
   * @param logSyncOutageAsErrorAfter the error logging threshold, or null
   * @return the builder
   */
  public LoggingConfigurationBuilder logSyncOutageAsErrorAfter(Duration logSyncOutageAsErrorAfter) {
    this.logSyncOutageAsErrorAfter = logSyncOutageAsErrorAfter;
    return this;
  }
}
