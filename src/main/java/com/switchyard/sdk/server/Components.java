package com.switchyard.sdk.server;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.Logs;
import com.switchyard.sdk.server.ComponentsImpl.EventProcessorBuilderImpl;
import com.switchyard.sdk.server.ComponentsImpl.HttpConfigurationBuilderImpl;
import com.switchyard.sdk.server.ComponentsImpl.LoggingConfigurationBuilderImpl;
import com.switchyard.sdk.server.ComponentsImpl.PollingDataSourceBuilderImpl;
import com.switchyard.sdk.server.integrations.EventProcessorBuilder;
import com.switchyard.sdk.server.integrations.HttpConfigurationBuilder;
import com.switchyard.sdk.server.integrations.LoggingConfigurationBuilder;
import com.switchyard.sdk.server.integrations.PollingDataSourceBuilder;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.EventProcessor;

import static com.switchyard.sdk.server.ComponentsImpl.NOOP_EVENT_PROCESSOR_FACTORY;

/**
 * Provides configurable factories for the standard implementations of Switchyard component interfaces.
 * <p>
 * Some of the configuration options in {@link SwitchyardConfig.Builder} affect the entire SDK, but others
 * are specific to one area of functionality, such as how the SDK syncs specs or delivers events. For the
 * latter, the standard way to specify a configuration is to call one of the static methods in
 * {@link Components} (such as {@link #pollingDataSource()}), apply any desired configuration change to the
 * object that that method returns (such as {@link PollingDataSourceBuilder#configSyncInterval(java.time.Duration)}),
 * and then use the corresponding method in {@link SwitchyardConfig.Builder} (such as
 * {@link SwitchyardConfig.Builder#dataSource(ComponentConfigurer)}) to use that configured component in the SDK.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a configuration builder for delivering exposure and custom events to Switchyard.
   * <p>
   * The default configuration has events enabled with default settings. If you want to customize this
   * behavior, call this method to obtain a builder, change its properties with the
   * {@link EventProcessorBuilder} properties, and pass it to {@link SwitchyardConfig.Builder#events(ComponentConfigurer)}:
   * <pre><code>
   *     SwitchyardConfig config = new SwitchyardConfig.Builder()
   *         .events(Components.sendEvents().capacity(5000).flushInterval(Duration.ofSeconds(2)))
   *         .build();
   * </code></pre>
   * To completely disable sending events, use {@link #noEvents()} instead.
   *
   * @return a builder for setting event properties
   * @see #noEvents()
   */
  public static EventProcessorBuilder sendEvents() {
    return new EventProcessorBuilderImpl();
  }

  /**
   * Returns a configuration object that disables events.
   * <p>
   * Passing this to {@link SwitchyardConfig.Builder#events(ComponentConfigurer)} causes the SDK
   * to discard all events and not send them to Switchyard, regardless of any other configuration.
   *
   * @return a factory object
   * @see #sendEvents()
   */
  public static ComponentConfigurer<EventProcessor> noEvents() {
    return NOOP_EVENT_PROCESSOR_FACTORY;
  }

  /**
   * Returns a configurable factory for the component that syncs specs and id lists.
   * <p>
   * This is the default data source; you only need it to change the defaults:
   * <pre><code>
   *     SwitchyardConfig config = new SwitchyardConfig.Builder()
   *         .dataSource(Components.pollingDataSource().disableCDN(true))
   *         .build();
   * </code></pre>
   *
   * @return a builder for setting sync properties
   */
  public static PollingDataSourceBuilder pollingDataSource() {
    return new PollingDataSourceBuilderImpl();
  }

  /**
   * Returns a configuration builder for the SDK's networking configuration.
   * <p>
   * Passing this to {@link SwitchyardConfig.Builder#http(ComponentConfigurer)} applies this
   * configuration to all HTTP requests made by the SDK.
   *
   * @return a configuration builder
   */
  public static HttpConfigurationBuilder httpConfiguration() {
    return new HttpConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the SDK's logging configuration.
   * <p>
   * Passing this to {@link SwitchyardConfig.Builder#logging(ComponentConfigurer)},
   * after setting any desired properties on the builder, applies this configuration to the SDK.
   *
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder logging() {
    return new LoggingConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the SDK's logging configuration, specifying the
   * implementation of logging to use.
   * <p>
   * This is a shortcut for <code>Components.logging().adapter(logAdapter)</code>.
   *
   * @param logAdapter the log adapter
   * @return a configuration builder
   * @see LoggingConfigurationBuilder#adapter(LDLogAdapter)
   */
  public static LoggingConfigurationBuilder logging(LDLogAdapter logAdapter) {
    return logging().adapter(logAdapter);
  }

  /**
   * Returns a configuration builder that turns off SDK logging.
   * <p>
   * It is equivalent to <code>Components.logging(com.launchdarkly.logging.Logs.none())</code>.
   *
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder noLogging() {
    return logging().adapter(Logs.none());
  }
}
