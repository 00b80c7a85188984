package com.switchyard.sdk.server.integrations;

import com.switchyard.sdk.server.Components;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.EventProcessor;
import com.switchyard.sdk.server.subsystems.EventSender;

import java.net.URI;
import java.time.Duration;

/**
 * Contains methods for configuring delivery of exposure and custom events.
 * <p>
 * The SDK normally buffers events and sends them to Switchyard at intervals. If you want to customize this
 * behavior, create a builder with {@link Components#sendEvents()}, change its properties with the
 * methods of this class, and pass it to {@link com.switchyard.sdk.server.SwitchyardConfig.Builder#events(ComponentConfigurer)}:
 * <pre><code>
 *     SwitchyardConfig config = new SwitchyardConfig.Builder()
 *         .events(Components.sendEvents().capacity(5000).flushInterval(Duration.ofSeconds(2)))
 *         .build();
 * </code></pre>
 * To completely disable sending events, use {@link Components#noEvents()}.
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#sendEvents()}.
 */
public abstract class EventProcessorBuilder implements ComponentConfigurer<EventProcessor> {
  /**
   * The default value for {@link #capacity(int)}.
   */
  public static final int DEFAULT_CAPACITY = 1000;
  
  /**
   * The default value for {@link #flushInterval(Duration)}: 60 seconds.
   */
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(60);
  
  protected URI apiBaseUri;
  protected int capacity = DEFAULT_CAPACITY;
  protected Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
  protected ComponentConfigurer<EventSender> eventSenderConfigurer = null;
  
  /**
   * Sets the base URI that events are posted to.
   * 
   * @param apiBaseUri the base URI; null to use the default
   * @return the builder
   */
  public EventProcessorBuilder apiBaseUri(URI apiBaseUri) {
    this.apiBaseUri = apiBaseUri;
    return this;
  }

  /**
   * Sets the capacity of the events buffer.
   * <p>
   * The client buffers up to this many events in memory before flushing. If the capacity is exceeded before
   * the buffer is flushed, events will be discarded.
   * 
   * @param capacity the capacity of the event buffer
   * @return the builder
   */
  public EventProcessorBuilder capacity(int capacity) {
    this.capacity = capacity <= 0 ? DEFAULT_CAPACITY : capacity;
    return this;
  }

  /**
   * Specifies a custom implementation for event delivery.
   * <p>
   * The standard event delivery implementation sends event data via HTTP/HTTPS to the Switchyard events
   * service endpoint (or any other endpoint specified with {@link #apiBaseUri(URI)}. Providing a
   * custom implementation may be useful in tests, or if the event data needs to be stored and forwarded. 
   * 
   * @param eventSenderConfigurer a factory for an {@link EventSender} implementation
   * @return the builder
   */
  public EventProcessorBuilder eventSender(ComponentConfigurer<EventSender> eventSenderConfigurer) {
    this.eventSenderConfigurer = eventSenderConfigurer;
    return this;
  }
  
  /**
   * Sets the interval between flushes of the event buffer.
   * <p>
   * Decreasing the flush interval means that the event buffer is less likely to reach capacity.
   * 
   * @param flushInterval the flush interval; null to use the default
   * @return the builder
   */
  public EventProcessorBuilder flushInterval(Duration flushInterval) {
    this.flushInterval = flushInterval == null ? DEFAULT_FLUSH_INTERVAL : flushInterval;
    return this;
  }
}
