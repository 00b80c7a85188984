package com.switchyard.sdk.server.subsystems;

import java.io.Closeable;
import java.net.URI;

/**
 * Interface for a component that can deliver preformatted event data.
 * <p>
 * By default, the SDK sends event data to the Switchyard event service via HTTP. You may provide
 * another implementation with
 * {@link com.switchyard.sdk.server.integrations.EventProcessorBuilder#eventSender(ComponentConfigurer)}.
 */
public interface EventSender extends Closeable {
  /**
   * Attempt to deliver an event data payload. This may be called from any thread.
   * 
   * @param data the JSON payload
   * @param eventCount the number of events in the payload
   * @param eventsBaseUri the configured events endpoint base URI
   * @return a {@link Result}
   */
  Result sendEventData(String data, int eventCount, URI eventsBaseUri);
  
  /**
   * Enumerated values corresponding to different kinds of results.
   */
  public static enum Result {
    /**
     * The EventSender successfully delivered the event(s).
     */
    SUCCESS,
    
    /**
     * The EventSender was not able to deliver the events, and the events were dropped.
     */
    FAILURE,
    
    /**
     * The EventSender was not able to deliver the events, and the SDK should not attempt to send
     * any more events because the error is terminal (such as an invalid secret key).
     */
    STOP
  }
}
