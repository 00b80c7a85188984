package com.switchyard.sdk.server.subsystems;

import com.switchyard.sdk.server.interfaces.Event;

import java.io.Closeable;

/**
 * Interface for an object that can send or store exposure and custom events.
 */
public interface EventProcessor extends Closeable {
  /**
   * Records an event asynchronously. This method never blocks on network activity.
   * 
   * @param event the event
   */
  void sendEvent(Event event);
  
  /**
   * Specifies that any buffered events should be sent as soon as possible, rather than waiting
   * for the next flush interval. This method is asynchronous.
   */
  void flush();
}
