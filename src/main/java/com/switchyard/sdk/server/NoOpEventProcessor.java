package com.switchyard.sdk.server;

import com.switchyard.sdk.server.interfaces.Event;
import com.switchyard.sdk.server.subsystems.EventProcessor;

/**
 * An {@link EventProcessor} that discards all events, used in local mode and when all logging is
 * disabled.
 */
final class NoOpEventProcessor implements EventProcessor {
  static final NoOpEventProcessor INSTANCE = new NoOpEventProcessor();
  
  private NoOpEventProcessor() {}

  @Override
  public void sendEvent(Event e) {}

  @Override
  public void flush() {}

  @Override
  public void close() {}
}
