package com.switchyard.sdk.server.interfaces;

/**
 * Notified after each spec document downloaded from the network has replaced the SDK's rules.
 * <p>
 * The callback runs on the SDK's sync thread; it should return quickly. Exceptions it throws are
 * logged and otherwise ignored.
 */
@FunctionalInterface
public interface RulesUpdatedCallback {
  /**
   * Called with the document as received.
   * 
   * @param specsJson the raw JSON spec document
   * @param time the document's server time
   */
  void rulesUpdated(String specsJson, long time);
}
