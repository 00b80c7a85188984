package com.switchyard.sdk.server.subsystems;

import java.io.Closeable;
import java.util.concurrent.Future;

/**
 * Interface for an object that receives config spec updates from Switchyard or from another source.
 */
public interface DataSource extends Closeable {
  /**
   * Starts the component if it is not already started, and returns a future that completes when
   * the first sync attempt has finished, successfully or not.
   * 
   * @return a future
   */
  Future<Void> start();

  /**
   * Returns true once the data source has put a spec document into the store.
   * 
   * @return true if initialized
   */
  boolean isInitialized();
}
