package com.switchyard.sdk.server.subsystems;

/**
 * An external key/value source of config specs and id lists.
 * <p>
 * When configured, the SDK reads its initial state from the adapter before going to the network,
 * writes every document it downloads back to the adapter, and, for keys where
 * {@link #shouldPollForUpdates(String)} returns true, reads updates from the adapter instead of the
 * network. Values are opaque strings; the SDK owns their format. Exceptions thrown by an adapter are
 * logged and otherwise ignored.
 */
public interface DataAdapter {
  /**
   * Key under which the full config spec document is stored.
   */
  String CONFIG_SPECS_KEY = "switchyard.cache";
  
  /**
   * Key under which the id list manifest is stored. Individual list bodies are stored under this key
   * plus {@code "::"} plus the list name.
   */
  String ID_LISTS_KEY = "switchyard.id_lists";
  
  /**
   * Returns the value for a key, or null if there is none.
   * 
   * @param key the key
   * @return the stored value or null
   */
  String get(String key);
  
  /**
   * Stores a value for a key.
   * 
   * @param key the key
   * @param value the value
   */
  void set(String key, String value);
  
  /**
   * Called once when the client starts, before any other method.
   */
  void initialize();
  
  /**
   * Called once when the client shuts down.
   */
  void shutdown();
  
  /**
   * Returns true if the SDK should poll this adapter for the given key instead of polling the network.
   * 
   * @param key the key
   * @return true to poll the adapter
   */
  boolean shouldPollForUpdates(String key);
}
