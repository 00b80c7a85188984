package com.switchyard.sdk.server.subsystems;

/**
 * Storage for sticky experiment assignments.
 * <p>
 * Each storage key identifies one unit (for instance {@code "user-123:userID"}) and holds a JSON
 * document mapping config names to their persisted evaluations. The SDK never interprets a storage
 * failure as fatal: an exception from {@link #load(String)} is treated as "nothing persisted".
 */
public interface UserPersistentStorage {
  /**
   * Returns the stored document for a key, or null.
   * 
   * @param key the storage key
   * @return a JSON string or null
   */
  String load(String key);
  
  /**
   * Persists the evaluation of one config for a key.
   * 
   * @param key the storage key
   * @param configName the config name
   * @param data the JSON representation of the evaluation
   */
  void save(String key, String configName, String data);
  
  /**
   * Removes the evaluation of one config for a key.
   * 
   * @param key the storage key
   * @param configName the config name
   */
  void delete(String key, String configName);
}
