package com.switchyard.sdk.server;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableMap;
import com.google.gson.reflect.TypeToken;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.switchyard.sdk.User;
import com.switchyard.sdk.server.interfaces.StickyValues;
import com.switchyard.sdk.server.subsystems.UserPersistentStorage;

import java.lang.reflect.Type;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads and writes persisted (sticky) experiment values through the application's
 * {@link UserPersistentStorage}.
 * <p>
 * The storage key for a unit is {@code unitId + ":" + idType}; the stored value is a JSON object
 * mapping config names to {@link StickyValues}. Loaded maps are held as immutable values in a
 * size-bounded cache, and each write replaces the map for that one unit atomically. Storage failures
 * are logged and treated as "nothing persisted"; they never reach the evaluating caller.
 */
final class PersistedValuesCache {
  static final long DEFAULT_MAX_CACHED_UNITS = 10000;
  
  private static final Type VALUES_TYPE = new TypeToken<Map<String, StickyValues>>() {}.getType();
  
  private final UserPersistentStorage storage;
  private final LDLogger logger;
  private final Cache<String, ImmutableMap<String, StickyValues>> cache;
  
  PersistedValuesCache(UserPersistentStorage storage, LDLogger logger) {
    this(storage, DEFAULT_MAX_CACHED_UNITS, logger);
  }
  
  PersistedValuesCache(UserPersistentStorage storage, long maxCachedUnits, LDLogger logger) {
    this.storage = storage;
    this.logger = logger;
    this.cache = CacheBuilder.newBuilder().maximumSize(maxCachedUnits).build();
  }
  
  boolean isEnabled() {
    return storage != null;
  }
  
  static String storageKey(User user, String idType) {
    return EvaluatorHelpers.getUnitID(user, idType) + ":" + (idType == null ? "" : idType);
  }
  
  /**
   * Returns the persisted values for a unit, or an empty map if there are none or no storage is
   * configured.
   */
  Map<String, StickyValues> load(User user, String idType) {
    if (storage == null) {
      return ImmutableMap.of();
    }
    String key = storageKey(user, idType);
    ImmutableMap<String, StickyValues> cached = cache.getIfPresent(key);
    if (cached != null) {
      return cached;
    }
    ImmutableMap<String, StickyValues> loaded = ImmutableMap.of();
    try {
      String json = storage.load(key);
      if (json != null && !json.isEmpty()) {
        Map<String, StickyValues> parsed = JsonHelpers.deserialize(json, VALUES_TYPE);
        if (parsed != null) {
          loaded = ImmutableMap.copyOf(parsed);
        }
      }
    } catch (Exception e) {
      logger.warn("Failed to load persisted values for \"{}\": {}", idType, LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      return ImmutableMap.of();
    }
    // a write that raced with this read wins
    ImmutableMap<String, StickyValues> existing = cache.asMap().putIfAbsent(key, loaded);
    return existing == null ? loaded : existing;
  }
  
  void save(User user, String idType, String configName, StickyValues value) {
    if (storage == null) {
      return;
    }
    String key = storageKey(user, idType);
    ImmutableMap<String, StickyValues> base = ImmutableMap.copyOf(load(user, idType));
    ImmutableMap<String, StickyValues> updated = cache.asMap().compute(key,
        (k, current) -> with(current == null ? base : current, configName, value));
    try {
      storage.save(key, configName, JsonHelpers.serialize(updated));
    } catch (Exception e) {
      logger.warn("Failed to save persisted value for \"{}\": {}", configName, LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      cache.invalidate(key);
    }
  }
  
  void delete(User user, String idType, String configName) {
    if (storage == null) {
      return;
    }
    String key = storageKey(user, idType);
    try {
      storage.delete(key, configName);
    } catch (Exception e) {
      logger.warn("Failed to delete persisted value for \"{}\": {}", configName, LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      return;
    }
    cache.asMap().computeIfPresent(key, (k, current) -> without(current, configName));
  }
  
  void clear() {
    cache.invalidateAll();
  }
  
  private static ImmutableMap<String, StickyValues> with(Map<String, StickyValues> values, String configName,
      StickyValues value) {
    Map<String, StickyValues> m = new HashMap<>(values);
    m.put(configName, value);
    return ImmutableMap.copyOf(m);
  }
  
  private static ImmutableMap<String, StickyValues> without(ImmutableMap<String, StickyValues> values,
      String configName) {
    if (!values.containsKey(configName)) {
      return values;
    }
    Map<String, StickyValues> m = new HashMap<>(values);
    m.remove(configName);
    return ImmutableMap.copyOf(m);
  }
}
