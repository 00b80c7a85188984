package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import com.switchyard.sdk.ArrayBuilder;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ObjectBuilder;
import com.switchyard.sdk.server.interfaces.Event;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Collects timing markers for SDK initialization, config syncs and API calls, and turns them into
 * {@code switchyard::diagnostics} events when the event processor flushes.
 * <p>
 * Each context is sampled independently with a rate out of 10000. The defaults emit initialization
 * markers only; a spec document may change the rates through its {@code diagnostics} section.
 */
final class Diagnostics {
  enum Context {
    INITIALIZE("initialize"),
    CONFIG_SYNC("config_sync"),
    API_CALL("api_call");
    
    private final String name;
    
    Context(String name) {
      this.name = name;
    }
    
    @Override
    public String toString() {
      return name;
    }
  }
  
  static final String KEY_OVERALL = "overall";
  static final String KEY_DOWNLOAD_CONFIG_SPECS = "download_config_specs";
  static final String KEY_BOOTSTRAP = "bootstrap";
  static final String KEY_GET_ID_LIST_SOURCES = "get_id_list_sources";
  static final String KEY_GET_ID_LIST = "get_id_list";
  static final String KEY_DATA_STORE_CONFIG_SPECS = "data_store_config_specs";
  
  static final String STEP_NETWORK_REQUEST = "network_request";
  static final String STEP_PROCESS = "process";
  
  static final String ACTION_START = "start";
  static final String ACTION_END = "end";
  
  static final int MAX_MARKERS = 50;
  static final int RATE_BASE = 10000;
  
  static final Map<String, Integer> DEFAULT_SAMPLING_RATES = ImmutableMap.of(
      Context.INITIALIZE.toString(), RATE_BASE,
      Context.CONFIG_SYNC.toString(), 0,
      Context.API_CALL.toString(), 0);
  
  // Some documents key the config sync rate as "dcs".
  private static final Map<String, String> LEGACY_RATE_KEYS = ImmutableMap.of(
      Context.CONFIG_SYNC.toString(), "dcs");
  
  private final LDLogger logger;
  private final boolean disabled;
  private final Map<Context, List<ConfigValue>> markers = new EnumMap<>(Context.class);
  private volatile Map<String, Integer> samplingRates = DEFAULT_SAMPLING_RATES;
  
  Diagnostics(LDLogger logger, boolean disabled) {
    this.logger = logger;
    this.disabled = disabled;
  }
  
  void markStart(Context context, String key, String step) {
    mark(context, key, step, ACTION_START, null, null);
  }
  
  void markEnd(Context context, String key, String step, boolean success, Integer statusCode) {
    mark(context, key, step, ACTION_END, success, statusCode);
  }
  
  private void mark(Context context, String key, String step, String action, Boolean success,
      Integer statusCode) {
    if (disabled) {
      return;
    }
    ObjectBuilder b = ConfigValue.buildObject()
        .put("key", key)
        .put("action", action)
        .put("timestamp", System.currentTimeMillis());
    if (step != null) {
      b.put("step", step);
    }
    if (success != null) {
      b.put("success", success);
    }
    if (statusCode != null) {
      b.put("statusCode", statusCode.longValue());
    }
    ConfigValue marker = b.build();
    logger.debug("{} {} {} {}", context, key, step == null ? "" : step, action);
    synchronized (markers) {
      List<ConfigValue> list = markers.computeIfAbsent(context, c -> new ArrayList<>());
      if (list.size() < MAX_MARKERS) {
        list.add(marker);
      }
    }
  }
  
  void updateSamplingRates(Map<String, Integer> rates) {
    if (rates != null && !rates.isEmpty()) {
      samplingRates = ImmutableMap.copyOf(rates);
    }
  }
  
  /**
   * Removes all collected markers and returns the events for the contexts that were sampled in.
   */
  List<Event> drainEvents() {
    List<Event> events = new ArrayList<>();
    if (disabled) {
      return events;
    }
    Map<Context, List<ConfigValue>> drained = new EnumMap<>(Context.class);
    synchronized (markers) {
      drained.putAll(markers);
      markers.clear();
    }
    for (Map.Entry<Context, List<ConfigValue>> e: drained.entrySet()) {
      if (e.getValue().isEmpty() || !isSampled(e.getKey())) {
        continue;
      }
      ArrayBuilder list = ConfigValue.buildArray();
      for (ConfigValue m: e.getValue()) {
        list.add(m);
      }
      ConfigValue value = ConfigValue.buildObject()
          .put("context", e.getKey().toString())
          .put("markers", list.build())
          .build();
      events.add(new Event(ExposureEventFactory.DIAGNOSTICS_EVENT, null, value,
          ImmutableMap.of("context", e.getKey().toString()), null, System.currentTimeMillis()));
    }
    return events;
  }
  
  private boolean isSampled(Context context) {
    Map<String, Integer> rates = samplingRates;
    Integer rate = rates.get(context.toString());
    if (rate == null && LEGACY_RATE_KEYS.containsKey(context.toString())) {
      rate = rates.get(LEGACY_RATE_KEYS.get(context.toString()));
    }
    if (rate == null) {
      rate = DEFAULT_SAMPLING_RATES.get(context.toString());
    }
    return rate != null && ThreadLocalRandom.current().nextInt(RATE_BASE) < rate;
  }
}
