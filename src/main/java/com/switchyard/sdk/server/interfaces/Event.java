package com.switchyard.sdk.server.interfaces;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.switchyard.sdk.ArrayBuilder;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ObjectBuilder;
import com.switchyard.sdk.User;

import java.util.List;
import java.util.Map;

/**
 * An exposure, diagnostics or custom event waiting to be delivered.
 * <p>
 * The user is kept in full so that callbacks can inspect it, but {@link #toValue()} only ever
 * includes its loggable form, without private attributes.
 */
public final class Event {
  private final String eventName;
  private final User user;
  private final ConfigValue value;
  private final ImmutableMap<String, String> metadata;
  private final ImmutableList<SecondaryExposure> secondaryExposures;
  private final ImmutableMap<String, ConfigValue> samplingMetadata;
  private final long time;
  
  /**
   * Creates an instance.
   * 
   * @param eventName the event name
   * @param user the user, or null for events not tied to a user
   * @param value an optional value
   * @param metadata string metadata
   * @param secondaryExposures secondary exposures for exposure events
   * @param time the event time in milliseconds
   */
  public Event(String eventName, User user, ConfigValue value, Map<String, String> metadata,
      List<SecondaryExposure> secondaryExposures, long time) {
    this(eventName, user, value, metadata, secondaryExposures, null, time);
  }
  
  private Event(String eventName, User user, ConfigValue value, Map<String, String> metadata,
      List<SecondaryExposure> secondaryExposures, Map<String, ConfigValue> samplingMetadata, long time) {
    this.eventName = eventName;
    this.user = user;
    this.value = ConfigValue.normalize(value);
    this.metadata = metadata == null ? ImmutableMap.<String, String>of() : ImmutableMap.copyOf(metadata);
    this.secondaryExposures = secondaryExposures == null ? ImmutableList.<SecondaryExposure>of() :
      ImmutableList.copyOf(secondaryExposures);
    this.samplingMetadata = samplingMetadata == null ? ImmutableMap.<String, ConfigValue>of() :
      ImmutableMap.copyOf(samplingMetadata);
    this.time = time;
  }
  
  /**
   * Returns a copy of this event annotated with sampling information.
   * 
   * @param samplingMetadata sampling annotations
   * @return a new event
   */
  public Event withSamplingMetadata(Map<String, ConfigValue> samplingMetadata) {
    return new Event(eventName, user, value, metadata, secondaryExposures, samplingMetadata, time);
  }
  
  public String getEventName() {
    return eventName;
  }
  
  public User getUser() {
    return user;
  }
  
  public ConfigValue getValue() {
    return value;
  }
  
  public Map<String, String> getMetadata() {
    return metadata;
  }
  
  public List<SecondaryExposure> getSecondaryExposures() {
    return secondaryExposures;
  }
  
  public Map<String, ConfigValue> getSamplingMetadata() {
    return samplingMetadata;
  }
  
  public long getTime() {
    return time;
  }
  
  /**
   * Returns the JSON representation sent to the event service.
   * 
   * @return an object value
   */
  public ConfigValue toValue() {
    ObjectBuilder b = ConfigValue.buildObject().put("eventName", eventName);
    if (user != null) {
      b.put("user", user.toLoggableValue());
    }
    if (!value.isNull()) {
      b.put("value", value);
    }
    if (!metadata.isEmpty()) {
      ObjectBuilder mb = ConfigValue.buildObject();
      for (Map.Entry<String, String> e: metadata.entrySet()) {
        mb.put(e.getKey(), e.getValue());
      }
      b.put("metadata", mb.build());
    }
    if (!secondaryExposures.isEmpty()) {
      ArrayBuilder ab = ConfigValue.buildArray();
      for (SecondaryExposure e: secondaryExposures) {
        ab.add(e.toValue());
      }
      b.put("secondaryExposures", ab.build());
    }
    if (!samplingMetadata.isEmpty()) {
      ObjectBuilder sb = ConfigValue.buildObject();
      for (Map.Entry<String, ConfigValue> e: samplingMetadata.entrySet()) {
        sb.put(e.getKey(), e.getValue());
      }
      b.put("samplingMetadata", sb.build());
    }
    b.put("time", time);
    return b.build();
  }
  
  @Override
  public String toString() {
    return toValue().toJsonString();
  }
}
