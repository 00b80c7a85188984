package com.switchyard.sdk;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A collection of attributes that can affect evaluation results.
 * <p>
 * A user is identified by a primary {@code userID} and any number of named custom ids (such as
 * {@code stableID} or {@code companyID}); a spec's id type selects which of these is the unit id
 * used for bucketing. Private attributes are visible to the evaluator but are never included in
 * any logged copy of the user.
 * <p>
 * Instances are immutable; use {@link #builder(String)} to create one.
 */
public final class User {
  private final String userID;
  private final String email;
  private final String ip;
  private final String userAgent;
  private final String country;
  private final String locale;
  private final String appVersion;
  private final ImmutableMap<String, ConfigValue> custom;
  private final ImmutableMap<String, ConfigValue> privateAttributes;
  private final ImmutableMap<String, String> customIDs;
  private final ImmutableMap<String, String> environment;

  private User(Builder builder) {
    this.userID = builder.userID;
    this.email = builder.email;
    this.ip = builder.ip;
    this.userAgent = builder.userAgent;
    this.country = builder.country;
    this.locale = builder.locale;
    this.appVersion = builder.appVersion;
    this.custom = ImmutableMap.copyOf(builder.custom);
    this.privateAttributes = ImmutableMap.copyOf(builder.privateAttributes);
    this.customIDs = ImmutableMap.copyOf(builder.customIDs);
    this.environment = ImmutableMap.copyOf(builder.environment);
  }
  
  /**
   * Creates a user with only a primary id.
   * 
   * @param userID the primary id
   * @return a user
   */
  public static User of(String userID) {
    return builder(userID).build();
  }
  
  /**
   * Starts building a user.
   * 
   * @param userID the primary id; may be null if the user has custom ids
   * @return a builder
   */
  public static Builder builder(String userID) {
    return new Builder(userID);
  }
  
  /**
   * Returns a builder initialized with all of this user's attributes.
   * 
   * @return a builder
   */
  public Builder toBuilder() {
    Builder b = new Builder(userID);
    b.email = email;
    b.ip = ip;
    b.userAgent = userAgent;
    b.country = country;
    b.locale = locale;
    b.appVersion = appVersion;
    b.custom.putAll(custom);
    b.privateAttributes.putAll(privateAttributes);
    b.customIDs.putAll(customIDs);
    b.environment.putAll(environment);
    return b;
  }

  public String getUserID() {
    return userID;
  }

  public String getEmail() {
    return email;
  }

  public String getIp() {
    return ip;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public String getCountry() {
    return country;
  }

  public String getLocale() {
    return locale;
  }

  public String getAppVersion() {
    return appVersion;
  }

  public Map<String, ConfigValue> getCustom() {
    return custom;
  }

  public Map<String, ConfigValue> getPrivateAttributes() {
    return privateAttributes;
  }

  public Map<String, String> getCustomIDs() {
    return customIDs;
  }

  /**
   * Returns environment tags such as {@code tier}. When the client is configured with an
   * environment tier, the client's environment takes precedence over these values.
   * 
   * @return the environment map
   */
  public Map<String, String> getEnvironment() {
    return environment;
  }
  
  /**
   * Returns true if the user has a non-empty primary id or at least one non-empty custom id.
   * 
   * @return true if the user can be evaluated
   */
  public boolean hasIdentity() {
    if (userID != null && !userID.isEmpty()) {
      return true;
    }
    for (String id: customIDs.values()) {
      if (id != null && !id.isEmpty()) {
        return true;
      }
    }
    return false;
  }
  
  /**
   * Returns a JSON representation of this user suitable for events: private attributes are omitted.
   * 
   * @return an object value
   */
  public ConfigValue toLoggableValue() {
    ObjectBuilder b = ConfigValue.buildObject();
    putIfNotNull(b, "userID", userID);
    putIfNotNull(b, "email", email);
    putIfNotNull(b, "ip", ip);
    putIfNotNull(b, "userAgent", userAgent);
    putIfNotNull(b, "country", country);
    putIfNotNull(b, "locale", locale);
    putIfNotNull(b, "appVersion", appVersion);
    if (!custom.isEmpty()) {
      ObjectBuilder cb = ConfigValue.buildObject();
      for (Map.Entry<String, ConfigValue> e: custom.entrySet()) {
        cb.put(e.getKey(), e.getValue());
      }
      b.put("custom", cb.build());
    }
    if (!customIDs.isEmpty()) {
      b.put("customIDs", stringMapValue(customIDs));
    }
    if (!environment.isEmpty()) {
      b.put("environment", stringMapValue(environment));
    }
    return b.build();
  }
  
  private static void putIfNotNull(ObjectBuilder b, String key, String value) {
    if (value != null) {
      b.put(key, value);
    }
  }
  
  private static ConfigValue stringMapValue(Map<String, String> map) {
    ObjectBuilder b = ConfigValue.buildObject();
    for (Map.Entry<String, String> e: map.entrySet()) {
      b.put(e.getKey(), e.getValue());
    }
    return b.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof User)) return false;
    User other = (User)o;
    return Objects.equals(userID, other.userID) &&
        Objects.equals(email, other.email) &&
        Objects.equals(ip, other.ip) &&
        Objects.equals(userAgent, other.userAgent) &&
        Objects.equals(country, other.country) &&
        Objects.equals(locale, other.locale) &&
        Objects.equals(appVersion, other.appVersion) &&
        custom.equals(other.custom) &&
        privateAttributes.equals(other.privateAttributes) &&
        customIDs.equals(other.customIDs) &&
        environment.equals(other.environment);
  }

  @Override
  public int hashCode() {
    return Objects.hash(userID, email, ip, userAgent, country, locale, appVersion, custom,
        privateAttributes, customIDs, environment);
  }
  
  @Override
  public String toString() {
    return "User(" + toLoggableValue().toJsonString() + ")";
  }

  /**
   * A mutable object that uses the Builder pattern to specify properties for a {@link User}.
   */
  public static final class Builder {
    private String userID;
    private String email;
    private String ip;
    private String userAgent;
    private String country;
    private String locale;
    private String appVersion;
    private final Map<String, ConfigValue> custom = new HashMap<>();
    private final Map<String, ConfigValue> privateAttributes = new HashMap<>();
    private final Map<String, String> customIDs = new HashMap<>();
    private final Map<String, String> environment = new HashMap<>();
    
    Builder(String userID) {
      this.userID = userID;
    }
    
    public Builder userID(String userID) {
      this.userID = userID;
      return this;
    }

    public Builder email(String email) {
      this.email = email;
      return this;
    }

    public Builder ip(String ip) {
      this.ip = ip;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder country(String country) {
      this.country = country;
      return this;
    }

    public Builder locale(String locale) {
      this.locale = locale;
      return this;
    }

    public Builder appVersion(String appVersion) {
      this.appVersion = appVersion;
      return this;
    }
    
    /**
     * Sets a custom attribute. A null value removes the attribute.
     * 
     * @param name the attribute name
     * @param value the value
     * @return the builder
     */
    public Builder custom(String name, ConfigValue value) {
      if (value == null) {
        custom.remove(name);
      } else {
        custom.put(name, value);
      }
      return this;
    }
    
    public Builder custom(String name, String value) {
      return custom(name, value == null ? null : ConfigValue.of(value));
    }
    
    public Builder custom(String name, double value) {
      return custom(name, ConfigValue.of(value));
    }
    
    public Builder custom(String name, boolean value) {
      return custom(name, ConfigValue.of(value));
    }
    
    /**
     * Sets a private attribute: one that can be used in conditions but is never logged.
     * 
     * @param name the attribute name
     * @param value the value
     * @return the builder
     */
    public Builder privateAttribute(String name, ConfigValue value) {
      if (value == null) {
        privateAttributes.remove(name);
      } else {
        privateAttributes.put(name, value);
      }
      return this;
    }
    
    public Builder privateAttribute(String name, String value) {
      return privateAttribute(name, value == null ? null : ConfigValue.of(value));
    }
    
    /**
     * Sets a custom id such as {@code stableID}.
     * 
     * @param idType the id type
     * @param id the id value
     * @return the builder
     */
    public Builder customID(String idType, String id) {
      if (id == null) {
        customIDs.remove(idType);
      } else {
        customIDs.put(idType, id);
      }
      return this;
    }
    
    /**
     * Sets an environment tag such as {@code tier}.
     * 
     * @param name the tag name
     * @param value the tag value
     * @return the builder
     */
    public Builder environment(String name, String value) {
      if (value == null) {
        environment.remove(name);
      } else {
        environment.put(name, value);
      }
      return this;
    }
    
    public User build() {
      return new User(this);
    }
  }
}
