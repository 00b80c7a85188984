package com.switchyard.sdk.server.interfaces;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Options for {@link SwitchyardClientInterface#getExperiment(com.switchyard.sdk.User, String, GetExperimentOptions)}.
 */
public final class GetExperimentOptions {
  /**
   * Default options: persisted values are loaded from the configured storage, if any.
   */
  public static final GetExperimentOptions DEFAULT = builder().build();
  
  private final Map<String, StickyValues> userPersistedValues;
  private final boolean ignorePersistence;
  
  private GetExperimentOptions(Builder b) {
    this.userPersistedValues = b.userPersistedValues == null ? null : ImmutableMap.copyOf(b.userPersistedValues);
    this.ignorePersistence = b.ignorePersistence;
  }
  
  public static Builder builder() {
    return new Builder();
  }
  
  /**
   * Returns the caller-supplied persisted values, or null to load them from storage.
   * 
   * @return a map of config name to sticky value, or null
   */
  public Map<String, StickyValues> getUserPersistedValues() {
    return userPersistedValues;
  }
  
  /**
   * Returns true if persisted values must not be read or written for this call.
   * 
   * @return true to ignore persistence
   */
  public boolean isIgnorePersistence() {
    return ignorePersistence;
  }
  
  /**
   * Builder for {@link GetExperimentOptions}.
   */
  public static final class Builder {
    private Map<String, StickyValues> userPersistedValues;
    private boolean ignorePersistence;
    
    Builder() {}
    
    /**
     * Supplies persisted values directly, for instance ones obtained earlier from
     * {@link SwitchyardClientInterface#getUserPersistedValues(com.switchyard.sdk.User, String)}.
     * 
     * @param userPersistedValues the values
     * @return the builder
     */
    public Builder userPersistedValues(Map<String, StickyValues> userPersistedValues) {
      this.userPersistedValues = userPersistedValues;
      return this;
    }
    
    /**
     * Evaluates as if nothing were persisted, and persists nothing.
     * 
     * @param ignorePersistence true to ignore persistence
     * @return the builder
     */
    public Builder ignorePersistence(boolean ignorePersistence) {
      this.ignorePersistence = ignorePersistence;
      return this;
    }
    
    public GetExperimentOptions build() {
      return new GetExperimentOptions(this);
    }
  }
}
