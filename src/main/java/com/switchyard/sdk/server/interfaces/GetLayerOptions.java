package com.switchyard.sdk.server.interfaces;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Options for {@link SwitchyardClientInterface#getLayer(com.switchyard.sdk.User, String, GetLayerOptions)}.
 * Persisted values apply to the experiment the layer delegates to.
 */
public final class GetLayerOptions {
  /**
   * Default options.
   */
  public static final GetLayerOptions DEFAULT = builder().build();
  
  private final Map<String, StickyValues> userPersistedValues;
  private final boolean ignorePersistence;
  private final boolean disableExposureLogging;
  
  private GetLayerOptions(Builder b) {
    this.userPersistedValues = b.userPersistedValues == null ? null : ImmutableMap.copyOf(b.userPersistedValues);
    this.ignorePersistence = b.ignorePersistence;
    this.disableExposureLogging = b.disableExposureLogging;
  }
  
  public static Builder builder() {
    return new Builder();
  }
  
  public Map<String, StickyValues> getUserPersistedValues() {
    return userPersistedValues;
  }
  
  public boolean isIgnorePersistence() {
    return ignorePersistence;
  }
  
  public boolean isDisableExposureLogging() {
    return disableExposureLogging;
  }
  
  /**
   * Builder for {@link GetLayerOptions}.
   */
  public static final class Builder {
    private Map<String, StickyValues> userPersistedValues;
    private boolean ignorePersistence;
    private boolean disableExposureLogging;
    
    Builder() {}
    
    public Builder userPersistedValues(Map<String, StickyValues> userPersistedValues) {
      this.userPersistedValues = userPersistedValues;
      return this;
    }
    
    public Builder ignorePersistence(boolean ignorePersistence) {
      this.ignorePersistence = ignorePersistence;
      return this;
    }
    
    public Builder disableExposureLogging(boolean disableExposureLogging) {
      this.disableExposureLogging = disableExposureLogging;
      return this;
    }
    
    public GetLayerOptions build() {
      return new GetLayerOptions(this);
    }
  }
}
