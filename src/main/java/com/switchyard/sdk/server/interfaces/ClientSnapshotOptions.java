package com.switchyard.sdk.server.interfaces;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Options for {@link SwitchyardClientInterface#getClientInitializeResponse(com.switchyard.sdk.User, ClientSnapshotOptions)}.
 */
public final class ClientSnapshotOptions {
  /**
   * Default options: sha256 name hashing, every entity, no key scoping.
   */
  public static final ClientSnapshotOptions DEFAULT = builder().build();
  
  private final String hashAlgorithm;
  private final String clientKey;
  private final String targetAppID;
  private final boolean includeLocalOverrides;
  private final Set<String> configTypesToInclude;
  private final boolean useControlForUsersNotInExperiment;
  
  private ClientSnapshotOptions(Builder b) {
    this.hashAlgorithm = b.hashAlgorithm == null ? "sha256" : b.hashAlgorithm;
    this.clientKey = b.clientKey;
    this.targetAppID = b.targetAppID;
    this.includeLocalOverrides = b.includeLocalOverrides;
    this.configTypesToInclude = b.configTypesToInclude == null ? null : ImmutableSet.copyOf(b.configTypesToInclude);
    this.useControlForUsersNotInExperiment = b.useControlForUsersNotInExperiment;
  }
  
  public static Builder builder() {
    return new Builder();
  }
  
  /**
   * The name hashing algorithm: {@code none}, {@code djb2} or {@code sha256}.
   * 
   * @return the algorithm
   */
  public String getHashAlgorithm() {
    return hashAlgorithm;
  }
  
  /**
   * The client key whose entity scope and target application should be applied, or null.
   * 
   * @return the client key or null
   */
  public String getClientKey() {
    return clientKey;
  }
  
  /**
   * An explicit target application; takes precedence over the one derived from the client key.
   * 
   * @return the target app id or null
   */
  public String getTargetAppID() {
    return targetAppID;
  }
  
  public boolean isIncludeLocalOverrides() {
    return includeLocalOverrides;
  }
  
  /**
   * The entity kinds to include (e.g. {@code feature_gate}, {@code experiment}), or null for all.
   * 
   * @return a set of entity kinds or null
   */
  public Set<String> getConfigTypesToInclude() {
    return configTypesToInclude;
  }
  
  /**
   * If true, users not allocated to an active experiment receive the control group's value.
   * 
   * @return true to use the control value
   */
  public boolean isUseControlForUsersNotInExperiment() {
    return useControlForUsersNotInExperiment;
  }
  
  /**
   * Builder for {@link ClientSnapshotOptions}.
   */
  public static final class Builder {
    private String hashAlgorithm;
    private String clientKey;
    private String targetAppID;
    private boolean includeLocalOverrides;
    private Set<String> configTypesToInclude;
    private boolean useControlForUsersNotInExperiment;
    
    Builder() {}
    
    public Builder hashAlgorithm(String hashAlgorithm) {
      this.hashAlgorithm = hashAlgorithm;
      return this;
    }
    
    public Builder clientKey(String clientKey) {
      this.clientKey = clientKey;
      return this;
    }
    
    public Builder targetAppID(String targetAppID) {
      this.targetAppID = targetAppID;
      return this;
    }
    
    public Builder includeLocalOverrides(boolean includeLocalOverrides) {
      this.includeLocalOverrides = includeLocalOverrides;
      return this;
    }
    
    public Builder configTypesToInclude(Set<String> configTypesToInclude) {
      this.configTypesToInclude = configTypesToInclude;
      return this;
    }
    
    public Builder useControlForUsersNotInExperiment(boolean useControlForUsersNotInExperiment) {
      this.useControlForUsersNotInExperiment = useControlForUsersNotInExperiment;
      return this;
    }
    
    public ClientSnapshotOptions build() {
      return new ClientSnapshotOptions(this);
    }
  }
}
