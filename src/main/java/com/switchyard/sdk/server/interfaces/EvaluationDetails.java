package com.switchyard.sdk.server.interfaces;

import java.util.Objects;

/**
 * Describes where an evaluation's specs came from and why a result has the value it has.
 */
public final class EvaluationDetails {
  /**
   * Where the specs in the store came from.
   */
  public static enum Source {
    /** No specs have been loaded. */
    UNINITIALIZED("Uninitialized"),
    /** Specs were downloaded from Switchyard. */
    NETWORK("Network"),
    /** The last download reported that nothing had changed. */
    NETWORK_NOT_MODIFIED("NetworkNotModified"),
    /** Specs came from the bootstrap payload in the configuration. */
    BOOTSTRAP("Bootstrap"),
    /** Specs came from the configured data adapter. */
    DATA_ADAPTER("DataAdapter");
    
    private final String label;
    
    private Source(String label) {
      this.label = label;
    }
    
    @Override
    public String toString() {
      return label;
    }
  }
  
  /**
   * Qualifies the source for a particular evaluation.
   */
  public static enum Reason {
    /** Normal evaluation. */
    NONE(""),
    /** The value was forced by a local override. */
    LOCAL_OVERRIDE("LocalOverride"),
    /** The requested spec does not exist. */
    UNRECOGNIZED("Unrecognized"),
    /** The value was replayed from a persisted sticky assignment. */
    PERSISTED("Persisted"),
    /** The spec uses a condition type or operator this SDK does not support. */
    UNSUPPORTED("Unsupported"),
    /** An unexpected error occurred and a default was returned. */
    ERROR("Error");
    
    private final String label;
    
    private Reason(String label) {
      this.label = label;
    }
    
    @Override
    public String toString() {
      return label;
    }
  }
  
  private final Source source;
  private final Reason reason;
  private final long configSyncTime;
  private final long initTime;
  private final long serverTime;
  
  /**
   * Creates an instance.
   * 
   * @param source the spec source
   * @param reason the evaluation reason
   * @param configSyncTime the server time of the spec document in use
   * @param initTime the server time of the first spec document loaded
   * @param serverTime the local time of the evaluation
   */
  public EvaluationDetails(Source source, Reason reason, long configSyncTime, long initTime, long serverTime) {
    this.source = source;
    this.reason = reason;
    this.configSyncTime = configSyncTime;
    this.initTime = initTime;
    this.serverTime = serverTime;
  }
  
  public Source getSource() {
    return source;
  }
  
  public Reason getReason() {
    return reason;
  }
  
  public long getConfigSyncTime() {
    return configSyncTime;
  }
  
  public long getInitTime() {
    return initTime;
  }
  
  public long getServerTime() {
    return serverTime;
  }
  
  /**
   * Returns a copy with a different reason.
   * 
   * @param newReason the reason
   * @return a new instance
   */
  public EvaluationDetails withReason(Reason newReason) {
    return new EvaluationDetails(source, newReason, configSyncTime, initTime, serverTime);
  }
  
  /**
   * Returns the combined label logged with exposures: the source alone, or
   * {@code "Source:Reason"} when there is a reason.
   * 
   * @return the label
   */
  public String detailedReason() {
    if (reason == null || reason == Reason.NONE) {
      return source.toString();
    }
    return source + ":" + reason;
  }
  
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EvaluationDetails)) return false;
    EvaluationDetails other = (EvaluationDetails)o;
    return source == other.source && reason == other.reason && configSyncTime == other.configSyncTime &&
        initTime == other.initTime && serverTime == other.serverTime;
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(source, reason, configSyncTime, initTime, serverTime);
  }
  
  @Override
  public String toString() {
    return detailedReason();
  }
}
