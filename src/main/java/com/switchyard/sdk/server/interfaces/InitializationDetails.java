package com.switchyard.sdk.server.interfaces;

/**
 * Describes how client startup went.
 */
public final class InitializationDetails {
  private final long durationMillis;
  private final boolean ready;
  private final EvaluationDetails.Source source;
  private final String failureReason;
  
  /**
   * Creates an instance.
   * 
   * @param durationMillis how long startup took
   * @param ready true if specs were loaded
   * @param source where the specs came from
   * @param failureReason a description of the failure, or null
   */
  public InitializationDetails(long durationMillis, boolean ready, EvaluationDetails.Source source,
      String failureReason) {
    this.durationMillis = durationMillis;
    this.ready = ready;
    this.source = source;
    this.failureReason = failureReason;
  }
  
  public long getDurationMillis() {
    return durationMillis;
  }
  
  public boolean isReady() {
    return ready;
  }
  
  public EvaluationDetails.Source getSource() {
    return source;
  }
  
  public String getFailureReason() {
    return failureReason;
  }
}
