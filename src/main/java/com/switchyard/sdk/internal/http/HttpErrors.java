package com.switchyard.sdk.internal.http;

import com.launchdarkly.logging.LDLogger;

/**
 * Contains shared helpers related to HTTP response validation.
 * <p>
 * This class is for internal use only and should not be documented in the SDK API.
 */
public abstract class HttpErrors {
  private HttpErrors() {}
  
  /**
   * Represents an HTTP response that had an unsuccessful status.
   */
  @SuppressWarnings("serial")
  public static final class HttpErrorException extends Exception {
    private final int status;
    
    /**
     * Constructs an instance.
     * 
     * @param status the HTTP status
     */
    public HttpErrorException(int status) {
      super("HTTP error " + status);
      this.status = status;
    }
    
    /**
     * Returns the HTTP status.
     * 
     * @return the status
     */
    public int getStatus() {
      return status;
    }
  }
  
  /**
   * Tests whether an HTTP error status represents a condition that might resolve on its own if we retry.
   * Only these statuses are retried: 408, 500, 502, 503, 504, 522, 524, 599.
   * 
   * @param statusCode the HTTP status
   * @return true if retrying makes sense; false if it should be considered a terminal failure
   */
  public static boolean isHttpErrorRetryable(int statusCode) {
    switch (statusCode) {
    case 408: // request timeout
    case 500:
    case 502:
    case 503:
    case 504:
    case 522: // origin connection timed out
    case 524: // origin response timed out
    case 599: // network connect timeout
      return true;
    default:
      return false;
    }
  }
  
  /**
   * Logs an HTTP error or network error at the appropriate level and determines whether it is
   * retryable (as defined by {@link #isHttpErrorRetryable(int)}). Network errors are always retryable.
   *  
   * @param logger the logger to log to
   * @param errorDesc description of the error
   * @param errorContext a phrase like "when doing such-and-such"
   * @param statusCode HTTP status code, or 0 for a network error
   * @param recoverableMessage a phrase like "will retry" to use if the error is retryable
   * @return true if the error is retryable
   */
  public static boolean checkIfErrorIsRetryableAndLog(
      LDLogger logger,
      String errorDesc,
      String errorContext,
      int statusCode,
      String recoverableMessage
      ) {
    if (statusCode > 0 && !isHttpErrorRetryable(statusCode)) {
      logger.error("Error {} (giving up): {}", errorContext, errorDesc);
      return false;
    } else {
      logger.warn("Error {} ({}): {}", errorContext, recoverableMessage, errorDesc);
      return true;
    }
  }
  
  /**
   * Returns a human-readable description of an HTTP error status.
   * 
   * @param statusCode the HTTP status
   * @return a description
   */
  public static String httpErrorDescription(int statusCode) {
    return "HTTP error " + statusCode +
        (statusCode == 401 || statusCode == 403 ? " (invalid server secret)" : "");
  }
}
