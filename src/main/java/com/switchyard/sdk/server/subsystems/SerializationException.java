package com.switchyard.sdk.server.subsystems;

/**
 * General exception class for all errors in serializing or deserializing JSON.
 * <p>
 * The SDK uses this class to avoid depending on exception types from the underlying JSON framework
 * that it uses (currently Gson). Public SDK client methods never throw this exception; it is only
 * relevant when implementing custom components such as a {@link DataAdapter}.
 */
@SuppressWarnings("serial")
public class SerializationException extends RuntimeException {
  /**
   * Creates an instance.
   * @param cause the underlying exception
   */
  public SerializationException(Throwable cause) {
    super(cause);
  }
  
  /**
   * Creates an instance.
   * @param message a description of the problem
   */
  public SerializationException(String message) {
    super(message);
  }
}
