package com.switchyard.sdk.internal.http;

/**
 * Header names and other constants shared by the SDK's HTTP components.
 * <p>
 * This class is for internal use only and should not be documented in the SDK API.
 */
public abstract class HttpConsts {
  private HttpConsts() {}
  
  /** Carries the server secret. */
  public static final String HEADER_API_KEY = "SWITCHYARD-API-KEY";
  /** The client's clock at the time of the request, in milliseconds. */
  public static final String HEADER_CLIENT_TIME = "SWITCHYARD-CLIENT-TIME";
  /** A random id generated once per client instance. */
  public static final String HEADER_SESSION_ID = "SWITCHYARD-SERVER-SESSION-ID";
  /** The SDK type, such as {@code java-server}. */
  public static final String HEADER_SDK_TYPE = "SWITCHYARD-SDK-TYPE";
  /** The SDK version. */
  public static final String HEADER_SDK_VERSION = "SWITCHYARD-SDK-VERSION";
  /** The number of events in a {@code log_event} batch. */
  public static final String HEADER_EVENT_COUNT = "SWITCHYARD-EVENT-COUNT";
}
