package com.switchyard.sdk.server.subsystems;

import com.launchdarkly.logging.LDLogger;
import com.switchyard.sdk.server.Components;

/**
 * Context information provided by the {@link com.switchyard.sdk.server.SwitchyardClient} when
 * creating components.
 * <p>
 * This is passed as a parameter to component factories such as
 * {@link com.switchyard.sdk.server.integrations.PollingDataSourceBuilder}. Component factories do not
 * receive the entire {@link com.switchyard.sdk.server.SwitchyardConfig} because it could contain
 * factory objects that they have no business using.
 */
public class ClientContext {
  private final String serverSecret;
  private final LDLogger baseLogger;
  private final HttpConfiguration http;
  private final LoggingConfiguration logging;
  private final boolean localMode;
  private final String sessionID;

  /**
   * Constructs an instance, specifying all properties.
   * 
   * @param serverSecret the server secret key
   * @param http the HTTP configuration
   * @param logging the logging configuration
   * @param localMode true if the client is in local mode
   * @param sessionID the id of this client instance, or null
   */
  public ClientContext(
      String serverSecret,
      HttpConfiguration http,
      LoggingConfiguration logging,
      boolean localMode,
      String sessionID
      ) {
    this.serverSecret = serverSecret;
    this.sessionID = sessionID;
    this.http = http;
    this.logging = logging;
    this.localMode = localMode;
    
    this.baseLogger = logging == null ? LDLogger.none() :
      LDLogger.withAdapter(logging.getLogAdapter(), logging.getBaseLoggerName());
  }
  
  /**
   * Copy constructor.
   * 
   * @param copyFrom the instance to copy from
   */
  protected ClientContext(ClientContext copyFrom) {
    this(copyFrom.serverSecret, copyFrom.http, copyFrom.logging, copyFrom.localMode, copyFrom.sessionID);
  }
  
  /**
   * Basic constructor for convenience in testing, using defaults for most properties.
   * 
   * @param serverSecret the server secret key
   */
  public ClientContext(String serverSecret) {
    this(serverSecret, defaultHttp(serverSecret), defaultLogging(), false, null);
  }
  
  private static HttpConfiguration defaultHttp(String serverSecret) {
    ClientContext minimalContext = new ClientContext(serverSecret, null, null, false, null);
    return Components.httpConfiguration().build(minimalContext);
  }
  
  private static LoggingConfiguration defaultLogging() {
    ClientContext minimalContext = new ClientContext("", null, null, false, null);
    return Components.logging().build(minimalContext);
  }
  
  /**
   * Returns the configured server secret.
   * 
   * @return the secret key
   */
  public String getServerSecret() {
    return serverSecret;
  }
  
  /**
   * The base logger for the SDK.
   * 
   * @return a logger instance
   */
  public LDLogger getBaseLogger() {
    return baseLogger;
  }

  /**
   * The configured networking properties that apply to all components.
   * 
   * @return the HTTP configuration
   */
  public HttpConfiguration getHttp() {
    return http;
  }

  /**
   * The configured logging properties that apply to all components.
   * 
   * @return the logging configuration
   */
  public LoggingConfiguration getLogging() {
    return logging;
  }
  
  /**
   * True if the SDK was configured for local mode, with no network activity.
   * 
   * @return true if in local mode
   */
  public boolean isLocalMode() {
    return localMode;
  }
  
  /**
   * Returns the random id generated for this client instance. It is sent with every request and
   * included in the SDK metadata of events.
   * 
   * @return the session id, or null if the context was not created by a client
   */
  public String getSessionID() {
    return sessionID;
  }
}
