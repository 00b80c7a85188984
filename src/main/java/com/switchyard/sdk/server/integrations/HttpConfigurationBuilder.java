package com.switchyard.sdk.server.integrations;

import com.switchyard.sdk.server.Components;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.HttpConfiguration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Contains methods for configuring the SDK's networking behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#httpConfiguration()}, change its properties with the methods of this class,
 * and pass it to {@link com.switchyard.sdk.server.SwitchyardConfig.Builder#http(ComponentConfigurer)}:
 * <pre><code>
 *     SwitchyardConfig config = new SwitchyardConfig.Builder()
 *         .http(
 *           Components.httpConfiguration()
 *             .connectTimeout(Duration.ofSeconds(3))
 *             .proxyHostAndPort("my-proxy", 8080)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#httpConfiguration()}.
 */
public abstract class HttpConfigurationBuilder implements ComponentConfigurer<HttpConfiguration> {
  /**
   * The default value for {@link #connectTimeout(Duration)}: two seconds.
   */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);
  
  /**
   * The default value for {@link #socketTimeout(Duration)}: 10 seconds.
   */
  public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(10);
  
  /**
   * The default value for {@link #maxRetries(int)}: 5.
   */
  public static final int DEFAULT_MAX_RETRIES = 5;

  protected Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
  protected String proxyHost;
  protected int proxyPort;
  protected Map<String, String> customHeaders = new HashMap<>();
  protected Duration socketTimeout = DEFAULT_SOCKET_TIMEOUT;
  protected int maxRetries = DEFAULT_MAX_RETRIES;
  
  /**
   * Sets the connection timeout. This is the time allowed for the SDK to make a socket connection to
   * any of the Switchyard services.
   * <p>
   * The default is {@link #DEFAULT_CONNECT_TIMEOUT}.
   * 
   * @param connectTimeout the connection timeout; null to use the default
   * @return the builder
   */
  public HttpConfigurationBuilder connectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    return this;
  }

  /**
   * Sets an HTTP proxy for making connections to Switchyard.
   *
   * @param host the proxy hostname
   * @param port the proxy port
   * @return the builder
   */
  public HttpConfigurationBuilder proxyHostAndPort(String host, int port) {
    this.proxyHost = host;
    this.proxyPort = port;
    return this;
  }

  /**
   * Sets the socket timeout. This is the amount of time without receiving data on a connection that the
   * SDK will tolerate before signaling an error.
   * <p>
   * The default is {@link #DEFAULT_SOCKET_TIMEOUT}.
   * 
   * @param socketTimeout the socket timeout; null to use the default
   * @return the builder
   */
  public HttpConfigurationBuilder socketTimeout(Duration socketTimeout) {
    this.socketTimeout = socketTimeout == null ? DEFAULT_SOCKET_TIMEOUT : socketTimeout;
    return this;
  }
  
  /**
   * Sets how many times a request that failed with a recoverable error is retried. Spec downloads
   * and event posts each have their own retry budget of this size.
   * <p>
   * The default is {@link #DEFAULT_MAX_RETRIES}; zero disables retries.
   * 
   * @param maxRetries the retry budget
   * @return the builder
   */
  public HttpConfigurationBuilder maxRetries(int maxRetries) {
    this.maxRetries = Math.max(0, maxRetries);
    return this;
  }

  /**
   * Specifies a custom HTTP header that should be added to all SDK requests.
   * <p>
   * This may be helpful if you are using a gateway or proxy server that requires a specific header in requests. You
   * may add any number of headers.
   *
   * @param headerName standard HTTP header
   * @param headerValue standard HTTP value
   * @return the builder
   */
  public HttpConfigurationBuilder addCustomHeader(String headerName, String headerValue) {
    this.customHeaders.put(headerName, headerValue);
    return this;
  }
}
