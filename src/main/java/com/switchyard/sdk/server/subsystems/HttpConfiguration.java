package com.switchyard.sdk.server.subsystems;

import com.google.common.collect.ImmutableMap;
import com.switchyard.sdk.server.integrations.HttpConfigurationBuilder;

import java.net.Proxy;
import java.time.Duration;
import java.util.Map;

/**
 * Encapsulates top-level HTTP configuration that applies to all SDK components.
 * <p>
 * Use {@link HttpConfigurationBuilder} to construct an instance.
 */
public final class HttpConfiguration {
  private final Duration connectTimeout;
  private final Map<String, String> defaultHeaders;
  private final Proxy proxy;
  private final Duration socketTimeout;
  private final int maxRetries;
  
  /**
   * Creates an instance.
   * 
   * @param connectTimeout see {@link #getConnectTimeout()}
   * @param defaultHeaders see {@link #getDefaultHeaders()}
   * @param proxy see {@link #getProxy()}
   * @param socketTimeout see {@link #getSocketTimeout()}
   * @param maxRetries see {@link #getMaxRetries()}
   */
  public HttpConfiguration(Duration connectTimeout, Map<String, String> defaultHeaders, Proxy proxy,
      Duration socketTimeout, int maxRetries) {
    this.connectTimeout = connectTimeout == null ? HttpConfigurationBuilder.DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    this.defaultHeaders = defaultHeaders == null ? ImmutableMap.<String, String>of() : ImmutableMap.copyOf(defaultHeaders);
    this.proxy = proxy;
    this.socketTimeout = socketTimeout == null ? HttpConfigurationBuilder.DEFAULT_SOCKET_TIMEOUT : socketTimeout;
    this.maxRetries = maxRetries;
  }

  /**
   * The connection timeout. This is the time allowed for the underlying HTTP client to connect
   * to the Switchyard server.
   * 
   * @return the connection timeout; never null
   */
  public Duration getConnectTimeout() {
    return connectTimeout;
  }
  
  /**
   * Returns the basic headers that should be added to all HTTP requests from SDK components. This
   * includes the secret key header and SDK metadata headers.
   * 
   * @return a list of HTTP header names and values
   */
  public Iterable<Map.Entry<String, String>> getDefaultHeaders() {
    return defaultHeaders.entrySet();
  }
  
  /**
   * The proxy configuration, if any.
   * 
   * @return a proxy or null
   */
  public Proxy getProxy() {
    return proxy;
  }

  /**
   * The socket timeout. This is the amount of time without receiving data on a connection that the
   * SDK will tolerate before signaling an error.
   * 
   * @return the socket timeout; never null
   */
  public Duration getSocketTimeout() {
    return socketTimeout;
  }
  
  /**
   * The number of times a request that failed with a retryable error will be retried.
   * 
   * @return the retry budget
   */
  public int getMaxRetries() {
    return maxRetries;
  }
}
