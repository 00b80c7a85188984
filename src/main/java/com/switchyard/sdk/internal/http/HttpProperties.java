package com.switchyard.sdk.internal.http;

import java.net.Proxy;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import okhttp3.ConnectionPool;
import okhttp3.Headers;
import okhttp3.OkHttpClient;

/**
 * Internal container for HTTP parameters used by SDK components. Includes logic for creating an
 * OkHttp client.
 * <p>
 * This is separate from the public HTTP configuration builder. That is transformed into this when the
 * SDK is constructing components. The public API does not reference any OkHttp classes, but this
 * internal class does.
 */
public final class HttpProperties {
  private static final int DEFAULT_TIMEOUT = 10000;
  
  private final long connectTimeoutMillis;
  private final Map<String, String> defaultHeaders;
  private final Proxy proxy;
  private final long socketTimeoutMillis;

  /**
   * Constructs an instance.
   * 
   * @param connectTimeoutMillis connection timeout milliseconds
   * @param defaultHeaders headers to add to all requests
   * @param proxy optional proxy
   * @param socketTimeoutMillis socket timeout milliseconds
   */
  public HttpProperties(long connectTimeoutMillis, Map<String, String> defaultHeaders, Proxy proxy,
      long socketTimeoutMillis) {
    this.connectTimeoutMillis = connectTimeoutMillis <= 0 ? DEFAULT_TIMEOUT : connectTimeoutMillis;
    this.defaultHeaders = defaultHeaders == null ? Collections.<String, String>emptyMap() :
      Collections.unmodifiableMap(new LinkedHashMap<>(defaultHeaders));
    this.proxy = proxy;
    this.socketTimeoutMillis = socketTimeoutMillis <= 0 ? DEFAULT_TIMEOUT : socketTimeoutMillis;
  }
  
  /**
   * Returns a minimal set of properties.
   * 
   * @return a default instance
   */
  public static HttpProperties defaults() {
    return new HttpProperties(0, null, null, 0);
  }
  
  /**
   * Returns an immutable view of the default headers.
   * 
   * @return the default headers
   */
  public Iterable<Map.Entry<String, String>> getDefaultHeaders() {
    return defaultHeaders.entrySet();
  }

  /**
   * Applies the configured properties to an OkHttp client builder.
   * 
   * @param builder the client builder
   */
  public void applyToHttpClientBuilder(OkHttpClient.Builder builder) {
    builder.connectionPool(new ConnectionPool(5, 5, TimeUnit.SECONDS));
    builder.connectTimeout(connectTimeoutMillis, TimeUnit.MILLISECONDS);
    builder.readTimeout(socketTimeoutMillis, TimeUnit.MILLISECONDS)
      .writeTimeout(socketTimeoutMillis, TimeUnit.MILLISECONDS);
    builder.retryOnConnectionFailure(false); // we implement our own retry logic
  
    if (proxy != null) {
      builder.proxy(proxy);
    }
  }
  
  /**
   * Returns an OkHttp client builder initialized with the configured properties.
   * 
   * @return a client builder
   */
  public OkHttpClient.Builder toHttpClientBuilder() {
    OkHttpClient.Builder builder = new OkHttpClient.Builder();
    applyToHttpClientBuilder(builder);
    return builder;
  }
  
  /**
   * Returns an OkHttp Headers builder initialized with the default headers.
   * 
   * @return a Headers builder
   */
  public Headers.Builder toHeadersBuilder() {
    Headers.Builder builder = new Headers.Builder();
    for (Map.Entry<String, String> kv: getDefaultHeaders()) {
      builder.add(kv.getKey(), kv.getValue());
    }
    return builder;
  }

  /**
   * Attempts to completely shut down an OkHttp client.
   * 
   * @param client the client to stop
   */
  public static void shutdownHttpClient(OkHttpClient client) {
    if (client.dispatcher() != null) {
      client.dispatcher().cancelAll();
      if (client.dispatcher().executorService() != null) {
        client.dispatcher().executorService().shutdown();
      }
    }
    if (client.connectionPool() != null) {
      client.connectionPool().evictAll();
    }
  }
}
