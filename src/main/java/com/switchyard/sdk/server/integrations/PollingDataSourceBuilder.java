package com.switchyard.sdk.server.integrations;

import com.switchyard.sdk.server.Components;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.DataSource;

import java.net.URI;
import java.time.Duration;

/**
 * Contains methods for configuring how the SDK downloads specs and id lists.
 * <p>
 * Create a builder with {@link Components#pollingDataSource()}, change its properties with the methods
 * of this class, and pass it to {@link com.switchyard.sdk.server.SwitchyardConfig.Builder#dataSource(ComponentConfigurer)}:
 * <pre><code>
 *     SwitchyardConfig config = new SwitchyardConfig.Builder()
 *         .dataSource(Components.pollingDataSource().configSyncInterval(Duration.ofSeconds(30)))
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#pollingDataSource()}.
 */
public abstract class PollingDataSourceBuilder implements ComponentConfigurer<DataSource> {
  /**
   * The default value for {@link #configSyncInterval(Duration)}: 10 seconds.
   */
  public static final Duration DEFAULT_CONFIG_SYNC_INTERVAL = Duration.ofSeconds(10);
  
  /**
   * The default value for {@link #idListSyncInterval(Duration)}: 60 seconds.
   */
  public static final Duration DEFAULT_ID_LIST_SYNC_INTERVAL = Duration.ofSeconds(60);
  
  protected URI apiBaseUri;
  protected URI cdnBaseUri;
  protected boolean disableCDN;
  protected boolean disableIdLists;
  protected Duration configSyncInterval = DEFAULT_CONFIG_SYNC_INTERVAL;
  protected Duration idListSyncInterval = DEFAULT_ID_LIST_SYNC_INTERVAL;
  
  /**
   * Sets the base URI of the Switchyard API, used for spec downloads when the CDN is not used and for
   * id lists.
   * 
   * @param apiBaseUri the base URI; null to use the default
   * @return the builder
   */
  public PollingDataSourceBuilder apiBaseUri(URI apiBaseUri) {
    this.apiBaseUri = apiBaseUri;
    return this;
  }
  
  /**
   * Sets the base URI of the content distribution endpoint that serves spec documents.
   * 
   * @param cdnBaseUri the base URI; null to use the default
   * @return the builder
   */
  public PollingDataSourceBuilder cdnBaseUri(URI cdnBaseUri) {
    this.cdnBaseUri = cdnBaseUri;
    return this;
  }
  
  /**
   * If true, spec documents are always downloaded from the API rather than the CDN.
   * 
   * @param disableCDN true to bypass the CDN
   * @return the builder
   */
  public PollingDataSourceBuilder disableCDN(boolean disableCDN) {
    this.disableCDN = disableCDN;
    return this;
  }
  
  /**
   * If true, id lists are never synced; segment conditions that use them will not match.
   * 
   * @param disableIdLists true to skip id lists
   * @return the builder
   */
  public PollingDataSourceBuilder disableIdLists(boolean disableIdLists) {
    this.disableIdLists = disableIdLists;
    return this;
  }
 
  /**
   * Sets the interval at which the SDK polls for spec updates.
   * 
   * @param configSyncInterval the polling interval; null to use the default 
   * @return the builder
   */
  public PollingDataSourceBuilder configSyncInterval(Duration configSyncInterval) {
    this.configSyncInterval = configSyncInterval == null ? DEFAULT_CONFIG_SYNC_INTERVAL : configSyncInterval;
    return this;
  }
  
  /**
   * Sets the interval at which the SDK polls for id list updates.
   * 
   * @param idListSyncInterval the polling interval; null to use the default 
   * @return the builder
   */
  public PollingDataSourceBuilder idListSyncInterval(Duration idListSyncInterval) {
    this.idListSyncInterval = idListSyncInterval == null ? DEFAULT_ID_LIST_SYNC_INTERVAL : idListSyncInterval;
    return this;
  }
}
