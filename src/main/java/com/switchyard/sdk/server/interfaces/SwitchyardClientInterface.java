package com.switchyard.sdk.server.interfaces;

import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.User;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * This interface defines the public methods of {@link com.switchyard.sdk.server.SwitchyardClient}.
 * <p>
 * Applications will normally interact directly with {@link com.switchyard.sdk.server.SwitchyardClient}
 * and must use its constructor to initialize the SDK, but being able to refer to it indirectly via an
 * interface may be helpful in test scenarios.
 * <p>
 * None of the evaluation methods throw: an invalid user, an unknown name or an internal error
 * produces the default result (gate {@code false}, empty config).
 */
public interface SwitchyardClientInterface extends Closeable {
  /**
   * Tests whether the client has loaded specs from any source.
   *
   * @return true if the client is ready to evaluate
   */
  boolean isInitialized();
  
  /**
   * Returns details about how startup went.
   * 
   * @return the initialization details
   */
  InitializationDetails getInitializationDetails();

  /**
   * Evaluates a gate and logs an exposure.
   *
   * @param user the user
   * @param gateName the gate name
   * @return the gate value
   */
  boolean checkGate(User user, String gateName);
  
  /**
   * Evaluates a gate without logging an exposure.
   *
   * @param user the user
   * @param gateName the gate name
   * @return the gate value
   */
  boolean checkGateWithExposureLoggingDisabled(User user, String gateName);
  
  /**
   * Evaluates a gate, logs an exposure, and returns the full result.
   *
   * @param user the user
   * @param gateName the gate name
   * @return the gate result
   */
  FeatureGate getFeatureGate(User user, String gateName);
  
  /**
   * Logs a gate exposure as if {@link #checkGate(User, String)} had been called.
   * 
   * @param user the user
   * @param gateName the gate name
   */
  void manuallyLogGateExposure(User user, String gateName);

  DynamicConfig getConfig(User user, String configName);
  
  DynamicConfig getConfigWithExposureLoggingDisabled(User user, String configName);
  
  void manuallyLogConfigExposure(User user, String configName);
  
  DynamicConfig getExperiment(User user, String experimentName);
  
  /**
   * Evaluates an experiment, honoring and updating sticky assignments as specified by the options.
   * 
   * @param user the user
   * @param experimentName the experiment name
   * @param options persistence options
   * @return the experiment result
   */
  DynamicConfig getExperiment(User user, String experimentName, GetExperimentOptions options);
  
  DynamicConfig getExperimentWithExposureLoggingDisabled(User user, String experimentName);
  
  void manuallyLogExperimentExposure(User user, String experimentName);
  
  Layer getLayer(User user, String layerName);
  
  Layer getLayer(User user, String layerName, GetLayerOptions options);
  
  Layer getLayerWithExposureLoggingDisabled(User user, String layerName);
  
  void manuallyLogLayerParameterExposure(User user, String layerName, String parameterName);
  
  /**
   * Selects a bandit arm for the user and logs an exposure.
   * 
   * @param user the user
   * @param cmabName the CMAB name
   * @return the assignment
   */
  CMABAssignment getCMAB(User user, String cmabName);
  
  /**
   * Loads the sticky values stored for the user's unit id of the given id type.
   * 
   * @param user the user
   * @param idType the id type
   * @return a map of config name to sticky value; empty if nothing is stored or no storage is configured
   */
  Map<String, StickyValues> getUserPersistedValues(User user, String idType);
  
  /**
   * Removes a sticky assignment, so that the next evaluation re-buckets the user.
   * 
   * @param user the user
   * @param idType the id type
   * @param configName the experiment name
   */
  void deletePersistedValue(User user, String idType, String configName);
  
  /**
   * Queues a custom event.
   * 
   * @param user the user
   * @param eventName the event name
   * @param value an optional value
   * @param metadata optional metadata
   */
  void logEvent(User user, String eventName, ConfigValue value, Map<String, String> metadata);
  
  void overrideGate(String gateName, boolean value);
  
  /**
   * Forces a gate value for one user id or custom id.
   * 
   * @param gateName the gate name
   * @param value the forced value
   * @param id the user id or custom id the override applies to
   */
  void overrideGate(String gateName, boolean value, String id);
  
  void overrideConfig(String configName, Map<String, ConfigValue> value);
  
  void overrideConfig(String configName, Map<String, ConfigValue> value, String id);
  
  void overrideLayer(String layerName, Map<String, ConfigValue> value);
  
  void overrideLayer(String layerName, Map<String, ConfigValue> value, String id);
  
  void removeGateOverride(String gateName);
  
  void removeConfigOverride(String configName);
  
  void removeLayerOverride(String layerName);
  
  void removeAllOverrides();
  
  /**
   * Renders the bulk payload used to bootstrap a client-side SDK for this user.
   * 
   * @param user the user
   * @param options rendering options
   * @return the payload as an object value, or null if the client is not initialized
   */
  ConfigValue getClientInitializeResponse(User user, ClientSnapshotOptions options);
  
  /**
   * Returns the session replay settings from the current spec document.
   * 
   * @return an object value; empty if there are none
   */
  ConfigValue getSessionReplayInfo();

  /**
   * Flushes all pending events asynchronously.
   */
  void flush();

  /**
   * Shuts down the client: stops the background tasks, delivers pending events, and releases
   * storage. After this, evaluation methods return defaults.
   *
   * @throws IOException if an exception is thrown by one of the underlying network services
   */
  @Override
  void close() throws IOException;
  
  /**
   * Returns the current version string of the client library.
   * 
   * @return a version string conforming to Semantic Versioning (http://semver.org)
   */
  String version();
}
