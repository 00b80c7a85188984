package com.switchyard.sdk.server;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ObjectBuilder;
import com.switchyard.sdk.User;
import com.switchyard.sdk.internal.http.HttpHelpers;
import com.switchyard.sdk.server.ExposureEventFactory.Exposure;
import com.switchyard.sdk.server.interfaces.CMABAssignment;
import com.switchyard.sdk.server.interfaces.ClientSnapshotOptions;
import com.switchyard.sdk.server.interfaces.DynamicConfig;
import com.switchyard.sdk.server.interfaces.EvaluationCallbacks;
import com.switchyard.sdk.server.interfaces.EvaluationDetails;
import com.switchyard.sdk.server.interfaces.EvaluationDetails.Reason;
import com.switchyard.sdk.server.interfaces.FeatureGate;
import com.switchyard.sdk.server.interfaces.GetExperimentOptions;
import com.switchyard.sdk.server.interfaces.GetLayerOptions;
import com.switchyard.sdk.server.interfaces.InitializationDetails;
import com.switchyard.sdk.server.interfaces.Layer;
import com.switchyard.sdk.server.interfaces.StickyValues;
import com.switchyard.sdk.server.interfaces.SwitchyardClientInterface;
import com.switchyard.sdk.server.subsystems.DataSource;
import com.switchyard.sdk.server.subsystems.EventProcessor;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A client for the Switchyard API. Client instances are thread-safe. Applications should instantiate
 * a single {@code SwitchyardClient} for the lifetime of their application, and close it exactly once
 * when shutting down.
 */
public final class SwitchyardClient implements SwitchyardClientInterface {
  static final String SECRET_PREFIX = "secret-";

  // Threads in the shared pool: one may be busy with a spec download while the other runs
  // event flushes and sampling resets.
  private static final int SHARED_EXECUTOR_THREADS = 2;

  private final SwitchyardConfig config;
  private final ClientContextImpl context;
  private final SpecStore store;
  private final LocalOverrides overrides = new LocalOverrides();
  private final Evaluator evaluator;
  private final TtlKeySet seenExposureKeys;
  private final ExposureEventFactory exposureFactory;
  private final PersistedValuesCache persistedValues;
  private final ClientSnapshotBuilder snapshotBuilder;
  private final ErrorBoundary errorBoundary;
  private final Diagnostics diagnostics;
  final EventProcessor eventProcessor;
  final DataSource dataSource;
  private final EvaluationCallbacks callbacks;
  private final ScheduledExecutorService sharedExecutor;
  private final LDLogger baseLogger;
  private final LDLogger evaluationLogger;
  private final long initDurationMillis;
  private final String initFailureReason;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a new client instance that connects to Switchyard with the default configuration.
   * <p>
   * The constructor blocks for up to {@link SwitchyardConfig#DEFAULT_START_WAIT} while the first
   * spec sync completes; if the sync has not finished by then, the client is still returned and
   * evaluations use default values until it does.
   *
   * @param serverSecret the server secret key, starting with {@code secret-}
   * @throws NullPointerException if the key is null
   * @throws IllegalArgumentException if the key is not a valid server secret
   * @see #SwitchyardClient(String, SwitchyardConfig)
   */
  public SwitchyardClient(String serverSecret) {
    this(serverSecret, SwitchyardConfig.DEFAULT);
  }

  /**
   * Creates a new client to connect to Switchyard with a custom configuration.
   *
   * @param serverSecret the server secret key, starting with {@code secret-}
   * @param config a client configuration object
   * @throws NullPointerException if a parameter is null
   * @throws IllegalArgumentException if the key is not a valid server secret
   */
  public SwitchyardClient(String serverSecret, SwitchyardConfig config) {
    checkNotNull(config, "config must not be null");
    checkNotNull(serverSecret, "serverSecret must not be null");
    if (serverSecret.isEmpty() || !serverSecret.startsWith(SECRET_PREFIX)) {
      throw new IllegalArgumentException("Invalid server secret key: it must start with \"" + SECRET_PREFIX + "\"");
    }
    if (!HttpHelpers.isAsciiHeaderValue(serverSecret)) {
      throw new IllegalArgumentException("Server secret key contained an invalid character");
    }
    this.config = config;
    long startTime = System.currentTimeMillis();

    this.sharedExecutor = createSharedExecutor();

    this.context = ClientContextImpl.fromConfig(
        serverSecret,
        UUID.randomUUID().toString(),
        config,
        sharedExecutor
    );
    this.baseLogger = context.getBaseLogger();
    this.evaluationLogger = baseLogger.subLogger(Loggers.EVALUATION_LOGGER_NAME);
    this.store = context.store;
    this.errorBoundary = context.errorBoundary;
    this.diagnostics = context.diagnostics;
    this.callbacks = config.evaluationCallbacks;

    diagnostics.markStart(Diagnostics.Context.INITIALIZE, Diagnostics.KEY_OVERALL, null);

    this.evaluator = new Evaluator(store, overrides, config.userAgentParser, config.countryLookup,
        evaluationLogger);
    this.seenExposureKeys = new TtlKeySet(sharedExecutor, TtlKeySet.DEFAULT_RESET_INTERVAL);
    this.exposureFactory = new ExposureEventFactory(
        new ExposureSampler(seenExposureKeys, store::getSdkConfigs, config.getEnvironmentTier()));
    this.persistedValues = new PersistedValuesCache(config.userPersistentStorage,
        baseLogger.subLogger(Loggers.DATA_STORE_LOGGER_NAME));
    this.snapshotBuilder = new ClientSnapshotBuilder(store, evaluator, context.sdkMetadata);

    this.eventProcessor = config.events.build(context);
    this.dataSource = config.dataSource.build(context);

    Future<Void> startFuture = dataSource.start();
    String failureReason = null;
    if (!config.startWait.isZero() && !config.startWait.isNegative()) {
      baseLogger.info("Waiting up to {} milliseconds for Switchyard client to start...",
          config.startWait.toMillis());
      try {
        startFuture.get(config.startWait.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        baseLogger.error("Timeout encountered waiting for Switchyard client initialization");
        failureReason = "Timed out after " + config.startWait.toMillis() + " ms";
      } catch (Exception e) {
        baseLogger.error("Exception encountered waiting for Switchyard client initialization: {}",
            LogValues.exceptionSummary(e));
        baseLogger.debug("{}", LogValues.exceptionTrace(e));
        failureReason = e.toString();
      }
      if (!dataSource.isInitialized()) {
        if (!config.localMode) {
          baseLogger.warn("Switchyard client was not successfully initialized");
        }
        if (failureReason == null) {
          failureReason = "No spec document was available";
        }
      }
    }
    this.initDurationMillis = System.currentTimeMillis() - startTime;
    this.initFailureReason = failureReason;
    diagnostics.markEnd(Diagnostics.Context.INITIALIZE, Diagnostics.KEY_OVERALL, null,
        dataSource.isInitialized(), null);
  }

  private static ScheduledExecutorService createSharedExecutor() {
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("Switchyard-tasks-%d")
        .setPriority(Thread.MIN_PRIORITY)
        .build();
    return Executors.newScheduledThreadPool(SHARED_EXECUTOR_THREADS, threadFactory);
  }

  @Override
  public boolean isInitialized() {
    return dataSource.isInitialized();
  }

  @Override
  public InitializationDetails getInitializationDetails() {
    boolean ready = isInitialized();
    return new InitializationDetails(initDurationMillis, ready, store.getSource(),
        ready ? null : initFailureReason);
  }

  @Override
  public boolean checkGate(User user, String gateName) {
    return evaluateGate("checkGate", user, gateName, true).getValue();
  }

  @Override
  public boolean checkGateWithExposureLoggingDisabled(User user, String gateName) {
    return evaluateGate("checkGateWithExposureLoggingDisabled", user, gateName, false).getValue();
  }

  @Override
  public FeatureGate getFeatureGate(User user, String gateName) {
    return evaluateGate("getFeatureGate", user, gateName, true);
  }

  @Override
  public void manuallyLogGateExposure(User user, String gateName) {
    errorBoundary.capture("manuallyLogGateExposure", () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return;
      }
      EvalResult result = evaluator.checkGate(EvalContext.of(u), gateName);
      queueExposure(exposureFactory.newGateExposure(u, gateName, result, true));
    });
  }

  @Override
  public DynamicConfig getConfig(User user, String configName) {
    return evaluateConfig("getConfig", user, configName, true);
  }

  @Override
  public DynamicConfig getConfigWithExposureLoggingDisabled(User user, String configName) {
    return evaluateConfig("getConfigWithExposureLoggingDisabled", user, configName, false);
  }

  @Override
  public void manuallyLogConfigExposure(User user, String configName) {
    errorBoundary.capture("manuallyLogConfigExposure", () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return;
      }
      EvalResult result = evaluator.getConfig(EvalContext.of(u), configName);
      queueExposure(exposureFactory.newConfigExposure(u, configName, result, true));
    });
  }

  @Override
  public DynamicConfig getExperiment(User user, String experimentName) {
    return getExperiment(user, experimentName, GetExperimentOptions.DEFAULT);
  }

  @Override
  public DynamicConfig getExperiment(User user, String experimentName, GetExperimentOptions options) {
    return evaluateExperiment("getExperiment", user, experimentName, options, true);
  }

  @Override
  public DynamicConfig getExperimentWithExposureLoggingDisabled(User user, String experimentName) {
    return evaluateExperiment("getExperimentWithExposureLoggingDisabled", user, experimentName,
        GetExperimentOptions.DEFAULT, false);
  }

  @Override
  public void manuallyLogExperimentExposure(User user, String experimentName) {
    errorBoundary.capture("manuallyLogExperimentExposure", () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return;
      }
      EvalResult result = evaluator.getExperiment(EvalContext.of(u), experimentName);
      queueExposure(exposureFactory.newConfigExposure(u, experimentName, result, true));
    });
  }

  @Override
  public Layer getLayer(User user, String layerName) {
    return getLayer(user, layerName, GetLayerOptions.DEFAULT);
  }

  @Override
  public Layer getLayer(User user, String layerName, GetLayerOptions options) {
    return evaluateLayer("getLayer", user, layerName, options == null ? GetLayerOptions.DEFAULT : options,
        options == null || !options.isDisableExposureLogging());
  }

  @Override
  public Layer getLayerWithExposureLoggingDisabled(User user, String layerName) {
    return evaluateLayer("getLayerWithExposureLoggingDisabled", user, layerName, GetLayerOptions.DEFAULT, false);
  }

  @Override
  public void manuallyLogLayerParameterExposure(User user, String layerName, String parameterName) {
    errorBoundary.capture("manuallyLogLayerParameterExposure", () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return;
      }
      EvalResult result = evaluator.getLayer(EvalContext.of(u), layerName);
      queueExposure(exposureFactory.newLayerExposure(u, layerName, result, parameterName, true));
    });
  }

  @Override
  public CMABAssignment getCMAB(User user, String cmabName) {
    return errorBoundary.capture("getCMAB", () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return emptyCMAB(cmabName, Reason.ERROR);
      }
      markApiCallStart("getCMAB");
      EvalResult result = evaluator.getCMAB(EvalContext.of(u), cmabName);
      queueExposure(exposureFactory.newConfigExposure(u, cmabName, result, false));
      markApiCallEnd("getCMAB");
      String ruleID = result.getRuleID();
      String groupID = null;
      if (result.isExperimentGroup()) {
        groupID = ruleID.endsWith(Evaluator.CMAB_EXPLORE_SUFFIX) ?
            ruleID.substring(0, ruleID.length() - Evaluator.CMAB_EXPLORE_SUFFIX.length()) : ruleID;
      }
      return new CMABAssignment(cmabName, groupID, result.getGroupName(), result.getJsonValue(), ruleID,
          result.getEvaluationDetails());
    }, () -> emptyCMAB(cmabName, Reason.ERROR));
  }

  @Override
  public Map<String, StickyValues> getUserPersistedValues(User user, String idType) {
    return errorBoundary.capture("getUserPersistedValues", () -> {
      User u = normalizeUser(user);
      return u == null ? Collections.<String, StickyValues>emptyMap() : persistedValues.load(u, idType);
    }, Collections::emptyMap);
  }

  @Override
  public void deletePersistedValue(User user, String idType, String configName) {
    errorBoundary.capture("deletePersistedValue", () -> {
      User u = normalizeUser(user);
      if (u != null) {
        persistedValues.delete(u, idType, configName);
      }
    });
  }

  @Override
  public void logEvent(User user, String eventName, ConfigValue value, Map<String, String> metadata) {
    errorBoundary.capture("logEvent", () -> {
      if (eventName == null || eventName.isEmpty()) {
        evaluationLogger.warn("logEvent called with an empty event name; the event was dropped");
        return;
      }
      User u = normalizeUser(user);
      if (u == null) {
        return;
      }
      eventProcessor.sendEvent(ExposureEventFactory.newCustomEvent(u, eventName, value, metadata));
    });
  }

  @Override
  public void overrideGate(String gateName, boolean value) {
    overrideGate(gateName, value, null);
  }

  @Override
  public void overrideGate(String gateName, boolean value, String id) {
    errorBoundary.capture("overrideGate", () -> overrides.overrideGate(gateName, value, id));
  }

  @Override
  public void overrideConfig(String configName, Map<String, ConfigValue> value) {
    overrideConfig(configName, value, null);
  }

  @Override
  public void overrideConfig(String configName, Map<String, ConfigValue> value, String id) {
    errorBoundary.capture("overrideConfig", () -> overrides.overrideConfig(configName, toObject(value), id));
  }

  @Override
  public void overrideLayer(String layerName, Map<String, ConfigValue> value) {
    overrideLayer(layerName, value, null);
  }

  @Override
  public void overrideLayer(String layerName, Map<String, ConfigValue> value, String id) {
    errorBoundary.capture("overrideLayer", () -> overrides.overrideLayer(layerName, toObject(value), id));
  }

  @Override
  public void removeGateOverride(String gateName) {
    overrides.removeGateOverride(gateName);
  }

  @Override
  public void removeConfigOverride(String configName) {
    overrides.removeConfigOverride(configName);
  }

  @Override
  public void removeLayerOverride(String layerName) {
    overrides.removeLayerOverride(layerName);
  }

  @Override
  public void removeAllOverrides() {
    overrides.removeAll();
  }

  @Override
  public ConfigValue getClientInitializeResponse(User user, ClientSnapshotOptions options) {
    return errorBoundary.capture("getClientInitializeResponse", () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return ConfigValue.ofNull();
      }
      if (!isInitialized()) {
        evaluationLogger.warn("getClientInitializeResponse called before the client was initialized");
      }
      markApiCallStart("getClientInitializeResponse");
      ConfigValue response = snapshotBuilder.build(u, options);
      markApiCallEnd("getClientInitializeResponse");
      return response;
    }, ConfigValue::ofNull);
  }

  @Override
  public ConfigValue getSessionReplayInfo() {
    ConfigValue info = store.getSessionReplayInfo();
    return info == null ? ConfigValue.ofNull() : info;
  }

  @Override
  public void flush() {
    this.eventProcessor.flush();
  }

  /**
   * Closes the client: stops syncing, sends any buffered events, and releases the client's threads.
   * Calling it again has no effect.
   *
   * @throws IOException if an exception is thrown by one of the underlying network services
   */
  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    baseLogger.info("Closing Switchyard client");
    try {
      this.dataSource.close();
      this.eventProcessor.close();
    } finally {
      this.seenExposureKeys.close();
      this.persistedValues.clear();
      this.sharedExecutor.shutdownNow();
    }
  }

  @Override
  public String version() {
    return Version.SDK_VERSION;
  }

  private FeatureGate evaluateGate(String tag, User user, String gateName, boolean logExposure) {
    return errorBoundary.capture(tag, () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return emptyGate(gateName);
      }
      markApiCallStart(tag);
      EvalResult result = evaluator.checkGate(EvalContext.of(u), gateName);
      Exposure exposure = exposureFactory.newGateExposure(u, gateName, result, false);
      if (logExposure) {
        queueExposure(exposure);
      }
      FeatureGate gate = new FeatureGate(gateName, result.getValue(), result.getRuleID(), result.getIdType(),
          result.getEvaluationDetails(), result.getSecondaryExposures());
      if (callbacks != null) {
        callbacks.onGate(u, gate, exposure.event);
      }
      markApiCallEnd(tag);
      return gate;
    }, () -> emptyGate(gateName));
  }

  private DynamicConfig evaluateConfig(String tag, User user, String configName, boolean logExposure) {
    return errorBoundary.capture(tag, () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return DynamicConfig.empty(configName, errorDetails());
      }
      markApiCallStart(tag);
      EvalResult result = evaluator.getConfig(EvalContext.of(u), configName);
      Exposure exposure = exposureFactory.newConfigExposure(u, configName, result, false);
      if (logExposure) {
        queueExposure(exposure);
      }
      DynamicConfig dc = toDynamicConfig(configName, result);
      if (callbacks != null) {
        callbacks.onConfig(u, dc, exposure.event);
      }
      markApiCallEnd(tag);
      return dc;
    }, () -> DynamicConfig.empty(configName, errorDetails()));
  }

  private DynamicConfig evaluateExperiment(String tag, User user, String experimentName,
      GetExperimentOptions options, boolean logExposure) {
    return errorBoundary.capture(tag, () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return DynamicConfig.empty(experimentName, errorDetails());
      }
      markApiCallStart(tag);
      GetExperimentOptions opts = options == null ? GetExperimentOptions.DEFAULT : options;
      Map<String, StickyValues> sticky = opts.isIgnorePersistence() ? null : opts.getUserPersistedValues();
      EvalResult result = evaluator.getExperiment(EvalContext.of(u).withPersistedValues(sticky), experimentName);
      if (sticky != null) {
        updatePersistedValue(u, experimentName, result, sticky, false);
      }
      Exposure exposure = exposureFactory.newConfigExposure(u, experimentName, result, false);
      if (logExposure) {
        queueExposure(exposure);
      }
      DynamicConfig dc = toDynamicConfig(experimentName, result);
      if (callbacks != null) {
        callbacks.onExperiment(u, dc, exposure.event);
      }
      markApiCallEnd(tag);
      return dc;
    }, () -> DynamicConfig.empty(experimentName, errorDetails()));
  }

  private Layer evaluateLayer(String tag, User user, String layerName, GetLayerOptions options,
      boolean logExposure) {
    return errorBoundary.capture(tag, () -> {
      User u = normalizeUser(user);
      if (u == null) {
        return Layer.empty(layerName, errorDetails());
      }
      markApiCallStart(tag);
      Map<String, StickyValues> sticky = options.isIgnorePersistence() ? null : options.getUserPersistedValues();
      EvalResult result = evaluator.getLayer(EvalContext.of(u).withPersistedValues(sticky), layerName);
      if (sticky != null) {
        updatePersistedValue(u, layerName, result, sticky, true);
      }
      Layer.ParameterExposureListener listener = (layer, parameterName) ->
          errorBoundary.capture("layerParameterExposure", () -> {
            Exposure exposure = exposureFactory.newLayerExposure(u, layerName, result, parameterName, false);
            if (logExposure) {
              queueExposure(exposure);
            }
            if (callbacks != null) {
              callbacks.onLayerParameter(u, layer, parameterName, exposure.event);
            }
          });
      Layer layer = new Layer(layerName, result.getJsonValue(), result.getRuleID(), result.getGroupName(),
          result.getConfigDelegate(), result.getEvaluationDetails(), result.getSecondaryExposures(), listener);
      markApiCallEnd(tag);
      return layer;
    }, () -> Layer.empty(layerName, errorDetails()));
  }

  // Saves a fresh assignment while its experiment is active; drops the saved one once it is not.
  // A layer result without a delegate carries no experiment of its own, so it only clears a stale entry.
  private void updatePersistedValue(User user, String name, EvalResult result, Map<String, StickyValues> persisted,
      boolean isLayer) {
    if (result.getEvaluationDetails() != null && result.getEvaluationDetails().getReason() == Reason.PERSISTED) {
      return;
    }
    String idType = result.getIdType();
    boolean experimentEvaluated = result.isExperimentActive() && !(isLayer && result.getConfigDelegate() == null);
    if (!experimentEvaluated) {
      if (persisted.containsKey(name)) {
        persistedValues.delete(user, idType, name);
      }
    } else if (result.isExperimentGroup()) {
      persistedValues.save(user, idType, name, result.toStickyValues(System.currentTimeMillis()));
    }
  }

  private void queueExposure(Exposure exposure) {
    if (exposure.shouldLog) {
      eventProcessor.sendEvent(exposure.event);
    }
  }

  private static DynamicConfig toDynamicConfig(String name, EvalResult result) {
    return new DynamicConfig(name, result.getJsonValue(), result.getRuleID(), result.getGroupName(),
        result.getIdType(), result.isExperimentGroup(), result.isExperimentActive(),
        result.getEvaluationDetails(), result.getSecondaryExposures());
  }

  /**
   * Returns the user with the configured environment parameters filled in, or null if the user
   * cannot be evaluated.
   */
  private User normalizeUser(User user) {
    if (user == null || !user.hasIdentity()) {
      errorBoundary.logException("validateUser",
          new IllegalArgumentException("A user must have a userID or at least one customID"), false);
      return null;
    }
    Map<String, String> env = config.environment;
    boolean missing = false;
    for (String key: env.keySet()) {
      if (!user.getEnvironment().containsKey(key)) {
        missing = true;
        break;
      }
    }
    if (!missing) {
      return user;
    }
    User.Builder b = user.toBuilder();
    for (Map.Entry<String, String> e: env.entrySet()) {
      if (!user.getEnvironment().containsKey(e.getKey())) {
        b.environment(e.getKey(), e.getValue());
      }
    }
    return b.build();
  }

  private void markApiCallStart(String api) {
    diagnostics.markStart(Diagnostics.Context.API_CALL, api, null);
  }

  private void markApiCallEnd(String api) {
    diagnostics.markEnd(Diagnostics.Context.API_CALL, api, null, true, null);
  }

  private EvaluationDetails errorDetails() {
    return store.createEvaluationDetails(Reason.ERROR);
  }

  private FeatureGate emptyGate(String gateName) {
    return new FeatureGate(gateName, false, "", null, errorDetails(), null);
  }

  private CMABAssignment emptyCMAB(String cmabName, Reason reason) {
    return new CMABAssignment(cmabName, null, null, null, "", store.createEvaluationDetails(reason));
  }

  private static ConfigValue toObject(Map<String, ConfigValue> map) {
    ObjectBuilder b = ConfigValue.buildObject();
    if (map != null) {
      for (Map.Entry<String, ConfigValue> e: map.entrySet()) {
        b.put(e.getKey(), e.getValue());
      }
    }
    return b.build();
  }
}
