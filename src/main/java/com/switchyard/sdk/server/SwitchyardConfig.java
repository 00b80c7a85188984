package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.switchyard.sdk.server.interfaces.EvaluationCallbacks;
import com.switchyard.sdk.server.interfaces.RulesUpdatedCallback;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.CountryLookup;
import com.switchyard.sdk.server.subsystems.DataAdapter;
import com.switchyard.sdk.server.subsystems.DataSource;
import com.switchyard.sdk.server.subsystems.EventProcessor;
import com.switchyard.sdk.server.subsystems.HttpConfiguration;
import com.switchyard.sdk.server.subsystems.LoggingConfiguration;
import com.switchyard.sdk.server.subsystems.ObservabilityClient;
import com.switchyard.sdk.server.subsystems.UserAgentParser;
import com.switchyard.sdk.server.subsystems.UserPersistentStorage;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * This class exposes advanced configuration options for the {@link SwitchyardClient}. Instances of this
 * class must be constructed with a {@link com.switchyard.sdk.server.SwitchyardConfig.Builder}.
 */
public final class SwitchyardConfig {
  /**
   * The default value for {@link Builder#startWait(Duration)}: 5 seconds.
   */
  public static final Duration DEFAULT_START_WAIT = Duration.ofSeconds(5);

  /**
   * The environment tier used when none is configured.
   */
  public static final String DEFAULT_ENVIRONMENT_TIER = "production";

  static final String ENVIRONMENT_TIER_KEY = "tier";

  protected static final SwitchyardConfig DEFAULT = new Builder().build();

  final ComponentConfigurer<DataSource> dataSource;
  final ComponentConfigurer<EventProcessor> events;
  final ComponentConfigurer<HttpConfiguration> http;
  final ComponentConfigurer<LoggingConfiguration> logging;
  final ImmutableMap<String, String> environment;
  final Duration startWait;
  final boolean localMode;
  final String bootstrapValues;
  final DataAdapter dataAdapter;
  final UserPersistentStorage userPersistentStorage;
  final RulesUpdatedCallback rulesUpdatedCallback;
  final EvaluationCallbacks evaluationCallbacks;
  final UserAgentParser userAgentParser;
  final CountryLookup countryLookup;
  final ObservabilityClient observabilityClient;
  final boolean disableDiagnostics;
  final boolean disableAllLogging;

  protected SwitchyardConfig(Builder builder) {
    if (builder.localMode) {
      this.events = Components.noEvents();
    } else {
      this.events = builder.events == null ? Components.sendEvents() : builder.events;
    }
    this.dataSource = builder.dataSource == null ? Components.pollingDataSource() : builder.dataSource;
    this.http = builder.http == null ? Components.httpConfiguration() : builder.http;
    this.logging = builder.logging == null ? Components.logging() : builder.logging;
    Map<String, String> env = new HashMap<>(builder.environment);
    env.putIfAbsent(ENVIRONMENT_TIER_KEY, DEFAULT_ENVIRONMENT_TIER);
    this.environment = ImmutableMap.copyOf(env);
    this.startWait = builder.startWait;
    this.localMode = builder.localMode;
    this.bootstrapValues = builder.bootstrapValues;
    this.dataAdapter = builder.dataAdapter;
    this.userPersistentStorage = builder.userPersistentStorage;
    this.rulesUpdatedCallback = builder.rulesUpdatedCallback;
    this.evaluationCallbacks = builder.evaluationCallbacks;
    this.userAgentParser = builder.userAgentParser == null ? UserAgentParser.NONE : builder.userAgentParser;
    this.countryLookup = builder.countryLookup == null ? CountryLookup.NONE : builder.countryLookup;
    this.observabilityClient = builder.observabilityClient;
    this.disableDiagnostics = builder.disableDiagnostics;
    this.disableAllLogging = builder.disableAllLogging;
  }

  String getEnvironmentTier() {
    return environment.get(ENVIRONMENT_TIER_KEY);
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link com.switchyard.sdk.server.SwitchyardConfig} objects. Builder calls can be chained, enabling the
   * following pattern:
   * <pre>
   * SwitchyardConfig config = new SwitchyardConfig.Builder()
   *      .environmentTier("staging")
   *      .startWait(Duration.ofSeconds(2))
   *      .build()
   * </pre>
   */
  public static class Builder {
    private ComponentConfigurer<DataSource> dataSource = null;
    private ComponentConfigurer<EventProcessor> events = null;
    private ComponentConfigurer<HttpConfiguration> http = null;
    private ComponentConfigurer<LoggingConfiguration> logging = null;
    private final Map<String, String> environment = new HashMap<>();
    private Duration startWait = DEFAULT_START_WAIT;
    private boolean localMode = false;
    private String bootstrapValues = null;
    private DataAdapter dataAdapter = null;
    private UserPersistentStorage userPersistentStorage = null;
    private RulesUpdatedCallback rulesUpdatedCallback = null;
    private EvaluationCallbacks evaluationCallbacks = null;
    private UserAgentParser userAgentParser = null;
    private CountryLookup countryLookup = null;
    private ObservabilityClient observabilityClient = null;
    private boolean disableDiagnostics = false;
    private boolean disableAllLogging = false;

    /**
     * Creates a builder with all configuration parameters set to the default
     */
    public Builder() {
    }

    /**
     * Sets the implementation of the component that receives spec data.
     * <p>
     * The default is {@link Components#pollingDataSource()}; use it to obtain a builder and change the
     * sync intervals or endpoints.
     *
     * @param dataSourceConfigurer the data source configuration builder
     * @return the main configuration builder
     */
    public Builder dataSource(ComponentConfigurer<DataSource> dataSourceConfigurer) {
      this.dataSource = dataSourceConfigurer;
      return this;
    }

    /**
     * Sets the implementation of the component that delivers exposure and custom events.
     * <p>
     * The default is {@link Components#sendEvents()}; use {@link Components#noEvents()} to discard them.
     *
     * @param eventsConfigurer the events configuration builder
     * @return the main configuration builder
     */
    public Builder events(ComponentConfigurer<EventProcessor> eventsConfigurer) {
      this.events = eventsConfigurer;
      return this;
    }

    /**
     * Sets the SDK's networking configuration, using a configuration builder obtained from
     * {@link Components#httpConfiguration()}.
     *
     * @param httpConfigurer the HTTP configuration builder
     * @return the main configuration builder
     */
    public Builder http(ComponentConfigurer<HttpConfiguration> httpConfigurer) {
      this.http = httpConfigurer;
      return this;
    }

    /**
     * Sets the SDK's logging configuration, using a factory object obtained from
     * {@link Components#logging()}.
     *
     * @param loggingConfigurer the logging configuration builder
     * @return the main configuration builder
     */
    public Builder logging(ComponentConfigurer<LoggingConfiguration> loggingConfigurer) {
      this.logging = loggingConfigurer;
      return this;
    }

    /**
     * Sets the environment tier, such as {@code production}, {@code staging} or {@code development}.
     * Exposures are only sampled in production.
     *
     * @param tier the tier name
     * @return the builder
     */
    public Builder environmentTier(String tier) {
      if (tier != null) {
        environment.put(ENVIRONMENT_TIER_KEY, tier);
      }
      return this;
    }

    /**
     * Sets an environment parameter that is attached to every user evaluated by this client, unless
     * the user sets the same parameter itself.
     *
     * @param name the parameter name
     * @param value the value
     * @return the builder
     */
    public Builder environmentParameter(String name, String value) {
      if (name != null && value != null) {
        environment.put(name, value);
      }
      return this;
    }

    /**
     * Set how long the constructor will block awaiting a successful initial sync. Setting this to
     * a zero or negative duration will not block and cause the constructor to return immediately.
     * <p>
     * The default is {@link #DEFAULT_START_WAIT}.
     *
     * @param startWait maximum time to wait; null to use the default
     * @return the builder
     */
    public Builder startWait(Duration startWait) {
      this.startWait = startWait == null ? DEFAULT_START_WAIT : startWait;
      return this;
    }

    /**
     * Set whether the client performs no network I/O at all. Specs then come only from the bootstrap
     * values and the data adapter, and events are discarded. This is meant for tests that use local
     * overrides.
     *
     * @param localMode true to disable all network I/O
     * @return the builder
     */
    public Builder localMode(boolean localMode) {
      this.localMode = localMode;
      return this;
    }

    /**
     * Provides a spec document to initialize from while the store is empty, such as one saved by a
     * {@link RulesUpdatedCallback} in an earlier process.
     *
     * @param bootstrapValues a spec document in JSON
     * @return the builder
     */
    public Builder bootstrapValues(String bootstrapValues) {
      this.bootstrapValues = bootstrapValues;
      return this;
    }

    /**
     * Sets an external key/value source for specs and id lists.
     *
     * @param dataAdapter the adapter
     * @return the builder
     */
    public Builder dataAdapter(DataAdapter dataAdapter) {
      this.dataAdapter = dataAdapter;
      return this;
    }

    /**
     * Sets the storage used for sticky experiment assignments.
     *
     * @param userPersistentStorage the storage
     * @return the builder
     */
    public Builder userPersistentStorage(UserPersistentStorage userPersistentStorage) {
      this.userPersistentStorage = userPersistentStorage;
      return this;
    }

    /**
     * Sets a callback that receives every spec document downloaded from the network.
     *
     * @param rulesUpdatedCallback the callback
     * @return the builder
     */
    public Builder rulesUpdatedCallback(RulesUpdatedCallback rulesUpdatedCallback) {
      this.rulesUpdatedCallback = rulesUpdatedCallback;
      return this;
    }

    /**
     * Sets callbacks that observe every evaluation.
     *
     * @param evaluationCallbacks the callbacks
     * @return the builder
     */
    public Builder evaluationCallbacks(EvaluationCallbacks evaluationCallbacks) {
      this.evaluationCallbacks = evaluationCallbacks;
      return this;
    }

    /**
     * Sets the parser used by {@code ua_based} conditions. The default parses nothing.
     *
     * @param userAgentParser the parser
     * @return the builder
     */
    public Builder userAgentParser(UserAgentParser userAgentParser) {
      this.userAgentParser = userAgentParser;
      return this;
    }

    /**
     * Sets the lookup used by {@code ip_based} conditions. The default resolves nothing.
     *
     * @param countryLookup the lookup
     * @return the builder
     */
    public Builder countryLookup(CountryLookup countryLookup) {
      this.countryLookup = countryLookup;
      return this;
    }

    /**
     * Sets a collaborator that is told about internal errors.
     *
     * @param observabilityClient the client
     * @return the builder
     */
    public Builder observabilityClient(ObservabilityClient observabilityClient) {
      this.observabilityClient = observabilityClient;
      return this;
    }

    /**
     * Set to true to stop the SDK from collecting diagnostic markers.
     *
     * @param disableDiagnostics true to disable diagnostics
     * @return the builder
     */
    public Builder disableDiagnostics(boolean disableDiagnostics) {
      this.disableDiagnostics = disableDiagnostics;
      return this;
    }

    /**
     * Set to true to drop every exposure, custom and diagnostic event instead of sending it.
     *
     * @param disableAllLogging true to drop all events
     * @return the builder
     */
    public Builder disableAllLogging(boolean disableAllLogging) {
      this.disableAllLogging = disableAllLogging;
      return this;
    }

    /**
     * Builds the configured {@link com.switchyard.sdk.server.SwitchyardConfig} object.
     *
     * @return the {@link com.switchyard.sdk.server.SwitchyardConfig} configured by this builder
     */
    public SwitchyardConfig build() {
      return new SwitchyardConfig(this);
    }
  }
}
