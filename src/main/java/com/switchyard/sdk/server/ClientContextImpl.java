package com.switchyard.sdk.server;

import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.interfaces.RulesUpdatedCallback;
import com.switchyard.sdk.server.subsystems.ClientContext;
import com.switchyard.sdk.server.subsystems.DataAdapter;
import com.switchyard.sdk.server.subsystems.HttpConfiguration;
import com.switchyard.sdk.server.subsystems.LoggingConfiguration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * This is the package-private implementation of {@link ClientContext} that contains additional non-public
 * SDK objects that may be used by our internal components.
 * <p>
 * All component factories, whether they are built-in ones or custom ones from the application, receive a
 * {@link ClientContext} and can access its public properties. But only our built-in ones can see the
 * package-private properties, which they can do by calling {@code ClientContextImpl.get(ClientContext)}
 * to make sure that what they have is really a {@code ClientContextImpl} (as opposed to some other
 * implementation of {@link ClientContext}, which might have been created for instance in application
 * test code).
 */
final class ClientContextImpl extends ClientContext {
  private static volatile ScheduledExecutorService fallbackSharedExecutor = null;

  final ScheduledExecutorService sharedExecutor;
  final SpecStore store;
  final Diagnostics diagnostics;
  final ErrorBoundary errorBoundary;
  final ConfigValue sdkMetadata;
  final String bootstrapValues;
  final DataAdapter dataAdapter;
  final RulesUpdatedCallback rulesUpdatedCallback;
  final boolean disableAllLogging;

  private ClientContextImpl(
      ClientContext baseContext,
      ScheduledExecutorService sharedExecutor,
      SpecStore store,
      Diagnostics diagnostics,
      ErrorBoundary errorBoundary,
      String bootstrapValues,
      DataAdapter dataAdapter,
      RulesUpdatedCallback rulesUpdatedCallback,
      boolean disableAllLogging
  ) {
    super(baseContext);
    this.sharedExecutor = sharedExecutor;
    this.store = store;
    this.diagnostics = diagnostics;
    this.errorBoundary = errorBoundary;
    this.sdkMetadata = sdkMetadata(baseContext.getSessionID());
    this.bootstrapValues = bootstrapValues;
    this.dataAdapter = dataAdapter;
    this.rulesUpdatedCallback = rulesUpdatedCallback;
    this.disableAllLogging = disableAllLogging;
  }

  static ClientContextImpl fromConfig(
      String serverSecret,
      String sessionID,
      SwitchyardConfig config,
      ScheduledExecutorService sharedExecutor
      ) {
    ClientContext minimalContext = new ClientContext(serverSecret, null, null, config.localMode, sessionID);
    LoggingConfiguration loggingConfig = config.logging.build(minimalContext);

    ClientContext contextWithLogging = new ClientContext(serverSecret, null, loggingConfig,
        config.localMode, sessionID);
    HttpConfiguration httpConfig = config.http.build(contextWithLogging);

    if (httpConfig.getProxy() != null) {
      contextWithLogging.getBaseLogger().info("Using proxy: {}", httpConfig.getProxy());
    }

    ClientContext contextWithHttpAndLogging = new ClientContext(serverSecret, httpConfig, loggingConfig,
        config.localMode, sessionID);

    SpecStore store = new SpecStore(serverSecret,
        contextWithHttpAndLogging.getBaseLogger().subLogger(Loggers.DATA_STORE_LOGGER_NAME));
    Diagnostics diagnostics = new Diagnostics(
        contextWithHttpAndLogging.getBaseLogger().subLogger(Loggers.DIAGNOSTICS_LOGGER_NAME),
        config.disableDiagnostics || config.disableAllLogging);
    ErrorBoundary errorBoundary = new ErrorBoundary(
        contextWithHttpAndLogging.getBaseLogger().subLogger(Loggers.ERROR_BOUNDARY_LOGGER_NAME),
        config.observabilityClient);

    return new ClientContextImpl(
        contextWithHttpAndLogging,
        sharedExecutor,
        store,
        diagnostics,
        errorBoundary,
        config.bootstrapValues,
        config.dataAdapter,
        config.rulesUpdatedCallback,
        config.disableAllLogging
        );
  }

  static ConfigValue sdkMetadata(String sessionID) {
    return ConfigValue.buildObject()
        .put("sdkType", Version.SDK_TYPE)
        .put("sdkVersion", Version.SDK_VERSION)
        .put("sessionID", sessionID == null ? ConfigValue.ofNull() : ConfigValue.of(sessionID))
        .build();
  }

  /**
   * This mechanism is a convenience for internal components to access the package-private fields of the
   * context if it is a ClientContextImpl, and to receive standalone instances of those fields if it is not.
   * The latter case should only happen in application test code where the application developer has no
   * way to create our package-private ClientContextImpl. In that case, we also generate a temporary
   * sharedExecutor so components can work correctly in tests.
   */
  static ClientContextImpl get(ClientContext context) {
    if (context instanceof ClientContextImpl) {
      return (ClientContextImpl)context;
    }
    synchronized (ClientContextImpl.class) {
      if (fallbackSharedExecutor == null) {
        fallbackSharedExecutor = Executors.newSingleThreadScheduledExecutor();
      }
    }
    return new ClientContextImpl(
        context,
        fallbackSharedExecutor,
        new SpecStore(context.getServerSecret(), context.getBaseLogger().subLogger(Loggers.DATA_STORE_LOGGER_NAME)),
        new Diagnostics(context.getBaseLogger().subLogger(Loggers.DIAGNOSTICS_LOGGER_NAME), true),
        new ErrorBoundary(context.getBaseLogger().subLogger(Loggers.ERROR_BOUNDARY_LOGGER_NAME), null),
        null,
        null,
        null,
        false
        );
  }
}
