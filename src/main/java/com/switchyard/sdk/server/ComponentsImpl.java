package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;
import com.switchyard.sdk.internal.http.HttpConsts;
import com.switchyard.sdk.internal.http.HttpProperties;
import com.switchyard.sdk.server.integrations.EventProcessorBuilder;
import com.switchyard.sdk.server.integrations.HttpConfigurationBuilder;
import com.switchyard.sdk.server.integrations.LoggingConfigurationBuilder;
import com.switchyard.sdk.server.integrations.PollingDataSourceBuilder;
import com.switchyard.sdk.server.subsystems.ClientContext;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.DataSource;
import com.switchyard.sdk.server.subsystems.EventProcessor;
import com.switchyard.sdk.server.subsystems.EventSender;
import com.switchyard.sdk.server.subsystems.HttpConfiguration;
import com.switchyard.sdk.server.subsystems.LoggingConfiguration;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * This class contains the package-private implementations of component factories and builders whose
 * public factory methods are in {@link Components}.
 */
abstract class ComponentsImpl {
  private ComponentsImpl() {}

  static final ComponentConfigurer<EventProcessor> NOOP_EVENT_PROCESSOR_FACTORY = context -> NoOpEventProcessor.INSTANCE;

  static final class PollingDataSourceBuilderImpl extends PollingDataSourceBuilder {
    @Override
    public DataSource build(ClientContext context) {
      ClientContextImpl impl = ClientContextImpl.get(context);
      LDLogger baseLogger = context.getBaseLogger();
      LDLogger logger = baseLogger.subLogger(Loggers.DATA_SOURCE_LOGGER_NAME);

      SpecsRequestor requestor = null;
      if (context.isLocalMode()) {
        logger.info("Starting Switchyard client in local mode; no network requests will be made");
      } else {
        URI apiUri = selectBaseUri(apiBaseUri, StandardEndpoints.DEFAULT_API_BASE_URI, "api", baseLogger);
        URI cdnUri = null;
        if (!disableCDN) {
          cdnUri = selectBaseUri(cdnBaseUri, StandardEndpoints.DEFAULT_CDN_BASE_URI, "cdn", baseLogger);
        }
        requestor = new DefaultSpecsRequestor(
            toHttpProperties(context.getHttp()),
            context.getServerSecret(),
            apiUri,
            cdnUri,
            context.getHttp().getMaxRetries(),
            null,
            logger);
      }

      IdListSyncer idListSyncer = disableIdLists ? null : new IdListSyncer(
          impl.store,
          requestor,
          impl.dataAdapter,
          impl.diagnostics,
          impl.errorBoundary,
          logger);

      return new SyncProcessor(
          impl.store,
          requestor,
          impl.dataAdapter,
          impl.bootstrapValues,
          idListSyncer,
          impl.diagnostics,
          impl.errorBoundary,
          impl.rulesUpdatedCallback,
          impl.sharedExecutor,
          configSyncInterval,
          idListSyncInterval,
          context.getLogging() == null ? null : context.getLogging().getLogSyncOutageAsErrorAfter(),
          logger);
    }
  }

  static final class EventProcessorBuilderImpl extends EventProcessorBuilder {
    @Override
    public EventProcessor build(ClientContext context) {
      ClientContextImpl impl = ClientContextImpl.get(context);
      if (context.isLocalMode() || impl.disableAllLogging) {
        return NoOpEventProcessor.INSTANCE;
      }
      LDLogger logger = context.getBaseLogger().subLogger(Loggers.EVENTS_LOGGER_NAME);
      EventSender eventSender;
      if (eventSenderConfigurer == null) {
        eventSender = new DefaultEventSender(
            toHttpProperties(context.getHttp()),
            context.getHttp().getMaxRetries(),
            null, // null means default retry delay
            logger);
      } else {
        eventSender = eventSenderConfigurer.build(context);
      }
      URI eventsUri = selectBaseUri(apiBaseUri, StandardEndpoints.DEFAULT_API_BASE_URI, "events",
          context.getBaseLogger());
      return new DefaultEventProcessor(
          eventSender,
          eventsUri,
          capacity,
          flushInterval,
          impl.sdkMetadata,
          impl.diagnostics,
          impl.errorBoundary,
          impl.sharedExecutor,
          logger);
    }
  }

  static final class HttpConfigurationBuilderImpl extends HttpConfigurationBuilder {
    @Override
    public HttpConfiguration build(ClientContext clientContext) {
      // Build the default headers
      Map<String, String> headers = new HashMap<>();
      headers.put(HttpConsts.HEADER_API_KEY, clientContext.getServerSecret());
      headers.put(HttpConsts.HEADER_SDK_TYPE, Version.SDK_TYPE);
      headers.put(HttpConsts.HEADER_SDK_VERSION, Version.SDK_VERSION);
      headers.put("User-Agent", "SwitchyardJavaServer/" + Version.SDK_VERSION);
      if (clientContext.getSessionID() != null) {
        headers.put(HttpConsts.HEADER_SESSION_ID, clientContext.getSessionID());
      }

      if (!customHeaders.isEmpty()) {
        headers.putAll(customHeaders);
      }

      Proxy proxy = proxyHost == null ? null : new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort));

      return new HttpConfiguration(
          connectTimeout,
          headers,
          proxy,
          socketTimeout,
          maxRetries);
    }
  }

  static final class LoggingConfigurationBuilderImpl extends LoggingConfigurationBuilder {
    @Override
    public LoggingConfiguration build(ClientContext clientContext) {
      LDLogAdapter adapter = logAdapter == null ? getDefaultLogAdapter() : logAdapter;
      LDLogAdapter filteredAdapter = Logs.level(adapter,
          minimumLevel == null ? LDLogLevel.INFO : minimumLevel);
      // If the adapter is for a framework like SLF4J or java.util.logging that has its own external
      // configuration system, then calling Logs.level here has no effect and filteredAdapter will be
      // just the same as adapter.
      String name = baseName == null ? Loggers.BASE_LOGGER_NAME : baseName;
      return new LoggingConfiguration(name, filteredAdapter, logSyncOutageAsErrorAfter);
    }

    private static LDLogAdapter getDefaultLogAdapter() {
      // If SLF4J is present in the classpath, use that by default; otherwise use the console.
      try {
        Class.forName("org.slf4j.LoggerFactory");
        return LDSLF4J.adapter();
      } catch (ClassNotFoundException e) {
        return Logs.toConsole();
      }
    }
  }

  static URI selectBaseUri(URI configuredUri, URI defaultUri, String description, LDLogger logger) {
    if (configuredUri == null) {
      return defaultUri;
    }
    if (StandardEndpoints.isCustomBaseUri(configuredUri, defaultUri)) {
      logger.info("Using custom {} base URI: {}", description, configuredUri);
    }
    return configuredUri;
  }

  static HttpProperties toHttpProperties(HttpConfiguration httpConfig) {
    return new HttpProperties(
        httpConfig.getConnectTimeout().toMillis(),
        ImmutableMap.copyOf(httpConfig.getDefaultHeaders()),
        httpConfig.getProxy(),
        httpConfig.getSocketTimeout().toMillis());
  }
}
