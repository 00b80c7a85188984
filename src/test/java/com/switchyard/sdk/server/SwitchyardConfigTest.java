package com.switchyard.sdk.server;

import com.switchyard.sdk.server.integrations.HttpConfigurationBuilder;
import com.switchyard.sdk.server.integrations.LoggingConfigurationBuilder;
import com.switchyard.sdk.server.interfaces.EvaluationCallbacks;
import com.switchyard.sdk.server.interfaces.RulesUpdatedCallback;
import com.switchyard.sdk.server.subsystems.ClientContext;
import com.switchyard.sdk.server.subsystems.ComponentConfigurer;
import com.switchyard.sdk.server.subsystems.DataSource;
import com.switchyard.sdk.server.subsystems.EventProcessor;
import com.switchyard.sdk.server.subsystems.HttpConfiguration;
import com.switchyard.sdk.server.subsystems.LoggingConfiguration;
import com.switchyard.sdk.server.subsystems.UserAgentParser;
import com.switchyard.sdk.server.subsystems.UserPersistentStorage;

import org.junit.Test;

import java.time.Duration;

import static com.switchyard.sdk.server.TestComponents.specificDataSource;
import static com.switchyard.sdk.server.TestComponents.specificEventProcessor;
import static org.easymock.EasyMock.mock;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class SwitchyardConfigTest {
  private static final ClientContext BASIC_CONTEXT = new ClientContext("");

  @Test
  public void defaults() {
    SwitchyardConfig config = new SwitchyardConfig.Builder().build();
    assertNotNull(config.dataSource);
    assertEquals(Components.pollingDataSource().getClass(), config.dataSource.getClass());
    assertNotNull(config.events);
    assertEquals(Components.sendEvents().getClass(), config.events.getClass());
    assertFalse(config.localMode);
    assertFalse(config.disableDiagnostics);
    assertFalse(config.disableAllLogging);

    assertNotNull(config.http);
    HttpConfiguration httpConfig = config.http.build(BASIC_CONTEXT);
    assertEquals(HttpConfigurationBuilder.DEFAULT_CONNECT_TIMEOUT, httpConfig.getConnectTimeout());

    assertNotNull(config.logging);
    LoggingConfiguration loggingConfig = config.logging.build(BASIC_CONTEXT);
    assertEquals(LoggingConfigurationBuilder.DEFAULT_LOG_SYNC_OUTAGE_AS_ERROR_AFTER,
        loggingConfig.getLogSyncOutageAsErrorAfter());

    assertEquals(SwitchyardConfig.DEFAULT_START_WAIT, config.startWait);
    assertEquals(SwitchyardConfig.DEFAULT_ENVIRONMENT_TIER, config.getEnvironmentTier());
    assertNull(config.bootstrapValues);
    assertNull(config.dataAdapter);
    assertNull(config.userPersistentStorage);
    assertNull(config.evaluationCallbacks);
    assertSame(UserAgentParser.NONE, config.userAgentParser);
  }

  @Test
  public void dataSourceFactory() {
    ComponentConfigurer<DataSource> f = specificDataSource(null);
    SwitchyardConfig config = new SwitchyardConfig.Builder().dataSource(f).build();
    assertSame(f, config.dataSource);
  }

  @Test
  public void eventProcessorFactory() {
    ComponentConfigurer<EventProcessor> f = specificEventProcessor(null);
    SwitchyardConfig config = new SwitchyardConfig.Builder().events(f).build();
    assertSame(f, config.events);
  }

  @Test
  public void localModeReplacesEventProcessor() {
    ComponentConfigurer<EventProcessor> f = specificEventProcessor(null);
    SwitchyardConfig config = new SwitchyardConfig.Builder().events(f).localMode(true).build();
    assertTrue(config.localMode);
    assertSame(Components.noEvents(), config.events);
  }

  @Test
  public void startWait() {
    assertEquals(Duration.ofMillis(200),
        new SwitchyardConfig.Builder().startWait(Duration.ofMillis(200)).build().startWait);
    assertEquals(SwitchyardConfig.DEFAULT_START_WAIT,
        new SwitchyardConfig.Builder().startWait(null).build().startWait);
  }

  @Test
  public void environmentTierAndParameters() {
    SwitchyardConfig config = new SwitchyardConfig.Builder()
        .environmentTier("staging")
        .environmentParameter("region", "eu")
        .environmentParameter("ignored", null)
        .build();
    assertEquals("staging", config.getEnvironmentTier());
    assertEquals("eu", config.environment.get("region"));
    assertFalse(config.environment.containsKey("ignored"));

    assertEquals(SwitchyardConfig.DEFAULT_ENVIRONMENT_TIER,
        new SwitchyardConfig.Builder().environmentTier(null).build().getEnvironmentTier());
  }

  @Test
  public void pluggableComponents() {
    UserPersistentStorage storage = mock(UserPersistentStorage.class);
    RulesUpdatedCallback rulesUpdated = mock(RulesUpdatedCallback.class);
    EvaluationCallbacks callbacks = mock(EvaluationCallbacks.class);
    SwitchyardConfig config = new SwitchyardConfig.Builder()
        .userPersistentStorage(storage)
        .rulesUpdatedCallback(rulesUpdated)
        .evaluationCallbacks(callbacks)
        .bootstrapValues("{}")
        .build();
    assertSame(storage, config.userPersistentStorage);
    assertSame(rulesUpdated, config.rulesUpdatedCallback);
    assertSame(callbacks, config.evaluationCallbacks);
    assertEquals("{}", config.bootstrapValues);
  }

  @Test
  public void diagnosticsAndLoggingFlags() {
    SwitchyardConfig config = new SwitchyardConfig.Builder()
        .disableDiagnostics(true)
        .disableAllLogging(true)
        .build();
    assertTrue(config.disableDiagnostics);
    assertTrue(config.disableAllLogging);
  }
}
