package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogLevel;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.User;
import com.switchyard.sdk.server.DataModel.SpecsResponse;
import com.switchyard.sdk.server.TestComponents.InMemoryPersistentStorage;
import com.switchyard.sdk.server.TestComponents.MockDataSource;
import com.switchyard.sdk.server.TestComponents.TestEventProcessor;
import com.switchyard.sdk.server.interfaces.DynamicConfig;
import com.switchyard.sdk.server.interfaces.EvaluationCallbacks;
import com.switchyard.sdk.server.interfaces.EvaluationDetails.Reason;
import com.switchyard.sdk.server.interfaces.EvaluationDetails.Source;
import com.switchyard.sdk.server.interfaces.Event;
import com.switchyard.sdk.server.interfaces.FeatureGate;
import com.switchyard.sdk.server.interfaces.GetExperimentOptions;
import com.switchyard.sdk.server.interfaces.GetLayerOptions;
import com.switchyard.sdk.server.interfaces.InitializationDetails;
import com.switchyard.sdk.server.interfaces.Layer;
import com.switchyard.sdk.server.interfaces.StickyValues;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.switchyard.sdk.server.ModelBuilders.alwaysOnGate;
import static com.switchyard.sdk.server.ModelBuilders.configBuilder;
import static com.switchyard.sdk.server.ModelBuilders.experimentBuilder;
import static com.switchyard.sdk.server.ModelBuilders.layerBuilder;
import static com.switchyard.sdk.server.ModelBuilders.publicCondition;
import static com.switchyard.sdk.server.ModelBuilders.ruleBuilder;
import static com.switchyard.sdk.server.ModelBuilders.specsBuilder;
import static com.switchyard.sdk.server.TestComponents.SERVER_SECRET;
import static com.switchyard.sdk.server.TestComponents.dataSourceWithSpecs;
import static com.switchyard.sdk.server.TestComponents.specificDataSource;
import static com.switchyard.sdk.server.TestComponents.specificEventProcessor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class SwitchyardClientTest extends BaseTest {
  private static final User user = User.of("user-1");
  private static final ConfigValue configValue = ConfigValue.buildObject().put("color", "blue").put("size", 3).build();

  private final TestEventProcessor eventProcessor = new TestEventProcessor();

  private static SpecsResponse standardSpecs() {
    return specsBuilder(100)
        .gates(alwaysOnGate("gate-on"))
        .configs(
            configBuilder("config").rules(ruleBuilder("config-rule").returnValue(configValue)
                .conditions(publicCondition()).build()).build(),
            experimentBuilder("exp").explicitParameters("size").rules(
                ruleBuilder("exp-rule").groupName("Test").experimentGroup(true)
                    .returnValue(ConfigValue.buildObject().put("size", 10).put("shape", "square").build())
                    .conditions(publicCondition()).build()).build())
        .layerConfigs(layerBuilder("layer").defaultValue(ConfigValue.buildObject().put("size", 1).put("shape", "round").build())
            .rules(ruleBuilder("alloc").configDelegate("exp").conditions(publicCondition()).build()).build())
        .layer("layer", "exp")
        .sessionReplayInfo(ConfigValue.buildObject().put("recording_blocked", false).build())
        .build();
  }

  private SwitchyardClient makeClient(SwitchyardConfig.Builder config) {
    return new SwitchyardClient(SERVER_SECRET, config.build());
  }

  private SwitchyardClient makeClient() {
    return makeClient(baseConfig().dataSource(dataSourceWithSpecs(standardSpecs()))
        .events(specificEventProcessor(eventProcessor)));
  }

  private Event onlyEvent() {
    assertEquals(1, eventProcessor.events.size());
    return eventProcessor.events.poll();
  }

  @Test(expected = NullPointerException.class)
  public void constructorThrowsExceptionForNullSecret() throws Exception {
    try (SwitchyardClient client = new SwitchyardClient(null, baseConfig().build())) {
      fail("expected exception");
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructorThrowsExceptionForSecretWithoutPrefix() throws Exception {
    try (SwitchyardClient client = new SwitchyardClient("client-key", baseConfig().build())) {
      fail("expected exception");
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructorThrowsExceptionForSecretWithInvalidCharacter() throws Exception {
    try (SwitchyardClient client = new SwitchyardClient("secret-abc\ndef", baseConfig().build())) {
      fail("expected exception");
    }
  }

  @Test
  public void initializationDetailsReportReadyClient() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      assertTrue(client.isInitialized());
      InitializationDetails details = client.getInitializationDetails();
      assertTrue(details.isReady());
      assertEquals(Source.NETWORK, details.getSource());
      assertNull(details.getFailureReason());
      assertTrue(details.getDurationMillis() >= 0);
    }
  }

  @Test
  public void initializationDetailsReportFailure() throws Exception {
    try (SwitchyardClient client = makeClient(baseConfig())) {
      assertFalse(client.isInitialized());
      InitializationDetails details = client.getInitializationDetails();
      assertFalse(details.isReady());
      assertEquals(Source.UNINITIALIZED, details.getSource());
      assertEquals("No spec document was available", details.getFailureReason());
    }
  }

  @Test
  public void checkGateLogsExposure() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      assertTrue(client.checkGate(user, "gate-on"));

      Event e = onlyEvent();
      assertEquals(ExposureEventFactory.GATE_EXPOSURE_EVENT, e.getEventName());
      assertEquals("gate-on", e.getMetadata().get("gate"));
      assertEquals("true", e.getMetadata().get("gateValue"));
      assertEquals("rule-on", e.getMetadata().get("ruleID"));
      assertEquals("Network", e.getMetadata().get("reason"));
      assertEquals("production", e.getUser().getEnvironment().get("tier"));
    }
  }

  @Test
  public void unknownGateIsFalse() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      FeatureGate gate = client.getFeatureGate(user, "nope");
      assertFalse(gate.getValue());
      assertEquals(Reason.UNRECOGNIZED, gate.getEvaluationDetails().getReason());
    }
  }

  @Test
  public void exposureLoggingCanBeDisabled() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      assertTrue(client.checkGateWithExposureLoggingDisabled(user, "gate-on"));
      assertEquals(configValue, client.getConfigWithExposureLoggingDisabled(user, "config").getValue());
      client.getExperimentWithExposureLoggingDisabled(user, "exp");
      client.getLayerWithExposureLoggingDisabled(user, "layer").getInt("size", 0);
      client.getLayer(user, "layer", GetLayerOptions.builder().disableExposureLogging(true).build())
          .getInt("size", 0);
      assertEquals(0, eventProcessor.events.size());
    }
  }

  @Test
  public void manualExposuresAreMarked() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      client.manuallyLogGateExposure(user, "gate-on");
      Event gate = onlyEvent();
      assertEquals("true", gate.getMetadata().get("isManualExposure"));

      client.manuallyLogConfigExposure(user, "config");
      assertEquals(ExposureEventFactory.CONFIG_EXPOSURE_EVENT, onlyEvent().getEventName());

      client.manuallyLogExperimentExposure(user, "exp");
      assertEquals("exp", onlyEvent().getMetadata().get("config"));

      client.manuallyLogLayerParameterExposure(user, "layer", "size");
      Event layer = onlyEvent();
      assertEquals(ExposureEventFactory.LAYER_EXPOSURE_EVENT, layer.getEventName());
      assertEquals("size", layer.getMetadata().get("parameterName"));
      assertEquals("true", layer.getMetadata().get("isManualExposure"));
    }
  }

  @Test
  public void getConfigReturnsValueAndLogsExposure() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      DynamicConfig config = client.getConfig(user, "config");
      assertEquals(configValue, config.getValue());
      assertEquals("config-rule", config.getRuleID());
      assertEquals("blue", config.getString("color", "none"));
      assertEquals(3, config.getInt("size", 0));
      assertEquals(7, config.getInt("missing", 7));

      Event e = onlyEvent();
      assertEquals(ExposureEventFactory.CONFIG_EXPOSURE_EVENT, e.getEventName());
      assertEquals("config", e.getMetadata().get("config"));
      assertEquals("config-rule", e.getMetadata().get("ruleID"));
    }
  }

  @Test
  public void getExperimentReportsGroup() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      DynamicConfig exp = client.getExperiment(user, "exp");
      assertEquals(10, exp.getInt("size", 0));
      assertEquals("Test", exp.getGroupName());
      assertTrue(exp.isUserInExperiment());
      assertTrue(exp.isExperimentActive());
      assertEquals(1, eventProcessor.events.size());
    }
  }

  @Test
  public void layerParameterAccessLogsExposure() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      Layer layer = client.getLayer(user, "layer");
      assertEquals("exp", layer.getAllocatedExperimentName());
      assertEquals(0, eventProcessor.events.size());

      assertEquals(10, layer.getInt("size", 0));
      Event e = onlyEvent();
      assertEquals("layer", e.getMetadata().get("config"));
      assertEquals("exp", e.getMetadata().get("allocatedExperiment"));
      assertEquals("true", e.getMetadata().get("isExplicitParameter"));

      assertEquals("square", layer.getString("shape", ""));
      Event implicit = onlyEvent();
      assertEquals("", implicit.getMetadata().get("allocatedExperiment"));
      assertEquals("false", implicit.getMetadata().get("isExplicitParameter"));

      assertEquals(0, layer.getInt("unknown", 0));
      assertEquals(0, eventProcessor.events.size());
    }
  }

  @Test
  public void invalidUserGetsDefaultsWithoutEvents() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      User noId = User.builder(null).email("x@example.com").build();
      assertFalse(client.checkGate(noId, "gate-on"));
      assertThat(client.getConfig(noId, "config").getValue().asMap(), anEmptyMap());
      assertEquals(Reason.ERROR, client.getConfig(null, "config").getEvaluationDetails().getReason());
      client.logEvent(noId, "purchase", null, null);

      assertEquals(0, eventProcessor.events.size());
      assertTrue(hasLogMessage(LDLogLevel.ERROR, "A user must have a userID or at least one customID"));
    }
  }

  @Test
  public void customIdIsEnoughToEvaluate() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      assertTrue(client.checkGate(User.builder(null).customID("stableID", "s-1").build(), "gate-on"));
    }
  }

  @Test
  public void environmentIsAddedToUsers() throws Exception {
    try (SwitchyardClient client = makeClient(baseConfig().dataSource(dataSourceWithSpecs(standardSpecs()))
        .events(specificEventProcessor(eventProcessor)).environmentTier("staging")
        .environmentParameter("region", "eu"))) {
      client.checkGate(user, "gate-on");
      Map<String, String> env = onlyEvent().getUser().getEnvironment();
      assertEquals("staging", env.get("tier"));
      assertEquals("eu", env.get("region"));

      client.checkGate(user.toBuilder().environment("tier", "development").build(), "gate-on");
      assertEquals("development", onlyEvent().getUser().getEnvironment().get("tier"));
    }
  }

  @Test
  public void logEventSendsCustomEvent() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      client.logEvent(user, "purchase", ConfigValue.of(9.99), ImmutableMap.of("sku", "abc"));
      Event e = onlyEvent();
      assertEquals("purchase", e.getEventName());
      assertEquals(ConfigValue.of(9.99), e.getValue());
      assertEquals("abc", e.getMetadata().get("sku"));

      client.logEvent(user, "", null, null);
      assertEquals(0, eventProcessor.events.size());
      assertTrue(hasLogMessage(LDLogLevel.WARN, "empty event name"));
    }
  }

  @Test
  public void overridesTakePrecedenceUntilRemoved() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      client.overrideGate("gate-on", false);
      client.overrideConfig("config", ImmutableMap.of("color", ConfigValue.of("red")));
      client.overrideLayer("layer", ImmutableMap.of("size", ConfigValue.of(99)));

      assertFalse(client.checkGate(user, "gate-on"));
      assertEquals(Reason.LOCAL_OVERRIDE, client.getFeatureGate(user, "gate-on").getEvaluationDetails().getReason());
      assertEquals("red", client.getConfig(user, "config").getString("color", ""));
      assertEquals(99, client.getLayer(user, "layer").getInt("size", 0));

      client.removeGateOverride("gate-on");
      assertTrue(client.checkGate(user, "gate-on"));

      client.removeAllOverrides();
      assertEquals("blue", client.getConfig(user, "config").getString("color", ""));
      assertEquals(10, client.getLayer(user, "layer").getInt("size", 0));
    }
  }

  @Test
  public void overrideForSpecificUserOnlyAppliesToThatUser() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      client.overrideGate("gate-on", false, "user-2");
      assertTrue(client.checkGate(user, "gate-on"));
      assertFalse(client.checkGate(User.of("user-2"), "gate-on"));
    }
  }

  @Test
  public void evaluationCallbacksReceiveResults() throws Exception {
    List<String> calls = new CopyOnWriteArrayList<>();
    EvaluationCallbacks callbacks = new EvaluationCallbacks() {
      @Override
      public void onGate(User u, FeatureGate gate, Event exposure) {
        calls.add("gate:" + gate.getName() + "=" + gate.getValue());
      }

      @Override
      public void onConfig(User u, DynamicConfig config, Event exposure) {
        calls.add("config:" + config.getName());
      }

      @Override
      public void onExperiment(User u, DynamicConfig experiment, Event exposure) {
        calls.add("experiment:" + experiment.getName());
      }

      @Override
      public void onLayerParameter(User u, Layer layer, String parameterName, Event exposure) {
        calls.add("layer:" + layer.getName() + "." + parameterName);
      }
    };
    try (SwitchyardClient client = makeClient(baseConfig().dataSource(dataSourceWithSpecs(standardSpecs()))
        .evaluationCallbacks(callbacks))) {
      client.checkGate(user, "gate-on");
      client.getConfig(user, "config");
      client.getExperiment(user, "exp");
      client.getLayer(user, "layer").getString("shape", "");
    }
    assertEquals(Arrays.asList("gate:gate-on=true", "config:config", "experiment:exp", "layer:layer.shape"),
        calls);
  }

  @Test
  public void callbackExceptionDoesNotBreakEvaluation() throws Exception {
    EvaluationCallbacks callbacks = new EvaluationCallbacks() {
      @Override
      public void onGate(User u, FeatureGate gate, Event exposure) {
        throw new IllegalStateException("bad callback");
      }
    };
    try (SwitchyardClient client = makeClient(baseConfig().dataSource(dataSourceWithSpecs(standardSpecs()))
        .evaluationCallbacks(callbacks))) {
      assertFalse(client.checkGate(user, "gate-on"));
      assertTrue(hasLogMessage(LDLogLevel.ERROR, "bad callback"));
    }
  }

  @Test
  public void persistedExperimentValueIsSavedAndReplayed() throws Exception {
    InMemoryPersistentStorage storage = new InMemoryPersistentStorage();
    try (SwitchyardClient client = makeClient(baseConfig().dataSource(dataSourceWithSpecs(standardSpecs()))
        .userPersistentStorage(storage))) {
      Map<String, StickyValues> persisted = client.getUserPersistedValues(user, "userID");
      assertThat(persisted, anEmptyMap());

      client.getExperiment(user, "exp", GetExperimentOptions.builder().userPersistedValues(persisted).build());
      assertTrue(storage.values.containsKey("user-1:userID"));

      Map<String, StickyValues> saved = client.getUserPersistedValues(user, "userID");
      assertEquals("exp-rule", saved.get("exp").getRuleID());

      DynamicConfig replayed = client.getExperiment(user, "exp",
          GetExperimentOptions.builder().userPersistedValues(saved).build());
      assertEquals(Reason.PERSISTED, replayed.getEvaluationDetails().getReason());

      client.deletePersistedValue(user, "userID", "exp");
      assertThat(client.getUserPersistedValues(user, "userID"), anEmptyMap());
    }
  }

  @Test
  public void persistedLayerValueIsSavedForDelegatedExperiment() throws Exception {
    InMemoryPersistentStorage storage = new InMemoryPersistentStorage();
    try (SwitchyardClient client = makeClient(baseConfig().dataSource(dataSourceWithSpecs(standardSpecs()))
        .userPersistentStorage(storage))) {
      Map<String, StickyValues> persisted = client.getUserPersistedValues(user, "userID");
      client.getLayer(user, "layer", GetLayerOptions.builder().userPersistedValues(persisted).build());
      assertEquals(1, storage.saveCount.get());

      Map<String, StickyValues> saved = client.getUserPersistedValues(user, "userID");
      assertEquals("exp", saved.get("layer").getConfigDelegate());
      Layer replayed = client.getLayer(user, "layer", GetLayerOptions.builder().userPersistedValues(saved).build());
      assertEquals(Reason.PERSISTED, replayed.getEvaluationDetails().getReason());
      assertEquals(1, storage.saveCount.get());
      assertEquals(0, storage.deleteCount.get());
    }
  }

  @Test
  public void layerWithoutDelegateDoesNotWriteToStorage() throws Exception {
    InMemoryPersistentStorage storage = new InMemoryPersistentStorage();
    SpecsResponse specs = specsBuilder(100)
        .layerConfigs(layerBuilder("plain").defaultValue(ConfigValue.buildObject().put("size", 1).build()).build())
        .build();
    try (SwitchyardClient client = makeClient(baseConfig().dataSource(dataSourceWithSpecs(specs))
        .userPersistentStorage(storage))) {
      Map<String, StickyValues> persisted = client.getUserPersistedValues(user, "userID");
      for (int i = 0; i < 3; i++) {
        Layer layer = client.getLayer(user, "plain", GetLayerOptions.builder().userPersistedValues(persisted).build());
        assertEquals(1, layer.getInt("size", 0));
      }
      assertEquals(0, storage.saveCount.get());
      assertEquals(0, storage.deleteCount.get());
    }
  }

  @Test
  public void inactiveExperimentWithoutPersistedEntryDoesNotWriteToStorage() throws Exception {
    InMemoryPersistentStorage storage = new InMemoryPersistentStorage();
    SpecsResponse specs = specsBuilder(100)
        .configs(experimentBuilder("stopped").active(false).build())
        .build();
    try (SwitchyardClient client = makeClient(baseConfig().dataSource(dataSourceWithSpecs(specs))
        .userPersistentStorage(storage))) {
      Map<String, StickyValues> persisted = client.getUserPersistedValues(user, "userID");
      client.getExperiment(user, "stopped", GetExperimentOptions.builder().userPersistedValues(persisted).build());
      assertEquals(0, storage.deleteCount.get());
    }
  }

  @Test
  public void clientInitializeResponseIsBuilt() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      ConfigValue response = client.getClientInitializeResponse(user, null);
      assertEquals(1, response.get("feature_gates").size());
      assertEquals(2, response.get("dynamic_configs").size());
      assertEquals(1, response.get("layer_configs").size());
      assertEquals(ConfigValue.of(100), response.get("time"));
      assertTrue(client.getClientInitializeResponse(null, null).isNull());
    }
  }

  @Test
  public void sessionReplayInfoIsReturned() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      assertEquals(ConfigValue.of(false), client.getSessionReplayInfo().get("recording_blocked"));
    }
    try (SwitchyardClient client = makeClient(baseConfig())) {
      assertTrue(client.getSessionReplayInfo().isNull());
    }
  }

  @Test
  public void unknownCmabHasNoGroup() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      assertNull(client.getCMAB(user, "nope").getGroupID());
      assertEquals(Reason.UNRECOGNIZED, client.getCMAB(user, "nope").getEvaluationDetails().getReason());
    }
  }

  @Test
  public void flushIsForwardedToEventProcessor() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      client.flush();
      assertEquals(1, eventProcessor.flushCount.get());
    }
  }

  @Test
  public void closeIsIdempotent() throws Exception {
    MockDataSource dataSource = new MockDataSource(new SpecStore(SERVER_SECRET, testLogger), null);
    SwitchyardClient client = makeClient(baseConfig().dataSource(specificDataSource(dataSource))
        .events(specificEventProcessor(eventProcessor)));
    client.close();
    assertTrue(dataSource.closed);
    assertTrue(eventProcessor.closed);

    dataSource.closed = false;
    eventProcessor.closed = false;
    client.close();
    assertFalse(dataSource.closed);
    assertFalse(eventProcessor.closed);
  }

  @Test
  public void versionIsReported() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      assertEquals(Version.SDK_VERSION, client.version());
    }
  }

  @Test
  public void eventsForAllExposuresOfRepeatedCallsAreSentWithoutSampling() throws Exception {
    try (SwitchyardClient client = makeClient()) {
      for (int i = 0; i < 3; i++) {
        client.checkGate(user, "gate-on");
      }
      assertThat(new ArrayList<>(eventProcessor.events), hasSize(3));
    }
  }
}
