package com.switchyard.sdk.server;

import com.launchdarkly.logging.LDLogLevel;
import com.switchyard.sdk.internal.http.HttpErrors.HttpErrorException;
import com.switchyard.sdk.server.TestComponents.InMemoryDataAdapter;
import com.switchyard.sdk.server.TestComponents.MockSpecsRequestor;
import com.switchyard.sdk.server.interfaces.EvaluationDetails.Source;
import com.switchyard.sdk.server.interfaces.RulesUpdatedCallback;
import com.switchyard.sdk.server.subsystems.DataAdapter;

import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static com.launchdarkly.testhelpers.ConcurrentHelpers.assertNoMoreValues;
import static com.launchdarkly.testhelpers.ConcurrentHelpers.awaitValue;
import static com.switchyard.sdk.server.ModelBuilders.alwaysOnGate;
import static com.switchyard.sdk.server.ModelBuilders.specsBuilder;
import static com.switchyard.sdk.server.TestComponents.sharedExecutor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class SyncProcessorTest extends BaseTest {
  private static final Duration LONG_INTERVAL = Duration.ofHours(1);
  private static final Duration SHORT_INTERVAL = Duration.ofMillis(50);

  private final SpecStore store = new SpecStore(TestComponents.SERVER_SECRET, testLogger);
  private final MockSpecsRequestor requestor = new MockSpecsRequestor();
  private final BlockingQueue<Long> updates = new LinkedBlockingQueue<>();
  private final RulesUpdatedCallback callback = (json, time) -> updates.add(time);

  private SyncProcessor makeProcessor(DataAdapter adapter, String bootstrap, Duration interval) {
    IdListSyncer idLists = new IdListSyncer(store, requestor, adapter, TestComponents.disabledDiagnostics(),
        TestComponents.errorBoundary(testLogger), testLogger);
    return new SyncProcessor(store, requestor, adapter, bootstrap, idLists, TestComponents.disabledDiagnostics(),
        TestComponents.errorBoundary(testLogger), callback, sharedExecutor, interval, LONG_INTERVAL,
        Duration.ofMinutes(2), testLogger);
  }

  private static String doc(long time, String gateName) {
    return specsBuilder(time).gates(alwaysOnGate(gateName)).json();
  }

  @Test
  public void defaultIntervalsAreUsedWhenNotSpecified() throws Exception {
    try (SyncProcessor sp = new SyncProcessor(store, requestor, null, null, null,
        TestComponents.disabledDiagnostics(), TestComponents.errorBoundary(testLogger), null, sharedExecutor,
        null, null, null, testLogger)) {
      assertEquals(SyncProcessor.DEFAULT_CONFIG_SYNC_INTERVAL, sp.configSyncInterval);
      assertEquals(SyncProcessor.DEFAULT_ID_LIST_SYNC_INTERVAL, sp.idListSyncInterval);
    }
  }

  @Test
  public void initializesFromNetwork() throws Exception {
    requestor.withSpecs(doc(100, "g"));
    try (SyncProcessor sp = makeProcessor(null, null, LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertTrue(sp.isInitialized());
      assertEquals(Source.NETWORK, store.getSource());
      assertThat(store.getGate("g"), notNullValue());
      assertEquals(Long.valueOf(0), requestor.specsRequests.take());
      assertEquals(Long.valueOf(100), awaitValue(updates, 1, TimeUnit.SECONDS));
    }
  }

  @Test
  public void bootstrapIsUsedBeforeNetwork() throws Exception {
    try (SyncProcessor sp = makeProcessor(null, doc(100, "boot"), LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertEquals(Source.BOOTSTRAP, store.getSource());
      assertThat(store.getGate("boot"), notNullValue());
      assertEquals(0, requestor.specsRequests.size());
      assertNoMoreValues(updates, 50, TimeUnit.MILLISECONDS);
    }
  }

  @Test
  public void malformedBootstrapFallsBackToNetwork() throws Exception {
    requestor.withSpecs(doc(100, "net"));
    try (SyncProcessor sp = makeProcessor(null, "{not valid", LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertEquals(Source.NETWORK, store.getSource());
      assertThat(store.getGate("net"), notNullValue());
      assertTrue(hasLogMessage(LDLogLevel.ERROR, "malformed"));
    }
  }

  @Test
  public void dataAdapterIsUsedBeforeNetwork() throws Exception {
    InMemoryDataAdapter adapter = new InMemoryDataAdapter();
    adapter.values.put(DataAdapter.CONFIG_SPECS_KEY, doc(100, "cached"));
    try (SyncProcessor sp = makeProcessor(adapter, null, LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertEquals(Source.DATA_ADAPTER, store.getSource());
      assertThat(store.getGate("cached"), notNullValue());
      assertEquals(0, requestor.specsRequests.size());
      assertEquals(1, adapter.initializeCount.get());
    }
    assertEquals(1, adapter.shutdownCount.get());
  }

  @Test
  public void bootstrapTakesPrecedenceOverDataAdapter() throws Exception {
    InMemoryDataAdapter adapter = new InMemoryDataAdapter();
    adapter.values.put(DataAdapter.CONFIG_SPECS_KEY, doc(200, "cached"));
    try (SyncProcessor sp = makeProcessor(adapter, doc(100, "boot"), LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertEquals(Source.BOOTSTRAP, store.getSource());
      assertThat(store.getGate("cached"), nullValue());
    }
  }

  @Test
  public void emptyDataAdapterFallsBackToNetworkAndIsWrittenBack() throws Exception {
    InMemoryDataAdapter adapter = new InMemoryDataAdapter();
    String json = doc(100, "g");
    requestor.withSpecs(json);
    try (SyncProcessor sp = makeProcessor(adapter, null, LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertEquals(Source.NETWORK, store.getSource());
      assertEquals(json, adapter.values.get(DataAdapter.CONFIG_SPECS_KEY));
    }
  }

  @Test
  public void pollingAppliesNewerDocuments() throws Exception {
    requestor.withSpecs(doc(100, "first"), doc(200, "second"));
    try (SyncProcessor sp = makeProcessor(null, null, SHORT_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);
      assertEquals(Long.valueOf(100), awaitValue(updates, 1, TimeUnit.SECONDS));
      assertEquals(Long.valueOf(200), awaitValue(updates, 1, TimeUnit.SECONDS));

      assertThat(store.getGate("second"), notNullValue());
      assertThat(store.getGate("first"), nullValue());
      requestor.specsRequests.take();
      assertEquals(Long.valueOf(100), requestor.specsRequests.take());
    }
  }

  @Test
  public void failedPollKeepsLastGoodDocument() throws Exception {
    requestor.withSpecs(doc(100, "g"), new HttpErrorException(500));
    try (SyncProcessor sp = makeProcessor(null, null, SHORT_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);
      awaitValue(updates, 1, TimeUnit.SECONDS);
      requestor.specsRequests.take();
      requestor.specsRequests.take();
      requestor.specsRequests.take();

      assertTrue(store.isInitialized());
      assertEquals(100, store.lastSyncTime());
      assertThat(store.getGate("g"), notNullValue());
    }
  }

  @Test
  public void initialNetworkFailureLeavesStoreUninitialized() throws Exception {
    requestor.withSpecs(new HttpErrorException(401));
    try (SyncProcessor sp = makeProcessor(null, null, LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertFalse(sp.isInitialized());
      assertEquals(Source.UNINITIALIZED, store.getSource());
      assertTrue(hasLogMessage(LDLogLevel.ERROR, "Failed to initialize"));
    }
  }

  @Test
  public void malformedNetworkDocumentIsIgnored() throws Exception {
    requestor.withSpecs("{\"feature_gates\": 3");
    try (SyncProcessor sp = makeProcessor(null, null, LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertFalse(sp.isInitialized());
      assertTrue(hasLogMessage(LDLogLevel.ERROR, "malformed data"));
    }
  }

  @Test
  public void documentForAnotherSecretIsIgnored() throws Exception {
    requestor.withSpecs(specsBuilder(100).gates(alwaysOnGate("g")).hashedSdkKeyUsed("12345").json());
    try (SyncProcessor sp = makeProcessor(null, null, LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertFalse(sp.isInitialized());
      assertNoMoreValues(updates, 50, TimeUnit.MILLISECONDS);
    }
  }

  @Test
  public void callbackExceptionIsLogged() throws Exception {
    requestor.withSpecs(doc(100, "g"));
    IdListSyncer idLists = new IdListSyncer(store, requestor, null, TestComponents.disabledDiagnostics(),
        TestComponents.errorBoundary(testLogger), testLogger);
    RulesUpdatedCallback throwing = (json, time) -> {
      throw new IllegalStateException("callback failure");
    };
    try (SyncProcessor sp = new SyncProcessor(store, requestor, null, null, idLists,
        TestComponents.disabledDiagnostics(), TestComponents.errorBoundary(testLogger), throwing, sharedExecutor,
        LONG_INTERVAL, LONG_INTERVAL, null, testLogger)) {
      sp.start().get(1, TimeUnit.SECONDS);

      assertTrue(sp.isInitialized());
      assertTrue(hasLogMessage(LDLogLevel.ERROR, "callback failure"));
    }
  }

  @Test
  public void adapterIsPolledForKeysItServes() throws Exception {
    InMemoryDataAdapter adapter = new InMemoryDataAdapter();
    adapter.keysToPoll.add(DataAdapter.CONFIG_SPECS_KEY);
    adapter.values.put(DataAdapter.CONFIG_SPECS_KEY, doc(100, "first"));
    try (SyncProcessor sp = makeProcessor(adapter, null, SHORT_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);
      assertThat(store.getGate("first"), notNullValue());

      adapter.values.put(DataAdapter.CONFIG_SPECS_KEY, doc(200, "second"));
      long deadline = System.currentTimeMillis() + 2000;
      while (store.lastSyncTime() != 200 && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(200, store.lastSyncTime());
      assertEquals(Source.DATA_ADAPTER, store.getSource());
      assertEquals(0, requestor.specsRequests.size());
    }
  }

  @Test
  public void idListsAreSyncedDuringInitialization() throws Exception {
    requestor.withSpecs(doc(100, "g"))
        .withManifest("{\"list1\":{\"name\":\"list1\",\"size\":3,\"creationTime\":1,\"url\":\"u1\",\"fileID\":\"f1\"}}")
        .withIdListFile("u1", "+a\n");
    try (SyncProcessor sp = makeProcessor(null, null, LONG_INTERVAL)) {
      sp.start().get(1, TimeUnit.SECONDS);
      assertTrue(store.getIdList("list1").contains("a"));
    }
  }

  @Test
  public void closeStopsSyncAndClosesRequestor() throws Exception {
    requestor.withSpecs(doc(100, "g"));
    SyncProcessor sp = makeProcessor(null, null, SHORT_INTERVAL);
    sp.start().get(1, TimeUnit.SECONDS);
    sp.close();
    assertTrue(requestor.closed);

    Thread.sleep(100);
    requestor.specsRequests.clear();
    assertNoMoreValues(requestor.specsRequests, 150, TimeUnit.MILLISECONDS);
  }

  @Test
  public void startAfterCloseCompletesWithoutSyncing() throws Exception {
    SyncProcessor sp = makeProcessor(null, null, LONG_INTERVAL);
    sp.close();
    sp.start().get(1, TimeUnit.SECONDS);
    assertEquals(0, requestor.specsRequests.size());
  }
}
