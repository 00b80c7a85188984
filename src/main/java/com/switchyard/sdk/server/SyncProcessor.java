package com.switchyard.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.switchyard.sdk.internal.http.HttpErrors.HttpErrorException;
import com.switchyard.sdk.server.DataModel.SpecsResponse;
import com.switchyard.sdk.server.SpecStore.UpdateResult;
import com.switchyard.sdk.server.interfaces.EvaluationDetails.Source;
import com.switchyard.sdk.server.interfaces.RulesUpdatedCallback;
import com.switchyard.sdk.server.subsystems.DataAdapter;
import com.switchyard.sdk.server.subsystems.DataSource;
import com.switchyard.sdk.server.subsystems.SerializationException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.switchyard.sdk.internal.http.HttpErrors.httpErrorDescription;

/**
 * Keeps the {@link SpecStore} current.
 * <p>
 * Initialization tries the sources in order of precedence: the bootstrap document (only while the
 * store is empty), then the data adapter, then the network. After that, specs and id lists are
 * polled on their own intervals, from the data adapter for keys it says it serves and from the
 * network otherwise. A failed cycle never clears the store; the last good document keeps being
 * served, and an error is logged once failures have lasted longer than the outage threshold.
 */
final class SyncProcessor implements DataSource {
  static final Duration DEFAULT_CONFIG_SYNC_INTERVAL = Duration.ofSeconds(10);
  static final Duration DEFAULT_ID_LIST_SYNC_INTERVAL = Duration.ofSeconds(60);
  
  private static final String ERROR_CONTEXT_MESSAGE = "syncSpecs";

  private final SpecStore store;
  @VisibleForTesting final SpecsRequestor requestor;
  private final DataAdapter dataAdapter;
  private final String bootstrapValues;
  private final IdListSyncer idListSyncer;
  private final Diagnostics diagnostics;
  private final ErrorBoundary errorBoundary;
  private final RulesUpdatedCallback rulesUpdatedCallback;
  private final ScheduledExecutorService scheduler;
  @VisibleForTesting final Duration configSyncInterval;
  @VisibleForTesting final Duration idListSyncInterval;
  private final Duration outageLoggingThreshold;
  private final LDLogger logger;
  private final CompletableFuture<Void> initFuture = new CompletableFuture<>();
  private final List<ScheduledFuture<?>> tasks = new ArrayList<>();
  private volatile boolean initializing = true;
  private volatile boolean closed = false;
  private long firstFailureTime = 0;

  SyncProcessor(
      SpecStore store,
      SpecsRequestor requestor,
      DataAdapter dataAdapter,
      String bootstrapValues,
      IdListSyncer idListSyncer,
      Diagnostics diagnostics,
      ErrorBoundary errorBoundary,
      RulesUpdatedCallback rulesUpdatedCallback,
      ScheduledExecutorService sharedExecutor,
      Duration configSyncInterval,
      Duration idListSyncInterval,
      Duration outageLoggingThreshold,
      LDLogger logger
      ) {
    this.store = store;
    this.requestor = requestor;
    this.dataAdapter = dataAdapter;
    this.bootstrapValues = bootstrapValues;
    this.idListSyncer = idListSyncer;
    this.diagnostics = diagnostics;
    this.errorBoundary = errorBoundary;
    this.rulesUpdatedCallback = rulesUpdatedCallback;
    this.scheduler = sharedExecutor;
    this.configSyncInterval = configSyncInterval == null ? DEFAULT_CONFIG_SYNC_INTERVAL : configSyncInterval;
    this.idListSyncInterval = idListSyncInterval == null ? DEFAULT_ID_LIST_SYNC_INTERVAL : idListSyncInterval;
    this.outageLoggingThreshold = outageLoggingThreshold;
    this.logger = logger;
  }

  @Override
  public boolean isInitialized() {
    return store.isInitialized();
  }

  @Override
  public Future<Void> start() {
    synchronized (this) {
      if (tasks.isEmpty() && !closed) {
        logger.info("Starting spec sync with interval: {} milliseconds", configSyncInterval.toMillis());
        tasks.add(scheduler.schedule(this::initialize, 0, TimeUnit.MILLISECONDS));
      }
    }
    return initFuture;
  }

  @Override
  public void close() throws IOException {
    logger.info("Closing spec sync");
    synchronized (this) {
      closed = true;
      for (ScheduledFuture<?> task: tasks) {
        task.cancel(true);
      }
      tasks.clear();
    }
    initFuture.complete(null);
    if (requestor != null) {
      requestor.close();
    }
    if (dataAdapter != null) {
      try {
        dataAdapter.shutdown();
      } catch (RuntimeException e) {
        logger.error("Error calling data adapter shutdown: {}", LogValues.exceptionSummary(e));
        logger.debug(LogValues.exceptionTrace(e));
      }
    }
  }
  
  private void initialize() {
    try {
      if (dataAdapter != null) {
        try {
          dataAdapter.initialize();
        } catch (RuntimeException e) {
          logger.error("Error calling data adapter initialize: {}", LogValues.exceptionSummary(e));
          logger.debug(LogValues.exceptionTrace(e));
        }
      }
      if (bootstrapValues != null && !bootstrapValues.isEmpty() && !store.isInitialized()) {
        processSpecs(bootstrapValues, Source.BOOTSTRAP, Diagnostics.Context.INITIALIZE, Diagnostics.KEY_BOOTSTRAP);
      }
      if (dataAdapter != null && !store.isInitialized()) {
        syncSpecsFromAdapter(Diagnostics.Context.INITIALIZE);
      }
      if (requestor != null && !store.isInitialized()) {
        syncSpecsFromNetwork(Diagnostics.Context.INITIALIZE, true);
      }
      if (idListSyncer != null) {
        if (dataAdapter != null) {
          idListSyncer.syncFromAdapter();
        } else {
          idListSyncer.syncFromNetwork(Diagnostics.Context.INITIALIZE);
        }
      }
      if (store.isInitialized()) {
        logger.info("Initialized Switchyard client from {}", store.getSource());
      }
    } catch (Exception e) {
      logger.error("Unexpected error during spec sync initialization: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
    } finally {
      initializing = false;
      initFuture.complete(null);
      schedulePolling();
    }
  }
  
  private void schedulePolling() {
    synchronized (this) {
      if (closed) {
        return;
      }
      boolean adapterPollsSpecs = dataAdapter != null && shouldPollAdapter(DataAdapter.CONFIG_SPECS_KEY);
      if (requestor != null || adapterPollsSpecs) {
        long millis = configSyncInterval.toMillis();
        tasks.add(scheduler.scheduleAtFixedRate(this::pollSpecs, millis, millis, TimeUnit.MILLISECONDS));
      }
      boolean adapterPollsIdLists = dataAdapter != null && shouldPollAdapter(DataAdapter.ID_LISTS_KEY);
      if (idListSyncer != null && (requestor != null || adapterPollsIdLists)) {
        long millis = idListSyncInterval.toMillis();
        tasks.add(scheduler.scheduleAtFixedRate(this::pollIdLists, millis, millis, TimeUnit.MILLISECONDS));
      }
    }
  }
  
  private void pollSpecs() {
    try {
      if (dataAdapter != null && shouldPollAdapter(DataAdapter.CONFIG_SPECS_KEY)) {
        syncSpecsFromAdapter(Diagnostics.Context.CONFIG_SYNC);
      } else if (requestor != null) {
        syncSpecsFromNetwork(Diagnostics.Context.CONFIG_SYNC, false);
      }
    } catch (Exception e) {
      // Nothing may escape: a scheduled task that throws is never run again.
      logger.error("Unexpected error from spec sync: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
    }
  }
  
  private void pollIdLists() {
    try {
      if (dataAdapter != null && shouldPollAdapter(DataAdapter.ID_LISTS_KEY)) {
        idListSyncer.syncFromAdapter();
      } else {
        idListSyncer.syncFromNetwork(Diagnostics.Context.CONFIG_SYNC);
      }
    } catch (Exception e) {
      logger.error("Unexpected error from id list sync: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
    }
  }
  
  private boolean shouldPollAdapter(String key) {
    try {
      return dataAdapter.shouldPollForUpdates(key);
    } catch (RuntimeException e) {
      logger.error("Error calling data adapter shouldPollForUpdates: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      return false;
    }
  }
  
  @VisibleForTesting
  void syncSpecsFromNetwork(Diagnostics.Context context, boolean coldStart) {
    diagnostics.markStart(context, Diagnostics.KEY_DOWNLOAD_CONFIG_SPECS, Diagnostics.STEP_NETWORK_REQUEST);
    String json;
    try {
      json = requestor.getConfigSpecs(store.lastSyncTime());
      diagnostics.markEnd(context, Diagnostics.KEY_DOWNLOAD_CONFIG_SPECS, Diagnostics.STEP_NETWORK_REQUEST, true, null);
    } catch (HttpErrorException e) {
      diagnostics.markEnd(context, Diagnostics.KEY_DOWNLOAD_CONFIG_SPECS, Diagnostics.STEP_NETWORK_REQUEST, false,
          e.getStatus());
      logger.warn("Spec download failed: {}", httpErrorDescription(e.getStatus()));
      recordSyncFailure(e, coldStart);
      return;
    } catch (IOException e) {
      diagnostics.markEnd(context, Diagnostics.KEY_DOWNLOAD_CONFIG_SPECS, Diagnostics.STEP_NETWORK_REQUEST, false, null);
      recordSyncFailure(e, coldStart);
      return;
    }
    
    SpecsResponse doc;
    try {
      doc = parseSpecs(json, context, Diagnostics.KEY_DOWNLOAD_CONFIG_SPECS);
    } catch (SerializationException e) {
      logger.error("Spec download received malformed data: {}", e.toString());
      recordSyncFailure(e, coldStart);
      return;
    }
    firstFailureTime = 0;
    if (store.putSpecs(doc, Source.NETWORK) != UpdateResult.UPDATED) {
      return;
    }
    onSpecsUpdated();
    if (rulesUpdatedCallback != null) {
      try {
        rulesUpdatedCallback.rulesUpdated(json, doc.getTime());
      } catch (RuntimeException e) {
        logger.error("Rules updated callback threw an exception: {}", LogValues.exceptionSummary(e));
        logger.debug(LogValues.exceptionTrace(e));
      }
    }
    if (dataAdapter != null) {
      try {
        dataAdapter.set(DataAdapter.CONFIG_SPECS_KEY, json);
      } catch (RuntimeException e) {
        logger.error("Error calling data adapter set: {}", LogValues.exceptionSummary(e));
        logger.debug(LogValues.exceptionTrace(e));
      }
    }
  }
  
  private void syncSpecsFromAdapter(Diagnostics.Context context) {
    diagnostics.markStart(context, Diagnostics.KEY_DATA_STORE_CONFIG_SPECS, null);
    String json;
    try {
      json = dataAdapter.get(DataAdapter.CONFIG_SPECS_KEY);
    } catch (RuntimeException e) {
      diagnostics.markEnd(context, Diagnostics.KEY_DATA_STORE_CONFIG_SPECS, null, false, null);
      logger.error("Error calling data adapter get: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      return;
    }
    diagnostics.markEnd(context, Diagnostics.KEY_DATA_STORE_CONFIG_SPECS, null, json != null, null);
    if (json != null && !json.isEmpty()) {
      processSpecs(json, Source.DATA_ADAPTER, context, Diagnostics.KEY_DATA_STORE_CONFIG_SPECS);
    }
  }
  
  private void processSpecs(String json, Source source, Diagnostics.Context context, String diagnosticsKey) {
    try {
      SpecsResponse doc = parseSpecs(json, context, diagnosticsKey);
      if (store.putSpecs(doc, source) == UpdateResult.UPDATED) {
        onSpecsUpdated();
      }
    } catch (SerializationException e) {
      logger.error("Spec document from {} was malformed: {}", source, e.toString());
    }
  }
  
  private SpecsResponse parseSpecs(String json, Diagnostics.Context context, String diagnosticsKey)
      throws SerializationException {
    diagnostics.markStart(context, diagnosticsKey, Diagnostics.STEP_PROCESS);
    try {
      SpecsResponse doc = JsonHelpers.deserialize(json, SpecsResponse.class);
      if (doc == null) {
        throw new SerializationException(new IllegalArgumentException("empty spec document"));
      }
      diagnostics.markEnd(context, diagnosticsKey, Diagnostics.STEP_PROCESS, true, null);
      return doc;
    } catch (SerializationException e) {
      diagnostics.markEnd(context, diagnosticsKey, Diagnostics.STEP_PROCESS, false, null);
      throw e;
    }
  }
  
  private void onSpecsUpdated() {
    diagnostics.updateSamplingRates(store.getSnapshot().diagnosticsSampleRates);
    logger.debug("Specs updated to server time {}", store.lastSyncTime());
  }
  
  private void recordSyncFailure(Exception e, boolean coldStart) {
    if (coldStart || initializing) {
      logger.error("Failed to initialize from the network; evaluations will use default values until a sync succeeds");
      errorBoundary.logException(ERROR_CONTEXT_MESSAGE, e, false);
      return;
    }
    long now = System.currentTimeMillis();
    if (firstFailureTime == 0) {
      firstFailureTime = now;
      return;
    }
    if (outageLoggingThreshold != null && now - firstFailureTime > outageLoggingThreshold.toMillis()) {
      logger.error("Syncing specs has failed for {} ms; the SDK keeps serving the specs of the last successful sync",
          now - firstFailureTime);
      errorBoundary.logException(ERROR_CONTEXT_MESSAGE, e, true);
      firstFailureTime = 0;
    }
  }
}
