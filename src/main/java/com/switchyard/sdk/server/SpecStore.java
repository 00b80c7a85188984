package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.DataModel.CMABSpec;
import com.switchyard.sdk.server.DataModel.ConfigSpec;
import com.switchyard.sdk.server.DataModel.KeyEntities;
import com.switchyard.sdk.server.DataModel.SpecsResponse;
import com.switchyard.sdk.server.interfaces.EvaluationDetails;

import java.util.HashMap;
import java.util.Map;

/**
 * The in-memory spec store.
 * <p>
 * Readers take the current {@link SpecSnapshot} reference without locking; writers build a complete new
 * snapshot and swap the reference inside a short synchronized section, so concurrent writers (the poll
 * loop, a data adapter poll, bootstrap) are serialized and readers never see a partial update.
 * Id lists follow the same discipline with their own immutable map.
 */
final class SpecStore {
  enum UpdateResult {
    /** The document was newer than the one held and replaced it. */
    UPDATED,
    /** The document was not strictly newer, or reported no changes; nothing was replaced. */
    NO_UPDATE,
    /** The document was generated for a different secret key. */
    KEY_MISMATCH
  }
  
  private final Object writeLock = new Object();
  private final String hashedServerSecret;
  private final LDLogger logger;
  private volatile SpecSnapshot snapshot = SpecSnapshot.EMPTY;
  private volatile ImmutableMap<String, IdList> idLists = ImmutableMap.of();
  private volatile long initTime;
  private volatile EvaluationDetails.Source source = EvaluationDetails.Source.UNINITIALIZED;
  
  SpecStore(String serverSecret, LDLogger logger) {
    this.hashedServerSecret = serverSecret == null ? null : Hashing.djb2(serverSecret);
    this.logger = logger;
  }
  
  /**
   * Replaces the current spec set if the document's server time is strictly newer.
   */
  UpdateResult putSpecs(SpecsResponse doc, EvaluationDetails.Source newSource) {
    if (doc == null || !doc.isHasUpdates()) {
      synchronized (writeLock) {
        if (!snapshot.isEmpty() && newSource == EvaluationDetails.Source.NETWORK) {
          source = EvaluationDetails.Source.NETWORK_NOT_MODIFIED;
        }
      }
      logger.debug("Received spec document with no update");
      return UpdateResult.NO_UPDATE;
    }
    String keyUsed = doc.getHashedSdkKeyUsed();
    if (keyUsed != null && !keyUsed.isEmpty() && hashedServerSecret != null && !keyUsed.equals(hashedServerSecret)) {
      logger.error("Spec document was generated for a different server secret; ignoring it");
      return UpdateResult.KEY_MISMATCH;
    }
    SpecSnapshot newSnapshot = new SpecSnapshot(doc, newSource);
    synchronized (writeLock) {
      long current = snapshot.time;
      if (!snapshot.isEmpty() && doc.getTime() <= current) {
        logger.debug("Received spec document with time {} not newer than current time {}; no update",
            doc.getTime(), current);
        return UpdateResult.NO_UPDATE;
      }
      if (snapshot.isEmpty()) {
        initTime = doc.getTime();
      }
      snapshot = newSnapshot;
      source = newSource;
    }
    return UpdateResult.UPDATED;
  }
  
  SpecSnapshot getSnapshot() {
    return snapshot;
  }
  
  boolean isInitialized() {
    return !snapshot.isEmpty();
  }
  
  long lastSyncTime() {
    return snapshot.time;
  }
  
  long initTime() {
    return initTime;
  }
  
  EvaluationDetails.Source getSource() {
    return source;
  }
  
  ConfigSpec getGate(String name) {
    return snapshot.gates.get(name);
  }
  
  ConfigSpec getDynamicConfig(String name) {
    return snapshot.configs.get(name);
  }
  
  ConfigSpec getLayerConfig(String name) {
    return snapshot.layerConfigs.get(name);
  }
  
  CMABSpec getCMAB(String name) {
    return snapshot.cmabs.get(name);
  }
  
  String getExperimentLayer(String experimentName) {
    return snapshot.experimentToLayer.get(experimentName);
  }
  
  /**
   * Returns the gates and configs a client key may see, or null if the document does not scope it.
   */
  KeyEntities getEntitiesForKey(String clientKey) {
    return getEntitiesForKey(snapshot, clientKey);
  }
  
  static KeyEntities getEntitiesForKey(SpecSnapshot specs, String clientKey) {
    if (clientKey == null) {
      return null;
    }
    return specs.hashedSdkKeysToEntities.get(Hashing.djb2(clientKey));
  }
  
  /**
   * Returns the target application of a client key, looking it up by raw key first and then by hash.
   */
  String getAppIdForKey(String clientKey) {
    return getAppIdForKey(snapshot, clientKey);
  }
  
  static String getAppIdForKey(SpecSnapshot s, String clientKey) {
    if (clientKey == null) {
      return null;
    }
    String appId = s.sdkKeysToAppIds.get(clientKey);
    if (appId != null) {
      return appId;
    }
    return s.hashedSdkKeysToAppIds.get(Hashing.djb2(clientKey));
  }
  
  ConfigValue getSessionReplayInfo() {
    return snapshot.sessionReplayInfo;
  }
  
  SdkConfigs getSdkConfigs() {
    return snapshot.sdkConfigs;
  }
  
  IdList getIdList(String name) {
    return idLists.get(name);
  }
  
  Map<String, IdList> getIdLists() {
    return idLists;
  }
  
  void putIdList(IdList list) {
    synchronized (writeLock) {
      Map<String, IdList> m = new HashMap<>(idLists);
      m.put(list.getName(), list);
      idLists = ImmutableMap.copyOf(m);
    }
  }
  
  void removeIdList(String name) {
    synchronized (writeLock) {
      if (!idLists.containsKey(name)) {
        return;
      }
      Map<String, IdList> m = new HashMap<>(idLists);
      m.remove(name);
      idLists = ImmutableMap.copyOf(m);
    }
  }
  
  /**
   * Creates evaluation details reflecting the store's current state.
   */
  EvaluationDetails createEvaluationDetails(EvaluationDetails.Reason reason) {
    return createEvaluationDetails(snapshot, reason);
  }
  
  /**
   * Creates evaluation details for a result computed from the given snapshot.
   */
  EvaluationDetails createEvaluationDetails(SpecSnapshot specs, EvaluationDetails.Reason reason) {
    return new EvaluationDetails(source, reason, specs.time, initTime, System.currentTimeMillis());
  }
}
