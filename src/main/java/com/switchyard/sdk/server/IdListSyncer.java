package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.google.gson.reflect.TypeToken;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.switchyard.sdk.internal.http.HttpErrors.HttpErrorException;
import com.switchyard.sdk.server.DataModel.IdListManifestEntry;
import com.switchyard.sdk.server.SpecsRequestor.IdListChunk;
import com.switchyard.sdk.server.subsystems.DataAdapter;
import com.switchyard.sdk.server.subsystems.SerializationException;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static com.switchyard.sdk.internal.http.HttpErrors.httpErrorDescription;

/**
 * Keeps the store's id lists up to date.
 * <p>
 * Each cycle reads the manifest (from the network or the data adapter), then fetches only the part of
 * each list file beyond the bytes already applied. A list whose file id changed starts over from an
 * empty list. A chunk that is truncated or does not start with a record marker causes one re-fetch of
 * that list from the beginning; if that also fails, the list is dropped. Lists missing from the
 * manifest are removed.
 * <p>
 * When a data adapter is configured, the syncer keeps the list file bytes applied so far and writes
 * them back unchanged, so byte offsets read from the adapter line up with those of the network file.
 */
final class IdListSyncer {
  private static final Type MANIFEST_TYPE = new TypeToken<Map<String, IdListManifestEntry>>() {}.getType();
  
  static String adapterKeyForList(String name) {
    return DataAdapter.ID_LISTS_KEY + "::" + name;
  }

  private final SpecStore store;
  private final SpecsRequestor requestor;
  private final DataAdapter dataAdapter;
  private final Diagnostics diagnostics;
  private final ErrorBoundary errorBoundary;
  private final LDLogger logger;
  // list name -> file content consumed so far; only kept when there is a data adapter
  private final Map<String, String> appliedContent = new ConcurrentHashMap<>();
  
  IdListSyncer(SpecStore store, SpecsRequestor requestor, DataAdapter dataAdapter, Diagnostics diagnostics,
      ErrorBoundary errorBoundary, LDLogger logger) {
    this.store = store;
    this.requestor = requestor;
    this.dataAdapter = dataAdapter;
    this.diagnostics = diagnostics;
    this.errorBoundary = errorBoundary;
    this.logger = logger;
  }
  
  /**
   * Runs one network cycle and writes the result back to the data adapter, if any. Failures are
   * logged; the lists already held are kept.
   */
  void syncFromNetwork(Diagnostics.Context context) {
    if (requestor == null) {
      return;
    }
    diagnostics.markStart(context, Diagnostics.KEY_GET_ID_LIST_SOURCES, Diagnostics.STEP_NETWORK_REQUEST);
    Map<String, IdListManifestEntry> manifest;
    try {
      manifest = parseManifest(requestor.getIdListManifest());
      diagnostics.markEnd(context, Diagnostics.KEY_GET_ID_LIST_SOURCES, Diagnostics.STEP_NETWORK_REQUEST, true, null);
    } catch (HttpErrorException e) {
      diagnostics.markEnd(context, Diagnostics.KEY_GET_ID_LIST_SOURCES, Diagnostics.STEP_NETWORK_REQUEST, false,
          e.getStatus());
      logger.warn("Id list manifest request failed: {}", httpErrorDescription(e.getStatus()));
      return;
    } catch (IOException | SerializationException e) {
      diagnostics.markEnd(context, Diagnostics.KEY_GET_ID_LIST_SOURCES, Diagnostics.STEP_NETWORK_REQUEST, false, null);
      errorBoundary.logException("getIdLists", e, false);
      return;
    }
    
    diagnostics.markStart(context, Diagnostics.KEY_GET_ID_LIST_SOURCES, Diagnostics.STEP_PROCESS);
    applyManifest(manifest, new NetworkSource(context));
    diagnostics.markEnd(context, Diagnostics.KEY_GET_ID_LIST_SOURCES, Diagnostics.STEP_PROCESS, true, null);
    saveToAdapter();
  }
  
  /**
   * Runs one cycle against the data adapter.
   */
  void syncFromAdapter() {
    if (dataAdapter == null) {
      return;
    }
    String json;
    try {
      json = dataAdapter.get(DataAdapter.ID_LISTS_KEY);
    } catch (RuntimeException e) {
      logger.error("Error calling data adapter get: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
      return;
    }
    if (json == null || json.isEmpty()) {
      return;
    }
    Map<String, IdListManifestEntry> manifest;
    try {
      manifest = parseManifest(json);
    } catch (SerializationException e) {
      logger.warn("Data adapter returned a malformed id list manifest: {}", e.toString());
      return;
    }
    applyManifest(manifest, new AdapterSource());
  }
  
  private static Map<String, IdListManifestEntry> parseManifest(String json) throws SerializationException {
    Map<String, IdListManifestEntry> m = JsonHelpers.deserialize(json, MANIFEST_TYPE);
    return m == null ? ImmutableMap.<String, IdListManifestEntry>of() : m;
  }
  
  private void applyManifest(Map<String, IdListManifestEntry> manifest, ChunkSource source) {
    for (Map.Entry<String, IdListManifestEntry> e: manifest.entrySet()) {
      String name = e.getKey();
      IdListManifestEntry entry = e.getValue();
      if (entry == null) {
        continue;
      }
      IdList local = store.getIdList(name);
      if (local == null) {
        local = IdList.empty(name, 0, null, null);
        store.putIdList(local);
      }
      if (isBlank(entry.getUrl()) || isBlank(entry.getFileID()) || entry.getCreationTime() < local.getCreationTime()) {
        continue;
      }
      if (!entry.getFileID().equals(local.getFileID())) {
        local = IdList.empty(name, entry.getCreationTime(), entry.getUrl(), entry.getFileID());
        store.putIdList(local);
      } else if (local.getSize() > entry.getSize()) {
        logger.warn("Id list \"{}\" holds more bytes than its file declares; fetching it again", name);
        local = IdList.empty(name, entry.getCreationTime(), entry.getUrl(), entry.getFileID());
        store.putIdList(local);
      }
      if (entry.getSize() <= local.getSize()) {
        continue;
      }
      fetchList(local, source);
    }
    Set<String> stale = new HashSet<>(store.getIdLists().keySet());
    stale.removeAll(manifest.keySet());
    for (String name: stale) {
      store.removeIdList(name);
      appliedContent.remove(name);
    }
  }
  
  private void fetchList(IdList local, ChunkSource source) {
    IdList updated = fetchAndApply(local, source);
    if (updated == null && local.getSize() > 0) {
      logger.warn("Id list \"{}\" was inconsistent; fetching it again from the beginning", local.getName());
      IdList fresh = IdList.empty(local.getName(), local.getCreationTime(), local.getUrl(), local.getFileID());
      updated = fetchAndApply(fresh, source);
    }
    if (updated == null) {
      store.removeIdList(local.getName());
      appliedContent.remove(local.getName());
    } else if (updated != local) {
      store.putIdList(updated);
    }
  }
  
  /**
   * Returns the list with the chunk applied, the same list if nothing could be fetched this cycle,
   * or null if the chunk was invalid.
   */
  private IdList fetchAndApply(IdList list, ChunkSource source) {
    IdListChunk chunk = source.fetch(list);
    if (chunk == null) {
      return list;
    }
    if (chunk.isTruncated() || chunk.body.length() <= 1) {
      return null;
    }
    IdList updated;
    try {
      updated = list.applyChanges(chunk.body, chunk.byteCount);
    } catch (IllegalArgumentException e) {
      logger.warn(e.getMessage());
      return null;
    }
    recordContent(list, chunk);
    return updated;
  }
  
  private void recordContent(IdList before, IdListChunk chunk) {
    if (dataAdapter == null) {
      return;
    }
    String prefix = before.getSize() == 0 ? "" : appliedContent.get(before.getName());
    if (prefix == null) {
      appliedContent.remove(before.getName());
    } else {
      appliedContent.put(before.getName(), prefix + chunk.body);
    }
  }
  
  private void saveToAdapter() {
    if (dataAdapter == null) {
      return;
    }
    Map<String, IdListManifestEntry> manifest = new TreeMap<>();
    try {
      for (IdList list: store.getIdLists().values()) {
        String body = list.getSize() == 0 ? "" : appliedContent.get(list.getName());
        if (body == null) {
          logger.debug("Not writing id list \"{}\" to the data adapter; its file content is unknown", list.getName());
          continue;
        }
        dataAdapter.set(adapterKeyForList(list.getName()), body);
        manifest.put(list.getName(), new IdListManifestEntry(list.getName(),
            list.getSize(), list.getCreationTime(), list.getUrl(), list.getFileID()));
      }
      dataAdapter.set(DataAdapter.ID_LISTS_KEY, JsonHelpers.serialize(manifest));
    } catch (RuntimeException e) {
      logger.error("Error calling data adapter set: {}", LogValues.exceptionSummary(e));
      logger.debug(LogValues.exceptionTrace(e));
    }
  }
  
  private static boolean isBlank(String s) {
    return s == null || s.isEmpty();
  }
  
  private interface ChunkSource {
    /**
     * Returns the bytes of the list file after those already applied, or null if they could not be
     * obtained this cycle.
     */
    IdListChunk fetch(IdList list);
  }
  
  private final class NetworkSource implements ChunkSource {
    private final Diagnostics.Context context;
    
    NetworkSource(Diagnostics.Context context) {
      this.context = context;
    }
    
    @Override
    public IdListChunk fetch(IdList list) {
      diagnostics.markStart(context, Diagnostics.KEY_GET_ID_LIST, Diagnostics.STEP_NETWORK_REQUEST);
      try {
        IdListChunk chunk = requestor.getIdList(list.getUrl(), list.getSize());
        diagnostics.markEnd(context, Diagnostics.KEY_GET_ID_LIST, Diagnostics.STEP_NETWORK_REQUEST, true, null);
        return chunk;
      } catch (HttpErrorException e) {
        diagnostics.markEnd(context, Diagnostics.KEY_GET_ID_LIST, Diagnostics.STEP_NETWORK_REQUEST, false,
            e.getStatus());
        logger.warn("Id list \"{}\" request failed: {}", list.getName(), httpErrorDescription(e.getStatus()));
      } catch (IOException e) {
        diagnostics.markEnd(context, Diagnostics.KEY_GET_ID_LIST, Diagnostics.STEP_NETWORK_REQUEST, false, null);
        errorBoundary.logException("getIdList", e, false);
      }
      return null;
    }
  }
  
  private final class AdapterSource implements ChunkSource {
    @Override
    public IdListChunk fetch(IdList list) {
      String content;
      try {
        content = dataAdapter.get(adapterKeyForList(list.getName()));
      } catch (RuntimeException e) {
        logger.error("Error calling data adapter get: {}", LogValues.exceptionSummary(e));
        logger.debug(LogValues.exceptionTrace(e));
        return null;
      }
      if (content == null) {
        return null;
      }
      byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
      if (list.getSize() >= bytes.length) {
        return null;
      }
      byte[] rest = Arrays.copyOfRange(bytes, (int)list.getSize(), bytes.length);
      return new IdListChunk(new String(rest, StandardCharsets.UTF_8), rest.length, -1);
    }
  }
}
