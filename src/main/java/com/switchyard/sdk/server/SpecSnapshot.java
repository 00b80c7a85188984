package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.DataModel.CMABSpec;
import com.switchyard.sdk.server.DataModel.ConfigSpec;
import com.switchyard.sdk.server.DataModel.KeyEntities;
import com.switchyard.sdk.server.DataModel.SpecsResponse;
import com.switchyard.sdk.server.interfaces.EvaluationDetails;

import java.util.List;
import java.util.Map;

/**
 * One fully-indexed, immutable spec document. The store replaces its snapshot reference wholesale,
 * so readers never observe a mix of two documents.
 */
final class SpecSnapshot {
  static final SpecSnapshot EMPTY = new SpecSnapshot();
  
  final ImmutableMap<String, ConfigSpec> gates;
  final ImmutableMap<String, ConfigSpec> configs;
  final ImmutableMap<String, ConfigSpec> layerConfigs;
  final ImmutableMap<String, String> experimentToLayer;
  final ImmutableMap<String, CMABSpec> cmabs;
  final ImmutableMap<String, String> sdkKeysToAppIds;
  final ImmutableMap<String, String> hashedSdkKeysToAppIds;
  final ImmutableMap<String, KeyEntities> hashedSdkKeysToEntities;
  final ImmutableMap<String, Integer> diagnosticsSampleRates;
  final ImmutableSet<String> idListNames;
  final SdkConfigs sdkConfigs;
  final ConfigValue sessionReplayInfo;
  final long time;
  final EvaluationDetails.Source source;
  
  private SpecSnapshot() {
    gates = configs = layerConfigs = ImmutableMap.of();
    experimentToLayer = ImmutableMap.of();
    cmabs = ImmutableMap.of();
    sdkKeysToAppIds = hashedSdkKeysToAppIds = ImmutableMap.of();
    hashedSdkKeysToEntities = ImmutableMap.of();
    diagnosticsSampleRates = ImmutableMap.of();
    idListNames = ImmutableSet.of();
    sdkConfigs = SdkConfigs.EMPTY;
    sessionReplayInfo = ConfigValue.ofNull();
    time = 0;
    source = EvaluationDetails.Source.UNINITIALIZED;
  }
  
  SpecSnapshot(SpecsResponse doc, EvaluationDetails.Source source) {
    this.gates = indexByName(doc.getFeatureGates());
    this.configs = indexByName(doc.getDynamicConfigs());
    this.layerConfigs = indexByName(doc.getLayerConfigs());
    ImmutableMap.Builder<String, String> expToLayer = ImmutableMap.builder();
    for (Map.Entry<String, List<String>> e: doc.getLayers().entrySet()) {
      if (e.getValue() != null) {
        for (String experiment: e.getValue()) {
          expToLayer.put(experiment, e.getKey());
        }
      }
    }
    this.experimentToLayer = expToLayer.buildKeepingLast();
    this.cmabs = ImmutableMap.copyOf(doc.getCmabConfigs());
    this.sdkKeysToAppIds = ImmutableMap.copyOf(doc.getSdkKeysToAppIds());
    this.hashedSdkKeysToAppIds = ImmutableMap.copyOf(doc.getHashedSdkKeysToAppIds());
    this.hashedSdkKeysToEntities = ImmutableMap.copyOf(doc.getHashedSdkKeysToEntities());
    this.diagnosticsSampleRates = ImmutableMap.copyOf(doc.getDiagnostics());
    this.idListNames = ImmutableSet.copyOf(doc.getIdLists().keySet());
    this.sdkConfigs = new SdkConfigs(doc.getSdkConfigs(), doc.getSdkFlags());
    this.sessionReplayInfo = doc.getSessionReplayInfo();
    this.time = doc.getTime();
    this.source = source;
  }
  
  private static ImmutableMap<String, ConfigSpec> indexByName(List<ConfigSpec> specs) {
    ImmutableMap.Builder<String, ConfigSpec> b = ImmutableMap.builder();
    for (ConfigSpec s: specs) {
      if (s != null && s.getName() != null) {
        b.put(s.getName(), s);
      }
    }
    return b.buildKeepingLast();
  }
  
  boolean isEmpty() {
    return this == EMPTY;
  }
}
