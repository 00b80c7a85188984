package com.switchyard.sdk.server;

import com.switchyard.sdk.internal.http.HttpHelpers;

import java.net.URI;

abstract class StandardEndpoints {
  private StandardEndpoints() {}

  static final URI DEFAULT_API_BASE_URI = URI.create("https://api.switchyard.dev/v1");
  static final URI DEFAULT_CDN_BASE_URI = URI.create("https://api.switchyardcdn.com/v1");

  static final String DOWNLOAD_CONFIG_SPECS_PATH = "/download_config_specs";
  static final String GET_ID_LISTS_PATH = "/get_id_lists";
  static final String LOG_EVENT_PATH = "/log_event";
  
  static final String QUERY_PARAM_SINCE_TIME = "sinceTime";

  /**
   * The CDN form of the spec download URI, which carries the server secret in the path so that the
   * response can be cached per key.
   */
  static URI cdnSpecsUri(URI cdnBaseUri, String serverSecret, long sinceTime) {
    URI uri = HttpHelpers.concatenateUriPath(cdnBaseUri, DOWNLOAD_CONFIG_SPECS_PATH + "/" + serverSecret + ".json");
    return HttpHelpers.addQueryParam(uri, QUERY_PARAM_SINCE_TIME, String.valueOf(sinceTime));
  }
  
  static URI originSpecsUri(URI apiBaseUri, long sinceTime) {
    URI uri = HttpHelpers.concatenateUriPath(apiBaseUri, DOWNLOAD_CONFIG_SPECS_PATH);
    return HttpHelpers.addQueryParam(uri, QUERY_PARAM_SINCE_TIME, String.valueOf(sinceTime));
  }

  /**
   * Internal method to determine whether a given base URI was set to a custom value or not.
   * Used only to describe the configuration in diagnostics.
   *
   * @param configuredValue the configured URI, or null
   * @param defaultValue the default URI
   * @return true iff the base URI was customized
   */
  static boolean isCustomBaseUri(URI configuredValue, URI defaultValue) {
    return configuredValue != null && !configuredValue.equals(defaultValue);
  }
}
