package com.switchyard.sdk.server;

/**
 * Logger names shared by implementation code in the main {@code com.switchyard.sdk.server} package.
 * <p>
 * Most class names in the SDK are package-private implementation details that are not meaningful to
 * users, so every log line is attributed to one of these stable names, as a sub-logger of the base
 * logger, rather than to the class that wrote it.
 */
abstract class Loggers {
  private Loggers() {}
  
  static final String BASE_LOGGER_NAME = SwitchyardClient.class.getName();
  static final String DATA_SOURCE_LOGGER_NAME = "DataSource";
  static final String DATA_STORE_LOGGER_NAME = "DataStore";
  static final String EVALUATION_LOGGER_NAME = "Evaluation";
  static final String EVENTS_LOGGER_NAME = "Events";
  static final String ERROR_BOUNDARY_LOGGER_NAME = "ErrorBoundary";
  static final String DIAGNOSTICS_LOGGER_NAME = "Diagnostics";
}
