package com.switchyard.sdk.server;

abstract class Version {
  private Version() {}
  
  // Must match the <version> in pom.xml when a release is cut.
  static final String SDK_VERSION = "1.0.0";
  
  static final String SDK_TYPE = "java-server";
}
