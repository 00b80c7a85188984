package com.switchyard.sdk.server.subsystems;

/**
 * Extracts device information from a user agent string, for {@code ua_based} conditions.
 */
public interface UserAgentParser {
  /**
   * A parser that never recognizes anything.
   */
  UserAgentParser NONE = (userAgent, field) -> null;
  
  /**
   * Returns a field of the parsed user agent.
   * 
   * @param userAgent the user agent string
   * @param field one of {@code os_name}, {@code os_version}, {@code browser_name},
   *   {@code browser_version}
   * @return the value, or null if unknown
   */
  String lookup(String userAgent, String field);
}
