package com.switchyard.sdk.server.subsystems;

/**
 * Maps an IP address to a country code, for {@code ip_based} conditions.
 */
public interface CountryLookup {
  /**
   * A lookup that never finds anything.
   */
  CountryLookup NONE = ip -> null;
  
  /**
   * Returns the ISO country code for an IP address.
   * 
   * @param ip an IPv4 or IPv6 address
   * @return the country code, or null if unknown
   */
  String lookupCountry(String ip);
}
