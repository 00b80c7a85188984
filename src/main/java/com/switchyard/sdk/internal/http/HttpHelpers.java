package com.switchyard.sdk.internal.http;

import java.net.URI;

/**
 * Helper methods related to HTTP.
 * <p>
 * This class is for internal use only and should not be documented in the SDK API.
 */
public abstract class HttpHelpers {
  private HttpHelpers() {}

  /**
   * Safely concatenates a path, ensuring that there is exactly one slash between components.
   * 
   * @param baseUri the base URI
   * @param path the path to add
   * @return a new URI
   */
  public static URI concatenateUriPath(URI baseUri, String path) {
    String uriStr = baseUri.toString();
    String addPath = path.startsWith("/") ? path.substring(1) : path;
    return URI.create(uriStr + (uriStr.endsWith("/") ? "" : "/") + addPath);
  }
  
  /**
   * Adds a query parameter to a URI.
   * 
   * @param baseUri the URI
   * @param name the parameter name; must not need escaping
   * @param value the parameter value; must not need escaping
   * @return a new URI
   */
  public static URI addQueryParam(URI baseUri, String name, String value) {
    String uriStr = baseUri.toString();
    return URI.create(uriStr + (uriStr.contains("?") ? "&" : "?") + name + "=" + value);
  }

  /**
   * Tests whether a string contains only characters that are safe to use in an HTTP header value.
   * <p>
   * The value we're mainly concerned with is the server secret. If a secret accidentally has (for
   * instance) a newline added to it, we don't want OkHttp to throw an exception mentioning the value,
   * which might get logged.
   * 
   * @param value a string
   * @return true if valid
   */
  public static boolean isAsciiHeaderValue(String value) {
    for (int i = 0; i < value.length(); i++) {
      char ch = value.charAt(i);
      if ((ch < 0x20 || ch > 0x7e) && ch != '\t') {
        return false;
      }
    }
    return true;
  }
}
