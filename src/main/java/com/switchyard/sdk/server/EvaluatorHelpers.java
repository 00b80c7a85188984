package com.switchyard.sdk.server;

import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.User;

import java.util.Locale;
import java.util.Map;

/**
 * Static helpers used by {@link Evaluator} that do not depend on evaluator state: resolving unit
 * ids and looking up user and environment fields.
 */
abstract class EvaluatorHelpers {
  private EvaluatorHelpers() {}
  
  static final String USER_ID_TYPE = "userid";
  
  /**
   * Returns the unit id for an id type: the user id for a blank or {@code userID} id type, otherwise
   * the matching custom id (exact key first, then lower-cased key), or "" if there is none.
   */
  static String getUnitID(User user, String idType) {
    if (idType == null || idType.isEmpty() || USER_ID_TYPE.equals(idType.toLowerCase(Locale.ROOT))) {
      return user.getUserID() == null ? "" : user.getUserID();
    }
    Map<String, String> customIDs = user.getCustomIDs();
    String id = customIDs.get(idType);
    if (id == null) {
      id = customIDs.get(idType.toLowerCase(Locale.ROOT));
    }
    return id == null ? "" : id;
  }
  
  /**
   * Looks up a field on the user: first the built-in attributes by their accepted aliases, then
   * custom attributes and then private attributes, each by exact and then lower-cased name.
   * Returns a JSON null if nothing is found.
   */
  static ConfigValue getFromUser(User user, String field) {
    if (field == null) {
      return ConfigValue.ofNull();
    }
    String builtIn = null;
    switch (field.toLowerCase(Locale.ROOT)) {
    case "userid":
    case "user_id":
      builtIn = user.getUserID();
      break;
    case "email":
      builtIn = user.getEmail();
      break;
    case "ip":
    case "ipaddress":
    case "ip_address":
      builtIn = user.getIp();
      break;
    case "useragent":
    case "user_agent":
      builtIn = user.getUserAgent();
      break;
    case "country":
      builtIn = user.getCountry();
      break;
    case "locale":
      builtIn = user.getLocale();
      break;
    case "appversion":
    case "app_version":
      builtIn = user.getAppVersion();
      break;
    default:
      break;
    }
    if (builtIn != null && !builtIn.isEmpty()) {
      return ConfigValue.of(builtIn);
    }
    ConfigValue v = lookup(user.getCustom(), field);
    if (v == null) {
      v = lookup(user.getPrivateAttributes(), field);
    }
    return v == null ? ConfigValue.ofNull() : v;
  }
  
  static ConfigValue getFromEnvironment(User user, String field) {
    if (field == null) {
      return ConfigValue.ofNull();
    }
    Map<String, String> env = user.getEnvironment();
    String v = env.get(field);
    if (v == null) {
      v = env.get(field.toLowerCase(Locale.ROOT));
    }
    return v == null ? ConfigValue.ofNull() : ConfigValue.of(v);
  }
  
  /**
   * Normalizes a user-agent field name to one of {@code os_name}, {@code os_version},
   * {@code browser_name}, {@code browser_version}, or returns null if it is not one of those.
   */
  static String normalizeUserAgentField(String field) {
    if (field == null) {
      return null;
    }
    switch (field.toLowerCase(Locale.ROOT)) {
    case "os_name":
    case "osname":
      return "os_name";
    case "os_version":
    case "osversion":
      return "os_version";
    case "browser_name":
    case "browsername":
      return "browser_name";
    case "browser_version":
    case "browserversion":
      return "browser_version";
    default:
      return null;
    }
  }
  
  static boolean isEmpty(ConfigValue value) {
    return value.isNull() || (value.isString() && value.stringValue().isEmpty());
  }
  
  private static ConfigValue lookup(Map<String, ConfigValue> attrs, String field) {
    ConfigValue v = attrs.get(field);
    if (v == null) {
      v = attrs.get(field.toLowerCase(Locale.ROOT));
    }
    return v;
  }
}
