package com.switchyard.sdk.server;

import com.switchyard.sdk.ConfigValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

abstract class EvaluatorTypeConversion {
  private EvaluatorTypeConversion() {}
  
  // A timestamp whose seconds interpretation lands this far ahead is read as milliseconds.
  private static final int MILLIS_DETECTION_YEARS = 100;
  
  static Pattern valueToRegex(ConfigValue value) {
    if (value == null || !value.isString()) {
      return null;
    }
    try {
      return Pattern.compile(value.stringValue());
    } catch (PatternSyntaxException e) {
      return null;
    }
  }
  
  /**
   * Returns the value as a number; numeric strings are parsed. Returns null for anything else.
   */
  static Double valueToNumber(ConfigValue value) {
    if (value == null) {
      return null;
    }
    if (value.isNumber()) {
      return value.doubleValue();
    }
    if (value.isString()) {
      try {
        return Double.parseDouble(value.stringValue().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
  
  /**
   * Returns the version portion of a version string (anything after the first {@code -} is dropped),
   * or null if the value is not a string or the version portion is empty.
   */
  static String valueToVersion(ConfigValue value) {
    if (value == null || !value.isString()) {
      return null;
    }
    String s = value.stringValue();
    int dash = s.indexOf('-');
    String v = dash < 0 ? s : s.substring(0, dash);
    return v.isEmpty() ? null : v;
  }
  
  /**
   * Compares two dotted versions part by part as integers; missing parts count as 0, and parts
   * that are not integers also count as 0.
   */
  static int compareVersions(String v1, String v2) {
    String[] p1 = v1.split("\\.", -1);
    String[] p2 = v2.split("\\.", -1);
    int n = Math.max(p1.length, p2.length);
    for (int i = 0; i < n; i++) {
      long a = i < p1.length ? parseVersionPart(p1[i]) : 0;
      long b = i < p2.length ? parseVersionPart(p2[i]) : 0;
      if (a != b) {
        return a < b ? -1 : 1;
      }
    }
    return 0;
  }
  
  private static long parseVersionPart(String part) {
    try {
      return Long.parseLong(part);
    } catch (NumberFormatException e) {
      return 0;
    }
  }
  
  /**
   * Interprets a number or integer string as epoch seconds, or as epoch milliseconds truncated to whole
   * seconds when the seconds interpretation would be more than a century in the future. Returns null
   * for other values and for times before {@link Instant#MIN}.
   */
  static Instant valueToTime(ConfigValue value) {
    Long n = null;
    if (value == null) {
      return null;
    }
    if (value.isNumber()) {
      n = value.longValue();
    } else if (value.isString()) {
      try {
        n = Long.parseLong(value.stringValue().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    if (n == null) {
      return null;
    }
    long limitYear = ZonedDateTime.now(ZoneOffset.UTC).getYear() + MILLIS_DETECTION_YEARS;
    long limitSeconds = ZonedDateTime.of((int)limitYear + 1, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC).toEpochSecond();
    if (n >= limitSeconds) {
      return Instant.ofEpochSecond(n / 1000);
    }
    if (n < Instant.MIN.getEpochSecond()) {
      return null;
    }
    return Instant.ofEpochSecond(n);
  }
}
