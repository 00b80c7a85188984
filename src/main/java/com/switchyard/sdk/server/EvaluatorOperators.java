package com.switchyard.sdk.server;

import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ConfigValueType;
import com.switchyard.sdk.server.DataModelPreprocessing.ConditionPreprocessed;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import static com.switchyard.sdk.server.EvaluatorTypeConversion.compareVersions;
import static com.switchyard.sdk.server.EvaluatorTypeConversion.valueToNumber;
import static com.switchyard.sdk.server.EvaluatorTypeConversion.valueToRegex;
import static com.switchyard.sdk.server.EvaluatorTypeConversion.valueToTime;
import static com.switchyard.sdk.server.EvaluatorTypeConversion.valueToVersion;

/**
 * Defines the behavior of all operators that can be used in conditions.
 */
abstract class EvaluatorOperators {
  private EvaluatorOperators() {}
  
  static final String IN_SEGMENT_LIST = "in_segment_list";
  static final String NOT_IN_SEGMENT_LIST = "not_in_segment_list";
  
  private static interface OperatorFn {
    boolean match(ConfigValue userValue, ConfigValue target, ConditionPreprocessed preprocessed);
  }
  
  private static final Map<String, OperatorFn> OPERATORS = new HashMap<>();
  static {
    OPERATORS.put("gt", numericComparison(delta -> delta > 0));
    OPERATORS.put("gte", numericComparison(delta -> delta >= 0));
    OPERATORS.put("lt", numericComparison(delta -> delta < 0));
    OPERATORS.put("lte", numericComparison(delta -> delta <= 0));
    OPERATORS.put("version_gt", versionComparison(delta -> delta > 0));
    OPERATORS.put("version_gte", versionComparison(delta -> delta >= 0));
    OPERATORS.put("version_lt", versionComparison(delta -> delta < 0));
    OPERATORS.put("version_lte", versionComparison(delta -> delta <= 0));
    OPERATORS.put("version_eq", versionComparison(delta -> delta == 0));
    OPERATORS.put("version_neq", versionComparison(delta -> delta != 0));
    OPERATORS.put("any", EvaluatorOperators::applyAny);
    OPERATORS.put("none", (u, t, p) -> !applyAny(u, t, p));
    OPERATORS.put("any_case_sensitive", EvaluatorOperators::applyAnyCaseSensitive);
    OPERATORS.put("none_case_sensitive", (u, t, p) -> !applyAnyCaseSensitive(u, t, p));
    OPERATORS.put("str_starts_with_any", stringComparison(String::startsWith));
    OPERATORS.put("str_ends_with_any", stringComparison(String::endsWith));
    OPERATORS.put("str_contains_any", stringComparison(String::contains));
    OPERATORS.put("str_contains_none", negate(stringComparison(String::contains)));
    OPERATORS.put("str_matches", EvaluatorOperators::applyMatches);
    OPERATORS.put("eq", EvaluatorOperators::applyEquals);
    OPERATORS.put("neq", negate(EvaluatorOperators::applyEquals));
    OPERATORS.put("before", timeComparison(delta -> delta < 0));
    OPERATORS.put("after", timeComparison(delta -> delta > 0));
    OPERATORS.put("on", EvaluatorOperators::applyOn);
    OPERATORS.put("array_contains_any", EvaluatorOperators::applyArrayContainsAny);
    OPERATORS.put("array_contains_none", negate(EvaluatorOperators::applyArrayContainsAny));
    OPERATORS.put("array_contains_all", EvaluatorOperators::applyArrayContainsAll);
    OPERATORS.put("not_array_contains_all", negate(EvaluatorOperators::applyArrayContainsAll));
    // The segment list operators are not included here, because they need the id lists in the
    // store and are implemented in Evaluator.
  }
  
  static boolean isKnown(String op) {
    return OPERATORS.containsKey(op) || IN_SEGMENT_LIST.equals(op) || NOT_IN_SEGMENT_LIST.equals(op);
  }
  
  static boolean apply(String op, ConfigValue userValue, ConfigValue target, ConditionPreprocessed preprocessed) {
    OperatorFn fn = OPERATORS.get(op);
    return fn != null && fn.match(ConfigValue.normalize(userValue), ConfigValue.normalize(target), preprocessed);
  }
  
  static boolean applyAny(ConfigValue userValue, ConfigValue target, ConditionPreprocessed preprocessed) {
    String s = userValue.toComparableString();
    if (s == null) {
      return false;
    }
    if (preprocessed != null && preprocessed.lowerCaseTargetStrings != null) {
      return preprocessed.lowerCaseTargetStrings.contains(s.toLowerCase(Locale.ROOT));
    }
    return anyTarget(target, t -> t.equalsIgnoreCase(s));
  }
  
  static boolean applyAnyCaseSensitive(ConfigValue userValue, ConfigValue target,
      ConditionPreprocessed preprocessed) {
    String s = userValue.toComparableString();
    if (s == null) {
      return false;
    }
    if (preprocessed != null && preprocessed.targetStrings != null) {
      return preprocessed.targetStrings.contains(s);
    }
    return anyTarget(target, t -> t.equals(s));
  }
  
  static boolean applyMatches(ConfigValue userValue, ConfigValue target, ConditionPreprocessed preprocessed) {
    // If preprocessed is non-null, we have already tried to parse the target as a regex, so a null
    // regex there means it was not a valid one.
    Pattern pattern = preprocessed == null ? valueToRegex(target) : preprocessed.regex;
    String s = userValue.toComparableString();
    return pattern != null && s != null && pattern.matcher(s).find();
  }
  
  static boolean applyEquals(ConfigValue userValue, ConfigValue target, ConditionPreprocessed preprocessed) {
    if (target.isNull()) {
      return userValue.isNull() || (userValue.isString() && userValue.stringValue().isEmpty());
    }
    return userValue.equals(target);
  }
  
  static boolean applyOn(ConfigValue userValue, ConfigValue target, ConditionPreprocessed preprocessed) {
    Instant a = valueToTime(userValue);
    Instant b = valueToTime(target);
    if (a == null || b == null) {
      return false;
    }
    LocalDate d1 = a.atZone(ZoneOffset.UTC).toLocalDate();
    LocalDate d2 = b.atZone(ZoneOffset.UTC).toLocalDate();
    return d1.equals(d2);
  }
  
  static boolean applyArrayContainsAny(ConfigValue userValue, ConfigValue target,
      ConditionPreprocessed preprocessed) {
    Set<String> userStrings = comparableStrings(userValue);
    if (userStrings == null) {
      return false;
    }
    return anyTarget(target, userStrings::contains);
  }
  
  static boolean applyArrayContainsAll(ConfigValue userValue, ConfigValue target,
      ConditionPreprocessed preprocessed) {
    Set<String> userStrings = comparableStrings(userValue);
    if (userStrings == null || target.size() == 0) {
      return false;
    }
    for (ConfigValue t: target.values()) {
      String s = t.toComparableString();
      if (s == null || !userStrings.contains(s)) {
        return false;
      }
    }
    return true;
  }
  
  private static Set<String> comparableStrings(ConfigValue array) {
    if (array.getType() != ConfigValueType.ARRAY) {
      return null;
    }
    Set<String> ret = new HashSet<>();
    for (ConfigValue v: array.values()) {
      String s = v.toComparableString();
      if (s != null) {
        ret.add(s);
      }
    }
    return ret;
  }
  
  private static boolean anyTarget(ConfigValue target, Predicate<String> test) {
    for (ConfigValue t: target.values()) {
      String s = t.toComparableString();
      if (s != null && test.test(s)) {
        return true;
      }
    }
    return false;
  }
  
  private static OperatorFn negate(OperatorFn fn) {
    return (u, t, p) -> !fn.match(u, t, p);
  }
  
  private static OperatorFn numericComparison(IntPredicate test) {
    return (userValue, target, preprocessed) -> {
      Double a = valueToNumber(userValue);
      Double b = valueToNumber(target);
      return a != null && b != null && test.test(Double.compare(a, b));
    };
  }
  
  private static OperatorFn versionComparison(IntPredicate test) {
    return (userValue, target, preprocessed) -> {
      String a = valueToVersion(userValue);
      String b = valueToVersion(target);
      return a != null && b != null && test.test(compareVersions(a, b));
    };
  }
  
  private static OperatorFn timeComparison(IntPredicate test) {
    return (userValue, target, preprocessed) -> {
      Instant a = valueToTime(userValue);
      Instant b = valueToTime(target);
      return a != null && b != null && test.test(a.compareTo(b));
    };
  }
  
  private static OperatorFn stringComparison(BiPredicate<String, String> test) {
    return (userValue, target, preprocessed) -> {
      String s = userValue.toComparableString();
      if (s == null) {
        return false;
      }
      String lower = s.toLowerCase(Locale.ROOT);
      return anyTarget(target, t -> test.test(lower, t.toLowerCase(Locale.ROOT)));
    };
  }
}
