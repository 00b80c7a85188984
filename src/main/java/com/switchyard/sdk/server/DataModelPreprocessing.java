package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableSet;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.ConfigValueType;
import com.switchyard.sdk.server.DataModel.Condition;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Additional information that we attach to our data model to reduce the overhead of evaluations.
 * <p>
 * All of this is computed once when a spec document is parsed, so an evaluation never re-parses a
 * regex or re-lowercases a target list.
 */
abstract class DataModelPreprocessing {
  private DataModelPreprocessing() {}
  
  static final class ConditionPreprocessed {
    final Pattern regex;
    final ImmutableSet<String> targetStrings;
    final ImmutableSet<String> lowerCaseTargetStrings;
    
    ConditionPreprocessed(Pattern regex, ImmutableSet<String> targetStrings,
        ImmutableSet<String> lowerCaseTargetStrings) {
      this.regex = regex;
      this.targetStrings = targetStrings;
      this.lowerCaseTargetStrings = lowerCaseTargetStrings;
    }
  }
  
  static ConditionPreprocessed preprocessCondition(Condition c) {
    ConfigValue target = c.getTargetValue();
    Pattern regex = null;
    if ("str_matches".equalsIgnoreCase(c.getOperator())) {
      regex = EvaluatorTypeConversion.valueToRegex(target);
    }
    ImmutableSet<String> targetStrings = null;
    ImmutableSet<String> lowerCase = null;
    if (target.getType() == ConfigValueType.ARRAY) {
      ImmutableSet.Builder<String> exact = ImmutableSet.builder();
      ImmutableSet.Builder<String> lower = ImmutableSet.builder();
      for (ConfigValue v: target.values()) {
        String s = v.toComparableString();
        if (s != null) {
          exact.add(s);
          lower.add(s.toLowerCase(Locale.ROOT));
        }
      }
      targetStrings = exact.build();
      lowerCase = lower.build();
    }
    return new ConditionPreprocessed(regex, targetStrings, lowerCase);
  }
}
