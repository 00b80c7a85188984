package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableList;
import com.switchyard.sdk.ConfigValue;
import com.switchyard.sdk.server.DataModel.Condition;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import static com.switchyard.sdk.server.ModelBuilders.stringArray;
import static org.junit.Assert.assertEquals;

@SuppressWarnings("javadoc")
@RunWith(Parameterized.class)
public class EvaluatorOperatorsParameterizedTest {
  private static final ConfigValue nullValue = ConfigValue.ofNull();

  private final String op;
  private final ConfigValue userValue;
  private final ConfigValue target;
  private final boolean shouldBe;

  public EvaluatorOperatorsParameterizedTest(String op, ConfigValue userValue, ConfigValue target, boolean shouldBe) {
    this.op = op;
    this.userValue = userValue;
    this.target = target;
    this.shouldBe = shouldBe;
  }

  @Parameterized.Parameters(name = "{1} {0} {2} should be {3}")
  public static Iterable<Object[]> data() {
    ImmutableList.Builder<Object[]> tests = ImmutableList.builder();

    tests.add(new Object[][] {
      // numeric comparisons
      { "gt", ConfigValue.of(99.0001), ConfigValue.of(99), true },
      { "gt", ConfigValue.of(99), ConfigValue.of(99), false },
      { "gte", ConfigValue.of(99), ConfigValue.of(99), true },
      { "lt", ConfigValue.of(98), ConfigValue.of(99), true },
      { "lt", ConfigValue.of(99), ConfigValue.of(98), false },
      { "lte", ConfigValue.of(99), ConfigValue.of(99), true },
      { "gt", ConfigValue.of("100"), ConfigValue.of(99), true },
      { "gt", ConfigValue.of(100), ConfigValue.of("99.5"), true },
      { "gt", ConfigValue.of("abc"), ConfigValue.of(99), false },
      { "gt", nullValue, ConfigValue.of(99), false },
      { "lt", ConfigValue.of(true), ConfigValue.of(99), false },

      // versions
      { "version_gt", ConfigValue.of("1.10"), ConfigValue.of("1.9"), true },
      { "version_gt", ConfigValue.of("1.9"), ConfigValue.of("1.10"), false },
      { "version_gte", ConfigValue.of("1.2.0"), ConfigValue.of("1.2"), true },
      { "version_lt", ConfigValue.of("1.2"), ConfigValue.of("1.2.1"), true },
      { "version_lte", ConfigValue.of("2.0"), ConfigValue.of("2"), true },
      { "version_eq", ConfigValue.of("1.2.3-beta"), ConfigValue.of("1.2.3"), true },
      { "version_eq", ConfigValue.of("1.2"), ConfigValue.of("1.2.0.0"), true },
      { "version_neq", ConfigValue.of("1.2.4"), ConfigValue.of("1.2.3"), true },
      { "version_neq", ConfigValue.of("1.2.3"), ConfigValue.of("1.2.3"), false },
      { "version_eq", ConfigValue.of(1), ConfigValue.of("1"), false },
      { "version_gt", ConfigValue.of("-beta"), ConfigValue.of("1"), false },

      // list membership
      { "any", ConfigValue.of("Apple"), stringArray("apple", "pear"), true },
      { "any", ConfigValue.of("plum"), stringArray("apple", "pear"), false },
      { "any", ConfigValue.of(3), stringArray("1", "2", "3"), true },
      { "any", nullValue, stringArray("apple"), false },
      { "none", ConfigValue.of("plum"), stringArray("apple", "pear"), true },
      { "none", ConfigValue.of("APPLE"), stringArray("apple", "pear"), false },
      { "any_case_sensitive", ConfigValue.of("apple"), stringArray("apple"), true },
      { "any_case_sensitive", ConfigValue.of("Apple"), stringArray("apple"), false },
      { "none_case_sensitive", ConfigValue.of("Apple"), stringArray("apple"), true },

      // string matching
      { "str_starts_with_any", ConfigValue.of("Hello world"), stringArray("hello"), true },
      { "str_starts_with_any", ConfigValue.of("world"), stringArray("hello"), false },
      { "str_ends_with_any", ConfigValue.of("user@example.COM"), stringArray("@example.com"), true },
      { "str_contains_any", ConfigValue.of("abcdef"), stringArray("xyz", "CD"), true },
      { "str_contains_none", ConfigValue.of("abcdef"), stringArray("xyz"), true },
      { "str_contains_none", ConfigValue.of("abcdef"), stringArray("bc"), false },
      { "str_contains_any", nullValue, stringArray("x"), false },
      { "str_matches", ConfigValue.of("user-123"), ConfigValue.of("^user-\\d+$"), true },
      { "str_matches", ConfigValue.of("admin-123"), ConfigValue.of("^user-\\d+$"), false },
      { "str_matches", ConfigValue.of("abc"), ConfigValue.of("(unclosed"), false },

      // equality
      { "eq", ConfigValue.of("x"), ConfigValue.of("x"), true },
      { "eq", ConfigValue.of(2), ConfigValue.of(2.0), true },
      { "eq", ConfigValue.of("2"), ConfigValue.of(2), false },
      { "eq", nullValue, nullValue, true },
      { "eq", ConfigValue.of(""), nullValue, true },
      { "neq", ConfigValue.of("x"), ConfigValue.of("y"), true },
      { "neq", ConfigValue.of("x"), ConfigValue.of("x"), false },

      // time
      { "before", ConfigValue.of(1000), ConfigValue.of(2000), true },
      { "before", ConfigValue.of(2000), ConfigValue.of(1000), false },
      { "after", ConfigValue.of("2000"), ConfigValue.of(1000), true },
      { "after", ConfigValue.of("not a time"), ConfigValue.of(1000), false },
      { "on", ConfigValue.of(1700000000L), ConfigValue.of(1700003600L), true },
      { "on", ConfigValue.of(1700000000000L), ConfigValue.of(1700000000L), true },
      { "on", ConfigValue.of(1700000000L), ConfigValue.of(1700100000L), false },
      { "before", ConfigValue.of(1700000000100L), ConfigValue.of(1700000000900L), false },
      { "after", ConfigValue.of(1700000000900L), ConfigValue.of(1700000000100L), false },
      { "before", ConfigValue.of(1700000000900L), ConfigValue.of(1700000001000L), true },
      { "before", ConfigValue.of("-9223372036854775808"), ConfigValue.of(1700000000), false },
      { "after", ConfigValue.of(-1e300), ConfigValue.of(0), false },
      { "on", ConfigValue.of(Long.MIN_VALUE), ConfigValue.of(0), false },

      // arrays
      { "array_contains_any", stringArray("a", "b"), stringArray("b", "c"), true },
      { "array_contains_any", stringArray("a", "b"), stringArray("c"), false },
      { "array_contains_any", ConfigValue.of("a"), stringArray("a"), false },
      { "array_contains_none", stringArray("a", "b"), stringArray("c"), true },
      { "array_contains_all", stringArray("a", "b", "c"), stringArray("a", "c"), true },
      { "array_contains_all", stringArray("a", "b"), stringArray("a", "c"), false },
      { "array_contains_all", stringArray("a"), stringArray(), false },
      { "not_array_contains_all", stringArray("a", "b"), stringArray("a", "c"), true },
      { "array_contains_any", ConfigValue.arrayOf(ConfigValue.of(1), ConfigValue.of(2)), stringArray("2"), true },

      // unknown operator never matches
      { "bogus", ConfigValue.of("x"), ConfigValue.of("x"), false }
    });

    return tests.build();
  }

  @Test
  public void applyWithoutPreprocessing() {
    assertEquals(shouldBe, EvaluatorOperators.apply(op, userValue, target, null));
  }

  @Test
  public void applyWithPreprocessedCondition() {
    Condition c = ModelBuilders.userField("attr", op, target);
    assertEquals(shouldBe, EvaluatorOperators.apply(op, userValue, target, c.preprocessed));
  }
}
