package io.synthtools.matcher;

import java.util.Arrays;
import java.util.List;

final class Constants {

  private Constants() {
    throw new UnsupportedOperationException("You can't create instance of utility class.");
  }

  // Reserved keys in a rule list entry.
  final static String ANY_OF = "any";
  final static String ALL_OF = "all";
  final static String ONE_OF_EACH = "one_of_each";
  final static String LIMIT = "limit";
  final static String EXACT_LIMIT = "=limit";

  // Operator keys inside an attribute's value object.
  final static String REGEX = "regex";

  // Keys of the target and agent sections.
  final static String DEVICES = "devices";
  final static String AGENTS = "agents";

  final static List<String> RESERVED_RULE_KEYS = Arrays.asList(ANY_OF, ALL_OF, ONE_OF_EACH, LIMIT, EXACT_LIMIT);

  static boolean isLimitKey(final String key) {
    return LIMIT.equals(key) || EXACT_LIMIT.equals(key);
  }
}
