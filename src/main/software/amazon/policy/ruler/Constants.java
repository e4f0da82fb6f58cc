package software.amazon.policy.ruler;

import java.time.Duration;
import java.util.regex.Pattern;

final class Constants {

  private Constants() {
    throw new UnsupportedOperationException("You can't create instance of utility class.");
  }

  // Wire names of the condition operators, case-sensitive.
  final static String STRING_EQUALS = "StringEquals";
  final static String STRING_NOT_EQUALS = "StringNotEquals";
  final static String STRING_EQUALS_IGNORE_CASE = "StringEqualsIgnoreCase";
  final static String STRING_NOT_EQUALS_IGNORE_CASE = "StringNotEqualsIgnoreCase";
  final static String STRING_LIKE = "StringLike";
  final static String STRING_NOT_LIKE = "StringNotLike";

  final static String NUMERIC_EQUALS = "NumericEquals";
  final static String NUMERIC_NOT_EQUALS = "NumericNotEquals";
  final static String NUMERIC_LESS_THAN = "NumericLessThan";
  final static String NUMERIC_LESS_THAN_EQUALS = "NumericLessThanEquals";
  final static String NUMERIC_GREATER_THAN = "NumericGreaterThan";
  final static String NUMERIC_GREATER_THAN_EQUALS = "NumericGreaterThanEquals";

  final static String DATE_EQUALS = "DateEquals";
  final static String DATE_NOT_EQUALS = "DateNotEquals";
  final static String DATE_LESS_THAN = "DateLessThan";
  final static String DATE_LESS_THAN_EQUALS = "DateLessThanEquals";
  final static String DATE_GREATER_THAN = "DateGreaterThan";
  final static String DATE_GREATER_THAN_EQUALS = "DateGreaterThanEquals";

  final static String BOOL = "Bool";

  final static String IP_ADDRESS = "IPAddress";
  final static String NOT_IP_ADDRESS = "NotIPAddress";

  final static char WILDCARD_CHAR = '*';
  final static String PATTERN_LIST_SEPARATOR = ",";

  final static int DEFAULT_CACHE_CAPACITY = 512;
  final static Duration DEFAULT_MATCH_TIMEOUT = Duration.ofMillis(250);

  // Octets with a leading zero are rejected, other parsers read them as octal.
  private final static String IPv4_OCTET = "(?:0|[1-9][0-9]{0,2})";
  private final static String IPv4_QUAD = IPv4_OCTET + "(?:\\." + IPv4_OCTET + "){3}";
  final static Pattern IPv4_REGEX = Pattern.compile(IPv4_QUAD);
  // Hex groups, optionally ending in an embedded dotted quad such as ::ffff:10.1.2.3
  final static Pattern IPv6_REGEX = Pattern.compile("[0-9a-fA-F:]*:(?:[0-9a-fA-F:]*|" + IPv4_QUAD + ")");
}
