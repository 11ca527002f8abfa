package build.please.gotest.parse;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses durations as the Go test runner prints them, e.g. "0.03s", "1m30.5s" or "250ms".
 */
public final class GoDuration {
  private static final Map<String, Long> UNIT_NANOS = new HashMap<>();

  static {
    UNIT_NANOS.put("ns", 1L);
    UNIT_NANOS.put("us", 1_000L);
    UNIT_NANOS.put("\u00b5s", 1_000L);  // micro sign
    UNIT_NANOS.put("\u03bcs", 1_000L);  // greek mu
    UNIT_NANOS.put("ms", 1_000_000L);
    UNIT_NANOS.put("s", 1_000_000_000L);
    UNIT_NANOS.put("m", 60_000_000_000L);
    UNIT_NANOS.put("h", 3_600_000_000_000L);
  }

  private GoDuration() {
  }

  /**
   * Parses a duration string.
   * @return the duration, or empty if the string is not a valid duration.
   */
  public static Optional<Duration> tryParse(String s) {
    if (s == null || s.isEmpty()) {
      return Optional.empty();
    }
    int i = 0;
    boolean negative = false;
    char first = s.charAt(0);
    if (first == '-' || first == '+') {
      negative = first == '-';
      ++i;
    }
    if (s.substring(i).equals("0")) {
      return Optional.of(Duration.ZERO);
    }
    if (i == s.length()) {
      return Optional.empty();
    }
    BigDecimal total = BigDecimal.ZERO;
    while (i < s.length()) {
      int numberStart = i;
      while (i < s.length() && isNumberChar(s.charAt(i))) {
        ++i;
      }
      int unitStart = i;
      while (i < s.length() && !isNumberChar(s.charAt(i))) {
        ++i;
      }
      String number = s.substring(numberStart, unitStart);
      Long unit = UNIT_NANOS.get(s.substring(unitStart, i));
      if (number.isEmpty() || number.equals(".") || unit == null) {
        return Optional.empty();
      }
      try {
        total = total.add(new BigDecimal(number).multiply(BigDecimal.valueOf(unit)));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    try {
      long nanos = total.setScale(0, RoundingMode.DOWN).longValueExact();
      return Optional.of(Duration.ofNanos(negative ? -nanos : nanos));
    } catch (ArithmeticException e) {
      return Optional.empty();  // overflows a long of nanoseconds
    }
  }

  /**
   * Parses a duration string, returning zero if it can't be parsed.
   */
  public static Duration parseOrZero(String s) {
    return tryParse(s).orElse(Duration.ZERO);
  }

  private static boolean isNumberChar(char c) {
    return (c >= '0' && c <= '9') || c == '.';
  }
}
