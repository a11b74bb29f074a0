package com.codeheadsystems.warden.server.config;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written as a count and a unit: {@code 30s}, {@code 15m}, {@code 24h}, {@code 30d}.
 */
public final class TtlParser {

  private static final Pattern TTL = Pattern.compile("^(\\d+)([smhd])$");

  /**
   * Longest accepted duration. Anything larger would overflow once added to a token's issue time.
   */
  static final Duration MAXIMUM = Duration.ofDays(36_500);

  private TtlParser() {
  }

  /**
   * Parses a duration, allowing zero.
   *
   * @param name  setting name used in the error message
   * @param value text such as {@code 15m}
   * @return the duration
   * @throws ConfigurationException when the text does not match the grammar or exceeds {@link #MAXIMUM}
   */
  public static Duration parse(final String name, final String value) {
    if (value == null) {
      throw new ConfigurationException(name + " is required");
    }
    final Matcher matcher = TTL.matcher(value.trim());
    if (!matcher.matches()) {
      throw new ConfigurationException(
          name + " must be a number followed by s, m, h or d (got '" + value + "')");
    }
    final long amount;
    try {
      amount = Long.parseLong(matcher.group(1));
    } catch (NumberFormatException e) {
      throw new ConfigurationException(name + " is out of range: " + value, e);
    }
    final Duration duration;
    try {
      duration = switch (matcher.group(2)) {
        case "s" -> Duration.ofSeconds(amount);
        case "m" -> Duration.ofMinutes(amount);
        case "h" -> Duration.ofHours(amount);
        default -> Duration.ofDays(amount);
      };
    } catch (ArithmeticException e) {
      throw new ConfigurationException(name + " is out of range: " + value, e);
    }
    if (duration.compareTo(MAXIMUM) > 0) {
      throw new ConfigurationException(name + " must not exceed " + MAXIMUM.toDays() + "d (got '" + value + "')");
    }
    return duration;
  }

  /**
   * Parses a duration that must be greater than zero.
   */
  public static Duration parsePositive(final String name, final String value) {
    final Duration duration = parse(name, value);
    if (duration.isZero()) {
      throw new ConfigurationException(name + " must be greater than zero");
    }
    return duration;
  }
}
