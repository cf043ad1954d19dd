package rps;

import java.util.Optional;
import java.util.OptionalDouble;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** Normalization and checks shared by the node factory and the option builders. */
final class Fields {
  private static final CharMatcher LINE_BREAK = CharMatcher.anyOf("\r\n");
  private static final Splitter WORDS =
      Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();

  static Optional<String> nonBlank(Optional<String> value) {
    return value.map(String::trim).filter(v -> !v.isEmpty());
  }

  static Optional<String> nonBlank(String value) {
    return nonBlank(Optional.ofNullable(value));
  }

  static String required(String value, String field) {
    Preconditions.checkArgument(
        value != null && !value.trim().isEmpty(), "%s must not be blank", field);
    return singleLine(value.trim(), field);
  }

  static String singleLine(String value, String field) {
    Preconditions.checkArgument(
        LINE_BREAK.matchesNoneOf(value), "%s must fit on one line: %s", field, value);
    return value;
  }

  static Optional<String> singleLine(Optional<String> value, String field) {
    value.ifPresent(v -> singleLine(v, field));
    return value;
  }

  static OptionalDouble finite(OptionalDouble value, String field) {
    if (value.isPresent()) {
      Preconditions.checkArgument(
          Double.isFinite(value.getAsDouble()), "%s must be finite: %s", field, value);
    }
    return value;
  }

  /** Splits every entry on whitespace, so {@code ["happy smile"]} becomes two words. */
  static ImmutableList<String> words(Iterable<String> values, String field) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (String value : values) {
      Preconditions.checkArgument(value != null, "%s must not be null", field);
      builder.addAll(WORDS.split(value));
    }
    return builder.build();
  }

  static ImmutableList<String> words(String value) {
    return ImmutableList.copyOf(WORDS.split(value));
  }

  private Fields() {}
}
