package rps;

import java.math.BigDecimal;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

/** Quoting, number formatting and list splitting shared by the parser and the generator. */
final class Literals {
  private static final Pattern NUMBER = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)");

  static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append("\\\"");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  static OptionalDouble parseNumber(String token) {
    if (!NUMBER.matcher(token).matches()) return OptionalDouble.empty();
    return OptionalDouble.of(Double.parseDouble(token));
  }

  /** Integral values print without a fraction: {@code 2.0} is {@code "2"}. */
  static String formatNumber(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  /**
   * Splits on commas that are not nested in brackets or strings, trimming each part and
   * dropping empty ones.
   */
  static ImmutableList<String> splitTopLevel(String text) {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    int depth = 0;
    char quote = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }

      switch (c) {
        case '"':
        case '\'':
          quote = c;
          break;
        case '(':
        case '[':
        case '{':
          depth++;
          break;
        case ')':
        case ']':
        case '}':
          depth = Math.max(0, depth - 1);
          break;
        case ',':
          if (depth == 0) {
            addPart(parts, text.substring(start, i));
            start = i + 1;
          }
          break;
        default:
          break;
      }
    }
    addPart(parts, text.substring(start));
    return parts.build();
  }

  private static void addPart(ImmutableList.Builder<String> parts, String part) {
    String trimmed = part.trim();
    if (!trimmed.isEmpty()) parts.add(trimmed);
  }

  private Literals() {}
}
