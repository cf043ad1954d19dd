package rps;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads one statement line left to right. Never reads past the end of the line. */
final class LineCursor {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String text;
  private int pos = 0;

  LineCursor(String text) {
    this.text = text;
  }

  private void skipSpaces() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
  }

  boolean atEnd() {
    skipSpaces();
    return pos >= text.length();
  }

  boolean lookingAt(char c) {
    skipSpaces();
    return pos < text.length() && text.charAt(pos) == c;
  }

  /** Consumes {@code c} if it is the next character. */
  boolean consume(char c) {
    if (!lookingAt(c)) return false;
    pos++;
    return true;
  }

  /** Everything not read yet, trimmed. */
  String rest() {
    skipSpaces();
    return text.substring(pos).trim();
  }

  Optional<String> readIdentifier() {
    skipSpaces();
    Matcher m = IDENTIFIER.matcher(text).region(pos, text.length());
    if (!m.lookingAt()) return Optional.empty();
    pos = m.end();
    return Optional.of(m.group());
  }

  /** Consumes {@code keyword} when it is the next whole word. */
  boolean consumeKeyword(String keyword) {
    skipSpaces();
    int end = pos + keyword.length();
    if (!text.startsWith(keyword, pos)) return false;
    if (end < text.length() && isWordChar(text.charAt(end))) return false;
    pos = end;
    return true;
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /** The next token without consuming it, or empty at the end of the line. */
  String peekToken() {
    int saved = pos;
    String token = readToken();
    pos = saved;
    return token;
  }

  /**
   * Reads up to the next whitespace that is not nested in brackets or a string, so {@code
   * Position(xpos = 0.5)} is a single token.
   */
  String readToken() {
    skipSpaces();
    int start = pos;
    int depth = 0;
    char quote = 0;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (quote != 0) {
        if (c == '\\') {
          pos++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        depth = Math.max(0, depth - 1);
      } else if (depth == 0 && Character.isWhitespace(c)) {
        break;
      }
      pos++;
    }
    pos = Math.min(pos, text.length());
    return text.substring(start, pos);
  }

  /**
   * Reads a balanced {@code (...)} group and returns its contents, or empty if the next
   * character is not {@code '('} or the group never closes.
   */
  Optional<String> readParenthesized() {
    if (!lookingAt('(')) return Optional.empty();
    int start = pos;
    int depth = 0;
    char quote = 0;
    for (int i = pos; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          pos = i + 1;
          return Optional.of(text.substring(start + 1, i));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Reads a double-quoted string and returns its unescaped value, or empty if there is no
   * complete string here.
   */
  Optional<String> readString() {
    if (!lookingAt('"')) return Optional.empty();
    StringBuilder sb = new StringBuilder();
    for (int i = pos + 1; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"') {
        pos = i + 1;
        return Optional.of(sb.toString());
      }
      if (c == '\\' && i + 1 < text.length()) {
        char next = text.charAt(++i);
        switch (next) {
          case 'n':
            sb.append('\n');
            break;
          case 't':
            sb.append('\t');
            break;
          case '"':
          case '\\':
            sb.append(next);
            break;
          default:
            sb.append('\\').append(next);
        }
      } else {
        sb.append(c);
      }
    }
    return Optional.empty();
  }
}
