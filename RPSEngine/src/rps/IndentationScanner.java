package rps;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * Splits source text into logical lines with their indentation. Blank lines and full-line
 * {@code #} comments are dropped; a dedent that matches no open level is reported and snapped
 * to the enclosing one.
 */
public class IndentationScanner {
  public static final int TAB_WIDTH = 4;

  private static final Splitter LINES = Splitter.onPattern("\r?\n");
  private static final CharMatcher INDENTATION = CharMatcher.anyOf(" \t");

  @AutoValue
  public abstract static class Line {
    /** The line without its indentation or trailing whitespace. */
    public abstract String text();

    /** The line without its indentation, trailing whitespace kept. */
    public abstract String rawText();

    /** Leading columns, with tabs expanded. */
    public abstract int indent();

    /** 1-based. */
    public abstract int lineNumber();

    public static Line create(String rawText, int indent, int lineNumber) {
      Verify.verify(indent >= 0, "negative indentation %s at line %s", indent, lineNumber);
      return new AutoValue_IndentationScanner_Line(
          CharMatcher.whitespace().trimFrom(rawText), rawText, indent, lineNumber);
    }

    public boolean endsWithColon() {
      return text().endsWith(":");
    }
  }

  @AutoValue
  public abstract static class ScanResult {
    public abstract ImmutableList<Line> lines();

    public abstract ImmutableList<Diagnostic> diagnostics();

    static ScanResult create(Iterable<Line> lines, Iterable<Diagnostic> diagnostics) {
      return new AutoValue_IndentationScanner_ScanResult(
          ImmutableList.copyOf(lines), ImmutableList.copyOf(diagnostics));
    }
  }

  public ScanResult scan(String source) {
    List<Line> lines = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();
    Deque<Integer> levels = new ArrayDeque<>();
    levels.push(0);

    int lineNumber = 0;
    for (String physical : LINES.split(source)) {
      lineNumber++;
      String text = CharMatcher.whitespace().trimFrom(physical);
      if (text.isEmpty() || text.startsWith("#")) continue;

      int indent = measureIndent(physical);
      if (indent > levels.peek()) {
        levels.push(indent);
      } else {
        while (indent < levels.peek()) levels.pop();
        if (indent != levels.peek()) {
          diagnostics.add(Diagnostic.create(lineNumber, "inconsistent indentation"));
          indent = levels.peek();
        }
      }

      lines.add(Line.create(INDENTATION.trimLeadingFrom(physical), indent, lineNumber));
    }

    return ScanResult.create(lines, diagnostics);
  }

  static int measureIndent(String physical) {
    int column = 0;
    for (int i = 0; i < physical.length(); i++) {
      char c = physical.charAt(i);
      if (c == ' ') {
        column++;
      } else if (c == '\t') {
        column = (column / TAB_WIDTH + 1) * TAB_WIDTH;
      } else {
        break;
      }
    }
    return column;
  }
}
