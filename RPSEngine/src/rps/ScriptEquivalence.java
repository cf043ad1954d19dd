package rps;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Semantic equality of statement trees, the contract behind {@code parse(generate(tree))}. Ids,
 * source lines and script metadata never matter; numbers match within {@link
 * #NUMBER_TOLERANCE}; python code matches after dropping what the scanner cannot reproduce.
 */
public final class ScriptEquivalence {
  public static final double NUMBER_TOLERANCE = 1e-6;

  private static final Splitter LINES = Splitter.on('\n');

  public static boolean equivalent(Script a, Script b) {
    return !firstDifference(a, b).isPresent();
  }

  public static boolean equivalent(
      List<? extends Statement> a, List<? extends Statement> b) {
    return !firstDifference(a, b).isPresent();
  }

  public static boolean equivalent(Statement a, Statement b) {
    return !diff("statement", a, b).isPresent();
  }

  /** The path to the first mismatch, such as {@code statements[0].body[2].text}. */
  public static Optional<String> firstDifference(Script a, Script b) {
    return firstDifference(a.statements(), b.statements());
  }

  public static Optional<String> firstDifference(
      List<? extends Statement> a, List<? extends Statement> b) {
    return diffStatements("statements", a, b);
  }

  private static Optional<String> diffStatements(
      String path, List<? extends Statement> a, List<? extends Statement> b) {
    if (a.size() != b.size()) return Optional.of(path + ".size");
    for (int i = 0; i < a.size(); i++) {
      Optional<String> difference = diff(path + "[" + i + "]", a.get(i), b.get(i));
      if (difference.isPresent()) return difference;
    }
    return Optional.empty();
  }

  private static Optional<String> diffChoices(
      String path, List<Statement.Menu.Choice> a, List<Statement.Menu.Choice> b) {
    if (a.size() != b.size()) return Optional.of(path + ".size");
    for (int i = 0; i < a.size(); i++) {
      Statement.Menu.Choice x = a.get(i);
      Statement.Menu.Choice y = b.get(i);
      Optional<String> difference =
          new Diff(path + "[" + i + "]")
              .field("text", x.text(), y.text())
              .field("condition", x.condition(), y.condition())
              .statements("body", x.body(), y.body())
              .result();
      if (difference.isPresent()) return difference;
    }
    return Optional.empty();
  }

  private static Optional<String> diffBranches(
      String path, List<Statement.If.Branch> a, List<Statement.If.Branch> b) {
    if (a.size() != b.size()) return Optional.of(path + ".size");
    for (int i = 0; i < a.size(); i++) {
      Statement.If.Branch x = a.get(i);
      Statement.If.Branch y = b.get(i);
      Optional<String> difference =
          new Diff(path + "[" + i + "]")
              .field("condition", x.condition(), y.condition())
              .statements("body", x.body(), y.body())
              .result();
      if (difference.isPresent()) return difference;
    }
    return Optional.empty();
  }

  private static Optional<String> diff(String path, Statement a, Statement b) {
    if (a.kind() != b.kind()) return Optional.of(path + ".kind");

    Diff diff = new Diff(path);
    switch (a.kind()) {
      case LABEL:
        {
          Statement.Label x = a.cast();
          Statement.Label y = b.cast();
          diff.field("name", x.name(), y.name())
              .field("parameters", x.parameters(), y.parameters())
              .statements("body", x.body(), y.body());
          break;
        }
      case DIALOGUE:
        {
          Statement.Dialogue x = a.cast();
          Statement.Dialogue y = b.cast();
          diff.field("speaker", x.speaker(), y.speaker())
              .field("text", x.text(), y.text())
              .field("attributes", x.options().attributes(), y.options().attributes())
              .field("transition", x.options().transition(), y.options().transition())
              .field("extend", x.options().extend(), y.options().extend());
          break;
        }
      case MENU:
        {
          Statement.Menu x = a.cast();
          Statement.Menu y = b.cast();
          diff.field("name", x.options().name(), y.options().name())
              .field("prompt", x.options().prompt(), y.options().prompt())
              .field("resultVariable", x.options().resultVariable(), y.options().resultVariable())
              .field("screen", x.options().screen(), y.options().screen());
          if (!diff.result().isPresent()) {
            return diffChoices(path + ".choices", x.choices(), y.choices());
          }
          break;
        }
      case SCENE:
      case SHOW:
      case HIDE:
        {
          Statement.ImageStatement x = a.cast();
          Statement.ImageStatement y = b.cast();
          DisplayOptions xo = x.options();
          DisplayOptions yo = y.options();
          diff.field("image", x.image(), y.image())
              .field("attributes", xo.attributes(), yo.attributes())
              .field("asTag", xo.asTag(), yo.asTag())
              .field("position", xo.position(), yo.position())
              .field("behindTag", xo.behindTag(), yo.behindTag())
              .field("layer", xo.layer(), yo.layer())
              .field("zorder", xo.zorder(), yo.zorder())
              .field("transition", xo.transition(), yo.transition());
          break;
        }
      case WITH:
        diff.field(
            "transition",
            a.cast(Statement.With.class).transition(),
            b.cast(Statement.With.class).transition());
        break;
      case JUMP:
        {
          Statement.Jump x = a.cast();
          Statement.Jump y = b.cast();
          diff.field("target", x.target(), y.target())
              .field("expression", x.expression(), y.expression());
          break;
        }
      case CALL:
        {
          Statement.Call x = a.cast();
          Statement.Call y = b.cast();
          diff.field("target", x.target(), y.target())
              .field("expression", x.expression(), y.expression())
              .field("arguments", x.arguments(), y.arguments())
              .field("fromLabel", x.fromLabel(), y.fromLabel());
          break;
        }
      case RETURN:
        diff.field(
            "value",
            a.cast(Statement.Return.class).value(),
            b.cast(Statement.Return.class).value());
        break;
      case IF:
        {
          Statement.If x = a.cast();
          Statement.If y = b.cast();
          return diffBranches(path + ".branches", x.branches(), y.branches());
        }
      case SET:
        {
          Statement.Set x = a.cast();
          Statement.Set y = b.cast();
          diff.field("variable", x.variable(), y.variable())
              .field("operator", x.operator(), y.operator())
              .field("value", x.value(), y.value());
          break;
        }
      case PYTHON:
        {
          Statement.Python x = a.cast();
          Statement.Python y = b.cast();
          diff.field("code", normalizeCode(x.code()), normalizeCode(y.code()))
              .field("early", x.early(), y.early())
              .field("hide", x.hide(), y.hide())
              .field("init", x.init(), y.init());
          break;
        }
      case DEFINE:
        {
          Statement.Define x = a.cast();
          Statement.Define y = b.cast();
          diff.field("store", x.store(), y.store())
              .field("name", x.name(), y.name())
              .field("value", x.value(), y.value());
          break;
        }
      case DEFAULT:
        {
          Statement.Default x = a.cast();
          Statement.Default y = b.cast();
          diff.field("name", x.name(), y.name()).field("value", x.value(), y.value());
          break;
        }
      case PLAY:
        {
          Statement.Play x = a.cast();
          Statement.Play y = b.cast();
          PlaybackOptions xo = x.options();
          PlaybackOptions yo = y.options();
          diff.field("channel", x.channel(), y.channel())
              .field("file", x.file(), y.file())
              .number("fadeIn", xo.fadeIn(), yo.fadeIn())
              .number("fadeOut", xo.fadeOut(), yo.fadeOut())
              .number("volume", xo.volume(), yo.volume())
              .field("loop", xo.loop(), yo.loop())
              .field("queue", xo.queue(), yo.queue())
              .field("ifChanged", xo.ifChanged(), yo.ifChanged());
          break;
        }
      case STOP:
        {
          Statement.Stop x = a.cast();
          Statement.Stop y = b.cast();
          diff.field("channel", x.channel(), y.channel())
              .number("fadeOut", x.fadeOut(), y.fadeOut());
          break;
        }
      case PAUSE:
        diff.number(
            "duration",
            a.cast(Statement.Pause.class).duration(),
            b.cast(Statement.Pause.class).duration());
        break;
      case NVL:
        diff.field(
            "action", a.cast(Statement.Nvl.class).action(), b.cast(Statement.Nvl.class).action());
        break;
      case RAW:
        diff.field(
            "content",
            a.cast(Statement.Raw.class).content(),
            b.cast(Statement.Raw.class).content());
        break;
      default:
        throw new AssertionError("Unknown statement kind: " + a.kind());
    }
    return diff.result();
  }

  /**
   * Python code as the scanner can reproduce it: no blank or comment lines, no trailing
   * whitespace, and the common indentation removed.
   */
  @VisibleForTesting
  static String normalizeCode(String code) {
    ImmutableList<String> lines =
        LINES
            .splitToStream(code)
            .map(String::stripTrailing)
            .filter(l -> !l.isEmpty() && !l.trim().startsWith("#"))
            .collect(ImmutableList.toImmutableList());
    int common =
        lines.stream().mapToInt(IndentationScanner::measureIndent).min().orElse(0);
    return lines
        .stream()
        .map(l -> l.substring(Math.min(common, leadingWhitespace(l))))
        .collect(Collectors.joining("\n"));
  }

  private static int leadingWhitespace(String line) {
    int i = 0;
    while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) i++;
    return i;
  }

  static boolean numbersMatch(OptionalDouble a, OptionalDouble b) {
    if (a.isPresent() != b.isPresent()) return false;
    return !a.isPresent() || Math.abs(a.getAsDouble() - b.getAsDouble()) <= NUMBER_TOLERANCE;
  }

  /** Compares fields in order and remembers the first one that differs. */
  private static final class Diff {
    private final String path;
    private Optional<String> difference = Optional.empty();

    private Diff(String path) {
      this.path = path;
    }

    private void check(String name, boolean same) {
      if (!difference.isPresent() && !same) difference = Optional.of(path + "." + name);
    }

    Diff field(String name, Object a, Object b) {
      check(name, Objects.equals(a, b));
      return this;
    }

    Diff number(String name, OptionalDouble a, OptionalDouble b) {
      check(name, numbersMatch(a, b));
      return this;
    }

    Diff statements(String name, List<? extends Statement> a, List<? extends Statement> b) {
      if (!difference.isPresent()) difference = diffStatements(path + "." + name, a, b);
      return this;
    }

    Optional<String> result() {
      return difference;
    }
  }

  private ScriptEquivalence() {}
}
