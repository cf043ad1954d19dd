package rps;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Writes statements back to script source. Output is deterministic and reads back, through
 * {@link StatementParser}, into an equivalent tree.
 */
public class CodeGenerator {
  private static final Joiner COMMA = Joiner.on(", ");
  private static final Splitter LINES = Splitter.on('\n');

  private final GeneratorOptions options;

  public CodeGenerator() {
    this(GeneratorOptions.defaults());
  }

  public CodeGenerator(GeneratorOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public String generate(Script script) {
    return generate(script.statements());
  }

  public String generate(List<? extends Statement> statements) {
    List<String> out = new ArrayList<>();
    for (int i = 0; i < statements.size(); i++) {
      Statement statement = statements.get(i);
      emit(statement, 0, out);
      if (options.blankLinesBetweenTopLevel()
          && i + 1 < statements.size()
          && needsBlankLine(statement, statements.get(i + 1))) {
        out.add("");
      }
    }
    return out.isEmpty() ? "" : String.join("\n", out) + "\n";
  }

  /** Writes a single statement as if nested {@code depth} levels deep. */
  public String generate(Statement statement, int depth) {
    Preconditions.checkArgument(depth >= 0, "negative depth: %s", depth);
    List<String> out = new ArrayList<>();
    emit(statement, depth, out);
    return String.join("\n", out) + "\n";
  }

  private static boolean isDefinition(Statement statement) {
    return statement.kind() == Statement.Kind.DEFINE || statement.kind() == Statement.Kind.DEFAULT;
  }

  private static boolean isMultiLineRaw(Statement statement) {
    return statement.kind() == Statement.Kind.RAW
        && statement.cast(Statement.Raw.class).isMultiLine();
  }

  private static boolean needsBlankLine(Statement current, Statement next) {
    if (current.kind() == Statement.Kind.LABEL || next.kind() == Statement.Kind.LABEL) {
      return true;
    }
    if (isDefinition(current) && !isDefinition(next)) return true;
    return isMultiLineRaw(current) || isMultiLineRaw(next);
  }

  private String indent(int depth) {
    return Strings.repeat(" ", depth * options.indentWidth());
  }

  private void line(int depth, String text, List<String> out) {
    out.add(indent(depth) + text);
  }

  private void emitBody(List<? extends Statement> body, int depth, List<String> out) {
    if (body.isEmpty()) {
      line(depth, "pass", out);
      return;
    }
    for (Statement statement : body) {
      emit(statement, depth, out);
    }
  }

  private void emit(Statement statement, int depth, List<String> out) {
    switch (statement.kind()) {
      case LABEL:
        emitLabel(statement.cast(), depth, out);
        break;
      case DIALOGUE:
        line(depth, dialogue(statement.cast()), out);
        break;
      case MENU:
        emitMenu(statement.cast(), depth, out);
        break;
      case SCENE:
        line(depth, image("scene", statement.cast()), out);
        break;
      case SHOW:
        line(depth, image("show", statement.cast()), out);
        break;
      case HIDE:
        line(depth, image("hide", statement.cast()), out);
        break;
      case WITH:
        line(depth, "with " + statement.cast(Statement.With.class).transition(), out);
        break;
      case JUMP:
        line(depth, jump(statement.cast()), out);
        break;
      case CALL:
        line(depth, call(statement.cast()), out);
        break;
      case RETURN:
        line(depth, returnStatement(statement.cast()), out);
        break;
      case IF:
        emitIf(statement.cast(), depth, out);
        break;
      case SET:
        line(depth, set(statement.cast()), out);
        break;
      case PYTHON:
        emitPython(statement.cast(), depth, out);
        break;
      case DEFINE:
        Statement.Define define = statement.cast();
        line(depth, String.format("define %s = %s", define.qualifiedName(), define.value()), out);
        break;
      case DEFAULT:
        Statement.Default defaultStatement = statement.cast();
        line(
            depth,
            String.format("default %s = %s", defaultStatement.name(), defaultStatement.value()),
            out);
        break;
      case PLAY:
        line(depth, play(statement.cast()), out);
        break;
      case STOP:
        line(depth, stop(statement.cast()), out);
        break;
      case PAUSE:
        line(depth, pause(statement.cast()), out);
        break;
      case NVL:
        line(depth, "nvl " + statement.cast(Statement.Nvl.class).action().keyword(), out);
        break;
      case RAW:
        for (String rawLine : LINES.split(statement.cast(Statement.Raw.class).content())) {
          line(depth, rawLine, out);
        }
        break;
      default:
        throw new AssertionError("Unknown statement kind: " + statement.kind());
    }
  }

  private void emitLabel(Statement.Label label, int depth, List<String> out) {
    StringBuilder header = new StringBuilder("label ").append(label.name());
    if (!label.parameters().isEmpty()) {
      header.append('(').append(COMMA.join(label.parameters())).append(')');
    }
    line(depth, header.append(':').toString(), out);
    emitBody(label.body(), depth + 1, out);
  }

  private static String dialogue(Statement.Dialogue dialogue) {
    List<String> parts = new ArrayList<>();
    if (dialogue.options().extend()) parts.add("extend");
    dialogue.speaker().ifPresent(parts::add);
    parts.addAll(dialogue.options().attributes());
    parts.add(Literals.quote(dialogue.text()));
    dialogue.options().transition().ifPresent(t -> parts.add("with " + t));
    return String.join(" ", parts);
  }

  private void emitMenu(Statement.Menu menu, int depth, List<String> out) {
    MenuOptions opts = menu.options();
    StringBuilder header = new StringBuilder("menu");
    opts.name().ifPresent(n -> header.append(' ').append(n));
    opts.screen().ifPresent(s -> header.append(" (screen=").append(s).append(')'));
    line(depth, header.append(':').toString(), out);

    if (!opts.resultVariable().isPresent()
        && !opts.prompt().isPresent()
        && menu.choices().isEmpty()) {
      line(depth + 1, "pass", out);
      return;
    }

    opts.resultVariable().ifPresent(v -> line(depth + 1, "set " + v, out));
    opts.prompt()
        .ifPresent(
            p ->
                line(
                    depth + 1,
                    p.speaker().map(s -> s + " ").orElse("") + Literals.quote(p.text()),
                    out));
    for (Statement.Menu.Choice choice : menu.choices()) {
      String condition = choice.condition().map(c -> " if " + c).orElse("");
      line(depth + 1, Literals.quote(choice.text()) + condition + ":", out);
      emitBody(choice.body(), depth + 2, out);
    }
  }

  private static String image(String keyword, Statement.ImageStatement image) {
    DisplayOptions opts = image.options();
    List<String> parts = new ArrayList<>();
    parts.add(keyword);
    parts.add(image.image());
    parts.addAll(opts.attributes());
    opts.asTag().ifPresent(t -> parts.add("as " + t));
    opts.position().ifPresent(p -> parts.add("at " + p));
    opts.behindTag().ifPresent(t -> parts.add("behind " + t));
    opts.layer().ifPresent(l -> parts.add("onlayer " + l));
    opts.zorder().ifPresent(z -> parts.add("zorder " + z));
    opts.transition().ifPresent(t -> parts.add("with " + t));
    return String.join(" ", parts);
  }

  private static String jump(Statement.Jump jump) {
    return (jump.expression() ? "jump expression " : "jump ") + jump.target();
  }

  private static String call(Statement.Call call) {
    StringBuilder sb = new StringBuilder("call ");
    if (call.expression()) {
      sb.append("expression ").append(call.target());
      if (!call.arguments().isEmpty()) {
        sb.append(" pass (").append(COMMA.join(call.arguments())).append(')');
      }
    } else {
      sb.append(call.target());
      if (!call.arguments().isEmpty()) {
        sb.append('(').append(COMMA.join(call.arguments())).append(')');
      }
    }
    call.fromLabel().ifPresent(l -> sb.append(" from ").append(l));
    return sb.toString();
  }

  private static String returnStatement(Statement.Return returnStatement) {
    return returnStatement.value().map(v -> "return " + v).orElse("return");
  }

  private void emitIf(Statement.If ifStatement, int depth, List<String> out) {
    ImmutableList<Statement.If.Branch> branches = ifStatement.branches();
    for (int i = 0; i < branches.size(); i++) {
      Statement.If.Branch branch = branches.get(i);
      String header;
      if (i == 0) {
        header = "if " + branch.condition().get() + ":";
      } else if (branch.isElse()) {
        header = "else:";
      } else {
        header = "elif " + branch.condition().get() + ":";
      }
      line(depth, header, out);
      emitBody(branch.body(), depth + 1, out);
    }
  }

  private static String set(Statement.Set set) {
    return String.format("$ %s %s %s", set.variable(), set.operator().symbol(), set.value());
  }

  private void emitPython(Statement.Python python, int depth, List<String> out) {
    String code = python.code();
    boolean singleLine = code.indexOf('\n') < 0;
    if (singleLine && !python.hasFlags() && !StatementParser.isSetShaped(code)) {
      line(depth, "$ " + code.trim(), out);
      return;
    }

    StringBuilder header = new StringBuilder();
    if (python.init()) header.append("init ");
    header.append("python");
    if (python.early()) header.append(" early");
    if (python.hide()) header.append(" hide");
    line(depth, header.append(':').toString(), out);
    for (String codeLine : LINES.split(code)) {
      if (codeLine.trim().isEmpty()) {
        out.add("");
      } else {
        line(depth + 1, codeLine, out);
      }
    }
  }

  private static String play(Statement.Play play) {
    PlaybackOptions opts = play.options();
    if (play.channel() == AudioChannel.VOICE && opts.isEmpty()) {
      return "voice " + Literals.quote(play.file());
    }

    List<String> parts = new ArrayList<>();
    parts.add(opts.queue() ? "queue" : "play");
    parts.add(play.channel().keyword());
    parts.add(Literals.quote(play.file()));
    opts.fadeIn().ifPresent(f -> parts.add("fadein " + Literals.formatNumber(f)));
    opts.fadeOut().ifPresent(f -> parts.add("fadeout " + Literals.formatNumber(f)));
    opts.volume().ifPresent(v -> parts.add("volume " + Literals.formatNumber(v)));
    opts.loop().ifPresent(l -> parts.add(l ? "loop" : "noloop"));
    if (opts.ifChanged()) parts.add("if_changed");
    return String.join(" ", parts);
  }

  private static String pause(Statement.Pause pause) {
    if (!pause.duration().isPresent()) return "pause";
    return "pause " + Literals.formatNumber(pause.duration().getAsDouble());
  }

  private static String stop(Statement.Stop stop) {
    StringBuilder sb = new StringBuilder("stop ").append(stop.channel().keyword());
    stop.fadeOut().ifPresent(f -> sb.append(" fadeout ").append(Literals.formatNumber(f)));
    return sb.toString();
  }
}
