package rps;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import rps.IndentationScanner.Line;

/**
 * Recursive descent over scanned lines. Never fails: anything it cannot read becomes a {@link
 * Statement.Raw} and problems are reported as {@link Diagnostic}s. A parser runs once.
 */
public class StatementParser {
  private static final Logger LOG = Logger.getLogger(StatementParser.class.getName());

  private static final Pattern LABEL_HEADER =
      Pattern.compile("label\\s+([A-Za-z0-9_.]+)\\s*(?:\\((.*)\\))?");
  private static final Pattern PYTHON_HEADER =
      Pattern.compile("(init\\s+)?python(\\s+early)?(\\s+hide)?\\s*:");
  private static final Pattern SET =
      Pattern.compile(
          "([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)\\s*(\\+=|-=|\\*=|/=|=)\\s*(.+)");
  private static final Pattern ASSIGNMENT = Pattern.compile("([A-Za-z0-9_.]+)\\s*=\\s*(.+)");
  private static final Pattern FROM_CLAUSE =
      Pattern.compile("(.*?)\\s+from\\s+([A-Za-z0-9_.]+)");
  private static final Pattern PASS_CLAUSE = Pattern.compile("(.*?)\\s+pass\\s*\\((.*)\\)");
  private static final Pattern CALL_TARGET =
      Pattern.compile("([A-Za-z0-9_.]+)\\s*(?:\\((.*)\\))?");
  private static final Pattern MENU_SET = Pattern.compile("set\\s+(\\S+)");
  private static final Pattern MENU_SCREEN = Pattern.compile("screen\\s*(?:=\\s*)?(\\S+)");
  private static final Pattern IMAGE_WORD =
      Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_\\-]*|-[A-Za-z0-9_]+");
  private static final Pattern ATTRIBUTE = Pattern.compile("-?[A-Za-z0-9_]+");
  private static final Pattern INTEGER = Pattern.compile("-?\\d+");

  private static final ImmutableSet<String> DISPLAY_CLAUSES =
      ImmutableSet.of("as", "at", "behind", "onlayer", "zorder", "with");
  private static final ImmutableSet<String> RAW_DISPLAY_FORMS =
      ImmutableSet.of("screen", "expression", "layer");

  /** Whether {@code $ code} would read back as an assignment rather than as python. */
  static boolean isSetShaped(String code) {
    Matcher m = SET.matcher(code.trim());
    return m.matches() && !m.group(3).startsWith("=");
  }

  /** A compound statement header with its trailing colon split off. */
  private static final class Header {
    private final String text;
    private final boolean colon;

    private Header(Line line) {
      this.colon = line.endsWithColon();
      this.text =
          colon ? line.text().substring(0, line.text().length() - 1).trim() : line.text();
    }
  }

  private final NodeFactory factory;
  private final String source;
  private final Optional<String> fileIdentifier;

  private ImmutableList<Line> lines = ImmutableList.of();
  private int index = 0;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private boolean parsed = false;

  public StatementParser(NodeFactory factory, String source, Optional<String> fileIdentifier) {
    this.factory = Preconditions.checkNotNull(factory);
    this.source = Preconditions.checkNotNull(source);
    this.fileIdentifier = fileIdentifier;
  }

  public ParseResult parse() {
    Preconditions.checkState(!parsed, "parse() may only be called once");
    parsed = true;

    IndentationScanner.ScanResult scan = new IndentationScanner().scan(source);
    diagnostics.addAll(scan.diagnostics());
    lines = scan.lines();

    ImmutableList<Statement> statements = parseBlock(0);
    Verify.verify(index == lines.size(), "stopped at line %s of %s", index, lines.size());

    return ParseResult.create(
        factory.script(statements, ScriptMetadata.create(fileIdentifier, Instant.now())),
        diagnostics);
  }

  private void report(Line line, String message) {
    diagnostics.add(Diagnostic.create(line.lineNumber(), message));
  }

  private NodeFactory at(Line line) {
    return factory.atLine(line.lineNumber());
  }

  private boolean hasDeeperLine(int indent) {
    return index < lines.size() && lines.get(index).indent() > indent;
  }

  private ImmutableList<Statement> parseBlock(int indent) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    while (index < lines.size()) {
      Line line = lines.get(index);
      if (line.indent() < indent) break;

      if (line.indent() > indent) {
        report(line, "unexpected indentation");
        statements.add(orphanBlock(indent));
      } else if (isPass(line)) {
        index++;
      } else {
        index++;
        Statement statement = parseStatement(line);
        statements.add(statement != null ? statement : fallback(line));
      }
    }
    return statements.build();
  }

  /**
   * Consumes the lines deeper than {@code indent}, each prefixed with its indentation relative
   * to {@code anchor}.
   */
  private List<String> collectDeeper(int indent, int anchor) {
    List<String> collected = new ArrayList<>();
    while (hasDeeperLine(indent)) {
      Line line = lines.get(index++);
      collected.add(Strings.repeat(" ", line.indent() - anchor) + line.rawText());
    }
    return collected;
  }

  private Statement orphanBlock(int indent) {
    Line first = lines.get(index);
    return at(first).raw(String.join("\n", collectDeeper(indent, indent)));
  }

  /** Keeps {@code header} and its nested block verbatim. */
  private Statement rawWithBlock(Line header) {
    List<String> content = new ArrayList<>();
    content.add(header.rawText());
    content.addAll(collectDeeper(header.indent(), header.indent()));
    return at(header).raw(String.join("\n", content));
  }

  private Statement fallback(Line line) {
    LOG.fine(() -> String.format("line %d kept as raw: %s", line.lineNumber(), line.text()));
    return line.endsWithColon() ? rawWithBlock(line) : at(line).raw(line.rawText());
  }

  /**
   * The body of a compound statement: the block right after {@code header} if it is deeper. A
   * body of only {@code pass} lines is empty.
   */
  private ImmutableList<Statement> parseBody(Line header) {
    if (!hasDeeperLine(header.indent())) {
      report(header, "expected an indented block");
      return ImmutableList.of();
    }
    return parseBlock(lines.get(index).indent());
  }

  /** {@code pass} is a no-op wherever it appears, so it never reaches the tree. */
  private static boolean isPass(Line line) {
    return line.text().equals("pass");
  }

  private void checkColon(Line line, Header header) {
    if (!header.colon) report(line, "expected ':' at the end of the line");
  }

  /** Returns the statement on {@code line}, or null if it should be kept as raw source. */
  private Statement parseStatement(Line line) {
    String text = line.text();
    if (text.startsWith("$")) return parseDollar(line);
    if (text.startsWith("\"")) return parseDialogue(line);

    LineCursor cursor = new LineCursor(text);
    String keyword = cursor.readIdentifier().orElse("");
    switch (keyword) {
      case "label":
        return parseLabel(line);
      case "menu":
        return parseMenu(line);
      case "if":
        return parseIf(line);
      case "elif":
      case "else":
        report(line, String.format("'%s' without a matching 'if'", keyword));
        return rawWithBlock(line);
      case "init":
      case "python":
        return parsePython(line);
      case "jump":
        return parseJump(line, cursor);
      case "call":
        return parseCall(line, cursor);
      case "return":
        return cursor.atEnd()
            ? at(line).returnStatement()
            : at(line).returnStatement(cursor.rest());
      case "scene":
      case "show":
      case "hide":
        return parseImage(line, keyword, cursor);
      case "with":
        return cursor.atEnd() ? null : at(line).with(cursor.rest());
      case "play":
      case "queue":
        return parsePlay(line, keyword.equals("queue"), cursor);
      case "voice":
        return parseVoice(line, cursor);
      case "stop":
        return parseStop(line, cursor);
      case "pause":
        return parsePause(line, cursor);
      case "nvl":
        return NvlAction.fromKeyword(cursor.rest()).map(a -> at(line).nvl(a)).orElse(null);
      case "define":
        return parseDefine(line, cursor);
      case "default":
        return parseDefault(line, cursor);
      default:
        return parseDialogue(line);
    }
  }

  private Statement parseLabel(Line line) {
    Header header = new Header(line);
    Matcher m = LABEL_HEADER.matcher(header.text);
    if (!m.matches() || !NodeFactory.isLabelName(m.group(1))) {
      report(line, "malformed label header");
      return rawWithBlock(line);
    }
    checkColon(line, header);

    ImmutableList<String> parameters =
        m.group(2) == null ? ImmutableList.of() : Literals.splitTopLevel(m.group(2));
    return at(line).label(m.group(1), parameters, parseBody(line));
  }

  private Statement parseIf(Line line) {
    Header header = new Header(line);
    String condition = header.text.substring("if".length()).trim();
    if (condition.isEmpty()) {
      report(line, "malformed if header");
      return rawWithBlock(line);
    }
    checkColon(line, header);

    List<Statement.If.Branch> branches = new ArrayList<>();
    branches.add(at(line).branch(condition, parseBody(line)));

    boolean sawElse = false;
    while (index < lines.size() && lines.get(index).indent() == line.indent()) {
      Line next = lines.get(index);
      Header nextHeader = new Header(next);
      LineCursor cursor = new LineCursor(nextHeader.text);
      String keyword = cursor.readIdentifier().orElse("");

      String branchCondition;
      if (keyword.equals("elif") && !cursor.atEnd()) {
        branchCondition = cursor.rest();
      } else if (keyword.equals("else") && cursor.atEnd()) {
        branchCondition = null;
      } else {
        break;
      }

      index++;
      if (sawElse) report(next, "'else' must be the last branch");
      checkColon(next, nextHeader);
      branches.add(at(next).branch(branchCondition, parseBody(next)));
      sawElse |= branchCondition == null;
    }

    return at(line).ifStatement(branches);
  }

  private Statement parseMenu(Line line) {
    Header header = new Header(line);
    LineCursor cursor = new LineCursor(header.text);
    cursor.consumeKeyword("menu");

    MenuOptions.Builder options = MenuOptions.builder();
    if (!cursor.atEnd() && !cursor.lookingAt('(')) {
      String name = cursor.readToken();
      if (!NodeFactory.isLabelName(name)) return malformedMenu(line);
      options.setName(name);
    }
    while (!cursor.atEnd()) {
      Optional<String> group = cursor.readParenthesized().map(String::trim);
      if (!group.isPresent()) return malformedMenu(line);

      Matcher set = MENU_SET.matcher(group.get());
      Matcher screen = MENU_SCREEN.matcher(group.get());
      if (set.matches()
          && NodeFactory.isDottedName(set.group(1))
          && !options.resultVariable().isPresent()) {
        options.setResultVariable(set.group(1));
      } else if (screen.matches() && !options.screen().isPresent()) {
        options.setScreen(screen.group(1));
      } else {
        return malformedMenu(line);
      }
    }
    checkColon(line, header);

    List<Statement.Menu.Choice> choices = new ArrayList<>();
    if (!hasDeeperLine(line.indent())) {
      report(line, "expected an indented block");
    } else {
      parseMenuItems(lines.get(index).indent(), options, choices);
    }

    return at(line).menu(choices, options.build());
  }

  private Statement malformedMenu(Line line) {
    report(line, "malformed menu header");
    return rawWithBlock(line);
  }

  /**
   * Reads result variable, prompt and choices at {@code indent}. Stops at the first line that
   * fits none of them; the enclosing block keeps that line and the rest as raw source.
   */
  private void parseMenuItems(
      int indent, MenuOptions.Builder options, List<Statement.Menu.Choice> choices) {
    boolean sawPrompt = false;
    while (index < lines.size() && lines.get(index).indent() == indent) {
      Line item = lines.get(index);
      if (isPass(item)) {
        index++;
        continue;
      }
      LineCursor cursor = new LineCursor(item.text());

      if (cursor.consumeKeyword("set")) {
        String variable = cursor.rest();
        if (!NodeFactory.isDottedName(variable) || options.resultVariable().isPresent()) {
          report(item, "unexpected line in menu");
          return;
        }
        index++;
        options.setResultVariable(variable);
        continue;
      }

      Optional<String> speaker = Optional.empty();
      if (!cursor.lookingAt('"')) {
        speaker = cursor.readIdentifier().filter(NodeFactory::isSpeakerName);
        if (!speaker.isPresent() || !cursor.lookingAt('"')) {
          report(item, "unexpected line in menu");
          return;
        }
      }

      Optional<String> text = cursor.readString();
      if (!text.isPresent()) {
        report(item, "unterminated string literal");
        return;
      }

      index++;
      String rest = cursor.rest();
      boolean hasBody = hasDeeperLine(item.indent());
      if (rest.isEmpty() && !hasBody) {
        if (sawPrompt) {
          index--;
          report(item, "unexpected line in menu");
          return;
        }
        sawPrompt = true;
        options.setPrompt(MenuOptions.Prompt.create(speaker, text.get()));
        continue;
      }

      if (speaker.isPresent()) {
        index--;
        report(item, "unexpected line in menu");
        return;
      }

      Optional<String> condition = Optional.empty();
      boolean colon = rest.endsWith(":");
      String clause = colon ? rest.substring(0, rest.length() - 1).trim() : rest;
      if (!clause.isEmpty()) {
        LineCursor clauseCursor = new LineCursor(clause);
        if (!clauseCursor.consumeKeyword("if") || clauseCursor.atEnd()) {
          index--;
          report(item, "unexpected line in menu");
          return;
        }
        condition = Optional.of(clauseCursor.rest());
      }
      if (!colon) report(item, "expected ':' at the end of the line");

      choices.add(at(item).choice(text.get(), condition.orElse(null), parseBody(item)));
    }
  }

  private Statement parsePython(Line line) {
    Matcher m = PYTHON_HEADER.matcher(line.text());
    if (!m.matches()) return null;

    int minIndent = Integer.MAX_VALUE;
    for (int i = index; i < lines.size() && lines.get(i).indent() > line.indent(); i++) {
      minIndent = Math.min(minIndent, lines.get(i).indent());
    }
    if (minIndent == Integer.MAX_VALUE) {
      report(line, "expected an indented block");
      return at(line).raw(line.rawText());
    }

    String code = String.join("\n", collectDeeper(line.indent(), minIndent));
    return at(line).python(code, m.group(2) != null, m.group(3) != null, m.group(1) != null);
  }

  private Statement parseDollar(Line line) {
    String code = line.text().substring(1).trim();
    if (code.isEmpty()) return null;

    Matcher m = SET.matcher(code);
    if (isSetShaped(code) && m.matches()) {
      return at(line)
          .set(m.group(1), SetOperator.fromSymbol(m.group(2)).get(), m.group(3));
    }
    return at(line).python(code);
  }

  private Statement parseJump(Line line, LineCursor cursor) {
    if (cursor.consumeKeyword("expression")) {
      return cursor.atEnd() ? null : at(line).jumpExpression(cursor.rest());
    }
    String target = cursor.rest();
    return NodeFactory.isLabelName(target) ? at(line).jump(target) : null;
  }

  private Statement parseCall(Line line, LineCursor cursor) {
    String rest = cursor.rest();
    String fromLabel = null;
    Matcher from = FROM_CLAUSE.matcher(rest);
    if (from.matches()) {
      if (!NodeFactory.isLabelName(from.group(2))) return null;
      rest = from.group(1).trim();
      fromLabel = from.group(2);
    }

    LineCursor target = new LineCursor(rest);
    if (target.consumeKeyword("expression")) {
      String expression = target.rest();
      ImmutableList<String> arguments = ImmutableList.of();
      Matcher pass = PASS_CLAUSE.matcher(expression);
      if (pass.matches()) {
        expression = pass.group(1).trim();
        arguments = Literals.splitTopLevel(pass.group(2));
      }
      return expression.isEmpty()
          ? null
          : at(line).callExpression(expression, arguments, fromLabel);
    }

    Matcher m = CALL_TARGET.matcher(rest);
    if (!m.matches() || !NodeFactory.isLabelName(m.group(1))) return null;
    ImmutableList<String> arguments =
        m.group(2) == null ? ImmutableList.of() : Literals.splitTopLevel(m.group(2));
    return at(line).call(m.group(1), arguments, fromLabel);
  }

  private Statement parseImage(Line line, String keyword, LineCursor cursor) {
    // ATL blocks and the screen, expression and layer forms are kept verbatim.
    if (line.endsWithColon() || RAW_DISPLAY_FORMS.contains(cursor.peekToken())) return null;

    List<String> words = new ArrayList<>();
    while (!cursor.atEnd() && !DISPLAY_CLAUSES.contains(cursor.peekToken())) {
      String word = cursor.readToken();
      if (!IMAGE_WORD.matcher(word).matches()) return null;
      words.add(word);
    }
    if (words.isEmpty() || words.get(0).startsWith("-")) return null;

    DisplayOptions.Builder options =
        DisplayOptions.builder().setAttributes(words.subList(1, words.size()));
    Set<String> seen = new HashSet<>();
    while (!cursor.atEnd()) {
      String clause = cursor.readToken();
      if (!seen.add(clause)) {
        report(line, String.format("duplicate '%s' clause", clause));
        return null;
      }

      List<String> tokens = new ArrayList<>();
      while (!cursor.atEnd() && !DISPLAY_CLAUSES.contains(cursor.peekToken())) {
        tokens.add(cursor.readToken());
      }
      if (tokens.isEmpty()) return null;
      String value = String.join(" ", tokens);

      switch (clause) {
        case "as":
          if (tokens.size() != 1) return null;
          options.setAsTag(value);
          break;
        case "at":
          options.setPosition(value);
          break;
        case "behind":
          if (tokens.size() != 1) return null;
          options.setBehindTag(value);
          break;
        case "onlayer":
          if (tokens.size() != 1) return null;
          options.setLayer(value);
          break;
        case "zorder":
          if (!INTEGER.matcher(value).matches()) return null;
          options.setZorder(Integer.parseInt(value));
          break;
        case "with":
          options.setTransition(value);
          break;
        default:
          throw new AssertionError("Unknown clause: " + clause);
      }
    }

    NodeFactory nodes = at(line);
    switch (keyword) {
      case "scene":
        return nodes.scene(words.get(0), options.build());
      case "show":
        return nodes.show(words.get(0), options.build());
      case "hide":
        return nodes.hide(words.get(0), options.build());
      default:
        throw new AssertionError("Not an image statement: " + keyword);
    }
  }

  private Statement parsePlay(Line line, boolean queue, LineCursor cursor) {
    Optional<AudioChannel> channel = cursor.readIdentifier().flatMap(AudioChannel::fromKeyword);
    if (!channel.isPresent()) return null;
    Optional<String> file = cursor.readString();
    if (!file.isPresent()) return null;

    PlaybackOptions.Builder options = PlaybackOptions.builder().setQueue(queue);
    Set<String> seen = new HashSet<>();
    while (!cursor.atEnd()) {
      String option = cursor.readToken();
      // 'loop' and 'noloop' set the same property.
      if (!seen.add(option.equals("noloop") ? "loop" : option)) return null;

      switch (option) {
        case "fadein":
        case "fadeout":
        case "volume":
          OptionalDouble number = Literals.parseNumber(cursor.readToken());
          if (!number.isPresent()) return null;
          if (option.equals("fadein")) {
            options.setFadeIn(number);
          } else if (option.equals("fadeout")) {
            options.setFadeOut(number);
          } else {
            options.setVolume(number);
          }
          break;
        case "loop":
          options.setLoop(true);
          break;
        case "noloop":
          options.setLoop(false);
          break;
        case "if_changed":
          options.setIfChanged(true);
          break;
        default:
          return null;
      }
    }

    return at(line).play(channel.get(), file.get(), options.build());
  }

  private Statement parseVoice(Line line, LineCursor cursor) {
    Optional<String> file = cursor.readString();
    if (!file.isPresent() || !cursor.atEnd()) return null;
    return at(line).voice(file.get());
  }

  private Statement parseStop(Line line, LineCursor cursor) {
    Optional<AudioChannel> channel = cursor.readIdentifier().flatMap(AudioChannel::fromKeyword);
    if (!channel.isPresent()) return null;
    if (cursor.atEnd()) return at(line).stop(channel.get());

    if (!cursor.consumeKeyword("fadeout")) return null;
    OptionalDouble fadeOut = Literals.parseNumber(cursor.readToken());
    if (!fadeOut.isPresent() || !cursor.atEnd()) return null;
    return at(line).stop(channel.get(), fadeOut);
  }

  private Statement parsePause(Line line, LineCursor cursor) {
    if (cursor.atEnd()) return at(line).pause();
    OptionalDouble duration = Literals.parseNumber(cursor.rest());
    return duration.isPresent() ? at(line).pause(duration) : null;
  }

  private Statement parseDefine(Line line, LineCursor cursor) {
    Matcher m = ASSIGNMENT.matcher(cursor.rest());
    if (!m.matches() || !NodeFactory.isDottedName(m.group(1)) || m.group(2).startsWith("=")) {
      return null;
    }
    return at(line).define(m.group(1), m.group(2));
  }

  private Statement parseDefault(Line line, LineCursor cursor) {
    Matcher m = ASSIGNMENT.matcher(cursor.rest());
    if (!m.matches() || !NodeFactory.isDottedName(m.group(1)) || m.group(2).startsWith("=")) {
      return null;
    }
    return at(line).defaultStatement(m.group(1), m.group(2));
  }

  private Statement parseDialogue(Line line) {
    LineCursor cursor = new LineCursor(line.text());
    Optional<String> speaker = Optional.empty();
    boolean extend = false;
    List<String> attributes = new ArrayList<>();

    if (!cursor.lookingAt('"')) {
      Optional<String> word = cursor.readIdentifier();
      if (!word.isPresent()) return null;
      if (word.get().equals("extend")) {
        extend = true;
      } else if (NodeFactory.isSpeakerName(word.get())) {
        speaker = word;
      } else {
        return null;
      }

      while (!cursor.atEnd() && !cursor.lookingAt('"')) {
        String attribute = cursor.readToken();
        if (extend || !ATTRIBUTE.matcher(attribute).matches()) return null;
        attributes.add(attribute);
      }
      if (!cursor.lookingAt('"')) return null;
    }

    Optional<String> text = cursor.readString();
    if (!text.isPresent()) {
      report(line, "unterminated string literal");
      return null;
    }

    DialogueOptions.Builder options =
        DialogueOptions.builder().setAttributes(attributes).setExtend(extend);
    if (!cursor.atEnd()) {
      if (!cursor.consumeKeyword("with") || cursor.atEnd()) return null;
      options.setTransition(cursor.rest());
    }

    return at(line).dialogue(speaker.orElse(null), text.get(), options.build());
  }
}
