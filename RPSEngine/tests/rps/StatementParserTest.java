package rps;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class StatementParserTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ParseResult parse() {
    return new StatementParser(
            new NodeFactory(new NodeIdGenerator()), file.toString(), Optional.of("test.rpy"))
        .parse();
  }

  /** Parses a file that must produce no diagnostics. */
  private ImmutableList<Statement> parseClean() {
    ParseResult result = parse();
    assertThat(result.diagnostics()).isEmpty();
    return result.script().statements();
  }

  private Statement parseSingle() {
    ImmutableList<Statement> statements = parseClean();
    assertThat(statements).hasSize(1);
    return statements.get(0);
  }

  @Test
  public void emptyFile() {
    ParseResult result = parse();

    assertThat(result.script().isEmpty()).isTrue();
    assertThat(result.hasDiagnostics()).isFalse();
    assertThat(result.script().metadata().fileIdentifier()).hasValue("test.rpy");
  }

  @Test
  public void labelWithDialogueAndReturn() {
    println("label start:");
    println("    e \"Hello!\"");
    println("    return");

    Statement.Label label = parseSingle().cast(Statement.Label.class);

    assertThat(label.name()).isEqualTo("start");
    assertThat(label.parameters()).isEmpty();
    assertThat(label.line()).hasValue(1);
    assertThat(label.body()).hasSize(2);

    Statement.Dialogue dialogue = label.body().get(0).cast(Statement.Dialogue.class);
    assertThat(dialogue.speaker()).hasValue("e");
    assertThat(dialogue.text()).isEqualTo("Hello!");
    assertThat(dialogue.line()).hasValue(2);
    assertThat(label.body().get(1).kind()).isEqualTo(Statement.Kind.RETURN);
  }

  @Test
  public void labelParameters() {
    println("label greet(name, times=2):");
    println("    \"Hi\"");

    Statement.Label label = parseSingle().cast(Statement.Label.class);

    assertThat(label.parameters()).containsExactly("name", "times=2").inOrder();
  }

  @Test
  public void localLabel() {
    println("label .inner:");
    println("    pass");

    Statement.Label label = parseSingle().cast(Statement.Label.class);

    assertThat(label.name()).isEqualTo(".inner");
    assertThat(label.body()).isEmpty();
  }

  @Test
  public void dialogueForms() {
    println("\"Just narration.\"");
    println("e happy \"Hi \\\"there\\\"\" with dissolve");
    println("extend \" And more.\"");

    ImmutableList<Statement> statements = parseClean();

    Statement.Dialogue narration = statements.get(0).cast();
    assertThat(narration.speaker()).isEmpty();
    assertThat(narration.text()).isEqualTo("Just narration.");

    Statement.Dialogue said = statements.get(1).cast();
    assertThat(said.speaker()).hasValue("e");
    assertThat(said.text()).isEqualTo("Hi \"there\"");
    assertThat(said.options().attributes()).containsExactly("happy");
    assertThat(said.options().transition()).hasValue("dissolve");

    Statement.Dialogue extend = statements.get(2).cast();
    assertThat(extend.options().extend()).isTrue();
    assertThat(extend.speaker()).isEmpty();
    assertThat(extend.text()).isEqualTo(" And more.");
  }

  @Test
  public void menuWithPromptAndChoices() {
    println("menu choose (set picked):");
    println("    \"Which way?\"");
    println("    \"Left\":");
    println("        jump left");
    println("    \"Right\" if brave:");
    println("        jump right");

    Statement.Menu menu = parseSingle().cast(Statement.Menu.class);

    assertThat(menu.options().name()).hasValue("choose");
    assertThat(menu.options().resultVariable()).hasValue("picked");
    assertThat(menu.options().prompt()).hasValue(MenuOptions.Prompt.narrated("Which way?"));
    assertThat(menu.choices()).hasSize(2);

    Statement.Menu.Choice left = menu.choices().get(0);
    assertThat(left.text()).isEqualTo("Left");
    assertThat(left.condition()).isEmpty();
    assertThat(left.body().get(0).cast(Statement.Jump.class).target()).isEqualTo("left");

    Statement.Menu.Choice right = menu.choices().get(1);
    assertThat(right.condition()).hasValue("brave");
    assertThat(right.line()).hasValue(5);
  }

  @Test
  public void menuPromptWithSpeakerAndSetLine() {
    println("menu:");
    println("    set answers");
    println("    e \"Pick one.\"");
    println("    \"Yes\":");
    println("        pass");

    Statement.Menu menu = parseSingle().cast(Statement.Menu.class);

    assertThat(menu.options().resultVariable()).hasValue("answers");
    assertThat(menu.options().prompt()).hasValue(MenuOptions.Prompt.said("e", "Pick one."));
    assertThat(menu.choices()).hasSize(1);
    assertThat(menu.choices().get(0).body()).isEmpty();
  }

  @Test
  public void ifElifElse() {
    println("if points > 3:");
    println("    \"good\"");
    println("elif points > 1:");
    println("    \"ok\"");
    println("else:");
    println("    \"bad\"");

    Statement.If ifStatement = parseSingle().cast(Statement.If.class);

    assertThat(ifStatement.branches()).hasSize(3);
    assertThat(ifStatement.branches().get(0).condition()).hasValue("points > 3");
    assertThat(ifStatement.branches().get(1).condition()).hasValue("points > 1");
    assertThat(ifStatement.branches().get(2).isElse()).isTrue();
    assertThat(ifStatement.branches().get(2).body().get(0).cast(Statement.Dialogue.class).text())
        .isEqualTo("bad");
  }

  @Test
  public void dollarLines() {
    println("$ points += 1");
    println("$ name = \"Eileen\"");
    println("$ renpy.pause(1)");
    println("$ x == 1");

    ImmutableList<Statement> statements = parseClean();

    Statement.Set add = statements.get(0).cast();
    assertThat(add.variable()).isEqualTo("points");
    assertThat(add.operator()).isEqualTo(SetOperator.ADD);
    assertThat(add.value()).isEqualTo("1");

    Statement.Set assign = statements.get(1).cast();
    assertThat(assign.operator()).isEqualTo(SetOperator.ASSIGN);
    assertThat(assign.value()).isEqualTo("\"Eileen\"");

    assertThat(statements.get(2).cast(Statement.Python.class).code()).isEqualTo("renpy.pause(1)");
    assertThat(statements.get(3).cast(Statement.Python.class).code()).isEqualTo("x == 1");
  }

  @Test
  public void pythonBlock() {
    println("init python early:");
    println("    def f():");
    println("        return 1");
    println("label start:");
    println("    return");

    ImmutableList<Statement> statements = parseClean();

    Statement.Python python = statements.get(0).cast();
    assertThat(python.code()).isEqualTo("def f():\n    return 1");
    assertThat(python.init()).isTrue();
    assertThat(python.early()).isTrue();
    assertThat(python.hide()).isFalse();
    assertThat(statements.get(1).kind()).isEqualTo(Statement.Kind.LABEL);
  }

  @Test
  public void imageStatements() {
    println("scene bg room");
    println("show eileen happy at left with dissolve");
    println("show eileen as e2 behind eileen onlayer overlay zorder 2");
    println("hide eileen");

    ImmutableList<Statement> statements = parseClean();

    Statement.Scene scene = statements.get(0).cast();
    assertThat(scene.image()).isEqualTo("bg");
    assertThat(scene.options().attributes()).containsExactly("room");

    Statement.Show show = statements.get(1).cast();
    assertThat(show.image()).isEqualTo("eileen");
    assertThat(show.options().attributes()).containsExactly("happy");
    assertThat(show.options().position()).hasValue("left");
    assertThat(show.options().transition()).hasValue("dissolve");

    DisplayOptions options = statements.get(2).cast(Statement.Show.class).options();
    assertThat(options.asTag()).hasValue("e2");
    assertThat(options.behindTag()).hasValue("eileen");
    assertThat(options.layer()).hasValue("overlay");
    assertThat(options.zorder()).hasValue(2);

    assertThat(statements.get(3).kind()).isEqualTo(Statement.Kind.HIDE);
  }

  @Test
  public void screenFormKeptRaw() {
    println("show screen inventory");

    Statement raw = parseSingle();

    assertThat(raw.kind()).isEqualTo(Statement.Kind.RAW);
    assertThat(raw.cast(Statement.Raw.class).content()).isEqualTo("show screen inventory");
  }

  @Test
  public void flowStatements() {
    println("with dissolve");
    println("jump ending");
    println("jump expression target_var");
    println("call greet(\"Bob\", 2) from after_greet");
    println("call expression route pass (1, 2)");
    println("return result");

    ImmutableList<Statement> statements = parseClean();

    assertThat(statements.get(0).cast(Statement.With.class).transition()).isEqualTo("dissolve");

    Statement.Jump jump = statements.get(1).cast();
    assertThat(jump.target()).isEqualTo("ending");
    assertThat(jump.expression()).isFalse();
    assertThat(statements.get(2).cast(Statement.Jump.class).expression()).isTrue();

    Statement.Call call = statements.get(3).cast();
    assertThat(call.target()).isEqualTo("greet");
    assertThat(call.arguments()).containsExactly("\"Bob\"", "2").inOrder();
    assertThat(call.fromLabel()).hasValue("after_greet");

    Statement.Call callExpression = statements.get(4).cast();
    assertThat(callExpression.expression()).isTrue();
    assertThat(callExpression.target()).isEqualTo("route");
    assertThat(callExpression.arguments()).containsExactly("1", "2").inOrder();

    assertThat(statements.get(5).cast(Statement.Return.class).value()).hasValue("result");
  }

  @Test
  public void definitions() {
    println("define e = Character(\"Eileen\", color=\"#c8ffc8\")");
    println("define config.rollback_enabled = False");
    println("default points = 0");

    ImmutableList<Statement> statements = parseClean();

    Statement.Define define = statements.get(0).cast();
    assertThat(define.store()).isEmpty();
    assertThat(define.name()).isEqualTo("e");
    assertThat(define.value()).isEqualTo("Character(\"Eileen\", color=\"#c8ffc8\")");

    Statement.Define stored = statements.get(1).cast();
    assertThat(stored.store()).hasValue("config");
    assertThat(stored.name()).isEqualTo("rollback_enabled");
    assertThat(stored.qualifiedName()).isEqualTo("config.rollback_enabled");

    Statement.Default defaultStatement = statements.get(2).cast();
    assertThat(defaultStatement.name()).isEqualTo("points");
    assertThat(defaultStatement.value()).isEqualTo("0");
  }

  @Test
  public void audioStatements() {
    println("play music \"theme.ogg\" fadein 1.5 loop");
    println("queue sound \"click.ogg\" noloop");
    println("voice \"line01.ogg\"");
    println("stop music fadeout 2.0");
    println("stop sound");

    ImmutableList<Statement> statements = parseClean();

    Statement.Play music = statements.get(0).cast();
    assertThat(music.channel()).isEqualTo(AudioChannel.MUSIC);
    assertThat(music.file()).isEqualTo("theme.ogg");
    assertThat(music.options().fadeIn()).hasValue(1.5);
    assertThat(music.options().loop()).hasValue(true);
    assertThat(music.options().queue()).isFalse();

    Statement.Play queued = statements.get(1).cast();
    assertThat(queued.options().queue()).isTrue();
    assertThat(queued.options().loop()).hasValue(false);

    Statement.Play voice = statements.get(2).cast();
    assertThat(voice.channel()).isEqualTo(AudioChannel.VOICE);
    assertThat(voice.options().isEmpty()).isTrue();

    assertThat(statements.get(3).cast(Statement.Stop.class).fadeOut()).hasValue(2.0);
    assertThat(statements.get(4).cast(Statement.Stop.class).fadeOut()).isEmpty();
  }

  @Test
  public void pauseAndNvl() {
    println("pause");
    println("pause 0.5");
    println("nvl clear");

    ImmutableList<Statement> statements = parseClean();

    assertThat(statements.get(0).cast(Statement.Pause.class).duration()).isEmpty();
    assertThat(statements.get(1).cast(Statement.Pause.class).duration()).hasValue(0.5);
    assertThat(statements.get(2).cast(Statement.Nvl.class).action()).isEqualTo(NvlAction.CLEAR);
  }

  @Test
  public void unknownSyntaxKeptRaw() {
    println("scene_transition_custom extra weird syntax");

    Statement raw = parseSingle();

    assertThat(raw.kind()).isEqualTo(Statement.Kind.RAW);
    assertThat(raw.cast(Statement.Raw.class).content())
        .isEqualTo("scene_transition_custom extra weird syntax");
  }

  @Test
  public void unknownBlockKeptRawWithBody() {
    println("screen hello():");
    println("    text \"Hi\"");
    println("\"after\"");

    ImmutableList<Statement> statements = parseClean();

    assertThat(statements).hasSize(2);
    Statement.Raw raw = statements.get(0).cast();
    assertThat(raw.content()).isEqualTo("screen hello():\n    text \"Hi\"");
    assertThat(raw.isMultiLine()).isTrue();
    assertThat(statements.get(1).kind()).isEqualTo(Statement.Kind.DIALOGUE);
  }

  @Test
  public void unknownLineKeepsTrailingWhitespace() {
    println("scene_transition_custom extra weird syntax   ");

    Statement.Raw raw = parseSingle().cast();

    assertThat(raw.content()).isEqualTo("scene_transition_custom extra weird syntax   ");
    assertThat(new ScriptEngine().generate(parse().script())).isEqualTo(file.toString());
  }

  @Test
  public void passLinesDroppedAnywhereInBody() {
    println("label a:");
    println("    pass");
    println("    e \"x\"");
    println("    pass");
    println("    menu:");
    println("        pass");
    println("        \"Go\":");
    println("            pass");

    Statement.Label label = parseSingle().cast();

    assertThat(label.body()).hasSize(2);
    assertThat(label.body().get(0).kind()).isEqualTo(Statement.Kind.DIALOGUE);
    Statement.Menu menu = label.body().get(1).cast();
    assertThat(menu.choices()).hasSize(1);
    assertThat(menu.choices().get(0).body()).isEmpty();
  }

  @Test
  public void missingColon() {
    println("label start");
    println("    return");

    ParseResult result = parse();

    assertThat(result.diagnostics())
        .containsExactly(Diagnostic.create(1, "expected ':' at the end of the line"));
    Statement.Label label = result.script().statements().get(0).cast();
    assertThat(label.body()).hasSize(1);
  }

  @Test
  public void missingBody() {
    println("label empty:");
    println("return");

    ParseResult result = parse();

    assertThat(result.diagnostics())
        .containsExactly(Diagnostic.create(1, "expected an indented block"));
    assertThat(result.script().statements()).hasSize(2);
    assertThat(result.script().statements().get(0).cast(Statement.Label.class).body()).isEmpty();
  }

  @Test
  public void unexpectedIndentation() {
    println("\"a\"");
    println("    \"b\"");

    ParseResult result = parse();

    assertThat(result.diagnostics())
        .containsExactly(Diagnostic.create(2, "unexpected indentation"));
    ImmutableList<Statement> statements = result.script().statements();
    assertThat(statements).hasSize(2);
    assertThat(statements.get(1).cast(Statement.Raw.class).content()).isEqualTo("    \"b\"");
  }

  @Test
  public void unterminatedString() {
    println("e \"Hello");

    ParseResult result = parse();

    assertThat(result.diagnostics())
        .containsExactly(Diagnostic.create(1, "unterminated string literal"));
    assertThat(result.script().statements().get(0).kind()).isEqualTo(Statement.Kind.RAW);
  }

  @Test
  public void elseWithoutIf() {
    println("else:");
    println("    \"x\"");

    ParseResult result = parse();

    assertThat(result.diagnostics())
        .containsExactly(Diagnostic.create(1, "'else' without a matching 'if'"));
    assertThat(result.script().statements().get(0).cast(Statement.Raw.class).content())
        .isEqualTo("else:\n    \"x\"");
  }

  @Test
  public void elseMustBeLast() {
    println("if a:");
    println("    \"1\"");
    println("else:");
    println("    \"2\"");
    println("else:");
    println("    \"3\"");

    ParseResult result = parse();

    assertThat(result.diagnostics())
        .containsExactly(Diagnostic.create(5, "'else' must be the last branch"));
  }

  @Test
  public void unexpectedLineInMenu() {
    println("menu:");
    println("    \"Go\":");
    println("        pass");
    println("    jump elsewhere");

    ParseResult result = parse();

    // The line the menu rejects is then deeper than the block around the menu.
    assertThat(result.diagnostics())
        .containsExactly(
            Diagnostic.create(4, "unexpected line in menu"),
            Diagnostic.create(4, "unexpected indentation"));
    ImmutableList<Statement> statements = result.script().statements();
    assertThat(statements.get(0).cast(Statement.Menu.class).choices()).hasSize(1);
  }

  @Test
  public void malformedMenuHeader() {
    println("menu (bogus):");
    println("    \"Go\":");
    println("        pass");

    ParseResult result = parse();

    assertThat(result.diagnostics()).containsExactly(Diagnostic.create(1, "malformed menu header"));
    assertThat(result.script().statements().get(0).kind()).isEqualTo(Statement.Kind.RAW);
  }

  @Test
  public void diagnosticsSortedByLine() {
    println("label a");
    println("    \"x\"");
    println("e \"open");

    ParseResult result = parse();

    assertThat(
            result
                .diagnostics()
                .stream()
                .map(Diagnostic::line)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly(1, 3)
        .inOrder();
  }

  @Test
  public void parsesOnlyOnce() {
    StatementParser parser =
        new StatementParser(new NodeFactory(new NodeIdGenerator()), "", Optional.empty());
    parser.parse();

    assertThrows(IllegalStateException.class, parser::parse);
  }

  @Test
  public void idsAreUnique() {
    println("label start:");
    println("    \"a\"");
    println("    \"b\"");

    ImmutableList<Statement> all = NodeLocator.allStatements(parse().script());

    assertThat(all.stream().map(Statement::id).distinct().count()).isEqualTo(3);
  }
}
