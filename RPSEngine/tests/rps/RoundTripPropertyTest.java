package rps;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import com.google.common.collect.ImmutableList;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/** Factory-built trees of every statement kind survive generation and re-parsing. */
public class RoundTripPropertyTest {

  private final ScriptEngine engine = new ScriptEngine();
  private final NodeFactory nodes = engine.factory();

  @Property(tries = 200)
  public void generatedTreesRoundTrip(@ForAll("scripts") Script script) {
    ParseResult reparsed = engine.parse(engine.generate(script));

    assertThat(reparsed.diagnostics()).isEmpty();
    assertThat(ScriptEquivalence.firstDifference(script, reparsed.script())).isEmpty();
    assertThat(engine.roundTrips(script)).isTrue();
  }

  @Property(tries = 200)
  public void generationIsIdempotent(@ForAll("scripts") Script script) {
    String once = engine.generate(script);

    assertThat(engine.generate(engine.parse(once).script())).isEqualTo(once);
  }

  @Provide
  Arbitrary<Script> scripts() {
    return statements(3).map(statements -> nodes.script(statements));
  }

  private Arbitrary<List<Statement>> statements(int depth) {
    return statement(depth).list().ofMaxSize(4);
  }

  private Arbitrary<Statement> statement(int depth) {
    ImmutableList.Builder<Arbitrary<? extends Statement>> choices = ImmutableList.builder();
    choices.add(
        said(),
        narration(),
        extend(),
        image(),
        with(),
        jump(),
        call(),
        returnStatement(),
        set(),
        python(),
        define(),
        defaultStatement(),
        play(),
        stop(),
        pause(),
        nvl(),
        raw());
    if (depth > 0) {
      choices.add(label(depth), ifStatement(depth), menu(depth));
    }
    return Arbitraries.oneOf(choices.build());
  }

  private static Arbitrary<String> text() {
    return Arbitraries.strings()
        .withCharRange('a', 'z')
        .withChars(" \"\\\n\t!#:")
        .ofMinLength(1)
        .ofMaxLength(12);
  }

  private static Arbitrary<String> condition() {
    return Arbitraries.of("x", "points > 3", "not seen");
  }

  private static Arbitrary<String> labelName() {
    return Arbitraries.of("start", "ending", "route_a");
  }

  private static Arbitrary<String> transition() {
    return Arbitraries.of("dissolve", "fade");
  }

  private static Arbitrary<String> speaker() {
    return Arbitraries.of("e", "m", "narrator_2");
  }

  private static Arbitrary<Boolean> flag() {
    return Arbitraries.of(true, false);
  }

  private static OptionalDouble toOptionalDouble(Optional<Double> value) {
    return value.isPresent() ? OptionalDouble.of(value.get()) : OptionalDouble.empty();
  }

  private Arbitrary<Statement> label(int depth) {
    return Combinators.combine(
            labelName(),
            Arbitraries.of("who", "times=2").list().uniqueElements().ofMaxSize(2),
            statements(depth - 1))
        .as((name, parameters, body) -> nodes.label(name, parameters, body));
  }

  private Arbitrary<Statement> said() {
    return Combinators.combine(
            speaker(),
            text(),
            Arbitraries.of("happy", "sad").list().uniqueElements().ofMaxSize(2),
            transition().optional())
        .as(
            (speaker, text, attributes, transition) ->
                nodes.dialogue(
                    speaker,
                    text,
                    DialogueOptions.builder()
                        .setAttributes(attributes)
                        .setTransition(transition)
                        .build()));
  }

  private Arbitrary<Statement> narration() {
    return text().map(text -> nodes.narration(text));
  }

  private Arbitrary<Statement> extend() {
    return text().map(text -> nodes.extend(text));
  }

  private Arbitrary<Statement> menu(int depth) {
    Arbitrary<MenuOptions.Prompt> prompt =
        Combinators.combine(speaker().optional(), text()).as(MenuOptions.Prompt::create);
    Arbitrary<Statement.Menu.Choice> choice =
        Combinators.combine(text(), condition().optional(), statements(depth - 1))
            .as((text, condition, body) -> nodes.choice(text, condition.orElse(null), body));
    return Combinators.combine(
            Arbitraries.of("choose").optional(),
            Arbitraries.of("choice").optional(),
            Arbitraries.of("picked", "result.value").optional(),
            prompt.optional(),
            choice.list().ofMaxSize(3))
        .as(
            (name, screen, result, menuPrompt, choices) ->
                nodes.menu(
                    choices,
                    MenuOptions.builder()
                        .setName(name)
                        .setScreen(screen)
                        .setResultVariable(result)
                        .setPrompt(menuPrompt)
                        .build()));
  }

  private Arbitrary<Statement> image() {
    Arbitrary<DisplayOptions> options =
        Combinators.combine(
                Arbitraries.of("happy", "night").list().uniqueElements().ofMaxSize(2),
                Arbitraries.of("e2").optional(),
                Arbitraries.of("left", "truecenter").optional(),
                Arbitraries.of("bg").optional(),
                Arbitraries.of("overlay", "master").optional(),
                Arbitraries.integers().between(-3, 3).optional(),
                transition().optional())
            .as(
                (attributes, asTag, position, behind, layer, zorder, transition) ->
                    DisplayOptions.builder()
                        .setAttributes(attributes)
                        .setAsTag(asTag)
                        .setPosition(position)
                        .setBehindTag(behind)
                        .setLayer(layer)
                        .setZorder(
                            zorder.isPresent() ? OptionalInt.of(zorder.get()) : OptionalInt.empty())
                        .setTransition(transition)
                        .build());
    return Combinators.combine(
            Arbitraries.of(Statement.Kind.SCENE, Statement.Kind.SHOW, Statement.Kind.HIDE),
            Arbitraries.of("bg", "eileen"),
            options)
        .as(
            (kind, image, opts) -> {
              switch (kind) {
                case SCENE:
                  return nodes.scene(image, opts);
                case SHOW:
                  return nodes.show(image, opts);
                default:
                  return nodes.hide(image, opts);
              }
            });
  }

  private Arbitrary<Statement> with() {
    return transition().map(transition -> nodes.with(transition));
  }

  private Arbitrary<Statement> jump() {
    Arbitrary<Statement> direct = labelName().map(label -> nodes.jump(label));
    Arbitrary<Statement> expression =
        Arbitraries.of("\"end\"", "target").map(expr -> nodes.jumpExpression(expr));
    return Arbitraries.oneOf(direct, expression);
  }

  private Arbitrary<Statement> call() {
    return Combinators.combine(
            flag(),
            labelName(),
            Arbitraries.of("1", "\"x\"", "b=2").list().ofMaxSize(3),
            labelName().optional())
        .as(
            (expression, target, arguments, from) ->
                expression
                    ? nodes.callExpression("target", arguments, from.orElse(null))
                    : nodes.call(target, arguments, from.orElse(null)));
  }

  private Arbitrary<Statement> returnStatement() {
    return Arbitraries.of("1", "points", "\"done\"")
        .optional()
        .map(value -> nodes.returnStatement(value.orElse(null)));
  }

  private Arbitrary<Statement> ifStatement(int depth) {
    Arbitrary<Statement.If.Branch> branch =
        Combinators.combine(condition(), statements(depth - 1))
            .as((condition, body) -> nodes.branch(condition, body));
    Arbitrary<Optional<Statement.If.Branch>> elseBranch =
        statements(depth - 1).map(body -> nodes.elseBranch(body)).optional();
    return Combinators.combine(branch.list().ofMinSize(1).ofMaxSize(3), elseBranch)
        .as(
            (branches, otherwise) -> {
              ImmutableList.Builder<Statement.If.Branch> all = ImmutableList.builder();
              all.addAll(branches);
              otherwise.ifPresent(all::add);
              return nodes.ifStatement(all.build());
            });
  }

  private Arbitrary<Statement> set() {
    return Combinators.combine(
            Arbitraries.of("points", "persistent.seen"),
            Arbitraries.of(SetOperator.class),
            Arbitraries.of("1", "True", "points + 1", "\"x\""))
        .as((variable, operator, value) -> nodes.set(variable, operator, value));
  }

  private Arbitrary<Statement> python() {
    return Combinators.combine(
            Arbitraries.of(
                "renpy.pause(1)",
                "x = 1",
                "print('hi')",
                "def f():\n    return 1",
                "x = 1\ny = 2"),
            flag(),
            flag(),
            flag())
        .as((code, early, hide, init) -> nodes.python(code, early, hide, init));
  }

  private Arbitrary<Statement> define() {
    return Combinators.combine(
            Arbitraries.of("e", "config.debug", "gui.text_size"),
            Arbitraries.of("1", "True", "Character(\"Eileen\")"))
        .as((name, value) -> nodes.define(name, value));
  }

  private Arbitrary<Statement> defaultStatement() {
    return Combinators.combine(
            Arbitraries.of("points", "persistent.flag"), Arbitraries.of("0", "False"))
        .as((name, value) -> nodes.defaultStatement(name, value));
  }

  private Arbitrary<Statement> play() {
    Arbitrary<Double> seconds = Arbitraries.of(0.5, 1.0, 2.25);
    return Combinators.combine(
            Arbitraries.of(AudioChannel.class),
            Arbitraries.of("a.ogg", "music/theme.ogg"),
            seconds.optional(),
            seconds.optional(),
            Arbitraries.of(0.5, 1.0).optional(),
            flag().optional(),
            flag(),
            flag())
        .as(
            (channel, file, fadeIn, fadeOut, volume, loop, queue, ifChanged) ->
                nodes.play(
                    channel,
                    file,
                    PlaybackOptions.builder()
                        .setFadeIn(toOptionalDouble(fadeIn))
                        .setFadeOut(toOptionalDouble(fadeOut))
                        .setVolume(toOptionalDouble(volume))
                        .setLoop(loop)
                        .setQueue(queue)
                        .setIfChanged(ifChanged)
                        .build()));
  }

  private Arbitrary<Statement> stop() {
    return Combinators.combine(
            Arbitraries.of(AudioChannel.class), Arbitraries.of(0.5, 1.0, 2.25).optional())
        .as((channel, fadeOut) -> nodes.stop(channel, toOptionalDouble(fadeOut)));
  }

  private Arbitrary<Statement> pause() {
    return Arbitraries.of(0.5, 1.0, 2.25)
        .optional()
        .map(duration -> nodes.pause(toOptionalDouble(duration)));
  }

  private Arbitrary<Statement> nvl() {
    return Arbitraries.of(NvlAction.class).map(action -> nodes.nvl(action));
  }

  private Arbitrary<Statement> raw() {
    return Arbitraries.of(
            "scene_transition_custom extra weird syntax",
            "renpy_custom_stmt 1 2  ",
            "screen hello():\n    text \"Hi\"")
        .map(content -> nodes.raw(content));
  }
}
