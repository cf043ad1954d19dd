package rps;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Builds statements with fresh ids. Absent, null and blank optional values all become empty;
 * null lists become empty lists. Arguments that could never come out of a script, such as a
 * blank label name, are rejected with {@link IllegalArgumentException}.
 */
public final class NodeFactory {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern DOTTED_NAME =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");
  private static final Pattern LABEL_NAME =
      Pattern.compile("(([A-Za-z_][A-Za-z0-9_]*)?\\.)?[A-Za-z_][A-Za-z0-9_]*");

  private static final Splitter LINES = Splitter.onPattern("\r?\n");

  /** Words that start a statement and so can never name a speaker. */
  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "label", "menu", "if", "elif", "else", "jump", "call", "return", "scene", "show",
          "hide", "with", "define", "default", "play", "queue", "stop", "pause", "nvl", "python",
          "init", "voice", "extend", "set", "pass");

  private final NodeIdGenerator ids;
  private final OptionalInt line;

  public NodeFactory(NodeIdGenerator ids) {
    this(ids, OptionalInt.empty());
  }

  private NodeFactory(NodeIdGenerator ids, OptionalInt line) {
    this.ids = Preconditions.checkNotNull(ids);
    this.line = line;
  }

  /** Returns a factory sharing this one's ids that records {@code line} on every node. */
  public NodeFactory atLine(int line) {
    Preconditions.checkArgument(line >= 1, "lines are 1-based: %s", line);
    return new NodeFactory(ids, OptionalInt.of(line));
  }

  public NodeIdGenerator idGenerator() {
    return ids;
  }

  public static boolean isSpeakerName(String name) {
    return name != null && IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name);
  }

  static boolean isDottedName(String name) {
    return DOTTED_NAME.matcher(name).matches();
  }

  static boolean isLabelName(String name) {
    return LABEL_NAME.matcher(name).matches();
  }

  private static <T> ImmutableList<T> list(Iterable<? extends T> items) {
    return items == null ? ImmutableList.of() : ImmutableList.copyOf(items);
  }

  public Statement.Label label(String name, Iterable<? extends Statement> body) {
    return label(name, ImmutableList.of(), body);
  }

  public Statement.Label label(
      String name, Iterable<String> parameters, Iterable<? extends Statement> body) {
    String labelName = Fields.required(name, "label name");
    Preconditions.checkArgument(isLabelName(labelName), "not a label name: %s", labelName);
    ImmutableList.Builder<String> params = ImmutableList.builder();
    for (String parameter : list(parameters)) {
      params.add(Fields.required(parameter, "label parameter"));
    }
    return new Statement.Label(ids.next(), line, labelName, params.build(), list(body));
  }

  public Statement.Dialogue dialogue(String speaker, String text) {
    return dialogue(speaker, text, DialogueOptions.none());
  }

  public Statement.Dialogue dialogue(String speaker, String text, DialogueOptions options) {
    Preconditions.checkArgument(text != null, "dialogue text must not be null");
    DialogueOptions opts = options == null ? DialogueOptions.none() : options;
    Optional<String> who = Fields.nonBlank(speaker);
    who.ifPresent(
        s -> Preconditions.checkArgument(isSpeakerName(s), "not a speaker name: %s", s));
    Preconditions.checkArgument(
        !(opts.extend() && who.isPresent()), "'extend' lines have no speaker");
    Preconditions.checkArgument(
        who.isPresent() || opts.attributes().isEmpty(), "attributes need a speaker");
    return new Statement.Dialogue(ids.next(), line, who, text, opts);
  }

  public Statement.Dialogue narration(String text) {
    return dialogue(null, text);
  }

  public Statement.Dialogue extend(String text) {
    return dialogue(null, text, DialogueOptions.builder().setExtend(true).build());
  }

  public Statement.Menu menu(Iterable<Statement.Menu.Choice> choices) {
    return menu(choices, MenuOptions.none());
  }

  public Statement.Menu menu(Iterable<Statement.Menu.Choice> choices, MenuOptions options) {
    return new Statement.Menu(
        ids.next(), line, list(choices), options == null ? MenuOptions.none() : options);
  }

  public Statement.Menu.Choice choice(String text, Iterable<? extends Statement> body) {
    return choice(text, null, body);
  }

  public Statement.Menu.Choice choice(
      String text, String condition, Iterable<? extends Statement> body) {
    Preconditions.checkArgument(text != null, "choice text must not be null");
    return new Statement.Menu.Choice(
        ids.next(),
        line,
        text,
        Fields.singleLine(Fields.nonBlank(condition), "choice condition"),
        list(body));
  }

  /** Splits a multi-word image name such as {@code "eileen happy"} into tag and attributes. */
  private static ImmutableList<String> imageWords(String image) {
    return Fields.words(Fields.required(image, "image"));
  }

  private static DisplayOptions imageOptions(ImmutableList<String> words, DisplayOptions options) {
    DisplayOptions opts = options == null ? DisplayOptions.none() : options;
    if (words.size() == 1) return opts;

    return opts.toBuilder()
        .setAttributes(
            ImmutableList.<String>builder()
                .addAll(words.subList(1, words.size()))
                .addAll(opts.attributes())
                .build())
        .build();
  }

  public Statement.Scene scene(String image) {
    return scene(image, DisplayOptions.none());
  }

  public Statement.Scene scene(String image, DisplayOptions options) {
    ImmutableList<String> words = imageWords(image);
    return new Statement.Scene(ids.next(), line, words.get(0), imageOptions(words, options));
  }

  public Statement.Show show(String image) {
    return show(image, DisplayOptions.none());
  }

  public Statement.Show show(String image, DisplayOptions options) {
    ImmutableList<String> words = imageWords(image);
    return new Statement.Show(ids.next(), line, words.get(0), imageOptions(words, options));
  }

  public Statement.Hide hide(String image) {
    return hide(image, DisplayOptions.none());
  }

  public Statement.Hide hide(String image, DisplayOptions options) {
    ImmutableList<String> words = imageWords(image);
    return new Statement.Hide(ids.next(), line, words.get(0), imageOptions(words, options));
  }

  public Statement.With with(String transition) {
    return new Statement.With(ids.next(), line, Fields.required(transition, "transition"));
  }

  public Statement.Jump jump(String target) {
    String label = Fields.required(target, "jump target");
    Preconditions.checkArgument(isLabelName(label), "not a label name: %s", label);
    return new Statement.Jump(ids.next(), line, label, false);
  }

  public Statement.Jump jumpExpression(String expression) {
    return new Statement.Jump(ids.next(), line, Fields.required(expression, "expression"), true);
  }

  public Statement.Call call(String target) {
    return call(target, ImmutableList.of(), null);
  }

  public Statement.Call call(String target, Iterable<String> arguments, String fromLabel) {
    String label = Fields.required(target, "call target");
    Preconditions.checkArgument(isLabelName(label), "not a label name: %s", label);
    return new Statement.Call(
        ids.next(), line, label, false, arguments(arguments), fromLabel(fromLabel));
  }

  public Statement.Call callExpression(
      String expression, Iterable<String> arguments, String fromLabel) {
    return new Statement.Call(
        ids.next(),
        line,
        Fields.required(expression, "expression"),
        true,
        arguments(arguments),
        fromLabel(fromLabel));
  }

  private static ImmutableList<String> arguments(Iterable<String> arguments) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (String argument : list(arguments)) {
      builder.add(Fields.required(argument, "call argument"));
    }
    return builder.build();
  }

  private static Optional<String> fromLabel(String fromLabel) {
    Optional<String> from = Fields.nonBlank(fromLabel);
    from.ifPresent(
        f -> Preconditions.checkArgument(isLabelName(f), "not a label name: %s", f));
    return from;
  }

  public Statement.Return returnStatement() {
    return returnStatement(null);
  }

  public Statement.Return returnStatement(String value) {
    return new Statement.Return(
        ids.next(), line, Fields.singleLine(Fields.nonBlank(value), "return value"));
  }

  public Statement.If ifStatement(Iterable<Statement.If.Branch> branches) {
    ImmutableList<Statement.If.Branch> all = list(branches);
    Preconditions.checkArgument(!all.isEmpty(), "an if statement needs a branch");
    Preconditions.checkArgument(
        !all.get(0).isElse(), "the first branch of an if statement needs a condition");
    return new Statement.If(ids.next(), line, all);
  }

  /** A conditional branch, or an {@code else} branch when {@code condition} is absent. */
  public Statement.If.Branch branch(String condition, Iterable<? extends Statement> body) {
    return new Statement.If.Branch(
        ids.next(),
        line,
        Fields.singleLine(Fields.nonBlank(condition), "branch condition"),
        list(body));
  }

  public Statement.If.Branch elseBranch(Iterable<? extends Statement> body) {
    return branch(null, body);
  }

  public Statement.Set set(String variable, String value) {
    return set(variable, SetOperator.ASSIGN, value);
  }

  public Statement.Set set(String variable, SetOperator operator, String value) {
    String name = Fields.required(variable, "variable");
    Preconditions.checkArgument(isDottedName(name), "not a variable name: %s", name);
    String expression = Fields.required(value, "value");
    Preconditions.checkArgument(
        !expression.startsWith("="), "value must not start with '=': %s", expression);
    return new Statement.Set(
        ids.next(), line, name, operator == null ? SetOperator.ASSIGN : operator, expression);
  }

  public Statement.Python python(String code) {
    return python(code, false, false, false);
  }

  public Statement.Python python(String code, boolean early, boolean hide, boolean init) {
    Preconditions.checkArgument(
        code != null && !code.trim().isEmpty(), "python code must not be blank");
    return new Statement.Python(ids.next(), line, stripTrailingLines(code), early, hide, init);
  }

  private static String stripTrailingLines(String code) {
    String stripped = code;
    while (stripped.startsWith("\n")) {
      stripped = stripped.substring(1);
    }
    return stripped.stripTrailing();
  }

  public Statement.Define define(String name, String value) {
    return define(null, name, value);
  }

  /** A {@code define}; a dotted {@code name} without {@code store} names its own store. */
  public Statement.Define define(String store, String name, String value) {
    String defined = Fields.required(name, "define name");
    Optional<String> storeName = Fields.nonBlank(store);
    if (!storeName.isPresent() && defined.contains(".")) {
      int dot = defined.lastIndexOf('.');
      storeName = Optional.of(defined.substring(0, dot));
      defined = defined.substring(dot + 1);
    }
    storeName.ifPresent(
        s -> Preconditions.checkArgument(isDottedName(s), "not a store name: %s", s));
    Preconditions.checkArgument(IDENTIFIER.matcher(defined).matches(), "not a name: %s", defined);
    return new Statement.Define(ids.next(), line, storeName, defined, checkedValue(value));
  }

  public Statement.Default defaultStatement(String name, String value) {
    String defaulted = Fields.required(name, "default name");
    Preconditions.checkArgument(isDottedName(defaulted), "not a name: %s", defaulted);
    return new Statement.Default(ids.next(), line, defaulted, checkedValue(value));
  }

  private static String checkedValue(String value) {
    String expression = Fields.required(value, "value");
    Preconditions.checkArgument(
        !expression.startsWith("="), "value must not start with '=': %s", expression);
    return expression;
  }

  public Statement.Play play(AudioChannel channel, String file) {
    return play(channel, file, PlaybackOptions.none());
  }

  public Statement.Play play(AudioChannel channel, String file, PlaybackOptions options) {
    Preconditions.checkArgument(channel != null, "channel must not be null");
    Preconditions.checkArgument(file != null, "file must not be null");
    return new Statement.Play(
        ids.next(),
        line,
        channel,
        Fields.singleLine(file, "file"),
        options == null ? PlaybackOptions.none() : options);
  }

  public Statement.Play voice(String file) {
    return play(AudioChannel.VOICE, file);
  }

  public Statement.Stop stop(AudioChannel channel) {
    return stop(channel, OptionalDouble.empty());
  }

  public Statement.Stop stop(AudioChannel channel, double fadeOut) {
    return stop(channel, OptionalDouble.of(fadeOut));
  }

  public Statement.Stop stop(AudioChannel channel, OptionalDouble fadeOut) {
    Preconditions.checkArgument(channel != null, "channel must not be null");
    return new Statement.Stop(ids.next(), line, channel, Fields.finite(fadeOut, "fadeout"));
  }

  public Statement.Pause pause() {
    return pause(OptionalDouble.empty());
  }

  public Statement.Pause pause(double duration) {
    return pause(OptionalDouble.of(duration));
  }

  public Statement.Pause pause(OptionalDouble duration) {
    return new Statement.Pause(ids.next(), line, Fields.finite(duration, "duration"));
  }

  public Statement.Nvl nvl(NvlAction action) {
    Preconditions.checkArgument(action != null, "action must not be null");
    return new Statement.Nvl(ids.next(), line, action);
  }

  /** Keeps {@code content} verbatim apart from blank lines, which the scanner never reports. */
  public Statement.Raw raw(String content) {
    Preconditions.checkArgument(
        content != null && !content.trim().isEmpty(), "raw content must not be blank");
    String normalized =
        LINES
            .splitToStream(content)
            .filter(l -> !l.trim().isEmpty())
            .collect(Collectors.joining("\n"));
    return new Statement.Raw(ids.next(), line, normalized);
  }

  public Script script(Iterable<? extends Statement> statements) {
    return script(statements, ScriptMetadata.now());
  }

  public Script script(Iterable<? extends Statement> statements, ScriptMetadata metadata) {
    return Script.create(list(statements), Preconditions.checkNotNull(metadata));
  }
}
