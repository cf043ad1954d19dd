package rps;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import rps.processor.ASTChild;
import rps.processor.ASTNode;

/**
 * A statement of a script. Every variant is a nested final class tagged with a {@link Kind};
 * instances are immutable and created through {@link NodeFactory}.
 */
public abstract class Statement implements ASTNodeInterface {
  public static enum Kind {
    LABEL,
    DIALOGUE,
    MENU,
    SCENE,
    SHOW,
    HIDE,
    WITH,
    JUMP,
    CALL,
    RETURN,
    IF,
    SET,
    PYTHON,
    DEFINE,
    DEFAULT,
    PLAY,
    STOP,
    PAUSE,
    NVL,
    RAW;

    /** Whether statements of this kind own nested statement lists. */
    public boolean isCompound() {
      return this == LABEL || this == MENU || this == IF;
    }
  }

  private final Kind kind;
  private final NodeId id;
  private final OptionalInt line;

  private Statement(Kind kind, NodeId id, OptionalInt line) {
    this.kind = Preconditions.checkNotNull(kind);
    this.id = Preconditions.checkNotNull(id);
    this.line = Preconditions.checkNotNull(line);
  }

  public final Kind kind() {
    return kind;
  }

  public final NodeId id() {
    return id;
  }

  /** The 1-based source line this statement was parsed from, if any. */
  public final OptionalInt line() {
    return line;
  }

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  public <T extends Statement> T cast(Class<T> clazz) {
    Preconditions.checkState(
        clazz.isInstance(this), "%s is not a %s", kind, clazz.getSimpleName());
    return clazz.cast(this);
  }

  @Override
  public String toString() {
    return new CodeGenerator().generate(this, 0).trim();
  }

  @ASTNode
  public static final class Label extends Statement implements Statement_Label_ASTNode {
    private final String name;
    private final ImmutableList<String> parameters;
    private final ImmutableList<Statement> body;

    Label(
        NodeId id,
        OptionalInt line,
        String name,
        ImmutableList<String> parameters,
        ImmutableList<Statement> body) {
      super(Kind.LABEL, id, line);
      this.name = name;
      this.parameters = parameters;
      this.body = body;
    }

    public String name() {
      return name;
    }

    /** Parameter declarations of {@code label name(a, b=1):}; empty when there are none. */
    public ImmutableList<String> parameters() {
      return parameters;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    public Label withBody(Iterable<? extends Statement> newBody) {
      return new Label(id(), line(), name, parameters, ImmutableList.copyOf(newBody));
    }
  }

  @ASTNode
  public static final class Dialogue extends Statement implements Statement_Dialogue_ASTNode {
    private final Optional<String> speaker;
    private final String text;
    private final DialogueOptions options;

    Dialogue(
        NodeId id,
        OptionalInt line,
        Optional<String> speaker,
        String text,
        DialogueOptions options) {
      super(Kind.DIALOGUE, id, line);
      this.speaker = speaker;
      this.text = text;
      this.options = options;
    }

    /** Empty for narration and for {@code extend} lines. */
    public Optional<String> speaker() {
      return speaker;
    }

    public String text() {
      return text;
    }

    public DialogueOptions options() {
      return options;
    }
  }

  @ASTNode
  public static final class Menu extends Statement implements Statement_Menu_ASTNode {
    @ASTNode
    public static final class Choice implements Statement_Menu_Choice_ASTNode {
      private final NodeId id;
      private final OptionalInt line;
      private final String text;
      private final Optional<String> condition;
      private final ImmutableList<Statement> body;

      Choice(
          NodeId id,
          OptionalInt line,
          String text,
          Optional<String> condition,
          ImmutableList<Statement> body) {
        this.id = id;
        this.line = line;
        this.text = text;
        this.condition = condition;
        this.body = body;
      }

      public NodeId id() {
        return id;
      }

      public OptionalInt line() {
        return line;
      }

      public String text() {
        return text;
      }

      public Optional<String> condition() {
        return condition;
      }

      @ASTChild
      @Override
      public ImmutableList<Statement> body() {
        return body;
      }

      public Choice withBody(Iterable<? extends Statement> newBody) {
        return new Choice(id, line, text, condition, ImmutableList.copyOf(newBody));
      }

      @Override
      public String toString() {
        return String.format("Choice%s \"%s\"", id, text);
      }
    }

    private final ImmutableList<Choice> choices;
    private final MenuOptions options;

    Menu(NodeId id, OptionalInt line, ImmutableList<Choice> choices, MenuOptions options) {
      super(Kind.MENU, id, line);
      this.choices = choices;
      this.options = options;
    }

    @ASTChild
    @Override
    public ImmutableList<Choice> choices() {
      return choices;
    }

    public MenuOptions options() {
      return options;
    }

    public Menu withChoices(Iterable<Choice> newChoices) {
      return new Menu(id(), line(), ImmutableList.copyOf(newChoices), options);
    }
  }

  /** Common shape of {@code scene}, {@code show} and {@code hide}. */
  public abstract static class ImageStatement extends Statement {
    private final String image;
    private final DisplayOptions options;

    private ImageStatement(
        Kind kind, NodeId id, OptionalInt line, String image, DisplayOptions options) {
      super(kind, id, line);
      this.image = image;
      this.options = options;
    }

    /** The image tag, without attributes. */
    public final String image() {
      return image;
    }

    public final DisplayOptions options() {
      return options;
    }
  }

  @ASTNode
  public static final class Scene extends ImageStatement implements Statement_Scene_ASTNode {
    Scene(NodeId id, OptionalInt line, String image, DisplayOptions options) {
      super(Kind.SCENE, id, line, image, options);
    }
  }

  @ASTNode
  public static final class Show extends ImageStatement implements Statement_Show_ASTNode {
    Show(NodeId id, OptionalInt line, String image, DisplayOptions options) {
      super(Kind.SHOW, id, line, image, options);
    }
  }

  @ASTNode
  public static final class Hide extends ImageStatement implements Statement_Hide_ASTNode {
    Hide(NodeId id, OptionalInt line, String image, DisplayOptions options) {
      super(Kind.HIDE, id, line, image, options);
    }
  }

  @ASTNode
  public static final class With extends Statement implements Statement_With_ASTNode {
    private final String transition;

    With(NodeId id, OptionalInt line, String transition) {
      super(Kind.WITH, id, line);
      this.transition = transition;
    }

    public String transition() {
      return transition;
    }
  }

  @ASTNode
  public static final class Jump extends Statement implements Statement_Jump_ASTNode {
    private final String target;
    private final boolean expression;

    Jump(NodeId id, OptionalInt line, String target, boolean expression) {
      super(Kind.JUMP, id, line);
      this.target = target;
      this.expression = expression;
    }

    /** A label name, or an expression evaluating to one when {@link #expression()}. */
    public String target() {
      return target;
    }

    public boolean expression() {
      return expression;
    }
  }

  @ASTNode
  public static final class Call extends Statement implements Statement_Call_ASTNode {
    private final String target;
    private final boolean expression;
    private final ImmutableList<String> arguments;
    private final Optional<String> fromLabel;

    Call(
        NodeId id,
        OptionalInt line,
        String target,
        boolean expression,
        ImmutableList<String> arguments,
        Optional<String> fromLabel) {
      super(Kind.CALL, id, line);
      this.target = target;
      this.expression = expression;
      this.arguments = arguments;
      this.fromLabel = fromLabel;
    }

    public String target() {
      return target;
    }

    public boolean expression() {
      return expression;
    }

    public ImmutableList<String> arguments() {
      return arguments;
    }

    public Optional<String> fromLabel() {
      return fromLabel;
    }
  }

  @ASTNode
  public static final class Return extends Statement implements Statement_Return_ASTNode {
    private final Optional<String> value;

    Return(NodeId id, OptionalInt line, Optional<String> value) {
      super(Kind.RETURN, id, line);
      this.value = value;
    }

    public Optional<String> value() {
      return value;
    }
  }

  @ASTNode
  public static final class If extends Statement implements Statement_If_ASTNode {
    @ASTNode
    public static final class Branch implements Statement_If_Branch_ASTNode {
      private final NodeId id;
      private final OptionalInt line;
      private final Optional<String> condition;
      private final ImmutableList<Statement> body;

      Branch(
          NodeId id,
          OptionalInt line,
          Optional<String> condition,
          ImmutableList<Statement> body) {
        this.id = id;
        this.line = line;
        this.condition = condition;
        this.body = body;
      }

      public NodeId id() {
        return id;
      }

      public OptionalInt line() {
        return line;
      }

      /** Empty for an {@code else} branch. */
      public Optional<String> condition() {
        return condition;
      }

      public boolean isElse() {
        return !condition.isPresent();
      }

      @ASTChild
      @Override
      public ImmutableList<Statement> body() {
        return body;
      }

      public Branch withBody(Iterable<? extends Statement> newBody) {
        return new Branch(id, line, condition, ImmutableList.copyOf(newBody));
      }

      @Override
      public String toString() {
        return String.format("Branch%s %s", id, condition.orElse("else"));
      }
    }

    private final ImmutableList<Branch> branches;

    If(NodeId id, OptionalInt line, ImmutableList<Branch> branches) {
      super(Kind.IF, id, line);
      this.branches = branches;
    }

    @ASTChild
    @Override
    public ImmutableList<Branch> branches() {
      return branches;
    }

    public If withBranches(Iterable<Branch> newBranches) {
      return new If(id(), line(), ImmutableList.copyOf(newBranches));
    }
  }

  @ASTNode
  public static final class Set extends Statement implements Statement_Set_ASTNode {
    private final String variable;
    private final SetOperator operator;
    private final String value;

    Set(NodeId id, OptionalInt line, String variable, SetOperator operator, String value) {
      super(Kind.SET, id, line);
      this.variable = variable;
      this.operator = operator;
      this.value = value;
    }

    public String variable() {
      return variable;
    }

    public SetOperator operator() {
      return operator;
    }

    public String value() {
      return value;
    }
  }

  @ASTNode
  public static final class Python extends Statement implements Statement_Python_ASTNode {
    private final String code;
    private final boolean early;
    private final boolean hide;
    private final boolean init;

    Python(
        NodeId id, OptionalInt line, String code, boolean early, boolean hide, boolean init) {
      super(Kind.PYTHON, id, line);
      this.code = code;
      this.early = early;
      this.hide = hide;
      this.init = init;
    }

    /** Source lines, indented relative to the block. */
    public String code() {
      return code;
    }

    public boolean early() {
      return early;
    }

    public boolean hide() {
      return hide;
    }

    public boolean init() {
      return init;
    }

    public boolean hasFlags() {
      return early || hide || init;
    }
  }

  @ASTNode
  public static final class Define extends Statement implements Statement_Define_ASTNode {
    private final Optional<String> store;
    private final String name;
    private final String value;

    Define(NodeId id, OptionalInt line, Optional<String> store, String name, String value) {
      super(Kind.DEFINE, id, line);
      this.store = store;
      this.name = name;
      this.value = value;
    }

    public Optional<String> store() {
      return store;
    }

    public String name() {
      return name;
    }

    public String qualifiedName() {
      return store.map(s -> s + "." + name).orElse(name);
    }

    public String value() {
      return value;
    }
  }

  @ASTNode
  public static final class Default extends Statement implements Statement_Default_ASTNode {
    private final String name;
    private final String value;

    Default(NodeId id, OptionalInt line, String name, String value) {
      super(Kind.DEFAULT, id, line);
      this.name = name;
      this.value = value;
    }

    public String name() {
      return name;
    }

    public String value() {
      return value;
    }
  }

  @ASTNode
  public static final class Play extends Statement implements Statement_Play_ASTNode {
    private final AudioChannel channel;
    private final String file;
    private final PlaybackOptions options;

    Play(
        NodeId id, OptionalInt line, AudioChannel channel, String file, PlaybackOptions options) {
      super(Kind.PLAY, id, line);
      this.channel = channel;
      this.file = file;
      this.options = options;
    }

    public AudioChannel channel() {
      return channel;
    }

    public String file() {
      return file;
    }

    public PlaybackOptions options() {
      return options;
    }
  }

  @ASTNode
  public static final class Stop extends Statement implements Statement_Stop_ASTNode {
    private final AudioChannel channel;
    private final OptionalDouble fadeOut;

    Stop(NodeId id, OptionalInt line, AudioChannel channel, OptionalDouble fadeOut) {
      super(Kind.STOP, id, line);
      this.channel = channel;
      this.fadeOut = fadeOut;
    }

    public AudioChannel channel() {
      return channel;
    }

    public OptionalDouble fadeOut() {
      return fadeOut;
    }
  }

  @ASTNode
  public static final class Pause extends Statement implements Statement_Pause_ASTNode {
    private final OptionalDouble duration;

    Pause(NodeId id, OptionalInt line, OptionalDouble duration) {
      super(Kind.PAUSE, id, line);
      this.duration = duration;
    }

    /** Seconds to wait; empty waits for a click. */
    public OptionalDouble duration() {
      return duration;
    }
  }

  @ASTNode
  public static final class Nvl extends Statement implements Statement_Nvl_ASTNode {
    private final NvlAction action;

    Nvl(NodeId id, OptionalInt line, NvlAction action) {
      super(Kind.NVL, id, line);
      this.action = action;
    }

    public NvlAction action() {
      return action;
    }
  }

  /** Source the parser does not understand, kept verbatim. */
  @ASTNode
  public static final class Raw extends Statement implements Statement_Raw_ASTNode {
    private final String content;

    Raw(NodeId id, OptionalInt line, String content) {
      super(Kind.RAW, id, line);
      this.content = content;
    }

    /**
     * The captured lines joined with {@code '\n'}, each keeping its indentation relative to the
     * enclosing block.
     */
    public String content() {
      return content;
    }

    public boolean isMultiLine() {
      return content.indexOf('\n') >= 0;
    }
  }
}
