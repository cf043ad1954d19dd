package rps;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class MenuOptions {
  private static final MenuOptions NONE = builder().build();

  public static MenuOptions none() {
    return NONE;
  }

  /** The line shown above the choices, said by {@code speaker} or narrated. */
  @AutoValue
  public abstract static class Prompt {
    public abstract Optional<String> speaker();

    public abstract String text();

    public static Prompt narrated(String text) {
      return create(Optional.empty(), text);
    }

    public static Prompt said(String speaker, String text) {
      return create(Optional.ofNullable(speaker), text);
    }

    public static Prompt create(Optional<String> speaker, String text) {
      Preconditions.checkArgument(text != null, "prompt text must not be null");
      Optional<String> normalizedSpeaker = Fields.nonBlank(speaker);
      normalizedSpeaker.ifPresent(
          s ->
              Preconditions.checkArgument(
                  NodeFactory.isSpeakerName(s), "not a speaker name: %s", s));
      return new AutoValue_MenuOptions_Prompt(normalizedSpeaker, text);
    }
  }

  /** Label name of the menu itself, {@code menu name:}. */
  public abstract Optional<String> name();

  public abstract Optional<Prompt> prompt();

  /** Variable receiving the chosen caption, {@code set var}. */
  public abstract Optional<String> resultVariable();

  public abstract Optional<String> screen();

  public boolean isEmpty() {
    return !name().isPresent()
        && !prompt().isPresent()
        && !resultVariable().isPresent()
        && !screen().isPresent();
  }

  public static Builder builder() {
    return new AutoValue_MenuOptions.Builder();
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(Optional<String> name);

    public Builder setName(String name) {
      return setName(Optional.ofNullable(name));
    }

    public abstract Builder setPrompt(Optional<Prompt> prompt);

    public Builder setPrompt(Prompt prompt) {
      return setPrompt(Optional.ofNullable(prompt));
    }

    public abstract Builder setResultVariable(Optional<String> resultVariable);

    public Builder setResultVariable(String resultVariable) {
      return setResultVariable(Optional.ofNullable(resultVariable));
    }

    public abstract Builder setScreen(Optional<String> screen);

    public Builder setScreen(String screen) {
      return setScreen(Optional.ofNullable(screen));
    }

    abstract Optional<String> name();

    abstract Optional<String> resultVariable();

    abstract Optional<String> screen();

    @ForOverride
    abstract MenuOptions autoBuild();

    public MenuOptions build() {
      setName(Fields.nonBlank(name()));
      setResultVariable(Fields.nonBlank(resultVariable()));
      setScreen(Fields.nonBlank(screen()));
      name()
          .ifPresent(
              n -> Preconditions.checkArgument(NodeFactory.isLabelName(n), "not a label: %s", n));
      resultVariable()
          .ifPresent(
              v ->
                  Preconditions.checkArgument(
                      NodeFactory.isDottedName(v), "not a variable name: %s", v));
      screen()
          .ifPresent(
              s ->
                  Preconditions.checkArgument(
                      CharMatcher.whitespace().matchesNoneOf(s), "not a screen name: %s", s));
      return autoBuild();
    }
  }
}
