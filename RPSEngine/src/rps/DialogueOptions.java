package rps;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;

/** Optional parts of a dialogue line: {@code speaker attrs "text" with transition}. */
@AutoValue
public abstract class DialogueOptions {
  private static final DialogueOptions NONE = builder().build();

  public static DialogueOptions none() {
    return NONE;
  }

  public abstract ImmutableList<String> attributes();

  public abstract Optional<String> transition();

  /** Whether the line continues the previous speaker's text ({@code extend "..."}). */
  public abstract boolean extend();

  public static Builder builder() {
    return new AutoValue_DialogueOptions.Builder()
        .setAttributes(ImmutableList.of())
        .setExtend(false);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAttributes(Iterable<String> attributes);

    public abstract Builder setTransition(Optional<String> transition);

    public Builder setTransition(String transition) {
      return setTransition(Optional.ofNullable(transition));
    }

    public abstract Builder setExtend(boolean extend);

    abstract ImmutableList<String> attributes();

    abstract Optional<String> transition();

    @ForOverride
    abstract DialogueOptions autoBuild();

    public DialogueOptions build() {
      setAttributes(Fields.words(attributes(), "attribute"));
      setTransition(Fields.singleLine(Fields.nonBlank(transition()), "transition"));
      return autoBuild();
    }
  }
}
