package rps;

import java.util.Optional;
import java.util.OptionalInt;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;

/**
 * Clauses of {@code scene}, {@code show} and {@code hide}. The generator writes them in the
 * order attributes, {@code as}, {@code at}, {@code behind}, {@code onlayer}, {@code zorder},
 * {@code with}.
 */
@AutoValue
public abstract class DisplayOptions {
  private static final DisplayOptions NONE = builder().build();

  public static DisplayOptions none() {
    return NONE;
  }

  public abstract ImmutableList<String> attributes();

  public abstract Optional<String> asTag();

  public abstract Optional<String> position();

  public abstract Optional<String> behindTag();

  public abstract Optional<String> layer();

  public abstract OptionalInt zorder();

  public abstract Optional<String> transition();

  public static Builder builder() {
    return new AutoValue_DisplayOptions.Builder().setAttributes(ImmutableList.of());
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAttributes(Iterable<String> attributes);

    public abstract Builder setAsTag(Optional<String> asTag);

    public Builder setAsTag(String asTag) {
      return setAsTag(Optional.ofNullable(asTag));
    }

    public abstract Builder setPosition(Optional<String> position);

    public Builder setPosition(String position) {
      return setPosition(Optional.ofNullable(position));
    }

    public abstract Builder setBehindTag(Optional<String> behindTag);

    public Builder setBehindTag(String behindTag) {
      return setBehindTag(Optional.ofNullable(behindTag));
    }

    public abstract Builder setLayer(Optional<String> layer);

    public Builder setLayer(String layer) {
      return setLayer(Optional.ofNullable(layer));
    }

    public abstract Builder setZorder(OptionalInt zorder);

    public Builder setZorder(int zorder) {
      return setZorder(OptionalInt.of(zorder));
    }

    public abstract Builder setTransition(Optional<String> transition);

    public Builder setTransition(String transition) {
      return setTransition(Optional.ofNullable(transition));
    }

    abstract ImmutableList<String> attributes();

    abstract Optional<String> asTag();

    abstract Optional<String> position();

    abstract Optional<String> behindTag();

    abstract Optional<String> layer();

    abstract Optional<String> transition();

    @ForOverride
    abstract DisplayOptions autoBuild();

    public DisplayOptions build() {
      setAttributes(Fields.words(attributes(), "attribute"));
      setAsTag(Fields.singleLine(Fields.nonBlank(asTag()), "as tag"));
      setPosition(Fields.singleLine(Fields.nonBlank(position()), "position"));
      setBehindTag(Fields.singleLine(Fields.nonBlank(behindTag()), "behind tag"));
      setLayer(Fields.singleLine(Fields.nonBlank(layer()), "layer"));
      setTransition(Fields.singleLine(Fields.nonBlank(transition()), "transition"));
      return autoBuild();
    }
  }
}
