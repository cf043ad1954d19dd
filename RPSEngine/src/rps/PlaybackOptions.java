package rps;

import java.util.Optional;
import java.util.OptionalDouble;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class PlaybackOptions {
  private static final PlaybackOptions NONE = builder().build();

  public static PlaybackOptions none() {
    return NONE;
  }

  public abstract OptionalDouble fadeIn();

  public abstract OptionalDouble fadeOut();

  /** {@code loop}, {@code noloop}, or empty when the channel default applies. */
  public abstract Optional<Boolean> loop();

  public abstract OptionalDouble volume();

  /** Written as {@code queue} instead of {@code play}. */
  public abstract boolean queue();

  public abstract boolean ifChanged();

  public boolean isEmpty() {
    return !fadeIn().isPresent()
        && !fadeOut().isPresent()
        && !loop().isPresent()
        && !volume().isPresent()
        && !queue()
        && !ifChanged();
  }

  public static Builder builder() {
    return new AutoValue_PlaybackOptions.Builder().setQueue(false).setIfChanged(false);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFadeIn(OptionalDouble fadeIn);

    public Builder setFadeIn(double fadeIn) {
      return setFadeIn(OptionalDouble.of(fadeIn));
    }

    public abstract Builder setFadeOut(OptionalDouble fadeOut);

    public Builder setFadeOut(double fadeOut) {
      return setFadeOut(OptionalDouble.of(fadeOut));
    }

    public abstract Builder setLoop(Optional<Boolean> loop);

    public Builder setLoop(boolean loop) {
      return setLoop(Optional.of(loop));
    }

    public abstract Builder setVolume(OptionalDouble volume);

    public Builder setVolume(double volume) {
      return setVolume(OptionalDouble.of(volume));
    }

    public abstract Builder setQueue(boolean queue);

    public abstract Builder setIfChanged(boolean ifChanged);

    abstract OptionalDouble fadeIn();

    abstract OptionalDouble fadeOut();

    abstract OptionalDouble volume();

    @ForOverride
    abstract PlaybackOptions autoBuild();

    public PlaybackOptions build() {
      Fields.finite(fadeIn(), "fadein");
      Fields.finite(fadeOut(), "fadeout");
      Fields.finite(volume(), "volume");
      return autoBuild();
    }
  }
}
