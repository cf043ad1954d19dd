package rps;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class GeneratorOptions {
  public static final int DEFAULT_INDENT_WIDTH = 4;

  /** Spaces per nesting level. */
  public abstract int indentWidth();

  /** Separates labels, define groups and multi-line raw blocks at the top level. */
  public abstract boolean blankLinesBetweenTopLevel();

  public static GeneratorOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_GeneratorOptions.Builder()
        .setIndentWidth(DEFAULT_INDENT_WIDTH)
        .setBlankLinesBetweenTopLevel(true);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIndentWidth(int indentWidth);

    public abstract Builder setBlankLinesBetweenTopLevel(boolean blankLines);

    @ForOverride
    abstract GeneratorOptions autoBuild();

    public GeneratorOptions build() {
      GeneratorOptions options = autoBuild();
      Preconditions.checkArgument(
          options.indentWidth() >= 1 && options.indentWidth() <= 16,
          "indent width out of range: %s",
          options.indentWidth());
      return options;
    }
  }
}
