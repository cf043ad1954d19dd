package rps;

import java.time.Instant;
import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class ScriptMetadata {
  public static final String FORMAT_VERSION = "1.0.0";

  /** Where the script came from, usually a file path. */
  public abstract Optional<String> fileIdentifier();

  public abstract Instant parseTime();

  public abstract String formatVersion();

  public static ScriptMetadata create(Optional<String> fileIdentifier, Instant parseTime) {
    return new AutoValue_ScriptMetadata(Fields.nonBlank(fileIdentifier), parseTime, FORMAT_VERSION);
  }

  public static ScriptMetadata now() {
    return create(Optional.empty(), Instant.now());
  }
}
