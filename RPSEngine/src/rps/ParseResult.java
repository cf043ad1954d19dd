package rps;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A best-effort script plus everything that was wrong with its source. */
@AutoValue
public abstract class ParseResult {
  public abstract Script script();

  public abstract ImmutableList<Diagnostic> diagnostics();

  public static ParseResult create(Script script, Iterable<Diagnostic> diagnostics) {
    return new AutoValue_ParseResult(
        script, ImmutableList.sortedCopyOf(ImmutableList.copyOf(diagnostics)));
  }

  public boolean hasDiagnostics() {
    return !diagnostics().isEmpty();
  }
}
