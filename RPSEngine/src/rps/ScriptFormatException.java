package rps;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Thrown by strict parsing when a script produced diagnostics. */
public class ScriptFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String file;
  private final ImmutableList<Diagnostic> diagnostics;

  public ScriptFormatException(String file, Iterable<Diagnostic> diagnostics) {
    super(summary(file, ImmutableList.copyOf(diagnostics)));
    this.file = file;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
    Preconditions.checkArgument(!this.diagnostics.isEmpty(), "no diagnostics");
  }

  private static String summary(String file, ImmutableList<Diagnostic> diagnostics) {
    if (diagnostics.isEmpty()) return file;
    return String.format(
        "%s: %d problem(s), first at line %d: %s",
        file,
        diagnostics.size(),
        diagnostics.get(0).line(),
        diagnostics.get(0).message());
  }

  public String file() {
    return file;
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public void print() {
    diagnostics.forEach(d -> d.print(file));
  }
}
