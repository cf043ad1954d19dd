package rps;

import com.google.auto.value.AutoValue;

/** A recoverable problem found in a script, reported against a 1-based source line. */
@AutoValue
public abstract class Diagnostic implements Comparable<Diagnostic> {
  public abstract int line();

  public abstract String message();

  public static Diagnostic create(int line, String message) {
    return new AutoValue_Diagnostic(line, message);
  }

  public String format(String file) {
    return String.format("WARNING: %s@%d %s", file, line(), message());
  }

  public void print(String file) {
    System.out.println(format(file));
  }

  @Override
  public int compareTo(Diagnostic other) {
    return Integer.compare(line(), other.line());
  }

  @Override
  public String toString() {
    return String.format("%d: %s", line(), message());
  }
}
