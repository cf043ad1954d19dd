package rps;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.io.Files;

public class RpsMain {

  private static final String USAGE =
      "Usage: $RPS (check|format|stats) script_file [--indent=N] [--no-blank-lines]";

  public static void main(String[] args) throws IOException {
    if (args.length < 2) {
      System.err.println(USAGE);
      System.exit(1);
    }

    GeneratorOptions.Builder options = GeneratorOptions.builder();
    List<String> flags = Arrays.asList(args).subList(2, args.length);
    for (String flag : flags) {
      if (flag.startsWith("--indent=")) {
        options.setIndentWidth(parseIndent(flag.substring("--indent=".length())));
      } else if (flag.equals("--no-blank-lines")) {
        options.setBlankLinesBetweenTopLevel(false);
      } else {
        System.err.println("Unknown flag: " + flag);
        System.err.println(USAGE);
        System.exit(1);
      }
    }

    File file = new File(args[1]);
    ScriptEngine engine = new ScriptEngine(options.build());
    String source = read(file);
    boolean success;
    switch (args[0]) {
      case "check":
        success = check(engine, file, source);
        break;
      case "format":
        success = format(engine, file, source);
        break;
      case "stats":
        success = stats(engine, file, source);
        break;
      default:
        System.err.println(USAGE);
        success = false;
    }

    if (!success) System.exit(1);
  }

  private static int parseIndent(String value) {
    int width;
    try {
      width = Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      width = -1;
    }
    if (width < 1 || width > 16) {
      System.err.println("Not an indent width: " + value);
      System.exit(1);
    }
    return width;
  }

  private static boolean check(ScriptEngine engine, File file, String source) {
    ParseResult result = engine.parse(source, Optional.of(file.toString()));
    if (result.hasDiagnostics()) {
      result.diagnostics().forEach(d -> d.print(file.toString()));
      System.out.println("Check failed.  See warnings above.");
      return false;
    }

    Script script = result.script();
    if (!engine.roundTrips(script)) {
      System.out.println("Check failed.  The script does not survive reformatting.");
      return false;
    }
    int statements = NodeLocator.allStatements(script).size();
    System.out.println(String.format("%d statements, no problems found.", statements));
    return true;
  }

  private static boolean format(ScriptEngine engine, File file, String source)
      throws IOException {
    String formatted;
    try {
      formatted = engine.reformat(source, Optional.of(file.toString()));
    } catch (ScriptFormatException ex) {
      ex.print();
      System.out.println("File not formatted; there were problems.  See warnings above.");
      return false;
    }

    if (formatted.equals(source)) {
      System.out.println("File is already formatted");
    } else {
      write(formatted, file);
      System.out.println("File successfully formatted!");
    }
    return true;
  }

  private static boolean stats(ScriptEngine engine, File file, String source) {
    ParseResult result = engine.parse(source, Optional.of(file.toString()));
    result.diagnostics().forEach(d -> d.print(file.toString()));

    StatementStatistics stats = StatementStatistics.of(result.script());
    stats
        .counts()
        .forEach((kind, count) -> System.out.println(String.format("%-10s %d", kind, count)));
    System.out.println(String.format("%-10s %d", "TOTAL", stats.total()));
    System.out.println(String.format("%-10s %d", "CHOICES", stats.choiceCount()));
    System.out.println(String.format("%-10s %d", "DEPTH", stats.maxDepth()));
    System.out.println("Labels: " + String.join(", ", stats.labelNames()));
    return true;
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
