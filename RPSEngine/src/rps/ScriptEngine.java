package rps;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Entry point tying parsing and generation together. One engine owns one {@link
 * NodeIdGenerator}, so every node it creates has a distinct id.
 */
public class ScriptEngine {
  private static final String UNNAMED = "<script>";

  private final NodeFactory factory;
  private final CodeGenerator generator;

  public ScriptEngine() {
    this(GeneratorOptions.defaults());
  }

  public ScriptEngine(GeneratorOptions options) {
    this.factory = new NodeFactory(new NodeIdGenerator());
    this.generator = new CodeGenerator(options);
  }

  public NodeFactory factory() {
    return factory;
  }

  public ParseResult parse(String source) {
    return parse(source, Optional.empty());
  }

  public ParseResult parse(String source, Optional<String> fileIdentifier) {
    Preconditions.checkNotNull(source);
    return new StatementParser(factory, source, fileIdentifier).parse();
  }

  /**
   * Parses {@code source}, failing on the first sign of trouble instead of returning a
   * best-effort tree.
   */
  public Script parseStrict(String source, Optional<String> fileIdentifier)
      throws ScriptFormatException {
    ParseResult result = parse(source, fileIdentifier);
    if (result.hasDiagnostics()) {
      throw new ScriptFormatException(fileIdentifier.orElse(UNNAMED), result.diagnostics());
    }
    return result.script();
  }

  public String generate(Script script) {
    return generator.generate(script);
  }

  /** Parses and regenerates {@code source} in canonical form. */
  public String reformat(String source, Optional<String> fileIdentifier)
      throws ScriptFormatException {
    return generate(parseStrict(source, fileIdentifier));
  }

  /** Whether {@code script} survives generation and re-parsing unchanged and without problems. */
  public boolean roundTrips(Script script) {
    ParseResult reparsed = parse(generate(script));
    return !reparsed.hasDiagnostics()
        && ScriptEquivalence.equivalent(script, reparsed.script());
  }
}
