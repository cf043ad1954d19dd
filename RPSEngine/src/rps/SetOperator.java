package rps;

import java.util.Arrays;
import java.util.Optional;

public enum SetOperator {
  ASSIGN("="),
  ADD("+="),
  SUBTRACT("-="),
  MULTIPLY("*="),
  DIVIDE("/=");

  private final String symbol;

  SetOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public static Optional<SetOperator> fromSymbol(String symbol) {
    return Arrays.stream(values()).filter(o -> o.symbol.equals(symbol)).findFirst();
  }
}
