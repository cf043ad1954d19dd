package rps;

import java.util.Arrays;
import java.util.Optional;

public enum NvlAction {
  SHOW,
  HIDE,
  CLEAR;

  public String keyword() {
    return name().toLowerCase();
  }

  public static Optional<NvlAction> fromKeyword(String keyword) {
    return Arrays.stream(values()).filter(a -> a.keyword().equals(keyword)).findFirst();
  }
}
