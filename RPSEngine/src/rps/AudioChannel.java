package rps;

import java.util.Arrays;
import java.util.Optional;

public enum AudioChannel {
  MUSIC,
  SOUND,
  VOICE;

  public String keyword() {
    return name().toLowerCase();
  }

  public static Optional<AudioChannel> fromKeyword(String keyword) {
    return Arrays.stream(values()).filter(c -> c.keyword().equals(keyword)).findFirst();
  }
}
