package org.budgetanalyzer.fxrates.domain;

/** Direction of a rate series over its window. */
public enum Trend {
  UP(0, "up"),
  DOWN(1, "down"),
  FLAT(2, "flat");

  private final int code;
  private final String label;

  Trend(int code, String label) {
    this.code = code;
    this.label = label;
  }

  /** Numeric code used by existing clients: 0 = up, 1 = down, 2 = flat. */
  public int code() {
    return code;
  }

  public String label() {
    return label;
  }

  public static Trend fromCode(int code) {
    for (var trend : values()) {
      if (trend.code == code) {
        return trend;
      }
    }
    throw new IllegalArgumentException("Unknown trend code: " + code);
  }
}
