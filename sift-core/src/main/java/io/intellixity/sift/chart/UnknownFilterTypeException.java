package io.intellixity.sift.chart;

public final class UnknownFilterTypeException extends ChartConfigException {
  private final String filterType;

  public UnknownFilterTypeException(String filterType) {
    super("Unknown filter type: " + filterType);
    this.filterType = filterType;
  }

  public String filterType() { return filterType; }
}
