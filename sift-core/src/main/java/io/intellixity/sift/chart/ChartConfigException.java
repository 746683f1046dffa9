package io.intellixity.sift.chart;

/** The chart configuration cannot be rendered as given. */
public class ChartConfigException extends RuntimeException {
  public ChartConfigException(String message) {
    super(message);
  }

  public ChartConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
