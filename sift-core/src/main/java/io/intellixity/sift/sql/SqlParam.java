package io.intellixity.sift.sql;

import java.util.Objects;

public record SqlParam(SqlParamType type, Object value) {
  public SqlParam {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
  }

  /** Literal SQL for this value, used when inlining parameters for display. */
  public String inline() {
    return switch (type) {
      case IDENTIFIER -> SqlStrings.quoteIdentifier(String.valueOf(value));
      case STRING -> SqlStrings.quote(String.valueOf(value));
      case INT32, INT64, FLOAT64 -> String.valueOf(value);
    };
  }
}
