package io.intellixity.sift.chart;

import java.util.List;

/** A select/group-by list: either raw SQL text or structured items. */
public sealed interface SelectList permits SelectList.Raw, SelectList.Items {

  static SelectList raw(String sql) { return new Raw(sql); }

  static SelectList of(List<SelectItem> items) { return new Items(items); }

  static SelectList of(SelectItem... items) { return new Items(List.of(items)); }

  record Raw(String sql) implements SelectList {
    public Raw {
      sql = sql == null ? "" : sql;
    }
  }

  record Items(List<SelectItem> items) implements SelectList {
    public Items {
      items = items == null ? List.of() : List.copyOf(items);
    }
  }
}
