package io.intellixity.sift.spi.sql;

import io.intellixity.sift.util.SiftFactoriesLoader;

import java.util.List;

/** Looks up dialects registered in {@code META-INF/sift.factories}. */
public final class Dialects {
  private Dialects() {}

  public static List<Dialect> all() {
    return SiftFactoriesLoader.load(Dialect.class);
  }

  public static Dialect byId(String id) {
    for (Dialect d : all()) {
      if (d.id().equalsIgnoreCase(id)) return d;
    }
    throw new IllegalArgumentException("No dialect registered for id: " + id);
  }
}
