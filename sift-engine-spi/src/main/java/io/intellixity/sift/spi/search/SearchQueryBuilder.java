package io.intellixity.sift.spi.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** Combines a search query with extra SQL conditions into one WHERE fragment. */
public final class SearchQueryBuilder {
  private final String searchQuery;
  private final AbstractSearchSerializer serializer;
  private final List<String> conditions = new ArrayList<>();

  public SearchQueryBuilder(String searchQuery, AbstractSearchSerializer serializer) {
    this.searchQuery = searchQuery;
    this.serializer = Objects.requireNonNull(serializer, "serializer");
  }

  public SearchQueryBuilder and(String condition) {
    if (condition != null && !condition.isBlank()) conditions.add(condition);
    return this;
  }

  /** Each condition is parenthesized; the search query comes last. Empty when there is nothing to filter. */
  public CompletableFuture<String> build() {
    return serializer.serialize(searchQuery).thenApply(search -> {
      List<String> all = new ArrayList<>(conditions);
      if (search != null && !search.isBlank()) all.add(search);
      List<String> wrapped = new ArrayList<>(all.size());
      for (String c : all) wrapped.add("(" + c + ")");
      return String.join(" AND ", wrapped);
    });
  }
}
