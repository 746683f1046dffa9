package io.intellixity.sift.spi.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class Futures {
  private Futures() {}

  /** Completes with the results in input order once every future has completed. */
  public static <T> CompletableFuture<List<T>> allOf(List<CompletableFuture<T>> futures) {
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
        .thenApply(v -> {
          List<T> out = new ArrayList<>(futures.size());
          for (CompletableFuture<T> f : futures) out.add(f.join());
          return out;
        });
  }

  /** Blocks for the result, rethrowing the original unchecked failure instead of a CompletionException. */
  public static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw e;
    }
  }
}
