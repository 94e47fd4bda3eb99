/*
 * どこで: Common 並行処理
 * 何を: 同じキーで同時に要求された処理を 1 回の実行にまとめ、結果を全呼び出し元で共有する
 * なぜ: ほぼ同時の重複リクエストが下流へ二重の更新呼び出しを出さないようにするため
 */
package com.dealdesk.common.concurrent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent calls that share a key into a single execution.
 *
 * <p>The first caller for a key runs the computation on its own thread; callers arriving while
 * it is in flight block on the same future and receive the same result or the same exception
 * instance. The key is released as soon as the computation settles, so a later call runs again.
 * Coalescing is process-local and best-effort.
 */
public class InFlightCoalescer {

  private final ConcurrentMap<String, CompletableFuture<Object>> inFlight =
      new ConcurrentHashMap<>();

  public <T> T run(String key, Supplier<T> computation) {
    final CompletableFuture<Object> ticket = new CompletableFuture<>();
    final CompletableFuture<Object> existing = inFlight.putIfAbsent(key, ticket);
    if (existing != null) {
      return await(existing);
    }
    final T result;
    try {
      result = computation.get();
    } catch (RuntimeException | Error ex) {
      // 待機者より先にキーを外し、次の呼び出しが新しい実行を始められるようにする
      inFlight.remove(key, ticket);
      ticket.completeExceptionally(ex);
      throw ex;
    }
    inFlight.remove(key, ticket);
    ticket.complete(result);
    return result;
  }

  public boolean isInFlight(String key) {
    return inFlight.containsKey(key);
  }

  private <T> T await(CompletableFuture<Object> shared) {
    try {
      // 同じキーの実行は同じ型を返す
      return (T) shared.join();
    } catch (CompletionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw ex;
    }
  }
}
