package io.github.simbo1905.shape;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.github.simbo1905.shape.ShapeLogging.LOG;

/// Cancellation signal shared by one async decode or encode call.
///
/// Effectful predicates and transforms receive the token. They may poll
/// [#isCancelled()] or register a callback; any future they return is also
/// cancelled directly when the call is cancelled.
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  public boolean isCancelled() {
    return cancelled.get();
  }

  /// Runs `callback` on cancellation, or immediately when already cancelled.
  public void onCancel(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) {
      callback.run();
    }
  }

  /// Cancels every tracked future and runs the callbacks once.
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    LOG.fine(() -> "cancelling " + inFlight.size() + " in-flight effect(s)");
    for (CompletableFuture<?> future : inFlight) {
      future.cancel(true);
    }
    inFlight.clear();
    for (Runnable callback : callbacks) {
      if (callbacks.remove(callback)) {
        callback.run();
      }
    }
  }

  <T> CompletableFuture<T> track(CompletableFuture<T> future) {
    if (cancelled.get()) {
      future.cancel(true);
      return future;
    }
    inFlight.add(future);
    future.whenComplete((value, error) -> inFlight.remove(future));
    if (cancelled.get()) {
      future.cancel(true);
    }
    return future;
  }
}
