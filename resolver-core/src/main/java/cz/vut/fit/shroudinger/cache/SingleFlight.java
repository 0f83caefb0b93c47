package cz.vut.fit.shroudinger.cache;

import cz.vut.fit.shroudinger.errors.ResolutionFailureException;
import cz.vut.fit.shroudinger.errors.ResolutionTimeoutException;
import cz.vut.fit.shroudinger.errors.ShroudingerException;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.*;

/**
 * Coalesces concurrent calls for the same key: the first caller (the leader) runs the loader, every caller that
 * arrives while it runs waits for the leader's outcome instead of running the loader again. Waiters give up when
 * their own deadline expires; the leader always runs to completion.
 *
 * @param <K> The key type.
 * @param <V> The value type.
 */
public class SingleFlight<K, V> {
    @FunctionalInterface
    public interface Loader<V> {
        V load() throws ShroudingerException;
    }

    private final ConcurrentMap<K, CompletableFuture<V>> _inFlight = new ConcurrentHashMap<>();

    /**
     * Runs the loader for the key unless an identical call is already in flight.
     *
     * @param key           The call key.
     * @param loader        The loader to run if this caller becomes the leader.
     * @param timeoutNanos  How long a waiter may wait for the leader.
     * @return The value produced by the leader.
     * @throws ShroudingerException the exception of the loader, or a {@link ResolutionTimeoutException} if a
     *                              waiter's deadline expired.
     */
    public V execute(@NotNull K key, @NotNull Loader<V> loader, long timeoutNanos) throws ShroudingerException {
        var call = new CompletableFuture<V>();
        var existing = _inFlight.putIfAbsent(key, call);
        if (existing != null)
            return await(existing, timeoutNanos);

        try {
            var value = loader.load();
            call.complete(value);
            return value;
        } catch (Throwable t) {
            call.completeExceptionally(t);
            throw t;
        } finally {
            _inFlight.remove(key, call);
        }
    }

    /**
     * @return The number of calls currently in flight.
     */
    public int inFlight() {
        return _inFlight.size();
    }

    private V await(CompletableFuture<V> call, long timeoutNanos) throws ShroudingerException {
        try {
            return call.get(Math.max(0, timeoutNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new ResolutionTimeoutException("Deadline expired while waiting for an identical query");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionFailureException("Interrupted while waiting for an identical query");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof ShroudingerException se)
                throw se;
            if (cause instanceof RuntimeException re)
                throw re;
            throw new ResolutionFailureException("Identical query failed", cause);
        }
    }
}
