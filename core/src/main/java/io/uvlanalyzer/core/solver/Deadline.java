package io.uvlanalyzer.core.solver;

import io.uvlanalyzer.core.error.AnalysisTimeoutException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wall-clock budget plus cancellation flag for one analysis. Search loops call
 * {@link #check()} between steps; solver calls are additionally bounded by
 * {@link #remainingMillis()}.
 *
 * <p>
 * Thread-safe: {@link #cancel()} may be called from any thread. Long-running solver calls
 * register a hook through {@link #onCancel(Runnable)} so cancellation interrupts them.
 */
public final class Deadline {

    private final long startNanos;
    private final long budgetMillis;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Runnable> cancelHooks = ConcurrentHashMap.newKeySet();

    private Deadline(long budgetMillis) {
        this.startNanos = System.nanoTime();
        this.budgetMillis = budgetMillis;
    }

    /**
     * Starts a deadline that expires {@code budgetMillis} from now.
     *
     * @throws IllegalArgumentException if the budget is not positive
     */
    public static Deadline of(long budgetMillis) {
        if (budgetMillis <= 0) {
            throw new IllegalArgumentException("budgetMillis must be positive, got: " + budgetMillis);
        }
        return new Deadline(budgetMillis);
    }

    /** A deadline that never expires but can still be cancelled. */
    public static Deadline unbounded() {
        return new Deadline(Long.MAX_VALUE);
    }

    public long budgetMillis() {
        return budgetMillis;
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /** Milliseconds left, never negative. */
    public long remainingMillis() {
        return Math.max(0, budgetMillis - elapsedMillis());
    }

    public boolean isExpired() {
        return cancelled.get() || elapsedMillis() >= budgetMillis;
    }

    /** Requests that the running analysis stop, interrupting any registered solver call. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancelHooks.forEach(Runnable::run);
        }
    }

    /**
     * Registers a hook run once when this deadline is cancelled. A hook registered after
     * cancellation is not run; callers re-check {@link #isCancelled()} after registering.
     *
     * @return an action that unregisters the hook
     */
    Runnable onCancel(Runnable hook) {
        cancelHooks.add(hook);
        return () -> cancelHooks.remove(hook);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws if the deadline has passed or the analysis was cancelled.
     *
     * @throws AnalysisTimeoutException on expiry or cancellation
     */
    public void check() {
        if (isExpired()) {
            throw timeout(null);
        }
    }

    /** Builds the timeout error for this deadline, optionally wrapping a solver-level cause. */
    AnalysisTimeoutException timeout(Throwable cause) {
        String message = cancelled.get()
                ? "Analysis was cancelled after " + elapsedMillis() + " ms"
                : "Analysis exceeded its time budget of " + budgetMillis + " ms";
        return cause != null
                ? new AnalysisTimeoutException(message, cause, budgetMillis, null)
                : new AnalysisTimeoutException(message, budgetMillis, null);
    }
}
