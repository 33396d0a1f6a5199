package flowprobe.capture;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of one best-effort instrumentation query. "Unavailable" (the tool or trace
 * could not answer) is kept distinct from an available value of zero.
 */
public final class Observation<T> {
    private final T value;
    private final String reason;

    private Observation(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> Observation<T> available(T value) {
        return new Observation<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Observation<T> unavailable(String reason) {
        return new Observation<>(null, reason == null ? "unavailable" : reason);
    }

    public boolean isAvailable() { return reason == null; }

    /**
     * @throws IllegalStateException if unavailable
     */
    public T get() {
        if (!isAvailable()) throw new IllegalStateException("observation unavailable: " + reason);
        return value;
    }

    public T orElse(T fallback) {
        return isAvailable() ? value : fallback;
    }

    /** Empty string when available. */
    public String reason() {
        return reason == null ? "" : reason;
    }

    public <R> Observation<R> map(Function<? super T, ? extends R> fn) {
        if (!isAvailable()) return unavailable(reason);
        return available(fn.apply(value));
    }

    @Override
    public String toString() {
        return isAvailable() ? "available(" + value + ")" : "unavailable(" + reason + ")";
    }
}
