package com.finforecast.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final CauseCode causeCode;
    public final String owner;
    public final Map<String, Object> details;

    private Outcome(boolean success, T value, CauseCode causeCode, String owner, Map<String, Object> details) {
        this.success = success;
        this.value = value;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.owner = owner == null ? "" : owner;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> Outcome<T> success(T value, String owner) {
        return new Outcome<>(true, value, CauseCode.NONE, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner) {
        return new Outcome<>(false, null, causeCode, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner, Map<String, Object> details) {
        return new Outcome<>(false, null, causeCode, owner, copy(details));
    }

    /**
     * Re-types a failure so it can be returned from a caller with a different value type.
     */
    public <R> Outcome<R> propagate() {
        if (success) {
            throw new IllegalStateException("cannot propagate a successful outcome");
        }
        return new Outcome<>(false, null, causeCode, owner, details);
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (!success) {
            return propagate();
        }
        return new Outcome<>(true, mapper.apply(value), CauseCode.NONE, owner, details);
    }

    public T orElseThrow() {
        if (success) {
            return value;
        }
        throw new IllegalStateException(describe());
    }

    public String describe() {
        if (success) {
            return owner + ": ok";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(owner).append(": ").append(causeCode);
        if (!details.isEmpty()) {
            sb.append(' ').append(new LinkedHashMap<>(details));
        }
        return sb.toString();
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : in.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }
}
