package com.finforecast.facts;

import java.util.Objects;

/**
 * Leaf value. {@code value} is a {@link Number}, {@link String}, {@link Boolean} or {@code null}.
 */
public final class ScalarNode implements FactNode {
    private static final ScalarNode NULL = new ScalarNode(null);

    public final Object value;

    private ScalarNode(Object value) {
        this.value = value;
    }

    public static ScalarNode of(Object value) {
        return value == null ? NULL : new ScalarNode(value);
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    @Override
    public <R> R accept(FactNodeVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScalarNode)) {
            return false;
        }
        return Objects.equals(value, ((ScalarNode) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
