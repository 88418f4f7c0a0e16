package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * Typed scalar literal. Every literal in the model has already been resolved to one
 * of the {@link Type} values; nothing downstream inspects string shapes.
 */
public class Literal extends ExpressionValue {

    public enum Type {
        STRING, INTEGER, REAL, BOOLEAN, NULL
    }

    public static final Literal NULL = new Literal(Type.NULL, null);

    private final Type type;
    private final Object value;

    private Literal(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Literal of(String value) {
        return new Literal(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static Literal of(long value) {
        return new Literal(Type.INTEGER, value);
    }

    public static Literal of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Real literal must be finite, got: " + value);
        }
        return new Literal(Type.REAL, value);
    }

    public static Literal of(boolean value) {
        return new Literal(Type.BOOLEAN, value);
    }

    public Type getType() {
        return type;
    }

    /**
     * The Java value: String, Long, Double, Boolean, or null for {@link Type#NULL}.
     */
    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public boolean isNumeric() {
        return type == Type.INTEGER || type == Type.REAL;
    }

    public String asString() {
        return (String) value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal other = (Literal) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING:
                return "\"" + value + "\"";
            case NULL:
                return "null";
            default:
                return String.valueOf(value);
        }
    }
}
