package org.literalscan.astnode;

import org.literalscan.astvisitor.Visitor;

/**
 * The NumberNode class holds a numeric literal, either a 64-bit integer or a 64-bit
 * floating-point value. The range covers the literal including its sign.
 */
public class NumberNode extends AbstractNode {
    public final NumberKind kind;
    private final long longValue;
    private final double doubleValue;

    private NumberNode(NumberKind kind, long longValue, double doubleValue, int start, int end) {
        super(start, end);
        this.kind = kind;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
    }

    public static NumberNode ofInteger(long value, int start, int end) {
        return new NumberNode(NumberKind.INTEGER, value, 0, start, end);
    }

    public static NumberNode ofFloat(double value, int start, int end) {
        return new NumberNode(NumberKind.FLOAT, 0, value, start, end);
    }

    public boolean isInteger() {
        return kind == NumberKind.INTEGER;
    }

    /**
     * @throws IllegalStateException if the literal is a float
     */
    public long getLong() {
        if (kind != NumberKind.INTEGER) {
            throw new IllegalStateException("Not an integer literal: " + doubleValue);
        }
        return longValue;
    }

    /**
     * Returns the value as a double; integers are widened.
     */
    public double getDouble() {
        return kind == NumberKind.FLOAT ? doubleValue : (double) longValue;
    }

    public Number getValue() {
        return kind == NumberKind.FLOAT ? (Number) doubleValue : (Number) longValue;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
