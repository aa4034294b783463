package ai.proofkit.extractor.expression;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

public record BinaryOperation(Operator operator, SymbolicExpression left, SymbolicExpression right)
        implements SymbolicExpression {

    public enum Operator {
        ADD(" + ", Precedence.SUM),
        SUBTRACT(" - ", Precedence.SUM),
        MULTIPLY("*", Precedence.PRODUCT),
        DIVIDE("/", Precedence.PRODUCT),
        POWER("^", Precedence.POWER);

        private final String separator;
        private final int precedence;

        Operator(String separator, int precedence) {
            this.separator = separator;
            this.precedence = precedence;
        }

        public String separator() {
            return separator;
        }

        public int precedence() {
            return precedence;
        }

        boolean rightAssociative() {
            return this == POWER;
        }

        /**
         * Whether {@code a op (b op' c)} differs from {@code a op b op' c} for operators of equal precedence.
         */
        boolean needsGroupedRightOperand() {
            return this == SUBTRACT || this == DIVIDE;
        }
    }

    public BinaryOperation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public SortedSet<String> freeSymbols() {
        TreeSet<String> symbols = new TreeSet<>(left.freeSymbols());
        symbols.addAll(right.freeSymbols());
        return Collections.unmodifiableSortedSet(symbols);
    }

    @Override
    public String render() {
        int own = operator.precedence();
        boolean groupLeft = operator.rightAssociative() ? left.precedence() <= own : left.precedence() < own;
        boolean groupRight;
        if (operator.rightAssociative()) {
            groupRight = right.precedence() < own;
        } else {
            groupRight = right.precedence() < own
                    || (right.precedence() == own && operator.needsGroupedRightOperand());
        }
        return Precedence.wrap(left, groupLeft) + operator.separator() + Precedence.wrap(right, groupRight);
    }

    @Override
    public int precedence() {
        return operator.precedence();
    }
}
