package ai.proofkit.extractor.expression;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Equality between two expressions.
 */
public record Equation(SymbolicExpression left, SymbolicExpression right) implements SymbolicExpression {

    public Equation {
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
        return left.render() + " = " + right.render();
    }

    @Override
    public int precedence() {
        return Precedence.RELATION;
    }
}
