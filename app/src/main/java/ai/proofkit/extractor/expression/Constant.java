package ai.proofkit.extractor.expression;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

public record Constant(BigDecimal value) implements SymbolicExpression {

    public Constant {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public SortedSet<String> freeSymbols() {
        return Collections.unmodifiableSortedSet(new TreeSet<>());
    }

    @Override
    public String render() {
        return value.stripTrailingZeros().toPlainString();
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }
}
