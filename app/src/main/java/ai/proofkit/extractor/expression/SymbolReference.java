package ai.proofkit.extractor.expression;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

public record SymbolReference(Symbol symbol) implements SymbolicExpression {

    public SymbolReference {
        Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public SortedSet<String> freeSymbols() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(Collections.singleton(symbol.name())));
    }

    @Override
    public String render() {
        return symbol.name();
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }
}
