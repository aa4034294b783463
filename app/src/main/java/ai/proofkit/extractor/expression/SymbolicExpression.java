package ai.proofkit.extractor.expression;

import java.util.SortedSet;

/**
 * Node of a parsed algebraic expression.
 */
public interface SymbolicExpression {

    /**
     * Names of the symbols occurring in this expression, sorted.
     */
    SortedSet<String> freeSymbols();

    /**
     * Canonical textual form with minimal parentheses.
     */
    String render();

    /**
     * Binding strength used by {@link #render()}; higher binds tighter.
     */
    int precedence();
}
