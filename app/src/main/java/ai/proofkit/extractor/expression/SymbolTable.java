package ai.proofkit.extractor.expression;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from names to the symbols an expression may reference. Names missing from the table
 * are rejected by the parser.
 */
public final class SymbolTable {

    private static final SymbolTable EMPTY = new SymbolTable(Map.of());

    private final Map<String, Symbol> symbols;

    private SymbolTable(Map<String, Symbol> symbols) {
        this.symbols = symbols;
    }

    public static SymbolTable empty() {
        return EMPTY;
    }

    public static SymbolTable of(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return EMPTY;
        }
        Map<String, Symbol> symbols = new LinkedHashMap<>();
        for (String name : names) {
            symbols.computeIfAbsent(name, Symbol::new);
        }
        return new SymbolTable(Collections.unmodifiableMap(symbols));
    }

    public Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public String toString() {
        return "SymbolTable" + symbols.keySet();
    }
}
