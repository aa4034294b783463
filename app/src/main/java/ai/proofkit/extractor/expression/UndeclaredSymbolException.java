package ai.proofkit.extractor.expression;

/**
 * An identifier in the expression has no entry in the supplied {@link SymbolTable}.
 */
public class UndeclaredSymbolException extends ExpressionParseException {

    private final String name;

    public UndeclaredSymbolException(String source, String name) {
        super(source, "Undeclared symbol '" + name + "' in: " + source);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
