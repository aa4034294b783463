package ai.proofkit.extractor.expression;

final class Precedence {

    static final int RELATION = 0;
    static final int SUM = 1;
    static final int PRODUCT = 2;
    static final int SIGN = 3;
    static final int POWER = 4;
    static final int ATOM = 5;

    private Precedence() {
    }

    static String wrap(SymbolicExpression expression, boolean parenthesize) {
        String rendered = expression.render();
        return parenthesize ? "(" + rendered + ")" : rendered;
    }
}
