package ai.proofkit.extractor.expression;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Turns an {@code Algebra} parse tree into {@link SymbolicExpression} nodes, resolving identifiers through
 * the symbol table.
 */
class SymbolicExpressionBuilder extends AlgebraBaseVisitor<SymbolicExpression> {

    private final String source;
    private final SymbolTable symbolTable;

    SymbolicExpressionBuilder(String source, SymbolTable symbolTable) {
        this.source = source;
        this.symbolTable = Objects.requireNonNull(symbolTable, "symbolTable");
    }

    @Override
    public SymbolicExpression visitRelation(AlgebraParser.RelationContext ctx) {
        SymbolicExpression left = visit(ctx.lhs);
        if (ctx.rhs == null) {
            return left;
        }
        return new Equation(left, visit(ctx.rhs));
    }

    @Override
    public SymbolicExpression visitPower(AlgebraParser.PowerContext ctx) {
        return new BinaryOperation(BinaryOperation.Operator.POWER, visit(ctx.base), visit(ctx.exponent));
    }

    @Override
    public SymbolicExpression visitSign(AlgebraParser.SignContext ctx) {
        UnaryOperation.Operator operator = ctx.op.getType() == AlgebraParser.MINUS
                ? UnaryOperation.Operator.NEGATE
                : UnaryOperation.Operator.PLUS;
        return new UnaryOperation(operator, visit(ctx.operand));
    }

    @Override
    public SymbolicExpression visitProduct(AlgebraParser.ProductContext ctx) {
        BinaryOperation.Operator operator = ctx.op.getType() == AlgebraParser.STAR
                ? BinaryOperation.Operator.MULTIPLY
                : BinaryOperation.Operator.DIVIDE;
        return new BinaryOperation(operator, visit(ctx.left), visit(ctx.right));
    }

    @Override
    public SymbolicExpression visitSum(AlgebraParser.SumContext ctx) {
        BinaryOperation.Operator operator = ctx.op.getType() == AlgebraParser.PLUS
                ? BinaryOperation.Operator.ADD
                : BinaryOperation.Operator.SUBTRACT;
        return new BinaryOperation(operator, visit(ctx.left), visit(ctx.right));
    }

    @Override
    public SymbolicExpression visitGroup(AlgebraParser.GroupContext ctx) {
        return visit(ctx.inner);
    }

    @Override
    public SymbolicExpression visitNumber(AlgebraParser.NumberContext ctx) {
        return new Constant(new BigDecimal(ctx.NUMBER().getText()));
    }

    @Override
    public SymbolicExpression visitIdentifier(AlgebraParser.IdentifierContext ctx) {
        String name = ctx.IDENTIFIER().getText();
        Symbol symbol = symbolTable.lookup(name)
                .orElseThrow(() -> new UndeclaredSymbolException(source, name));
        return new SymbolReference(symbol);
    }
}
