package ed.inf.adbs.pivotgrid;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.expression.operators.relational.NotEqualsTo;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The AxisFilterParser turns a filter condition written in SQL WHERE syntax
 * into accepted value sets, one per dimension.
 * Only conjunctions of membership tests are understood:
 * <pre>
 *   region IN ('north', 'south') AND quarter = 3
 * </pre>
 * Integer literals become {@code Integer} values when they fit, string literals
 * become {@code String}s. A dimension constrained twice keeps the intersection
 * of both sets. Any other construct is rejected.
 */
public class AxisFilterParser extends ExpressionVisitorAdapter {

    private final Map<String, Set<Object>> accepted = new LinkedHashMap<>();

    /**
     * Parse a filter condition.
     * @param condition The condition text.
     * @return Accepted values keyed by dimension id, in order of first mention.
     * @throws IllegalArgumentException if the text cannot be parsed or uses an unsupported construct.
     */
    public static Map<String, Set<Object>> parse(String condition) {
        Expression expression;
        try {
            expression = CCJSqlParserUtil.parseCondExpression(condition, false);
        } catch (JSQLParserException e) {
            throw new IllegalArgumentException("Cannot parse filter condition '" + condition + "'", e);
        }
        AxisFilterParser parser = new AxisFilterParser();
        expression.accept(parser);
        return parser.accepted;
    }

    @Override
    public void visit(AndExpression andExpression) {
        andExpression.getLeftExpression().accept(this);
        andExpression.getRightExpression().accept(this);
    }

    @Override
    public void visit(EqualsTo equalsTo) {
        String dimension = dimensionOf(equalsTo.getLeftExpression());
        Set<Object> values = new LinkedHashSet<>();
        values.add(literalOf(equalsTo.getRightExpression()));
        constrain(dimension, values);
    }

    @Override
    public void visit(InExpression inExpression) {
        if (inExpression.isNot()) {
            throw unsupported("NOT IN");
        }
        String dimension = dimensionOf(inExpression.getLeftExpression());
        Expression right = inExpression.getRightExpression();
        Set<Object> values = new LinkedHashSet<>();
        if (right instanceof ExpressionList) {
            for (Object item : (ExpressionList<?>) right) {
                values.add(literalOf((Expression) item));
            }
        } else {
            values.add(literalOf(right));
        }
        constrain(dimension, values);
    }

    @Override
    public void visit(OrExpression orExpression) {
        throw unsupported("OR");
    }

    @Override
    public void visit(NotEqualsTo notEqualsTo) {
        throw unsupported(notEqualsTo.getStringExpression());
    }

    @Override
    public void visit(GreaterThan greaterThan) {
        throw unsupported(greaterThan.getStringExpression());
    }

    @Override
    public void visit(GreaterThanEquals greaterThanEquals) {
        throw unsupported(greaterThanEquals.getStringExpression());
    }

    @Override
    public void visit(MinorThan minorThan) {
        throw unsupported(minorThan.getStringExpression());
    }

    @Override
    public void visit(MinorThanEquals minorThanEquals) {
        throw unsupported(minorThanEquals.getStringExpression());
    }

    @Override
    public void visit(Column column) {
        throw unsupported("bare column " + column.getColumnName());
    }

    private void constrain(String dimension, Set<Object> values) {
        Set<Object> current = accepted.get(dimension);
        if (current == null) {
            accepted.put(dimension, values);
        } else {
            current.retainAll(values);
        }
    }

    private static String dimensionOf(Expression expression) {
        if (!(expression instanceof Column)) {
            throw new IllegalArgumentException("Expected a dimension name but got '" + expression + "'");
        }
        return ((Column) expression).getColumnName();
    }

    private static Object literalOf(Expression expression) {
        if (expression instanceof Parenthesis) {
            return literalOf(((Parenthesis) expression).getExpression());
        }
        if (expression instanceof LongValue) {
            long value = ((LongValue) expression).getValue();
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        }
        if (expression instanceof StringValue) {
            return ((StringValue) expression).getValue();
        }
        if (expression instanceof DoubleValue) {
            return ((DoubleValue) expression).getValue();
        }
        if (expression instanceof SignedExpression && ((SignedExpression) expression).getSign() == '-') {
            Object inner = literalOf(((SignedExpression) expression).getExpression());
            if (inner instanceof Integer) {
                return -(Integer) inner;
            }
            if (inner instanceof Long) {
                return -(Long) inner;
            }
            if (inner instanceof Double) {
                return -(Double) inner;
            }
        }
        throw new IllegalArgumentException("Expected a literal value but got '" + expression + "'");
    }

    private static IllegalArgumentException unsupported(String construct) {
        return new IllegalArgumentException("Unsupported construct in filter condition: " + construct);
    }
}
