package com.jmath.interpreting;

import com.jmath.exceptions.DomainException;
import com.jmath.exceptions.UndefinedVariableException;
import com.jmath.exceptions.UnknownConstantException;
import com.jmath.exceptions.UnknownFunctionException;
import com.jmath.exceptions.UnknownOperatorException;
import com.jmath.nodes.DepthLimit;
import com.jmath.nodes.Node;
import com.jmath.nodes.NodeVisitor;
import com.jmath.nodes.Operators;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Numeric evaluation of an expression tree in double precision.
 *
 * <pre>{@code
 * double y = Evaluator.evaluate(tree, Map.of("x", 1.3));
 * }</pre>
 */
public class Evaluator implements NodeVisitor<Double> {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private static final int MAX_FACTORIAL = 170;

    private final MutableMap<String, Double> variables;
    private final DepthLimit depthLimit;

    public Evaluator(Map<String, Double> variables) {
        this(variables, DepthLimit.DEFAULT_MAX_DEPTH);
    }

    public Evaluator(Map<String, Double> variables, int maxDepth) {
        this.variables = Maps.mutable.ofMap(variables);
        this.depthLimit = new DepthLimit(maxDepth);
    }

    public static double evaluate(Node node, Map<String, Double> variables) {
        return new Evaluator(variables).eval(node);
    }

    public void setVariables(Map<String, Double> variables) {
        this.variables.clear();
        this.variables.putAll(variables);
    }

    public double eval(Node node) {
        depthLimit.enter();
        try {
            return node.accept(this);
        } finally {
            depthLimit.exit();
        }
    }

    @Override
    public Double visitInteger(Node.IntegerNode node) {
        return (double) node.value();
    }

    @Override
    public Double visitNumber(Node.NumberNode node) {
        return node.value();
    }

    @Override
    public Double visitRational(Node.RationalNode node) {
        return node.doubleValue();
    }

    @Override
    public Double visitVariable(Node.VariableNode node) {
        Double value = variables.get(node.name());
        if (value == null) {
            throw new UndefinedVariableException(node.name());
        }
        return value;
    }

    @Override
    public Double visitConstant(Node.ConstantNode node) {
        return switch (node.name()) {
            case "pi" -> Math.PI;
            case "e" -> Math.E;
            case "NAN" -> Double.NaN;
            case "INF" -> Double.POSITIVE_INFINITY;
            default -> throw new UnknownConstantException(node.name());
        };
    }

    @Override
    public Double visitFunction(Node.FunctionNode node) {
        double x = eval(node.operand());

        return switch (node.name()) {
            case "sin" -> Math.sin(x);
            case "cos" -> Math.cos(x);
            case "tan" -> Math.tan(x);
            case "cot" -> 1 / Math.tan(x);

            case "arcsin" -> Math.asin(x);
            case "arccos" -> Math.acos(x);
            case "arctan" -> Math.atan(x);
            case "arccot" -> Math.PI / 2 - Math.atan(x);

            case "exp" -> Math.exp(x);
            case "log", "ln" -> Math.log(x);
            case "lg", "log10" -> Math.log10(x);
            case "sqrt" -> Math.sqrt(x);

            case "sinh" -> Math.sinh(x);
            case "cosh" -> Math.cosh(x);
            case "tanh" -> Math.tanh(x);
            case "coth" -> 1 / Math.tanh(x);

            case "arsinh" -> Math.log(x + Math.sqrt(x * x + 1));
            case "arcosh" -> Math.log(x + Math.sqrt(x * x - 1));
            case "artanh" -> 0.5 * Math.log((1 + x) / (1 - x));
            case "arcoth" -> 0.5 * Math.log((x + 1) / (x - 1));

            case "abs" -> Math.abs(x);
            case "sgn" -> Math.signum(x);
            case "ceil" -> Math.ceil(x);
            case "floor" -> Math.floor(x);
            case "round" -> (double) Math.round(x);

            default -> throw new UnknownFunctionException(node.name());
        };
    }

    @Override
    public Double visitSubExpression(Node.SubExpressionNode node) {
        return eval(node.inner());
    }

    @Override
    public Double visitExpression(Node.ExpressionNode node) {
        String operator = node.operator();
        if (!Operators.KNOWN.contains(operator)) {
            throw new UnknownOperatorException(operator);
        }

        double left = eval(node.left());
        if (node.isUnary()) {
            return switch (operator) {
                case Operators.MINUS -> -left;
                case Operators.FACTORIAL -> factorial(left);
                case Operators.SQUARE_ROOT -> Math.sqrt(left);
                default -> throw new UnknownOperatorException(operator);
            };
        }

        double right = eval(node.right());
        return switch (operator) {
            case Operators.PLUS -> left + right;
            case Operators.MINUS -> left - right;
            case Operators.TIMES -> left * right;
            case Operators.DIVIDE -> left / right;
            case Operators.POWER -> Math.pow(left, right);
            default -> throw new UnknownOperatorException(operator);
        };
    }

    private static double factorial(double x) {
        if (x < 0 || x != Math.rint(x)) {
            throw new DomainException("Factorial is only defined for non-negative integers, got " + x);
        }
        if (x > MAX_FACTORIAL) {
            log.debug("Factorial of {} overflows double", x);
            return Double.POSITIVE_INFINITY;
        }
        double result = 1;
        for (int i = 2; i <= (int) x; i++) {
            result *= i;
        }
        return result;
    }
}
