package com.openforge.ariste.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.ariste.llm.model.ToolDefinition;
import com.openforge.ariste.tool.AgentTool;
import com.openforge.ariste.tool.ToolArguments;
import com.openforge.ariste.tool.ToolExecutionException;
import com.openforge.ariste.tool.ToolSchemas;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates + - * / over decimal literals, with * and / binding tighter.
 * No parentheses and no unary minus.
 */
public class CalculatorTool implements AgentTool {

    private static final ToolDefinition DEFINITION = ToolSchemas.define(
            "calculator",
            "Perform basic mathematical calculations (+, -, *, /)",
            """
            {
              "type": "object",
              "properties": {
                "expression": {
                  "type": "string",
                  "description": "Mathematical expression to evaluate (e.g., '2 + 3', '10 * 5', '100 / 4')"
                }
              },
              "required": ["expression"]
            }
            """);

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public String execute(JsonNode arguments) throws ToolExecutionException {
        String expression = ToolArguments.requireString(arguments, "expression");
        try {
            return format(evaluate(expression));
        } catch (IllegalArgumentException e) {
            throw new ToolExecutionException("Evaluation error: " + e.getMessage(), e);
        }
    }

    /** "4" for 4.0, "2.5" for 2.5. */
    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static double evaluate(String expression) {
        String expr = expression.replace(" ", "");
        if (expr.isEmpty()) {
            throw new IllegalArgumentException("Empty expression");
        }

        List<Double>    numbers   = new ArrayList<>();
        List<Character> operators = new ArrayList<>();
        tokenize(expr, numbers, operators);
        if (numbers.size() != operators.size() + 1) {
            throw new IllegalArgumentException("Invalid expression");
        }

        // First pass: * and /, folded into the left operand.
        List<Double>    terms = new ArrayList<>();
        List<Character> additive = new ArrayList<>();
        double current = numbers.get(0);
        for (int i = 0; i < operators.size(); i++) {
            char   op    = operators.get(i);
            double right = numbers.get(i + 1);
            switch (op) {
                case '*' -> current *= right;
                case '/' -> {
                    if (right == 0.0) throw new IllegalArgumentException("Division by zero");
                    current /= right;
                }
                default -> {
                    terms.add(current);
                    additive.add(op);
                    current = right;
                }
            }
        }
        terms.add(current);

        // Second pass: + and -, left to right.
        double result = terms.get(0);
        for (int i = 0; i < additive.size(); i++) {
            result = additive.get(i) == '+' ? result + terms.get(i + 1) : result - terms.get(i + 1);
        }
        return result;
    }

    private static void tokenize(String expr, List<Double> numbers, List<Character> operators) {
        StringBuilder number = new StringBuilder();
        boolean expectNumber = true;
        for (char ch : expr.toCharArray()) {
            if (Character.isDigit(ch) || ch == '.') {
                number.append(ch);
                expectNumber = false;
            } else if (ch == '+' || ch == '-' || ch == '*' || ch == '/') {
                if (expectNumber) {
                    throw new IllegalArgumentException("Invalid expression");
                }
                numbers.add(parse(number));
                number.setLength(0);
                operators.add(ch);
                expectNumber = true;
            } else {
                throw new IllegalArgumentException("Invalid character: " + ch);
            }
        }
        if (expectNumber) {
            throw new IllegalArgumentException("Invalid expression");
        }
        numbers.add(parse(number));
    }

    private static double parse(StringBuilder number) {
        try {
            return Double.parseDouble(number.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number: " + number, e);
        }
    }
}
