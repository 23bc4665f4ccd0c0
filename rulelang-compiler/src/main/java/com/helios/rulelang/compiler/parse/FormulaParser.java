/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.parse;

import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.NodeMeta;
import com.helios.rulelang.api.ast.Operation;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.UnitAnnotation;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Recursive-descent parser for inline formulas.
 *
 * <pre>
 * comparison     := additive ( ("&lt;" | "&lt;=" | "&gt;" | "&gt;=" | "=" | "!=") additive )?
 * additive       := multiplicative ( ("+" | "-") multiplicative )*
 * multiplicative := unary ( ("*" | "/") unary )*
 * unary          := "-" unary | primary
 * primary        := NUMBER | PERCENT | STRING | NAME | "(" comparison ")"
 * </pre>
 *
 * Binary operators are left-associative. Unary minus is rewritten to {@code 0 - operand}.
 * A name is a reference, except the literals {@code true}/{@code yes}, {@code false}/{@code no}
 * and {@code null}.
 */
public final class FormulaParser {

    private final String formula;
    private final NodeMeta meta;
    private final UnaryOperator<String> unitKey;

    private List<FormulaToken> tokens;
    private int pos;

    /**
     * @param formula formula text
     * @param meta    metadata given to every produced node
     * @param unitKey maps unit labels (such as {@code %}) to the caller's unit keys
     */
    public FormulaParser(String formula, NodeMeta meta, UnaryOperator<String> unitKey) {
        this.formula = formula;
        this.meta = meta;
        this.unitKey = unitKey;
    }

    /**
     * @throws FormulaSyntaxException if the formula is empty or malformed
     */
    public ASTNode parse() {
        tokens = new FormulaLexer(formula).tokenize();
        pos = 0;
        if (check(FormulaToken.Type.END)) {
            throw new FormulaSyntaxException(formula, 0, "empty formula");
        }
        ASTNode expression = parseComparison();
        if (!check(FormulaToken.Type.END)) {
            throw error(peek(), "unexpected '" + peek().text() + "'");
        }
        return expression;
    }

    private ASTNode parseComparison() {
        ASTNode left = parseAdditive();
        if (peek().is(FormulaToken.Type.OPERATOR)) {
            Operation.Operator operator = Operation.Operator.fromSymbol(peek().text());
            if (isComparison(operator)) {
                advance();
                ASTNode right = parseAdditive();
                return new Operation(operator, left, right, meta);
            }
        }
        return left;
    }

    private ASTNode parseAdditive() {
        ASTNode left = parseMultiplicative();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            Operation.Operator operator = Operation.Operator.fromSymbol(advance().text());
            ASTNode right = parseMultiplicative();
            left = new Operation(operator, left, right, meta);
        }
        return left;
    }

    private ASTNode parseMultiplicative() {
        ASTNode left = parseUnary();
        while (peek().isOperator("*") || peek().isOperator("/")) {
            Operation.Operator operator = Operation.Operator.fromSymbol(advance().text());
            ASTNode right = parseUnary();
            left = new Operation(operator, left, right, meta);
        }
        return left;
    }

    private ASTNode parseUnary() {
        if (peek().isOperator("-")) {
            advance();
            ASTNode operand = parseUnary();
            return new Operation(Operation.Operator.SUBTRACT, Constant.number(0, meta), operand, meta);
        }
        return parsePrimary();
    }

    private ASTNode parsePrimary() {
        FormulaToken token = advance();
        switch (token.type()) {
            case NUMBER:
                return Constant.number(Double.parseDouble(token.text()), meta);
            case PERCENT:
                return new UnitAnnotation(unitKey.apply("%"), Constant.number(Double.parseDouble(token.text()), meta), meta);
            case STRING:
                return Constant.string(token.text(), meta);
            case NAME:
                return nameOrLiteral(token.text());
            case LEFT_PAREN:
                ASTNode inner = parseComparison();
                if (!check(FormulaToken.Type.RIGHT_PAREN)) {
                    throw error(peek(), "expected ')'");
                }
                advance();
                return inner;
            case END:
                throw error(token, "unexpected end of formula");
            default:
                throw error(token, "unexpected '" + token.text() + "'");
        }
    }

    private ASTNode nameOrLiteral(String name) {
        switch (name) {
            case "true":
            case "yes":
                return Constant.bool(true, meta);
            case "false":
            case "no":
                return Constant.bool(false, meta);
            case "null":
                return Constant.none(meta);
            default:
                return Reference.to(name, meta);
        }
    }

    private static boolean isComparison(Operation.Operator operator) {
        if (operator == null) {
            return false;
        }
        switch (operator) {
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
            case EQUAL_TO:
            case NOT_EQUAL_TO:
                return true;
            default:
                return false;
        }
    }

    private boolean check(FormulaToken.Type type) {
        return peek().is(type);
    }

    private FormulaToken advance() {
        FormulaToken token = tokens.get(pos);
        if (!token.is(FormulaToken.Type.END)) {
            pos++;
        }
        return token;
    }

    private FormulaToken peek() {
        return tokens.get(pos);
    }

    private FormulaSyntaxException error(FormulaToken at, String message) {
        return new FormulaSyntaxException(formula, at.position(), message);
    }
}
