/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.parse;

import com.helios.rulelang.compiler.DottedNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a formula into tokens.
 *
 * <p>Formulas are word based: operators must be surrounded by whitespace, which lets rule
 * names contain spaces, dashes and digits. Consecutive words that are neither operators nor
 * leading numbers form a single {@link FormulaToken.Type#NAME} token, e.g.
 * {@code contract . gross pay} in {@code contract . gross pay * 10%}.
 */
public final class FormulaLexer {

    static final Set<String> OPERATORS = Set.of("+", "-", "*", "/", "<", "<=", ">", ">=", "=", "!=");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern PERCENT = Pattern.compile("-?\\d+(\\.\\d+)?%");

    private final String source;
    private final List<FormulaToken> tokens = new ArrayList<>();
    private int pos = 0;

    private final List<String> nameWords = new ArrayList<>();
    private int nameStart = -1;

    public FormulaLexer(String source) {
        this.source = source;
    }

    /**
     * @throws FormulaSyntaxException on an unterminated string literal
     */
    public List<FormulaToken> tokenize() {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            char c = source.charAt(pos);
            switch (c) {
                case '(' -> {
                    flushName();
                    tokens.add(new FormulaToken(FormulaToken.Type.LEFT_PAREN, "(", pos++));
                }
                case ')' -> {
                    flushName();
                    tokens.add(new FormulaToken(FormulaToken.Type.RIGHT_PAREN, ")", pos++));
                }
                case '\'', '"' -> {
                    flushName();
                    readString(c);
                }
                default -> readWord();
            }
        }
        flushName();
        tokens.add(new FormulaToken(FormulaToken.Type.END, "", pos));
        return tokens;
    }

    private void readWord() {
        int start = pos;
        while (!isAtEnd() && !Character.isWhitespace(source.charAt(pos))
                && source.charAt(pos) != '(' && source.charAt(pos) != ')') {
            pos++;
        }
        String word = source.substring(start, pos);

        if (OPERATORS.contains(word)) {
            flushName();
            tokens.add(new FormulaToken(FormulaToken.Type.OPERATOR, word, start));
        } else if (nameWords.isEmpty() && PERCENT.matcher(word).matches()) {
            tokens.add(new FormulaToken(FormulaToken.Type.PERCENT, word.substring(0, word.length() - 1), start));
        } else if (nameWords.isEmpty() && NUMBER.matcher(word).matches()) {
            tokens.add(new FormulaToken(FormulaToken.Type.NUMBER, word, start));
        } else if (nameWords.isEmpty() && word.length() > 1 && word.charAt(0) == '-') {
            // unary minus glued to a name
            tokens.add(new FormulaToken(FormulaToken.Type.OPERATOR, "-", start));
            nameStart = start + 1;
            nameWords.add(word.substring(1));
        } else {
            if (nameWords.isEmpty()) {
                nameStart = start;
            }
            nameWords.add(word);
        }
    }

    private void readString(char quote) {
        int start = pos++;
        int end = source.indexOf(quote, pos);
        if (end < 0) {
            throw new FormulaSyntaxException(source, start, "unterminated string literal");
        }
        tokens.add(new FormulaToken(FormulaToken.Type.STRING, source.substring(pos, end), start));
        pos = end + 1;
    }

    private void flushName() {
        if (nameWords.isEmpty()) {
            return;
        }
        String name = DottedNames.normalize(String.join(" ", nameWords));
        tokens.add(new FormulaToken(FormulaToken.Type.NAME, name, nameStart));
        nameWords.clear();
        nameStart = -1;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }
}
