package com.asiainfo.pivot.core.parser;

import com.asiainfo.pivot.core.exception.FormulaCompileException;

/**
 * 派生指标公式的递归下降解析器
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/') unary)*
 * unary   := '-' unary | primary
 * primary := NUMBER | '{' IDENT '}' | '(' expr ')'
 * </pre>
 */
public class FormulaParser {

    private final String metricId;
    private final String source;
    private int pos;

    private FormulaParser(String metricId, String source) {
        this.metricId = metricId;
        this.source = source;
    }

    public static Expr parse(String metricId, String formula) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaCompileException(metricId, "formula is empty");
        }
        FormulaParser parser = new FormulaParser(metricId, formula);
        Expr expr = parser.expr();
        parser.skipWhitespace();
        if (parser.pos < formula.length()) {
            throw parser.error("unexpected character '" + formula.charAt(parser.pos) + "'");
        }
        return expr;
    }

    private Expr expr() {
        Expr left = term();
        while (true) {
            skipWhitespace();
            if (peek('+') || peek('-')) {
                Expr.Operator op = Expr.Operator.of(source.charAt(pos++));
                left = new Expr.BinaryOp(op, left, term());
            } else {
                return left;
            }
        }
    }

    private Expr term() {
        Expr left = unary();
        while (true) {
            skipWhitespace();
            if (peek('*') || peek('/')) {
                Expr.Operator op = Expr.Operator.of(source.charAt(pos++));
                left = new Expr.BinaryOp(op, left, unary());
            } else {
                return left;
            }
        }
    }

    private Expr unary() {
        skipWhitespace();
        if (peek('-')) {
            pos++;
            return new Expr.Negate(unary());
        }
        return primary();
    }

    private Expr primary() {
        skipWhitespace();
        if (pos >= source.length()) {
            throw error("unexpected end of formula");
        }
        char c = source.charAt(pos);
        if (c == '(') {
            pos++;
            Expr inner = expr();
            skipWhitespace();
            expect(')');
            return inner;
        }
        if (c == '{') {
            pos++;
            int start = pos;
            while (pos < source.length() && isIdentChar(source.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw error("empty metric reference");
            }
            String ref = source.substring(start, pos);
            expect('}');
            return new Expr.Ref(ref);
        }
        if (Character.isDigit(c) || c == '.') {
            int start = pos;
            while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
                pos++;
            }
            try {
                return new Expr.Literal(Double.parseDouble(source.substring(start, pos)));
            } catch (NumberFormatException e) {
                throw error("invalid number '" + source.substring(start, pos) + "'");
            }
        }
        throw error("unexpected character '" + c + "'");
    }

    private void expect(char c) {
        if (!peek(c)) {
            throw error("expected '" + c + "'");
        }
        pos++;
    }

    private boolean peek(char c) {
        return pos < source.length() && source.charAt(pos) == c;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private FormulaCompileException error(String message) {
        return new FormulaCompileException(metricId,
                String.format("%s at position %d in formula '%s'", message, pos, source));
    }
}
