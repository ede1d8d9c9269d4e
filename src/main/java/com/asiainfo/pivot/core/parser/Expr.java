package com.asiainfo.pivot.core.parser;

import com.asiainfo.pivot.core.SafeMath;

import java.util.Set;
import java.util.function.Function;

/**
 * 派生指标公式编译后的 AST
 */
public interface Expr {

    /**
     * @param lookup 指标ID -> 当前行上的值；取不到时返回 null
     */
    double evaluate(Function<String, Double> lookup);

    void collectReferences(Set<String> into);

    record Literal(double value) implements Expr {
        @Override
        public double evaluate(Function<String, Double> lookup) {
            return value;
        }

        @Override
        public void collectReferences(Set<String> into) {
        }
    }

    record Ref(String metricId) implements Expr {
        @Override
        public double evaluate(Function<String, Double> lookup) {
            Double value = lookup.apply(metricId);
            if (value == null) {
                throw new IllegalStateException("Missing value for metric " + metricId);
            }
            return value;
        }

        @Override
        public void collectReferences(Set<String> into) {
            into.add(metricId);
        }
    }

    record Negate(Expr operand) implements Expr {
        @Override
        public double evaluate(Function<String, Double> lookup) {
            return -operand.evaluate(lookup);
        }

        @Override
        public void collectReferences(Set<String> into) {
            operand.collectReferences(into);
        }
    }

    record BinaryOp(Operator operator, Expr left, Expr right) implements Expr {
        @Override
        public double evaluate(Function<String, Double> lookup) {
            double l = left.evaluate(lookup);
            double r = right.evaluate(lookup);
            return operator.apply(l, r);
        }

        @Override
        public void collectReferences(Set<String> into) {
            left.collectReferences(into);
            right.collectReferences(into);
        }
    }

    enum Operator {
        ADD('+'),
        SUB('-'),
        MUL('*'),
        DIV('/');

        private final char symbol;

        Operator(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        public double apply(double l, double r) {
            return switch (this) {
                case ADD -> l + r;
                case SUB -> l - r;
                case MUL -> l * r;
                // 除数为 0 结果为 0，不产生 Infinity
                case DIV -> SafeMath.safeDivide(l, r);
            };
        }

        public static Operator of(char c) {
            for (Operator op : values()) {
                if (op.symbol == c) {
                    return op;
                }
            }
            return null;
        }
    }
}
