package xyz.firestige.rollback.domain.health.condition;

import java.util.Arrays;

/**
 * 比较运算符
 */
public enum Comparison {

    GT(">") {
        @Override
        public boolean test(double left, double right) {
            return left > right;
        }
    },
    GTE(">=") {
        @Override
        public boolean test(double left, double right) {
            return left >= right;
        }
    },
    LT("<") {
        @Override
        public boolean test(double left, double right) {
            return left < right;
        }
    },
    LTE("<=") {
        @Override
        public boolean test(double left, double right) {
            return left <= right;
        }
    },
    EQ("==") {
        @Override
        public boolean test(double left, double right) {
            return Double.compare(left, right) == 0;
        }
    };

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public abstract boolean test(double left, double right);

    /**
     * 兼容符号（">="）和名称（"gte"）
     */
    public static Comparison parse(String value) {
        return Arrays.stream(values())
                .filter(c -> c.symbol.equals(value) || c.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的比较运算符: " + value));
    }
}
