package com.asiainfo.pivot.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 安全数值运算
 * 除数为 0 时结果为 0，任何 NaN / Infinity 都不允许流出引擎。
 */
public final class SafeMath {

    private SafeMath() {}

    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return numerator / denominator;
    }

    public static double sanitize(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return 0.0;
        }
        return value;
    }

    public static double percentage(double part, double total) {
        if (total <= 0) {
            return 0.0;
        }
        return sanitize(part / total * 100);
    }

    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * 数据库驱动返回的数值类型五花八门 (Long / BigDecimal / Integer)，统一转 Double
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
