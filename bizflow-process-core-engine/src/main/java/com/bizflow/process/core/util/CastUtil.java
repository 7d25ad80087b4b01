package com.bizflow.process.core.util;

public class CastUtil {

    private CastUtil() {}

    /**
     * Lenient truth value of an expression result. Anything unrecognised is false.
     */
    public static boolean castAsBoolean(Object e) {
        if (e instanceof Boolean bool) {
            return bool;
        } else if (e instanceof Number number) {
            return number.intValue() == 1;
        } else if (e instanceof String s) {
            return "true".equalsIgnoreCase(s) || "yes".equalsIgnoreCase(s) || "1".equals(s);
        }
        return false;
    }
}
