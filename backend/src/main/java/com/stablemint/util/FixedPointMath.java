package com.stablemint.util;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;

import java.math.BigInteger;
import java.util.Map;

/**
 * Checked unsigned 256-bit integer arithmetic.
 * Every result must stay within [0, 2^256 - 1]; anything else is a hard failure, never a wrap.
 * Division truncates toward zero.
 */
public final class FixedPointMath {
    private FixedPointMath() {}

    public static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(a.add(b), "add");
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        return checked(a.subtract(b), "sub");
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        return checked(a.multiply(b), "mul");
    }

    public static BigInteger div(BigInteger a, BigInteger b) {
        if (b.signum() == 0) {
            throw new EngineException(ErrorCode.ARITHMETIC_ERROR, "division by zero");
        }
        return checked(a.divide(b), "div");
    }

    /** a * b / c with the intermediate product range-checked as well. */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c) {
        return div(mul(a, b), c);
    }

    /** Range check for values entering the engine from outside (requests, feeds, tokens). */
    public static BigInteger requireUint256(BigInteger v, String name) {
        if (v == null) throw new EngineException(ErrorCode.INVALID_INPUT, name + " must not be null");
        if (v.signum() < 0) {
            throw new EngineException(ErrorCode.INVALID_INPUT, name + " must not be negative",
                    Map.of(name, v.toString()));
        }
        if (v.compareTo(MAX_UINT256) > 0) {
            throw new EngineException(ErrorCode.ARITHMETIC_ERROR, name + " is outside uint256 range",
                    Map.of(name, v.toString()));
        }
        return v;
    }

    private static BigInteger checked(BigInteger r, String op) {
        if (r.signum() < 0) {
            throw new EngineException(ErrorCode.ARITHMETIC_ERROR, "uint256 underflow in " + op);
        }
        if (r.compareTo(MAX_UINT256) > 0) {
            throw new EngineException(ErrorCode.ARITHMETIC_ERROR, "uint256 overflow in " + op);
        }
        return r;
    }
}
