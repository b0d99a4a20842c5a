package com.stablemint.util;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;

/**
 * Simple validators/normalizers for EVM addresses.
 * Actors, collateral tokens and price feeds are all keyed by the lower-cased form.
 */
public final class AddressUtil {
    private AddressUtil(){}

    public static String normalize(String addr) {
        if (addr == null) throw invalid("address is null");
        String a = addr.trim();
        if (!a.startsWith("0x") && !a.startsWith("0X")) throw invalid("address must start with 0x: " + addr);
        String hex = a.substring(2);
        if (hex.length() != 40) throw invalid("invalid address length (need 40 hex chars): " + addr);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) throw invalid("address is not hex: " + addr);
        }
        return "0x" + hex.toLowerCase();
    }

    public static boolean isZero(String addr) {
        return normalize(addr).equals("0x0000000000000000000000000000000000000000");
    }

    private static EngineException invalid(String message) {
        return new EngineException(ErrorCode.INVALID_INPUT, message);
    }
}
