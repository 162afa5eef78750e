package io.github.rowbase.hashid;

import java.math.BigInteger;

/**
 * Base-x encoding of byte arrays over a 62 symbol alphabet. Leading zero bytes are kept as
 * leading zero symbols, so decoding restores the exact input length.
 */
final class Base62 {

    static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final BigInteger BASE = BigInteger.valueOf(62);

    private Base62() {
    }

    static String encode(byte[] data) {
        int zeros = 0;
        while (zeros < data.length && data[zeros] == 0) {
            zeros++;
        }
        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, data);
        while (value.signum() > 0) {
            BigInteger[] qr = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(qr[1].intValue()));
            value = qr[0];
        }
        for (int i = 0; i < zeros; i++) {
            sb.append(ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }

    /**
     * @throws IllegalArgumentException on a symbol outside the alphabet
     */
    static byte[] decode(String text) {
        int zeros = 0;
        while (zeros < text.length() && text.charAt(zeros) == ALPHABET.charAt(0)) {
            zeros++;
        }
        BigInteger value = toBigInteger(text.substring(zeros));
        byte[] magnitude = value.signum() == 0 ? new byte[0] : stripSign(value.toByteArray());
        byte[] result = new byte[zeros + magnitude.length];
        System.arraycopy(magnitude, 0, result, zeros, magnitude.length);
        return result;
    }

    /**
     * Fixed width encoding of an unsigned value, left padded with the zero symbol.
     */
    static String encodeFixed(byte[] data, int width) {
        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, data);
        while (value.signum() > 0) {
            BigInteger[] qr = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(qr[1].intValue()));
            value = qr[0];
        }
        while (sb.length() < width) {
            sb.append(ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }

    /**
     * Inverse of {@link #encodeFixed(byte[], int)}.
     *
     * @throws IllegalArgumentException on a bad symbol or a value wider than {@code bytes}
     */
    static byte[] decodeFixed(String text, int bytes) {
        byte[] magnitude = stripSign(toBigInteger(text).toByteArray());
        if (magnitude.length > bytes) {
            throw new IllegalArgumentException("Value does not fit in " + bytes + " bytes");
        }
        byte[] result = new byte[bytes];
        System.arraycopy(magnitude, 0, result, bytes - magnitude.length, magnitude.length);
        return result;
    }

    private static BigInteger toBigInteger(String text) {
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < text.length(); i++) {
            int digit = ALPHABET.indexOf(text.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid symbol '" + text.charAt(i) + "'");
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        return value;
    }

    private static byte[] stripSign(byte[] bytes) {
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] result = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, result, 0, result.length);
            return result;
        }
        if (bytes.length == 1 && bytes[0] == 0) {
            return new byte[0];
        }
        return bytes;
    }
}
