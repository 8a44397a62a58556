package com.entity.reconciliation.rules;

import java.net.IDN;
import java.text.Normalizer;
import java.util.Locale;

/**
 * Text helpers shared by hooks and key derivation.
 */
public final class Identifiers {

    private Identifiers() {
    }

    /**
     * Unicode NFC form; null becomes the empty string.
     */
    public static String nfc(String value) {
        if (value == null) {
            return "";
        }
        return Normalizer.isNormalized(value, Normalizer.Form.NFC)
                ? value
                : Normalizer.normalize(value, Normalizer.Form.NFC);
    }

    /**
     * NFC followed by locale-independent lower-casing.
     */
    public static String fold(String value) {
        return nfc(value).toLowerCase(Locale.ROOT);
    }

    /**
     * Converts internationalized host names to their ASCII (punycode) form.
     * Pure ASCII input is returned unchanged.
     *
     * @throws IllegalArgumentException if the value is not a valid internationalized name
     */
    public static String punycode(String value) {
        if (value == null || value.isEmpty() || isAscii(value)) {
            return value;
        }
        return IDN.toASCII(nfc(value), IDN.ALLOW_UNASSIGNED);
    }

    public static boolean isAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
