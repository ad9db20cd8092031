package com.flagship.inventory_ledger.production;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes production serial numbers: trimmed, and carrying the configured
 * prefix. Comparison is case-insensitive everywhere.
 */
public final class SerialNumbers {

    private SerialNumbers() {
    }

    /**
     * @throws IllegalArgumentException if a serial is blank or appears twice
     */
    public static List<String> normalize(List<String> serials, String prefix) {
        if (serials == null) {
            throw new IllegalArgumentException("Serial numbers are required");
        }
        List<String> normalized = new ArrayList<>(serials.size());
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String raw : serials) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("Serial numbers cannot be blank");
            }
            String serial = withPrefix(raw.trim(), prefix);
            if (!seen.add(key(serial))) {
                duplicates.add(serial);
            }
            normalized.add(serial);
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Duplicate serial numbers in request: " + String.join(", ", duplicates));
        }
        return normalized;
    }

    static String withPrefix(String serial, String prefix) {
        if (serial.toUpperCase(Locale.ROOT).startsWith(prefix.toUpperCase(Locale.ROOT))) {
            return serial;
        }
        return prefix + serial;
    }

    /**
     * Case-insensitive comparison key.
     */
    public static String key(String serial) {
        return serial.toUpperCase(Locale.ROOT);
    }
}
