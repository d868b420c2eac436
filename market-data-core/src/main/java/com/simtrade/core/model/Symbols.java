package com.simtrade.core.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Symbol normalisation helpers. All keyed state in the engine uses the
 * trimmed, upper-cased form.
 */
public final class Symbols {

    private Symbols() {
    }

    public static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Normalise and de-duplicate a request, preserving order. Blank entries are dropped.
     */
    public static Set<String> normalizeAll(Collection<String> symbols) {
        var normalized = new LinkedHashSet<String>();
        if (symbols == null) {
            return normalized;
        }
        for (String symbol : symbols) {
            String value = normalize(symbol);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return normalized;
    }
}
