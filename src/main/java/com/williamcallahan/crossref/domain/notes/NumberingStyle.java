package com.williamcallahan.crossref.domain.notes;

/**
 * Presentation of note numbers. Applied at render time only; canonical ids never depend on it.
 */
public enum NumberingStyle {
    NUMERIC,
    ROMAN,
    ALPHA,
    SYMBOLS;

    private static final String[] SYMBOL_SEQUENCE = {"*", "†", "‡", "§", "‖", "¶"};
    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_NUMERALS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    /**
     * Formats a 1-based note number.
     *
     * @param number note number, at least 1
     * @return label such as "3", "iii", "c" or "‡"
     */
    public String format(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Note numbers start at 1: " + number);
        }
        return switch (this) {
            case NUMERIC -> Integer.toString(number);
            case ROMAN -> roman(number);
            case ALPHA -> alpha(number);
            case SYMBOLS -> symbols(number);
        };
    }

    private static String roman(int number) {
        StringBuilder numeral = new StringBuilder();
        int remaining = number;
        for (int index = 0; index < ROMAN_VALUES.length; index++) {
            while (remaining >= ROMAN_VALUES[index]) {
                numeral.append(ROMAN_NUMERALS[index]);
                remaining -= ROMAN_VALUES[index];
            }
        }
        return numeral.toString();
    }

    // a..z, aa..zz, aaa.. like spreadsheet columns
    private static String alpha(int number) {
        StringBuilder letters = new StringBuilder();
        int remaining = number;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            letters.insert(0, (char) ('a' + digit));
            remaining = (remaining - 1) / 26;
        }
        return letters.toString();
    }

    private static String symbols(int number) {
        String symbol = SYMBOL_SEQUENCE[(number - 1) % SYMBOL_SEQUENCE.length];
        int repeat = (number - 1) / SYMBOL_SEQUENCE.length + 1;
        return symbol.repeat(repeat);
    }
}
