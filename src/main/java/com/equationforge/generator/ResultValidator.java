package com.equationforge.generator;

import java.util.OptionalLong;
import java.util.regex.Pattern;

public final class ResultValidator {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern ZERO_PADDED = Pattern.compile("^0+[1-9]");

    private ResultValidator() {
    }

    public static OptionalLong parseResult(String result) {
        if (result == null || !DIGITS.matcher(result).matches()) {
            return OptionalLong.empty();
        }
        if (ZERO_PADDED.matcher(result).find()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(result));
        } catch (NumberFormatException ex) {
            return OptionalLong.empty();
        }
    }
}
