package com.yerin.bookpipe.application;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Product codes look like {@code 100227-01} and lead the uploaded file name.
 */
public final class ProductCodes {

    private static final Pattern LEADING_CODE = Pattern.compile("^(\\d{6}-\\d{2})");

    private ProductCodes() {}

    public static Optional<String> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher m = LEADING_CODE.matcher(fileName.trim());
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static boolean isValid(String code) {
        return code != null && code.matches("\\d{6}-\\d{2}");
    }
}
