package com.agrichain.offchain.app;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.validation.ConstraintViolation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Renders constraint violations with the snake_case property names clients
 * send, e.g. {@code gpsCoordinates.latitude -> gps_coordinates.latitude}.
 */
final class WirePaths {

    private static final PropertyNamingStrategies.NamingBase SNAKE = new PropertyNamingStrategies.SnakeCaseStrategy();

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private WirePaths() {}

    static String path(String javaPath) {
        Matcher m = SEGMENT.matcher(javaPath);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(SNAKE.translate(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String message(ConstraintViolation<?> v) {
        return path(v.getPropertyPath().toString()) + ": " + v.getMessage();
    }
}
