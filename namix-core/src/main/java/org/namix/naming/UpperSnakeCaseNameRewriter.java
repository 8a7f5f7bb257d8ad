package org.namix.naming;

import java.util.Locale;
import java.util.Objects;

/**
 * "OrderLine" → "ORDER_LINE".
 */
public class UpperSnakeCaseNameRewriter implements NameRewriter {

    private final SnakeCaseNameRewriter snakeCase;
    private final Locale locale;

    public UpperSnakeCaseNameRewriter(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale must not be null");
        this.snakeCase = new SnakeCaseNameRewriter(locale);
    }

    @Override
    public String rewriteName(String name) {
        String snake = snakeCase.rewriteName(name);
        return snake == null ? null : snake.toUpperCase(locale);
    }
}
