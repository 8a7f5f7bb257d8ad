package org.namix.naming;

import java.util.Locale;
import java.util.Objects;

/**
 * Lower-cases the first character only: "OrderLine" → "orderLine".
 */
public class CamelCaseNameRewriter implements NameRewriter {

    private final Locale locale;

    public CamelCaseNameRewriter(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale must not be null");
    }

    @Override
    public String rewriteName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toLowerCase(locale) + name.substring(1);
    }
}
