package org.namix.naming;

import java.util.Locale;
import java.util.Objects;

public class UpperCaseNameRewriter implements NameRewriter {

    private final Locale locale;

    public UpperCaseNameRewriter(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale must not be null");
    }

    @Override
    public String rewriteName(String name) {
        return name == null ? null : name.toUpperCase(locale);
    }
}
