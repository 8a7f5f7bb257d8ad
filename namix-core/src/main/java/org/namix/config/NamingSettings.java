package org.namix.config;

import lombok.Builder;
import lombok.Value;
import org.namix.convention.ConventionSet;
import org.namix.model.SchemaModel;
import org.namix.naming.DefaultNaming;
import org.namix.naming.NameRewriter;
import org.namix.naming.NamingConvention;
import org.namix.options.NamixOptions;

import java.util.Locale;
import java.util.Map;

/**
 * Typed view of the resolved configuration map, and the factory of models wired with it.
 */
@Value
@Builder(toBuilder = true)
public class NamingSettings {

    @Builder.Default
    NamingConvention convention = NamingConvention.SNAKE_CASE;

    @Builder.Default
    Locale locale = Locale.ROOT;

    @Builder.Default
    int maxLength = NamixOptions.Naming.MAX_LENGTH_DEFAULT;

    String defaultSchema;

    /**
     * @throws IllegalArgumentException when a value cannot be interpreted
     */
    public static NamingSettings fromConfiguration(Map<String, String> config) {
        NamingSettingsBuilder builder = builder();

        String convention = config.get(NamixOptions.Naming.CONVENTION_KEY);
        if (convention != null) {
            builder.convention(NamingConvention.fromString(convention));
        }

        String locale = config.get(NamixOptions.Naming.LOCALE_KEY);
        if (locale != null) {
            builder.locale(parseLocale(locale));
        }

        String maxLength = config.get(NamixOptions.Naming.MAX_LENGTH_KEY);
        if (maxLength != null) {
            try {
                builder.maxLength(Integer.parseInt(maxLength.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + NamixOptions.Naming.MAX_LENGTH_KEY + ": " + maxLength, e);
            }
        }

        return builder.defaultSchema(config.get(NamixOptions.Model.DEFAULT_SCHEMA_KEY)).build();
    }

    static Locale parseLocale(String value) {
        if (value.isBlank() || "ROOT".equalsIgnoreCase(value.trim())) {
            return Locale.ROOT;
        }
        return Locale.forLanguageTag(value.trim().replace('_', '-'));
    }

    public NameRewriter createRewriter() {
        return convention.createRewriter(locale);
    }

    /**
     * Creates an empty model with the naming engine attached.
     */
    public SchemaModel createModel() {
        return new SchemaModel(ConventionSet.withNameRewriting(createRewriter()), new DefaultNaming(maxLength), defaultSchema);
    }
}
