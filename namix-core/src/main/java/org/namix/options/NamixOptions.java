package org.namix.options;

/**
 * Configuration option keys and defaults shared by the configuration loader and the CLI.
 */
public final class NamixOptions {

    private NamixOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        /**
         * Environment variable selecting the profile when none is given on the command line.
         */
        public static final String ENV_VAR = "NAMIX_PROFILE";

        public static final String CONFIG_FILE = "namix.yaml";
    }

    /**
     * Naming-related settings.
     */
    public static final class Naming {
        private Naming() {}

        /**
         * Target naming convention, see {@code NamingConvention}.
         */
        public static final String CONVENTION_KEY = "namix.naming.convention";
        public static final String CONVENTION_DEFAULT = "snake_case";

        /**
         * Language tag of the locale used for case conversion. {@code ROOT} selects {@code Locale.ROOT}.
         */
        public static final String LOCALE_KEY = "namix.naming.locale";
        public static final String LOCALE_DEFAULT = "ROOT";

        /**
         * Maximum length for generated key/constraint/index names.
         * Default: 63
         */
        public static final String MAX_LENGTH_KEY = "namix.naming.maxLength";
        public static final int MAX_LENGTH_DEFAULT = 63;
    }

    /**
     * Model-related settings.
     */
    public static final class Model {
        private Model() {}

        public static final String DEFAULT_SCHEMA_KEY = "namix.model.defaultSchema";
    }
}
