package com.datachain.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Settings that change how SQL text is rendered.
 *
 * <p>Read from JVM system properties:
 * <ul>
 *   <li>{@code datachain.sql.quoteIdentifiers} (default false): quote every
 *       identifier, not only those that need it</li>
 *   <li>{@code datachain.sql.cteName} (default {@code cte}): name of the
 *       staging CTE; must be a plain identifier</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 *   java -Ddatachain.sql.quoteIdentifiers=true -Ddatachain.sql.cteName=staged ...
 * </pre>
 *
 * @param quoteIdentifiers whether every identifier is double-quoted
 * @param cteName name of the staging CTE
 */
public record CompilerSettings(boolean quoteIdentifiers, String cteName) {

    private static final Logger logger = LoggerFactory.getLogger(CompilerSettings.class);

    public static final String PROP_QUOTE_IDENTIFIERS = "datachain.sql.quoteIdentifiers";
    public static final String PROP_CTE_NAME = "datachain.sql.cteName";

    public static final boolean DEFAULT_QUOTE_IDENTIFIERS = false;
    public static final String DEFAULT_CTE_NAME = "cte";

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public CompilerSettings {
        Objects.requireNonNull(cteName, "cteName must not be null");
        if (!PLAIN_IDENTIFIER.matcher(cteName).matches()) {
            throw new IllegalArgumentException("CTE name must be a plain identifier: " + cteName);
        }
    }

    /**
     * Returns the built-in defaults, ignoring system properties.
     */
    public static CompilerSettings defaults() {
        return new CompilerSettings(DEFAULT_QUOTE_IDENTIFIERS, DEFAULT_CTE_NAME);
    }

    /**
     * Reads settings from system properties, falling back to defaults for
     * missing or invalid values.
     *
     * @return the effective settings
     */
    public static CompilerSettings fromSystemProperties() {
        boolean quote = Boolean.parseBoolean(
            System.getProperty(PROP_QUOTE_IDENTIFIERS, String.valueOf(DEFAULT_QUOTE_IDENTIFIERS)).trim());

        String cteName = System.getProperty(PROP_CTE_NAME, DEFAULT_CTE_NAME).trim();
        if (!PLAIN_IDENTIFIER.matcher(cteName).matches()) {
            logger.warn("Invalid {} value '{}', using default: {}", PROP_CTE_NAME, cteName, DEFAULT_CTE_NAME);
            cteName = DEFAULT_CTE_NAME;
        }

        CompilerSettings settings = new CompilerSettings(quote, cteName);
        logger.debug("Compiler settings: {}", settings);
        return settings;
    }
}
