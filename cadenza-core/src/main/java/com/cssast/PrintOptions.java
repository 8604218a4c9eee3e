package com.cssast;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Options for {@link CssPrinter#toCss(java.util.List, PrintOptions)}.
 *
 * @param trackDestination when true, every printed node gets a {@link com.cssast.ast.Mapping}
 *                         appended whose destination is the output line it starts on
 */
public record PrintOptions(boolean trackDestination) {

    public static final PrintOptions DEFAULT = new PrintOptions(false);

    private static final String TRACK_DESTINATION_PATH = "cadenza.printer.track-destination";

    public PrintOptions withTrackDestination() {
        return new PrintOptions(true);
    }

    /**
     * Reads printer options from the given configuration, which must contain the
     * {@code cadenza.printer} block (the bundled reference.conf provides the defaults).
     *
     * @throws com.typesafe.config.ConfigException if the setting is missing or not a boolean
     */
    public static PrintOptions fromConfig(Config config) {
        return new PrintOptions(config.getBoolean(TRACK_DESTINATION_PATH));
    }

    /**
     * Loads printer options from the standard configuration sources
     * (system properties, application.conf, reference.conf).
     */
    public static PrintOptions load() {
        return fromConfig(ConfigFactory.load());
    }
}
