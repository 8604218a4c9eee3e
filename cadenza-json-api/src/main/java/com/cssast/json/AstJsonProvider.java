package com.cssast.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for converting CSS trees to and from JSON.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>Put an implementation JAR such as cadenza-jackson on the classpath and it is picked up
 * without further setup. A typical use is handing printed trees, with their destination
 * mappings, to a source map generator running elsewhere:</p>
 * <pre>{@code
 * CssPrinter.toCss(ast, PrintOptions.DEFAULT.withTrackDestination());
 * String json = AstJsonProvider.getProvider().getSerializer().serializeForest(ast);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * @return the serializer for converting CSS nodes to JSON
     */
    AstJsonSerializer getSerializer();

    /**
     * @return the deserializer for converting JSON to CSS nodes
     */
    AstJsonDeserializer getDeserializer();

    /**
     * @return the name of this provider (e.g., "Jackson")
     */
    String getName();

    /**
     * Gets the first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> providers = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException(
                "No AstJsonProvider found on the classpath. " +
                "Add cadenza-jackson (or another provider) to your dependencies."
            );
        }
        return providers.next();
    }

    /**
     * Gets a provider by name, ignoring case.
     *
     * @param name the provider name (e.g., "Jackson")
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath.");
    }

    /**
     * @return true if at least one provider is on the classpath
     */
    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
