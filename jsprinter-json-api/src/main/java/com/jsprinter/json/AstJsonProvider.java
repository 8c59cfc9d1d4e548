package com.jsprinter.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point to the JSON binding. Implementations are discovered with
 * {@link ServiceLoader}; put one on the classpath (e.g. jsprinter-jackson).
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * Program program = provider.getDeserializer().deserializeProgram(json);
 * Doc doc = ModulePrinter.printProgram(program, sourceText, PrintOptions.defaults());
 * String docJson = provider.getSerializer().serializeDoc(doc);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * @return the provider name, e.g. "Jackson"
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add jsprinter-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Looks a provider up by name, ignoring case.
     *
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

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
