package com.jsast.json;

import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Entry point to ESTree JSON output. Implementations register themselves in
 * {@code META-INF/services/com.jsast.json.AstJsonProvider} and are picked up by
 * {@link ServiceLoader}; jsast-jackson is the bundled one.
 *
 * <pre>{@code
 * Program program = AstBuilder.parse("a = 2");
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(program);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * @return a short provider name such as {@code "Jackson"}
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is registered
     */
    static AstJsonProvider getProvider() {
        return registered().findFirst().orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider registered, add jsast-jackson to the classpath"));
    }

    /**
     * @param name provider name, matched ignoring case
     * @throws IllegalStateException if no registered provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        Optional<AstJsonProvider> match = registered()
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst();
        return match.orElseThrow(() -> new IllegalStateException("No AstJsonProvider named '" + name + "'"));
    }

    static boolean isProviderAvailable() {
        return registered().findFirst().isPresent();
    }

    private static Stream<AstJsonProvider> registered() {
        return ServiceLoader.load(AstJsonProvider.class).stream().map(ServiceLoader.Provider::get);
    }
}
