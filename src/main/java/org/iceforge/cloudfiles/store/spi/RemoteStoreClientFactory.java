package org.iceforge.cloudfiles.store.spi;

import org.iceforge.cloudfiles.store.DependencyUnavailableException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

public final class RemoteStoreClientFactory {
    private static final Logger log = LoggerFactory.getLogger(RemoteStoreClientFactory.class);

    private final List<RemoteStoreProvider> providers;

    public RemoteStoreClientFactory(Collection<RemoteStoreProvider> springProviders) {
        this(springProviders, true);
    }

    RemoteStoreClientFactory(Collection<RemoteStoreProvider> springProviders, boolean useServiceLoader) {
        List<RemoteStoreProvider> fromSpring = springProviders == null ? List.of() : List.copyOf(springProviders);
        List<RemoteStoreProvider> fromServiceLoader = useServiceLoader
                ? ServiceLoader.load(RemoteStoreProvider.class).stream().map(ServiceLoader.Provider::get).toList()
                : List.of();

        // Merge by id, Spring wins if same id
        Map<String, RemoteStoreProvider> merged = new LinkedHashMap<>();
        for (RemoteStoreProvider p : fromServiceLoader) merged.put(p.id(), p);
        for (RemoteStoreProvider p : fromSpring) merged.put(p.id(), p);

        this.providers = List.copyOf(merged.values());
        log.info("Discovered RemoteStoreProviders: {}", ids());
    }

    /**
     * Picks the forced provider when {@code forcedProvider} is set, otherwise the first provider
     * (by id) that supports the context, and builds its client.
     */
    public ResolvedStore resolve(String forcedProvider, RemoteStoreContext ctx) {
        if (forcedProvider != null && !forcedProvider.isBlank()) {
            RemoteStoreProvider p = providers.stream()
                    .filter(x -> forcedProvider.equals(x.id()))
                    .findFirst()
                    .orElseThrow(() -> new DependencyUnavailableException(
                            "Remote store provider '" + forcedProvider + "' not found. Available: " + ids()
                                    + " (is the provider's JAR on the classpath?)"));

            log.info("Using forced remote store provider id='{}' with ctx={}", p.id(), ctx.describe());
            return new ResolvedStore(p.id(), p.client(ctx));
        }

        List<RemoteStoreProvider> matching = providers.stream()
                .filter(p -> p.supports(ctx))
                .sorted(Comparator.comparing(RemoteStoreProvider::id))
                .toList();

        if (matching.isEmpty()) {
            throw new DependencyUnavailableException(
                    "No RemoteStoreProvider supports ctx=" + ctx.describe() + " providers=" + ids());
        }

        RemoteStoreProvider chosen = matching.get(0);
        log.info("Using remote store provider id='{}' (matched {}) with ctx={}",
                chosen.id(), matching.stream().map(RemoteStoreProvider::id).toList(), ctx.describe());
        return new ResolvedStore(chosen.id(), chosen.client(ctx));
    }

    public List<String> ids() {
        return providers.stream().map(RemoteStoreProvider::id).sorted().toList();
    }

    public record ResolvedStore(String providerId, RemoteStoreClient client) {}
}
