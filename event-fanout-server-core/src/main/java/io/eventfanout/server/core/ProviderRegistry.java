package io.eventfanout.server.core;

import io.eventfanout.core.EventFanoutException;
import io.eventfanout.server.spi.ProviderDescriptor;
import io.eventfanout.server.spi.ProviderFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Process-wide table of event providers keyed by slug.
 *
 * <p>Filled once during start-up. Registration is serialized; {@link #getAll()} hands out an
 * immutable snapshot in registration order, so readers never need to synchronize.
 */
public final class ProviderRegistry {

    private static final Pattern SLUG = Pattern.compile("[a-z0-9][a-z0-9_-]*");

    private final Object lock = new Object();
    private volatile Map<String, ProviderDescriptor> providers = Map.of();

    public ProviderRegistry() {
    }

    /**
     * Builds a registry by applying each module in iteration order.
     */
    public static ProviderRegistry fromModules(Iterable<? extends ProviderModule> modules) {
        Objects.requireNonNull(modules, "modules");
        ProviderRegistry registry = new ProviderRegistry();
        for (ProviderModule module : modules) {
            module.registerProviders(registry);
        }
        return registry;
    }

    /**
     * Registers a provider factory.
     *
     * @throws EventFanoutException.DuplicateProvider if the slug is already registered; the
     *         registry is left unchanged
     * @throws EventFanoutException.InvalidSlug if the slug is not lower-case alphanumeric with
     *         {@code -} or {@code _}
     */
    public ProviderDescriptor register(String slug, ProviderFactory factory) {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(factory, "factory");
        if (!SLUG.matcher(slug).matches()) {
            throw new EventFanoutException.InvalidSlug("invalid provider slug: '" + slug + "'");
        }

        synchronized (lock) {
            if (providers.containsKey(slug)) {
                throw new EventFanoutException.DuplicateProvider(slug);
            }
            ProviderDescriptor descriptor = new ProviderDescriptor(slug, factory);
            Map<String, ProviderDescriptor> next = new LinkedHashMap<>(providers);
            next.put(slug, descriptor);
            providers = Collections.unmodifiableMap(next);
            return descriptor;
        }
    }

    /**
     * @return snapshot of every registered provider, in registration order
     */
    public Map<String, ProviderDescriptor> getAll() {
        return providers;
    }

    public boolean contains(String slug) {
        return providers.containsKey(slug);
    }

    public int size() {
        return providers.size();
    }
}
