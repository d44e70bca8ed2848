package io.eventfanout.server.core;

/**
 * A feature module's start-up hook: registers the feature's providers.
 *
 * <p>Modules are applied in an explicit order by {@link ProviderRegistry#fromModules(Iterable)},
 * so the set of registered slugs is decided by start-up code, not by class loading order.
 */
@FunctionalInterface
public interface ProviderModule {

    void registerProviders(ProviderRegistry registry);
}
