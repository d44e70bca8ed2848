package io.eventfanout.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventfanout.json.jackson.JacksonJsonCodec;
import io.eventfanout.json.spi.JsonCodec;
import io.eventfanout.server.core.Authenticator;
import io.eventfanout.server.core.DirtyNotifier;
import io.eventfanout.server.core.EventStreamHandler;
import io.eventfanout.server.core.EventStreamSettings;
import io.eventfanout.server.core.InMemoryDirtyTokenStore;
import io.eventfanout.server.core.LexiLongTokenGenerator;
import io.eventfanout.server.core.ProviderModule;
import io.eventfanout.server.core.ProviderRegistry;
import io.eventfanout.server.spi.DirtyTokenStore;
import io.eventfanout.server.spi.PushBroker;
import io.eventfanout.server.spi.TokenGenerator;
import io.eventfanout.servlet.EventStreamServlet;
import jakarta.servlet.Servlet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the event fan-out endpoint.
 *
 * <p>Provides default beans for {@link ProviderRegistry}, {@link DirtyTokenStore},
 * {@link DirtyNotifier}, {@link JsonCodec} and {@link EventStreamHandler}, and maps an
 * {@link EventStreamServlet} at {@code event-fanout.path}. Each can be overridden by defining
 * your own bean.
 *
 * <p>Features contribute providers through {@link ProviderModule} beans, applied in their
 * {@code @Order}. Streams are only opened for users resolved by an {@link Authenticator} bean:
 * <pre>{@code
 * @Bean
 * ProviderModule chatEvents(ChatRepository chat) {
 *     return registry -> registry.register("chat", ChangeFeedProvider.builder("chat", "message", chat).factory());
 * }
 *
 * @Bean
 * Authenticator streamAuthenticator() {
 *     return Authenticator.fromPrincipal();
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass(EventStreamHandler.class)
@ConditionalOnProperty(prefix = "event-fanout", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventFanoutProperties.class)
public class EventFanoutAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventFanoutAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EventStreamSettings eventStreamSettings(EventFanoutProperties properties) {
        return properties.toSettings();
    }

    /**
     * Registry filled from every {@link ProviderModule} bean, in order. A slug registered twice
     * fails start-up.
     */
    @Bean
    @ConditionalOnMissingBean
    public ProviderRegistry eventProviderRegistry(ObjectProvider<ProviderModule> modules) {
        ProviderRegistry registry = ProviderRegistry.fromModules(modules.orderedStream().toList());
        log.info("Registered {} event provider(s): {}", registry.size(), registry.getAll().keySet());
        return registry;
    }

    /**
     * Provides a default in-memory {@link DirtyTokenStore}. Multi-node deployments should define
     * a shared one.
     */
    @Bean
    @ConditionalOnMissingBean
    public DirtyTokenStore dirtyTokenStore() {
        return new InMemoryDirtyTokenStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenGenerator dirtyTokenGenerator() {
        return new LexiLongTokenGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DirtyNotifier dirtyNotifier(DirtyTokenStore store, ObjectProvider<PushBroker> broker,
                                       TokenGenerator tokens, EventStreamSettings settings) {
        return new DirtyNotifier(store, broker.getIfAvailable(), tokens, settings.dirtyTokenTtl());
    }

    /**
     * Payload codec backed by the application's {@link ObjectMapper} when there is one.
     */
    @Bean
    @ConditionalOnMissingBean
    public JsonCodec eventPayloadCodec(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new JacksonJsonCodec(mapper) : new JacksonJsonCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStreamHandler eventStreamHandler(ProviderRegistry registry, DirtyTokenStore store,
                                                 ObjectProvider<PushBroker> broker,
                                                 ObjectProvider<Authenticator> authenticator,
                                                 JsonCodec codec, EventStreamSettings settings) {
        Authenticator auth = authenticator.getIfAvailable();
        if (auth == null) {
            log.warn("No Authenticator bean defined; every event stream request will be rejected with 403");
            auth = Authenticator.denyAll();
        }
        return EventStreamHandler.builder(registry)
                .dirtyTokenStore(store)
                .pushBroker(broker.getIfAvailable())
                .authenticator(auth)
                .jsonCodec(codec)
                .settings(settings)
                .build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({Servlet.class, ServletRegistrationBean.class})
    static class ServletConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "eventStreamServletRegistration")
        public ServletRegistrationBean<EventStreamServlet> eventStreamServletRegistration(
                EventStreamHandler handler, EventFanoutProperties properties) {
            ServletRegistrationBean<EventStreamServlet> registration =
                    new ServletRegistrationBean<>(new EventStreamServlet(handler), properties.getPath());
            registration.setName("eventStreamServlet");
            registration.setAsyncSupported(true);
            return registration;
        }
    }
}
