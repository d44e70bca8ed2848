package io.eventfanout.server.core;

import io.eventfanout.core.Headers;
import io.eventfanout.core.Protocol;
import io.eventfanout.json.spi.JsonCodec;
import io.eventfanout.server.spi.DirtyTokenStore;
import io.eventfanout.server.spi.PushBroker;
import io.eventfanout.server.spi.StreamUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Framework-neutral HTTP handler of the per-user event stream endpoint.
 *
 * <p>A successful request yields a {@code 200} response whose body is a
 * {@link java.util.concurrent.Flow.Publisher} of frames; the connection's session starts once the
 * adapter subscribes and requests frames.
 *
 * <p>Use {@link #builder(ProviderRegistry)} to create instances:
 * <pre>{@code
 * EventStreamHandler handler = EventStreamHandler.builder(registry)
 *     .authenticator(myAuthenticator)
 *     .pushBroker(broker)
 *     .dirtyTokenStore(store)
 *     .build();
 * }</pre>
 */
public final class EventStreamHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventStreamHandler.class);

    private final ProviderRegistry registry;
    private final Authenticator authenticator;
    private final EventFrames frames;
    private final EventStreamSettings settings;
    private final Clock clock;
    private final TransportSelector transportSelector;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final AtomicInteger activeConnections = new AtomicInteger();

    /**
     * Creates a new builder for configuring a handler.
     *
     * @param registry the provider registry (required)
     * @return a new builder instance
     */
    public static Builder builder(ProviderRegistry registry) {
        return new Builder(registry);
    }

    private EventStreamHandler(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.authenticator = builder.authenticator != null ? builder.authenticator : Authenticator.denyAll();
        JsonCodec codec = builder.jsonCodec != null ? builder.jsonCodec : ServiceLoaderJsonCodecs.loadDefault();
        this.frames = new EventFrames(codec);
        this.settings = builder.settings != null ? builder.settings : EventStreamSettings.defaults();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.transportSelector != null) {
            this.transportSelector = builder.transportSelector;
        } else {
            DirtyTokenStore store = builder.dirtyTokenStore != null ? builder.dirtyTokenStore : new InMemoryDirtyTokenStore(clock);
            Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
            this.transportSelector = new BrokerAwareTransportSelector(builder.pushBroker, store, settings, clock, sleeper);
        }
        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null ? builder.executor : VirtualThreads.newExecutor("event-fanout-session");
    }

    /**
     * Builder for {@link EventStreamHandler}.
     */
    public static final class Builder {
        private final ProviderRegistry registry;
        private Authenticator authenticator;
        private DirtyTokenStore dirtyTokenStore;
        private PushBroker pushBroker;
        private JsonCodec jsonCodec;
        private EventStreamSettings settings;
        private Clock clock;
        private Sleeper sleeper;
        private ExecutorService executor;
        private TransportSelector transportSelector;

        private Builder(ProviderRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        /** Resolves the stream owner. Default: reject every request. */
        public Builder authenticator(Authenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        /** Store read by polling connections. Default: an {@link InMemoryDirtyTokenStore}. */
        public Builder dirtyTokenStore(DirtyTokenStore dirtyTokenStore) {
            this.dirtyTokenStore = dirtyTokenStore;
            return this;
        }

        /** Broker for push wake-ups. Default: none, every connection polls. */
        public Builder pushBroker(PushBroker pushBroker) {
            this.pushBroker = pushBroker;
            return this;
        }

        /** Payload codec. Default: discovered through {@link java.util.ServiceLoader}. */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public Builder settings(EventStreamSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Executor running one task per connection. Default: virtual threads when available; the
         * handler then shuts it down on {@link EventStreamHandler#close()}.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /** Overrides transport selection; the store and broker settings are then unused. */
        public Builder transportSelector(TransportSelector transportSelector) {
            this.transportSelector = transportSelector;
            return this;
        }

        public EventStreamHandler build() {
            return new EventStreamHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest request) {
        try {
            if (request.method() != HttpMethod.GET) {
                return ServerResponse.empty(405).header(Protocol.H_ALLOW, HttpMethod.GET.name());
            }
            if (!Headers.acceptsEventStream(Headers.firstValue(request.headers(), Protocol.H_ACCEPT))) {
                return ServerResponse.error(406, "event_stream_required");
            }

            Optional<StreamUser> user;
            try {
                user = authenticator.authenticate(request);
            } catch (Exception e) {
                log.debug("Authentication failed for {}", request.uri(), e);
                user = Optional.empty();
            }
            if (user == null || user.isEmpty()) {
                return ServerResponse.empty(403);
            }

            String resumeId = Headers.lastEventId(request.headers()).orElse(null);
            ConnectionSession session = new ConnectionSession(
                    user.get(), resumeId, List.copyOf(registry.getAll().values()), transportSelector, frames, settings, clock);
            EventStreamPublisher publisher = new EventStreamPublisher(session, executor, activeConnections);

            return new ServerResponse(200, new ResponseBody.Sse(publisher))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM_UTF8)
                    .header(Protocol.H_CACHE_CONTROL, Protocol.CACHE_CONTROL_STREAM)
                    .header(Protocol.H_ACCEL_BUFFERING, Protocol.ACCEL_BUFFERING_OFF)
                    .header(Protocol.H_CONTENT_ENCODING, Protocol.ENCODING_IDENTITY);
        } catch (Exception e) {
            log.error("Event stream request failed for {}", request.uri(), e);
            return ServerResponse.error(500, "internal_error");
        }
    }

    /** Number of connections currently streaming. */
    public int activeConnections() {
        return activeConnections.get();
    }

    public EventStreamSettings settings() {
        return settings;
    }

    /**
     * Shuts down the connection executor when the handler created it; running connections are
     * interrupted.
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}
