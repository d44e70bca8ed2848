package io.eventfanout.servlet;

import io.eventfanout.core.Protocol;
import io.eventfanout.core.SseFrame;
import io.eventfanout.server.core.EventStreamHandler;
import io.eventfanout.server.core.HttpMethod;
import io.eventfanout.server.core.ResponseBody;
import io.eventfanout.server.core.ServerRequest;
import io.eventfanout.server.core.ServerResponse;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exposes an {@link EventStreamHandler} as an asynchronous servlet. The container thread is
 * released once the stream is open; frames are written from the connection's own task.
 *
 * <p>Requires {@code asyncSupported=true} on the registration.
 */
public final class EventStreamServlet extends HttpServlet {

    private static final Logger log = LoggerFactory.getLogger(EventStreamServlet.class);

    private final transient EventStreamHandler handler;

    public EventStreamServlet(EventStreamHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ServerResponse engineResp;
        try {
            engineResp = handler.handle(toEngineRequest(req));
        } catch (Exception e) {
            log.error("Cannot map request {}", req.getRequestURI(), e);
            resp.setStatus(500);
            resp.setHeader(Protocol.H_ERROR, "internal_error");
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((name, values) -> values.forEach(v -> {
            if (Protocol.H_CONTENT_TYPE.equalsIgnoreCase(name)) {
                resp.setContentType(v);
            } else {
                resp.addHeader(name, v);
            }
        }));

        if (engineResp.body() instanceof ResponseBody.Sse sse) {
            stream(req, resp, sse.publisher());
        }
    }

    private static void stream(HttpServletRequest req, HttpServletResponse resp, Flow.Publisher<SseFrame> publisher)
            throws IOException {
        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        resp.flushBuffer();

        ServletOutputStream out = resp.getOutputStream();
        AtomicBoolean completed = new AtomicBoolean(false);
        Runnable complete = () -> {
            if (completed.compareAndSet(false, true)) {
                async.complete();
            }
        };

        publisher.subscribe(new Flow.Subscriber<>() {
            private volatile Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                this.subscription = subscription;
                async.addListener(new DisconnectListener(subscription));
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    log.debug("Event stream write failed, closing: {}", e.toString());
                    subscription.cancel();
                    complete.run();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                log.warn("Event stream ended with error", throwable);
                complete.run();
            }

            @Override
            public void onComplete() {
                complete.run();
            }
        });
    }

    static ServerRequest toEngineRequest(HttpServletRequest req) throws Exception {
        HttpMethod method = HttpMethod.parse(req.getMethod());
        URI uri = new URI(req.getRequestURL().toString() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        if (names != null) {
            while (names.hasMoreElements()) {
                String name = names.nextElement();
                headers.put(name, Collections.list(req.getHeaders(name)));
            }
        }
        return new ServerRequest(method, uri, headers, req.getUserPrincipal());
    }

    /**
     * Cancels the stream when the container ends the async cycle (client gone, error, timeout).
     */
    private static final class DisconnectListener implements AsyncListener {
        private final Flow.Subscription subscription;

        private DisconnectListener(Flow.Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            subscription.cancel();
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            subscription.cancel();
        }

        @Override
        public void onError(AsyncEvent event) {
            subscription.cancel();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
        }
    }
}
