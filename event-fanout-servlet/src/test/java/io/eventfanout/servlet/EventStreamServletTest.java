package io.eventfanout.servlet;

import io.eventfanout.core.Event;
import io.eventfanout.json.jackson.JacksonJsonCodec;
import io.eventfanout.server.core.Authenticator;
import io.eventfanout.server.core.EventStreamHandler;
import io.eventfanout.server.core.EventStreamSettings;
import io.eventfanout.server.core.ProviderRegistry;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventStreamServletTest {

    private final ProviderRegistry registry = new ProviderRegistry();
    private final HttpServletRequest req = mock(HttpServletRequest.class);
    private final HttpServletResponse resp = mock(HttpServletResponse.class);
    private final AsyncContext async = mock(AsyncContext.class);
    private final CountDownLatch completed = new CountDownLatch(1);
    private EventStreamHandler handler;

    @AfterEach
    void tearDown() {
        if (handler != null) handler.close();
    }

    @Test
    void unauthenticatedRequestIsRejectedWithoutStartingAsync() throws Exception {
        handler = handler(Authenticator.denyAll(), Duration.ofSeconds(60));
        stubRequest("GET", Map.of(), null);

        new EventStreamServlet(handler).service(req, resp);

        verify(resp).setStatus(403);
        verify(req, never()).startAsync();
    }

    @Test
    void streamsFramesAndCompletesAtLifetimeCap() throws Exception {
        registry.register("notifications", (user, resumeId) -> provider(
                Event.of("notifications", "count", Map.of("unread", 5), resumeId)));
        handler = handler(Authenticator.fromPrincipal(), Duration.ofMillis(300));
        stubRequest("GET", Map.of("Last-Event-ID", List.of("n-9")), () -> "42");
        RecordingOutputStream out = new RecordingOutputStream(false);
        stubAsync(out);

        new EventStreamServlet(handler).service(req, resp);

        assertThat(completed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(out.text()).isEqualTo("event: notifications.count\nid: n-9\ndata: {\"unread\":5}\n\n");
        verify(resp).setStatus(200);
        verify(resp).setContentType("text/event-stream; charset=utf-8");
        verify(resp).addHeader("Cache-Control", "no-cache, no-transform");
        verify(resp).addHeader("X-Accel-Buffering", "no");
        verify(resp).addHeader("Content-Encoding", "identity");
        verify(async).setTimeout(0);
    }

    @Test
    void writeFailureCancelsTheConnection() throws Exception {
        registry.register("chat", (user, resumeId) -> provider(Event.of("chat", "hello", "x")));
        handler = handler(Authenticator.fromPrincipal(), Duration.ofSeconds(60));
        stubRequest("GET", Map.of(), () -> "42");
        stubAsync(new RecordingOutputStream(true));

        new EventStreamServlet(handler).service(req, resp);

        assertThat(completed.await(5, TimeUnit.SECONDS)).isTrue();
        awaitNoActiveConnections();
    }

    @Test
    void containerEndingAsyncCycleCancelsTheConnection() throws Exception {
        handler = handler(Authenticator.fromPrincipal(), Duration.ofSeconds(60));
        stubRequest("GET", Map.of(), () -> "42");
        stubAsync(new RecordingOutputStream(false));
        ArgumentCaptor<AsyncListener> listener = ArgumentCaptor.forClass(AsyncListener.class);

        new EventStreamServlet(handler).service(req, resp);

        verify(async).addListener(listener.capture());
        long until = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (handler.activeConnections() == 0 && System.nanoTime() < until) {
            Thread.sleep(5);
        }
        listener.getValue().onError(new AsyncEvent(async, new IOException("broken pipe")));

        awaitNoActiveConnections();
    }

    @Test
    void unknownMethodIsNotAllowed() throws Exception {
        handler = handler(Authenticator.fromPrincipal(), Duration.ofSeconds(60));
        stubRequest("PROPFIND", Map.of(), () -> "42");

        new EventStreamServlet(handler).service(req, resp);

        verify(resp).setStatus(405);
        verify(resp).addHeader("Allow", "GET");
    }

    private EventStreamHandler handler(Authenticator authenticator, Duration maxLifetime) {
        return EventStreamHandler.builder(registry)
                .authenticator(authenticator)
                .jsonCodec(new JacksonJsonCodec())
                .settings(EventStreamSettings.builder()
                        .maxLifetime(maxLifetime)
                        .pollTick(Duration.ofMillis(20))
                        .build())
                .build();
    }

    private void stubRequest(String method, Map<String, List<String>> headers, Principal principal) {
        when(req.getMethod()).thenReturn(method);
        when(req.getRequestURL()).thenReturn(new StringBuffer("http://localhost/events/stream"));
        when(req.getRequestURI()).thenReturn("/events/stream");
        when(req.getHeaderNames()).thenReturn(Collections.enumeration(headers.keySet()));
        when(req.getHeaders(anyString())).thenAnswer(inv ->
                Collections.enumeration(headers.getOrDefault(inv.<String>getArgument(0), List.of())));
        when(req.getUserPrincipal()).thenReturn(principal);
    }

    private void stubAsync(ServletOutputStream out) throws IOException {
        when(req.startAsync()).thenReturn(async);
        when(resp.getOutputStream()).thenReturn(out);
        doAnswer(inv -> {
            completed.countDown();
            return null;
        }).when(async).complete();
        doAnswer(inv -> null).when(async).addListener(any(AsyncListener.class));
    }

    private void awaitNoActiveConnections() throws InterruptedException {
        long until = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (handler.activeConnections() > 0 && System.nanoTime() < until) {
            Thread.sleep(5);
        }
        assertThat(handler.activeConnections()).isZero();
    }

    private static EventProvider provider(Event initial) {
        return new EventProvider() {
            @Override
            public List<Event> initialEvents() {
                return List.of(initial);
            }

            @Override
            public List<Event> poll(DirtyToken dirtyToken) {
                return List.of();
            }
        };
    }

    private static final class RecordingOutputStream extends ServletOutputStream {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private final boolean failing;

        RecordingOutputStream(boolean failing) {
            this.failing = failing;
        }

        @Override
        public void write(int b) throws IOException {
            if (failing) throw new IOException("connection reset by peer");
            synchronized (bytes) {
                bytes.write(b);
            }
        }

        String text() {
            synchronized (bytes) {
                return bytes.toString(StandardCharsets.UTF_8);
            }
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
        }
    }
}
