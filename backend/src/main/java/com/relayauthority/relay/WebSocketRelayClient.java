package com.relayauthority.relay;

import com.relayauthority.event.MalformedEventException;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relay transport over WebSocket. Each operation opens its own session, which
 * is closed when the operation completes or is cancelled.
 */
public class WebSocketRelayClient implements RelayClient {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRelayClient.class);

    private final URI uri;
    private final WebSocketClient client;
    private final Duration fetchTimeout;
    private final Duration publishTimeout;

    public WebSocketRelayClient(String url, WebSocketClient client, Duration fetchTimeout, Duration publishTimeout) {
        this.uri = URI.create(url);
        this.client = client;
        this.fetchTimeout = fetchTimeout;
        this.publishTimeout = publishTimeout;
    }

    @Override
    public String url() {
        return uri.toString();
    }

    @Override
    public Mono<Void> publish(NostrEvent event) {
        AtomicReference<RelayFrame> ack = new AtomicReference<>();
        return client.execute(uri, session -> session
                        .send(Mono.fromCallable(() -> session.textMessage(RelayFrame.eventMessage(event))))
                        .thenMany(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .mapNotNull(this::parseQuietly)
                                .filter(frame -> frame.type() == RelayFrame.Type.OK && event.id().equals(frame.eventId()))
                                .take(1)
                                .doOnNext(ack::set))
                        .then())
                .timeout(publishTimeout)
                .onErrorMap(error -> !(error instanceof TransportException),
                        error -> new TransportException("Publish of " + event.id() + " to " + uri + " failed", error))
                .then(Mono.<Void>defer(() -> {
                    RelayFrame frame = ack.get();
                    if (frame == null) {
                        return Mono.error(new TransportException("Relay " + uri + " closed before acknowledging " + event.id()));
                    }
                    if (!frame.accepted() && !frame.message().startsWith("duplicate:")) {
                        return Mono.error(new TransportException("Relay " + uri + " rejected " + event.id() + ": " + frame.message()));
                    }
                    return Mono.<Void>empty();
                }));
    }

    @Override
    public Flux<NostrEvent> fetch(RelayFilter filter) {
        return stream(filter, true).timeout(fetchTimeout);
    }

    @Override
    public Flux<NostrEvent> subscribe(RelayFilter filter) {
        return stream(filter, false);
    }

    @Override
    public Mono<NostrEvent> exchange(NostrEvent request, RelayFilter responseFilter) {
        String subscriptionId = newSubscriptionId();
        AtomicReference<NostrEvent> response = new AtomicReference<>();
        return client.execute(uri, session -> session
                        .send(Flux.just(RelayFrame.reqMessage(subscriptionId, responseFilter), RelayFrame.eventMessage(request))
                                .map(session::textMessage))
                        .thenMany(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .mapNotNull(this::parseQuietly)
                                .filter(frame -> frame.type() == RelayFrame.Type.EVENT
                                        && subscriptionId.equals(frame.subscriptionId()))
                                .take(1)
                                .doOnNext(frame -> response.set(frame.event())))
                        .then())
                .onErrorMap(error -> !(error instanceof TransportException),
                        error -> new TransportException("Exchange of " + request.id() + " with " + uri + " failed", error))
                .then(Mono.fromSupplier(response::get));
    }

    private static String newSubscriptionId() {
        return "ra-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private Flux<NostrEvent> stream(RelayFilter filter, boolean closeOnEose) {
        return Flux.create(sink -> {
            String subscriptionId = newSubscriptionId();
            Disposable connection = client.execute(uri, session -> session
                            .send(Mono.fromCallable(() -> session.textMessage(RelayFrame.reqMessage(subscriptionId, filter))))
                            .thenMany(session.receive()
                                    .map(WebSocketMessage::getPayloadAsText)
                                    .mapNotNull(this::parseQuietly)
                                    .filter(frame -> subscriptionId.equals(frame.subscriptionId()))
                                    .takeWhile(frame -> !(closeOnEose && frame.type() == RelayFrame.Type.EOSE))
                                    .doOnNext(frame -> {
                                        if (frame.type() == RelayFrame.Type.EVENT) {
                                            sink.next(frame.event());
                                        } else if (frame.type() == RelayFrame.Type.CLOSED) {
                                            sink.error(new TransportException(
                                                    "Relay " + uri + " closed subscription: " + frame.message()));
                                        }
                                    }))
                            .then())
                    .subscribe(null,
                            error -> sink.error(error instanceof TransportException ? error
                                    : new TransportException("Subscription to " + uri + " failed", error)),
                            sink::complete);
            sink.onDispose(connection);
        });
    }

    private RelayFrame parseQuietly(String text) {
        try {
            RelayFrame frame = RelayFrame.parse(text);
            if (frame.type() == RelayFrame.Type.NOTICE) {
                log.debug("NOTICE from {}: {}", uri, frame.message());
            }
            return frame;
        } catch (MalformedEventException e) {
            log.debug("Ignoring unparseable frame from {}: {}", uri, e.getMessage());
            return null;
        }
    }
}
