package com.relayauthority.control;

import com.relayauthority.event.MalformedEventException;
import com.relayauthority.relay.RelayFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

/**
 * Relay-protocol endpoint where administrators hand in control messages for countersigning.
 * Each {@code ["EVENT", ev]} is answered with {@code ["OK", id, accepted, message]}.
 */
public class SignerWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SignerWebSocketHandler.class);

    private final ControlMessageOrchestrator orchestrator;

    public SignerWebSocketHandler(ControlMessageOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        log.debug("Signer session {} opened", session.getId());
        return session.send(session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(this::reply)
                .map(session::textMessage))
                .doFinally(signal -> log.debug("Signer session {} closed ({})", session.getId(), signal));
    }

    Mono<String> reply(String text) {
        RelayFrame frame;
        try {
            frame = RelayFrame.parse(text);
        } catch (MalformedEventException e) {
            return Mono.just(RelayFrame.noticeMessage("error: " + e.getMessage()));
        }
        if (frame.type() != RelayFrame.Type.EVENT) {
            return Mono.just(RelayFrame.noticeMessage("error: only EVENT is accepted here"));
        }
        return orchestrator.process(frame.event())
                .map(result -> result.isAccepted()
                        ? RelayFrame.okMessage(result.original().id(), true, "signed:" + result.signed().id())
                        : RelayFrame.okMessage(result.original().id(), false, result.reason()));
    }
}
