package com.relayauthority.control;

import com.relayauthority.TestKeys;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.NostrEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SignerWebSocketHandlerTest {

    @Mock
    private ControlMessageOrchestrator orchestrator;

    private SignerWebSocketHandler handler;

    @BeforeEach
    void setup() {
        handler = new SignerWebSocketHandler(orchestrator);
    }

    @Test
    void acceptedMessageIsAnsweredWithSignedId() {
        NostrEvent original = TestKeys.signed(TestKeys.ALICE, 1, 100, List.of(), "hi");
        NostrEvent signed = TestKeys.signed(TestKeys.AUTHORITY, 1, 200, List.of(), "hi");
        when(orchestrator.process(original)).thenReturn(Mono.just(
                ProcessedMessage.forwarded(ControlMessageType.GENERAL, original, signed)));

        StepVerifier.create(handler.reply("[\"EVENT\"," + EventCodec.toJson(original) + "]"))
                .expectNext("[\"OK\",\"" + original.id() + "\",true,\"signed:" + signed.id() + "\"]")
                .verifyComplete();
    }

    @Test
    void rejectedMessageCarriesReason() {
        NostrEvent original = TestKeys.signed(TestKeys.MALLORY, 1, 100, List.of(), "spam");
        when(orchestrator.process(original)).thenReturn(Mono.just(
                ProcessedMessage.rejected(ControlMessageType.GENERAL, original, "restricted: not an admin or editor")));

        StepVerifier.create(handler.reply("[\"EVENT\"," + EventCodec.toJson(original) + "]"))
                .expectNext("[\"OK\",\"" + original.id() + "\",false,\"restricted: not an admin or editor\"]")
                .verifyComplete();
    }

    @Test
    void garbageAndNonEventFramesGetNotice() {
        StepVerifier.create(handler.reply("hello"))
                .expectNextMatches(frame -> frame.startsWith("[\"NOTICE\",\"error: "))
                .verifyComplete();
        StepVerifier.create(handler.reply("[\"REQ\",\"sub\",{}]"))
                .expectNext("[\"NOTICE\",\"error: only EVENT is accepted here\"]")
                .verifyComplete();
        verifyNoInteractions(orchestrator);
    }
}
