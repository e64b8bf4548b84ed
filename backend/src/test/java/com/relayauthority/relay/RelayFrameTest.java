package com.relayauthority.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayauthority.TestKeys;
import com.relayauthority.event.EventCodec;
import com.relayauthority.event.MalformedEventException;
import com.relayauthority.event.NostrEvent;
import com.relayauthority.event.RelayFilter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RelayFrameTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesClientAndRelayEventFrames() {
        NostrEvent event = TestKeys.signed(TestKeys.ALICE, 1, 10L, List.of(), "hi");
        String json = EventCodec.toJson(event);

        RelayFrame fromClient = RelayFrame.parse("[\"EVENT\"," + json + "]");
        RelayFrame fromRelay = RelayFrame.parse("[\"EVENT\",\"sub-1\"," + json + "]");

        assertEquals(RelayFrame.Type.EVENT, fromClient.type());
        assertNull(fromClient.subscriptionId());
        assertEquals(event, fromClient.event());
        assertEquals("sub-1", fromRelay.subscriptionId());
        assertEquals(event, fromRelay.event());
    }

    @Test
    void parsesOkNoticeAndEose() {
        RelayFrame ok = RelayFrame.parse("[\"OK\",\"abc\",false,\"blocked: nope\"]");
        RelayFrame notice = RelayFrame.parse("[\"NOTICE\",\"slow down\"]");
        RelayFrame eose = RelayFrame.parse("[\"EOSE\",\"sub-2\"]");

        assertEquals("abc", ok.eventId());
        assertFalse(ok.accepted());
        assertEquals("blocked: nope", ok.message());
        assertEquals("slow down", notice.message());
        assertEquals(RelayFrame.Type.EOSE, eose.type());
        assertEquals("sub-2", eose.subscriptionId());
    }

    @Test
    void rejectsUnknownAndBrokenFrames() {
        assertThrows(MalformedEventException.class, () -> RelayFrame.parse("{}"));
        assertThrows(MalformedEventException.class, () -> RelayFrame.parse("[\"AUTH\",\"x\"]"));
        assertThrows(MalformedEventException.class, () -> RelayFrame.parse("[\"OK\",\"abc\"]"));
        assertThrows(MalformedEventException.class, () -> RelayFrame.parse("[\"EVENT\",{\"id\":1}]"));
        assertThrows(MalformedEventException.class, () -> RelayFrame.parse("[\"EVENT\""));
    }

    @Test
    void writesRequestWithFilter() throws Exception {
        String req = RelayFrame.reqMessage("s1", RelayFilter.forKinds(30000)
                .withAuthors("aa")
                .withTag("d", "admins", "editors")
                .withSince(5)
                .withLimit(1));

        var node = mapper.readTree(req);
        assertEquals("REQ", node.get(0).asText());
        assertEquals("s1", node.get(1).asText());
        assertEquals(30000, node.get(2).get("kinds").get(0).asInt());
        assertEquals("aa", node.get(2).get("authors").get(0).asText());
        assertEquals("editors", node.get(2).get("#d").get(1).asText());
        assertEquals(5, node.get(2).get("since").asLong());
        assertEquals(1, node.get(2).get("limit").asInt());
    }

    @Test
    void writesOkAndNotice() {
        assertEquals("[\"OK\",\"id1\",true,\"signed:id2\"]", RelayFrame.okMessage("id1", true, "signed:id2"));
        assertEquals("[\"NOTICE\",\"error: bad\"]", RelayFrame.noticeMessage("error: bad"));
    }
}
