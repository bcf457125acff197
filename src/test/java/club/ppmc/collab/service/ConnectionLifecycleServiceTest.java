package club.ppmc.collab.service;

import static club.ppmc.collab.support.TestSessions.framesOfType;
import static club.ppmc.collab.support.TestSessions.open;
import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.collab.dto.ClientMessage;
import club.ppmc.collab.model.NegotiationPhase;
import club.ppmc.collab.support.Relay;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

class ConnectionLifecycleServiceTest {

    private Relay relay;
    private ConnectionLifecycleService lifecycle;
    private WebSocketSession alice;
    private WebSocketSession bob;

    @BeforeEach
    void setUp() {
        relay = new Relay();
        lifecycle = relay.lifecycle;
        alice = open("a");
        bob = open("b");
        relay.presence.join(alice, new ClientMessage.Join("alice@x", "r1"));
        relay.presence.join(bob, new ClientMessage.Join("bob@x", "r1"));
    }

    @Test
    void disconnectIsAnnouncedExactlyOnce() {
        assertThat(lifecycle.onDisconnect(bob)).isPresent();
        assertThat(lifecycle.onDisconnect(bob)).isEmpty();

        var left = framesOfType(alice, "participant-left");
        assertThat(left).hasSize(1);
        assertThat(left.get(0).get("identity").asText()).isEqualTo("bob@x");
        assertThat(left.get(0).get("connection").asText()).isEqualTo("b");
        assertThat(relay.registry.lookupConnection("bob@x")).isEmpty();
    }

    @Test
    void leaveThenDisconnectIsAnnouncedOnce() {
        lifecycle.onLeave(bob, "r1");
        lifecycle.onDisconnect(bob);

        assertThat(framesOfType(alice, "participant-left")).hasSize(1);
    }

    @Test
    void disconnectOfACallPartyTearsDownTheNegotiation() {
        var offer = JsonNodeFactory.instance.objectNode().put("sdp", "v=0");
        relay.negotiation.requestCall(alice, new ClientMessage.CallRequest("b", offer, null));
        relay.negotiation.acceptCall(bob, new ClientMessage.CallAccept("a", offer));
        assertThat(relay.negotiation.phaseOf("r1")).isEqualTo(NegotiationPhase.CONNECTED);

        lifecycle.onDisconnect(alice);

        assertThat(relay.negotiation.phaseOf("r1")).isEqualTo(NegotiationPhase.IDLE);
        assertThat(framesOfType(bob, "participant-left")).hasSize(1);
    }

    @Test
    void leavingOneRoomOnlyNotifiesThatRoom() {
        var carol = open("c");
        relay.presence.join(carol, new ClientMessage.Join("carol@x", "r2"));
        relay.presence.join(alice, new ClientMessage.Join("alice@x", "r2"));

        var departure = lifecycle.onLeave(alice, "r2");

        assertThat(departure).hasValueSatisfying(d -> assertThat(d.rooms()).containsExactly("r2"));
        assertThat(framesOfType(carol, "participant-left")).hasSize(1);
        assertThat(framesOfType(bob, "participant-left")).isEmpty();
        assertThat(relay.registry.isMember("a", "r1")).isTrue();
    }

    @Test
    void leaveWithoutRoomLeavesEverything() {
        lifecycle.onLeave(bob, null);

        assertThat(relay.registry.connection("b")).isEmpty();
        assertThat(framesOfType(alice, "participant-left")).hasSize(1);
    }

    @Test
    void disconnectOfAnUnregisteredSessionIsIgnored() {
        assertThat(lifecycle.onDisconnect(open("stranger"))).isEmpty();
        assertThat(framesOfType(alice, "participant-left")).isEmpty();
    }
}
