package club.ppmc.collab.handler;

import static club.ppmc.collab.support.TestSessions.frames;
import static club.ppmc.collab.support.TestSessions.framesOfType;
import static club.ppmc.collab.support.TestSessions.open;
import static club.ppmc.collab.support.TestSessions.types;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import club.ppmc.collab.config.WebSocketProperties;
import club.ppmc.collab.model.NegotiationPhase;
import club.ppmc.collab.support.Relay;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class CollabWebSocketHandlerTest {

    private Relay relay;
    private CollabWebSocketHandler handler;
    private WebSocketSession alice;
    private WebSocketSession bob;

    @BeforeEach
    void setUp() {
        relay = new Relay();
        handler = new CollabWebSocketHandler(relay.presence, relay.negotiation, relay.stateRelay, relay.lifecycle,
                relay.sender, relay.objectMapper, webSocketProperties(), relay.clock);
        alice = open("a");
        bob = open("b");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);
    }

    @Test
    void twoParticipantsJoinCallAndShareCode() {
        send(alice, "{\"type\":\"join\",\"identity\":\"alice@x\",\"room\":\"r1\"}");
        send(bob, "{\"type\":\"join\",\"identity\":\"bob@x\",\"room\":\"r1\"}");

        assertThat(framesOfType(alice, "participant-joined")).hasSize(1);
        assertThat(framesOfType(bob, "wait-for-admission").get(0).get("from").asText()).isEqualTo("a");

        send(alice, "{\"type\":\"call-request\",\"to\":\"b\",\"offer\":{\"type\":\"offer\",\"sdp\":\"o\"}}");
        send(bob, "{\"type\":\"call-accept\",\"to\":\"a\",\"answer\":{\"type\":\"answer\",\"sdp\":\"x\"}}");
        assertThat(relay.negotiation.phaseOf("r1")).isEqualTo(NegotiationPhase.CONNECTED);
        assertThat(framesOfType(bob, "incoming-call").get(0).get("offer").get("sdp").asText()).isEqualTo("o");

        send(alice, "{\"type\":\"code-broadcast\",\"room\":\"r1\",\"code\":\"let x = 1;\"}");
        assertThat(framesOfType(bob, "code-update").get(0).get("code").asText()).isEqualTo("let x = 1;");
        assertThat(framesOfType(alice, "code-update")).isEmpty();

        handler.afterConnectionClosed(bob, CloseStatus.GOING_AWAY);
        assertThat(framesOfType(alice, "participant-left").get(0).get("identity").asText()).isEqualTo("bob@x");
        assertThat(relay.negotiation.phaseOf("r1")).isEqualTo(NegotiationPhase.IDLE);
    }

    @Test
    void pingIsAnsweredWithPong() {
        send(alice, "{\"type\":\"ping\",\"sentAt\":1}");

        assertThat(types(alice)).containsExactly("pong");
        assertThat(frames(alice).get(0).get("serverTime").asLong())
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z").toEpochMilli());
    }

    @Test
    void malformedFrameGetsAnErrorAndKeepsTheConnection() throws IOException {
        send(alice, "{not json");
        send(alice, "{\"type\":\"teleport\",\"to\":\"b\"}");

        assertThat(types(alice)).containsExactly("error", "error");
        verify(alice, never()).close(any());
    }

    @Test
    void binaryFramesAreRejected() {
        handler.handleMessage(alice, new BinaryMessage(new byte[] {1, 2, 3}));

        assertThat(types(alice)).containsExactly("error");
    }

    @Test
    void leaveMessageRemovesTheParticipant() {
        send(alice, "{\"type\":\"join\",\"identity\":\"alice@x\",\"room\":\"r1\"}");
        send(bob, "{\"type\":\"join\",\"identity\":\"bob@x\",\"room\":\"r1\"}");

        send(bob, "{\"type\":\"leave\",\"room\":\"r1\"}");
        handler.afterConnectionClosed(bob, CloseStatus.NORMAL);

        assertThat(framesOfType(alice, "participant-left")).hasSize(1);
        assertThat(relay.registry.membersOf("r1")).hasSize(1);
    }

    @Test
    void closeOfAnUnjoinedConnectionIsQuiet() {
        handler.afterConnectionClosed(alice, CloseStatus.NORMAL);

        assertThat(frames(alice)).isEmpty();
        assertThat(frames(bob)).isEmpty();
    }

    private void send(WebSocketSession session, String payload) {
        handler.handleMessage(session, new TextMessage(payload));
    }

    private static WebSocketProperties webSocketProperties() {
        return new WebSocketProperties(
                new WebSocketProperties.Max(DataSize.ofKilobytes(2048), DataSize.ofKilobytes(512), Duration.ofMinutes(30)),
                new WebSocketProperties.Send(Duration.ofSeconds(10), DataSize.ofMegabytes(4)));
    }
}
