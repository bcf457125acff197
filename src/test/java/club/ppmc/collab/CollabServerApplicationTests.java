package club.ppmc.collab;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.collab.config.WebSocketConfig;
import club.ppmc.collab.handler.CollabWebSocketHandler;
import club.ppmc.collab.scheduler.NegotiationTimeoutTask;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CollabServerApplicationTests {

    @LocalServerPort
    private int port;

    @Autowired
    private CollabWebSocketHandler handler;

    @Autowired
    private NegotiationTimeoutTask negotiationTimeoutTask;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        assertThat(handler).isNotNull();
        assertThat(negotiationTimeoutTask.expireUnansweredOffers()).isZero();
    }

    @Test
    void joinsOverARealWebSocket() throws Exception {
        var received = new LinkedBlockingQueue<String>();
        var session = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                        received.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + WebSocketConfig.COLLAB_PATH)
                .get(5, TimeUnit.SECONDS);
        try {
            session.sendMessage(new TextMessage("{\"type\":\"join\",\"identity\":\"alice@x\",\"room\":\"r1\"}"));

            assertThat(next(received).get("type").asText()).isEqualTo("joined");
            var roster = next(received);
            assertThat(roster.get("type").asText()).isEqualTo("room-roster");
            assertThat(roster.get("participants").get(0).get("identity").asText()).isEqualTo("alice@x");
        } finally {
            session.close();
        }
    }

    private JsonNode next(BlockingQueue<String> received) throws Exception {
        var payload = received.poll(5, TimeUnit.SECONDS);
        assertThat(payload).as("frame within 5 s").isNotNull();
        return objectMapper.readTree(payload);
    }
}
