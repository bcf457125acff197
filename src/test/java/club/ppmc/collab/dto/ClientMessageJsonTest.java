package club.ppmc.collab.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ClientMessageJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void bindsJoin() throws Exception {
        var message = objectMapper.readValue("{\"type\":\"join\",\"identity\":\"alice@x\",\"room\":\"r1\"}",
                ClientMessage.class);

        assertThat(message).isEqualTo(new ClientMessage.Join("alice@x", "r1"));
        assertThat(message.type()).isEqualTo(MessageType.JOIN);
    }

    @Test
    void keepsSessionDescriptionsUntouched() throws Exception {
        var json = "{\"type\":\"call-request\",\"to\":\"b\",\"identity\":\"alice@x\","
                + "\"offer\":{\"type\":\"offer\",\"sdp\":\"v=0\\r\\no=- 1 2 IN IP4 127.0.0.1\"}}";

        var message = (ClientMessage.CallRequest) objectMapper.readValue(json, ClientMessage.class);

        assertThat(message.to()).isEqualTo("b");
        assertThat(message.offer().get("type").asText()).isEqualTo("offer");
        assertThat(message.offer().get("sdp").asText()).startsWith("v=0\r\n");
    }

    @Test
    void bindsMediaToggleFlag() throws Exception {
        var message = objectMapper.readValue("{\"type\":\"audio-toggle\",\"to\":\"b\",\"isOff\":true}",
                ClientMessage.class);

        assertThat(message).isInstanceOf(ClientMessage.AudioToggle.class);
        assertThat(((ClientMessage.AudioToggle) message).isOff()).isTrue();
    }

    @Test
    void ignoresUnknownFields() throws Exception {
        var message = objectMapper.readValue("{\"type\":\"whiteboard-clear\",\"room\":\"r1\",\"extra\":42}",
                ClientMessage.class);

        assertThat(message).isEqualTo(new ClientMessage.WhiteboardClear("r1"));
        assertThat(message.type().wireName()).isEqualTo("whiteboard-clear");
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"type\":\"teleport\"}", ClientMessage.class))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void rejectsMissingType() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"room\":\"r1\"}", ClientMessage.class))
                .isInstanceOf(JsonProcessingException.class);
    }
}
