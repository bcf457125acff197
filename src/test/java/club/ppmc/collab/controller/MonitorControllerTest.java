package club.ppmc.collab.controller;

import static club.ppmc.collab.support.TestSessions.open;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.collab.dto.ClientMessage;
import club.ppmc.collab.support.Relay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class MonitorControllerTest {

    private Relay relay;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        relay = new Relay();
        mockMvc = MockMvcBuilders.standaloneSetup(new MonitorController(relay.registry, relay.negotiation, relay.clock)).build();
    }

    @Test
    void statusReportsLiveCounts() throws Exception {
        relay.presence.join(open("a"), new ClientMessage.Join("alice@x", "r1"));
        relay.presence.join(open("b"), new ClientMessage.Join("bob@x", "r1"));
        relay.presence.join(open("c"), new ClientMessage.Join("carol@x", "r2"));

        mockMvc.perform(get("/api/monitor/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.onlineConnections").value(3))
                .andExpect(jsonPath("$.activeRooms").value(2))
                .andExpect(jsonPath("$.activeNegotiations").value(0))
                .andExpect(jsonPath("$.serverTime").value(relay.clock.millis()))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.errorMessage").doesNotExist());
    }

    @Test
    void roomShowsMembersAndPhase() throws Exception {
        relay.presence.join(open("a"), new ClientMessage.Join("alice@x", "r1"));
        relay.presence.join(open("b"), new ClientMessage.Join("bob@x", "r1"));

        mockMvc.perform(get("/api/monitor/rooms/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room").value("r1"))
                .andExpect(jsonPath("$.participants.length()").value(2))
                .andExpect(jsonPath("$.participants[0].identity").value("alice@x"))
                .andExpect(jsonPath("$.participants[1].connection").value("b"))
                .andExpect(jsonPath("$.negotiationPhase").value("IDLE"));
    }

    @Test
    void unknownRoomIsNotFound() throws Exception {
        mockMvc.perform(get("/api/monitor/rooms/nowhere")).andExpect(status().isNotFound());
    }
}
