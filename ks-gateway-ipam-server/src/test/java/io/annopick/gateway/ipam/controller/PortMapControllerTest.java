package io.annopick.gateway.ipam.controller;

import io.annopick.gateway.ipam.config.IpamProperties;
import io.annopick.gateway.ipam.service.CapacityExhaustedException;
import io.annopick.gateway.ipam.service.MappingResult;
import io.annopick.gateway.ipam.service.MappingStatus;
import io.annopick.gateway.ipam.service.PortMapCoordinator;
import io.annopick.gateway.ipam.service.RecordView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PortMapControllerTest {

    private static final String TOKEN = "s3cret";

    @Mock
    private PortMapCoordinator coordinator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        IpamProperties properties = new IpamProperties();
        properties.getSecurity().setApiToken(TOKEN);
        mockMvc = MockMvcBuilders.standaloneSetup(new PortMapController(coordinator, properties)).build();
    }

    @Test
    void shouldRejectMissingToken() throws Exception {
        mockMvc.perform(get("/api/1/ipam/portmap"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Invalid API token"));
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldRejectWrongToken() throws Exception {
        mockMvc.perform(get("/api/1/ipam/portmap").header("X-API-Token", "guess"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldLookUpRecords() throws Exception {
        Map<Integer, RecordView> records = new LinkedHashMap<>();
        records.put(50001, new RecordView("myVM", "2.3.4.5", 22, "OneFS", true));
        when(coordinator.lookupRecords("myVM", null, null, null, null)).thenReturn(records);

        mockMvc.perform(get("/api/1/ipam/portmap").header("X-API-Token", TOKEN).param("name", "myVM"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content['50001'].name").value("myVM"))
            .andExpect(jsonPath("$.content['50001'].target_addr").value("2.3.4.5"))
            .andExpect(jsonPath("$.content['50001'].target_port").value(22))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void shouldTreatZeroPortAsNoFilter() throws Exception {
        when(coordinator.lookupRecords(null, null, null, null, 22)).thenReturn(Map.of());

        mockMvc.perform(get("/api/1/ipam/portmap").header("X-API-Token", TOKEN)
                .param("conn_port", "0").param("target_port", "22"))
            .andExpect(status().isOk());
    }

    @Test
    void shouldRejectNonNumericPort() throws Exception {
        mockMvc.perform(get("/api/1/ipam/portmap").header("X-API-Token", TOKEN).param("conn_port", "abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Param conn_port must be a number, supplied: abc"));
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldCreatePortMap() throws Exception {
        when(coordinator.create("2.3.4.5", 22, "myVM", "OneFS")).thenReturn(50001);

        mockMvc.perform(post("/api/1/ipam/portmap").header("X-API-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target_addr\":\"2.3.4.5\",\"target_port\":22,"
                    + "\"target_name\":\"myVM\",\"target_component\":\"OneFS\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content.conn_port").value(50001));
    }

    @Test
    void shouldListMissingFields() throws Exception {
        mockMvc.perform(post("/api/1/ipam/portmap").header("X-API-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target_addr\":\"2.3.4.5\",\"target_name\":\"myVM\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing required field(s): [target_port, target_component]"));
        verify(coordinator, never()).create(anyString(), anyInt(), anyString(), anyString());
    }

    @Test
    void shouldReportCreateFailure() throws Exception {
        when(coordinator.create("2.3.4.5", 22, "myVM", "OneFS"))
            .thenThrow(new CapacityExhaustedException("Failed to create port map after 100 tries"));

        mockMvc.perform(post("/api/1/ipam/portmap").header("X-API-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target_addr\":\"2.3.4.5\",\"target_port\":22,"
                    + "\"target_name\":\"myVM\",\"target_component\":\"OneFS\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Failed to create port map after 100 tries"));
    }

    @Test
    void shouldDestroyPortMap() throws Exception {
        when(coordinator.destroy(50001)).thenReturn(MappingResult.ok());

        mockMvc.perform(delete("/api/1/ipam/portmap").header("X-API-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"conn_port\":50001}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void shouldMapDestroyStatus() throws Exception {
        when(coordinator.destroy(50002))
            .thenReturn(MappingResult.failure("No such port mapping record", MappingStatus.NOT_FOUND));

        mockMvc.perform(delete("/api/1/ipam/portmap").header("X-API-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"conn_port\":50002}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("No such port mapping record"));
    }

    @Test
    void shouldRequireConnectionPortOnDestroy() throws Exception {
        mockMvc.perform(delete("/api/1/ipam/portmap").header("X-API-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
        verify(coordinator, never()).destroy(anyInt());
    }

    @Test
    void shouldShowRawRules() throws Exception {
        when(coordinator.showRawRules("nat")).thenReturn("Chain PREROUTING (policy ACCEPT)\n");

        mockMvc.perform(get("/api/1/ipam/portmap/rules").header("X-API-Token", TOKEN)
                .param("table", "nat").param("format", "raw"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content").value("Chain PREROUTING (policy ACCEPT)\n"));
    }

    @Test
    void shouldRejectUnknownRuleTable() throws Exception {
        when(coordinator.showRules(any())).thenThrow(new IllegalArgumentException(
            "Param \"table\" must be either \"nat\" or \"filter\", supplied: mangle"));

        mockMvc.perform(get("/api/1/ipam/portmap/rules").header("X-API-Token", TOKEN).param("table", "mangle"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Param \"table\" must be either \"nat\" or \"filter\", supplied: mangle"));
    }
}
