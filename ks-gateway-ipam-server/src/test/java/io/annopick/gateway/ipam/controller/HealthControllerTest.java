package io.annopick.gateway.ipam.controller;

import io.annopick.gateway.ipam.firewall.CommandException;
import io.annopick.gateway.ipam.firewall.FirewallService;
import io.annopick.gateway.ipam.model.PortMapping;
import io.annopick.gateway.ipam.service.PortMapRecordService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private PortMapRecordService recordService;

    @Mock
    private FirewallService firewallService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(recordService, firewallService)).build();
    }

    @Test
    void shouldReportDatabaseAndFirewall() throws Exception {
        PortMapping mapping = new PortMapping();
        mapping.setConnPort(50001);
        mapping.setTargetAddr("2.3.4.5");
        when(recordService.listRecords()).thenReturn(List.of(mapping));
        when(firewallService.showRaw("nat")).thenReturn("nat rules");
        when(firewallService.showRaw("filter")).thenReturn("filter rules");

        mockMvc.perform(get("/api/1/ipam/healthcheck"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").exists())
            .andExpect(jsonPath("$.database[0].targetAddr").value("2.3.4.5"))
            .andExpect(jsonPath("$.firewall.nat").value("nat rules"))
            .andExpect(jsonPath("$.firewall.filter").value("filter rules"));
    }

    @Test
    void shouldReportFailure() throws Exception {
        when(recordService.listRecords()).thenReturn(List.of());
        when(firewallService.showRaw("nat")).thenThrow(new CommandException("sudo iptables", 1, "Permission denied"));

        mockMvc.perform(get("/api/1/ipam/healthcheck"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Command \"sudo iptables\" exited with code 1: Permission denied"));
    }
}
