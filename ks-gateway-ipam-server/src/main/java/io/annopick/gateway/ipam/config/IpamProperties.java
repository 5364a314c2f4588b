package io.annopick.gateway.ipam.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "ipam")
public class IpamProperties {

    private PortsConfig ports = new PortsConfig();
    private FirewallConfig firewall = new FirewallConfig();
    private SecurityConfig security = new SecurityConfig();
    private ProberConfig prober = new ProberConfig();

    @Data
    public static class PortsConfig {
        private int min = 50000;
        private int max = 50100;
        private int insertMaxTries = 100;
    }

    @Data
    public static class FirewallConfig {
        private List<String> command = new ArrayList<>(List.of("sudo", "iptables"));
        private List<String> saveCommand = new ArrayList<>(List.of("sudo", "iptables-save"));
        private String rulesFile = "/etc/iptables/rules.v4";
        // Interface that receives traffic for the connection ports
        private String externalInterface = "ens160";
    }

    @Data
    public static class SecurityConfig {
        private String apiToken;
    }

    @Data
    public static class ProberConfig {
        private boolean enabled = true;
        private int threads = 10;
        private long intervalMs = 300000;
        private List<String> pingCommand = new ArrayList<>(List.of("/bin/ping", "-W", "2", "-c", "3", "-4", "-I", "ens192"));
    }
}
