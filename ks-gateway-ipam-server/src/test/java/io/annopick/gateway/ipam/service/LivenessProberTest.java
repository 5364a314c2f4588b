package io.annopick.gateway.ipam.service;

import io.annopick.gateway.ipam.config.IpamProperties;
import io.annopick.gateway.ipam.firewall.CommandException;
import io.annopick.gateway.ipam.firewall.CommandResult;
import io.annopick.gateway.ipam.firewall.CommandRunner;
import io.annopick.gateway.ipam.model.ProbeTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LivenessProberTest {

    @Mock
    private PortMapRecordService recordService;

    @Mock
    private CommandRunner commandRunner;

    private IpamProperties properties;
    private LivenessProber prober;

    @BeforeEach
    void setUp() {
        properties = new IpamProperties();
        properties.getProber().setThreads(2);
        properties.getProber().setPingCommand(List.of("ping", "-c", "1"));
        prober = new LivenessProber(recordService, commandRunner, properties);
        prober.startWorkers();
    }

    @AfterEach
    void tearDown() {
        prober.stopWorkers();
    }

    @Test
    void shouldAppendAddressToPingCommand() {
        when(commandRunner.run(List.of("ping", "-c", "1", "10.1.1.5")))
            .thenReturn(new CommandResult("ping -c 1 10.1.1.5", 0, "", ""));

        assertThat(prober.pingable("10.1.1.5")).isTrue();
    }

    @Test
    void shouldTreatFailedPingAsUnreachable() {
        when(commandRunner.run(any())).thenThrow(new CommandException("ping -c 1 10.1.1.6", 1, ""));

        assertThat(prober.pingable("10.1.1.6")).isFalse();
    }

    @Test
    void shouldStoreProbeOutcome() {
        when(commandRunner.run(any())).thenThrow(new CommandException("ping -c 1 10.1.1.6", 1, ""));

        prober.probe(new ProbeTarget("myVM", "10.1.1.6"));

        verify(recordService).updateRoutable("myVM", "10.1.1.6", false);
    }

    @Test
    void shouldProbeEveryTarget() {
        when(recordService.probeTargets()).thenReturn(List.of(
            new ProbeTarget("myVM", "10.1.1.5"), new ProbeTarget("otherVM", "10.1.1.6")));
        when(commandRunner.run(List.of("ping", "-c", "1", "10.1.1.5")))
            .thenReturn(new CommandResult("ping", 0, "", ""));
        when(commandRunner.run(List.of("ping", "-c", "1", "10.1.1.6")))
            .thenThrow(new CommandException("ping", 1, ""));

        prober.probeAll();

        verify(recordService).updateRoutable("myVM", "10.1.1.5", true);
        verify(recordService).updateRoutable("otherVM", "10.1.1.6", false);
    }

    @Test
    void shouldSkipRoundWhenTargetsUnavailable() {
        when(recordService.probeTargets()).thenThrow(new StoreException("connection refused", "08001", null));

        prober.probeAll();

        verify(recordService, never()).updateRoutable(anyString(), anyString(), anyBoolean());
        verifyNoInteractions(commandRunner);
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        properties.getProber().setEnabled(false);

        prober.probeAll();

        verifyNoInteractions(recordService, commandRunner);
    }
}
