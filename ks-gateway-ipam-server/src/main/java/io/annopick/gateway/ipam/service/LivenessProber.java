package io.annopick.gateway.ipam.service;

import io.annopick.gateway.ipam.config.IpamProperties;
import io.annopick.gateway.ipam.firewall.CommandException;
import io.annopick.gateway.ipam.firewall.CommandRunner;
import io.annopick.gateway.ipam.model.ProbeTarget;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pings every recorded machine address on a fixed delay and stores whether it answered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LivenessProber {

    private final PortMapRecordService recordService;
    private final CommandRunner commandRunner;
    private final IpamProperties properties;
    private ExecutorService workers;

    @PostConstruct
    public void startWorkers() {
        AtomicInteger threadId = new AtomicInteger();
        workers = Executors.newFixedThreadPool(properties.getProber().getThreads(), runnable -> {
            Thread thread = new Thread(runnable, "IPAM-worker-thread-" + threadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Started {} liveness worker threads", properties.getProber().getThreads());
    }

    @PreDestroy
    public void stopWorkers() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(20, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    @Scheduled(fixedDelayString = "${ipam.prober.interval-ms:300000}", initialDelay = 10000)
    public void probeAll() {
        if (!properties.getProber().isEnabled()) {
            return;
        }
        List<ProbeTarget> targets;
        try {
            targets = recordService.probeTargets();
        } catch (StoreException e) {
            log.error("Failed to look up IP records", e);
            return;
        }
        log.info("Found {} IP records to check", targets.size());
        List<Future<?>> pending = new ArrayList<>();
        for (ProbeTarget target : targets) {
            pending.add(workers.submit(() -> probe(target)));
        }
        for (Future<?> future : pending) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Liveness check failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    void probe(ProbeTarget target) {
        log.debug("Checking IP {} belonging to {}", target.getTargetAddr(), target.getTargetName());
        boolean routable = pingable(target.getTargetAddr());
        recordService.updateRoutable(target.getTargetName(), target.getTargetAddr(), routable);
        if (!routable) {
            log.info("IP {} owned by {} not pingable", target.getTargetAddr(), target.getTargetName());
        }
    }

    boolean pingable(String addr) {
        List<String> command = new ArrayList<>(properties.getProber().getPingCommand());
        command.add(addr);
        try {
            commandRunner.run(command);
            return true;
        } catch (CommandException e) {
            log.debug("Ping of {} failed: {}", addr, e.getMessage());
            return false;
        }
    }
}
