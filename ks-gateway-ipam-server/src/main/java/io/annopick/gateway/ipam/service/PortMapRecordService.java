package io.annopick.gateway.ipam.service;

import io.annopick.gateway.ipam.config.IpamProperties;
import io.annopick.gateway.ipam.model.PortMapping;
import io.annopick.gateway.ipam.model.ProbeTarget;
import io.annopick.gateway.ipam.repository.PortMappingRepository;
import io.annopick.gateway.ipam.repository.PortMappingSpecifications;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Durable port mapping records. Every statement runs in its own transaction that commits on
 * success and rolls back on failure; database errors surface as {@link StoreException}.
 */
@Slf4j
@Service
public class PortMapRecordService {

    private final PortMappingRepository repository;
    private final TransactionOperations transactions;
    private final IpamProperties properties;
    private final Random random;

    @Autowired
    public PortMapRecordService(PortMappingRepository repository,
                                PlatformTransactionManager transactionManager,
                                IpamProperties properties) {
        this(repository, new TransactionTemplate(transactionManager), properties, new Random());
    }

    PortMapRecordService(PortMappingRepository repository, TransactionOperations transactions,
                         IpamProperties properties, Random random) {
        this.repository = repository;
        this.transactions = transactions;
        this.properties = properties;
        this.random = random;
    }

    /**
     * Insert a record under a random, unused connection port and return that port.
     * Collisions with other writers are retried with a fresh port.
     *
     * @throws CapacityExhaustedException if every attempt collided
     * @throws StoreException for any failure other than a collision
     */
    public int addRecord(String targetAddr, int targetPort, String targetName, String targetComponent) {
        IpamProperties.PortsConfig ports = properties.getPorts();
        if (ports.getMin() > ports.getMax()) {
            throw new IllegalStateException(
                String.format("Invalid port range %d-%d", ports.getMin(), ports.getMax()));
        }
        int span = ports.getMax() - ports.getMin() + 1;
        for (int attempt = 1; attempt <= ports.getInsertMaxTries(); attempt++) {
            int connPort = ports.getMin() + random.nextInt(span);
            PortMapping mapping = new PortMapping();
            mapping.setConnPort(connPort);
            mapping.setTargetAddr(targetAddr);
            mapping.setTargetPort(targetPort);
            mapping.setTargetName(targetName);
            mapping.setTargetComponent(targetComponent);
            try {
                execute(status -> repository.saveAndFlush(mapping));
            } catch (StoreException e) {
                if (!e.isUniqueViolation()) {
                    throw e;
                }
                log.debug("Connection port {} already in use, attempt {} of {}",
                    connPort, attempt, ports.getInsertMaxTries());
                continue;
            }
            log.info("Recorded port map {} -> {}:{} for {} ({})",
                connPort, targetAddr, targetPort, targetName, targetComponent);
            return connPort;
        }
        throw new CapacityExhaustedException(
            String.format("Failed to create port map after %d tries", ports.getInsertMaxTries()));
    }

    // Removing a record that does not exist is not an error
    public void deleteRecord(int connPort) {
        int deleted = execute(status -> repository.deleteByConnPort(connPort));
        if (deleted == 0) {
            log.debug("No record for connection port {}, nothing to delete", connPort);
        } else {
            log.info("Deleted record for connection port {}", connPort);
        }
    }

    public TargetInfo getRecord(int connPort) {
        return execute(status -> repository.findByConnPort(connPort)
            .map(mapping -> new TargetInfo(mapping.getTargetPort(), mapping.getTargetAddr()))
            .orElse(TargetInfo.absent()));
    }

    public Map<Integer, RecordView> lookupByFilter(String name, String addr, String component,
                                                   Integer connPort, Integer targetPort) {
        List<PortMapping> rows = execute(status -> repository.findAll(
            PortMappingSpecifications.matching(name, addr, component, connPort, targetPort)));
        Map<Integer, RecordView> result = new LinkedHashMap<>();
        for (PortMapping row : rows) {
            result.put(row.getConnPort(), RecordView.of(row));
        }
        return result;
    }

    public Map<String, AddressView> lookupAddresses(String name, String addr, String component) {
        List<PortMapping> rows = execute(status -> repository.findAll(
            PortMappingSpecifications.matching(name, addr, component, null, null)));
        Map<String, AddressView> result = new LinkedHashMap<>();
        for (PortMapping row : rows) {
            result.computeIfAbsent(row.getTargetName(), key -> new AddressView())
                .merge(row.getTargetAddr(), row.getTargetComponent(), row.getRoutable());
        }
        return result;
    }

    public List<PortMapping> listRecords() {
        return execute(status -> repository.findAll());
    }

    public List<ProbeTarget> probeTargets() {
        return execute(status -> repository.findProbeTargets());
    }

    public void updateRoutable(String targetName, String targetAddr, boolean routable) {
        int updated = execute(status -> repository.updateRoutable(targetName, targetAddr, routable));
        log.debug("Marked {} record(s) for {} at {} routable={}", updated, targetName, targetAddr, routable);
    }

    private <T> T execute(TransactionCallback<T> action) {
        try {
            return transactions.execute(action);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException(e.getMostSpecificCause().getMessage(), sqlState(e), e);
        }
    }

    private static String sqlState(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException && ((SQLException) cause).getSQLState() != null) {
                return ((SQLException) cause).getSQLState();
            }
        }
        return null;
    }
}
