package io.annopick.gateway.ipam.repository;

import io.annopick.gateway.ipam.model.PortMapping;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjunctive filters over {@link PortMapping}. A {@code null} argument imposes no constraint.
 */
public final class PortMappingSpecifications {

    private PortMappingSpecifications() {
    }

    public static Specification<PortMapping> matching(String targetName, String targetAddr, String targetComponent,
                                                      Integer connPort, Integer targetPort) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (targetName != null) {
                predicates.add(cb.equal(root.get("targetName"), targetName));
            }
            if (targetAddr != null) {
                predicates.add(cb.equal(root.get("targetAddr"), targetAddr));
            }
            if (targetComponent != null) {
                predicates.add(cb.equal(root.get("targetComponent"), targetComponent));
            }
            if (connPort != null) {
                predicates.add(cb.equal(root.get("connPort"), connPort));
            }
            if (targetPort != null) {
                predicates.add(cb.equal(root.get("targetPort"), targetPort));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
