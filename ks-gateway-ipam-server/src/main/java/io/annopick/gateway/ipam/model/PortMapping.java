package io.annopick.gateway.ipam.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "ipam")
public class PortMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Integer connPort;

    @Column(nullable = false, length = 15)
    private String targetAddr;

    @Column(nullable = false)
    private Integer targetPort;

    @Column(nullable = false, length = 255)
    private String targetName;

    @Column(nullable = false, length = 255)
    private String targetComponent;

    // Written only by the liveness prober
    @Column
    private Boolean routable;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
