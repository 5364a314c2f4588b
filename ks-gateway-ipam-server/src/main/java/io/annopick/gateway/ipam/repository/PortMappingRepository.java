package io.annopick.gateway.ipam.repository;

import io.annopick.gateway.ipam.model.PortMapping;
import io.annopick.gateway.ipam.model.ProbeTarget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.List;
import java.util.Optional;

@Repository
public interface PortMappingRepository extends JpaRepository<PortMapping, Long>, JpaSpecificationExecutor<PortMapping> {

    Optional<PortMapping> findByConnPort(Integer connPort);

    @Modifying
    @Query("DELETE FROM PortMapping p WHERE p.connPort = :connPort")
    int deleteByConnPort(@Param("connPort") Integer connPort);

    @Query("SELECT DISTINCT new io.annopick.gateway.ipam.model.ProbeTarget(p.targetName, p.targetAddr) FROM PortMapping p")
    List<ProbeTarget> findProbeTargets();

    @Modifying
    @Query("UPDATE PortMapping p SET p.routable = :routable WHERE p.targetName = :targetName AND p.targetAddr = :targetAddr")
    int updateRoutable(@Param("targetName") String targetName,
                       @Param("targetAddr") String targetAddr,
                       @Param("routable") Boolean routable);
}
