package com.recaprio.projection.repository;

import com.recaprio.projection.domain.ClusterEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ClusterRepository extends JpaRepository<ClusterEntity, Long> {
    Optional<ClusterEntity> findByClusterName(String clusterName);
}
