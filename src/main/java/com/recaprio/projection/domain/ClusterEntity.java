package com.recaprio.projection.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

/**
 * Cluster properties; assigns the {@code cluster_id} that keys the base relation.
 */
@Data
@Entity
@Table(name = "cluster_properties")
public class ClusterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cluster_id")
    private Long clusterId;

    @Column(name = "cluster_name", nullable = false, unique = true, length = 100)
    private String clusterName;

    @Column(length = 50)
    private String environment;

    @Column(length = 50)
    private String region;

    @Column(length = 100)
    private String owner;

    @Column(length = 2000)
    private String description;

    @Column(name = "is_active")
    private boolean active = true;

    @Column(name = "last_updated")
    private Instant lastUpdated;
}
