package com.recaprio.projection.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Bulk import payload: clusters with their properties and a batch of stat samples.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImportRequest {

    @Valid
    @NotEmpty
    @JsonProperty("clusters")
    private List<ClusterData> clusters = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClusterData {
        @Valid
        @NotNull
        @JsonProperty("properties")
        private ClusterProperty properties;

        @Valid
        @JsonProperty("stats")
        private List<ClusterStat> stats = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClusterProperty {
        @NotBlank
        @JsonProperty("cluster_name")
        private String clusterName;

        @JsonProperty("environment")
        private String environment;

        @JsonProperty("region")
        private String region;

        @JsonProperty("owner")
        private String owner;

        @JsonProperty("description")
        private String description;

        @JsonProperty("is_active")
        private boolean active = true;
    }

    /**
     * One stat sample. Only the newest sample of a cluster becomes its base row;
     * property names are the base relation's column names.
     */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClusterStat {
        @NotNull
        @JsonProperty("timestamp")
        private LocalDateTime timestamp;

        @JsonProperty("cpu_usage")
        private Double cpuUsage;

        @JsonProperty("memory_usage")
        private Double memoryUsage;

        @JsonProperty("storage_usage")
        private Double storageUsage;

        @JsonProperty("network_throughput")
        private Double networkThroughput;

        @JsonProperty("active_connections")
        private Integer activeConnections;

        @JsonProperty("request_count")
        private Integer requestCount;

        @JsonProperty("response_time_ms")
        private Integer responseTimeMs;

        @JsonProperty("error_count")
        private Integer errorCount;

        @JsonProperty("FreeGHz")
        private Double freeGhz;
    }
}
