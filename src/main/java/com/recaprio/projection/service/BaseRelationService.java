package com.recaprio.projection.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recaprio.projection.domain.BaseRowEntity;
import com.recaprio.projection.domain.ClusterEntity;
import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.model.KeyRange;
import com.recaprio.projection.model.MutationEvent;
import com.recaprio.projection.model.MutationType;
import com.recaprio.projection.model.dto.ImportRequest;
import com.recaprio.projection.model.dto.ImportResult;
import com.recaprio.projection.outbox.MutationOutboxService;
import com.recaprio.projection.repository.BaseRowRepository;
import com.recaprio.projection.repository.ClusterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Write path of the base relation. Every committed change gets a commit sequence from
 * the mutation outbox and is published as a {@link MutationEvent} inside the same
 * transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaseRelationService {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final BaseRowRepository baseRowRepository;
    private final ClusterRepository clusterRepository;
    private final MutationOutboxService outbox;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Inserts the row or replaces all of its attributes.
     *
     * @return the published event, empty when the row already held exactly these values
     */
    @Transactional
    public Optional<MutationEvent> replace(Long key, Map<String, Object> attributes) {
        return write(key, attributes, false);
    }

    /**
     * Inserts the row or overlays {@code changes} on its current attributes.
     */
    @Transactional
    public Optional<MutationEvent> merge(Long key, Map<String, Object> changes) {
        return write(key, changes, true);
    }

    /**
     * @return false when the key does not exist
     */
    @Transactional
    public boolean delete(Long key) {
        Optional<BaseRowEntity> existing = baseRowRepository.findForUpdate(key);
        if (existing.isEmpty()) {
            log.warn("Delete requested for unknown key {}", key);
            return false;
        }
        BaseRowEntity entity = existing.get();
        BaseRow before = entity.toBaseRow();
        Instant now = clock.instant();
        long sequence = outbox.append(MutationType.DELETE, key, before, null, now).getId();
        baseRowRepository.delete(entity);
        MutationEvent event = MutationEvent.delete(key, before, sequence, now);
        log.info("Deleted base row {} at sequence {}", key, sequence);
        eventPublisher.publishEvent(event);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<BaseRow> find(Long key) {
        return baseRowRepository.findById(key).map(BaseRowEntity::toBaseRow);
    }

    /**
     * Up to {@code limit} rows of {@code range} in ascending key order.
     */
    @Transactional(readOnly = true)
    public List<BaseRow> page(KeyRange range, int limit) {
        if (range.isEmpty()) {
            return List.of();
        }
        return baseRowRepository.findByRowKeyBetweenOrderByRowKeyAsc(
                        range.lowerBound(), range.upperBound(), PageRequest.of(0, limit))
                .stream()
                .map(BaseRowEntity::toBaseRow)
                .toList();
    }

    @Transactional(readOnly = true)
    public Set<Long> existingKeys(Collection<Long> keys) {
        if (keys.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(baseRowRepository.findExistingKeys(keys));
    }

    /**
     * Bulk import in one transaction: cluster properties are merged by cluster name,
     * and each cluster's newest stat sample becomes its base row, keyed by cluster id.
     */
    @Transactional
    public ImportResult importClusters(ImportRequest request) {
        int imported = 0;
        for (ImportRequest.ClusterData cluster : request.getClusters()) {
            ClusterEntity entity = upsertCluster(cluster.getProperties());
            Map<String, Object> attributes = propertyAttributes(cluster.getProperties());
            Optional<ImportRequest.ClusterStat> latest = cluster.getStats() == null
                    ? Optional.empty()
                    : cluster.getStats().stream()
                            .filter(stat -> stat.getTimestamp() != null)
                            .max(Comparator.comparing(ImportRequest.ClusterStat::getTimestamp));
            if (latest.isPresent()) {
                attributes.putAll(objectMapper.convertValue(latest.get(), MAP_TYPE));
                write(entity.getClusterId(), attributes, false);
            } else {
                write(entity.getClusterId(), attributes, true);
            }
            imported++;
        }
        log.info("Imported {} clusters", imported);
        return new ImportResult("success", "Imported " + imported + " clusters with their stats");
    }

    private ClusterEntity upsertCluster(ImportRequest.ClusterProperty properties) {
        ClusterEntity entity = clusterRepository.findByClusterName(properties.getClusterName())
                .orElseGet(ClusterEntity::new);
        entity.setClusterName(properties.getClusterName());
        entity.setEnvironment(properties.getEnvironment());
        entity.setRegion(properties.getRegion());
        entity.setOwner(properties.getOwner());
        entity.setDescription(properties.getDescription());
        entity.setActive(properties.isActive());
        entity.setLastUpdated(clock.instant());
        return clusterRepository.save(entity);
    }

    private static Map<String, Object> propertyAttributes(ImportRequest.ClusterProperty properties) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("cluster_name", properties.getClusterName());
        attributes.put("environment", properties.getEnvironment());
        attributes.put("region", properties.getRegion());
        attributes.put("owner", properties.getOwner());
        attributes.put("description", properties.getDescription());
        attributes.put("is_active", properties.isActive());
        return attributes;
    }

    private Optional<MutationEvent> write(Long key, Map<String, Object> attributes, boolean merge) {
        Instant now = clock.instant();
        Optional<BaseRowEntity> existing = baseRowRepository.findForUpdate(key);
        MutationEvent event;
        if (existing.isEmpty()) {
            Map<String, Object> values = new LinkedHashMap<>(attributes);
            long sequence = outbox.append(MutationType.INSERT, key, null, values, now).getId();
            BaseRowEntity saved = baseRowRepository.save(new BaseRowEntity(key, values, sequence, now));
            event = MutationEvent.insert(saved.toBaseRow(), now);
            log.debug("Inserted base row {} at sequence {}", key, sequence);
        } else {
            BaseRowEntity entity = existing.get();
            BaseRow before = entity.toBaseRow();
            Map<String, Object> values = new LinkedHashMap<>(merge ? before.attributes() : Map.of());
            values.putAll(attributes);
            if (values.equals(before.attributes())) {
                log.debug("Write for key {} changes nothing, no event", key);
                return Optional.empty();
            }
            long sequence = outbox.append(MutationType.UPDATE, key, before, values, now).getId();
            entity.setAttributes(values);
            entity.setVersion(sequence);
            entity.setUpdatedAt(now);
            BaseRowEntity saved = baseRowRepository.save(entity);
            event = MutationEvent.update(before, saved.toBaseRow(), now);
            log.debug("Updated base row {} at sequence {}, changed {}", key, sequence, event.changedColumns());
        }
        eventPublisher.publishEvent(event);
        return Optional.of(event);
    }
}
