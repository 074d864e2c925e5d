package com.fincube.fraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fincube.fraud.config.AerospikeConfig;
import com.fincube.fraud.engine.SimilarityIndex;
import com.fincube.fraud.model.FeatureVector;
import com.fincube.fraud.model.NeighborMatch;
import com.fincube.fraud.model.ReferenceVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Labeled reference vectors, persisted in Aerospike and served from an
 * in-memory snapshot. Nearest-neighbor search is an exact Euclidean scan.
 *
 * The snapshot holds one generation of vectors per scaler version. A reload
 * swaps in the new generation atomically and keeps the one it replaces, so a
 * request that captured the previous scaler still finds its neighbors.
 */
@Repository
public class ReferenceVectorRepository implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(ReferenceVectorRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    static final int RETAINED_GENERATIONS = 2;

    private final AtomicReference<NavigableMap<Long, List<ReferenceVector>>> generations =
            new AtomicReference<>(Collections.emptyNavigableMap());

    public ReferenceVectorRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Replaces the stored reference population. In memory the previous
     * generation stays queryable next to the new one.
     */
    public void replaceAll(List<ReferenceVector> vectors) {
        client.truncate(null, namespace, AerospikeConfig.SET_REFERENCE_VECTORS, null);
        for (ReferenceVector vector : vectors) {
            save(vector);
        }
        swap(vectors, true);
        log.info("Reference index replaced with {} vectors", vectors.size());
    }

    private void swap(List<ReferenceVector> vectors, boolean keepPrevious) {
        NavigableMap<Long, List<ReferenceVector>> next = new TreeMap<>();
        if (keepPrevious) {
            next.putAll(generations.get());
        }
        NavigableMap<Long, List<ReferenceVector>> incoming = new TreeMap<>();
        for (ReferenceVector vector : vectors) {
            incoming.computeIfAbsent(vector.getScalerVersion(), v -> new ArrayList<>()).add(vector);
        }
        incoming.forEach((version, group) -> next.put(version, List.copyOf(group)));
        while (next.size() > RETAINED_GENERATIONS) {
            next.pollFirstEntry();
        }
        generations.set(Collections.unmodifiableNavigableMap(next));
    }

    private void save(ReferenceVector vector) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_REFERENCE_VECTORS, vector.getAddress());
            client.put(writePolicy, key,
                    new Bin("address", vector.getAddress()),
                    new Bin("label", vector.getLabel()),
                    new Bin("vectorJson", objectMapper.writeValueAsString(vector.getValues())),
                    new Bin("scalerVer", vector.getScalerVersion()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reference vector " + vector.getAddress(), e);
        }
    }

    /**
     * Reloads the in-memory snapshot from storage.
     */
    public int loadAll() {
        List<ReferenceVector> loaded = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_REFERENCE_VECTORS,
                (key, record) -> {
                    try {
                        loaded.add(ReferenceVector.builder()
                                .address(record.getString("address"))
                                .label(record.getInt("label"))
                                .values(objectMapper.readValue(record.getString("vectorJson"), double[].class))
                                .scalerVersion(record.getLong("scalerVer"))
                                .build());
                    } catch (Exception e) {
                        log.warn("Failed to deserialize reference vector: {}", e.getMessage());
                    }
                });

        swap(loaded, false);
        return getAll().size();
    }

    public void clear() {
        client.truncate(null, namespace, AerospikeConfig.SET_REFERENCE_VECTORS, null);
        generations.set(Collections.emptyNavigableMap());
        log.info("Reference index cleared");
    }

    /**
     * Vectors of the newest generation.
     */
    public List<ReferenceVector> getAll() {
        NavigableMap<Long, List<ReferenceVector>> current = generations.get();
        return current.isEmpty() ? List.of() : current.lastEntry().getValue();
    }

    public int count() {
        return getAll().size();
    }

    @Override
    public List<NeighborMatch> findNearest(FeatureVector normalizedVector, int k) {
        List<ReferenceVector> vectors = generations.get()
                .getOrDefault(normalizedVector.getScalerVersion(), List.of());
        if (vectors.isEmpty() || k <= 0) {
            return List.of();
        }

        double[] query = normalizedVector.toArray();
        Comparator<NeighborMatch> byDistance = Comparator.comparingDouble(NeighborMatch::getDistance);
        // Max-heap of the k closest so far
        PriorityQueue<NeighborMatch> closest = new PriorityQueue<>(k, byDistance.reversed());

        for (ReferenceVector vector : vectors) {
            NeighborMatch match = NeighborMatch.builder()
                    .address(vector.getAddress())
                    .label(vector.getLabel())
                    .distance(vector.distanceTo(query))
                    .build();
            if (closest.size() < k) {
                closest.add(match);
            } else if (match.getDistance() < closest.peek().getDistance()) {
                closest.poll();
                closest.add(match);
            }
        }

        List<NeighborMatch> result = new ArrayList<>(closest);
        result.sort(byDistance);
        return result;
    }
}
