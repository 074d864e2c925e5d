package com.fincube.fraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fincube.fraud.config.AerospikeConfig;
import com.fincube.fraud.model.Scaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Persists fitted scaler versions, one record per version.
 */
@Repository
public class ScalerRepository {

    private static final Logger log = LoggerFactory.getLogger(ScalerRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ScalerRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Scaler scaler) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_SCALERS, scaler.getVersion());
            client.put(writePolicy, key,
                    new Bin("version", scaler.getVersion()),
                    new Bin("meansJson", objectMapper.writeValueAsString(scaler.getMeans())),
                    new Bin("stdsJson", objectMapper.writeValueAsString(scaler.getStds())),
                    new Bin("sampleCount", scaler.getSampleCount()),
                    new Bin("fittedAt", scaler.getFittedAt()));
            log.info("Saved scaler v{} ({} dimensions)", scaler.getVersion(), scaler.getDimension());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize scaler v" + scaler.getVersion(), e);
        }
    }

    public Optional<Scaler> findByVersion(long version) {
        Key key = new Key(namespace, AerospikeConfig.SET_SCALERS, version);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.ofNullable(mapRecord(record));
    }

    public Optional<Scaler> findLatest() {
        AtomicReference<Scaler> latest = new AtomicReference<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SCALERS,
                (key, record) -> {
                    Scaler scaler = mapRecord(record);
                    if (scaler != null) {
                        latest.accumulateAndGet(scaler,
                                (a, b) -> a == null || b.getVersion() > a.getVersion() ? b : a);
                    }
                });
        return Optional.ofNullable(latest.get());
    }

    private Scaler mapRecord(Record record) {
        try {
            return Scaler.builder()
                    .version(record.getLong("version"))
                    .means(objectMapper.readValue(record.getString("meansJson"), double[].class))
                    .stds(objectMapper.readValue(record.getString("stdsJson"), double[].class))
                    .sampleCount(record.getInt("sampleCount"))
                    .fittedAt(record.getLong("fittedAt"))
                    .build();
        } catch (Exception e) {
            log.warn("Failed to deserialize scaler record: {}", e.getMessage());
            return null;
        }
    }
}
