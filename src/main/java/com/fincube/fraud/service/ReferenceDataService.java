package com.fincube.fraud.service;

import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.engine.features.FeatureVectorBuilder;
import com.fincube.fraud.engine.features.ScalerRegistry;
import com.fincube.fraud.model.FeatureVector;
import com.fincube.fraud.model.ReferenceIndexStats;
import com.fincube.fraud.model.ReferenceLoadResult;
import com.fincube.fraud.model.ReferenceRecord;
import com.fincube.fraud.model.ReferenceVector;
import com.fincube.fraud.model.Scaler;
import com.fincube.fraud.repository.ReferenceVectorRepository;
import com.fincube.fraud.repository.ScalerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Manages the labeled reference population and the scaler fitted over it.
 *
 * Load flow:
 * 1. Drop invalid rows and repeated addresses, convert each feature map to a raw vector
 * 2. Fit a new scaler version over the batch and persist it
 * 3. Normalize every vector with it and replace the reference index
 * 4. Publish the scaler, so new requests only see it once its vectors are queryable
 */
@Service
public class ReferenceDataService {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataService.class);

    private final ScalerRegistry scalerRegistry;
    private final ScalerRepository scalerRepository;
    private final ReferenceVectorRepository referenceVectorRepository;
    private final MetricsConfig metricsConfig;

    public ReferenceDataService(ScalerRegistry scalerRegistry,
                                ScalerRepository scalerRepository,
                                ReferenceVectorRepository referenceVectorRepository,
                                MetricsConfig metricsConfig) {
        this.scalerRegistry = scalerRegistry;
        this.scalerRepository = scalerRepository;
        this.referenceVectorRepository = referenceVectorRepository;
        this.metricsConfig = metricsConfig;
    }

    public synchronized ReferenceLoadResult load(List<ReferenceRecord> records) {
        List<ReferenceRecord> accepted = new ArrayList<>();
        List<String> addresses = new ArrayList<>();
        List<double[]> rawBatch = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skipped = 0;
        int duplicates = 0;

        // 1. Raw vectors, one per address
        for (ReferenceRecord record : records) {
            if (record == null || record.getAddress() == null || record.getAddress().isBlank()
                    || (record.getFlag() != 0 && record.getFlag() != 1)) {
                skipped++;
                continue;
            }
            String address = record.getAddress().trim().toLowerCase();
            if (!seen.add(address)) {
                duplicates++;
                skipped++;
                continue;
            }
            accepted.add(record);
            addresses.add(address);
            rawBatch.add(FeatureVectorBuilder.fromReferenceFeatures(record.getFeatures()).toArray());
        }

        if (accepted.isEmpty()) {
            throw new IllegalArgumentException("Reference batch contains no valid records");
        }
        if (duplicates > 0) {
            log.warn("Reference batch repeats {} addresses; kept the first row of each", duplicates);
        }

        // 2. Fit and persist the scaler
        Scaler scaler = scalerRegistry.fit(rawBatch);
        scalerRepository.save(scaler);

        // 3. Normalize and replace the index
        List<ReferenceVector> vectors = new ArrayList<>(accepted.size());
        int fraudCount = 0;
        for (int i = 0; i < accepted.size(); i++) {
            ReferenceRecord record = accepted.get(i);
            vectors.add(ReferenceVector.builder()
                    .address(addresses.get(i))
                    .label(record.getFlag())
                    .values(FeatureVectorBuilder.normalize(scaler, rawBatch.get(i)))
                    .scalerVersion(scaler.getVersion())
                    .build());
            fraudCount += record.getFlag();
        }
        referenceVectorRepository.replaceAll(vectors);

        // 4. Publish
        scalerRegistry.publish(scaler);
        metricsConfig.updateReferenceVectorCount(vectors.size());

        log.info("Loaded {} reference vectors ({} fraud, {} skipped) with scaler v{}",
                vectors.size(), fraudCount, skipped, scaler.getVersion());

        return ReferenceLoadResult.builder()
                .loadedCount(vectors.size())
                .fraudCount(fraudCount)
                .skippedCount(skipped)
                .scalerVersion(scaler.getVersion())
                .build();
    }

    /**
     * Restores the latest persisted scaler and the reference vectors into memory.
     */
    public void restore() {
        Optional<Scaler> latest = scalerRepository.findLatest();
        latest.ifPresent(scalerRegistry::restore);
        int count = referenceVectorRepository.loadAll();
        metricsConfig.updateReferenceVectorCount(count);
        log.info("Restored reference index: {} vectors, scaler {}", count,
                latest.map(s -> "v" + s.getVersion()).orElse("none"));
    }

    public ReferenceIndexStats stats() {
        List<ReferenceVector> vectors = referenceVectorRepository.getAll();
        Optional<Scaler> scaler = scalerRegistry.current();
        int fraudCount = (int) vectors.stream().filter(v -> v.getLabel() == 1).count();

        return ReferenceIndexStats.builder()
                .exists(!vectors.isEmpty())
                .documentCount(vectors.size())
                .fraudCount(fraudCount)
                .dimension(FeatureVectorBuilder.FEATURE_COUNT)
                .scalerVersion(scaler.map(Scaler::getVersion).orElse(FeatureVector.RAW))
                .fittedAt(scaler.map(Scaler::getFittedAt).orElse(0L))
                .build();
    }

    public Optional<Scaler> currentScaler() {
        return scalerRegistry.current();
    }

    /**
     * Removes every reference vector. The scaler stays published so versions
     * keep increasing across reloads.
     */
    public synchronized void clear() {
        referenceVectorRepository.clear();
        metricsConfig.updateReferenceVectorCount(0);
    }
}
