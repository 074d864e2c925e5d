package com.fincube.fraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.fincube.fraud.config.AerospikeConfig;
import com.fincube.fraud.engine.Numbers;
import com.fincube.fraud.model.ScoreLedgerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Accumulated fraud score per reference.
 *
 * Update rule, step s = 0.1:
 *   fraud     : score = min(1, score + confidence * s)
 *   not fraud : score = max(0, score - confidence * s)
 *
 * Writes use generation checks so concurrent outcomes for the same reference
 * are applied one after the other.
 */
@Repository
public class ScoreLedgerRepository {

    private static final Logger log = LoggerFactory.getLogger(ScoreLedgerRepository.class);

    static final double SCORE_STEP = 0.1;
    static final int MAX_WRITE_ATTEMPTS = 3;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ScoreLedgerRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public Optional<ScoreLedgerEntry> findByReferenceId(String referenceId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SCORE_LEDGER, referenceId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(referenceId, record));
    }

    /**
     * Applies one decided outcome to the reference's score.
     */
    public ScoreLedgerEntry recordOutcome(String referenceId, boolean isFraud, double confidence) {
        Key key = new Key(namespace, AerospikeConfig.SET_SCORE_LEDGER, referenceId);
        double step = Numbers.clamp01(confidence) * SCORE_STEP;

        for (int attempt = 1; ; attempt++) {
            Record existing = client.get(readPolicy, key);
            long now = System.currentTimeMillis();

            double previous = existing == null ? 0.0 : existing.getDouble("score");
            long createdAt = existing == null ? now : existing.getLong("createdAt");
            double updated = isFraud
                    ? Math.min(1.0, previous + step)
                    : Math.max(0.0, previous - step);

            ScoreLedgerEntry entry = ScoreLedgerEntry.builder()
                    .referenceId(referenceId)
                    .score(updated)
                    .lastResult(isFraud ? "fraud" : "not_fraud")
                    .lastConfidence(Numbers.clamp01(confidence))
                    .createdAt(createdAt)
                    .updatedAt(now)
                    .build();

            WritePolicy policy = new WritePolicy(writePolicy);
            if (existing == null) {
                policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
            } else {
                policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
                policy.generation = existing.generation;
            }

            try {
                client.put(policy, key,
                        new Bin("referenceId", referenceId),
                        new Bin("score", entry.getScore()),
                        new Bin("lastResult", entry.getLastResult()),
                        new Bin("lastConf", entry.getLastConfidence()),
                        new Bin("createdAt", entry.getCreatedAt()),
                        new Bin("updatedAt", entry.getUpdatedAt()));
                log.debug("Ledger {} score {} -> {} ({})", referenceId, previous, updated, entry.getLastResult());
                return entry;
            } catch (AerospikeException e) {
                boolean conflict = e.getResultCode() == ResultCode.GENERATION_ERROR
                        || e.getResultCode() == ResultCode.KEY_EXISTS_ERROR;
                if (!conflict || attempt >= MAX_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent ledger update for {}, retrying (attempt {})", referenceId, attempt);
            }
        }
    }

    private ScoreLedgerEntry mapRecord(String referenceId, Record record) {
        return ScoreLedgerEntry.builder()
                .referenceId(referenceId)
                .score(record.getDouble("score"))
                .lastResult(record.getString("lastResult"))
                .lastConfidence(record.getDouble("lastConf"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
