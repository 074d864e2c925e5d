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
import com.fincube.fraud.model.ScoreLedgerEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScoreLedgerRepositoryTest {

    @Mock
    private AerospikeClient client;

    private ScoreLedgerRepository repository;

    // In-memory stand-in for the score_ledger set, honoring generation checks
    private final Map<String, Record> store = new HashMap<>();
    private final AtomicInteger forcedConflicts = new AtomicInteger();

    @BeforeEach
    void setUp() {
        repository = new ScoreLedgerRepository(client, "test", new WritePolicy(), new Policy());

        when(client.get(any(Policy.class), any(Key.class)))
                .thenAnswer(inv -> store.get(((Key) inv.getArgument(1)).userKey.toString()));

        doAnswer(inv -> {
            WritePolicy policy = inv.getArgument(0);
            String id = ((Key) inv.getArgument(1)).userKey.toString();
            Record existing = store.get(id);

            if (forcedConflicts.getAndDecrement() > 0) {
                throw new AerospikeException(ResultCode.GENERATION_ERROR);
            }
            if (existing != null && policy.recordExistsAction == RecordExistsAction.CREATE_ONLY) {
                throw new AerospikeException(ResultCode.KEY_EXISTS_ERROR);
            }
            if (existing != null && policy.generationPolicy == GenerationPolicy.EXPECT_GEN_EQUAL
                    && existing.generation != policy.generation) {
                throw new AerospikeException(ResultCode.GENERATION_ERROR);
            }

            Map<String, Object> bins = new HashMap<>();
            Object[] args = inv.getArguments();
            for (int i = 2; i < args.length; i++) {
                Bin bin = (Bin) args[i];
                bins.put(bin.name, bin.value.getObject());
            }
            store.put(id, new Record(bins, existing == null ? 1 : existing.generation + 1, 0));
            return null;
        }).when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void recordOutcome_firstFraudOutcome_createsEntry() {
        ScoreLedgerEntry entry = repository.recordOutcome("REF-1", true, 0.8);

        assertThat(entry.getScore()).isCloseTo(0.08, within(1e-9));
        assertThat(entry.getLastResult()).isEqualTo("fraud");
        assertThat(entry.getCreatedAt()).isEqualTo(entry.getUpdatedAt());
        assertThat(repository.findByReferenceId("REF-1")).get()
                .extracting(ScoreLedgerEntry::getScore).isEqualTo(entry.getScore());
    }

    @Test
    void recordOutcome_fraudThenNotFraud_movesScoreBothWays() {
        repository.recordOutcome("REF-1", true, 0.8);
        ScoreLedgerEntry entry = repository.recordOutcome("REF-1", false, 0.5);

        assertThat(entry.getScore()).isCloseTo(0.03, within(1e-9));
        assertThat(entry.getLastResult()).isEqualTo("not_fraud");
        assertThat(entry.getLastConfidence()).isEqualTo(0.5);
    }

    @Test
    void recordOutcome_scoreStaysWithinUnitInterval() {
        ScoreLedgerEntry low = repository.recordOutcome("REF-LOW", false, 1.0);
        assertThat(low.getScore()).isEqualTo(0.0);

        ScoreLedgerEntry high = null;
        for (int i = 0; i < 15; i++) {
            high = repository.recordOutcome("REF-HIGH", true, 1.0);
        }
        assertThat(high.getScore()).isEqualTo(1.0);
    }

    @Test
    void recordOutcome_concurrentWrite_retriedWithFreshRead() {
        repository.recordOutcome("REF-1", true, 1.0);
        forcedConflicts.set(1);

        ScoreLedgerEntry entry = repository.recordOutcome("REF-1", true, 1.0);

        assertThat(entry.getScore()).isCloseTo(0.2, within(1e-9));
        verify(client, times(3)).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void recordOutcome_persistentConflict_throwsAfterMaxAttempts() {
        forcedConflicts.set(10);

        assertThatThrownBy(() -> repository.recordOutcome("REF-1", true, 1.0))
                .isInstanceOf(AerospikeException.class);
        verify(client, times(ScoreLedgerRepository.MAX_WRITE_ATTEMPTS))
                .put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void findByReferenceId_unknown_empty() {
        assertThat(repository.findByReferenceId("missing")).isEmpty();
    }
}
