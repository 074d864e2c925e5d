package com.fincube.fraud.service;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.WritePolicy;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.fincube.fraud.testutil.TestDataFactory.identityScaler;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferenceDataServiceTest {

    @Mock private ScalerRepository scalerRepository;
    @Mock private ReferenceVectorRepository referenceVectorRepository;
    @Mock private AerospikeClient aerospikeClient;

    private ScalerRegistry scalerRegistry;
    private SimpleMeterRegistry meterRegistry;
    private ReferenceDataService service;

    @BeforeEach
    void setUp() {
        scalerRegistry = new ScalerRegistry();
        meterRegistry = new SimpleMeterRegistry();
        service = new ReferenceDataService(scalerRegistry, scalerRepository, referenceVectorRepository,
                new MetricsConfig(meterRegistry));
    }

    private static ReferenceRecord record(String address, int flag, double sent, double received) {
        return ReferenceRecord.builder()
                .address(address)
                .flag(flag)
                .features(Map.of("Sent tnx", sent, "Received Tnx", String.valueOf(received)))
                .build();
    }

    @SuppressWarnings("unchecked")
    @Test
    void load_validBatch_fitsScalerAndReplacesIndex() {
        List<ReferenceRecord> records = Arrays.asList(
                record("0xAAA1", 1, 10, 2),
                record("0xaaa2", 0, 20, 4),
                record(" 0xAAA3 ", 1, 30, 6),
                record("0xbad", 2, 1, 1),
                record(null, 0, 1, 1),
                null);

        ReferenceLoadResult result = service.load(records);

        assertThat(result.getLoadedCount()).isEqualTo(3);
        assertThat(result.getFraudCount()).isEqualTo(2);
        assertThat(result.getSkippedCount()).isEqualTo(3);
        assertThat(result.getScalerVersion()).isEqualTo(1);

        ArgumentCaptor<List<ReferenceVector>> captor = ArgumentCaptor.forClass(List.class);
        verify(referenceVectorRepository).replaceAll(captor.capture());
        List<ReferenceVector> vectors = captor.getValue();
        assertThat(vectors).extracting(ReferenceVector::getAddress).containsExactly("0xaaa1", "0xaaa2", "0xaaa3");
        assertThat(vectors).allSatisfy(v -> {
            assertThat(v.getScalerVersion()).isEqualTo(1);
            assertThat(v.getValues()).hasSize(44);
        });
        // "Sent tnx" is column 3; its normalized values are centered on zero
        double sum = vectors.stream().mapToDouble(v -> v.getValues()[3]).sum();
        assertThat(sum).isCloseTo(0.0, within(1e-9));

        verify(scalerRepository).save(any(Scaler.class));
        assertThat(scalerRegistry.current()).isPresent();
        assertThat(meterRegistry.get("reference.vectors").gauge().value()).isEqualTo(3.0);
    }

    @SuppressWarnings("unchecked")
    @Test
    void load_repeatedAddress_keepsFirstRowOnly() {
        List<ReferenceRecord> records = List.of(
                record("0xAAA1", 1, 10, 2),
                record("0xaaa2", 0, 20, 4),
                record("0xaaa1 ", 0, 99, 99),
                record("0xaaa3", 0, 30, 6));

        ReferenceLoadResult result = service.load(records);

        assertThat(result.getLoadedCount()).isEqualTo(3);
        assertThat(result.getSkippedCount()).isEqualTo(1);
        assertThat(result.getFraudCount()).isEqualTo(1);

        ArgumentCaptor<Scaler> scaler = ArgumentCaptor.forClass(Scaler.class);
        verify(scalerRepository).save(scaler.capture());
        assertThat(scaler.getValue().getSampleCount()).isEqualTo(3);

        ArgumentCaptor<List<ReferenceVector>> captor = ArgumentCaptor.forClass(List.class);
        verify(referenceVectorRepository).replaceAll(captor.capture());
        assertThat(captor.getValue()).extracting(ReferenceVector::getAddress)
                .containsExactly("0xaaa1", "0xaaa2", "0xaaa3");
        assertThat(captor.getValue().get(0).getLabel()).isEqualTo(1);
    }

    @Test
    void load_scalerPublishedOnlyAfterIndexReplaced() {
        doAnswer(inv -> {
            assertThat(scalerRegistry.current()).isEmpty();
            return null;
        }).when(referenceVectorRepository).replaceAll(anyList());

        ReferenceLoadResult result = service.load(List.of(record("0x1", 1, 1, 1), record("0x2", 0, 2, 2)));

        assertThat(scalerRegistry.current().get().getVersion()).isEqualTo(result.getScalerVersion());
    }

    @Test
    void load_reloadWhileScoring_bothScalerVersionsFindNeighbors() {
        ReferenceVectorRepository index = new ReferenceVectorRepository(aerospikeClient, "test", new WritePolicy());
        ReferenceDataService indexedService = new ReferenceDataService(scalerRegistry, scalerRepository, index,
                new MetricsConfig(meterRegistry));
        List<ReferenceRecord> batch = IntStream.range(0, 20)
                .mapToObj(i -> record("0xref" + i, i % 2, i, 2 * i))
                .collect(Collectors.toList());

        indexedService.load(batch);
        Scaler inFlight = scalerRegistry.current().get();

        List<Integer> newRequestNeighbors = new ArrayList<>();
        doAnswer(inv -> {
            Scaler captured = scalerRegistry.current().get();
            newRequestNeighbors.add(index.findNearest(emptyAccount(captured), 5).size());
            return null;
        }).when(aerospikeClient).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        indexedService.load(batch);

        assertThat(newRequestNeighbors).hasSize(20).containsOnly(5);
        assertThat(scalerRegistry.current().get().getVersion()).isEqualTo(2);
        assertThat(index.findNearest(emptyAccount(inFlight), 5)).hasSize(5);
        assertThat(index.findNearest(emptyAccount(scalerRegistry.current().get()), 5)).hasSize(5);
    }

    private static FeatureVector emptyAccount(Scaler scaler) {
        FeatureVector raw = new FeatureVector(FeatureVectorBuilder.FEATURE_NAMES,
                new double[FeatureVectorBuilder.FEATURE_COUNT], FeatureVector.RAW);
        return FeatureVectorBuilder.normalize(scaler, raw);
    }

    @Test
    void load_noValidRecords_rejectedWithoutSideEffects() {
        assertThatThrownBy(() -> service.load(List.of(record("0x1", 5, 1, 1))))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(scalerRepository, referenceVectorRepository);
        assertThat(scalerRegistry.current()).isEmpty();
    }

    @Test
    void load_twice_scalerVersionIncreases() {
        service.load(List.of(record("0x1", 1, 1, 1), record("0x2", 0, 2, 2)));
        ReferenceLoadResult second = service.load(List.of(record("0x1", 1, 1, 1), record("0x2", 0, 2, 2)));

        assertThat(second.getScalerVersion()).isEqualTo(2);
        verify(referenceVectorRepository, times(2)).replaceAll(anyList());
    }

    @Test
    void restore_publishesPersistedScalerAndLoadsVectors() {
        when(scalerRepository.findLatest()).thenReturn(Optional.of(identityScaler(4)));
        when(referenceVectorRepository.loadAll()).thenReturn(10);

        service.restore();

        assertThat(scalerRegistry.current().get().getVersion()).isEqualTo(4);
        assertThat(meterRegistry.get("reference.vectors").gauge().value()).isEqualTo(10.0);
    }

    @Test
    void restore_nothingPersisted_leavesRegistryEmpty() {
        when(scalerRepository.findLatest()).thenReturn(Optional.empty());
        when(referenceVectorRepository.loadAll()).thenReturn(0);

        service.restore();

        assertThat(scalerRegistry.current()).isEmpty();
    }

    @Test
    void stats_reportsIndexAndScaler() {
        scalerRegistry.restore(identityScaler(2));
        when(referenceVectorRepository.getAll()).thenReturn(List.of(
                ReferenceVector.builder().address("0x1").label(1).values(new double[44]).scalerVersion(2).build(),
                ReferenceVector.builder().address("0x2").label(0).values(new double[44]).scalerVersion(2).build()));

        ReferenceIndexStats stats = service.stats();

        assertThat(stats.isExists()).isTrue();
        assertThat(stats.getDocumentCount()).isEqualTo(2);
        assertThat(stats.getFraudCount()).isEqualTo(1);
        assertThat(stats.getDimension()).isEqualTo(44);
        assertThat(stats.getScalerVersion()).isEqualTo(2);
    }

    @Test
    void stats_emptyIndex() {
        when(referenceVectorRepository.getAll()).thenReturn(List.of());

        ReferenceIndexStats stats = service.stats();

        assertThat(stats.isExists()).isFalse();
        assertThat(stats.getScalerVersion()).isZero();
    }

    @Test
    void clear_keepsScalerPublished() {
        scalerRegistry.restore(identityScaler(2));

        service.clear();

        verify(referenceVectorRepository).clear();
        assertThat(service.currentScaler()).isPresent();
    }
}
