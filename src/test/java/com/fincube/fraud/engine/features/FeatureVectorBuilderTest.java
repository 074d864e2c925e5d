package com.fincube.fraud.engine.features;

import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.FeatureVector;
import com.fincube.fraud.model.Scaler;
import com.fincube.fraud.model.TransferCategory;
import com.fincube.fraud.model.TransferDirection;
import com.fincube.fraud.model.TransferRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.fincube.fraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureVectorBuilderTest {

    @Test
    void featureNames_fortyFourColumnsWithRepeatedUniqueAddressColumns() {
        assertThat(FeatureVectorBuilder.FEATURE_COUNT).isEqualTo(44);
        assertThat(FeatureVectorBuilder.FEATURE_NAMES.get(42)).isEqualTo("Unique Sent To Addresses");
        assertThat(FeatureVectorBuilder.FEATURE_NAMES.get(43)).isEqualTo("Unique Received From Addresses");
        assertThat(FeatureVectorBuilder.FEATURE_NAMES).contains(" Total ERC20 tnxs");
    }

    @Test
    void build_emptyActivity_allZeroExceptBalance() {
        FeatureVector vector = FeatureVectorBuilder.build(activity(List.of(), List.of(), 2.5));

        assertThat(vector.size()).isEqualTo(44);
        assertThat(vector.isNormalized()).isFalse();
        int balanceIndex = FeatureVectorBuilder.FEATURE_NAMES.indexOf(FeatureVectorBuilder.BALANCE_FEATURE);
        for (int i = 0; i < vector.size(); i++) {
            assertThat(vector.get(i)).isEqualTo(i == balanceIndex ? 2.5 : 0.0);
        }
    }

    @Test
    void extractFeatures_nativeTransfers_countsValuesAndTiming() {
        AccountActivity activity = activity(
                List.of(sent(1.0, address(1), BASE_TS),
                        sent(3.0, address(2), BASE_TS + 120_000),
                        sent(0.0, address(2), BASE_TS + 240_000)),
                List.of(received(5.0, address(3), BASE_TS - 600_000)),
                1.0);

        Map<String, Double> features = FeatureVectorBuilder.extractFeatures(activity);

        assertThat(features.get("Sent tnx")).isEqualTo(3.0);
        assertThat(features.get("Received Tnx")).isEqualTo(1.0);
        assertThat(features.get("Unique Sent To Addresses")).isEqualTo(2.0);
        assertThat(features.get("Avg min between sent tnx")).isCloseTo(2.0, within(1e-9));
        assertThat(features.get("Time Diff between first and last (Mins)")).isCloseTo(14.0, within(1e-9));
        // zero-value transfers are excluded from value statistics
        assertThat(features.get("min val sent")).isEqualTo(1.0);
        assertThat(features.get("avg val sent")).isCloseTo(2.0, within(1e-9));
        assertThat(features.get("total Ether sent")).isCloseTo(4.0, within(1e-9));
        assertThat(features.get("total ether received")).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void extractFeatures_tokenTransfers_countedSeparately() {
        AccountActivity activity = activity(
                List.of(tokenTransfer(TransferDirection.SENT, TransferCategory.FUNGIBLE_TOKEN, address(900), address(1), BASE_TS),
                        tokenTransfer(TransferDirection.SENT, TransferCategory.FUNGIBLE_TOKEN, address(900), address(2), BASE_TS + 60_000),
                        tokenTransfer(TransferDirection.SENT, TransferCategory.FUNGIBLE_TOKEN, address(901), address(2), BASE_TS + 120_000)),
                List.of(tokenTransfer(TransferDirection.RECEIVED, TransferCategory.NFT, address(902), address(3), BASE_TS)),
                0.0);

        Map<String, Double> features = FeatureVectorBuilder.extractFeatures(activity);

        assertThat(features.get(" Total ERC20 tnxs")).isEqualTo(3.0);
        assertThat(features.get("Sent tnx")).isEqualTo(0.0);
        assertThat(features.get(" ERC20 uniq sent token name")).isEqualTo(2.0);
        assertThat(features.get(" ERC20 most sent token type")).isEqualTo(2.0);
        assertThat(features.get(" ERC20 uniq sent addr")).isEqualTo(2.0);
        assertThat(features.get("total transactions (including tnx to create contract)")).isEqualTo(4.0);
    }

    @Test
    void fromReferenceFeatures_trimmedNamesAndNumericStrings() {
        Map<String, Object> row = new HashMap<>();
        row.put("Total ERC20 tnxs", "12");
        row.put("Sent tnx", 7);
        row.put("total ether balance", "not-a-number");
        row.put("Received Tnx", "");
        row.put("avg val sent", Double.NaN);

        FeatureVector vector = FeatureVectorBuilder.fromReferenceFeatures(row);
        Map<String, Double> named = vector.asMap();

        assertThat(vector.size()).isEqualTo(44);
        assertThat(named.get(" Total ERC20 tnxs")).isEqualTo(12.0);
        assertThat(named.get("Sent tnx")).isEqualTo(7.0);
        assertThat(named.get("total ether balance")).isEqualTo(0.0);
        assertThat(named.get("Received Tnx")).isEqualTo(0.0);
        assertThat(named.get("avg val sent")).isEqualTo(0.0);
    }

    @Test
    void fromReferenceFeatures_nullRow_zeroVector() {
        FeatureVector vector = FeatureVectorBuilder.fromReferenceFeatures(null);

        assertThat(vector.toArray()).containsOnly(0.0);
    }

    @Test
    void fit_thenNormalize_centersBatch() {
        List<double[]> batch = List.of(new double[]{1, 10, 5}, new double[]{3, 20, 5}, new double[]{5, 30, 5});

        Scaler scaler = FeatureVectorBuilder.fit(batch, 4);

        assertThat(scaler.getVersion()).isEqualTo(4);
        assertThat(scaler.getMeans()).containsExactly(3.0, 20.0, 5.0);
        assertThat(scaler.stdAt(2)).isEqualTo(0.0);

        double sum = 0;
        for (double[] row : batch) {
            double[] normalized = FeatureVectorBuilder.normalize(scaler, row);
            // zero-variance dimension normalizes to 0
            assertThat(normalized[2]).isEqualTo(0.0);
            sum += normalized[0] + normalized[1];
        }
        assertThat(sum).isCloseTo(0.0, within(1e-9));
        assertThat(FeatureVectorBuilder.normalize(scaler, new double[]{5, 30, 5})[0])
                .isCloseTo(2.0 / Math.sqrt(8.0 / 3.0), within(1e-9));
    }

    @Test
    void fit_emptyBatch_throws() {
        assertThatThrownBy(() -> FeatureVectorBuilder.fit(List.of(), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalize_dimensionMismatch_throws() {
        Scaler scaler = identityScaler(1);

        assertThatThrownBy(() -> FeatureVectorBuilder.normalize(scaler, new double[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void normalize_vector_recordsScalerVersion() {
        FeatureVector normalized = FeatureVectorBuilder.normalize(identityScaler(7),
                FeatureVectorBuilder.build(AccountActivity.empty()));

        assertThat(normalized.getScalerVersion()).isEqualTo(7);
        assertThat(normalized.isNormalized()).isTrue();
    }

    private static final double[] AWKWARD_VALUES = {0.0, 1e-9, 0.5, 1.0, 1e21, -3.0,
            Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};

    private static TransferRecord randomTransfer(Random random, TransferDirection direction) {
        TransferRecord.TransferRecordBuilder builder = TransferRecord.builder().direction(direction);
        if (random.nextBoolean()) {
            builder.category(TransferCategory.values()[random.nextInt(TransferCategory.values().length)]);
        }
        if (random.nextBoolean()) {
            builder.value(AWKWARD_VALUES[random.nextInt(AWKWARD_VALUES.length)]);
        }
        if (random.nextBoolean()) {
            builder.counterparty(address(random.nextInt(5)));
        }
        if (random.nextBoolean()) {
            builder.timestamp(BASE_TS + random.nextInt(1_000_000) * 1000L);
        }
        if (random.nextBoolean()) {
            builder.tokenContract(address(100 + random.nextInt(3)));
        }
        return builder.build();
    }

    private static List<TransferRecord> randomTransfers(Random random, TransferDirection direction) {
        if (random.nextInt(4) == 0) return null;
        List<TransferRecord> transfers = new ArrayList<>();
        int count = random.nextInt(30);
        for (int i = 0; i < count; i++) {
            transfers.add(random.nextInt(10) == 0 ? null : randomTransfer(random, direction));
        }
        return transfers;
    }

    @Test
    void build_randomPartialActivity_alwaysFortyFourFiniteValues() {
        Random random = new Random(11);
        for (int run = 0; run < 300; run++) {
            AccountActivity activity = AccountActivity.builder()
                    .sent(randomTransfers(random, TransferDirection.SENT))
                    .received(randomTransfers(random, TransferDirection.RECEIVED))
                    .balance(AWKWARD_VALUES[random.nextInt(AWKWARD_VALUES.length)])
                    .build();

            FeatureVector vector = FeatureVectorBuilder.build(activity);

            assertThat(vector.size()).isEqualTo(44);
            for (int i = 0; i < vector.size(); i++) {
                assertThat(Double.isFinite(vector.get(i))).as("run %d column %d", run, i).isTrue();
            }
        }
    }

    @Test
    void fromReferenceFeatures_randomMissingColumns_alwaysFortyFourFiniteValues() {
        Random random = new Random(13);
        Object[] cells = {1, 2.5, "7", " 3.25 ", "", "n/a", null, Double.NaN, Long.MAX_VALUE};
        for (int run = 0; run < 300; run++) {
            Map<String, Object> row = new HashMap<>();
            for (String name : FeatureVectorBuilder.FEATURE_NAMES) {
                if (random.nextBoolean()) {
                    row.put(random.nextBoolean() ? name : name.trim(), cells[random.nextInt(cells.length)]);
                }
            }

            FeatureVector vector = FeatureVectorBuilder.fromReferenceFeatures(row);

            assertThat(vector.size()).isEqualTo(44);
            for (int i = 0; i < vector.size(); i++) {
                assertThat(Double.isFinite(vector.get(i))).as("run %d column %d", run, i).isTrue();
            }
        }
    }
}
