package com.fincube.fraud.engine.features;

import com.fincube.fraud.engine.Numbers;
import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.FeatureVector;
import com.fincube.fraud.model.Scaler;
import com.fincube.fraud.model.TransferCategory;
import com.fincube.fraud.model.TransferRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds the fixed-length account feature vector and standardizes it.
 *
 * The canonical ordering is the column layout of the labeled reference dataset,
 * including its leading-space column names and the two unique-address columns
 * repeated at the end. Every build produces exactly {@link #FEATURE_COUNT} values;
 * a name with no computed value is 0.
 */
public final class FeatureVectorBuilder {

    public static final List<String> FEATURE_NAMES = List.of(
            "Avg min between sent tnx",
            "Avg min between received tnx",
            "Time Diff between first and last (Mins)",
            "Sent tnx",
            "Received Tnx",
            "Number of Created Contracts",
            "Unique Received From Addresses",
            "Unique Sent To Addresses",
            "min value received",
            "max value received",
            "avg val received",
            "min val sent",
            "max val sent",
            "avg val sent",
            "min value sent to contract",
            "max val sent to contract",
            "avg value sent to contract",
            "total transactions (including tnx to create contract)",
            "total Ether sent",
            "total ether received",
            "total ether sent contracts",
            "total ether balance",
            " Total ERC20 tnxs",
            " ERC20 total Ether received",
            " ERC20 total ether sent",
            " ERC20 total Ether sent contract",
            " ERC20 uniq sent addr",
            " ERC20 uniq rec addr",
            " ERC20 uniq rec contract addr",
            " ERC20 avg time between sent tnx",
            " ERC20 avg time between rec tnx",
            " ERC20 avg time between contract tnx",
            " ERC20 min val rec",
            " ERC20 max val rec",
            " ERC20 avg val rec",
            " ERC20 min val sent",
            " ERC20 max val sent",
            " ERC20 avg val sent",
            " ERC20 uniq sent token name",
            " ERC20 uniq rec token name",
            " ERC20 most sent token type",
            " ERC20 most rec token type",
            "Unique Sent To Addresses",
            "Unique Received From Addresses"
    );

    public static final int FEATURE_COUNT = FEATURE_NAMES.size();

    public static final String BALANCE_FEATURE = "total ether balance";

    private FeatureVectorBuilder() {
    }

    /**
     * Extracts named features from raw activity. Missing or malformed fields
     * contribute 0.
     */
    public static Map<String, Double> extractFeatures(AccountActivity activity) {
        List<TransferRecord> sent = activity.getSent();
        List<TransferRecord> received = activity.getReceived();

        List<TransferRecord> sentExternal = filter(sent, r -> r.getCategory() == TransferCategory.EXTERNAL);
        List<TransferRecord> receivedExternal = filter(received, r -> r.getCategory() == TransferCategory.EXTERNAL);
        List<TransferRecord> sentToken = filter(sent, r -> r.getCategory() == TransferCategory.FUNGIBLE_TOKEN);
        List<TransferRecord> receivedToken = filter(received, r -> r.getCategory() == TransferCategory.FUNGIBLE_TOKEN);

        Map<String, Double> features = new LinkedHashMap<>();

        // Counts
        features.put("Sent tnx", (double) sentExternal.size());
        features.put("Received Tnx", (double) receivedExternal.size());
        features.put(" Total ERC20 tnxs", (double) (sentToken.size() + receivedToken.size()));
        features.put("total transactions (including tnx to create contract)",
                (double) (sent.size() + received.size()));

        // Timing
        features.put("Avg min between sent tnx", avgMinutesBetween(sentExternal));
        features.put("Avg min between received tnx", avgMinutesBetween(receivedExternal));
        features.put("Time Diff between first and last (Mins)", spanMinutes(activity.getAll()));

        // Native values
        List<Double> sentValues = positiveValues(sentExternal);
        features.put("min val sent", Numbers.min(sentValues));
        features.put("max val sent", Numbers.max(sentValues));
        features.put("avg val sent", Numbers.mean(sentValues));
        features.put("total Ether sent", Numbers.sum(sentValues));

        List<Double> receivedValues = positiveValues(receivedExternal);
        features.put("min value received", Numbers.min(receivedValues));
        features.put("max value received", Numbers.max(receivedValues));
        features.put("avg val received", Numbers.mean(receivedValues));
        features.put("total ether received", Numbers.sum(receivedValues));

        // Contract interactions: sent records that carry a token contract or are internal calls
        List<TransferRecord> contractTxs = filter(sent, FeatureVectorBuilder::isContractInteraction);
        List<Double> contractValues = positiveValues(contractTxs);
        features.put("Number of Created Contracts",
                (double) filter(sent, r -> r.getCategory() == TransferCategory.INTERNAL).size());
        features.put("min value sent to contract", Numbers.min(contractValues));
        features.put("max val sent to contract", Numbers.max(contractValues));
        features.put("avg value sent to contract", Numbers.mean(contractValues));
        features.put("total ether sent contracts", Numbers.sum(contractValues));

        features.put("Unique Sent To Addresses", (double) uniqueCounterparties(sent));
        features.put("Unique Received From Addresses", (double) uniqueCounterparties(received));

        features.put(BALANCE_FEATURE, activity.getBalance());

        // Fungible token values
        List<Double> tokenSentValues = positiveValues(sentToken);
        List<Double> tokenReceivedValues = positiveValues(receivedToken);
        features.put(" ERC20 total ether sent", Numbers.sum(tokenSentValues));
        features.put(" ERC20 total Ether received", Numbers.sum(tokenReceivedValues));
        features.put(" ERC20 min val sent", Numbers.min(tokenSentValues));
        features.put(" ERC20 max val sent", Numbers.max(tokenSentValues));
        features.put(" ERC20 avg val sent", Numbers.mean(tokenSentValues));
        features.put(" ERC20 min val rec", Numbers.min(tokenReceivedValues));
        features.put(" ERC20 max val rec", Numbers.max(tokenReceivedValues));
        features.put(" ERC20 avg val rec", Numbers.mean(tokenReceivedValues));

        features.put(" ERC20 uniq sent addr", (double) uniqueCounterparties(sentToken));
        features.put(" ERC20 uniq rec addr", (double) uniqueCounterparties(receivedToken));

        List<TransferRecord> tokenContractTxs = filter(sentToken, FeatureVectorBuilder::isContractInteraction);
        features.put(" ERC20 total Ether sent contract", Numbers.sum(positiveValues(tokenContractTxs)));
        features.put(" ERC20 uniq rec contract addr", (double) uniqueCounterparties(tokenContractTxs));

        features.put(" ERC20 avg time between sent tnx", avgMinutesBetween(sentToken));
        features.put(" ERC20 avg time between rec tnx", avgMinutesBetween(receivedToken));
        features.put(" ERC20 avg time between contract tnx", avgMinutesBetween(tokenContractTxs));

        List<String> sentContracts = contracts(sentToken);
        List<String> receivedContracts = contracts(receivedToken);
        features.put(" ERC20 uniq sent token name", (double) new HashSet<>(sentContracts).size());
        features.put(" ERC20 uniq rec token name", (double) new HashSet<>(receivedContracts).size());
        features.put(" ERC20 most sent token type", (double) mostFrequentCount(sentContracts));
        features.put(" ERC20 most rec token type", (double) mostFrequentCount(receivedContracts));

        features.replaceAll((name, value) -> Numbers.finiteOrZero(value));
        return features;
    }

    /**
     * Raw (unnormalized) vector in canonical order.
     */
    public static FeatureVector build(AccountActivity activity) {
        return toVector(extractFeatures(activity));
    }

    public static FeatureVector toVector(Map<String, Double> features) {
        double[] values = new double[FEATURE_COUNT];
        for (int i = 0; i < FEATURE_COUNT; i++) {
            Double value = features.get(FEATURE_NAMES.get(i));
            values[i] = value == null ? 0.0 : Numbers.finiteOrZero(value);
        }
        return new FeatureVector(FEATURE_NAMES, values, FeatureVector.RAW);
    }

    /**
     * Converts a reference dataset row to a raw vector. Values may be numbers or
     * numeric strings; blank, non-numeric and non-finite values become 0. Column
     * names are matched exactly first, then ignoring surrounding whitespace.
     */
    public static FeatureVector fromReferenceFeatures(Map<String, Object> row) {
        double[] values = new double[FEATURE_COUNT];
        if (row == null || row.isEmpty()) {
            return new FeatureVector(FEATURE_NAMES, values, FeatureVector.RAW);
        }

        Map<String, Object> trimmed = new HashMap<>();
        row.forEach((key, value) -> {
            if (key != null) trimmed.putIfAbsent(key.trim(), value);
        });

        for (int i = 0; i < FEATURE_COUNT; i++) {
            String name = FEATURE_NAMES.get(i);
            Object raw = row.containsKey(name) ? row.get(name) : trimmed.get(name.trim());
            values[i] = toDouble(raw);
        }
        return new FeatureVector(FEATURE_NAMES, values, FeatureVector.RAW);
    }

    /**
     * Fits per-dimension population mean and standard deviation over the batch.
     *
     * @param batch   raw vectors, all of the same dimension
     * @param version version number for the new scaler
     */
    public static Scaler fit(List<double[]> batch, long version) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a scaler on an empty batch");
        }
        int dimension = batch.get(0).length;
        double[] means = new double[dimension];
        double[] stds = new double[dimension];

        for (double[] row : batch) {
            if (row.length != dimension) {
                throw new IllegalArgumentException("Inconsistent vector dimension: expected "
                        + dimension + ", got " + row.length);
            }
            for (int d = 0; d < dimension; d++) {
                means[d] += Numbers.finiteOrZero(row[d]);
            }
        }
        for (int d = 0; d < dimension; d++) {
            means[d] /= batch.size();
        }

        for (double[] row : batch) {
            for (int d = 0; d < dimension; d++) {
                double diff = Numbers.finiteOrZero(row[d]) - means[d];
                stds[d] += diff * diff;
            }
        }
        for (int d = 0; d < dimension; d++) {
            stds[d] = Numbers.finiteOrZero(Math.sqrt(stds[d] / batch.size()));
            means[d] = Numbers.finiteOrZero(means[d]);
        }

        return Scaler.builder()
                .version(version)
                .means(means)
                .stds(stds)
                .sampleCount(batch.size())
                .fittedAt(System.currentTimeMillis())
                .build();
    }

    public static FeatureVector normalize(Scaler scaler, FeatureVector vector) {
        return new FeatureVector(vector.getNames(), normalize(scaler, vector.toArray()), scaler.getVersion());
    }

    /**
     * (x - mean) / std per dimension; 0 where std is 0. Non-finite results become 0.
     */
    public static double[] normalize(Scaler scaler, double[] values) {
        if (scaler.getDimension() != values.length) {
            throw new IllegalArgumentException("Scaler dimension " + scaler.getDimension()
                    + " does not match vector dimension " + values.length);
        }
        double[] normalized = new double[values.length];
        for (int d = 0; d < values.length; d++) {
            double std = scaler.stdAt(d);
            normalized[d] = std == 0.0
                    ? 0.0
                    : Numbers.finiteOrZero((values[d] - scaler.meanAt(d)) / std);
        }
        return normalized;
    }

    // ---- helpers ----

    static boolean isContractInteraction(TransferRecord record) {
        return record.getNormalizedTokenContract() != null || record.getCategory() == TransferCategory.INTERNAL;
    }

    /**
     * Average gap between consecutive timestamps in minutes; 0 with fewer than two.
     */
    static double avgMinutesBetween(Collection<TransferRecord> records) {
        List<Long> timestamps = sortedTimestamps(records);
        if (timestamps.size() < 2) return 0.0;
        double totalGapMs = timestamps.get(timestamps.size() - 1) - timestamps.get(0);
        return Numbers.finiteOrZero(totalGapMs / (timestamps.size() - 1) / 60_000.0);
    }

    static double spanMinutes(Collection<TransferRecord> records) {
        List<Long> timestamps = sortedTimestamps(records);
        if (timestamps.size() < 2) return 0.0;
        return (timestamps.get(timestamps.size() - 1) - timestamps.get(0)) / 60_000.0;
    }

    private static List<Long> sortedTimestamps(Collection<TransferRecord> records) {
        return records.stream()
                .filter(TransferRecord::hasTimestamp)
                .map(TransferRecord::getTimestamp)
                .sorted()
                .collect(Collectors.toList());
    }

    private static List<TransferRecord> filter(List<TransferRecord> records, Predicate<TransferRecord> predicate) {
        return records.stream().filter(predicate).collect(Collectors.toList());
    }

    private static List<Double> positiveValues(List<TransferRecord> records) {
        List<Double> values = new ArrayList<>();
        for (TransferRecord record : records) {
            if (record.getValue() > 0) values.add(record.getValue());
        }
        return values;
    }

    private static int uniqueCounterparties(List<TransferRecord> records) {
        Set<String> unique = records.stream()
                .map(TransferRecord::getNormalizedCounterparty)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return unique.size();
    }

    private static List<String> contracts(List<TransferRecord> records) {
        return records.stream()
                .map(TransferRecord::getNormalizedTokenContract)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private static long mostFrequentCount(List<String> items) {
        return items.stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .values().stream()
                .mapToLong(Long::longValue)
                .max()
                .orElse(0L);
    }

    private static double toDouble(Object raw) {
        if (raw == null) return 0.0;
        if (raw instanceof Number) {
            return Numbers.finiteOrZero(((Number) raw).doubleValue());
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) return 0.0;
        try {
            return Numbers.finiteOrZero(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
