package com.fincube.fraud.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fincube.fraud.model.ReferenceRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a labeled dataset export into reference records. Rows are flat: an
 * {@code Address} column, a {@code FLAG} column and one column per feature.
 * Bookkeeping columns are dropped; feature values are left as read and
 * converted when the record is loaded.
 */
@Component
public class ReferenceDatasetReader {

    static final String ADDRESS_COLUMN = "Address";
    static final String FLAG_COLUMN = "FLAG";

    private static final Set<String> NON_FEATURE_COLUMNS = Set.of("", "Index", ADDRESS_COLUMN, FLAG_COLUMN);

    // Rows whose label cannot be read get this flag and are skipped on load.
    static final int UNREADABLE_FLAG = -1;

    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Reads a CSV export with a header row.
     */
    public List<ReferenceRecord> readCsv(String text) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class)
                .with(schema)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(text)) {
            List<ReferenceRecord> records = new ArrayList<>();
            while (rows.hasNextValue()) {
                records.add(toRecord(new LinkedHashMap<>(rows.nextValue())));
            }
            return records;
        } catch (IOException | RuntimeException e) {
            throw new IllegalArgumentException("Malformed CSV dataset: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a JSON export: an array of rows, an object whose {@code data}
     * field is that array, or a single row.
     */
    public List<ReferenceRecord> readJson(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed JSON dataset: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }

        JsonNode rows = root.isObject() && root.path("data").isArray() ? root.get("data") : root;
        List<ReferenceRecord> records = new ArrayList<>();
        if (rows.isArray()) {
            rows.forEach(row -> addJsonRow(row, records));
        } else {
            addJsonRow(rows, records);
        }
        return records;
    }

    private void addJsonRow(JsonNode row, List<ReferenceRecord> records) {
        if (!row.isObject()) {
            records.add(null);
            return;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        row.fields().forEachRemaining(field -> values.put(field.getKey(),
                field.getValue().isValueNode() ? field.getValue().asText() : null));
        records.add(toRecord(values));
    }

    ReferenceRecord toRecord(Map<String, Object> row) {
        Map<String, Object> features = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            if (column != null && !NON_FEATURE_COLUMNS.contains(column.trim())) {
                features.put(column, value);
            }
        });
        Object address = row.get(ADDRESS_COLUMN);
        return ReferenceRecord.builder()
                .address(address == null ? null : address.toString())
                .flag(parseFlag(row.get(FLAG_COLUMN)))
                .features(features)
                .build();
    }

    static int parseFlag(Object raw) {
        if (raw == null) return 0;
        String text = raw.toString().trim();
        if (text.isEmpty()) return 0;
        try {
            double value = Double.parseDouble(text);
            return value == Math.rint(value) ? (int) value : UNREADABLE_FLAG;
        } catch (NumberFormatException e) {
            return UNREADABLE_FLAG;
        }
    }
}
