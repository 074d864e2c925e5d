package com.fincube.fraud.service;

import com.fincube.fraud.exception.DatasetUnavailableException;
import com.fincube.fraud.model.ReferenceImportRequest;
import com.fincube.fraud.model.ReferenceLoadResult;
import com.fincube.fraud.model.ReferenceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.List;

/**
 * Loads the reference population from a CSV or JSON export, either posted
 * directly or downloaded from a URL. Parsed rows go through the same
 * validate, fit and index flow as an inline batch.
 */
@Service
public class ReferenceImportService {

    private static final Logger log = LoggerFactory.getLogger(ReferenceImportService.class);

    private final RestClient restClient;
    private final ReferenceDatasetReader reader;
    private final ReferenceDataService referenceDataService;

    public ReferenceImportService(@Qualifier("datasetRestClient") RestClient restClient,
                                  ReferenceDatasetReader reader,
                                  ReferenceDataService referenceDataService) {
        this.restClient = restClient;
        this.reader = reader;
        this.referenceDataService = referenceDataService;
    }

    public ReferenceLoadResult loadCsv(String csv) {
        return load(reader.readCsv(csv), "posted CSV");
    }

    public ReferenceLoadResult importFrom(ReferenceImportRequest request) {
        if (request.getSourceType() == null) {
            throw new IllegalArgumentException("sourceType is required");
        }
        URI uri = parseUri(request.getSourceUrl());
        String body = download(uri);

        List<ReferenceRecord> records = switch (request.getSourceType()) {
            case CSV_URL -> reader.readCsv(body);
            case JSON_URL -> reader.readJson(body);
        };
        return load(records, uri.toString());
    }

    private ReferenceLoadResult load(List<ReferenceRecord> records, String source) {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("Reference dataset from " + source + " has no rows");
        }
        log.info("Read {} reference rows from {}", records.size(), source);
        return referenceDataService.load(records);
    }

    private String download(URI uri) {
        try {
            String body = restClient.get().uri(uri).retrieve().body(String.class);
            return body == null ? "" : body;
        } catch (RestClientException e) {
            throw new DatasetUnavailableException("Failed to download reference dataset from " + uri, e);
        }
    }

    private static URI parseUri(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("sourceUrl is required");
        }
        URI uri;
        try {
            uri = URI.create(sourceUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("sourceUrl is not a valid URL: " + sourceUrl, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("sourceUrl must be an http or https URL");
        }
        return uri;
    }
}
