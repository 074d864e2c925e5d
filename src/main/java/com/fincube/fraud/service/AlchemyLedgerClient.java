package com.fincube.fraud.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fincube.fraud.config.LedgerConfig;
import com.fincube.fraud.exception.LedgerUnavailableException;
import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.TransferCategory;
import com.fincube.fraud.model.TransferDirection;
import com.fincube.fraud.model.TransferRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches account activity from an Alchemy JSON-RPC endpoint.
 *
 * Sent and received transfers come from {@code alchemy_getAssetTransfers}
 * (one call per direction), the balance from {@code eth_getBalance}.
 * Malformed transfer fields are defaulted rather than rejected.
 */
@Service
public class AlchemyLedgerClient implements LedgerDataSource {

    private static final Logger log = LoggerFactory.getLogger(AlchemyLedgerClient.class);

    static final List<String> CATEGORIES = List.of("external", "internal", "erc20", "erc721", "erc1155");

    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);

    private final RestClient restClient;
    private final LedgerConfig config;

    public AlchemyLedgerClient(@Qualifier("ledgerRestClient") RestClient restClient, LedgerConfig config) {
        this.restClient = restClient;
        this.config = config;
    }

    @Override
    public AccountActivity fetchActivity(String address) {
        List<TransferRecord> sent = fetchTransfers(address, TransferDirection.SENT);
        List<TransferRecord> received = fetchTransfers(address, TransferDirection.RECEIVED);
        double balance = fetchBalance(address);

        log.info("Fetched ledger activity for {}: sent={}, received={}, balance={}",
                address, sent.size(), received.size(), balance);

        return AccountActivity.builder()
                .sent(sent)
                .received(received)
                .balance(balance)
                .build();
    }

    List<TransferRecord> fetchTransfers(String address, TransferDirection direction) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("fromBlock", "0x0");
        filter.put("toBlock", "latest");
        filter.put(direction == TransferDirection.SENT ? "fromAddress" : "toAddress", address);
        filter.put("category", CATEGORIES);
        filter.put("withMetadata", true);
        filter.put("excludeZeroValue", false);
        filter.put("maxCount", "0x" + Integer.toHexString(config.getMaxCount()));

        JsonNode result = call("alchemy_getAssetTransfers", List.of(filter));
        JsonNode transfers = result.path("transfers");

        List<TransferRecord> records = new ArrayList<>();
        if (transfers.isArray()) {
            for (JsonNode transfer : transfers) {
                records.add(toRecord(transfer, direction));
            }
        }
        return records;
    }

    double fetchBalance(String address) {
        JsonNode result = call("eth_getBalance", List.of(address, "latest"));
        return weiToEther(result.asText(null));
    }

    static TransferRecord toRecord(JsonNode transfer, TransferDirection direction) {
        String counterparty = direction == TransferDirection.SENT
                ? transfer.path("to").asText(null)
                : transfer.path("from").asText(null);

        return TransferRecord.builder()
                .direction(direction)
                .category(TransferCategory.fromLedgerName(transfer.path("category").asText(null)))
                .value(transfer.path("value").isNumber() ? transfer.path("value").asDouble() : 0.0)
                .counterparty(counterparty)
                .timestamp(parseTimestamp(transfer.path("metadata").path("blockTimestamp").asText(null)))
                .tokenContract(transfer.path("rawContract").path("address").asText(null))
                .build();
    }

    static long parseTimestamp(String isoTimestamp) {
        if (isoTimestamp == null || isoTimestamp.isBlank()) {
            return 0L;
        }
        try {
            return Instant.parse(isoTimestamp).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable block timestamp '{}', treating as missing", isoTimestamp);
            return 0L;
        }
    }

    static double weiToEther(String hexWei) {
        if (hexWei == null || !hexWei.startsWith("0x") || hexWei.length() < 3) {
            return 0.0;
        }
        try {
            BigInteger wei = new BigInteger(hexWei.substring(2), 16);
            return new BigDecimal(wei).divide(WEI_PER_ETHER).doubleValue();
        } catch (NumberFormatException e) {
            log.debug("Unparseable balance '{}', treating as zero", hexWei);
            return 0.0;
        }
    }

    private JsonNode call(String method, List<?> params) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jsonrpc", "2.0");
        payload.put("id", 1);
        payload.put("method", method);
        payload.put("params", params);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(config.getBaseUrl() + "/" + config.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.error("Ledger request {} failed: {}", method, e.getMessage());
            throw new LedgerUnavailableException("Ledger request " + method + " failed", e);
        }

        if (response == null) {
            throw new LedgerUnavailableException("Empty ledger response for " + method, null);
        }
        if (response.has("error")) {
            throw new LedgerUnavailableException("Ledger error for " + method + ": " + response.get("error"), null);
        }
        return response.path("result");
    }
}
