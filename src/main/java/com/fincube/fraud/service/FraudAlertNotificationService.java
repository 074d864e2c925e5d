package com.fincube.fraud.service;

import com.fincube.fraud.config.FraudAlertConfig;
import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.ScoreDecision;
import com.fincube.fraud.model.ScoreResponse;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends an analyst alert for every confident fraud decision. Delivery
 * failures are logged and counted; they never affect the scoring response.
 */
@Service
public class FraudAlertNotificationService {

    private static final Logger log = LoggerFactory.getLogger(FraudAlertNotificationService.class);

    private final FraudAlertConfig config;
    private final MetricsConfig metricsConfig;

    public FraudAlertNotificationService(FraudAlertConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Fraud alerts initialized: channel={}, recipients={}, minConfidence={}",
                    config.getChannel(), config.getRecipients().size(), config.getMinConfidence());
        } else {
            log.info("Fraud alerts are DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-fraud-alert")
    public void notifyIfFraud(ScoreResponse response) {
        if (!shouldAlert(response)) {
            return;
        }

        String body = buildMessageBody(response);
        String channel = config.getChannel().name().toLowerCase();
        for (String recipient : config.getRecipients()) {
            try {
                String sid = send(address(recipient), address(config.getFromNumber()), body);
                metricsConfig.recordNotification(channel, "success");
                log.info("Fraud alert sent for reference={} to {}, sid={}", response.getReferenceId(), recipient, sid);
            } catch (Exception e) {
                metricsConfig.recordNotification(channel, "error");
                log.error("Failed to send fraud alert for reference={} to {}: {}",
                        response.getReferenceId(), recipient, e.getMessage(), e);
            }
        }
    }

    boolean shouldAlert(ScoreResponse response) {
        if (!config.isEnabled() || response.getDecision() == null) {
            return false;
        }
        ScoreDecision decision = response.getDecision();
        if (decision.getLabel() != FraudLabel.FRAUD) {
            return false;
        }
        if (decision.getConfidence() < config.getMinConfidence()) {
            log.debug("Fraud decision for reference={} below alert confidence ({} < {})",
                    response.getReferenceId(), decision.getConfidence(), config.getMinConfidence());
            return false;
        }
        return true;
    }

    String send(String to, String from, String body) {
        Message message = Message.creator(new PhoneNumber(to), new PhoneNumber(from), body).create();
        return message.getSid();
    }

    String buildMessageBody(ScoreResponse response) {
        ScoreDecision decision = response.getDecision();
        List<String> riskFactors = decision.getRiskFactors();
        String topFactors = riskFactors.isEmpty()
                ? "N/A"
                : String.join("; ", riskFactors.subList(0, Math.min(config.getMaxRiskFactors(), riskFactors.size())));

        StringBuilder sb = new StringBuilder();
        sb.append("[FRAUD ALERT] Account flagged\n");
        sb.append("Reference: ").append(response.getReferenceId()).append("\n");
        sb.append("Address: ").append(response.getAddress()).append("\n");
        sb.append(String.format("Confidence: %.2f\n", decision.getConfidence()));
        NeighborAnalysis neighbors = response.getNeighborAnalysis();
        if (neighbors != null && neighbors.hasEvidence()) {
            sb.append(String.format("Neighbor fraud probability: %.2f (%d/%d fraudulent)\n",
                    neighbors.getFraudProbability(), neighbors.getFraudCount(), neighbors.getTotalCount()));
        }
        if (!decision.getOverrides().isEmpty()) {
            sb.append("Guardrails: ").append(String.join("; ", decision.getOverrides())).append("\n");
        }
        sb.append("Risk factors: ").append(topFactors);
        return sb.toString();
    }

    private String address(String number) {
        if (config.getChannel() == FraudAlertConfig.Channel.WHATSAPP) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
