package com.fincube.fraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Analyst alerts for accounts scored as fraud, delivered through Twilio.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fraud-alert")
public class FraudAlertConfig {

    public enum Channel {
        SMS,
        WHATSAPP
    }

    private boolean enabled = false;
    private Channel channel = Channel.SMS;

    private String accountSid;
    private String authToken;
    private String fromNumber;

    // Every recipient gets its own message.
    private List<String> recipients = new ArrayList<>();

    // Fraud decisions below this confidence are not alerted.
    private double minConfidence = 0.6;

    private int maxRiskFactors = 3;
}
