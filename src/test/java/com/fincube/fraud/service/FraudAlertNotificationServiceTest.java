package com.fincube.fraud.service;

import com.fincube.fraud.config.FraudAlertConfig;
import com.fincube.fraud.config.MetricsConfig;
import com.fincube.fraud.model.FraudLabel;
import com.fincube.fraud.model.NeighborAnalysis;
import com.fincube.fraud.model.ScoreDecision;
import com.fincube.fraud.model.ScoreResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.fincube.fraud.testutil.TestDataFactory.ADDRESS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class FraudAlertNotificationServiceTest {

    @Mock
    private MetricsConfig metricsConfig;

    private FraudAlertConfig config;
    private FraudAlertNotificationService notificationService;

    @BeforeEach
    void setUp() {
        config = new FraudAlertConfig();
        config.setFromNumber("+15550000000");
        config.setRecipients(List.of("+15551111111", "+15552222222"));
        notificationService = spy(new FraudAlertNotificationService(config, metricsConfig));
    }

    private static ScoreResponse response(FraudLabel label, double confidence, List<String> riskFactors) {
        return ScoreResponse.builder()
                .referenceId("REF-9")
                .address(ADDRESS)
                .decision(ScoreDecision.builder()
                        .label(label)
                        .confidence(confidence)
                        .riskFactors(riskFactors)
                        .build())
                .build();
    }

    @Test
    void buildMessageBody_topRiskFactorsOnly() {
        String body = notificationService.buildMessageBody(response(FraudLabel.FRAUD, 0.876,
                List.of("circular flow", "mixer profile", "burst activity", "night activity")));

        assertThat(body).startsWith("[FRAUD ALERT] Account flagged");
        assertThat(body).contains("Reference: REF-9", "Address: " + ADDRESS, "Confidence: 0.88");
        assertThat(body).doesNotContain("Neighbor fraud probability", "Guardrails");
        assertThat(body).endsWith("Risk factors: circular flow; mixer profile; burst activity");
    }

    @Test
    void buildMessageBody_includesNeighborEvidenceAndGuardrails() {
        ScoreResponse response = ScoreResponse.builder()
                .referenceId("REF-9")
                .address(ADDRESS)
                .neighborAnalysis(NeighborAnalysis.builder()
                        .fraudProbability(0.912).fraudCount(4).nonFraudCount(1).totalCount(5).build())
                .decision(ScoreDecision.builder()
                        .label(FraudLabel.FRAUD)
                        .confidence(0.9)
                        .overrides(List.of("neighbor consensus"))
                        .build())
                .build();

        String body = notificationService.buildMessageBody(response);

        assertThat(body).contains("Neighbor fraud probability: 0.91 (4/5 fraudulent)", "Guardrails: neighbor consensus");
        assertThat(body).endsWith("Risk factors: N/A");
    }

    @Test
    void notifyIfFraud_disabled_nothingSent() {
        config.setEnabled(false);

        notificationService.notifyIfFraud(response(FraudLabel.FRAUD, 0.9, List.of("circular flow")));

        verify(notificationService, never()).send(anyString(), anyString(), anyString());
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void notifyIfFraud_notFraud_nothingSent() {
        config.setEnabled(true);

        notificationService.notifyIfFraud(response(FraudLabel.NOT_FRAUD, 0.9, List.of()));

        verify(notificationService, never()).send(anyString(), anyString(), anyString());
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void notifyIfFraud_belowMinConfidence_nothingSent() {
        config.setEnabled(true);
        config.setMinConfidence(0.7);

        notificationService.notifyIfFraud(response(FraudLabel.FRAUD, 0.65, List.of("circular flow")));

        verify(notificationService, never()).send(anyString(), anyString(), anyString());
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void notifyIfFraud_eachRecipientAlerted_failuresCountedSeparately() {
        config.setEnabled(true);
        doReturn("SM1").when(notificationService).send(eq("+15551111111"), anyString(), anyString());
        doThrow(new IllegalStateException("unreachable"))
                .when(notificationService).send(eq("+15552222222"), anyString(), anyString());

        notificationService.notifyIfFraud(response(FraudLabel.FRAUD, 0.8, List.of("circular flow")));

        verify(metricsConfig).recordNotification("sms", "success");
        verify(metricsConfig).recordNotification("sms", "error");
    }

    @Test
    void notifyIfFraud_whatsappChannel_prefixesNumbers() {
        config.setEnabled(true);
        config.setChannel(FraudAlertConfig.Channel.WHATSAPP);
        config.setRecipients(List.of("+15551111111"));
        doReturn("SM2").when(notificationService).send(anyString(), anyString(), anyString());

        notificationService.notifyIfFraud(response(FraudLabel.FRAUD, 0.8, List.of()));

        verify(notificationService).send(eq("whatsapp:+15551111111"), eq("whatsapp:+15550000000"), anyString());
        verify(metricsConfig).recordNotification("whatsapp", "success");
    }
}
