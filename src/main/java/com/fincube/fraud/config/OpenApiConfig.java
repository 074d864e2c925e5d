package com.fincube.fraud.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudScoringOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Account Fraud Scoring API")
                        .version("1.0.0")
                        .description(
                                "Fraud scoring for blockchain accounts by fusing neighbor evidence, behavioral patterns and reasoning.\n\n" +
                                "**Scoring Pipeline:**\n" +
                                "1. Receive an address via `POST /fraud/score` (or activity via `POST /fraud/score/activity`)\n" +
                                "2. Extract 44 account features and normalize them with the current scaler\n" +
                                "3. Vote among the 10 nearest labeled reference accounts (inverse-distance weighted)\n" +
                                "4. Run temporal, value, network, token and behavioral pattern detectors\n" +
                                "5. Cross-validate neighbor and pattern evidence\n" +
                                "6. Ask the reasoning oracle, or fall back to deterministic voting\n" +
                                "7. Apply guardrails: **Fraud**, **Not_Fraud** or **Undecided**\n\n" +
                                "**Pattern Dimensions:**\n" +
                                "- `TEMPORAL` - bursts, bot-like regularity, night activity, short lifespan\n" +
                                "- `VALUE` - round amounts, matched in/out values, mixer flow, draining\n" +
                                "- `NETWORK` - counterparty diversity, one-time addresses, circular flow\n" +
                                "- `TOKEN` - token diversity, wash trading, NFT activity\n" +
                                "- `BEHAVIORAL` - dusting, immediate forwarding, asymmetry, zero-value spam\n\n" +
                                "Load reference data via `POST /reference/load` before scoring.")
                        .contact(new Contact().name("Fraud Scoring Team")));
    }
}
