package com.fincube.fraud.controller;

import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.ErrorResponse;
import com.fincube.fraud.model.ScoreLedgerEntry;
import com.fincube.fraud.model.ScoreRequest;
import com.fincube.fraud.model.ScoreResponse;
import com.fincube.fraud.service.FraudScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/fraud")
@Tag(name = "Fraud Scoring", description = "Score blockchain accounts for fraud and read recorded outcomes")
public class FraudScoringController {

    private final FraudScoringService scoringService;

    public FraudScoringController(FraudScoringService scoringService) {
        this.scoringService = scoringService;
    }

    @Operation(summary = "Score an account",
            description = "Fetches the account's transfer history from the ledger, then runs feature extraction, " +
                    "neighbor voting, pattern detection, cross-validation, reasoning and guardrails. " +
                    "Returns the final decision with the five nearest reference accounts. " +
                    "Answers 503 until reference data has been loaded.")
    @PostMapping("/score")
    public ResponseEntity<?> score(@RequestBody ScoreRequest request) {
        if (request.getAddress() == null || request.getAddress().isBlank()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(HttpStatus.BAD_REQUEST, "address is required"));
        }
        ScoreResponse response = scoringService.score(request);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Score caller-supplied activity",
            description = "Runs the scoring pipeline on the transfers in the request body without querying the ledger. " +
                    "A missing activity is scored as an account with no history.")
    @PostMapping("/score/activity")
    public ResponseEntity<?> scoreActivity(@RequestBody ScoreRequest request) {
        if (request.getAddress() == null || request.getAddress().isBlank()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(HttpStatus.BAD_REQUEST, "address is required"));
        }
        AccountActivity activity = request.getActivity() != null ? request.getActivity() : AccountActivity.empty();
        ScoreResponse response = scoringService.scoreActivity(
                request.getEffectiveReferenceId(), request.getAddress(), activity);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Get the recorded score for a reference",
            description = "Returns the additive score ledger entry. Only Fraud and Not_Fraud outcomes move the score.")
    @GetMapping("/score/{referenceId}")
    public ResponseEntity<ScoreLedgerEntry> getScore(
            @Parameter(description = "Reference ID the outcome was recorded under", example = "REF-2024-000117")
            @PathVariable String referenceId) {
        return scoringService.getLedgerEntry(referenceId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
