package com.fincube.fraud.controller;

import com.fincube.fraud.model.ReferenceImportRequest;
import com.fincube.fraud.model.ReferenceIndexStats;
import com.fincube.fraud.model.ReferenceLoadResult;
import com.fincube.fraud.model.ReferenceRecord;
import com.fincube.fraud.model.Scaler;
import com.fincube.fraud.service.ReferenceDataService;
import com.fincube.fraud.service.ReferenceImportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reference")
@Tag(name = "Reference Data", description = "Load and inspect the labeled reference population used for neighbor voting")
public class ReferenceDataController {

    private final ReferenceDataService referenceDataService;
    private final ReferenceImportService referenceImportService;

    public ReferenceDataController(ReferenceDataService referenceDataService,
                                   ReferenceImportService referenceImportService) {
        this.referenceDataService = referenceDataService;
        this.referenceImportService = referenceImportService;
    }

    @Operation(summary = "Load the reference population",
            description = "Replaces the reference index with the given labeled accounts. A new scaler version is fitted " +
                    "over the batch, published, and used to normalize every reference vector.")
    @PostMapping("/load")
    public ResponseEntity<ReferenceLoadResult> load(@RequestBody List<ReferenceRecord> records) {
        if (records == null || records.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(referenceDataService.load(records));
    }

    @Operation(summary = "Load the reference population from CSV",
            description = "Same as /load for a CSV export with a header row: an Address column, a FLAG column " +
                    "(1 = fraud, 0 = legitimate) and one column per feature. Unknown columns are ignored.")
    @PostMapping(value = "/load/csv", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ReferenceLoadResult> loadCsv(@RequestBody String csv) {
        return ResponseEntity.ok(referenceImportService.loadCsv(csv));
    }

    @Operation(summary = "Import the reference population from a URL",
            description = "Downloads a CSV or JSON export and loads it like /load. JSON may be an array of rows, " +
                    "an object with a data array, or a single row. Answers 502 when the download fails.")
    @PostMapping("/import")
    public ResponseEntity<ReferenceLoadResult> importDataset(@RequestBody ReferenceImportRequest request) {
        return ResponseEntity.ok(referenceImportService.importFrom(request));
    }

    @Operation(summary = "Reference index statistics",
            description = "Vector count, fraud count, dimension and the current scaler version.")
    @GetMapping("/stats")
    public ResponseEntity<ReferenceIndexStats> stats() {
        return ResponseEntity.ok(referenceDataService.stats());
    }

    @Operation(summary = "Current scaler",
            description = "Per-dimension means and standard deviations of the published scaler. 404 before the first load.")
    @GetMapping("/scaler")
    public ResponseEntity<Scaler> scaler() {
        return referenceDataService.currentScaler()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Clear the reference index",
            description = "Removes every reference vector. Scoring answers 503 until data is loaded again.")
    @DeleteMapping
    public ResponseEntity<Map<String, String>> clear() {
        referenceDataService.clear();
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }
}
