package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One labeled account of the reference population")
public class ReferenceRecord {

    @Schema(description = "Account address", example = "0x00009277775ac7d0d59eaad8fee3d10ac6c805e8")
    private String address;

    @Schema(description = "1 = fraud, 0 = legitimate", example = "0")
    private int flag;

    @Schema(description = "Feature values keyed by canonical feature name; values may be numbers or numeric strings")
    private Map<String, Object> features;
}
