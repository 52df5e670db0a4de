package io.b2mash.worldtax.tax.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

public record BatchTaxCalculationRequest(
    @NotEmpty(message = "lines must not be empty")
        @Size(max = 500, message = "a batch must not exceed 500 lines")
        List<@Valid TaxCalculationRequest> lines) {}
