package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.account.IntegrityService;
import com.flagship.budget_ledger.api.dto.IntegrityReportResponse;
import com.flagship.budget_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * GET reports issues without touching anything; POST reports and repairs them.
 */
@RestController
@RequestMapping("/api/owners/{ownerId}/integrity")
@RequiredArgsConstructor
public class IntegrityController {

    private final IntegrityService integrityService;

    @GetMapping
    public ResponseEntity<IntegrityReportResponse> validate(@PathVariable("ownerId") UUID ownerId) {
        CorrelationContext.bindOwner(ownerId);
        return ResponseEntity.ok(IntegrityReportResponse.from(integrityService.validateIntegrity(ownerId, false)));
    }

    @PostMapping("/fix")
    public ResponseEntity<IntegrityReportResponse> fix(@PathVariable("ownerId") UUID ownerId) {
        CorrelationContext.bindOwner(ownerId);
        return ResponseEntity.ok(IntegrityReportResponse.from(integrityService.validateIntegrity(ownerId, true)));
    }
}
