package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.api.dto.ConfigureOwnerRequest;
import com.flagship.budget_ledger.api.dto.SettingsResponse;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.settings.OwnerSettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/owners/{ownerId}/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final OwnerSettingsService settingsService;

    @GetMapping
    public ResponseEntity<SettingsResponse> getSettings(@PathVariable("ownerId") UUID ownerId) {
        return ResponseEntity.ok(SettingsResponse.from(settingsService.settingsFor(ownerId)));
    }

    /**
     * Omitted fields keep their current values.
     */
    @PutMapping
    public ResponseEntity<SettingsResponse> configure(@PathVariable("ownerId") UUID ownerId,
                                                      @RequestBody ConfigureOwnerRequest request) {
        CorrelationContext.bindOwner(ownerId);
        return ResponseEntity.ok(SettingsResponse.from(settingsService.configure(ownerId, request.toCommand())));
    }
}
