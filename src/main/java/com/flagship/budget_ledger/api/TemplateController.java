package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.allocation.BudgetTemplateService;
import com.flagship.budget_ledger.api.dto.CreateTemplateRequest;
import com.flagship.budget_ledger.api.dto.TemplateResponse;
import com.flagship.budget_ledger.api.dto.UpdateTemplateRequest;
import com.flagship.budget_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/owners/{ownerId}/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final BudgetTemplateService templateService;

    @PostMapping
    public ResponseEntity<TemplateResponse> createTemplate(@PathVariable("ownerId") UUID ownerId,
                                                           @Valid @RequestBody CreateTemplateRequest request) {
        CorrelationContext.bindOwner(ownerId);
        CorrelationContext.bindAccount(request.getAccountId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TemplateResponse.from(templateService.createTemplate(ownerId, request.toCommand())));
    }

    /**
     * Templates in run order.
     */
    @GetMapping
    public ResponseEntity<List<TemplateResponse>> listTemplates(
            @PathVariable("ownerId") UUID ownerId,
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(templateService.listTemplates(ownerId, activeOnly).stream()
            .map(TemplateResponse::from)
            .toList());
    }

    @GetMapping("/{templateId}")
    public ResponseEntity<TemplateResponse> getTemplate(@PathVariable("ownerId") UUID ownerId,
                                                        @PathVariable("templateId") UUID templateId) {
        return ResponseEntity.ok(TemplateResponse.from(templateService.getTemplate(ownerId, templateId)));
    }

    @PutMapping("/{templateId}")
    public ResponseEntity<TemplateResponse> updateTemplate(@PathVariable("ownerId") UUID ownerId,
                                                           @PathVariable("templateId") UUID templateId,
                                                           @Valid @RequestBody UpdateTemplateRequest request) {
        CorrelationContext.bindOwner(ownerId);
        return ResponseEntity.ok(TemplateResponse.from(
            templateService.updateTemplate(ownerId, templateId, request.toCommand())));
    }

    @PostMapping("/{templateId}/deactivation")
    public ResponseEntity<TemplateResponse> deactivateTemplate(@PathVariable("ownerId") UUID ownerId,
                                                               @PathVariable("templateId") UUID templateId) {
        CorrelationContext.bindOwner(ownerId);
        return ResponseEntity.ok(TemplateResponse.from(templateService.deactivateTemplate(ownerId, templateId)));
    }

    @PostMapping("/{templateId}/activation")
    public ResponseEntity<TemplateResponse> activateTemplate(@PathVariable("ownerId") UUID ownerId,
                                                             @PathVariable("templateId") UUID templateId) {
        CorrelationContext.bindOwner(ownerId);
        return ResponseEntity.ok(TemplateResponse.from(templateService.activateTemplate(ownerId, templateId)));
    }
}
