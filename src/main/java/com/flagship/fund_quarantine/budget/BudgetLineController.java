package com.flagship.fund_quarantine.budget;

import com.flagship.fund_quarantine.budget.dto.CapacityResponse;
import com.flagship.fund_quarantine.quarantine.QuarantineQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/budget-lines")
@RequiredArgsConstructor
public class BudgetLineController {

    private final QuarantineQueryService queryService;

    /**
     * Current allocated, spent, reserved and available amounts for a budget line.
     */
    @GetMapping("/{id}/capacity")
    public ResponseEntity<CapacityResponse> capacity(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CapacityResponse.from(queryService.capacity(id)));
    }
}
