package com.prizeflow.allocation.controller;

import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.engine.FailCode;
import com.prizeflow.allocation.engine.ReasonCode;
import com.prizeflow.allocation.mapper.AllocationResponseMapper;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed labels for reason and fail codes, so clients never hard-code the text.
 */
@RestController
@RequestMapping("/api/allocation")
public class AllocationReferenceController {

    private final AllocationResponseMapper allocationResponseMapper;

    public AllocationReferenceController(AllocationResponseMapper allocationResponseMapper) {
        this.allocationResponseMapper = allocationResponseMapper;
    }

    @GetMapping("/reason-codes")
    public ResponseEntity<List<AllocationResponses.ReasonCodeLabel>> reasonCodes() {
        return ResponseEntity.ok(Arrays.stream(ReasonCode.values())
                .map(allocationResponseMapper::toReasonCodeLabel)
                .toList());
    }

    @GetMapping("/fail-codes")
    public ResponseEntity<List<AllocationResponses.FailCodeLabel>> failCodes() {
        return ResponseEntity.ok(Arrays.stream(FailCode.values())
                .map(allocationResponseMapper::toFailCodeLabel)
                .toList());
    }
}
