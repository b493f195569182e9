package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.lock.dto.ApprovalRequest;
import com.flagship.vote_escrow.lock.dto.OperatorRequest;
import com.flagship.vote_escrow.lock.dto.PositionResponse;
import com.flagship.vote_escrow.lock.dto.TransferRequest;
import com.flagship.vote_escrow.observability.CorrelationIdFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Ownership endpoints: transfers, approvals and holder listings.
 */
@RestController
@RequiredArgsConstructor
public class OwnershipController {

    private final OwnershipService ownershipService;
    private final LockQueryService queryService;

    @PostMapping("/api/locks/{id}/transfer")
    public ResponseEntity<PositionResponse> transfer(
            @PathVariable("id") long id,
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        ownershipService.transferFrom(caller, request.getFrom(), request.getTo(), id);
        return ResponseEntity.ok(PositionResponse.from(queryService.position(id), queryService.balanceOf(id)));
    }

    @PostMapping("/api/locks/{id}/approve")
    public ResponseEntity<Void> approve(
            @PathVariable("id") long id,
            @RequestBody ApprovalRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        ownershipService.approve(caller, id, request.getApproved());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/api/operators")
    public ResponseEntity<Void> setApprovalForAll(
            @Valid @RequestBody OperatorRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        ownershipService.setApprovalForAll(caller, request.getOperator(), request.getApproved());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/api/holders/{holder}/locks")
    public ResponseEntity<List<PositionResponse>> positionsOf(@PathVariable("holder") UUID holder) {
        List<PositionResponse> positions = queryService.positionsOf(holder).stream()
            .map(record -> PositionResponse.from(record, queryService.balanceOf(record.getId())))
            .toList();
        return ResponseEntity.ok(positions);
    }
}
