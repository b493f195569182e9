package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.lock.dto.AdminRequests.MinLockAmountRequest;
import com.flagship.vote_escrow.lock.dto.AdminRequests.PenaltyRequest;
import com.flagship.vote_escrow.lock.dto.AdminRequests.SplitPermissionRequest;
import com.flagship.vote_escrow.lock.dto.AdminRequests.TeamRequest;
import com.flagship.vote_escrow.lock.dto.AdminRequests.TreasuryRequest;
import com.flagship.vote_escrow.observability.CorrelationIdFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Team-only parameter endpoints.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class EscrowAdminController {

    private final EscrowAdminService adminService;
    private final EscrowGovernance governance;

    @GetMapping("/parameters")
    public ResponseEntity<Map<String, Object>> parameters() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("team", governance.getTeam());
        response.put("pending_team", governance.getPendingTeam());
        response.put("early_withdraw_treasury", governance.getEarlyWithdrawTreasury());
        response.put("early_withdraw_penalty_bps", governance.getEarlyWithdrawPenaltyBps());
        response.put("min_lock_amount", governance.getMinLockAmount());
        response.put("global_split_enabled", governance.isGlobalSplitEnabled());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/team")
    public ResponseEntity<Void> proposeTeam(@Valid @RequestBody TeamRequest request,
                                            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        adminService.proposeTeam(caller, request.getTeam());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/team/accept")
    public ResponseEntity<Void> acceptTeam(@RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        adminService.acceptTeam(caller);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/split")
    public ResponseEntity<Void> toggleSplit(@Valid @RequestBody SplitPermissionRequest request,
                                            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        adminService.toggleSplit(caller, request.getAccount(), request.getEnabled());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/treasury")
    public ResponseEntity<Void> setTreasury(@Valid @RequestBody TreasuryRequest request,
                                            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        adminService.setEarlyWithdrawTreasury(caller, request.getTreasury());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/penalty")
    public ResponseEntity<Void> setPenalty(@Valid @RequestBody PenaltyRequest request,
                                           @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        adminService.setEarlyWithdrawPenalty(caller, request.getPenaltyBps());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/min-lock-amount")
    public ResponseEntity<Void> setMinLockAmount(@Valid @RequestBody MinLockAmountRequest request,
                                                 @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        adminService.setMinLockAmount(caller, request.getAmount());
        return ResponseEntity.noContent().build();
    }
}
