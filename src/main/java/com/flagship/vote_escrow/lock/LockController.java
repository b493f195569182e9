package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.lock.dto.AmountRequest;
import com.flagship.vote_escrow.lock.dto.BalanceResponse;
import com.flagship.vote_escrow.lock.dto.CreateLockRequest;
import com.flagship.vote_escrow.lock.dto.ExtendLockRequest;
import com.flagship.vote_escrow.lock.dto.MergeRequest;
import com.flagship.vote_escrow.lock.dto.PointResponse;
import com.flagship.vote_escrow.lock.dto.PositionResponse;
import com.flagship.vote_escrow.lock.dto.SplitResponse;
import com.flagship.vote_escrow.lock.dto.WithdrawalResponse;
import com.flagship.vote_escrow.observability.CorrelationIdFilter;
import com.flagship.vote_escrow.time.LedgerClock;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.UUID;

/**
 * REST API of the lock lifecycle.
 *
 * Every mutating call names its caller in the X-Caller-ID header; ownership and
 * approval checks run against that holder.
 */
@RestController
@RequestMapping("/api/locks")
@RequiredArgsConstructor
@Slf4j
public class LockController {

    private final LockService lockService;
    private final LockQueryService queryService;
    private final LedgerClock clock;

    @PostMapping
    public ResponseEntity<PositionResponse> createLock(
            @Valid @RequestBody CreateLockRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {

        log.info("Received lock creation request: amount={}, duration={}s, recipient={}",
                request.getAmount(), request.getDurationSeconds(), request.getRecipient());

        UUID recipient = request.getRecipient() != null ? request.getRecipient() : caller;
        long id = lockService.createLockFor(caller, request.getAmount(), request.getDurationSeconds(), recipient);

        return ResponseEntity.status(HttpStatus.CREATED).body(positionResponse(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PositionResponse> getPosition(@PathVariable("id") long id) {
        return ResponseEntity.ok(positionResponse(id));
    }

    /**
     * Balance now, or at {@code timestamp} when given.
     */
    @GetMapping("/{id}/balance")
    public ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("id") long id,
            @RequestParam(value = "timestamp", required = false) Long timestamp) {
        long at = timestamp != null ? timestamp : clock.currentTimestamp();
        return ResponseEntity.ok(new BalanceResponse(id, at, queryService.balanceAt(id, at)));
    }

    @GetMapping("/{id}/points/{epoch}")
    public ResponseEntity<PointResponse> getUserPoint(@PathVariable("id") long id,
                                                      @PathVariable("epoch") int epoch) {
        return ResponseEntity.ok(PointResponse.from(epoch, queryService.userPointHistory(id, epoch)));
    }

    @PostMapping("/{id}/deposit")
    public ResponseEntity<PositionResponse> depositFor(
            @PathVariable("id") long id,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        lockService.depositFor(caller, id, request.getAmount());
        return ResponseEntity.ok(positionResponse(id));
    }

    @PostMapping("/{id}/increase-amount")
    public ResponseEntity<PositionResponse> increaseAmount(
            @PathVariable("id") long id,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        lockService.increaseAmount(caller, id, request.getAmount());
        return ResponseEntity.ok(positionResponse(id));
    }

    @PostMapping("/{id}/extend")
    public ResponseEntity<PositionResponse> increaseUnlockTime(
            @PathVariable("id") long id,
            @Valid @RequestBody ExtendLockRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        lockService.increaseUnlockTime(caller, id, request.getDurationSeconds());
        return ResponseEntity.ok(positionResponse(id));
    }

    /**
     * Merges the position named in the body into the one in the path.
     */
    @PostMapping("/{id}/merge")
    public ResponseEntity<PositionResponse> merge(
            @PathVariable("id") long id,
            @Valid @RequestBody MergeRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        lockService.merge(caller, request.getFromId(), id);
        return ResponseEntity.ok(positionResponse(id));
    }

    @PostMapping("/{id}/split")
    public ResponseEntity<SplitResponse> split(
            @PathVariable("id") long id,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        SplitResult result = lockService.split(caller, id, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(SplitResponse.from(id, result));
    }

    @PostMapping("/{id}/permanent")
    public ResponseEntity<PositionResponse> lockPermanent(
            @PathVariable("id") long id,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        lockService.lockPermanent(caller, id);
        return ResponseEntity.ok(positionResponse(id));
    }

    @PostMapping("/{id}/unpermanent")
    public ResponseEntity<PositionResponse> unlockPermanent(
            @PathVariable("id") long id,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        lockService.unlockPermanent(caller, id);
        return ResponseEntity.ok(positionResponse(id));
    }

    @PostMapping("/{id}/withdraw")
    public ResponseEntity<WithdrawalResponse> withdraw(
            @PathVariable("id") long id,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        BigInteger amount = lockService.withdraw(caller, id);
        return ResponseEntity.ok(WithdrawalResponse.atExpiry(id, amount));
    }

    @PostMapping("/{id}/early-withdraw")
    public ResponseEntity<WithdrawalResponse> earlyWithdraw(
            @PathVariable("id") long id,
            @RequestHeader(CorrelationIdFilter.CALLER_ID_HEADER) UUID caller) {
        return ResponseEntity.ok(WithdrawalResponse.from(lockService.earlyWithdraw(caller, id)));
    }

    private PositionResponse positionResponse(long id) {
        return PositionResponse.from(queryService.position(id), queryService.balanceOf(id));
    }
}
