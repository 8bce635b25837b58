package com.saltbet.controller;

import com.saltbet.dto.StakeRequests;
import com.saltbet.dto.StakeResponses;
import com.saltbet.mapper.BettingResponseMapper;
import com.saltbet.model.SideTotals;
import com.saltbet.model.User;
import com.saltbet.service.SseTotalsPublisher;
import com.saltbet.service.StakeLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * Stake placement and the live side totals of the current match.
 */
@RestController
@RequestMapping("/api/stakes")
public class StakeController {

    private final StakeLedgerService stakeLedgerService;
    private final SseTotalsPublisher sseTotalsPublisher;
    private final CallerResolver callerResolver;
    private final BettingResponseMapper responseMapper;

    public StakeController(StakeLedgerService stakeLedgerService,
                           SseTotalsPublisher sseTotalsPublisher,
                           CallerResolver callerResolver,
                           BettingResponseMapper responseMapper) {
        this.stakeLedgerService = stakeLedgerService;
        this.sseTotalsPublisher = sseTotalsPublisher;
        this.callerResolver = callerResolver;
        this.responseMapper = responseMapper;
    }

    @PostMapping
    public ResponseEntity<StakeResponses.StakeAccepted> placeStake(
            @RequestHeader(CallerResolver.USER_HEADER) UUID userId,
            @Valid @RequestBody StakeRequests.PlaceStakeRequest request
    ) {
        User user = callerResolver.resolve(userId);
        boolean accepted = stakeLedgerService.placeStake(user, request.amount(), request.side());
        return ResponseEntity.ok(new StakeResponses.StakeAccepted(accepted));
    }

    @PostMapping("/cancel")
    public ResponseEntity<StakeResponses.StakeAccepted> cancelStake(
            @RequestHeader(CallerResolver.USER_HEADER) UUID userId,
            @Valid @RequestBody StakeRequests.CancelStakeRequest request
    ) {
        User user = callerResolver.resolve(userId);
        boolean accepted = stakeLedgerService.cancelStake(user, request.amount());
        return ResponseEntity.ok(new StakeResponses.StakeAccepted(accepted));
    }

    @GetMapping("/totals")
    public ResponseEntity<SideTotals> getTotals() {
        return ResponseEntity.ok(stakeLedgerService.currentTotals());
    }

    /**
     * Subscribe to totals updates. The current totals are sent straight away.
     */
    @GetMapping(path = "/totals/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamTotals() {
        return sseTotalsPublisher.subscribe(stakeLedgerService.currentTotals());
    }

    @GetMapping("/me")
    public ResponseEntity<StakeResponses.MyStake> getMyStake(
            @RequestHeader(CallerResolver.USER_HEADER) UUID userId
    ) {
        User user = callerResolver.resolve(userId);
        StakeResponses.MyStake response = new StakeResponses.MyStake(
                stakeLedgerService.activeStakeOf(user.getId()).map(responseMapper::toStakeSummary).orElse(null),
                stakeLedgerService.openStakeOf(user.getId()).map(responseMapper::toOpenStake).orElse(null)
        );
        return ResponseEntity.ok(response);
    }
}
