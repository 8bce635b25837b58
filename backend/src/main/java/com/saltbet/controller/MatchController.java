package com.saltbet.controller;

import com.saltbet.dto.MatchRequests;
import com.saltbet.dto.MatchResponses;
import com.saltbet.mapper.BettingResponseMapper;
import com.saltbet.model.Match;
import com.saltbet.model.Side;
import com.saltbet.model.SideTotals;
import com.saltbet.repository.StakeRepository;
import com.saltbet.service.MatchDataClient;
import com.saltbet.service.MatchLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the match lifecycle.
 */
@RestController
@RequestMapping("/api/matches")
public class MatchController {

    private final MatchLifecycleService matchLifecycleService;
    private final MatchDataClient matchDataClient;
    private final StakeRepository stakeRepository;
    private final BettingResponseMapper responseMapper;

    public MatchController(MatchLifecycleService matchLifecycleService,
                           MatchDataClient matchDataClient,
                           StakeRepository stakeRepository,
                           BettingResponseMapper responseMapper) {
        this.matchLifecycleService = matchLifecycleService;
        this.matchDataClient = matchDataClient;
        this.stakeRepository = stakeRepository;
        this.responseMapper = responseMapper;
    }

    /**
     * Get the most recently created match.
     *
     * @return the match, or 404 when none has been created yet
     */
    @GetMapping("/current")
    public ResponseEntity<MatchResponses.MatchDetail> getCurrentMatch() {
        return matchLifecycleService.currentMatch()
                .map(match -> ResponseEntity.ok(toDetail(match)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MatchResponses.MatchDetail> getMatch(@PathVariable String id) {
        return ResponseEntity.ok(toDetail(matchLifecycleService.findMatch(id)));
    }

    @GetMapping("/{id}/fighters")
    public ResponseEntity<MatchResponses.MatchFighters> getFighters(@PathVariable String id) {
        Match match = matchLifecycleService.findMatch(id);
        MatchDataClient.Fighter blue = matchDataClient.getFighter(match.getFighterBlueId());
        MatchDataClient.Fighter red = matchDataClient.getFighter(match.getFighterRedId());
        return ResponseEntity.ok(responseMapper.toMatchFighters(match, blue, red));
    }

    /**
     * Open a match for the bout now running. An open previous match is ended first.
     *
     * @param request optional fallback winner for the previous match
     */
    @PostMapping
    public ResponseEntity<MatchResponses.MatchSummary> createNextMatch(
            @RequestBody(required = false) MatchRequests.WinnerRequest request
    ) {
        Match match = matchLifecycleService.createNextMatch(winnerOf(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toMatchSummary(match));
    }

    @PostMapping("/{id}/end")
    public ResponseEntity<MatchResponses.MatchDetail> endMatch(
            @PathVariable String id,
            @RequestBody(required = false) MatchRequests.WinnerRequest request
    ) {
        Match match = matchLifecycleService.endMatch(id, winnerOf(request));
        return ResponseEntity.ok(toDetail(match));
    }

    @PostMapping("/{id}/settle")
    public ResponseEntity<MatchResponses.SettlementSummary> settleMatch(@PathVariable String id) {
        return ResponseEntity.ok(responseMapper.toSettlementSummary(matchLifecycleService.settleMatch(id)));
    }

    private MatchResponses.MatchDetail toDetail(Match match) {
        SideTotals durableTotals = new SideTotals(
                stakeRepository.sumAmountByMatchIdAndSide(match.getId(), Side.RED),
                stakeRepository.sumAmountByMatchIdAndSide(match.getId(), Side.BLUE)
        );
        long participants = stakeRepository.countByMatchId(match.getId());
        return responseMapper.toMatchDetail(match, durableTotals, participants);
    }

    private Side winnerOf(MatchRequests.WinnerRequest request) {
        return request != null ? request.winner() : null;
    }
}
