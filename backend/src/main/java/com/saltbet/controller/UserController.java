package com.saltbet.controller;

import com.saltbet.dto.StakeResponses;
import com.saltbet.dto.UserResponse;
import com.saltbet.mapper.BettingResponseMapper;
import com.saltbet.model.User;
import com.saltbet.repository.StakeRepository;
import com.saltbet.repository.UserRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final CallerResolver callerResolver;
    private final StakeRepository stakeRepository;
    private final UserRepository userRepository;
    private final BettingResponseMapper responseMapper;

    public UserController(CallerResolver callerResolver,
                          StakeRepository stakeRepository,
                          UserRepository userRepository,
                          BettingResponseMapper responseMapper) {
        this.callerResolver = callerResolver;
        this.stakeRepository = stakeRepository;
        this.userRepository = userRepository;
        this.responseMapper = responseMapper;
    }

    /**
     * Every user with lifetime stats, ordered by username. Backs the leaderboard.
     */
    @GetMapping
    public ResponseEntity<List<UserResponse>> listUsers() {
        List<UserResponse> users = userRepository.findAllByOrderByUsernameAsc()
                .stream()
                .map(responseMapper::toUserResponse)
                .toList();
        return ResponseEntity.ok(users);
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> getUser(@PathVariable UUID id) {
        User user = callerResolver.resolve(id);
        return ResponseEntity.ok(responseMapper.toUserResponse(user));
    }

    /**
     * Settled stake history, newest first.
     */
    @GetMapping("/{id}/stakes")
    public ResponseEntity<List<StakeResponses.StakeSummary>> getStakes(@PathVariable UUID id) {
        User user = callerResolver.resolve(id);
        List<StakeResponses.StakeSummary> stakes = stakeRepository.findByUserIdOrderByCreatedAtDesc(user.getId())
                .stream()
                .map(responseMapper::toStakeSummary)
                .toList();
        return ResponseEntity.ok(stakes);
    }
}
