package com.saltbet.controller;

import com.saltbet.mapper.BettingResponseMapper;
import com.saltbet.model.Match;
import com.saltbet.model.Side;
import com.saltbet.model.Stake;
import com.saltbet.model.User;
import com.saltbet.repository.StakeRepository;
import com.saltbet.repository.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserController.class)
@Import(BettingResponseMapper.class)
class UserControllerTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000601");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CallerResolver callerResolver;

    @MockitoBean
    private StakeRepository stakeRepository;

    @MockitoBean
    private UserRepository userRepository;

    @Test
    void usersAreListedInUsernameOrder() throws Exception {
        User alice = new User();
        alice.setId(UUID.fromString("00000000-0000-0000-0000-000000000611"));
        alice.setUsername("alice");
        alice.setBalance(new BigDecimal("40.00"));
        alice.setTotalWins(1);
        alice.setTotalLosses(1);
        User bob = new User();
        bob.setId(UUID.fromString("00000000-0000-0000-0000-000000000612"));
        bob.setUsername("bob");
        bob.setBalance(new BigDecimal("12.50"));
        when(userRepository.findAllByOrderByUsernameAsc()).thenReturn(List.of(alice, bob));

        mockMvc.perform(get("/api/users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].username").value("alice"))
                .andExpect(jsonPath("$[0].winPercentage").value(50.0))
                .andExpect(jsonPath("$[1].username").value("bob"))
                .andExpect(jsonPath("$[1].winPercentage").value(0.0));
    }

    @Test
    void userIncludesDerivedStats() throws Exception {
        User user = new User();
        user.setId(USER_ID);
        user.setUsername("salty");
        user.setBalance(new BigDecimal("115.00"));
        user.setTotalWins(3);
        user.setTotalLosses(1);
        user.setTotalRevenueGained(new BigDecimal("25.00"));
        user.setTotalRevenueLost(new BigDecimal("10.00"));
        when(callerResolver.resolve(USER_ID)).thenReturn(user);

        mockMvc.perform(get("/api/users/{id}", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("salty"))
                .andExpect(jsonPath("$.balance").value(115.0))
                .andExpect(jsonPath("$.winPercentage").value(75.0))
                .andExpect(jsonPath("$.grossRevenue").value(15.0));
    }

    @Test
    void stakeHistoryListsSettledStakes() throws Exception {
        User user = new User();
        user.setId(USER_ID);
        user.setUsername("salty");
        Match match = new Match();
        match.setId("101-102-mock7");
        match.setWinningSide(Side.RED);
        Stake stake = new Stake();
        stake.setId(UUID.fromString("00000000-0000-0000-0000-000000000602"));
        stake.setAmount(new BigDecimal("10.00"));
        stake.setSide(Side.BLUE);
        stake.setUser(user);
        stake.setMatch(match);
        when(callerResolver.resolve(USER_ID)).thenReturn(user);
        when(stakeRepository.findByUserIdOrderByCreatedAtDesc(USER_ID)).thenReturn(List.of(stake));

        mockMvc.perform(get("/api/users/{id}/stakes", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].matchId").value("101-102-mock7"))
                .andExpect(jsonPath("$[0].side").value("BLUE"))
                .andExpect(jsonPath("$[0].winningSide").value("RED"));
    }
}
