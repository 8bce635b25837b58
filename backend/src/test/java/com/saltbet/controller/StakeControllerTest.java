package com.saltbet.controller;

import com.saltbet.mapper.BettingResponseMapper;
import com.saltbet.model.ActiveStake;
import com.saltbet.model.Side;
import com.saltbet.model.SideTotals;
import com.saltbet.model.User;
import com.saltbet.service.SseTotalsPublisher;
import com.saltbet.service.StakeLedgerService;
import com.saltbet.web.BettingException;
import com.saltbet.web.LedgerStoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StakeController.class)
@Import(BettingResponseMapper.class)
class StakeControllerTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StakeLedgerService stakeLedgerService;

    @MockitoBean
    private SseTotalsPublisher sseTotalsPublisher;

    @MockitoBean
    private CallerResolver callerResolver;

    private User user;

    @BeforeEach
    void setUp() {
        user = new User();
        user.setId(USER_ID);
        user.setUsername("salty");
        user.setBalance(new BigDecimal("100.00"));
    }

    @Test
    void placeStakeReturnsSuccess() throws Exception {
        when(callerResolver.resolve(USER_ID)).thenReturn(user);
        when(stakeLedgerService.placeStake(user, new BigDecimal("2.50"), Side.RED)).thenReturn(true);

        mockMvc.perform(post("/api/stakes")
                        .header(CallerResolver.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 2.50, "side": "RED"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void placeStakeWithoutSideIsRejectedBeforeReachingTheLedger() throws Exception {
        mockMvc.perform(post("/api/stakes")
                        .header(CallerResolver.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 2.50}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"))
                .andExpect(jsonPath("$.fieldErrors.side").value("side is required"));

        verify(stakeLedgerService, never()).placeStake(any(), any(), any());
    }

    @Test
    void placeStakeWithoutCallerHeaderIsRejected() throws Exception {
        mockMvc.perform(post("/api/stakes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 2.50, "side": "BLUE"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("missing_caller"))
                .andExpect(jsonPath("$.message").value("Missing required header: X-User-Id"));
    }

    @Test
    void businessErrorsAreRenderedWithTheirCode() throws Exception {
        when(callerResolver.resolve(USER_ID)).thenReturn(user);
        when(stakeLedgerService.placeStake(user, new BigDecimal("0.07"), Side.BLUE))
                .thenThrow(BettingException.invalidAmount("Amount must be a multiple of 0.05"));

        mockMvc.perform(post("/api/stakes")
                        .header(CallerResolver.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 0.07, "side": "BLUE"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_amount"));
    }

    @Test
    void insufficientFundsIsConflict() throws Exception {
        when(callerResolver.resolve(USER_ID)).thenReturn(user);
        when(stakeLedgerService.placeStake(user, new BigDecimal("500.00"), Side.RED))
                .thenThrow(BettingException.insufficientFunds("Insufficient balance"));

        mockMvc.perform(post("/api/stakes")
                        .header(CallerResolver.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 500.00, "side": "RED"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("insufficient_funds"));
    }

    @Test
    void cancelStakeOfUnknownUserIsNotFound() throws Exception {
        when(callerResolver.resolve(USER_ID)).thenThrow(BettingException.userNotFound(USER_ID));

        mockMvc.perform(post("/api/stakes/cancel")
                        .header(CallerResolver.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 1.00}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("user_not_found"));
    }

    @Test
    void cancelStakeWithoutReservationIsConflict() throws Exception {
        when(callerResolver.resolve(USER_ID)).thenReturn(user);
        when(stakeLedgerService.cancelStake(user, new BigDecimal("1.00")))
                .thenThrow(BettingException.noActiveStake());

        mockMvc.perform(post("/api/stakes/cancel")
                        .header(CallerResolver.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 1.00}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("no_active_stake"));
    }

    @Test
    void totalsAreReadFromTheLedger() throws Exception {
        when(stakeLedgerService.currentTotals())
                .thenReturn(new SideTotals(new BigDecimal("12.50"), new BigDecimal("7.25")));

        mockMvc.perform(get("/api/stakes/totals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.red").value(12.5))
                .andExpect(jsonPath("$.blue").value(7.25));
    }

    @Test
    void unavailableLedgerIsServiceUnavailable() throws Exception {
        when(stakeLedgerService.currentTotals())
                .thenThrow(new LedgerStoreUnavailableException("Ledger store failed to read totals", null));

        mockMvc.perform(get("/api/stakes/totals"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("ledger_unavailable"));
    }

    @Test
    void myStakeShowsOpenReservation() throws Exception {
        when(callerResolver.resolve(USER_ID)).thenReturn(user);
        when(stakeLedgerService.activeStakeOf(USER_ID)).thenReturn(Optional.empty());
        when(stakeLedgerService.openStakeOf(USER_ID))
                .thenReturn(Optional.of(new ActiveStake(USER_ID, new BigDecimal("3.00"), Side.BLUE)));

        mockMvc.perform(get("/api/stakes/me").header(CallerResolver.USER_HEADER, USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.open.amount").value(3.0))
                .andExpect(jsonPath("$.open.side").value("BLUE"))
                .andExpect(jsonPath("$.durable").doesNotExist());
    }
}
