package com.acdm.market.acdm_market.controller;

import com.acdm.market.acdm_market.config.JacksonConfig;
import com.acdm.market.acdm_market.engine.MarketEngine;
import com.acdm.market.acdm_market.entity.Order;
import com.acdm.market.acdm_market.entity.Role;
import com.acdm.market.acdm_market.entity.Round;
import com.acdm.market.acdm_market.entity.RoundPhase;
import com.acdm.market.acdm_market.events.SaleTokenBought;
import com.acdm.market.acdm_market.exception.GuardReason;
import com.acdm.market.acdm_market.exception.GuardViolationException;
import com.acdm.market.acdm_market.exception.PermissionDeniedException;
import com.acdm.market.acdm_market.exception.TransferFailureException;
import com.acdm.market.acdm_market.execution.MarketCallTimeoutException;
import com.acdm.market.acdm_market.execution.MarketExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class MarketControllerTest {

    private static final UsernamePasswordAuthenticationToken ALICE =
            new UsernamePasswordAuthenticationToken("alice", null, List.of());

    @Mock
    private MarketEngine marketEngine;

    private MarketExecutor marketExecutor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        marketExecutor = new MarketExecutor(2_000);
        Jackson2ObjectMapperBuilder json = Jackson2ObjectMapperBuilder.json();
        new JacksonConfig().bigIntegerAsString().customize(json);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new MarketController(marketEngine, marketExecutor),
                        new MarketAdminController(marketEngine, marketExecutor))
                .setControllerAdvice(new MarketExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(json.build()))
                .build();
    }

    @AfterEach
    void tearDown() {
        marketExecutor.close();
    }

    @Test
    void purchaseRunsAsTheAuthenticatedAccount() throws Exception {
        when(marketEngine.buySaleTokens("alice", new BigInteger("100000000000000000")))
                .thenReturn(new SaleTokenBought("alice", new BigInteger("10000000000"),
                        new BigInteger("100000000000000000")));

        mockMvc.perform(post("/api/market/sale/buy").principal(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payment\":\"100000000000000000\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.buyer").value("alice"))
                .andExpect(jsonPath("$.amount").value("10000000000"))
                .andExpect(jsonPath("$.cost").value("100000000000000000"));
    }

    @Test
    void malformedAmountsAreRejectedBeforeTheEngine() throws Exception {
        mockMvc.perform(post("/api/market/sale/buy").principal(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payment\":\"0.5\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("ValidationError"));

        verifyNoInteractions(marketEngine);
    }

    @Test
    void wrongPhaseMapsToConflict() throws Exception {
        when(marketEngine.startTradeRound("alice"))
                .thenThrow(new GuardViolationException(GuardReason.INAPPROPRIATE_ROUND));

        mockMvc.perform(post("/api/market/rounds/trade").principal(ALICE))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("InappropriateRound"));
    }

    @Test
    void timeoutsTellWhetherTheCallMayStillHappen() throws Exception {
        when(marketEngine.startSaleRound("alice"))
                .thenThrow(new MarketCallTimeoutException(5_000, true))
                .thenThrow(new MarketCallTimeoutException(5_000, false));

        mockMvc.perform(post("/api/market/rounds/sale").principal(ALICE))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.reason").value("OutcomeUnknown"));
        mockMvc.perform(post("/api/market/rounds/sale").principal(ALICE))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.reason").value("CallNotExecuted"));
    }

    @Test
    void refusedPaymentMapsToBadGateway() throws Exception {
        when(marketEngine.redeemOrder(eq("alice"), eq(3L), any()))
                .thenThrow(new TransferFailureException("bob", BigInteger.TEN));

        mockMvc.perform(post("/api/market/orders/3/redeem").principal(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payment\":\"5000000000000000\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.reason").value("TransferFailure"));
    }

    @Test
    void unknownOrderMapsToNotFound() throws Exception {
        when(marketEngine.findOrder(9L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/market/orders/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("StateNotFound"));
    }

    @Test
    void openOrdersAreListed() throws Exception {
        when(marketEngine.openOrders()).thenReturn(List.of(Order.builder()
                .id(1L).owner("bob").pricePerToken(new BigInteger("20000000000000"))
                .amount(BigInteger.valueOf(1_000)).remainingAmount(BigInteger.valueOf(400))
                .createdAt(10L).updatedAt(20L).build()));

        mockMvc.perform(get("/api/market/orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].remainingAmount").value("400"));
    }

    @Test
    void roundViewCarriesTheActiveFlag() throws Exception {
        when(marketEngine.getRound()).thenReturn(Round.builder()
                .phase(RoundPhase.SALE).endTime(500L)
                .saleTokensRemaining(BigInteger.TEN).salePricePerToken(BigInteger.ONE)
                .accumulatedTradeVolume(BigInteger.ZERO).saleRoundCount(1L).build());
        when(marketEngine.isRoundActive()).thenReturn(true);

        mockMvc.perform(get("/api/market/round"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("SALE"))
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.saleTokensRemaining").value("10"));
    }

    @Test
    void missingRoleMapsToForbidden() throws Exception {
        when(marketEngine.updateRoundDuration("alice", 60L))
                .thenThrow(new PermissionDeniedException("alice", Role.ADMIN));

        mockMvc.perform(put("/api/market/admin/round-duration").principal(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"seconds\":60}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("PermissionDenied"));
    }

    @Test
    void registrationEchoesTheSponsor() throws Exception {
        mockMvc.perform(post("/api/market/referrals").principal(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sponsor\":\"root\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.account").value("alice"))
                .andExpect(jsonPath("$.sponsor").value("root"));

        verify(marketEngine).register("alice", "root");
    }
}
