package com.tokenwatch.indexer.controller;

import com.tokenwatch.indexer.dto.TokenBalancePayload;
import com.tokenwatch.indexer.dto.TransferPayload;
import com.tokenwatch.indexer.dto.TransferSimulationRequest;
import com.tokenwatch.indexer.dto.TransferSimulationResult;
import com.tokenwatch.indexer.dto.UnsignedTransfer;
import com.tokenwatch.indexer.modules.chain.rpc.RpcException;
import com.tokenwatch.indexer.service.TokenAccountService;
import com.tokenwatch.indexer.service.TransferQueryService;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TransferControllerTest {

    private static final String ALICE = "0x1111111111111111111111111111111111111111";

    private TransferQueryService queryService;
    private TokenAccountService accountService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        queryService = mock(TransferQueryService.class);
        accountService = mock(TokenAccountService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new TransferController(queryService, accountService)).build();
    }

    @Test
    void listsRecentTransfersWithDefaultLimit() throws Exception {
        when(queryService.findRecent(null, null, 20)).thenReturn(List.of(payload()));

        mockMvc.perform(get("/transfers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].txHash").value("0xabc"))
                .andExpect(jsonPath("$[0].block").value(100))
                .andExpect(jsonPath("$[0].formattedAmount").value("1.5"));
    }

    @Test
    void passesFiltersThrough() throws Exception {
        when(queryService.findRecent(ALICE, null, 5)).thenReturn(List.of());

        mockMvc.perform(get("/transfers").param("from", ALICE).param("limit", "5"))
                .andExpect(status().isOk());

        verify(queryService).findRecent(eq(ALICE), isNull(),
                eq(5));
    }

    @Test
    void historyForAddress() throws Exception {
        when(queryService.findHistory(ALICE, 20)).thenReturn(List.of(payload()));

        mockMvc.perform(get("/transfers/history/" + ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].from").value(ALICE));
    }

    @Test
    void invalidInputIsBadRequest() throws Exception {
        when(queryService.findRecent(null, null, 5000))
                .thenThrow(new IllegalArgumentException("limit must be between 1 and 1000"));

        mockMvc.perform(get("/transfers").param("limit", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("limit must be between 1 and 1000"));
    }

    @Test
    void balanceComesFromChain() throws Exception {
        when(accountService.balanceOf(ALICE)).thenReturn(TokenBalancePayload.builder()
                .address(ALICE)
                .balance("1.5")
                .rawBalance("1500000")
                .build());

        mockMvc.perform(get("/transfers/balance/" + ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address").value(ALICE))
                .andExpect(jsonPath("$.balance").value("1.5"));
    }

    @Test
    void unreachableNodeIsBadGateway() throws Exception {
        when(accountService.balanceOf(ALICE)).thenThrow(new RpcException("connection refused", true));

        mockMvc.perform(get("/transfers/balance/" + ALICE))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("connection refused"));
    }

    @Test
    void simulatesTransferFromJsonBody() throws Exception {
        when(accountService.simulateTransfer(any())).thenReturn(TransferSimulationResult.builder()
                .success(true)
                .from(ALICE)
                .to("0x2222222222222222222222222222222222222222")
                .amount("10.5")
                .txData(UnsignedTransfer.builder().from(ALICE).to("0xa0b8").data("0xa9059cbb").build())
                .estimatedGas("51234")
                .build());

        mockMvc.perform(post("/transfers/transfer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromPk\":\"0x01\",\"to\":\"0x2222222222222222222222222222222222222222\",\"amount\":\"10.5\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.estimatedGas").value("51234"))
                .andExpect(jsonPath("$.txData.data").value("0xa9059cbb"));

        ArgumentCaptor<TransferSimulationRequest> captor = ArgumentCaptor.forClass(TransferSimulationRequest.class);
        verify(accountService).simulateTransfer(captor.capture());
        assertEquals("0x01", captor.getValue().getFromPk());
        assertEquals("10.5", captor.getValue().getAmount());
    }

    @Test
    void invalidSimulationIsBadRequest() throws Exception {
        when(accountService.simulateTransfer(any()))
                .thenThrow(new IllegalArgumentException("fromPk must be a 32-byte hex private key"));

        mockMvc.perform(post("/transfers/transfer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromPk\":\"nope\",\"to\":\"x\",\"amount\":\"1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    private static TransferPayload payload() {
        return TransferPayload.builder()
                .id(1L)
                .txHash("0xabc")
                .logIndex(0)
                .block(100)
                .blockHash("0xblock100")
                .from(ALICE)
                .to("0x2222222222222222222222222222222222222222")
                .amount("1500000")
                .formattedAmount("1.5")
                .timestamp(Instant.ofEpochSecond(1_700_000_000L))
                .build();
    }
}
