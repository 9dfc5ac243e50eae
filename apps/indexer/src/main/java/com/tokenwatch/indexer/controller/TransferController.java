package com.tokenwatch.indexer.controller;

import com.tokenwatch.indexer.dto.TokenBalancePayload;
import com.tokenwatch.indexer.dto.TransferPayload;
import com.tokenwatch.indexer.dto.TransferSimulationRequest;
import com.tokenwatch.indexer.dto.TransferSimulationResult;
import com.tokenwatch.indexer.modules.chain.rpc.RpcException;
import com.tokenwatch.indexer.service.TokenAccountService;
import com.tokenwatch.indexer.service.TransferQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for indexed transfers.
 */
@RestController
@RequestMapping("/transfers")
public class TransferController {

    private static final Logger logger = LoggerFactory.getLogger(TransferController.class);

    private final TransferQueryService transferQueryService;
    private final TokenAccountService tokenAccountService;

    public TransferController(TransferQueryService transferQueryService, TokenAccountService tokenAccountService) {
        this.transferQueryService = transferQueryService;
        this.tokenAccountService = tokenAccountService;
    }

    /**
     * Recent transfers, optionally filtered by sender and/or recipient.
     *
     * GET /transfers?from=&to=&limit=20
     */
    @GetMapping
    public List<TransferPayload> getTransfers(@RequestParam(required = false) String from,
                                              @RequestParam(required = false) String to,
                                              @RequestParam(defaultValue = "20") int limit) {
        return transferQueryService.findRecent(from, to, limit);
    }

    /**
     * Transfers sent or received by an address.
     *
     * GET /transfers/history/{address}?limit=20
     */
    @GetMapping("/history/{address}")
    public List<TransferPayload> getHistory(@PathVariable String address,
                                            @RequestParam(defaultValue = "20") int limit) {
        return transferQueryService.findHistory(address, limit);
    }

    /**
     * Token balance read from the chain, not from the index.
     *
     * GET /transfers/balance/{address}
     */
    @GetMapping("/balance/{address}")
    public TokenBalancePayload getBalance(@PathVariable String address) {
        return tokenAccountService.balanceOf(address);
    }

    /**
     * Build and gas-estimate a transfer without signing or sending it.
     *
     * POST /transfers/transfer
     */
    @PostMapping("/transfer")
    public TransferSimulationResult simulateTransfer(@RequestBody TransferSimulationRequest request) {
        logger.info("Received transfer simulation request: {}", request);
        return tokenAccountService.simulateTransfer(request);
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<Map<String, Object>> handleNodeFailure(RpcException e) {
        logger.error("Chain node request failed: {}", e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "Chain node request failed");
        response.put("error", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        logger.debug("Rejected transfer query: {}", e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }
}
