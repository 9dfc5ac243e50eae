package com.tokenwatch.indexer.service;

import com.tokenwatch.indexer.config.IndexerProperties;
import com.tokenwatch.indexer.dto.TokenBalancePayload;
import com.tokenwatch.indexer.dto.TransferSimulationRequest;
import com.tokenwatch.indexer.dto.TransferSimulationResult;
import com.tokenwatch.indexer.dto.UnsignedTransfer;
import com.tokenwatch.indexer.modules.chain.rpc.ChainClient;
import com.tokenwatch.indexer.modules.chain.rpc.RpcException;
import com.tokenwatch.indexer.util.Addresses;
import com.tokenwatch.indexer.util.RetryPolicy;
import com.tokenwatch.indexer.util.TokenAmounts;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Live token reads against the chain node: balances and dry-run transfers.
 * Nothing here touches the transfer store, and no transaction is ever signed or sent.
 */
@Service
public class TokenAccountService {

    private static final Logger logger = LoggerFactory.getLogger(TokenAccountService.class);

    private static final Pattern PRIVATE_KEY = Pattern.compile("^(0x)?[0-9a-fA-F]{64}$");

    private final ChainClient chainClient;
    private final RetryPolicy retryPolicy;
    private final IndexerProperties properties;
    private final Tracer tracer;

    public TokenAccountService(ChainClient chainClient, RetryPolicy retryPolicy,
                               IndexerProperties properties, Tracer tracer) {
        this.chainClient = chainClient;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.tracer = tracer;
    }

    /**
     * Current token balance of the address.
     *
     * @throws IllegalArgumentException for a malformed address
     * @throws RpcException             when the node cannot be reached after retries
     */
    public TokenBalancePayload balanceOf(String address) {
        String owner = Addresses.normalize(address, "address");
        Span span = tracer.spanBuilder("TokenAccountService.balanceOf").startSpan();
        try {
            BigInteger raw = retryPolicy.execute("balanceOf(" + owner + ")",
                    () -> chainClient.tokenBalance(properties.getContractAddress(), owner));
            return TokenBalancePayload.builder()
                    .address(owner)
                    .balance(TokenAmounts.format(raw, properties.getTokenDecimals()))
                    .rawBalance(raw.toString())
                    .build();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Build the unsigned {@code transfer(to, amount)} call for the key's address and ask the node
     * for a gas estimate. A rejected estimate is reported in the result, not thrown.
     *
     * @throws IllegalArgumentException for a malformed key, recipient or amount
     */
    public TransferSimulationResult simulateTransfer(TransferSimulationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        String from = senderOf(request.getFromPk());
        String recipient = Addresses.normalize(request.getTo(), "to");
        BigInteger raw = TokenAmounts.parse(request.getAmount(), properties.getTokenDecimals());

        UnsignedTransfer txData = UnsignedTransfer.builder()
                .from(from)
                .to(properties.getContractAddress())
                .data(encodeTransfer(recipient, raw))
                .build();
        TransferSimulationResult.TransferSimulationResultBuilder result = TransferSimulationResult.builder()
                .from(from)
                .to(recipient)
                .amount(request.getAmount())
                .txData(txData);

        Span span = tracer.spanBuilder("TokenAccountService.simulateTransfer").startSpan();
        try {
            BigInteger gas = retryPolicy.execute("eth_estimateGas",
                    () -> chainClient.estimateGas(txData.getFrom(), txData.getTo(), txData.getData()));
            logger.info("Simulated transfer of {} from {} to {}: estimated gas {}", raw, from, recipient, gas);
            return result
                    .success(true)
                    .message("This is a simulated transfer. No funds were moved on-chain.")
                    .estimatedGas(gas.toString())
                    .build();
        } catch (RpcException e) {
            span.recordException(e);
            logger.warn("Gas estimation failed for simulated transfer from {}: {}", from, e.getMessage());
            return result
                    .success(false)
                    .message("Gas estimation failed")
                    .error(e.getMessage())
                    .build();
        } finally {
            span.end();
        }
    }

    static String encodeTransfer(String recipient, BigInteger amount) {
        if (amount.bitLength() > 256) {
            throw new IllegalArgumentException("amount does not fit in uint256");
        }
        Function transfer = new Function(
                "transfer",
                Arrays.asList(new Address(recipient), new Uint256(amount)),
                Arrays.asList(new TypeReference<Bool>() {
                }));
        return FunctionEncoder.encode(transfer);
    }

    private static String senderOf(String privateKey) {
        if (privateKey == null || !PRIVATE_KEY.matcher(privateKey.trim()).matches()) {
            throw new IllegalArgumentException("fromPk must be a 32-byte hex private key");
        }
        return Credentials.create(privateKey.trim()).getAddress();
    }
}
