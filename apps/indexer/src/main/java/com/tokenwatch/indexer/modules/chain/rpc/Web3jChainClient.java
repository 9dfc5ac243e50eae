package com.tokenwatch.indexer.modules.chain.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ChainClient} backed by a Web3j HTTP client.
 * I/O failures and throttling responses surface as transient {@link RpcException}s.
 */
public class Web3jChainClient implements ChainClient {

    private static final Logger logger = LoggerFactory.getLogger(Web3jChainClient.class);

    private final Web3j web3j;

    public Web3jChainClient(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public long headHeight() {
        EthBlockNumber response = send("eth_blockNumber", web3j.ethBlockNumber());
        return response.getBlockNumber().longValueExact();
    }

    @Override
    public Optional<BlockInfo> blockAt(long number) {
        EthBlock response = send("eth_getBlockByNumber",
                web3j.ethGetBlockByNumber(DefaultBlockParameter.valueOf(BigInteger.valueOf(number)), false));
        EthBlock.Block block = response.getBlock();
        if (block == null || block.getHash() == null) {
            logger.debug("Block {} not found on node", number);
            return Optional.empty();
        }
        return Optional.of(new BlockInfo(
                number,
                block.getHash(),
                Instant.ofEpochSecond(block.getTimestamp().longValueExact())));
    }

    @Override
    public List<ChainLog> logsInRange(String contractAddress, String eventTopic, long fromBlock, long toBlock) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
                contractAddress);
        filter.addSingleTopic(eventTopic);

        EthLog response = send("eth_getLogs", web3j.ethGetLogs(filter));
        List<EthLog.LogResult> results = response.getLogs();
        if (results == null) {
            return List.of();
        }

        List<ChainLog> logs = new ArrayList<>(results.size());
        for (EthLog.LogResult<?> result : results) {
            Object value = result.get();
            if (value instanceof Log) {
                logs.add(toChainLog((Log) value));
            }
        }
        return logs;
    }

    @Override
    public BigInteger tokenBalance(String contractAddress, String owner) {
        Function balanceOf = new Function(
                "balanceOf",
                Arrays.asList(new Address(owner)),
                Arrays.asList(new TypeReference<Uint256>() {
                }));
        EthCall response = send("eth_call", web3j.ethCall(
                Transaction.createEthCallTransaction(owner, contractAddress, FunctionEncoder.encode(balanceOf)),
                DefaultBlockParameterName.LATEST));

        List<Type> values = FunctionReturnDecoder.decode(response.getValue(), balanceOf.getOutputParameters());
        if (values.isEmpty()) {
            throw new RpcException("balanceOf(" + owner + ") returned no data from " + contractAddress, false);
        }
        return (BigInteger) values.get(0).getValue();
    }

    @Override
    public BigInteger estimateGas(String from, String to, String data) {
        EthEstimateGas response = send("eth_estimateGas",
                web3j.ethEstimateGas(Transaction.createEthCallTransaction(from, to, data)));
        return response.getAmountUsed();
    }

    private <T extends Response<?>> T send(String method, Request<?, T> request) {
        T response;
        try {
            response = request.send();
        } catch (IOException e) {
            throw new RpcException(method + " I/O failure: " + e.getMessage(), e, true);
        }
        if (response == null) {
            throw new RpcException(method + " returned no response", true);
        }
        if (response.hasError()) {
            Response.Error error = response.getError();
            String message = method + " error (code=" + error.getCode() + "): " + error.getMessage();
            throw new RpcException(message, isTransientError(error.getCode(), error.getMessage()));
        }
        return response;
    }

    /**
     * True for JSON-RPC errors caused by throttling or temporary upstream trouble.
     */
    static boolean isTransientError(int code, String message) {
        if (code == -32005 || code == 429) {
            return true;
        }
        if (message == null) {
            return false;
        }
        String msg = message.toLowerCase(Locale.ROOT);
        return msg.contains("rate limit") || msg.contains("too many requests")
                || msg.contains("limit exceeded") || msg.contains("timeout")
                || msg.contains("timed out") || msg.contains("temporar")
                || msg.contains("header not found") || msg.contains("try again")
                || msg.contains("502") || msg.contains("503") || msg.contains("504");
    }

    private static ChainLog toChainLog(Log log) {
        return ChainLog.builder()
                .address(log.getAddress())
                .transactionHash(log.getTransactionHash())
                .logIndex(quantityOrNull(log::getLogIndex))
                .blockNumber(quantityOrNull(log::getBlockNumber))
                .topics(log.getTopics() != null ? new ArrayList<>(log.getTopics()) : List.of())
                .data(log.getData())
                .build();
    }

    private static Long quantityOrNull(Supplier<BigInteger> quantity) {
        try {
            BigInteger value = quantity.get();
            return value != null ? value.longValueExact() : null;
        } catch (RuntimeException e) {
            logger.debug("Unparseable quantity in log: {}", e.getMessage());
            return null;
        }
    }
}
