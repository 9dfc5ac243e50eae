package com.tokenwatch.indexer.modules.transfers.events;

import com.tokenwatch.indexer.modules.chain.rpc.BlockInfo;
import com.tokenwatch.indexer.modules.chain.rpc.ChainLog;
import com.tokenwatch.indexer.modules.transfers.model.TransferRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decodes ERC-20 {@code Transfer(address indexed from, address indexed to, uint256 value)} logs
 * into {@link TransferRecord}s.
 */
@Component
public class TransferEventDecoder {

    private static final Logger logger = LoggerFactory.getLogger(TransferEventDecoder.class);

    public static final Event TRANSFER_EVENT = new Event(
            "Transfer",
            Arrays.asList(
                    TypeReference.create(Address.class, true),
                    TypeReference.create(Address.class, true),
                    TypeReference.create(Uint256.class)
            )
    );

    public static final String TRANSFER_TOPIC = EventEncoder.encode(TRANSFER_EVENT);

    private static final Pattern WORD = Pattern.compile("^0x[0-9a-fA-F]{64}$");
    private static final Pattern DATA = Pattern.compile("^0x([0-9a-fA-F]{64})+$");

    /**
     * Decode a raw log.
     *
     * @param log raw log from eth_getLogs
     * @return decoded transfer fields
     * @throws TransferDecodingException if the log is not a well-formed Transfer
     */
    public DecodedTransfer decode(ChainLog log) {
        if (log.getTransactionHash() == null || log.getTransactionHash().isBlank()) {
            throw new TransferDecodingException("Log has no transaction hash");
        }
        if (log.getLogIndex() == null || log.getLogIndex() < 0 || log.getLogIndex() > Integer.MAX_VALUE) {
            throw new TransferDecodingException("Invalid log index in tx " + log.getTransactionHash());
        }
        if (log.getBlockNumber() == null || log.getBlockNumber() < 0) {
            throw new TransferDecodingException("Invalid block number in tx " + log.getTransactionHash());
        }

        List<String> topics = log.getTopics();
        if (topics == null || topics.size() != 3) {
            throw new TransferDecodingException("Expected 3 topics, got "
                    + (topics == null ? 0 : topics.size()) + " in tx " + log.getTransactionHash());
        }
        if (!TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
            throw new TransferDecodingException("Not a Transfer event: " + topics.get(0));
        }
        if (!WORD.matcher(topics.get(1)).matches() || !WORD.matcher(topics.get(2)).matches()) {
            throw new TransferDecodingException("Malformed address topic in tx " + log.getTransactionHash());
        }
        if (log.getData() == null || !DATA.matcher(log.getData()).matches()) {
            throw new TransferDecodingException("Malformed data in tx " + log.getTransactionHash());
        }

        try {
            String from = decodeAddress(topics.get(1));
            String to = decodeAddress(topics.get(2));

            List<Type> values = FunctionReturnDecoder.decode(log.getData(), TRANSFER_EVENT.getNonIndexedParameters());
            if (values.isEmpty()) {
                throw new TransferDecodingException("Empty value in tx " + log.getTransactionHash());
            }
            BigInteger value = (BigInteger) values.get(0).getValue();

            logger.debug("Decoded transfer: block={}, tx={}, logIndex={}",
                    log.getBlockNumber(), log.getTransactionHash(), log.getLogIndex());

            return new DecodedTransfer(
                    log.getTransactionHash(),
                    log.getLogIndex().intValue(),
                    log.getBlockNumber(),
                    from,
                    to,
                    value.toString());
        } catch (TransferDecodingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransferDecodingException("Failed to decode log in tx " + log.getTransactionHash(), e);
        }
    }

    /**
     * Attach block metadata to a decoded transfer.
     */
    public TransferRecord toRecord(DecodedTransfer transfer, BlockInfo block) {
        return TransferRecord.builder()
                .txHash(transfer.getTxHash())
                .logIndex(transfer.getLogIndex())
                .blockNumber(transfer.getBlockNumber())
                .blockHash(block.getHash())
                .fromAddress(transfer.getFrom())
                .toAddress(transfer.getTo())
                .amount(transfer.getAmount())
                .blockTimestamp(block.getTimestamp())
                .build();
    }

    private static String decodeAddress(String topic) {
        Address address = (Address) FunctionReturnDecoder.decodeIndexedValue(topic, TypeReference.create(Address.class));
        return address.getValue().toLowerCase(Locale.ROOT);
    }
}
