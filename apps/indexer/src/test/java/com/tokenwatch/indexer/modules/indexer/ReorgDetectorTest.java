package com.tokenwatch.indexer.modules.indexer;

import com.tokenwatch.indexer.config.IndexerProperties;
import com.tokenwatch.indexer.modules.chain.rpc.BlockInfo;
import com.tokenwatch.indexer.modules.chain.rpc.RpcException;
import com.tokenwatch.indexer.support.FakeChainClient;
import com.tokenwatch.indexer.support.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReorgDetectorTest {

    private FakeChainClient chain;
    private InMemoryEventStore store;
    private ReorgDetector detector;

    @BeforeEach
    void setUp() {
        chain = new FakeChainClient();
        store = new InMemoryEventStore();
        detector = new ReorgDetector(chain, IndexerFixtures.noDelayRetry(3), store,
                IndexerFixtures.properties(5, 1000, 12));
    }

    @Test
    void emptyStoreNeedsNoRollback() {
        assertEquals(0, detector.rollbackIfReorganized());
    }

    @Test
    void canonicalFrontierKeepsEverything() {
        store.insertManyIgnoringDuplicates(IndexerFixtures.storedRange(40, 50, "a"));
        chain.blocks(1, 60, "a");

        assertEquals(0, detector.rollbackIfReorganized());
        assertEquals(11, store.count());
    }

    @Test
    void changedFrontierHashDeletesFrontierBlockAndAbove() {
        store.insertManyIgnoringDuplicates(IndexerFixtures.storedRange(45, 50, "a"));
        store.insertManyIgnoringDuplicates(List.of(IndexerFixtures.stored(50, 1, "a")));
        chain.blocks(1, 49, "a").blocks(50, 60, "b");

        int deleted = detector.rollbackIfReorganized();

        assertEquals(2, deleted);
        assertEquals(49L, store.findHighestBlock().orElseThrow().getBlockNumber());
        assertTrue(store.all().stream().allMatch(t -> t.getBlockNumber() < 50));
    }

    @Test
    void missingFrontierBlockCountsAsReorg() {
        store.insertManyIgnoringDuplicates(IndexerFixtures.storedRange(48, 50, "a"));
        chain.blocks(1, 49, "a");

        assertEquals(1, detector.rollbackIfReorganized());
        assertEquals(49L, store.findHighestBlock().orElseThrow().getBlockNumber());
    }

    @Test
    void unwindsReorgDeeperThanOneStoredBlock() {
        store.insertManyIgnoringDuplicates(IndexerFixtures.storedRange(40, 50, "a"));
        chain.blocks(1, 46, "a").blocks(47, 60, "b");

        int deleted = detector.rollbackIfReorganized();

        assertEquals(4, deleted);
        assertEquals(46L, store.findHighestBlock().orElseThrow().getBlockNumber());
    }

    @Test
    void abortsWhenDivergenceExceedsMaxDepth() {
        detector = new ReorgDetector(chain, IndexerFixtures.noDelayRetry(3), store, withDepth(2));
        store.insertManyIgnoringDuplicates(IndexerFixtures.storedRange(40, 50, "a"));
        chain.blocks(1, 60, "b");

        assertThrows(IllegalStateException.class, () -> detector.rollbackIfReorganized());
        assertEquals(9, store.count());
    }

    @Test
    void failedBlockLookupLeavesStoreUntouched() {
        store.insertManyIgnoringDuplicates(IndexerFixtures.storedRange(48, 50, "a"));
        FakeChainClient broken = new FakeChainClient() {
            @Override
            public Optional<BlockInfo> blockAt(long number) {
                throw new RpcException("node down", true);
            }
        };
        detector = new ReorgDetector(broken, IndexerFixtures.noDelayRetry(2), store,
                IndexerFixtures.properties(5, 1000, 12));

        assertThrows(RpcException.class, () -> detector.rollbackIfReorganized());
        assertEquals(3, store.count());
    }

    private static IndexerProperties withDepth(int depth) {
        IndexerProperties properties = IndexerFixtures.properties(5, 1000, 12);
        properties.setMaxReorgDepth(depth);
        return properties;
    }
}
