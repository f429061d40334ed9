package io.cryptomm.engine.core.orderbook;

import io.cryptomm.engine.core.model.BookSide;
import io.cryptomm.engine.core.model.Level;
import io.cryptomm.engine.core.model.SlippageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderBookTest {

    private OrderBook book;

    @BeforeEach
    void setUp() {
        book = new OrderBook("BTC-USDT");
        book.applySnapshot(
                List.of(Level.of("99", "2"), Level.of("100", "1"), Level.of("98", "3")),
                List.of(Level.of("102", "2"), Level.of("101", "1"), Level.of("103", "5")),
                Instant.now());
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void testSnapshotSorting() {
        List<Level> bids = book.getBids(10);
        List<Level> asks = book.getAsks(10);

        assertDecimal("100", bids.get(0).getPrice());
        assertDecimal("99", bids.get(1).getPrice());
        assertDecimal("98", bids.get(2).getPrice());
        assertDecimal("101", asks.get(0).getPrice());
        assertDecimal("103", asks.get(2).getPrice());
    }

    @Test
    void testSnapshotNormalization() {
        List<Level> bids = List.of(Level.of("100", "1"), Level.of("100", "4"), Level.of("99", "0"));

        book.applySnapshot(bids, List.of(), Instant.now());

        assertEquals(1, book.getLevelCount(BookSide.BID));
        assertDecimal("4", book.getBestBid().orElseThrow().getSize());
        assertEquals(0, book.getLevelCount(BookSide.ASK));
        assertEquals(0, book.getSequence());
    }

    @Test
    void testBestBidAsk() {
        BigDecimal bestBid = book.getBestBid().orElseThrow().getPrice();
        BigDecimal bestAsk = book.getBestAsk().orElseThrow().getPrice();

        book.getBids(10).forEach(l -> assertTrue(bestBid.compareTo(l.getPrice()) >= 0));
        book.getAsks(10).forEach(l -> assertTrue(bestAsk.compareTo(l.getPrice()) <= 0));
    }

    @Test
    void testMidAndSpread() {
        assertDecimal("100.5", book.getMidPrice().orElseThrow());
        assertDecimal("1", book.getSpread().orElseThrow());
    }

    @Test
    void testMidAndSpreadOneSideEmpty() {
        book.applySnapshot(List.of(Level.of("100", "1")), List.of(), Instant.now());

        assertTrue(book.getMidPrice().isEmpty());
        assertTrue(book.getSpread().isEmpty());
        assertTrue(book.getBestAsk().isEmpty());
    }

    @Test
    void testUpdateInsertsLevel() {
        book.applyUpdate(BookSide.BID, new BigDecimal("99.5"), new BigDecimal("7"), 2, Instant.now());

        List<Level> bids = book.getBids(10);
        assertEquals(4, bids.size());
        assertDecimal("99.5", bids.get(1).getPrice());
        assertEquals(2, bids.get(1).getNumOrders());
        assertEquals(1, book.getSequence());
    }

    @Test
    void testUpdateReplacesSize() {
        book.applyUpdate(BookSide.ASK, new BigDecimal("101.0"), new BigDecimal("9"), 1, Instant.now());

        assertEquals(3, book.getLevelCount(BookSide.ASK));
        assertDecimal("9", book.getBestAsk().orElseThrow().getSize());
    }

    @Test
    void testUpdateRemovesLevel() {
        book.applyUpdate(BookSide.BID, new BigDecimal("100"), BigDecimal.ZERO, 0, Instant.now());

        assertEquals(2, book.getLevelCount(BookSide.BID));
        assertDecimal("99", book.getBestBid().orElseThrow().getPrice());
    }

    @Test
    void testRemoveMissingLevel() {
        book.applyUpdate(BookSide.BID, new BigDecimal("50"), BigDecimal.ZERO, 0, Instant.now());

        assertEquals(3, book.getLevelCount(BookSide.BID));
        assertEquals(1, book.getSequence());
    }

    @Test
    void testNegativeSize() {
        assertThrows(IllegalArgumentException.class,
                () -> book.applyUpdate(BookSide.BID, new BigDecimal("100"), new BigDecimal("-1"), 1, Instant.now()));
        assertEquals(3, book.getLevelCount(BookSide.BID));
    }

    @Test
    void testDepth() {
        assertDecimal("3", book.getDepth(BookSide.BID, new BigDecimal("99")));
        assertDecimal("6", book.getDepth(BookSide.BID, new BigDecimal("1")));
        assertDecimal("0", book.getDepth(BookSide.BID, new BigDecimal("100.5")));
        assertDecimal("3", book.getDepth(BookSide.ASK, new BigDecimal("102")));
    }

    @Test
    void testDepthMonotone() {
        BigDecimal narrow = book.getDepth(BookSide.ASK, new BigDecimal("101"));
        BigDecimal wide = book.getDepth(BookSide.ASK, new BigDecimal("103"));

        assertTrue(wide.compareTo(narrow) >= 0);
    }

    @Test
    void testSlippageAcrossLevels() {
        // 1 @ 101 + 2 @ 102 = 305
        Optional<SlippageResult> result = book.getSlippage(BookSide.BID, new BigDecimal("3"));

        assertTrue(result.isPresent());
        assertDecimal("305", result.get().getTotalCost());
        assertDecimal("101.66666666666666667", result.get().getAvgPrice());
        assertTrue(result.get().getSlippagePct().signum() > 0);
    }

    @Test
    void testSlippageWithinBestLevel() {
        SlippageResult result = book.getSlippage(BookSide.ASK, new BigDecimal("0.5")).orElseThrow();

        assertDecimal("100", result.getAvgPrice());
        assertDecimal("0", result.getSlippagePct());
    }

    @Test
    void testSlippageInsufficientDepth() {
        assertFalse(book.getSlippage(BookSide.BID, new BigDecimal("8.01")).isPresent());
        assertTrue(book.getSlippage(BookSide.BID, new BigDecimal("8")).isPresent());
    }

    @Test
    void testSlippageInvalidQuantity() {
        assertThrows(IllegalArgumentException.class, () -> book.getSlippage(BookSide.BID, BigDecimal.ZERO));
    }

    @Test
    void testDepthBeyondBook() {
        assertEquals(3, book.getBids(50).size());
        assertEquals(1, book.getBids(1).size());
        assertEquals(0, book.getBids(0).size());
    }

    @Test
    void testRandomUpdatesKeepSidesSorted() {
        Random random = new Random(20260101L);
        TreeMap<BigDecimal, BigDecimal> expectedBids = new TreeMap<>(Comparator.reverseOrder());
        TreeMap<BigDecimal, BigDecimal> expectedAsks = new TreeMap<>();
        Map<BookSide, TreeMap<BigDecimal, BigDecimal>> expected = Map.of(
                BookSide.BID, expectedBids,
                BookSide.ASK, expectedAsks);
        book.applySnapshot(List.of(), List.of(), Instant.now());

        for (int step = 0; step < 2_000; step++) {
            if (step % 250 == 0) {
                List<Level> bids = randomLevels(random, expected.get(BookSide.BID));
                List<Level> asks = randomLevels(random, expected.get(BookSide.ASK));
                book.applySnapshot(bids, asks, Instant.now());
            } else {
                BookSide side = random.nextBoolean() ? BookSide.BID : BookSide.ASK;
                BigDecimal price = randomPrice(random);
                BigDecimal size = randomSize(random);
                book.applyUpdate(side, price, size, 1, Instant.now());
                apply(expected.get(side), price, size);
            }

            assertStrictlyOrdered(book.getBids(Integer.MAX_VALUE), true, step);
            assertStrictlyOrdered(book.getAsks(Integer.MAX_VALUE), false, step);
            assertEquals(expected.get(BookSide.BID).size(), book.getLevelCount(BookSide.BID), "bids at step " + step);
            assertEquals(expected.get(BookSide.ASK).size(), book.getLevelCount(BookSide.ASK), "asks at step " + step);
        }
    }

    private static BigDecimal randomPrice(Random random) {
        // same price with different scales, e.g. 100 and 100.0
        return BigDecimal.valueOf(9_000 + random.nextInt(200), 2).setScale(2 + random.nextInt(2));
    }

    private static BigDecimal randomSize(Random random) {
        return random.nextInt(4) == 0 ? BigDecimal.ZERO : BigDecimal.valueOf(1 + random.nextInt(50), 1);
    }

    private static void apply(TreeMap<BigDecimal, BigDecimal> side, BigDecimal price, BigDecimal size) {
        if (size.signum() > 0) {
            side.put(price, size);
        } else {
            side.remove(price);
        }
    }

    private static List<Level> randomLevels(Random random, TreeMap<BigDecimal, BigDecimal> model) {
        model.clear();
        List<Level> levels = new ArrayList<>();
        int count = random.nextInt(30);
        for (int i = 0; i < count; i++) {
            BigDecimal price = randomPrice(random);
            BigDecimal size = randomSize(random);
            levels.add(Level.of(price, size, 1));
            apply(model, price, size);
        }
        return levels;
    }

    private static void assertStrictlyOrdered(List<Level> levels, boolean descending, int step) {
        for (int i = 1; i < levels.size(); i++) {
            int cmp = levels.get(i - 1).getPrice().compareTo(levels.get(i).getPrice());
            assertTrue(descending ? cmp > 0 : cmp < 0, "side out of order at step " + step + ": " + levels);
            assertTrue(levels.get(i).getSize().signum() > 0, "empty level kept at step " + step);
        }
        if (!levels.isEmpty()) {
            assertTrue(levels.get(0).getSize().signum() > 0, "empty level kept at step " + step);
        }
    }
}
