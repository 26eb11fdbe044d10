package org.replaystore.table.distributions;

import org.replaystore.api.distributions.KeyWithProbability;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class FifoDistributionTest {

    @Test
    void samplesOldestKeyWithProbabilityOne() {
        FifoDistribution fifo = new FifoDistribution();
        fifo.insert(3, 1.0);
        fifo.insert(1, 5.0);
        fifo.insert(2, 0.0);

        KeyWithProbability sample = fifo.sample();
        assertEquals(3, sample.key());
        assertEquals(1.0, sample.probability());

        fifo.delete(3);
        assertEquals(1, fifo.sample().key());
        assertEquals(2, fifo.size());
    }

    @Test
    void deletingMiddleKeyKeepsOrder() {
        FifoDistribution fifo = new FifoDistribution();
        fifo.insert(1, 1.0);
        fifo.insert(2, 1.0);
        fifo.insert(3, 1.0);

        fifo.delete(2);
        fifo.delete(1);

        assertEquals(3, fifo.sample().key());
    }

    @Test
    void updateDoesNotChangeOrder() {
        FifoDistribution fifo = new FifoDistribution();
        fifo.insert(1, 1.0);
        fifo.insert(2, 1.0);

        fifo.update(1, 100.0);

        assertEquals(1, fifo.sample().key());
    }

    @Test
    void corruptedUsageIsRejected() {
        FifoDistribution fifo = new FifoDistribution();
        fifo.insert(1, 1.0);

        assertThrows(IllegalStateException.class, () -> fifo.insert(1, 1.0));
        assertThrows(IllegalStateException.class, () -> fifo.delete(2));
        assertThrows(IllegalStateException.class, () -> fifo.update(2, 1.0));
        fifo.clear();
        assertThrows(IllegalStateException.class, fifo::sample);
    }

    @Test
    void optionsDescribeDeterministicFifo() {
        FifoDistribution fifo = new FifoDistribution();

        assertTrue(fifo.options().getFifo());
        assertTrue(fifo.options().getIsDeterministic());
    }
}
