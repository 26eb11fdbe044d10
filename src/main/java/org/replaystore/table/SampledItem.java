package org.replaystore.table;

import java.util.List;

import org.replaystore.api.contracts.ChunkData;
import org.replaystore.api.contracts.SampleInfo;

/**
 * Result of a sample call: the sample metadata plus the payloads of the chunks
 * the item references, in the item's chunk order.
 * <p>
 * The chunks stay valid after the item is deleted from the table, since
 * payloads are immutable.
 *
 * @param info   Item snapshot, probability and table size at sample time
 * @param chunks The referenced chunk payloads
 */
public record SampledItem(SampleInfo info, List<ChunkData> chunks) {

    public SampledItem {
        chunks = List.copyOf(chunks);
    }

    public long key() {
        return info.getItem().getKey();
    }
}
