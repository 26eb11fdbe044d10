package org.replaystore.table.signature;

import org.replaystore.api.contracts.ChunkData;
import org.replaystore.api.contracts.TableSignature;
import org.replaystore.api.contracts.TensorPayload;
import org.replaystore.api.contracts.TensorSpec;
import org.replaystore.api.errors.InvalidArgumentException;

/**
 * Checks the tensors of a chunk against a table signature.
 * <p>
 * A chunk must carry one tensor per spec, in spec order. Each tensor must have
 * the spec's dtype and the spec's shape prefixed by a leading time dimension
 * equal to the number of timesteps covered by the chunk. Spec dimensions of
 * {@code -1} match any size. Tensor contents are never inspected.
 */
public class SignatureValidator {

    private final TableSignature signature;

    public SignatureValidator(TableSignature signature) {
        this.signature = signature;
    }

    public TableSignature signature() {
        return signature;
    }

    /**
     * Validates a chunk.
     *
     * @param chunk The chunk to check
     * @throws InvalidArgumentException if the chunk does not match the signature
     */
    public void validate(ChunkData chunk) throws InvalidArgumentException {
        int expected = signature.getTensorsCount();
        if (chunk.getDataCount() != expected) {
            throw new InvalidArgumentException(String.format(
                    "Chunk %d has %d tensors but the table signature expects %d",
                    chunk.getChunkKey(), chunk.getDataCount(), expected));
        }
        long timesteps = (long) chunk.getSequenceRange().getEnd() - chunk.getSequenceRange().getStart() + 1;
        for (int i = 0; i < expected; i++) {
            TensorSpec spec = signature.getTensors(i);
            TensorPayload tensor = chunk.getData(i);
            if (!spec.getDtype().equals(tensor.getDtype())) {
                throw new InvalidArgumentException(String.format(
                        "Chunk %d tensor %d ('%s') has dtype %s but the signature expects %s",
                        chunk.getChunkKey(), i, spec.getName(), tensor.getDtype(), spec.getDtype()));
            }
            if (tensor.getShapeCount() != spec.getShapeCount() + 1) {
                throw new InvalidArgumentException(String.format(
                        "Chunk %d tensor %d ('%s') has rank %d but the signature expects %d (including the time dimension)",
                        chunk.getChunkKey(), i, spec.getName(), tensor.getShapeCount(), spec.getShapeCount() + 1));
            }
            if (tensor.getShape(0) != timesteps) {
                throw new InvalidArgumentException(String.format(
                        "Chunk %d tensor %d ('%s') has %d timesteps but the chunk covers %d",
                        chunk.getChunkKey(), i, spec.getName(), tensor.getShape(0), timesteps));
            }
            for (int d = 0; d < spec.getShapeCount(); d++) {
                long want = spec.getShape(d);
                long got = tensor.getShape(d + 1);
                if (want != -1 && want != got) {
                    throw new InvalidArgumentException(String.format(
                            "Chunk %d tensor %d ('%s') has size %d in dimension %d but the signature expects %d",
                            chunk.getChunkKey(), i, spec.getName(), got, d + 1, want));
                }
            }
        }
    }
}
