package org.replaystore.table.distributions;

import java.util.Locale;
import java.util.Map;
import java.util.Random;

import org.replaystore.api.contracts.KeyDistributionOptions;
import org.replaystore.api.distributions.IKeyDistribution;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Creates {@link IKeyDistribution} instances from their wire description or from
 * a HOCON block.
 * <p>
 * HOCON format:
 * <pre>
 * sampler {
 *   type = prioritized        # fifo | lifo | uniform | prioritized | heap
 *   priorityExponent = 0.8    # prioritized only
 *   minHeap = true            # heap only
 *   seed = 42                 # optional, uniform and prioritized only
 * }
 * </pre>
 */
public final class KeyDistributions {

    private KeyDistributions() {
    }

    /**
     * Creates a distribution described by wire options.
     *
     * @param options The distribution options, exactly one variant must be set
     * @param random  Source of randomness for non-deterministic variants
     * @return a new, empty distribution
     * @throws IllegalArgumentException if no variant is set
     */
    public static IKeyDistribution create(KeyDistributionOptions options, Random random) {
        return switch (options.getDistributionCase()) {
            case FIFO -> new FifoDistribution();
            case LIFO -> new LifoDistribution();
            case UNIFORM -> new UniformDistribution(random);
            case PRIORITIZED -> new PrioritizedDistribution(options.getPrioritized().getPriorityExponent(), random);
            case HEAP -> new HeapDistribution(options.getHeap().getMinHeap());
            case DISTRIBUTION_NOT_SET -> throw new IllegalArgumentException(
                    "KeyDistributionOptions must set exactly one distribution");
        };
    }

    /**
     * Creates a distribution from a HOCON block.
     *
     * @param options The configuration block (see class documentation)
     * @return a new, empty distribution
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static IKeyDistribution fromConfig(Config options) {
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of(
                "priorityExponent", 1.0,
                "minHeap", true
        )));
        try {
            String type = finalConfig.getString("type").toLowerCase(Locale.ROOT);
            Random random = finalConfig.hasPath("seed") ? new Random(finalConfig.getLong("seed")) : new Random();
            KeyDistributionOptions.Builder builder = KeyDistributionOptions.newBuilder();
            switch (type) {
                case "fifo" -> builder.setFifo(true);
                case "lifo" -> builder.setLifo(true);
                case "uniform" -> builder.setUniform(true);
                case "prioritized" -> builder.setPrioritized(KeyDistributionOptions.Prioritized.newBuilder()
                        .setPriorityExponent(finalConfig.getDouble("priorityExponent")));
                case "heap" -> builder.setHeap(KeyDistributionOptions.Heap.newBuilder()
                        .setMinHeap(finalConfig.getBoolean("minHeap")));
                default -> throw new IllegalArgumentException(String.format(
                        "Unknown distribution type '%s'. Supported types: fifo, lifo, uniform, prioritized, heap",
                        type));
            }
            return create(builder.build(), random);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid key distribution configuration", e);
        }
    }
}
