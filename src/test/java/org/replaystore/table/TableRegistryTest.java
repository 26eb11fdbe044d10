package org.replaystore.table;

import java.io.File;
import java.util.List;
import java.util.Objects;

import org.replaystore.api.contracts.TableInfo;
import org.replaystore.api.errors.CancelledException;
import org.replaystore.api.errors.NotFoundException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.replaystore.test.utils.TableTestUtils.insertSimple;

@Tag("unit")
class TableRegistryTest {

    @Test
    void buildsConfiguredTablesWithDefaults() throws Exception {
        File file = new File(Objects.requireNonNull(
                getClass().getClassLoader().getResource("test-config.conf")).toURI());

        try (TableRegistry registry = TableRegistry.load(file)) {
            assertThat(registry.getTables()).extracting(Table::name).containsExactlyInAnyOrder("replay", "queue.v2");

            TableInfo replay = registry.getTable("replay").info();
            assertEquals(100, replay.getMaxSize());
            assertTrue(replay.getSamplerOptions().getUniform());
            assertTrue(replay.getRemoverOptions().getFifo());
            assertEquals(0, replay.getMaxTimesSampled());
            assertEquals(1.0, replay.getRateLimiterInfo().getSamplesPerInsert());

            TableInfo queue = registry.getTable("queue.v2").info();
            assertEquals(10, queue.getMaxSize());
            assertEquals(1, queue.getMaxTimesSampled());
            assertEquals(0.0, queue.getRateLimiterInfo().getMinDiff());
            assertEquals(10.0, queue.getRateLimiterInfo().getMaxDiff());
        }
    }

    @Test
    void unknownTableIsNotFound() {
        try (TableRegistry registry = new TableRegistry(List.of(Table.queue("a", 1)))) {
            assertThatThrownBy(() -> registry.getTable("b"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessageContaining("[a]");
        }
    }

    @Test
    void rejectsDuplicateNames() {
        Table first = Table.queue("a", 1);
        Table second = Table.queue("a", 1);

        assertThatThrownBy(() -> new TableRegistry(List.of(first, second)))
                .isInstanceOf(IllegalArgumentException.class);
        first.close();
        second.close();
    }

    @Test
    void rejectsInvalidTableDefinition() {
        assertThatThrownBy(() -> new TableRegistry(ConfigFactory.parseString(
                "replaystore { tableDefaults { maxSize = 10 }, tables { broken { sampler { type = nope } } } }")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeCancelsEveryTable() throws Exception {
        Table table = Table.queue("a", 1);
        TableRegistry registry = new TableRegistry(List.of(table));
        insertSimple(table, 1, 1.0);

        registry.close();

        assertThatThrownBy(() -> insertSimple(table, 2, 1.0)).isInstanceOf(CancelledException.class);
    }
}
