package com.github.dimitryivaniuta.pack.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import com.github.dimitryivaniuta.pack.support.TestCatalogs;
import java.util.List;
import org.junit.jupiter.api.Test;

class DropTableTest {

    @Test
    void exposesTotalWeightAndPityRow() {
        DropTable table = TestCatalogs.starterTable();

        assertThat(table.totalWeight()).isEqualTo(100d);
        assertThat(table.pityRow()).map(DropRow::rarity).contains("legendary");
        assertThat(table.rarities()).containsExactly("common", "rare", "legendary");
    }

    @Test
    void rejectsEmptyTable() {
        assertThatThrownBy(() -> new DropTable("t", List.of()))
                .isInstanceOf(CatalogConfigurationException.class);
    }

    @Test
    void rejectsNonPositiveOrInfiniteWeights() {
        assertThatThrownBy(() -> DropRow.of("common", 0))
                .isInstanceOf(CatalogConfigurationException.class);
        assertThatThrownBy(() -> DropRow.of("common", Double.NaN))
                .isInstanceOf(CatalogConfigurationException.class);
        assertThatThrownBy(() -> DropRow.of("common", Double.POSITIVE_INFINITY))
                .isInstanceOf(CatalogConfigurationException.class);
    }

    @Test
    void rejectsSecondPityRow() {
        assertThatThrownBy(() -> new DropTable("t", List.of(
                new DropRow("rare", 50, 3),
                new DropRow("legendary", 50, 5))))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("pity");
    }

    @Test
    void rejectsPityEveryBelowOne() {
        assertThatThrownBy(() -> new DropRow("legendary", 1, 0))
                .isInstanceOf(CatalogConfigurationException.class);
    }

    @Test
    void normalizesRarityNames() {
        assertThat(DropRow.of("  Legendary ", 1).rarity()).isEqualTo("legendary");
    }
}
