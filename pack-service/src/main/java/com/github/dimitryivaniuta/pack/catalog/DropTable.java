package com.github.dimitryivaniuta.pack.catalog;

import static com.github.dimitryivaniuta.pack.catalog.CatalogChecks.requireNonBlank;

import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered weighted rarity rows. Construction fails for an empty table, a non-positive total
 * weight, or more than one pity row.
 */
public record DropTable(String id, List<DropRow> rows) {

    public DropTable {
        requireNonBlank(id, "dropTable.id");
        rows = CatalogChecks.copyOrEmpty(rows);
        if (rows.isEmpty()) {
            throw new CatalogConfigurationException("Drop table " + id + " has no rows");
        }
        double total = rows.stream().mapToDouble(DropRow::weight).sum();
        if (!(total > 0)) {
            throw new CatalogConfigurationException("Drop table " + id + " has total weight " + total);
        }
        long pityRows = rows.stream().filter(DropRow::hasPity).count();
        if (pityRows > 1) {
            throw new CatalogConfigurationException("Drop table " + id + " declares " + pityRows + " pity rows");
        }
    }

    public double totalWeight() {
        return rows.stream().mapToDouble(DropRow::weight).sum();
    }

    public Optional<DropRow> pityRow() {
        return rows.stream().filter(DropRow::hasPity).findFirst();
    }

    public Set<String> rarities() {
        Set<String> out = new LinkedHashSet<>();
        rows.forEach(r -> out.add(r.rarity()));
        return out;
    }
}
