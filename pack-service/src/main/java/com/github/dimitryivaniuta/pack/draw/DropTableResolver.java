package com.github.dimitryivaniuta.pack.draw;

import com.github.dimitryivaniuta.pack.catalog.DropRow;
import com.github.dimitryivaniuta.pack.catalog.DropTable;
import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a drop table plus the owner's pity state into a rarity. Called once per draw, so the
 * pity threshold can fire in the middle of an opening.
 */
@Slf4j
@RequiredArgsConstructor
public class DropTableResolver {

    private final RandomSource random;

    public RarityOutcome resolve(DropTable table, PityState pity) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(pity, "pity");

        Optional<DropRow> pityRow = table.pityRow();
        if (pityRow.isPresent() && pity.sinceLastPity() + 1 >= pityRow.get().pityEvery()) {
            log.debug("Pity forced {} on table {} after {} misses",
                    pityRow.get().rarity(), table.id(), pity.sinceLastPity());
            return new RarityOutcome(pityRow.get().rarity(), pity.reset(), true);
        }

        double total = table.totalWeight();
        if (!(total > 0)) {
            throw new CatalogConfigurationException("Drop table " + table.id() + " has total weight " + total);
        }

        double roll = random.nextDouble(total);
        double acc = 0;
        DropRow hit = null;
        for (DropRow row : table.rows()) {
            acc += row.weight();
            if (acc >= roll) {
                hit = row;
                break;
            }
        }
        // roll < total, so only floating-point drift on the last row can leave hit unset
        final DropRow chosen = hit != null ? hit : table.rows().get(table.rows().size() - 1);

        boolean isPityRarity = pityRow.map(r -> r.rarity().equals(chosen.rarity())).orElse(false);
        return new RarityOutcome(chosen.rarity(), isPityRarity ? pity.reset() : pity.advance(), false);
    }
}
