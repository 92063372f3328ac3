package com.github.dimitryivaniuta.pack.catalog;

import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Immutable, validated view of the whole catalog. A snapshot is never mutated; reloads publish
 * a new instance through {@link CatalogStore}.
 */
@Getter
public final class CatalogSnapshot {

    private final long version;
    private final Instant loadedAt;
    private final List<Pack> packs;
    private final List<Release> releases;
    private final List<Single> singles;
    private final List<FragmentSet> fragmentSets;
    private final List<String> unreleasedIds;
    private final List<String> goldenCharacterIds;

    private final Map<String, Pack> packsById;
    private final Map<String, DropTable> tablesById;
    private final Map<String, Item> itemsById;
    private final Map<String, List<Item>> itemsByRarity;

    @Builder
    private CatalogSnapshot(long version,
                            Instant loadedAt,
                            @Singular List<Pack> packs,
                            @Singular List<DropTable> dropTables,
                            @Singular List<Item> items,
                            @Singular List<Release> releases,
                            @Singular List<Single> singles,
                            @Singular List<FragmentSet> fragmentSets,
                            @Singular("unreleasedId") List<String> unreleasedIds,
                            @Singular("goldenCharacterId") List<String> goldenCharacterIds) {
        this.version = version;
        this.loadedAt = loadedAt == null ? Instant.EPOCH : loadedAt;
        this.packs = List.copyOf(packs);
        this.releases = List.copyOf(releases);
        this.singles = List.copyOf(singles);
        this.fragmentSets = List.copyOf(fragmentSets);
        this.unreleasedIds = List.copyOf(unreleasedIds);
        this.goldenCharacterIds = List.copyOf(goldenCharacterIds);

        this.itemsById = indexUnique(items, Item::id, "item");
        this.tablesById = indexUnique(dropTables, DropTable::id, "drop table");
        this.packsById = indexUnique(packs, Pack::id, "pack");

        Map<String, List<Item>> byRarity = new LinkedHashMap<>();
        for (Item item : items) {
            byRarity.computeIfAbsent(item.rarity(), r -> new ArrayList<>()).add(item);
        }
        byRarity.replaceAll((r, list) -> List.copyOf(list));
        this.itemsByRarity = Collections.unmodifiableMap(byRarity);

        validate();
    }

    public Optional<Pack> findPack(String packId) {
        return Optional.ofNullable(packsById.get(packId));
    }

    public Optional<Item> findItem(String itemId) {
        return Optional.ofNullable(itemsById.get(itemId));
    }

    public DropTable table(String tableId) {
        DropTable table = tablesById.get(tableId);
        if (table == null) {
            throw new CatalogConfigurationException("Unknown drop table " + tableId);
        }
        return table;
    }

    public List<Item> itemsOfRarity(String rarity) {
        return itemsByRarity.getOrDefault(Rarities.normalize(rarity), List.of());
    }

    public Collection<Item> items() {
        return itemsById.values();
    }

    /* ======================================================================
       Validation
       ====================================================================== */

    private void validate() {
        for (Pack pack : packs) {
            DropTable table = tablesById.get(pack.tableId());
            if (table == null) {
                throw new CatalogConfigurationException(
                        "Pack " + pack.id() + " references unknown drop table " + pack.tableId());
            }
            for (String rarity : table.rarities()) {
                if (itemsOfRarity(rarity).isEmpty()) {
                    throw new CatalogConfigurationException(
                            "Drop table " + table.id() + " can roll '" + rarity + "' but the catalog has no such items");
                }
            }
        }
        for (Release release : releases) {
            release.songs().forEach(song -> requireItems(song.stemIds(), "song " + song.id()));
            requireItem(release.coverId(), "release " + release.id());
        }
        for (Single single : singles) {
            requireItems(single.stemIds(), "single " + single.id());
            requireItem(single.coverId(), "single " + single.id());
        }
        fragmentSets.forEach(set -> requireItems(set.fragmentIds(), "fragment set " + set.id()));
        requireItems(unreleasedIds, "unreleased collection");
        requireItems(goldenCharacterIds, "golden characters");
    }

    private void requireItems(List<String> ids, String owner) {
        ids.forEach(id -> requireItem(id, owner));
    }

    private void requireItem(String id, String owner) {
        if (id != null && !itemsById.containsKey(id)) {
            throw new CatalogConfigurationException(owner + " references unknown item " + id);
        }
    }

    private static <T> Map<String, T> indexUnique(List<T> values,
                                                  java.util.function.Function<T, String> key,
                                                  String what) {
        Map<String, T> out = new LinkedHashMap<>();
        for (T v : values) {
            if (out.putIfAbsent(key.apply(v), v) != null) {
                throw new CatalogConfigurationException("Duplicate " + what + " id " + key.apply(v));
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
