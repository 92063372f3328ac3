package com.github.dimitryivaniuta.pack.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.pack.catalog.CatalogDocument.FragmentSetDoc;
import com.github.dimitryivaniuta.pack.catalog.CatalogDocument.ItemDoc;
import com.github.dimitryivaniuta.pack.catalog.CatalogDocument.ReleaseDoc;
import com.github.dimitryivaniuta.pack.catalog.CatalogDocument.SingleDoc;
import com.github.dimitryivaniuta.pack.catalog.CatalogDocument.SongDoc;
import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * Reads the catalog document and flattens its hierarchy into packable items:
 * every stem, cover, fragment, unreleased entry and golden character becomes an {@link Item}.
 * The first definition of an id wins; later duplicates are ignored.
 */
@Slf4j
@RequiredArgsConstructor
public class CatalogLoader {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CatalogSnapshot load(Resource resource, long version) {
        if (resource == null || !resource.exists()) {
            throw new CatalogConfigurationException("Catalog resource not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            CatalogDocument doc = objectMapper.readValue(in, CatalogDocument.class);
            CatalogSnapshot snapshot = flatten(doc, version);
            log.info("Catalog v{} loaded from {}: packs={} tables={} items={}",
                    version, resource.getDescription(), snapshot.getPacks().size(),
                    snapshot.getTablesById().size(), snapshot.getItemsById().size());
            return snapshot;
        } catch (IOException e) {
            throw new CatalogConfigurationException("Unreadable catalog " + resource.getDescription(), e);
        }
    }

    CatalogSnapshot flatten(CatalogDocument doc, long version) {
        var b = CatalogSnapshot.builder().version(version).loadedAt(clock.instant());
        var items = new FlatItems();

        for (ReleaseDoc rel : nonNull(doc.releases())) {
            List<Song> songs = new ArrayList<>();
            for (SongDoc song : nonNull(rel.songs())) {
                songs.add(new Song(song.id(), song.name(), items.addAll(song.stems(), ItemKind.STEM),
                        song.rewardCharacterId()));
            }
            b.release(new Release(rel.id(), rel.name(), songs, items.add(rel.cover(), ItemKind.COVER),
                    rel.rewardCharacterId()));
        }

        for (SingleDoc single : nonNull(doc.singles())) {
            List<String> stems = single.song() == null ? List.of() : items.addAll(single.song().stems(), ItemKind.STEM);
            b.single(new Single(single.id(), single.name(), stems, items.add(single.cover(), ItemKind.COVER),
                    single.rewardCharacterId()));
        }

        for (FragmentSetDoc set : nonNull(doc.fragmentSets())) {
            b.fragmentSet(new FragmentSet(set.id(), set.name(), items.addAll(set.fragments(), ItemKind.FRAGMENT),
                    set.rewardCharacterId()));
        }

        b.unreleasedIds(items.addAll(doc.unreleased(), ItemKind.UNRELEASED));
        b.goldenCharacterIds(items.addAll(doc.goldenCharacters(), ItemKind.CHARACTER));

        nonNull(doc.dropTables()).forEach(t -> b.dropTable(new DropTable(t.id(), t.rows())));
        nonNull(doc.packs()).forEach(p -> b.pack(new Pack(p.id(), p.name(), p.price(), p.tableId())));

        log.info("[flatten] counts: {}", items.countsByKind);
        return b.items(items.items).build();
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }

    /** Accumulates flattened items, skipping ids already seen. */
    private static final class FlatItems {
        private final List<Item> items = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();
        private final Map<ItemKind, Integer> countsByKind = new EnumMap<>(ItemKind.class);

        String add(ItemDoc doc, ItemKind kind) {
            if (doc == null) return null;
            if (seen.add(doc.id())) {
                String rarity = doc.rarity() == null || doc.rarity().isBlank() ? kind.defaultRarity() : doc.rarity();
                items.add(new Item(doc.id(), doc.name(), rarity, kind, doc.image()));
                countsByKind.merge(kind, 1, Integer::sum);
            }
            return doc.id();
        }

        List<String> addAll(List<ItemDoc> docs, ItemKind kind) {
            List<String> ids = new ArrayList<>();
            for (ItemDoc d : nonNull(docs)) {
                ids.add(add(d, kind));
            }
            return ids;
        }
    }
}
