package com.github.dimitryivaniuta.pack.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

class CatalogLoaderTest {

    private static final Instant LOADED_AT = Instant.parse("2024-05-01T10:00:00Z");

    private final CatalogLoader loader = new CatalogLoader(new ObjectMapper().findAndRegisterModules(),
            Clock.fixed(LOADED_AT, ZoneOffset.UTC));

    @Test
    void flattensHierarchyIntoItems() {
        CatalogSnapshot snapshot = loader.load(new ClassPathResource("catalog/catalog.json"), 7);

        assertThat(snapshot.getVersion()).isEqualTo(7);
        assertThat(snapshot.getLoadedAt()).isEqualTo(LOADED_AT);
        assertThat(snapshot.findPack("starter")).map(Pack::price).contains(Money.of("COIN", 100));
        // 6 + 2 stems, 2 covers, 3 fragments, 2 unreleased, 4 characters
        assertThat(snapshot.items()).hasSize(19);
        assertThat(snapshot.getReleases()).singleElement()
                .satisfies(r -> {
                    assertThat(r.songs()).hasSize(2);
                    assertThat(r.coverId()).isEqualTo("cover-neon-tide");
                });
        assertThat(snapshot.getSingles()).singleElement()
                .satisfies(s -> assertThat(s.stemIds()).containsExactly("stem-afterglow-keys", "stem-afterglow-vox"));
        assertThat(snapshot.getGoldenCharacterIds()).contains("char-ember", "char-nova");
    }

    @Test
    void defaultsRarityByKind() {
        CatalogSnapshot snapshot = loader.load(new ClassPathResource("catalog/catalog.json"), 1);

        assertThat(snapshot.findItem("stem-undertow-bass")).map(Item::rarity).contains("common");
        assertThat(snapshot.findItem("frag-nova-1")).map(Item::rarity).contains("common");
        assertThat(snapshot.findItem("cover-afterglow")).map(Item::rarity).contains("rare");
        assertThat(snapshot.findItem("unrel-demo-07")).map(Item::rarity).contains("epic");
        assertThat(snapshot.findItem("char-echo")).map(Item::rarity).contains("legendary");
        assertThat(snapshot.findItem("char-echo")).map(Item::artUrl).contains("/art/characters/echo.png");
    }

    @Test
    void firstDefinitionOfAnIdWins() {
        String json = """
                {
                  "packs": [],
                  "dropTables": [],
                  "singles": [
                    { "id": "single-1", "cover": { "id": "shared", "name": "As cover" },
                      "song": { "id": "song-1", "stems": [ { "id": "st-1" } ] } }
                  ],
                  "unreleased": [ { "id": "shared", "name": "As unreleased" } ]
                }
                """;

        CatalogSnapshot snapshot = loader.load(new ByteArrayResource(json.getBytes()), 1);

        assertThat(snapshot.findItem("shared")).map(Item::kind).contains(ItemKind.COVER);
        assertThat(snapshot.findItem("shared")).map(Item::name).contains("As cover");
        assertThat(snapshot.getUnreleasedIds()).containsExactly("shared");
        assertThat(snapshot.findItem("st-1")).map(Item::name).contains("st-1");
    }

    @Test
    void rejectsTableThatRollsARarityWithoutItems() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("catalog/missing-rarity.json"), 1))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("epic");
    }

    @Test
    void rejectsPackWithUnknownTable() {
        String json = """
                { "packs": [ { "id": "p", "price": { "currency": "COIN", "amount": 1 }, "tableId": "nope" } ] }
                """;

        assertThatThrownBy(() -> loader.load(new ByteArrayResource(json.getBytes()), 1))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void invalidRowsAndUnreadableDocumentsAreConfigurationErrors() {
        String badRow = """
                { "dropTables": [ { "id": "t", "rows": [ { "rarity": "common", "weight": -1 } ] } ] }
                """;

        assertThatThrownBy(() -> loader.load(new ByteArrayResource(badRow.getBytes()), 1))
                .isInstanceOf(CatalogConfigurationException.class);
        assertThatThrownBy(() -> loader.load(new ByteArrayResource("{ not json".getBytes()), 1))
                .isInstanceOf(CatalogConfigurationException.class);
        assertThatThrownBy(() -> loader.load(new ClassPathResource("catalog/absent.json"), 1))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("not found");
    }
}
