package com.github.dimitryivaniuta.pack.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.github.dimitryivaniuta.common.money.Money;
import java.util.List;

/**
 * Raw shape of the catalog file, before flattening. Nested entries carry full item
 * definitions; {@link CatalogLoader} turns them into {@link Item}s and id references.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogDocument(
        List<PackDoc> packs,
        List<DropTableDoc> dropTables,
        @JsonAlias("eps") List<ReleaseDoc> releases,
        List<SingleDoc> singles,
        @JsonAlias("characters") List<FragmentSetDoc> fragmentSets,
        List<ItemDoc> unreleased,
        List<ItemDoc> goldenCharacters
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PackDoc(String id, String name, Money price, String tableId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DropTableDoc(String id, List<DropRow> rows) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ItemDoc(String id, String name, String rarity, @JsonAlias("artUrl") String image) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SongDoc(String id, String name, List<ItemDoc> stems, String rewardCharacterId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReleaseDoc(String id, String name, ItemDoc cover, List<SongDoc> songs, String rewardCharacterId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SingleDoc(String id, String name, SongDoc song, ItemDoc cover, String rewardCharacterId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FragmentSetDoc(String id, String name, List<ItemDoc> fragments, String rewardCharacterId) {}
}
