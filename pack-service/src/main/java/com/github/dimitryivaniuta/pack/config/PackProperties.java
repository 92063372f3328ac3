package com.github.dimitryivaniuta.pack.config;

import com.github.dimitryivaniuta.pack.economy.EconomyModel;
import com.github.dimitryivaniuta.pack.service.PendingPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Unified configuration for the pack service.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "pack")
public class PackProperties {

    /** Items drawn per opening. */
    @Min(1)
    private int pullsPerOpening = 5;

    @Valid
    private Catalog catalog = new Catalog();

    @Valid
    private Pending pending = new Pending();

    @Valid
    private Idempotency idempotency = new Idempotency();

    @Valid
    private Economy economy = new Economy();

    @Valid
    private Store store = new Store();

    @Valid
    private Dev dev = new Dev();

  /* ===========================
     Sub-sections
     =========================== */

    @Getter @Setter
    @Validated
    public static class Catalog {
        /** Spring resource location of the catalog document. */
        @NotBlank
        private String location = "classpath:catalog/catalog.json";
    }

    @Getter @Setter
    @Validated
    public static class Pending {
        /** What a second opening does to an uncollected one. */
        @NotNull
        private PendingPolicy policy = PendingPolicy.FIRST_WINS;
    }

    @Getter @Setter
    @Validated
    public static class Idempotency {
        /** How long a repeated request waits for the first one to finish. */
        @NotNull
        private Duration inFlightTimeout = Duration.ofSeconds(10);
    }

    @Getter @Setter
    @Validated
    public static class Economy {
        @NotNull
        private EconomyModel model = EconomyModel.IMMEDIATE_DUPE_CREDIT;

        /** Balance of a newly created account. */
        @NotEmpty
        private Map<String, Long> startingBalance = new LinkedHashMap<>(Map.of("COIN", 1000L));

        /** Currency of dupe credits and dev grants. */
        @NotBlank
        private String currency = "COIN";

        /** Credit per duplicate under IMMEDIATE_DUPE_CREDIT. */
        @Min(0)
        private long dupeCredit = 0;

        /** Shards that mint one guarantee token under SHARD_TOKENS. */
        @Min(1)
        private int shardsPerToken = 10;
    }

    @Getter @Setter
    @Validated
    public static class Store {
        @NotNull
        private StoreType type = StoreType.MEMORY;

        /** Root directory of the FILE store. */
        @NotBlank
        private String directory = "data/users";
    }

    public enum StoreType { MEMORY, FILE }

    @Getter @Setter
    public static class Dev {
        /** Registers grant/reset/reload endpoints. Never enable in production. */
        private boolean enabled = false;
    }
}
