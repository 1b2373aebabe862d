package com.basisengine.config;

import com.basisengine.domain.enums.TradingMode;
import com.basisengine.domain.enums.VenueType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine configuration bound from the {@code basisengine.*} prefix: trading mode, retry and
 * backoff, reconciliation tolerance and cadence, dedup window and the venue definitions.
 */
@ConfigurationProperties(prefix = "basisengine")
@Validated
@Getter
@Setter
public class ExecutionProperties {

    /** PAPER wires simulated venue clients, LIVE wires the REST clients. */
    @NotNull
    private TradingMode tradingMode = TradingMode.PAPER;

    /** An instruction id seen again within this window is rejected as a duplicate. */
    @NotNull
    private Duration dedupWindow = Duration.ofMinutes(5);

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @Valid
    private Map<String, Venue> venues = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Retry {

        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration baseDelay = Duration.ofMillis(200);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Reconciliation {

        /** Absolute drift accepted for assets without their own tolerance. */
        @NotNull
        @DecimalMin("0")
        private BigDecimal tolerance = new BigDecimal("0.01");

        private Map<String, BigDecimal> assetTolerances = new LinkedHashMap<>();

        private long intervalMs = 60_000;

        /** Reconcile the venues a tick touched right after the tick. */
        private boolean postExecution = true;

        private boolean scheduled = true;

        @Min(1)
        private int historySize = 500;

        public BigDecimal toleranceFor(String asset) {
            return assetTolerances.getOrDefault(asset, tolerance);
        }
    }

    @Getter
    @Setter
    public static class Venue {

        @NotNull
        private VenueType type;

        private boolean enabled = true;

        /** REST endpoint (CEX API or relayer sidecar). Required in LIVE mode. */
        private String baseUrl;

        private String apiKey;

        private String apiSecret;

        private double rateLimitPerSecond = 10;

        /** Quote asset appended to the instruction asset to form the CEX symbol. */
        private String quoteAsset = "USDT";

        /** Asset gas fees are paid in on chain venues. */
        private String nativeAsset = "ETH";

        @Min(1)
        private int requiredConfirmations = 1;

        private Duration confirmationTimeout = Duration.ofMinutes(2);

        private Duration fillTimeout = Duration.ofSeconds(30);

        private Duration pollInterval = Duration.ofMillis(500);

        private Duration requestTimeout = Duration.ofSeconds(10);

        /** Where transfers into this venue are sent. */
        private String depositAddress;

        /** Seed balances for PAPER mode; also the ledger's opening balances. */
        private Map<String, BigDecimal> initialBalances = new LinkedHashMap<>();
    }
}
