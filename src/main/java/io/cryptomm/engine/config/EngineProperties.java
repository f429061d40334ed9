package io.cryptomm.engine.config;

import io.cryptomm.engine.core.model.OffsetBasis;
import io.cryptomm.engine.core.model.SkewMode;
import io.cryptomm.engine.core.model.SkewTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
    private Inventory inventory = new Inventory();
    private Orders orders = new Orders();
    private Events events = new Events();
    private Exchange exchange = new Exchange();
    private Strategy strategy = new Strategy();
    private Logging logging = new Logging();

    @Data
    public static class Inventory {
        private BigDecimal maxInventory = BigDecimal.TEN;
        private BigDecimal targetInventory = BigDecimal.ZERO;
        private SkewMode skewMode = SkewMode.LINEAR;
        private double skewFactor = 0.5;
        private List<SkewTier> tiers = new ArrayList<>();
        private double rebalanceThreshold = 0.8;
        private double emergencyThreshold = 0.95;
        private OffsetBasis offsetBasis = OffsetBasis.HALF_SPREAD;
        private BigDecimal priceUnit;
        // Per-symbol max inventory; falls back to maxInventory
        private Map<String, BigDecimal> maxInventoryBySymbol = new LinkedHashMap<>();
    }

    @Data
    public static class Orders {
        private String clientIdPrefix = "mm";
        private Duration exchangeTimeout = Duration.ofSeconds(5);
        private int exchangeThreads = 4;
        private int historyPageSize = 50;
        private int maxHistoryPerSymbol = 1000;
    }

    @Data
    public static class Events {
        private int queueCapacity = 10000;
    }

    @Data
    public static class Exchange {
        private String name = "simulated";
        private String apiKey;
        private String apiSecret;
        private Duration latency = Duration.ZERO;
        private Map<String, BigDecimal> balances = new LinkedHashMap<>();
    }

    @Data
    public static class Strategy {
        private boolean enabled = false;
        private String symbol = "BTC-USDT";
        private int spreadBps = 10;
        private BigDecimal orderQuantity = new BigDecimal("0.01");
        private int orderLevels = 1;
        private int levelSpreadBps = 5;
        private int minRefreshBps = 2;
        private int orderTtlTicks = 60;
        private long tickIntervalMs = 1000;
    }

    @Data
    public static class Logging {
        private String directory = "logs";
        private int maxSessionFiles = 50;
    }
}
