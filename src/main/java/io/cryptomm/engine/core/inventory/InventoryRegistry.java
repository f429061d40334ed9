package io.cryptomm.engine.core.inventory;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.exchange.Position;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link InventoryManager} per traded symbol, built from the configured defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryRegistry {
    private final EngineProperties properties;
    private final Map<String, InventoryManager> managers = new ConcurrentHashMap<>();

    public InventoryManager getOrCreate(String symbol) {
        return managers.computeIfAbsent(symbol, s -> {
            InventoryConfig config = defaultConfig(s);
            log.info("Created inventory manager for {}: max={}, mode={}", s, config.getMaxInventory(), config.getSkewMode());
            return new InventoryManager(s, config);
        });
    }

    public Optional<InventoryManager> get(String symbol) {
        return Optional.ofNullable(managers.get(symbol));
    }

    public List<String> getSymbols() {
        return managers.keySet().stream().sorted().toList();
    }

    /**
     * Overwrites local inventories with the positions reported by the exchange.
     *
     * @return number of symbols updated
     */
    public int sync(List<Position> positions) {
        for (Position position : positions) {
            BigDecimal signed = position.getSide() == OrderSide.SELL
                    ? position.getSize().negate()
                    : position.getSize();
            getOrCreate(position.getSymbol()).setInventory(signed);
        }
        log.info("Inventory synced from {} exchange positions", positions.size());
        return positions.size();
    }

    public InventoryConfig defaultConfig(String symbol) {
        EngineProperties.Inventory inv = properties.getInventory();
        InventoryConfig config = InventoryConfig.builder()
                .maxInventory(inv.getMaxInventoryBySymbol().getOrDefault(symbol, inv.getMaxInventory()))
                .targetInventory(inv.getTargetInventory())
                .skewMode(inv.getSkewMode())
                .skewFactor(inv.getSkewFactor())
                .tiers(inv.getTiers())
                .rebalanceThreshold(inv.getRebalanceThreshold())
                .emergencyThreshold(inv.getEmergencyThreshold())
                .offsetBasis(inv.getOffsetBasis())
                .priceUnit(inv.getPriceUnit())
                .build();
        config.validate();
        return config;
    }
}
