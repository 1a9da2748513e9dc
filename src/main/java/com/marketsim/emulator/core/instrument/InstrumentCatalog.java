package com.marketsim.emulator.core.instrument;

import com.marketsim.emulator.core.model.AssetClass;
import com.marketsim.emulator.core.model.FactorLoadings;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.InstrumentStyle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static com.marketsim.emulator.core.model.MacroFactor.CRYPTO;
import static com.marketsim.emulator.core.model.MacroFactor.ENERGY;
import static com.marketsim.emulator.core.model.MacroFactor.METALS;
import static com.marketsim.emulator.core.model.MacroFactor.RATES;
import static com.marketsim.emulator.core.model.MacroFactor.RISK_ON;
import static com.marketsim.emulator.core.model.MacroFactor.USD;
import static com.marketsim.emulator.core.model.MacroFactor.VOL;

/**
 * Immutable set of instruments listed on the emulator.
 */
@Slf4j
@Component
public class InstrumentCatalog {

    private final Map<String, InstrumentDefinition> instruments;

    public InstrumentCatalog() {
        this(defaultInstruments());
    }

    public InstrumentCatalog(List<InstrumentDefinition> definitions) {
        Map<String, InstrumentDefinition> map = new LinkedHashMap<>();
        for (InstrumentDefinition definition : definitions) {
            definition.validate();
            if (map.putIfAbsent(definition.getTicker(), definition) != null) {
                throw new IllegalArgumentException("Duplicate instrument " + definition.getTicker());
            }
        }
        this.instruments = Collections.unmodifiableMap(map);
        log.info("Instrument catalog loaded: {} instruments", instruments.size());
    }

    public Optional<InstrumentDefinition> find(String ticker) {
        return Optional.ofNullable(instruments.get(ticker));
    }

    public InstrumentDefinition get(String ticker) {
        InstrumentDefinition definition = instruments.get(ticker);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown ticker: " + ticker);
        }
        return definition;
    }

    public boolean contains(String ticker) {
        return instruments.containsKey(ticker);
    }

    public Collection<InstrumentDefinition> all() {
        return instruments.values();
    }

    public List<String> tickers() {
        return List.copyOf(instruments.keySet());
    }

    static List<InstrumentDefinition> defaultInstruments() {
        return List.of(
                // Large cap stocks
                def("AAPL", "Apricot Corp", AssetClass.STOCK, "Tech", 185, 0.018, 0.0001, 0.002, s -> s),
                def("MSFT", "MegaSoft", AssetClass.STOCK, "Tech", 420, 0.016, 0.00012, 0.002, s -> s),
                def("NVDA", "NeuraVolt", AssetClass.STOCK, "Tech", 875, 0.032, 0.0002, 0.0015,
                        s -> s.trendPersistence(0.08)),
                def("AMZN", "AmazoNet", AssetClass.STOCK, "Tech", 195, 0.020, 0.00015, 0.002, s -> s),
                def("GOOG", "GooglTech", AssetClass.STOCK, "Tech", 175, 0.019, 0.0001, 0.002, s -> s),
                def("META", "MetaVerse Inc", AssetClass.STOCK, "Tech", 510, 0.025, 0.00015, 0.0018, s -> s),
                def("TSLA", "VoltMotors", AssetClass.STOCK, "Auto", 245, 0.038, 0.0002, 0.001,
                        s -> s.trendPersistence(0.09).jumpProbability(0.002)),
                // Growth and speculative stocks
                def("MOON", "LunarTech", AssetClass.STOCK, "Meme", 42, 0.065, 0.0005, 0.0005,
                        s -> s.trendPersistence(0.12).jumpProbability(0.004).jumpScale(4.0)
                                .spreadMultiplier(1.6).volumeMultiplier(1.8).idiosyncraticMultiplier(1.3)),
                def("BIOT", "BioTera", AssetClass.STOCK, "Healthcare", 78, 0.040, 0.0003, 0.001,
                        s -> s.jumpProbability(0.003).jumpScale(4.5)),
                def("QNTM", "QuantumLeap", AssetClass.STOCK, "Tech", 34, 0.045, 0.0003, 0.001,
                        s -> s.trendPersistence(0.1).spreadMultiplier(1.3)),
                // Commodities
                def("OGLD", "OmniGold", AssetClass.COMMODITY, "Metals", 2050, 0.012, 0.00005, 0.003, s -> s),
                def("SLVR", "SilverEdge", AssetClass.COMMODITY, "Metals", 28.5, 0.022, 0.00003, 0.003, s -> s),
                def("CRUD", "CrudeFlow", AssetClass.COMMODITY, "Energy", 78, 0.025, 0.0, 0.004,
                        s -> s.jumpProbability(0.002)),
                def("NATG", "NatGas Plus", AssetClass.COMMODITY, "Energy", 3.2, 0.040, 0.0, 0.005,
                        s -> s.jumpProbability(0.003).spreadMultiplier(1.4)),
                def("COPR", "CopperLine", AssetClass.COMMODITY, "Metals", 4.25, 0.018, 0.00005, 0.003, s -> s),
                // Index futures
                def("SPXF", "S&P Futures", AssetClass.FUTURE, "Index", 5200, 0.012, 0.0001, 0.002, s -> s),
                def("NQFT", "NQ Futures", AssetClass.FUTURE, "Index", 18500, 0.016, 0.00012, 0.002, s -> s),
                def("DOWF", "Dow Futures", AssetClass.FUTURE, "Index", 39000, 0.010, 0.00008, 0.002, s -> s),
                def("VIXF", "Fear Index", AssetClass.FUTURE, "Volatility", 18, 0.060, -0.0002, 0.008,
                        s -> s.trendPersistence(0.02).meanReversionMultiplier(1.5).anchorFollowRate(0.002)),
                // ETFs
                def("SAFE", "Treasury ETF", AssetClass.ETF, "Bonds", 102, 0.003, 0.00003, 0.005,
                        s -> s.jumpProbability(0.0002)),
                def("BNKX", "BankEx ETF", AssetClass.ETF, "Finance", 45, 0.014, 0.00006, 0.003, s -> s),
                def("NRGY", "Energy ETF", AssetClass.ETF, "Energy", 88, 0.022, 0.00008, 0.003, s -> s),
                def("MEDS", "HealthCare ETF", AssetClass.ETF, "Healthcare", 155, 0.015, 0.0001, 0.003, s -> s),
                def("SEMX", "SemiConductor ETF", AssetClass.ETF, "Tech", 240, 0.028, 0.00015, 0.002, s -> s),
                def("REIT", "RealtyFund ETF", AssetClass.ETF, "RealEstate", 38, 0.012, 0.00005, 0.004, s -> s),
                // Crypto
                def("BTCX", "Bitcoin Index", AssetClass.CRYPTO, "Crypto", 67500, 0.035, 0.0002, 0.001,
                        s -> s.jumpProbability(0.002)),
                def("ETHX", "Ethereum Index", AssetClass.CRYPTO, "Crypto", 3500, 0.040, 0.00015, 0.001,
                        s -> s.jumpProbability(0.002)),
                def("SOLX", "Solana Index", AssetClass.CRYPTO, "Crypto", 145, 0.055, 0.0003, 0.0008,
                        s -> s.jumpProbability(0.003).idiosyncraticMultiplier(1.2)),
                // Forex
                def("EURUSD", "Euro/Dollar", AssetClass.FOREX, "FX", 1.0850, 0.004, 0.0, 0.006,
                        s -> s.factorLoadings(FactorLoadings.builder().with(USD, -1.0).with(RATES, -0.2).build())),
                def("GBPUSD", "Pound/Dollar", AssetClass.FOREX, "FX", 1.2700, 0.005, 0.0, 0.006,
                        s -> s.factorLoadings(FactorLoadings.builder().with(USD, -0.9).with(RISK_ON, 0.1).build())),
                def("USDJPY", "Dollar/Yen", AssetClass.FOREX, "FX", 150.50, 0.005, 0.0, 0.005,
                        s -> s.factorLoadings(FactorLoadings.builder().with(USD, 1.0).with(RATES, 0.4)
                                .with(RISK_ON, 0.15).build()))
        );
    }

    private static InstrumentDefinition def(String ticker, String name, AssetClass assetClass, String sector,
                                            double basePrice, double volatility, double drift, double meanRev,
                                            UnaryOperator<InstrumentStyle.InstrumentStyleBuilder> style) {
        InstrumentStyle.InstrumentStyleBuilder styleBuilder = InstrumentStyle.builder()
                .factorLoadings(sectorLoadings(sector));
        boolean fx = assetClass == AssetClass.FOREX;
        return InstrumentDefinition.builder()
                .ticker(ticker)
                .name(name)
                .assetClass(assetClass)
                .sector(sector)
                .basePrice(basePrice)
                .baseVolatility(volatility)
                .drift(drift)
                .meanReversionRate(meanRev)
                .microstructure(assetClass.defaultMicrostructure())
                .style(style.apply(styleBuilder).build())
                .decimals(decimalsFor(assetClass, basePrice))
                .minPrice(basePrice * (fx ? 0.5 : 0.05))
                .maxPrice(basePrice * (fx ? 2.0 : 20.0))
                .build();
    }

    static int decimalsFor(AssetClass assetClass, double basePrice) {
        if (assetClass == AssetClass.FOREX) {
            return basePrice > 20 ? 3 : 4;
        }
        if (basePrice < 10) {
            return 3;
        }
        return 2;
    }

    static FactorLoadings sectorLoadings(String sector) {
        FactorLoadings.Builder builder = FactorLoadings.builder();
        switch (sector) {
            case "Tech" -> builder.with(RISK_ON, 1.2).with(RATES, -0.4).with(VOL, -0.5);
            case "Auto" -> builder.with(RISK_ON, 1.3).with(ENERGY, -0.2).with(VOL, -0.6);
            case "Meme" -> builder.with(RISK_ON, 1.6).with(CRYPTO, 0.4).with(VOL, -0.8);
            case "Healthcare" -> builder.with(RISK_ON, 0.6).with(RATES, -0.2);
            case "Metals" -> builder.with(METALS, 1.0).with(USD, -0.8).with(RISK_ON, -0.1);
            case "Energy" -> builder.with(ENERGY, 1.1).with(USD, -0.3).with(RISK_ON, 0.3);
            case "Index" -> builder.with(RISK_ON, 1.0).with(VOL, -0.5).with(RATES, -0.2);
            case "Volatility" -> builder.with(VOL, 2.0).with(RISK_ON, -1.2);
            case "Bonds" -> builder.with(RATES, -1.0).with(RISK_ON, -0.2);
            case "Finance" -> builder.with(RISK_ON, 0.8).with(RATES, 0.5);
            case "RealEstate" -> builder.with(RATES, -0.8).with(RISK_ON, 0.5);
            case "Crypto" -> builder.with(CRYPTO, 1.0).with(RISK_ON, 0.5);
            default -> builder.with(RISK_ON, 0.5);
        }
        return builder.build();
    }
}
