package com.memeinsight.common.extraction;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Known tradable symbols with their company names, plus the ambiguity tables the
 * {@link TickerExtractor} needs: a blacklist of common words that look like tickers
 * and, per symbol, context words that reveal a non-ticker meaning.
 *
 * <p>Immutable. {@link #withExtraSymbols} returns a new catalog.
 */
public final class SymbolCatalog {

    private static final Pattern VALID_SYMBOL = Pattern.compile("[A-Z0-9]{1,5}");

    private static final Map<String, String> DEFAULT_NAMES = buildDefaultNames();

    /** Words that are rejected as bare tokens even when they are known symbols. */
    public static final Set<String> DEFAULT_BLACKLIST = Set.of(
        "ON", "IT", "ALL", "A", "I", "THE", "AND", "FOR", "ARE", "BUT", "NOT", "YOU",
        "CAN", "HER", "WAS", "ONE", "OUR", "OUT", "DAY", "GET", "HAS", "HIM", "HIS",
        "HOW", "ITS", "MAY", "NEW", "NOW", "OLD", "SEE", "TWO", "WHO", "BOY", "DID",
        "LOL", "OMG", "WTF", "CEO", "CFO", "CTO", "IPO", "SEC", "FDA", "NYC", "USA",
        "EUR", "USD", "GBP", "DD", "YOLO", "ATH", "IMO", "EOD", "OTM", "ITM", "GAS",
        "OIL", "F", "RIDE"
    );

    /** Context words that turn a bare mention into a false positive. */
    public static final Map<String, List<String>> DEFAULT_CONTEXT_EXCLUSIONS = Map.ofEntries(
        Map.entry("AI",   List.of("artificial", "intelligence", "chatgpt")),
        Map.entry("LI",   List.of("linkedin")),
        Map.entry("GM",   List.of("good morning")),
        Map.entry("NOK",  List.of("norwegian krone", "kroner")),
        Map.entry("SPCE", List.of("space station")),
        Map.entry("COIN", List.of("coin toss", "flip a coin")),
        Map.entry("HOOD", List.of("neighborhood", "the hood")),
        Map.entry("WISH", List.of("i wish", "wish i", "wish me")),
        Map.entry("SENS", List.of("sense"))
    );

    private final Map<String, String> names;
    private final Set<String> blacklist;
    private final Map<String, List<String>> contextExclusions;

    private SymbolCatalog(Map<String, String> names, Set<String> blacklist,
                          Map<String, List<String>> contextExclusions) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
        this.blacklist = Set.copyOf(blacklist);
        this.contextExclusions = Map.copyOf(contextExclusions);
    }

    public static SymbolCatalog defaults() {
        return new SymbolCatalog(DEFAULT_NAMES, DEFAULT_BLACKLIST, DEFAULT_CONTEXT_EXCLUSIONS);
    }

    public static SymbolCatalog of(Map<String, String> names, Set<String> blacklist,
                                   Map<String, List<String>> contextExclusions) {
        Map<String, String> valid = new LinkedHashMap<>();
        names.forEach((symbol, name) -> {
            if (isValidSymbol(symbol)) valid.put(symbol, name);
        });
        return new SymbolCatalog(valid, blacklist, contextExclusions);
    }

    /** Adds symbols (upper-cased, invalid ones ignored) that have no company name. */
    public SymbolCatalog withExtraSymbols(Collection<String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(names);
        for (String raw : extra) {
            String symbol = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
            if (isValidSymbol(symbol)) merged.putIfAbsent(symbol, symbol);
        }
        return new SymbolCatalog(merged, blacklist, contextExclusions);
    }

    public Set<String> knownSymbols() {
        return names.keySet();
    }

    public Set<String> blacklist() {
        return blacklist;
    }

    public Map<String, List<String>> contextExclusions() {
        return contextExclusions;
    }

    public Optional<String> displayName(String symbol) {
        return Optional.ofNullable(names.get(symbol));
    }

    public static boolean isValidSymbol(String symbol) {
        return symbol != null && VALID_SYMBOL.matcher(symbol).matches();
    }

    private static Map<String, String> buildDefaultNames() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("GME", "GameStop Corp");
        m.put("AMC", "AMC Entertainment Holdings Inc");
        m.put("TSLA", "Tesla Inc");
        m.put("META", "Meta Platforms Inc");
        m.put("NVDA", "NVIDIA Corporation");
        m.put("AMD", "Advanced Micro Devices Inc");
        m.put("AAPL", "Apple Inc");
        m.put("MSFT", "Microsoft Corporation");
        m.put("GOOGL", "Alphabet Inc");
        m.put("AMZN", "Amazon.com Inc");
        m.put("PLTR", "Palantir Technologies Inc");
        m.put("HOOD", "Robinhood Markets Inc");
        m.put("COIN", "Coinbase Global Inc");
        m.put("SOFI", "SoFi Technologies Inc");
        m.put("CLOV", "Clover Health Investments Corp");
        m.put("WISH", "ContextLogic Inc");
        m.put("SNDL", "Sundial Growers Inc");
        m.put("NOK", "Nokia Corporation");
        m.put("BB", "BlackBerry Limited");
        m.put("EXPR", "Express Inc");
        m.put("KOSS", "Koss Corporation");
        m.put("SIRI", "Sirius XM Holdings Inc");
        m.put("SPY", "SPDR S&P 500 ETF Trust");
        m.put("QQQ", "Invesco QQQ Trust");
        m.put("IWM", "iShares Russell 2000 ETF");
        m.put("DIA", "SPDR Dow Jones Industrial Average ETF Trust");
        m.put("TLT", "iShares 20+ Year Treasury Bond ETF");
        m.put("GLD", "SPDR Gold Shares");
        m.put("SLV", "iShares Silver Trust");
        m.put("OIL", "United States Oil Fund");
        m.put("GAS", "United States Gasoline Fund");
        m.put("BABA", "Alibaba Group Holding Limited");
        m.put("NIO", "NIO Inc");
        m.put("XPEV", "XPeng Inc");
        m.put("LI", "Li Auto Inc");
        m.put("RIVN", "Rivian Automotive Inc");
        m.put("LCID", "Lucid Group Inc");
        m.put("F", "Ford Motor Company");
        m.put("GM", "General Motors Company");
        m.put("NKLA", "Nikola Corporation");
        m.put("RIDE", "Lordstown Motors Corp");
        m.put("SPCE", "Virgin Galactic Holdings Inc");
        m.put("ARKK", "ARK Innovation ETF");
        m.put("ARKF", "ARK Fintech Innovation ETF");
        m.put("ARKG", "ARK Genomics Revolution ETF");
        m.put("MVIS", "MicroVision Inc");
        m.put("SENS", "Senseonics Holdings Inc");
        m.put("BNGO", "Bionano Genomics Inc");
        m.put("OCGN", "Ocugen Inc");
        m.put("PROG", "Progenity Inc");
        m.put("BBIG", "Vinco Ventures Inc");
        m.put("AI", "C3.ai Inc");
        return m;
    }
}
