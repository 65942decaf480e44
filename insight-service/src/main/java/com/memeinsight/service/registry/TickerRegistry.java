package com.memeinsight.service.registry;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracked tickers keyed by symbol. Confined to the commit scheduler; readers only ever
 * see {@link com.memeinsight.common.model.TickerSnapshot}s built from it.
 */
public class TickerRegistry {

    private final Map<String, TickerRecord> records = new LinkedHashMap<>();

    public Optional<TickerRecord> get(String symbol) {
        return Optional.ofNullable(records.get(symbol));
    }

    public boolean contains(String symbol) {
        return records.containsKey(symbol);
    }

    public void put(TickerRecord record) {
        records.put(record.symbol(), record);
    }

    public Optional<TickerRecord> remove(String symbol) {
        return Optional.ofNullable(records.remove(symbol));
    }

    public Collection<TickerRecord> all() {
        return List.copyOf(records.values());
    }

    public List<String> symbols() {
        return List.copyOf(records.keySet());
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
