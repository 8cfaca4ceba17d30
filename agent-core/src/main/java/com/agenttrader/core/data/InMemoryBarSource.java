package com.agenttrader.core.data;

import com.agenttrader.core.exception.InvalidSymbolException;
import com.agenttrader.core.model.Bar;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bar histories held in memory. Histories are sorted ascending on insert.
 */
public final class InMemoryBarSource implements BarSource {

    private final Map<String, List<Bar>> histories = new ConcurrentHashMap<>();

    public InMemoryBarSource() {
    }

    public InMemoryBarSource(Map<String, List<Bar>> initial) {
        initial.forEach(this::put);
    }

    public InMemoryBarSource put(String symbol, List<Bar> bars) {
        List<Bar> sorted = new ArrayList<>(bars);
        sorted.sort(Comparator.comparing(Bar::date));
        histories.put(symbol, List.copyOf(sorted));
        return this;
    }

    @Override
    public List<Bar> history(String symbol) throws InvalidSymbolException {
        List<Bar> bars = histories.get(symbol);
        if (bars == null) {
            throw new InvalidSymbolException(symbol, "no history loaded");
        }
        return bars;
    }

    @Override
    public List<String> symbols() {
        return histories.keySet().stream().sorted().toList();
    }
}
