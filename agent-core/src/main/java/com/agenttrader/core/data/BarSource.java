package com.agenttrader.core.data;

import com.agenttrader.core.exception.InvalidSymbolException;
import com.agenttrader.core.model.Bar;

import java.io.IOException;
import java.util.List;

/**
 * Supplies bar histories to the pipeline.
 */
public interface BarSource {

    /**
     * Full history for a symbol, ascending by date.
     *
     * @throws InvalidSymbolException when the source does not know the symbol
     * @throws IOException            when the history cannot be read
     */
    List<Bar> history(String symbol) throws InvalidSymbolException, IOException;

    /** Symbols this source can serve. */
    List<String> symbols() throws IOException;
}
