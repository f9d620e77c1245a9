package com.example.valuelens.provider;

import com.example.valuelens.model.ProviderResult;
import com.example.valuelens.model.QuoteSummary;
import com.example.valuelens.model.RealtimeQuote;

import java.util.List;

/**
 * Source of realtime prices. Implementations never throw; failures come back as empty results.
 */
public interface RealtimeQuoteProvider {

    /**
     * Fetch the realtime quote for a symbol without exchange suffix
     */
    ProviderResult<RealtimeQuote> fetchQuote(String symbol);

    /**
     * Fetch lightweight quotes for several symbols in one upstream request
     */
    List<QuoteSummary> fetchBatch(List<String> symbols);

    /**
     * Provider name used in provenance tags
     */
    String getProviderName();
}
