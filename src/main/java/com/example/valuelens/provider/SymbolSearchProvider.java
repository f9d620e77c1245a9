package com.example.valuelens.provider;

import com.example.valuelens.model.SearchResult;

import java.util.List;

public interface SymbolSearchProvider {

    /**
     * Matches for a free-text query; empty list when nothing matched or the provider failed
     */
    List<SearchResult> search(String query);

    String getProviderName();
}
