package com.example.valuelens.provider;

import com.example.valuelens.model.FinancialSeries;
import com.example.valuelens.model.ProviderResult;

/**
 * Source of annual income statements, amounts in crores, most recent year first.
 * Beans are consulted in {@link org.springframework.core.annotation.Order} sequence.
 */
public interface FinancialsProvider {

    ProviderResult<FinancialSeries> fetchFinancials(String symbol);

    String getProviderName();
}
