package com.example.valuelens.service;

import com.example.valuelens.cache.CacheCategory;
import com.example.valuelens.cache.CacheStore;
import com.example.valuelens.config.AsyncConfig;
import com.example.valuelens.model.Crores;
import com.example.valuelens.model.FinancialMetric;
import com.example.valuelens.model.FinancialSeries;
import com.example.valuelens.model.FinancialYear;
import com.example.valuelens.model.MergedStockRecord;
import com.example.valuelens.model.ProviderResult;
import com.example.valuelens.model.RealtimeQuote;
import com.example.valuelens.model.SourceInfo;
import com.example.valuelens.model.Symbols;
import com.example.valuelens.provider.FinancialsProvider;
import com.example.valuelens.provider.RealtimeQuoteProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Resolves one symbol into a {@link MergedStockRecord}.
 *
 * Realtime data comes from a single provider. Financial statements come from the first
 * {@link FinancialsProvider} (in bean order) that returns data; later providers are asked only
 * when every earlier one came back empty, and sources are never mixed. The quote fetch and the
 * financials chain run in parallel and are joined before merging.
 *
 * Never throws for provider trouble: with everything down the result is a zeroed record with
 * provenance none/none.
 */
@Slf4j
@Service
public class StockResolutionService {

  static final String CACHE_PREFIX = "full:";

  private static final String UNKNOWN_SECTOR = "Unknown";

  private final CacheStore cacheStore;
  private final RealtimeQuoteProvider realtimeProvider;
  private final List<FinancialsProvider> financialsProviders;
  private final Executor executor;

  public StockResolutionService(CacheStore cacheStore,
                                RealtimeQuoteProvider realtimeProvider,
                                List<FinancialsProvider> financialsProviders,
                                @Qualifier(AsyncConfig.PROVIDER_EXECUTOR) Executor executor) {
    this.cacheStore = cacheStore;
    this.realtimeProvider = realtimeProvider;
    this.financialsProviders = financialsProviders;
    this.executor = executor;
  }

  public MergedStockRecord resolve(String rawSymbol) {
    String symbol = Symbols.normalize(rawSymbol);
    String cacheKey = CACHE_PREFIX + symbol;

    Optional<MergedStockRecord> cached = cacheStore.get(cacheKey);
    if (cached.isPresent()) {
      return cached.get();
    }

    CompletableFuture<ProviderResult<RealtimeQuote>> quoteTask =
        submit(() -> realtimeProvider.fetchQuote(symbol));
    CompletableFuture<ProviderResult<FinancialSeries>> financialsTask =
        submit(() -> fetchFinancials(symbol));

    ProviderResult<RealtimeQuote> quote = await(quoteTask, symbol, "realtime");
    ProviderResult<FinancialSeries> financials = await(financialsTask, symbol, "financials");

    MergedStockRecord record = merge(symbol, quote, financials);

    log.info("[RESULT] {}: CMP={} MCap={}Cr PE={} PAT={}Cr Rev={}Cr ({} yrs from {})",
        symbol, record.getPrice(), record.getMcapCr(), record.getPe(),
        record.getLatestProfit(), record.getLatestRevenue(),
        record.getSource().getYearsAvailable(), record.getSource().getFinancials());

    cacheStore.put(cacheKey, CacheCategory.QUOTE, record);
    return record;
  }

  /**
   * Strict fallback: the next provider is consulted only when the previous one returned nothing.
   */
  ProviderResult<FinancialSeries> fetchFinancials(String symbol) {
    for (FinancialsProvider provider : financialsProviders) {
      ProviderResult<FinancialSeries> result;
      try {
        result = provider.fetchFinancials(symbol);
      } catch (RuntimeException e) {
        log.error("[{}] Unexpected failure for {}: {}", provider.getProviderName(), symbol, e.toString());
        result = ProviderResult.empty();
      }

      if (result.getValue().filter(series -> !series.isEmpty()).isPresent()) {
        return result;
      }
      log.info("[{}] No financials for {}", provider.getProviderName(), symbol);
    }
    return ProviderResult.empty();
  }

  MergedStockRecord merge(String symbol,
                          ProviderResult<RealtimeQuote> quoteResult,
                          ProviderResult<FinancialSeries> financialsResult) {
    RealtimeQuote quote = quoteResult.getValue().orElse(null);
    FinancialSeries series = financialsResult.getValue().orElse(null);
    List<FinancialYear> years = series != null ? series.getYears() : Collections.emptyList();

    BigDecimal price = quote != null ? orZero(quote.getPrice()) : BigDecimal.ZERO;
    BigDecimal mcapCrores = quote != null ? Crores.fromMarketCap(quote.getMarketCap()) : BigDecimal.ZERO;
    BigDecimal sharesCrores = sharesOutstandingCrores(price, mcapCrores);

    FinancialYear latest = years.isEmpty() ? null : years.get(0);

    SourceInfo source = SourceInfo.builder()
        .realtime(quoteResult.getSource())
        .financials(financialsResult.getSource())
        .yearsAvailable(years.size())
        .build();

    return MergedStockRecord.builder()
        .symbol(symbol)
        .name(quote != null ? quote.getCompanyName() : symbol)
        .sector(quote != null ? quote.getSector() : UNKNOWN_SECTOR)
        .industry(quote != null ? quote.getIndustry() : "")
        .price(price)
        .sharesCrores(sharesCrores.setScale(2, RoundingMode.HALF_UP))
        .mcapCr(mcapCrores.setScale(0, RoundingMode.HALF_UP))
        .pe(quote != null ? orZero(quote.getPeRatio()) : BigDecimal.ZERO)
        .eps(quote != null ? orZero(quote.getEps()) : BigDecimal.ZERO)
        .latestProfit(latest != null ? orZero(latest.getProfit()) : BigDecimal.ZERO)
        .latestRevenue(latest != null ? orZero(latest.getRevenue()) : BigDecimal.ZERO)
        .revenueCagr3y(CagrCalculator.cagr(years, FinancialMetric.REVENUE, 3).orElse(null))
        .revenueCagr5y(CagrCalculator.cagr(years, FinancialMetric.REVENUE, 5).orElse(null))
        .profitCagr3y(CagrCalculator.cagr(years, FinancialMetric.PROFIT, 3).orElse(null))
        .profitCagr5y(CagrCalculator.cagr(years, FinancialMetric.PROFIT, 5).orElse(null))
        .dayChange(quote != null ? orZero(quote.getChange()) : BigDecimal.ZERO)
        .dayChangePct(quote != null ? orZero(quote.getChangePercent()) : BigDecimal.ZERO)
        .yearHigh(quote != null ? orZero(quote.getYearHigh()) : BigDecimal.ZERO)
        .yearLow(quote != null ? orZero(quote.getYearLow()) : BigDecimal.ZERO)
        .volume(quote != null ? orZero(quote.getVolume()) : BigDecimal.ZERO)
        .bookValue(quote != null ? orZero(quote.getBookValue()) : BigDecimal.ZERO)
        .dividendYield(quote != null ? orZero(quote.getDividendYield()) : BigDecimal.ZERO)
        .years(years)
        .source(source)
        .build();
  }

  /**
   * Market cap over price; zero unless both are positive.
   */
  private static BigDecimal sharesOutstandingCrores(BigDecimal price, BigDecimal mcapCrores) {
    if (price.signum() > 0 && mcapCrores.signum() > 0) {
      return mcapCrores.divide(price, MathContext.DECIMAL64);
    }
    return BigDecimal.ZERO;
  }

  private <T> CompletableFuture<ProviderResult<T>> submit(Supplier<ProviderResult<T>> call) {
    try {
      return CompletableFuture.supplyAsync(call, executor);
    } catch (RejectedExecutionException e) {
      log.warn("Provider executor saturated, fetching on caller thread");
      return CompletableFuture.completedFuture(call.get());
    }
  }

  private <T> ProviderResult<T> await(CompletableFuture<ProviderResult<T>> task, String symbol, String branch) {
    try {
      ProviderResult<T> result = task.get();
      return result != null ? result : ProviderResult.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Interrupted waiting for {} data for {}", branch, symbol);
    } catch (ExecutionException e) {
      log.error("{} fetch failed for {}: {}", branch, symbol, String.valueOf(e.getCause()));
    }
    return ProviderResult.empty();
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }
}
