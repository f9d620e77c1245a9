package com.example.valuelens.service;

import com.example.valuelens.MutableClock;
import com.example.valuelens.cache.CacheStore;
import com.example.valuelens.config.ValueLensProperties;
import com.example.valuelens.model.FinancialSeries;
import com.example.valuelens.model.FinancialYear;
import com.example.valuelens.model.MergedStockRecord;
import com.example.valuelens.model.ProviderResult;
import com.example.valuelens.model.RealtimeQuote;
import com.example.valuelens.provider.FinancialsProvider;
import com.example.valuelens.provider.RealtimeQuoteProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StockResolutionServiceTest {

    @Mock
    private RealtimeQuoteProvider realtimeProvider;

    @Mock
    private FinancialsProvider primaryFinancials;

    @Mock
    private FinancialsProvider secondaryFinancials;

    private MutableClock clock;
    private StockResolutionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T09:15:00Z"));
        CacheStore cacheStore = new CacheStore(new ValueLensProperties(), clock);
        service = new StockResolutionService(cacheStore, realtimeProvider,
                List.of(primaryFinancials, secondaryFinancials), Runnable::run);
    }

    @Test
    @DisplayName("every provider empty yields a zeroed record with none/none provenance")
    void allProvidersEmpty() {
        when(realtimeProvider.fetchQuote("TCS")).thenReturn(ProviderResult.empty());
        when(primaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());
        when(secondaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());

        MergedStockRecord record = service.resolve("tcs.ns");

        assertThat(record.getSymbol()).isEqualTo("TCS");
        assertThat(record.getName()).isEqualTo("TCS");
        assertThat(record.getSector()).isEqualTo("Unknown");
        assertThat(record.getPrice()).isEqualByComparingTo("0");
        assertThat(record.getMcapCr()).isEqualByComparingTo("0");
        assertThat(record.getSharesCrores()).isEqualByComparingTo("0");
        assertThat(record.getLatestRevenue()).isEqualByComparingTo("0");
        assertThat(record.getLatestProfit()).isEqualByComparingTo("0");
        assertThat(record.getRevenueCagr3y()).isNull();
        assertThat(record.getProfitCagr5y()).isNull();
        assertThat(record.getYears()).isEmpty();
        assertThat(record.getSource().getRealtime()).isEqualTo("none");
        assertThat(record.getSource().getFinancials()).isEqualTo("none");
        assertThat(record.getSource().getYearsAvailable()).isZero();
    }

    @Test
    @DisplayName("providers throwing despite their contract still yield a record")
    void providersThrowing() {
        when(realtimeProvider.fetchQuote("TCS")).thenThrow(new IllegalStateException("socket closed"));
        when(primaryFinancials.fetchFinancials("TCS")).thenThrow(new IllegalStateException("bad schema"));
        when(secondaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());

        MergedStockRecord record = service.resolve("TCS");

        assertThat(record.getSource().getRealtime()).isEqualTo("none");
        assertThat(record.getSource().getFinancials()).isEqualTo("none");
        verify(secondaryFinancials).fetchFinancials("TCS");
    }

    @Test
    @DisplayName("primary financials with data means the secondary is never called")
    void primaryWins() {
        when(realtimeProvider.fetchQuote("INFY")).thenReturn(ProviderResult.empty());
        when(primaryFinancials.fetchFinancials("INFY"))
                .thenReturn(ProviderResult.found(series(0, year("2024", "100", "10")), "eodhd"));

        MergedStockRecord record = service.resolve("INFY");

        assertThat(record.getSource().getFinancials()).isEqualTo("eodhd");
        verify(secondaryFinancials, never()).fetchFinancials(anyString());
    }

    @Test
    @DisplayName("empty primary financials falls back to the secondary exactly once")
    void secondaryFallback() {
        when(realtimeProvider.fetchQuote("INFY")).thenReturn(ProviderResult.empty());
        when(primaryFinancials.fetchFinancials("INFY")).thenReturn(ProviderResult.empty());
        when(secondaryFinancials.fetchFinancials("INFY"))
                .thenReturn(ProviderResult.found(series(0, year("2024", "100", "10")), "yfinance"));

        MergedStockRecord record = service.resolve("INFY");

        assertThat(record.getSource().getFinancials()).isEqualTo("yfinance");
        assertThat(record.getSource().getYearsAvailable()).isEqualTo(1);
        verify(primaryFinancials, times(1)).fetchFinancials("INFY");
        verify(secondaryFinancials, times(1)).fetchFinancials("INFY");
    }

    @Test
    @DisplayName("a primary series with no years counts as no data")
    void emptySeriesFallsThrough() {
        when(realtimeProvider.fetchQuote("INFY")).thenReturn(ProviderResult.empty());
        when(primaryFinancials.fetchFinancials("INFY")).thenReturn(ProviderResult.found(series(0), "eodhd"));
        when(secondaryFinancials.fetchFinancials("INFY")).thenReturn(ProviderResult.empty());

        MergedStockRecord record = service.resolve("INFY");

        assertThat(record.getSource().getFinancials()).isEqualTo("none");
        verify(secondaryFinancials).fetchFinancials("INFY");
    }

    @Test
    @DisplayName("merged record derives crores, shares and CAGR from both sources")
    void derivedFields() {
        when(realtimeProvider.fetchQuote("TCS"))
                .thenReturn(ProviderResult.found(quote("250", "5000000000"), "isma"));
        when(primaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.found(series(0,
                year("2024", "200", "50"),
                year("2023", "180", "40"),
                year("2022", "160", "30"),
                year("2021", "100", "25"),
                year("2020", "90", "20"),
                year("2019", "80", "10")), "eodhd"));

        MergedStockRecord record = service.resolve("TCS");

        assertThat(record.getName()).isEqualTo("Tata Consultancy Services");
        assertThat(record.getSector()).isEqualTo("Information Technology");
        assertThat(record.getPrice()).isEqualByComparingTo("250");
        assertThat(record.getMcapCr()).isEqualByComparingTo("500");
        assertThat(record.getSharesCrores()).isEqualByComparingTo("2.00");
        assertThat(record.getLatestRevenue()).isEqualByComparingTo("200");
        assertThat(record.getLatestProfit()).isEqualByComparingTo("50");
        assertThat(record.getRevenueCagr3y()).isEqualByComparingTo("26.0");
        assertThat(record.getRevenueCagr5y()).isEqualByComparingTo("20.1");
        assertThat(record.getProfitCagr3y()).isEqualByComparingTo("26.0");
        assertThat(record.getProfitCagr5y()).isEqualByComparingTo("38.0");
        assertThat(record.getSource().getRealtime()).isEqualTo("isma");
        assertThat(record.getSource().getYearsAvailable()).isEqualTo(6);
    }

    @Test
    @DisplayName("small market cap is taken as already in crores")
    void marketCapAlreadyInCrores() {
        when(realtimeProvider.fetchQuote("TINY")).thenReturn(ProviderResult.found(quote("50", "500"), "isma"));
        when(primaryFinancials.fetchFinancials("TINY")).thenReturn(ProviderResult.empty());
        when(secondaryFinancials.fetchFinancials("TINY")).thenReturn(ProviderResult.empty());

        MergedStockRecord record = service.resolve("TINY");

        assertThat(record.getMcapCr()).isEqualByComparingTo("500");
        assertThat(record.getSharesCrores()).isEqualByComparingTo("10.00");
    }

    @Test
    @DisplayName("without a price, shares stay zero even when the financials provider reports a count")
    void sharesZeroWithoutPrice() {
        when(realtimeProvider.fetchQuote("TCS")).thenReturn(ProviderResult.empty());
        when(primaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());
        when(secondaryFinancials.fetchFinancials("TCS"))
                .thenReturn(ProviderResult.found(series(3_618_087_518L, year("2024", "240893", "46099")), "yfinance"));

        MergedStockRecord record = service.resolve("TCS");

        assertThat(record.getSharesCrores()).isEqualByComparingTo("0");
        assertThat(record.getSource().getRealtime()).isEqualTo("none");
        assertThat(record.getSource().getFinancials()).isEqualTo("yfinance");
    }

    @Test
    @DisplayName("second resolution within TTL is served from cache without upstream calls")
    void cachedWithinTtl() {
        when(realtimeProvider.fetchQuote("TCS")).thenReturn(ProviderResult.found(quote("250", "5000000000"), "isma"));
        when(primaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());
        when(secondaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());

        MergedStockRecord first = service.resolve("TCS");
        clock.advance(Duration.ofSeconds(120));
        MergedStockRecord second = service.resolve("tcs.ns");

        assertThat(second).isSameAs(first);
        verify(realtimeProvider, times(1)).fetchQuote(anyString());
        verify(primaryFinancials, times(1)).fetchFinancials(anyString());
        verify(secondaryFinancials, times(1)).fetchFinancials(anyString());
    }

    @Test
    @DisplayName("after the quote TTL elapses providers are called again")
    void refetchedAfterTtl() {
        when(realtimeProvider.fetchQuote("TCS")).thenReturn(ProviderResult.found(quote("250", "5000000000"), "isma"));
        when(primaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());
        when(secondaryFinancials.fetchFinancials("TCS")).thenReturn(ProviderResult.empty());

        service.resolve("TCS");
        clock.advance(Duration.ofSeconds(301));
        service.resolve("TCS");

        verify(realtimeProvider, times(2)).fetchQuote("TCS");
        verify(primaryFinancials, times(2)).fetchFinancials("TCS");
    }

    private static RealtimeQuote quote(String price, String marketCap) {
        return RealtimeQuote.builder()
                .symbol("TCS")
                .companyName("Tata Consultancy Services")
                .sector("Information Technology")
                .industry("IT Services & Consulting")
                .price(new BigDecimal(price))
                .marketCap(new BigDecimal(marketCap))
                .peRatio(new BigDecimal("29.4"))
                .eps(new BigDecimal("134.2"))
                .change(new BigDecimal("12.5"))
                .changePercent(new BigDecimal("0.32"))
                .yearHigh(new BigDecimal("4592.25"))
                .yearLow(new BigDecimal("3311.00"))
                .volume(new BigDecimal("1843221"))
                .bookValue(new BigDecimal("250.1"))
                .dividendYield(new BigDecimal("1.2"))
                .build();
    }

    private static FinancialSeries series(long sharesOutstanding, FinancialYear... years) {
        return FinancialSeries.builder()
                .years(List.of(years))
                .sharesOutstanding(sharesOutstanding)
                .build();
    }

    private static FinancialYear year(String year, String revenue, String profit) {
        return FinancialYear.builder()
                .year(year)
                .revenue(new BigDecimal(revenue))
                .profit(new BigDecimal(profit))
                .build();
    }
}
