package com.example.valuelens.provider;

import com.example.valuelens.config.ValueLensProperties;
import com.example.valuelens.model.Crores;
import com.example.valuelens.model.ProviderResult;
import com.example.valuelens.model.QuoteSummary;
import com.example.valuelens.model.RealtimeQuote;
import com.example.valuelens.model.SearchResult;
import com.example.valuelens.model.Symbols;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Indian Stock Market API client.
 * Realtime quotes, symbol search and batch quotes for NSE/BSE equities, prices in INR.
 *
 * The API is free and keyless but hosted on a hobby tier, so timeouts and 5xx responses are
 * routine. Every call degrades to an empty result.
 */
@Slf4j
@Service
@Order(1)
public class IsmaMarketDataService implements RealtimeQuoteProvider, SymbolSearchProvider, DiagnosableProvider {

  public static final String PROVIDER_NAME = "isma";

  private static final String PROBE_SYMBOL = "TCS";
  private static final String SEARCH_EXCHANGE_TAG = "NSE";

  private final ObjectMapper objectMapper;
  private final ValueLensProperties.Isma settings;
  private final HttpClient httpClient;

  public IsmaMarketDataService(ObjectMapper objectMapper, ValueLensProperties properties) {
    this.objectMapper = objectMapper;
    this.settings = properties.getProviders().getIsma();
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();
  }

  @Override
  public String getProviderName() {
    return PROVIDER_NAME;
  }

  @Override
  public ProviderResult<RealtimeQuote> fetchQuote(String symbol) {
    String clean = Symbols.normalize(symbol);
    try {
      String url = settings.getBaseUrl() + "/stock?symbol=" + encode(clean) + "&res=num";
      log.info("[ISMA] Fetching {}", clean);

      HttpResponse<String> response = get(url, settings.getTimeoutSeconds());
      if (response.statusCode() != 200) {
        log.warn("[ISMA] {} for {}", response.statusCode(), clean);
        return ProviderResult.empty();
      }
      return parseQuote(clean, response.body());

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("[ISMA ERROR] {}: interrupted", clean);
    } catch (Exception e) {
      log.error("[ISMA ERROR] {}: {}", clean, e.toString());
    }
    return ProviderResult.empty();
  }

  @Override
  public List<SearchResult> search(String query) {
    try {
      String url = settings.getBaseUrl() + "/search?query=" + encode(query);
      log.info("[ISMA SEARCH] {}", query);

      HttpResponse<String> response = get(url, settings.getSearchTimeoutSeconds());
      if (response.statusCode() != 200) {
        log.warn("[ISMA SEARCH] {} for '{}'", response.statusCode(), query);
        return Collections.emptyList();
      }
      return parseSearchResults(response.body());

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("[ISMA SEARCH ERROR] '{}': interrupted", query);
    } catch (Exception e) {
      log.error("[ISMA SEARCH ERROR] '{}': {}", query, e.toString());
    }
    return Collections.emptyList();
  }

  @Override
  public List<QuoteSummary> fetchBatch(List<String> symbols) {
    if (symbols == null || symbols.isEmpty()) {
      return Collections.emptyList();
    }

    try {
      String url = settings.getBaseUrl() + "/stock/list?symbols=" + encode(String.join(",", symbols)) + "&res=num";
      log.info("[BATCH] Fetching {} stocks", symbols.size());

      HttpResponse<String> response = get(url, settings.getTimeoutSeconds());
      if (response.statusCode() != 200) {
        log.warn("[BATCH] {} for {}", response.statusCode(), symbols);
        return Collections.emptyList();
      }
      return parseBatch(response.body());

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("[BATCH ERROR] {}: interrupted", symbols);
    } catch (Exception e) {
      log.error("[BATCH ERROR] {}: {}", symbols, e.toString());
    }
    return Collections.emptyList();
  }

  @Override
  public Map<String, Object> probe() {
    RealtimeQuote quote = fetchQuote(PROBE_SYMBOL).getValue().orElse(null);

    Map<String, Object> status = new LinkedHashMap<>();
    status.put("working", quote != null && quote.getPrice().signum() > 0);
    status.put("tcs_cmp", quote != null ? quote.getPrice() : BigDecimal.ZERO);
    status.put("tcs_mcap_cr", quote != null ? Crores.of(quote.getMarketCap(), 0) : BigDecimal.ZERO);
    status.put("tcs_pe", quote != null ? quote.getPeRatio() : BigDecimal.ZERO);
    return status;
  }

  // =========================================================================
  // Response parsing
  // =========================================================================

  ProviderResult<RealtimeQuote> parseQuote(String symbol, String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    if (!"success".equals(root.path("status").asText())) {
      log.warn("[ISMA] Non-success status '{}' for {}", root.path("status").asText(), symbol);
      return ProviderResult.empty();
    }

    JsonNode d = root.path("data");
    if (!d.isObject()) {
      log.warn("[ISMA] No data object in response for {}", symbol);
      return ProviderResult.empty();
    }

    RealtimeQuote quote = RealtimeQuote.builder()
        .symbol(symbol)
        .price(JsonValues.decimal(d, "last_price"))
        .marketCap(JsonValues.decimal(d, "market_cap"))
        .peRatio(JsonValues.decimal(d, "pe_ratio"))
        .eps(JsonValues.decimal(d, "earnings_per_share"))
        .sector(JsonValues.text(d, "sector"))
        .industry(JsonValues.text(d, "industry"))
        .companyName(JsonValues.text(d, "company_name"))
        .change(JsonValues.decimal(d, "change"))
        .changePercent(JsonValues.decimal(d, "percent_change"))
        .yearHigh(JsonValues.decimal(d, "year_high"))
        .yearLow(JsonValues.decimal(d, "year_low"))
        .volume(JsonValues.decimal(d, "volume"))
        .bookValue(JsonValues.decimal(d, "book_value"))
        .dividendYield(JsonValues.decimal(d, "dividend_yield"))
        .build();

    return ProviderResult.found(quote, PROVIDER_NAME);
  }

  List<SearchResult> parseSearchResults(String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    if (!"success".equals(root.path("status").asText())) {
      return Collections.emptyList();
    }

    List<SearchResult> results = new ArrayList<>();
    JsonNode items = root.path("results");
    if (items.isArray()) {
      for (JsonNode item : items) {
        if (results.size() >= settings.getMaxSearchResults()) break;

        results.add(SearchResult.builder()
            .symbol(JsonValues.text(item, "symbol"))
            .name(JsonValues.text(item, "company_name"))
            .exchange(SEARCH_EXCHANGE_TAG)
            .build());
      }
    }
    return results;
  }

  List<QuoteSummary> parseBatch(String json) throws IOException {
    JsonNode stocks = objectMapper.readTree(json).path("stocks");

    List<QuoteSummary> results = new ArrayList<>();
    if (stocks.isArray()) {
      for (JsonNode s : stocks) {
        results.add(QuoteSummary.builder()
            .symbol(JsonValues.text(s, "symbol"))
            .name(JsonValues.text(s, "company_name"))
            .price(JsonValues.decimal(s, "last_price"))
            .pe(JsonValues.decimal(s, "pe_ratio"))
            .mcapCr(Crores.of(JsonValues.decimal(s, "market_cap"), 0))
            .dayChangePct(JsonValues.decimal(s, "percent_change"))
            .build());
      }
    }
    return results;
  }

  private HttpResponse<String> get(String url, int timeoutSeconds) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Accept", "application/json")
        .GET()
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .build();

    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
