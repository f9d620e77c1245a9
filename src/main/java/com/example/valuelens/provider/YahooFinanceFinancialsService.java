package com.example.valuelens.provider;

import com.example.valuelens.config.ValueLensProperties;
import com.example.valuelens.model.Crores;
import com.example.valuelens.model.FinancialSeries;
import com.example.valuelens.model.FinancialYear;
import com.example.valuelens.model.ProviderResult;
import com.example.valuelens.model.SearchResult;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Yahoo Finance client. Fallback source of annual income statements, and fallback symbol search
 * that treats the query as a literal NSE ticker.
 *
 * Statements come from the fundamentals-timeseries endpoint: one series per line item, keyed by
 * period end date. Revenue and profit are picked per period from the configured line-item
 * preference lists, so schema drift on Yahoo's side is a configuration change.
 */
@Slf4j
@Service
@Order(2)
public class YahooFinanceFinancialsService implements FinancialsProvider, SymbolSearchProvider, DiagnosableProvider {

  public static final String PROVIDER_NAME = "yfinance";

  private static final String ANNUAL_PREFIX = "annual";
  private static final String PROBE_SYMBOL = "TCS";
  private static final String DEFAULT_EXCHANGE_TAG = "NSE";

  // Same fixed start Yahoo's own web client sends; earlier than any annual period on record
  private static final long TIMESERIES_START_EPOCH_SECONDS = 493590046L;

  private final ObjectMapper objectMapper;
  private final ValueLensProperties.Yahoo settings;
  private final HttpClient httpClient;

  public YahooFinanceFinancialsService(ObjectMapper objectMapper, ValueLensProperties properties) {
    this.objectMapper = objectMapper;
    this.settings = properties.getProviders().getYahoo();
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();
  }

  @Override
  public String getProviderName() {
    return PROVIDER_NAME;
  }

  @Override
  public ProviderResult<FinancialSeries> fetchFinancials(String symbol) {
    String ticker = toTicker(symbol);
    try {
      log.info("[YFINANCE] Fetching financials for {}", ticker);

      String url = String.format("%s/%s?symbol=%s&type=%s&period1=%d&period2=%d",
          settings.getTimeseriesUrl(), encode(ticker), encode(ticker), encode(statementTypes()),
          TIMESERIES_START_EPOCH_SECONDS, Instant.now().getEpochSecond());

      HttpResponse<String> response = get(url);
      if (response.statusCode() != 200) {
        log.warn("[YFINANCE] {} for {}", response.statusCode(), ticker);
        return ProviderResult.empty();
      }

      List<FinancialYear> years = parseIncomeStatement(response.body());
      if (years.isEmpty()) {
        log.warn("[YFINANCE] No financials for {}", ticker);
        return ProviderResult.empty();
      }

      FinancialSeries series = FinancialSeries.builder()
          .years(years)
          .sharesOutstanding(fetchSharesOutstanding(ticker))
          .build();
      return ProviderResult.found(series, PROVIDER_NAME);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("[YFINANCE ERROR] {}: interrupted", ticker);
    } catch (Exception e) {
      log.error("[YFINANCE ERROR] {}: {}", ticker, e.toString(), e);
    }
    return ProviderResult.empty();
  }

  @Override
  public List<SearchResult> search(String query) {
    String literal = query.trim().toUpperCase(Locale.ROOT);
    log.info("[YFINANCE SEARCH] Trying literal ticker {}", literal);

    return fetchQuoteNode(literal + settings.getDefaultSuffix())
        .filter(quote -> quote.path("regularMarketPrice").asDouble(0) != 0)
        .map(quote -> List.of(SearchResult.builder()
            .symbol(literal)
            .name(firstNonBlank(JsonValues.text(quote, "longName"), JsonValues.text(quote, "shortName"), literal))
            .exchange(firstNonBlank(JsonValues.text(quote, "sector"), DEFAULT_EXCHANGE_TAG))
            .build()))
        .orElse(Collections.emptyList());
  }

  @Override
  public Map<String, Object> probe() {
    Optional<FinancialSeries> series = fetchFinancials(PROBE_SYMBOL).getValue();

    Map<String, Object> status = new LinkedHashMap<>();
    status.put("working", series.isPresent());
    status.put("years", series.map(s -> s.getYears().size()).orElse(0));
    return status;
  }

  // =========================================================================
  // Response parsing
  // =========================================================================

  /**
   * Folds the per-line-item series into one row per period, most recent first.
   */
  List<FinancialYear> parseIncomeStatement(String json) throws IOException {
    JsonNode results = objectMapper.readTree(json).path("timeseries").path("result");
    if (!results.isArray()) {
      return Collections.emptyList();
    }

    Map<String, Map<String, BigDecimal>> lineItemsByPeriod = new TreeMap<>(Comparator.reverseOrder());
    for (JsonNode series : results) {
      String type = series.path("meta").path("type").path(0).asText("");
      if (!type.startsWith(ANNUAL_PREFIX)) continue;

      String lineItem = type.substring(ANNUAL_PREFIX.length());
      JsonNode points = series.path(type);
      if (!points.isArray()) continue;

      for (JsonNode point : points) {
        if (point == null || point.isNull()) continue;

        String period = point.path("asOfDate").asText("");
        JsonNode raw = point.path("reportedValue").path("raw");
        if (period.isEmpty() || !raw.isNumber() || !Double.isFinite(raw.asDouble())) continue;

        lineItemsByPeriod.computeIfAbsent(period, p -> new HashMap<>())
            .put(lineItem, raw.decimalValue());
      }
    }

    List<FinancialYear> years = new ArrayList<>();
    lineItemsByPeriod.forEach((period, lineItems) -> years.add(FinancialYear.builder()
        .year(period.length() >= 4 ? period.substring(0, 4) : period)
        .revenue(Crores.of(firstPresent(settings.getRevenueLineItems(), lineItems), 2))
        .profit(Crores.of(firstPresent(settings.getProfitLineItems(), lineItems), 2))
        .build()));
    return years;
  }

  private long fetchSharesOutstanding(String ticker) {
    return fetchQuoteNode(ticker)
        .map(quote -> quote.path("sharesOutstanding").asLong(0))
        .orElse(0L);
  }

  private Optional<JsonNode> fetchQuoteNode(String ticker) {
    try {
      HttpResponse<String> response = get(settings.getQuoteUrl() + "?symbols=" + encode(ticker));
      if (response.statusCode() != 200) {
        log.warn("[YFINANCE] Quote {} for {}", response.statusCode(), ticker);
        return Optional.empty();
      }

      JsonNode quote = objectMapper.readTree(response.body())
          .path("quoteResponse").path("result").path(0);
      return quote.isObject() ? Optional.of(quote) : Optional.empty();

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[YFINANCE] Quote lookup interrupted for {}", ticker);
    } catch (Exception e) {
      log.warn("[YFINANCE] Quote lookup failed for {}: {}", ticker, e.toString());
    }
    return Optional.empty();
  }

  private String toTicker(String symbol) {
    String upper = symbol.trim().toUpperCase(Locale.ROOT);
    return upper.contains(".") ? upper : upper + settings.getDefaultSuffix();
  }

  private String statementTypes() {
    return Stream.concat(settings.getRevenueLineItems().stream(), settings.getProfitLineItems().stream())
        .distinct()
        .map(item -> ANNUAL_PREFIX + item)
        .collect(Collectors.joining(","));
  }

  private static BigDecimal firstPresent(List<String> candidates, Map<String, BigDecimal> lineItems) {
    for (String candidate : candidates) {
      BigDecimal value = lineItems.get(candidate);
      if (value != null) {
        return value;
      }
    }
    return BigDecimal.ZERO;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return "";
  }

  private HttpResponse<String> get(String url) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Accept", "application/json")
        .header("User-Agent", "Mozilla/5.0")
        .GET()
        .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
        .build();

    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
