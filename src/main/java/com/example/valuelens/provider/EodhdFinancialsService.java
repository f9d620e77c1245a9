package com.example.valuelens.provider;

import com.example.valuelens.config.ValueLensProperties;
import com.example.valuelens.model.Crores;
import com.example.valuelens.model.FinancialSeries;
import com.example.valuelens.model.FinancialYear;
import com.example.valuelens.model.ProviderResult;
import com.example.valuelens.model.Symbols;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EOD Historical Data fundamentals client. Primary source of annual income statements.
 *
 * Paid API: enable by setting EODHD_API_KEY. Without a key every call returns empty and
 * resolution falls through to Yahoo Finance.
 */
@Slf4j
@Service
@Order(1)
public class EodhdFinancialsService implements FinancialsProvider, DiagnosableProvider {

  public static final String PROVIDER_NAME = "eodhd";

  private static final String PROBE_SYMBOL = "TCS";

  private final ObjectMapper objectMapper;
  private final ValueLensProperties.Eodhd settings;
  private final HttpClient httpClient;

  public EodhdFinancialsService(ObjectMapper objectMapper, ValueLensProperties properties) {
    this.objectMapper = objectMapper;
    this.settings = properties.getProviders().getEodhd();
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();
  }

  @PostConstruct
  public void init() {
    if (settings.isConfigured()) {
      log.info("EODHD financials enabled (key {}...)", keyPrefix());
    } else {
      log.info("EODHD API key not set - financials will come from Yahoo Finance");
    }
  }

  @Override
  public String getProviderName() {
    return PROVIDER_NAME;
  }

  @Override
  public ProviderResult<FinancialSeries> fetchFinancials(String symbol) {
    if (!settings.isConfigured()) {
      return ProviderResult.empty();
    }

    String ticker = Symbols.normalize(symbol) + settings.getExchangeSuffix();
    try {
      String url = String.format("%s/fundamentals/%s?api_token=%s&fmt=json&filter=Financials",
          settings.getBaseUrl(), encode(ticker), encode(settings.getApiKey()));
      log.info("[EODHD] Fetching {}", ticker);

      HttpResponse<String> response = get(url, settings.getTimeoutSeconds());
      if (response.statusCode() != 200) {
        log.warn("[EODHD] {} for {}", response.statusCode(), ticker);
        return ProviderResult.empty();
      }
      return parseFinancials(ticker, response.body());

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("[EODHD ERROR] {}: interrupted", ticker);
    } catch (Exception e) {
      log.error("[EODHD ERROR] {}: {}", ticker, e.toString());
    }
    return ProviderResult.empty();
  }

  @Override
  public Map<String, Object> probe() {
    Map<String, Object> status = new LinkedHashMap<>();
    if (!settings.isConfigured()) {
      status.put("configured", false);
      status.put("note", "Set EODHD_API_KEY env var to enable");
      return status;
    }

    try {
      String url = String.format("%s/eod/%s?api_token=%s&fmt=json&limit=1",
          settings.getBaseUrl(), encode(PROBE_SYMBOL + settings.getExchangeSuffix()), encode(settings.getApiKey()));
      HttpResponse<String> response = get(url, 10);
      status.put("working", response.statusCode() == 200);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      status.put("working", false);
      status.put("error", "interrupted");
    } catch (Exception e) {
      status.put("working", false);
      status.put("error", e.toString());
    }
    status.put("key_prefix", keyPrefix() + "...");
    return status;
  }

  /**
   * Reads {@code Financials.Income_Statement.yearly}; accepts the payload with or without the
   * outer {@code Financials} object since the filter parameter may already unwrap it.
   */
  ProviderResult<FinancialSeries> parseFinancials(String ticker, String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    JsonNode statements = root.has("Financials") ? root.path("Financials") : root;
    JsonNode yearly = statements.path("Income_Statement").path("yearly");

    if (!yearly.isObject() || yearly.isEmpty()) {
      log.warn("[EODHD] No income statement for {}", ticker);
      return ProviderResult.empty();
    }

    List<String> periods = new ArrayList<>();
    yearly.fieldNames().forEachRemaining(periods::add);
    periods.sort(Comparator.reverseOrder());

    List<FinancialYear> years = periods.stream()
        .limit(settings.getMaxYears())
        .map(period -> {
          JsonNode statement = yearly.path(period);
          return FinancialYear.builder()
              .year(period.length() >= 4 ? period.substring(0, 4) : period)
              .revenue(Crores.of(JsonValues.decimal(statement, "totalRevenue"), 2))
              .profit(Crores.of(JsonValues.decimal(statement, "netIncome"), 2))
              .build();
        })
        .toList();

    return ProviderResult.found(FinancialSeries.builder().years(years).build(), PROVIDER_NAME);
  }

  private String keyPrefix() {
    String key = settings.getApiKey();
    return key.substring(0, Math.min(5, key.length()));
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
