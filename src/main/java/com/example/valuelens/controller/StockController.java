package com.example.valuelens.controller;

import com.example.valuelens.model.BatchQuoteRequest;
import com.example.valuelens.model.MergedStockRecord;
import com.example.valuelens.model.QuoteSummary;
import com.example.valuelens.model.SearchResult;
import com.example.valuelens.service.BatchQuoteService;
import com.example.valuelens.service.StockResolutionService;
import com.example.valuelens.service.SymbolSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for stock lookups.
 *
 * Endpoints:
 * - GET /api/search?q={query} - Search for symbols
 * - GET /api/fullstock/{symbol} - Merged quote and financials for one symbol
 * - POST /api/batch-quotes - Lightweight quotes for up to 20 symbols
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StockController {

  private final StockResolutionService stockResolutionService;
  private final BatchQuoteService batchQuoteService;
  private final SymbolSearchService symbolSearchService;

  @GetMapping("/search")
  public ResponseEntity<List<SearchResult>> search(
      @RequestParam(value = "q", required = false, defaultValue = "") String query) {
    log.debug("Symbol search request: '{}'", query);
    return ResponseEntity.ok(symbolSearchService.search(query));
  }

  @GetMapping("/fullstock/{symbol}")
  public ResponseEntity<MergedStockRecord> fullStock(@PathVariable String symbol) {
    return ResponseEntity.ok(stockResolutionService.resolve(symbol));
  }

  @PostMapping("/batch-quotes")
  public ResponseEntity<List<QuoteSummary>> batchQuotes(
      @RequestBody(required = false) BatchQuoteRequest request) {
    List<String> symbols = request != null ? request.getSymbols() : null;
    return ResponseEntity.ok(batchQuoteService.quotes(symbols));
  }
}
