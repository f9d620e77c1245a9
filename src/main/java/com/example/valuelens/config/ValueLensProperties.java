package com.example.valuelens.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Upstream provider, cache and executor settings. Documented in application.yml under valuelens.
 */
@ConfigurationProperties(prefix = "valuelens")
@Getter
@Setter
public class ValueLensProperties {

    private Providers providers = new Providers();

    private Cache cache = new Cache();

    private Executor executor = new Executor();

    @Getter
    @Setter
    public static class Providers {
        private Isma isma = new Isma();
        private Eodhd eodhd = new Eodhd();
        private Yahoo yahoo = new Yahoo();
    }

    /**
     * Indian Stock Market API: realtime quotes, search and batch quotes. Free, no key, INR.
     */
    @Getter
    @Setter
    public static class Isma {
        private String baseUrl = "https://military-jobye-haiqstudios-14f59639.koyeb.app";
        private int timeoutSeconds = 15;
        private int searchTimeoutSeconds = 10;
        private int maxSearchResults = 15;
    }

    /**
     * EOD Historical Data fundamentals. Disabled while {@code apiKey} is blank.
     */
    @Getter
    @Setter
    public static class Eodhd {
        private String apiKey = "";
        private String baseUrl = "https://eodhd.com/api";
        private int timeoutSeconds = 20;
        private int maxYears = 10;
        private String exchangeSuffix = ".NSE";

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Yahoo {
        private String timeseriesUrl = "https://query2.finance.yahoo.com/ws/fundamentals-timeseries/v1/finance/timeseries";
        private String quoteUrl = "https://query1.finance.yahoo.com/v7/finance/quote";
        private int timeoutSeconds = 15;
        private String defaultSuffix = ".NS";

        /**
         * Income statement line items tried in order for revenue; first present value wins.
         */
        private List<String> revenueLineItems = new ArrayList<>(List.of("TotalRevenue", "OperatingRevenue"));

        /**
         * Income statement line items tried in order for profit after tax.
         */
        private List<String> profitLineItems = new ArrayList<>(List.of(
                "NetIncome", "NetIncomeCommonStockholders", "NetIncomeContinuousOperations"));
    }

    @Getter
    @Setter
    public static class Cache {
        private Duration quoteTtl = Duration.ofSeconds(300);
        private Duration searchTtl = Duration.ofSeconds(86400);
    }

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 0;
    }
}
