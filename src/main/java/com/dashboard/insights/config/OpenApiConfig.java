package com.dashboard.insights.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI dashboardInsightsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Dashboard Insights API")
                        .version("1.0.0")
                        .description(
                                "Statistical anomaly detection and trend analysis for business dashboard metrics.\n\n" +
                                "**Anomaly Pipeline:**\n" +
                                "1. Submit a dataset via `POST /anomalies/detect`\n" +
                                "2. Rows are sorted by the date column (when declared)\n" +
                                "3. Every metric column is checked by Z-score, IQR and moving-average deviation\n" +
                                "4. An Isolation Forest scores all metric columns together\n" +
                                "5. A row is a **consensus anomaly** when at least two detectors flag it\n\n" +
                                "**Trend Pipeline:**\n" +
                                "- `POST /trends/analyze`: direction, seasonality, growth, stationarity (ADF), " +
                                "peaks/troughs, seasonal decomposition and forecasts\n" +
                                "- `POST /trends/forecast`: Linear Trend, Exponential Smoothing (Holt-Winters) " +
                                "and ARIMA forecasts with per-model failure isolation\n\n" +
                                "**Distribution:** `POST /insights/summary` renders a plain-language and structured " +
                                "summary and hands it to the configured report sink.")
                        .contact(new Contact().name("Business Intelligence Team")));
    }
}
