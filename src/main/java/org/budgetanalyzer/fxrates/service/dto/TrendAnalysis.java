package org.budgetanalyzer.fxrates.service.dto;

import org.budgetanalyzer.fxrates.domain.RateSeries;
import org.budgetanalyzer.fxrates.domain.Trend;

/** Trend of a currency pair together with the series it was computed from. */
public record TrendAnalysis(Trend trend, RateSeries series) {}
