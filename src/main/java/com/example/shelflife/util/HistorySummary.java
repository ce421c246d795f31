package com.example.shelflife.util;

public record HistorySummary(int entries,
                             Double recentAlpha,
                             Double recentMlPrediction) {
  public static HistorySummary empty() {
    return new HistorySummary(0, null, null);
  }
}
