package com.example.shelflife.util;

import com.example.shelflife.domain.EnvironmentalReading;

import java.util.List;

public record ShelfLifeRequest(String productType,
                               double temperatureC,
                               double humidityPercent,
                               List<EnvironmentalReading> readings,
                               Double alphaOverride,
                               String batchId) {
  public ShelfLifeRequest {
    readings = readings == null ? List.of() : List.copyOf(readings);
  }

  public static ShelfLifeRequest of(String productType, double temperatureC, double humidityPercent) {
    return new ShelfLifeRequest(productType, temperatureC, humidityPercent, List.of(), null, null);
  }

  public static ShelfLifeRequest fromContext(String productType, EnvironmentalContext context,
                                             Double alphaOverride, String batchId) {
    return new ShelfLifeRequest(productType, context.temperatureC(), context.humidityPercent(),
        context.readings(), alphaOverride, batchId);
  }
}
