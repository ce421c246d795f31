package com.example.shelflife.util;

import com.example.shelflife.domain.EnvironmentalReading;

import java.util.List;

public record EnvironmentalContext(double temperatureC,
                                   double humidityPercent,
                                   List<EnvironmentalReading> readings) {
}
