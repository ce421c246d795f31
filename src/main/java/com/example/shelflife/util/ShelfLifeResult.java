package com.example.shelflife.util;

public record ShelfLifeResult(double mlPrediction,
                              double arrheniusPrediction,
                              double hybridPrediction,
                              double alphaUsed,
                              double sensorTemperature,
                              double sensorHumidity,
                              int sensorSamples,
                              double sensorStability,
                              double mlPerformance) {
}
