package com.example.shelflife.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionHistoryEntry {
  private String batchId;

  private String product;

  private double temperatureC;
  private double humidityPercent;

  private Double mlPrediction;
  private Double arrheniusPrediction;
  private Double hybridPrediction;
  private double alphaUsed;

  private int sensorSamples;

  // set later by external curation once the batch's real shelf life is known
  private Double actualShelfLifeDays;
  private Instant actualRecordedAt;

  private Instant createdAt = Instant.now();

  @JsonIgnore
  public boolean isValidated() {
    return actualShelfLifeDays != null && actualShelfLifeDays > 0;
  }
}
