package com.example.shelflife.exception;

public class MissingEnvironmentalDataException extends ShelfLifeException {
  public MissingEnvironmentalDataException(String batchId) {
    super("No temperature/humidity data is available for batch '" + batchId
        + "'. Provide overrides or ingest sensor data first.");
  }
}
