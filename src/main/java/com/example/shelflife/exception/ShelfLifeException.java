package com.example.shelflife.exception;

/**
 * Base type for failures that reject a single shelf-life request.
 */
public class ShelfLifeException extends RuntimeException {
  public ShelfLifeException(String message) {
    super(message);
  }

  public ShelfLifeException(String message, Throwable cause) {
    super(message, cause);
  }
}
