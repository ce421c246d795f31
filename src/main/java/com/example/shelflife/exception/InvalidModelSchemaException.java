package com.example.shelflife.exception;

/**
 * The regression model does not declare a usable feature schema. Indicates a misconfigured
 * deployment, so callers should not retry.
 */
public class InvalidModelSchemaException extends ShelfLifeException {
  public InvalidModelSchemaException(String message) {
    super(message);
  }

  public InvalidModelSchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
