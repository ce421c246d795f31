package com.example.shelflife.exception;

public class UnsupportedProductException extends ShelfLifeException {
  private final String product;

  public UnsupportedProductException(String product) {
    super("Unsupported product type '" + product + "' for shelf-life prediction");
    this.product = product;
  }

  public String getProduct() {
    return product;
  }
}
