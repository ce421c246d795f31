package com.example.shelflife.domain;

import com.example.shelflife.exception.UnsupportedProductException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of kinetic profiles keyed by normalized product name.
 */
public final class KineticProfileTable {
  private static final List<ProductKineticProfile> DEFAULT_PROFILES = List.of(
      ProductKineticProfile.of("apple", 70000.0, 2.0e11, 60),
      ProductKineticProfile.of("banana", 62000.0, 9.0e9, 14),
      ProductKineticProfile.of("tomato", 36000.0, 1.5e5, 14),
      ProductKineticProfile.of("mango", 46000.0, 2.5e7, 12),
      ProductKineticProfile.of("potato", 60000.0, 4.0e10, 90)
  );

  private final Map<String, ProductKineticProfile> profiles;

  private KineticProfileTable(Map<String, ProductKineticProfile> profiles) {
    this.profiles = profiles;
  }

  public static KineticProfileTable defaults() {
    return of(DEFAULT_PROFILES);
  }

  public static KineticProfileTable of(Collection<ProductKineticProfile> source) {
    if (source == null || source.isEmpty()) {
      throw new IllegalArgumentException("At least one kinetic profile is required");
    }
    Map<String, ProductKineticProfile> byKey = new LinkedHashMap<>();
    for (ProductKineticProfile profile : source) {
      String key = normalize(profile.product());
      if (byKey.putIfAbsent(key, profile) != null) {
        throw new IllegalArgumentException("Duplicate kinetic profile for product '" + key + "'");
      }
    }
    return new KineticProfileTable(Map.copyOf(byKey));
  }

  public static String normalize(String product) {
    return product == null ? "" : product.trim().toLowerCase(Locale.ROOT);
  }

  public Optional<ProductKineticProfile> find(String product) {
    return Optional.ofNullable(profiles.get(normalize(product)));
  }

  public ProductKineticProfile require(String product) {
    return find(product).orElseThrow(() -> new UnsupportedProductException(normalize(product)));
  }

  public boolean supports(String product) {
    return profiles.containsKey(normalize(product));
  }

  public Set<String> products() {
    return profiles.keySet();
  }
}
