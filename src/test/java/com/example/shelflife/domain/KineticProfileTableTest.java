package com.example.shelflife.domain;

import com.example.shelflife.exception.UnsupportedProductException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KineticProfileTableTest {

  private final KineticProfileTable table = KineticProfileTable.defaults();

  @Test
  void lookupIsCaseAndWhitespaceInsensitive() {
    assertThat(table.require("  Apple ").referenceShelfLifeDays()).isEqualTo(60.0);
    assertThat(table.require("POTATO").activationEnergy()).isEqualTo(60000.0);
    assertThat(table.products()).containsExactlyInAnyOrder("apple", "banana", "tomato", "mango", "potato");
  }

  @Test
  void unknownProductIsATypedFailure() {
    assertThat(table.find("durian")).isEmpty();
    assertThat(table.supports("durian")).isFalse();
    assertThatThrownBy(() -> table.require("Durian"))
        .isInstanceOf(UnsupportedProductException.class)
        .hasMessageContaining("durian");
  }

  @Test
  void rejectsDuplicateKeysAfterNormalization() {
    List<ProductKineticProfile> profiles = List.of(
        ProductKineticProfile.of("Kiwi", 50000, 1e8, 20),
        ProductKineticProfile.of("kiwi", 51000, 1e8, 21));

    assertThatThrownBy(() -> KineticProfileTable.of(profiles))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("kiwi");
  }

  @Test
  void profileValidatesConstants() {
    assertThatThrownBy(() -> ProductKineticProfile.of("kiwi", 0, 1e8, 20))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProductKineticProfile.of(" ", 50000, 1e8, 20))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProductKineticProfile.of("kiwi", 50000, 1e8, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void tableIsImmutable() {
    assertThatThrownBy(() -> table.products().add("kiwi"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
