package io.vaultledger.holdersbackend.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AddressesTest {
  private static final String CHECKSUMMED = "0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045";

  @Test
  void normalizesToLowerCase() {
    assertEquals(CHECKSUMMED.toLowerCase(), Addresses.normalize(" " + CHECKSUMMED + " "));
    assertThrows(IllegalArgumentException.class, () -> Addresses.normalize("0x123"));
  }

  @Test
  void normalizeAllDropsDuplicates() {
    assertEquals(
        List.of(CHECKSUMMED.toLowerCase()),
        Addresses.normalizeAll(List.of(CHECKSUMMED, CHECKSUMMED.toLowerCase())));
  }

  @Test
  void comparesIgnoringCase() {
    assertTrue(Addresses.sameAddress(CHECKSUMMED, CHECKSUMMED.toLowerCase()));
    assertFalse(Addresses.sameAddress(CHECKSUMMED, null));
  }
}
