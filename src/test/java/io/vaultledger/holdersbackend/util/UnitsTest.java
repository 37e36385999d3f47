package io.vaultledger.holdersbackend.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class UnitsTest {

  @Test
  void formatsRawAmounts() {
    assertEquals("1.5", Units.formatUnits(new BigInteger("1500000000000000000"), 18));
    assertEquals("0.000001", Units.formatUnits(BigInteger.ONE, 6));
    assertEquals("0", Units.formatUnits(BigInteger.ZERO, 18));
    assertEquals("42", Units.formatUnits(BigInteger.valueOf(42), 0));
  }

  @Test
  void parsesIndexerNumerics() {
    assertEquals(BigInteger.valueOf(12), Units.parseRaw("12"));
    assertEquals(BigInteger.valueOf(12), Units.parseRaw("12.0"));
    assertEquals(BigInteger.valueOf(16), Units.parseRaw("0x10"));
    assertEquals(new BigInteger("1000000000000000000000"), Units.parseRaw("1e21"));
    assertThrows(ArithmeticException.class, () -> Units.parseRaw("1.5"));
    assertThrows(NumberFormatException.class, () -> Units.parseRaw(" "));
  }
}
