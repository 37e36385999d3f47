package io.vaultledger.holdersbackend.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Raw-to-human conversion. Only used when rendering responses. */
public final class Units {
  private Units() {}

  public static String formatUnits(BigInteger raw, int decimals) {
    if (raw == null) return null;
    if (decimals < 0) throw new IllegalArgumentException("decimals must be >= 0");
    if (decimals == 0) return raw.toString();
    BigDecimal v = new BigDecimal(raw).movePointLeft(decimals);
    String out = v.stripTrailingZeros().toPlainString();
    if ("-0".equals(out)) return "0";
    return out;
  }

  public static BigInteger parseRaw(String raw) {
    String s = raw == null ? "" : raw.trim();
    if (s.isBlank()) throw new NumberFormatException("empty integer");
    if (s.startsWith("0x")) return new BigInteger(s.substring(2), 16);
    // The indexer renders numeric columns as plain decimals, occasionally with a ".0" tail.
    if (s.indexOf('.') >= 0 || s.indexOf('e') >= 0 || s.indexOf('E') >= 0) {
      return new BigDecimal(s).toBigIntegerExact();
    }
    return new BigInteger(s);
  }
}
