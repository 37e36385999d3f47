package io.vaultledger.holdersbackend.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class Addresses {
  public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

  private Addresses() {}

  public static boolean isValid(String address) {
    return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
  }

  /** Lower-cased address, or {@link IllegalArgumentException} when it is not a 20-byte hex address. */
  public static String normalize(String address) {
    String a = address == null ? "" : address.trim();
    if (!EVM_ADDRESS.matcher(a).matches()) {
      throw new IllegalArgumentException("address must be a valid EVM address: " + a);
    }
    return a.toLowerCase(Locale.ROOT);
  }

  public static List<String> normalizeAll(Collection<String> addresses) {
    Set<String> out = new LinkedHashSet<>();
    if (addresses == null) return List.of();
    for (String a : addresses) {
      out.add(normalize(a));
    }
    return List.copyOf(out);
  }

  public static boolean sameAddress(String a, String b) {
    return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
  }
}
