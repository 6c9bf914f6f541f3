package io.intellixity.activa.persistence.record;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Brings join keys to one representation so that parent and child values match regardless of
 * the driver's numeric type for the column.
 */
final class KeyNormalizer {
  private KeyNormalizer() {}

  static Object normalize(Object key) {
    if (key == null) return null;
    if (key instanceof Long) return key;
    if (key instanceof Integer || key instanceof Short || key instanceof Byte) {
      return ((Number) key).longValue();
    }
    if (key instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    if (key instanceof BigDecimal bd) {
      try {
        return bd.longValueExact();
      } catch (ArithmeticException notIntegral) {
        return bd.stripTrailingZeros();
      }
    }
    return key;
  }
}
