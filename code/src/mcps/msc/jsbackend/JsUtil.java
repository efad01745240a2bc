/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package mcps.msc.jsbackend;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Lexical helpers for writing JavaScript source
 */
public class JsUtil {

  /** Significant digits that always identify a double */
  private static final int MAX_DIGITS = 17;

  private static final Pattern IDENTIFIER =
                  Pattern.compile("^[a-zA-Z_$][a-zA-Z0-9_$]*$");

  /**
   * @return true if s can be written as an unquoted property name
   */
  public static boolean isIdentifier(String s) {
    return IDENTIFIER.matcher(s).matches();
  }

  /**
   * Quote a string the way JSON.stringify does
   * @param unescaped
   * @return
   */
  public static String jsonQuote(String unescaped) {
    StringBuilder escaped = new StringBuilder(unescaped.length() + 2);
    escaped.append('"');
    for (int i = 0; i < unescaped.length(); i++) {
      char c = unescaped.charAt(i);
      switch (c) {
      case '"':
        escaped.append("\\\"");
        break;
      case '\\':
        escaped.append("\\\\");
        break;
      case '\b':
        escaped.append("\\b");
        break;
      case '\f':
        escaped.append("\\f");
        break;
      case '\n':
        escaped.append("\\n");
        break;
      case '\r':
        escaped.append("\\r");
        break;
      case '\t':
        escaped.append("\\t");
        break;
      default:
        if (c < 0x20) {
          escaped.append(String.format("\\u%04x", (int)c));
        } else {
          escaped.append(c);
        }
      }
    }
    escaped.append('"');
    return escaped.toString();
  }

  /**
   * Format a number the way JavaScript's Number.prototype.toString does
   * for radix 10.
   */
  public static String formatNumber(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    } else if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    } else if (value == 0.0) {
      // Covers -0 too
      return "0";
    }

    String sign = value < 0 ? "-" : "";
    BigDecimal dec = shortestDecimal(Math.abs(value));
    String digits = dec.unscaledValue().toString();
    int k = digits.length();
    int n = k - dec.scale();

    StringBuilder sb = new StringBuilder(sign);
    if (k <= n && n <= 21) {
      sb.append(digits);
      sb.append(StringUtils.repeat('0', n - k));
    } else if (0 < n && n <= 21) {
      sb.append(digits, 0, n);
      sb.append('.');
      sb.append(digits, n, k);
    } else if (-6 < n && n <= 0) {
      sb.append("0.");
      sb.append(StringUtils.repeat('0', -n));
      sb.append(digits);
    } else {
      sb.append(digits.charAt(0));
      if (k > 1) {
        sb.append('.');
        sb.append(digits, 1, k);
      }
      sb.append('e');
      int exp = n - 1;
      sb.append(exp >= 0 ? "+" : "-");
      sb.append(Math.abs(exp));
    }
    return sb.toString();
  }

  /**
   * Fewest significant digits that read back as exactly value.  Rounding
   * to nearest picks the closest candidate when several have that many
   * digits.
   * @param value positive and finite
   */
  static BigDecimal shortestDecimal(double value) {
    BigDecimal exact = new BigDecimal(value);
    for (int precision = 1; precision < MAX_DIGITS; precision++) {
      BigDecimal rounded = exact.round(
                  new MathContext(precision, RoundingMode.HALF_EVEN));
      if (rounded.doubleValue() == value) {
        return rounded.stripTrailingZeros();
      }
    }
    return exact.round(new MathContext(MAX_DIGITS, RoundingMode.HALF_EVEN))
                .stripTrailingZeros();
  }

}
