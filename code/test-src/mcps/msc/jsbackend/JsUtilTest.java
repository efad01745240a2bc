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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class JsUtilTest {

  @Test
  public void testFormatIntegers() {
    assertEquals("0", JsUtil.formatNumber(0.0));
    assertEquals("0", JsUtil.formatNumber(-0.0));
    assertEquals("5", JsUtil.formatNumber(5.0));
    assertEquals("100", JsUtil.formatNumber(100.0));
    assertEquals("-42", JsUtil.formatNumber(-42.0));
    assertEquals("123456789012", JsUtil.formatNumber(123456789012.0));
  }

  @Test
  public void testFormatFractions() {
    assertEquals("0.25", JsUtil.formatNumber(0.25));
    assertEquals("3.14159", JsUtil.formatNumber(3.14159));
    assertEquals("0.000001", JsUtil.formatNumber(0.000001));
    assertEquals("0.1", JsUtil.formatNumber(0.1));
  }

  @Test
  public void testFormatExponents() {
    assertEquals("6.022e+23", JsUtil.formatNumber(6.022e23));
    assertEquals("4.56e-7", JsUtil.formatNumber(4.56e-7));
    assertEquals("1e+21", JsUtil.formatNumber(1e21));
    assertEquals("100000000000000000000", JsUtil.formatNumber(1e20));
    assertEquals("1e-7", JsUtil.formatNumber(1e-7));
  }

  @Test
  public void testFormatShortestDigits() {
    // The 17-digit forms of these are 1.9999999999999998e+23 etc.
    assertEquals("2e+23", JsUtil.formatNumber(2e23));
    assertEquals("1e+23", JsUtil.formatNumber(1e23));
    assertEquals("5e-324", JsUtil.formatNumber(Double.MIN_VALUE));
    assertEquals("1.7976931348623157e+308",
                 JsUtil.formatNumber(Double.MAX_VALUE));
    assertEquals("0.30000000000000004", JsUtil.formatNumber(0.1 + 0.2));
  }

  @Test
  public void testFormatSpecial() {
    assertEquals("NaN", JsUtil.formatNumber(Double.NaN));
    assertEquals("Infinity", JsUtil.formatNumber(Double.POSITIVE_INFINITY));
    assertEquals("-Infinity", JsUtil.formatNumber(Double.NEGATIVE_INFINITY));
  }

  @Test
  public void testJsonQuote() {
    assertEquals("\"plain\"", JsUtil.jsonQuote("plain"));
    assertEquals("\"a\\\"b\"", JsUtil.jsonQuote("a\"b"));
    assertEquals("\"line\\nnext\\ttab\"", JsUtil.jsonQuote("line\nnext\ttab"));
    assertEquals("\"back\\\\slash\"", JsUtil.jsonQuote("back\\slash"));
    assertEquals("\"\\u0001\"", JsUtil.jsonQuote("\u0001"));
    assertEquals("Single quotes need no escape", "\"it's\"",
                 JsUtil.jsonQuote("it's"));
  }

  @Test
  public void testIsIdentifier() {
    assertTrue(JsUtil.isIdentifier("name"));
    assertTrue(JsUtil.isIdentifier("_private"));
    assertTrue(JsUtil.isIdentifier("$el"));
    assertFalse(JsUtil.isIdentifier("two words"));
    assertFalse(JsUtil.isIdentifier("1st"));
    assertFalse(JsUtil.isIdentifier("content-type"));
    assertFalse(JsUtil.isIdentifier(""));
  }
}
