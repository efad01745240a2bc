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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.frontend.tree.Expression;
import mcps.msc.frontend.tree.Expression.ArrayLit;
import mcps.msc.frontend.tree.Expression.Identifier;
import mcps.msc.frontend.tree.Expression.Member;
import mcps.msc.frontend.tree.Expression.ObjectLit;
import mcps.msc.frontend.tree.Expression.Property;

/**
 * Compile-time values of declaration configurations.
 *
 * Values are String, Double, Boolean, List and Map.  Java null stands
 * for a value that can't be known at compile time, written as undefined.
 * Identifiers evaluate to their own name and env.X to the string "env.X".
 */
public class ConfigValues {

  private static final String ENV_PREFIX = "env.";

  private static final Pattern PLAIN_KEY =
                          Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

  /**
   * @return key to value.  A repeated key keeps its first position and
   *        takes its last value, as in a JavaScript object literal.
   */
  public static Map<String, Object> extract(ObjectLit obj) {
    Map<String, Object> result = new LinkedHashMap<String, Object>();
    for (Property prop: obj.getProperties()) {
      result.put(prop.getKey(), extractValue(prop.getValue()));
    }
    return result;
  }

  public static Object extractValue(Expression expr) {
    switch (expr.kind()) {
      case STRING:
        return ((Expression.StringLit)expr).getValue();
      case NUMBER:
        return ((Expression.NumberLit)expr).getValue();
      case BOOLEAN:
        return ((Expression.BooleanLit)expr).getValue();
      case ARRAY: {
        List<Object> elems = new ArrayList<Object>();
        for (Expression e: ((ArrayLit)expr).getElements()) {
          elems.add(extractValue(e));
        }
        return elems;
      }
      case OBJECT:
        return extract((ObjectLit)expr);
      case IDENTIFIER:
        return ((Identifier)expr).getName();
      case MEMBER: {
        Member member = (Member)expr;
        if (member.getObject().kind() == Expression.Kind.IDENTIFIER &&
            ((Identifier)member.getObject()).getName().equals("env")) {
          return ENV_PREFIX + member.getProperty();
        }
        return null;
      }
      default:
        return null;
    }
  }

  /**
   * JavaScript truthiness of a compile-time value
   */
  public static boolean isTruthy(Object value) {
    if (value == null) {
      return false;
    } else if (value instanceof String) {
      return !((String)value).isEmpty();
    } else if (value instanceof Double) {
      double d = (Double)value;
      return d != 0.0 && !Double.isNaN(d);
    } else if (value instanceof Boolean) {
      return (Boolean)value;
    }
    // Arrays and objects
    return true;
  }

  /**
   * Serialize as JavaScript source.  Strings of the form env.X become
   * process.env.X lookups.
   */
  public static String serializeValue(Object value) {
    if (value instanceof String) {
      String s = (String)value;
      if (s.startsWith(ENV_PREFIX)) {
        return "process.env." + s.substring(ENV_PREFIX.length());
      }
      return JsUtil.jsonQuote(s);
    }
    return serialize(value);
  }

  /**
   * Serialize as JavaScript source
   */
  @SuppressWarnings("unchecked")
  public static String serialize(Object value) {
    if (value == null) {
      return "undefined";
    } else if (value instanceof String) {
      return JsUtil.jsonQuote((String)value);
    } else if (value instanceof Double) {
      return JsUtil.formatNumber((Double)value);
    } else if (value instanceof Boolean) {
      return value.toString();
    } else if (value instanceof List) {
      List<String> elems = new ArrayList<String>();
      for (Object o: (List<Object>)value) {
        elems.add(serialize(o));
      }
      return "[" + StringUtils.join(elems, ", ") + "]";
    } else if (value instanceof Map) {
      List<String> pairs = new ArrayList<String>();
      for (Entry<String, Object> e: ((Map<String, Object>)value).entrySet()) {
        String key = PLAIN_KEY.matcher(e.getKey()).matches() ?
                            e.getKey() : JsUtil.jsonQuote(e.getKey());
        pairs.add(key + ": " + serialize(e.getValue()));
      }
      return "{" + StringUtils.join(pairs, ", ") + "}";
    }
    throw new MscRuntimeError("Unexpected config value: " + value);
  }

  /**
   * Convert to text the way JavaScript's String() does
   */
  @SuppressWarnings("unchecked")
  public static String toText(Object value) {
    if (value == null) {
      return "undefined";
    } else if (value instanceof Double) {
      return JsUtil.formatNumber((Double)value);
    } else if (value instanceof List) {
      List<String> elems = new ArrayList<String>();
      for (Object o: (List<Object>)value) {
        elems.add(o == null ? "" : toText(o));
      }
      return StringUtils.join(elems, ",");
    } else if (value instanceof Map) {
      return "[object Object]";
    }
    return value.toString();
  }

  /**
   * Serialize the way JSON.stringify does, without whitespace
   */
  @SuppressWarnings("unchecked")
  public static String toJson(Object value) {
    if (value == null) {
      return "null";
    } else if (value instanceof String) {
      return JsUtil.jsonQuote((String)value);
    } else if (value instanceof Double) {
      double d = (Double)value;
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return "null";
      }
      return JsUtil.formatNumber(d);
    } else if (value instanceof Boolean) {
      return value.toString();
    } else if (value instanceof List) {
      List<String> elems = new ArrayList<String>();
      for (Object o: (List<Object>)value) {
        elems.add(toJson(o));
      }
      return "[" + StringUtils.join(elems, ",") + "]";
    } else if (value instanceof Map) {
      List<String> pairs = new ArrayList<String>();
      for (Entry<String, Object> e: ((Map<String, Object>)value).entrySet()) {
        if (e.getValue() != null) {
          pairs.add(JsUtil.jsonQuote(e.getKey()) + ":" + toJson(e.getValue()));
        }
      }
      return "{" + StringUtils.join(pairs, ",") + "}";
    }
    throw new MscRuntimeError("Unexpected config value: " + value);
  }
}
