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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Shape description of a value, rendered as a literal that the runtime
 * schema builder turns into a validation schema.
 */
public class SchemaDescriptor {

  public static enum Kind {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ANY("any"),
    NULL("null"),
    ARRAY("array"),
    OBJECT("object"),
    UNION("union"),
    OPTIONAL("optional");

    private final String tag;

    private Kind(String tag) {
      this.tag = tag;
    }

    public String tag() {
      return tag;
    }

    public boolean isLeaf() {
      return ordinal() <= NULL.ordinal();
    }
  }

  public static final SchemaDescriptor ANY = new SchemaDescriptor(Kind.ANY,
                      null, ImmutableList.<SchemaDescriptor>of(),
                      ImmutableMap.<String, SchemaDescriptor>of());

  private final Kind kind;

  /** Wrapped descriptor for ARRAY and OPTIONAL */
  private final SchemaDescriptor inner;

  /** Members of a UNION */
  private final ImmutableList<SchemaDescriptor> members;

  /** Properties of an OBJECT, in declaration order */
  private final ImmutableMap<String, SchemaDescriptor> properties;

  private SchemaDescriptor(Kind kind, SchemaDescriptor inner,
          ImmutableList<SchemaDescriptor> members,
          ImmutableMap<String, SchemaDescriptor> properties) {
    this.kind = kind;
    this.inner = inner;
    this.members = members;
    this.properties = properties;
  }

  public static SchemaDescriptor leaf(Kind kind) {
    Preconditions.checkArgument(kind.isLeaf(), "Not a leaf: %s", kind);
    if (kind == Kind.ANY) {
      return ANY;
    }
    return new SchemaDescriptor(kind, null, ImmutableList.<SchemaDescriptor>of(),
                             ImmutableMap.<String, SchemaDescriptor>of());
  }

  public static SchemaDescriptor array(SchemaDescriptor elementType) {
    return new SchemaDescriptor(Kind.ARRAY, elementType,
                             ImmutableList.<SchemaDescriptor>of(),
                             ImmutableMap.<String, SchemaDescriptor>of());
  }

  public static SchemaDescriptor optional(SchemaDescriptor schema) {
    return new SchemaDescriptor(Kind.OPTIONAL, schema,
                             ImmutableList.<SchemaDescriptor>of(),
                             ImmutableMap.<String, SchemaDescriptor>of());
  }

  public static SchemaDescriptor union(List<SchemaDescriptor> types) {
    return new SchemaDescriptor(Kind.UNION, null, ImmutableList.copyOf(types),
                             ImmutableMap.<String, SchemaDescriptor>of());
  }

  /**
   * @param properties iteration order is kept.  Later duplicates of a
   *        key replace earlier ones.
   */
  public static SchemaDescriptor object(
                              Map<String, SchemaDescriptor> properties) {
    return new SchemaDescriptor(Kind.OBJECT, null,
              ImmutableList.<SchemaDescriptor>of(),
              ImmutableMap.copyOf(new LinkedHashMap<String, SchemaDescriptor>(
                                                                properties)));
  }

  public Kind kind() {
    return kind;
  }

  public SchemaDescriptor getElementType() {
    Preconditions.checkState(kind == Kind.ARRAY);
    return inner;
  }

  public SchemaDescriptor getSchema() {
    Preconditions.checkState(kind == Kind.OPTIONAL);
    return inner;
  }

  public ImmutableList<SchemaDescriptor> getTypes() {
    return members;
  }

  public ImmutableMap<String, SchemaDescriptor> getProperties() {
    return properties;
  }

  /**
   * Render as a JavaScript object literal
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  public void appendTo(StringBuilder sb) {
    sb.append("{ type: ");
    sb.append(JsUtil.jsonQuote(kind.tag()));
    switch (kind) {
      case ARRAY:
        sb.append(", elementType: ");
        inner.appendTo(sb);
        break;
      case OPTIONAL:
        sb.append(", schema: ");
        inner.appendTo(sb);
        break;
      case UNION:
        sb.append(", types: [");
        boolean first = true;
        for (SchemaDescriptor member: members) {
          if (first) {
            first = false;
          } else {
            sb.append(", ");
          }
          member.appendTo(sb);
        }
        sb.append("]");
        break;
      case OBJECT:
        sb.append(", properties: ");
        appendProperties(sb, properties);
        break;
      default:
        // Leaf types carry nothing else
        break;
    }
    sb.append(" }");
  }

  /**
   * Render a map of descriptors as an object literal
   */
  public static String renderProperties(
                          Map<String, SchemaDescriptor> properties) {
    StringBuilder sb = new StringBuilder();
    appendProperties(sb, properties);
    return sb.toString();
  }

  private static void appendProperties(StringBuilder sb,
                          Map<String, SchemaDescriptor> properties) {
    if (properties.isEmpty()) {
      sb.append("{}");
      return;
    }
    List<String> entries = new ArrayList<String>();
    for (Entry<String, SchemaDescriptor> e: properties.entrySet()) {
      String key = JsUtil.isIdentifier(e.getKey()) ?
                          e.getKey() : JsUtil.jsonQuote(e.getKey());
      entries.add(key + ": " + e.getValue().render());
    }
    sb.append("{ ");
    sb.append(String.join(", ", entries));
    sb.append(" }");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SchemaDescriptor)) {
      return false;
    }
    SchemaDescriptor other = (SchemaDescriptor)o;
    if (kind != other.kind) {
      return false;
    }
    if (inner == null ? other.inner != null : !inner.equals(other.inner)) {
      return false;
    }
    return members.equals(other.members) &&
           properties.equals(other.properties);
  }

  @Override
  public int hashCode() {
    int h = kind.hashCode();
    h = h * 31 + (inner == null ? 0 : inner.hashCode());
    h = h * 31 + members.hashCode();
    h = h * 31 + properties.hashCode();
    return h;
  }

  @Override
  public String toString() {
    return render();
  }
}
