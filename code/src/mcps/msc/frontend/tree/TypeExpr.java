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
package mcps.msc.frontend.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.commons.lang3.StringUtils;

/**
 * Structural type annotations on tool parameters and return values
 */
public abstract class TypeExpr {

  public static enum Kind {
    PRIMITIVE,
    ARRAY,
    OBJECT,
    UNION,
  }

  public static enum PrimitiveType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ANY("any"),
    NULL("null");

    private final String typeName;

    private PrimitiveType(String typeName) {
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }

    /**
     * @return primitive named typeName, or null if none
     */
    public static PrimitiveType fromName(String typeName) {
      for (PrimitiveType t: values()) {
        if (t.typeName.equals(typeName)) {
          return t;
        }
      }
      return null;
    }
  }

  private final Kind kind;

  protected TypeExpr(Kind kind) {
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  public static class Primitive extends TypeExpr {
    private final PrimitiveType type;

    public Primitive(PrimitiveType type) {
      super(Kind.PRIMITIVE);
      this.type = type;
    }

    public PrimitiveType getType() {
      return type;
    }

    @Override
    public String toString() {
      return type.typeName();
    }
  }

  public static class ArrayType extends TypeExpr {
    private final TypeExpr elementType;

    public ArrayType(TypeExpr elementType) {
      super(Kind.ARRAY);
      this.elementType = elementType;
    }

    public TypeExpr getElementType() {
      return elementType;
    }

    @Override
    public String toString() {
      return elementType + "[]";
    }
  }

  public static class TypeProperty {
    private final String name;
    private final boolean optional;
    private final TypeExpr type;

    public TypeProperty(String name, boolean optional, TypeExpr type) {
      this.name = name;
      this.optional = optional;
      this.type = type;
    }

    public String getName() {
      return name;
    }

    public boolean isOptional() {
      return optional;
    }

    public TypeExpr getType() {
      return type;
    }

    @Override
    public String toString() {
      return name + (optional ? "?" : "") + ": " + type;
    }
  }

  public static class ObjectType extends TypeExpr {
    private final ImmutableList<TypeProperty> properties;

    public ObjectType(List<TypeProperty> properties) {
      super(Kind.OBJECT);
      this.properties = ImmutableList.copyOf(properties);
    }

    public ImmutableList<TypeProperty> getProperties() {
      return properties;
    }

    @Override
    public String toString() {
      return "{" + StringUtils.join(properties, ", ") + "}";
    }
  }

  public static class UnionType extends TypeExpr {
    private final ImmutableList<TypeExpr> types;

    public UnionType(List<TypeExpr> types) {
      super(Kind.UNION);
      this.types = ImmutableList.copyOf(types);
    }

    public ImmutableList<TypeExpr> getTypes() {
      return types;
    }

    @Override
    public String toString() {
      return "(" + StringUtils.join(types, " | ") + ")";
    }
  }
}
