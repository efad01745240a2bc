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

import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.frontend.tree.ToolParameter;
import mcps.msc.frontend.tree.TypeExpr;
import mcps.msc.frontend.tree.TypeExpr.ArrayType;
import mcps.msc.frontend.tree.TypeExpr.ObjectType;
import mcps.msc.frontend.tree.TypeExpr.Primitive;
import mcps.msc.frontend.tree.TypeExpr.TypeProperty;
import mcps.msc.frontend.tree.TypeExpr.UnionType;
import mcps.msc.jsbackend.SchemaDescriptor.Kind;

/**
 * Compiles type annotations on a tool's interface into descriptors.
 * Tool bodies are never checked against these.
 */
public class TypeSchemaCompiler {

  public SchemaDescriptor compile(TypeExpr type) {
    switch (type.kind()) {
      case PRIMITIVE:
        return primitive(((Primitive)type).getType());
      case ARRAY:
        return SchemaDescriptor.array(
                  compile(((ArrayType)type).getElementType()));
      case OBJECT:
        return object((ObjectType)type);
      case UNION:
        return union((UnionType)type);
      default:
        throw new MscRuntimeError("Unexpected type kind: " + type.kind());
    }
  }

  /**
   * Descriptor of a parameter: any if unannotated, wrapped in optional
   * if marked with ?
   */
  public SchemaDescriptor compileParameter(ToolParameter param) {
    return maybeOptional(param.isOptional(), param.getType());
  }

  /**
   * @return parameter name to descriptor, in declaration order
   */
  public Map<String, SchemaDescriptor> compileParameters(
                                    List<ToolParameter> params) {
    Map<String, SchemaDescriptor> result =
                        new LinkedHashMap<String, SchemaDescriptor>();
    for (ToolParameter param: params) {
      result.put(param.getName(), compileParameter(param));
    }
    return result;
  }

  private SchemaDescriptor maybeOptional(boolean optional, TypeExpr type) {
    SchemaDescriptor d = type == null ? SchemaDescriptor.ANY : compile(type);
    return optional ? SchemaDescriptor.optional(d) : d;
  }

  private SchemaDescriptor primitive(TypeExpr.PrimitiveType type) {
    switch (type) {
      case STRING:
        return SchemaDescriptor.leaf(Kind.STRING);
      case NUMBER:
        return SchemaDescriptor.leaf(Kind.NUMBER);
      case BOOLEAN:
        return SchemaDescriptor.leaf(Kind.BOOLEAN);
      case ANY:
        return SchemaDescriptor.ANY;
      case NULL:
        return SchemaDescriptor.leaf(Kind.NULL);
      default:
        throw new MscRuntimeError("Unexpected primitive: " + type);
    }
  }

  private SchemaDescriptor object(ObjectType type) {
    Map<String, SchemaDescriptor> props =
                        new LinkedHashMap<String, SchemaDescriptor>();
    for (TypeProperty prop: type.getProperties()) {
      props.put(prop.getName(),
                maybeOptional(prop.isOptional(), prop.getType()));
    }
    return SchemaDescriptor.object(props);
  }

  private SchemaDescriptor union(UnionType type) {
    List<TypeExpr> flat = new ArrayList<TypeExpr>();
    flatten(type, flat);
    if (flat.size() == 1) {
      return compile(flat.get(0));
    }
    List<SchemaDescriptor> members = new ArrayList<SchemaDescriptor>();
    for (TypeExpr member: flat) {
      members.add(compile(member));
    }
    return SchemaDescriptor.union(members);
  }

  /**
   * Append non-union members of type to out, expanding nested unions
   * in place
   */
  private static void flatten(UnionType type, List<TypeExpr> out) {
    for (TypeExpr member: type.getTypes()) {
      if (member.kind() == TypeExpr.Kind.UNION) {
        flatten((UnionType)member, out);
      } else {
        out.add(member);
      }
    }
  }
}
