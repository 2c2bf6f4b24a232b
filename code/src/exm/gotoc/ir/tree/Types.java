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
package exm.gotoc.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.gotoc.common.exceptions.GotocRuntimeError;

/**
 * Types of the goto program.
 *
 * The base class for all types is Type.  Aggregate types (structs and
 * unions) are normally referred to through tag types, which name a type
 * symbol {@code tag-<tag>} in the symbol table.
 */
public class Types {

  /** Prefix of symbol table keys holding struct/union declarations */
  public static final String TAG_PREFIX = "tag-";

  public static enum TypeKind {
    ARRAY,
    BOOL,
    C_INTEGER,
    CODE,
    DOUBLE,
    EMPTY,
    FLOAT,
    INCOMPLETE_STRUCT,
    INCOMPLETE_UNION,
    POINTER,
    SIGNED_BV,
    STRUCT,
    STRUCT_TAG,
    TYPEDEF,
    UNION,
    UNION_TAG,
    UNSIGNED_BV,
    VECTOR,
    ;
  }

  /**
   * Machine dependent C integer types
   */
  public static enum CIntKind {
    BOOL("bool", "c_bool", false),
    CHAR("char", "c_char", true),
    INT("int", "c_int", true),
    SIZE_T("size_t", "c_size_t", false),
    SSIZE_T("ssize_t", "c_ssize_t", true),
    ;

    private final String cName;
    private final String identifier;
    private final boolean signed;

    private CIntKind(String cName, String identifier, boolean signed) {
      this.cName = cName;
      this.identifier = identifier;
      this.signed = signed;
    }

    public String cName() {
      return cName;
    }

    public String identifier() {
      return identifier;
    }

    public boolean isSigned() {
      return signed;
    }
  }

  public static String tagSymbolName(String tag) {
    return TAG_PREFIX + tag;
  }

  public abstract static class Type {

    public abstract TypeKind kind();

    /**
     * Deterministic rendering of the type that only uses identifier
     * characters.  Used to name synthesized symbols.
     */
    public abstract String toIdentifier();

    /**
     * Immediate component types, e.g. the element of an array or the
     * parameter and return types of a function
     */
    public abstract List<Type> componentTypes();

    @Override
    public abstract String toString();

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    public boolean isCode() {
      return kind() == TypeKind.CODE;
    }

    public boolean isEmpty() {
      return kind() == TypeKind.EMPTY;
    }

    public boolean isBool() {
      return kind() == TypeKind.BOOL;
    }

    public boolean isPointer() {
      return kind() == TypeKind.POINTER;
    }

    public boolean isArray() {
      return kind() == TypeKind.ARRAY;
    }

    public boolean isVector() {
      return kind() == TypeKind.VECTOR;
    }

    public boolean isStructTag() {
      return kind() == TypeKind.STRUCT_TAG;
    }

    public boolean isUnionTag() {
      return kind() == TypeKind.UNION_TAG;
    }

    public boolean isCInteger() {
      return kind() == TypeKind.C_INTEGER;
    }

    public boolean isBitVector() {
      return kind() == TypeKind.SIGNED_BV || kind() == TypeKind.UNSIGNED_BV;
    }

    public boolean isInteger() {
      return isCInteger() || isBitVector();
    }

    /**
     * @return bit width of type if fixed regardless of machine, else -1
     */
    public long width() {
      return -1;
    }

    public PointerType toPointer() {
      return new PointerType(this);
    }

    public ArrayType arrayOf(long size) {
      return new ArrayType(this, size);
    }

    public TypeDefType toTypeDef(String name) {
      return new TypeDefType(name, this);
    }

    /**
     * Element type of pointer, array or vector
     */
    public Type baseType() {
      throw new GotocRuntimeError("baseType() not supported for type "
                                 + toString());
    }

    public CodeType asCode() {
      throw new GotocRuntimeError("Expected code type but got " + toString());
    }

    public AggregateType asAggregate() {
      throw new GotocRuntimeError("Expected struct or union type but got "
                                  + toString());
    }

    /**
     * @return tag of struct/union related types
     */
    public String tag() {
      throw new GotocRuntimeError("tag() not supported for type "
                                  + toString());
    }
  }

  /**
   * Types with no parameters: bool, float, double, void
   */
  public static class SimpleType extends Type {
    private final TypeKind kind;

    private SimpleType(TypeKind kind) {
      this.kind = kind;
    }

    @Override
    public TypeKind kind() {
      return kind;
    }

    @Override
    public String toIdentifier() {
      switch (kind) {
        case BOOL:
          return "bool";
        case DOUBLE:
          return "double";
        case EMPTY:
          return "empty";
        case FLOAT:
          return "float";
        default:
          throw new GotocRuntimeError("Unexpected kind " + kind);
      }
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.emptyList();
    }

    @Override
    public long width() {
      switch (kind) {
        case FLOAT:
          return 32;
        case DOUBLE:
          return 64;
        default:
          return -1;
      }
    }

    @Override
    public String toString() {
      return toIdentifier();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof SimpleType && ((SimpleType)o).kind == kind;
    }

    @Override
    public int hashCode() {
      return kind.hashCode();
    }
  }

  public static class CIntegerType extends Type {
    private final CIntKind intKind;

    private CIntegerType(CIntKind intKind) {
      this.intKind = intKind;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.C_INTEGER;
    }

    public CIntKind intKind() {
      return intKind;
    }

    @Override
    public String toIdentifier() {
      return intKind.identifier();
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return intKind.cName();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof CIntegerType &&
              ((CIntegerType)o).intKind == intKind;
    }

    @Override
    public int hashCode() {
      return 17 * intKind.hashCode();
    }
  }

  /**
   * Fixed-width signed or unsigned bit vector
   */
  public static class BitVectorType extends Type {
    private final boolean signed;
    private final long width;

    private BitVectorType(boolean signed, long width) {
      if (width <= 0) {
        throw new GotocRuntimeError("Invalid bit vector width " + width);
      }
      this.signed = signed;
      this.width = width;
    }

    @Override
    public TypeKind kind() {
      return signed ? TypeKind.SIGNED_BV : TypeKind.UNSIGNED_BV;
    }

    public boolean isSigned() {
      return signed;
    }

    @Override
    public long width() {
      return width;
    }

    @Override
    public String toIdentifier() {
      return (signed ? "signed_bv_" : "unsigned_bv_") + width;
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return (signed ? "signedbv[" : "unsignedbv[") + width + "]";
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof BitVectorType))
        return false;
      BitVectorType other = (BitVectorType)o;
      return other.signed == signed && other.width == width;
    }

    @Override
    public int hashCode() {
      return (int)(width * 31 + (signed ? 1 : 0));
    }
  }

  public static class PointerType extends Type {
    private final Type target;

    private PointerType(Type target) {
      assert(target != null);
      this.target = target;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.POINTER;
    }

    @Override
    public Type baseType() {
      return target;
    }

    @Override
    public String toIdentifier() {
      return "pointer_to_" + target.toIdentifier();
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.singletonList(target);
    }

    @Override
    public String toString() {
      return "pointer(" + target + ")";
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof PointerType &&
              ((PointerType)o).target.equals(target);
    }

    @Override
    public int hashCode() {
      return 37 * target.hashCode() + 1;
    }
  }

  /**
   * Fixed size array or SIMD vector
   */
  public static class ArrayType extends Type {
    private final Type elem;
    private final long size;

    private ArrayType(Type elem, long size) {
      assert(elem != null);
      this.elem = elem;
      this.size = size;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.ARRAY;
    }

    @Override
    public Type baseType() {
      return elem;
    }

    public long size() {
      return size;
    }

    @Override
    public String toIdentifier() {
      return "array_of_" + size + "_" + elem.toIdentifier();
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.singletonList(elem);
    }

    @Override
    public String toString() {
      return elem + "[" + size + "]";
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ArrayType))
        return false;
      ArrayType other = (ArrayType)o;
      return other.size == size && other.elem.equals(elem);
    }

    @Override
    public int hashCode() {
      return 41 * elem.hashCode() + (int)size;
    }
  }

  public static class VectorType extends Type {
    private final Type elem;
    private final long size;

    private VectorType(Type elem, long size) {
      assert(elem != null);
      this.elem = elem;
      this.size = size;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.VECTOR;
    }

    @Override
    public Type baseType() {
      return elem;
    }

    public long size() {
      return size;
    }

    @Override
    public String toIdentifier() {
      return "vec_of_" + size + "_" + elem.toIdentifier();
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.singletonList(elem);
    }

    @Override
    public String toString() {
      return "vector(" + elem + ", " + size + ")";
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof VectorType))
        return false;
      VectorType other = (VectorType)o;
      return other.size == size && other.elem.equals(elem);
    }

    @Override
    public int hashCode() {
      return 43 * elem.hashCode() + (int)size;
    }
  }

  /**
   * Function parameter.  Identifier and base name are absent for
   * declarations without a definition.
   */
  public static class Parameter {
    private final String identifier;
    private final String baseName;
    private final Type type;

    public Parameter(String identifier, String baseName, Type type) {
      assert(type != null);
      this.identifier = identifier;
      this.baseName = baseName;
      this.type = type;
    }

    public static Parameter unnamed(Type type) {
      return new Parameter(null, null, type);
    }

    public String identifier() {
      return identifier;
    }

    public String baseName() {
      return baseName;
    }

    public Type type() {
      return type;
    }

    @Override
    public String toString() {
      return (identifier == null ? "_" : identifier) + ": " + type;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Parameter))
        return false;
      Parameter other = (Parameter)o;
      return type.equals(other.type) &&
          (identifier == null ? other.identifier == null
                              : identifier.equals(other.identifier)) &&
          (baseName == null ? other.baseName == null
                              : baseName.equals(other.baseName));
    }

    @Override
    public int hashCode() {
      int result = type.hashCode();
      result = 31 * result + (identifier == null ? 0 : identifier.hashCode());
      result = 31 * result + (baseName == null ? 0 : baseName.hashCode());
      return result;
    }
  }

  /**
   * Function types.  Variadic functions accept extra arguments
   * after the declared parameters.
   */
  public static class CodeType extends Type {
    private final List<Parameter> parameters;
    private final Type returnType;
    private final boolean variadic;

    private CodeType(List<Parameter> parameters, Type returnType,
                     boolean variadic) {
      assert(returnType != null);
      this.parameters = Collections.unmodifiableList(
                              new ArrayList<Parameter>(parameters));
      this.returnType = returnType;
      this.variadic = variadic;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.CODE;
    }

    @Override
    public CodeType asCode() {
      return this;
    }

    public List<Parameter> parameters() {
      return parameters;
    }

    public Type returnType() {
      return returnType;
    }

    public boolean isVariadic() {
      return variadic;
    }

    @Override
    public String toIdentifier() {
      return variadic ? "variadic_code" : "code";
    }

    @Override
    public List<Type> componentTypes() {
      List<Type> result = new ArrayList<Type>(parameters.size() + 1);
      for (Parameter p: parameters) {
        result.add(p.type());
      }
      result.add(returnType);
      return result;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("fn(");
      boolean first = true;
      for (Parameter p: parameters) {
        if (!first) {
          sb.append(", ");
        }
        sb.append(p);
        first = false;
      }
      if (variadic) {
        sb.append(first ? "..." : ", ...");
      }
      sb.append(") -> ").append(returnType);
      return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof CodeType))
        return false;
      CodeType other = (CodeType)o;
      return variadic == other.variadic &&
             returnType.equals(other.returnType) &&
             parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
      return 47 * parameters.hashCode() + returnType.hashCode() +
              (variadic ? 1 : 0);
    }
  }

  /**
   * Reference to a struct or union by tag, or an incomplete
   * (forward declared) struct or union
   */
  public static class TagType extends Type {
    private final TypeKind kind;
    private final String tag;

    private TagType(TypeKind kind, String tag) {
      assert(kind == TypeKind.STRUCT_TAG || kind == TypeKind.UNION_TAG ||
             kind == TypeKind.INCOMPLETE_STRUCT ||
             kind == TypeKind.INCOMPLETE_UNION);
      if (tag == null || tag.isEmpty()) {
        throw new GotocRuntimeError("Empty tag for " + kind);
      }
      this.kind = kind;
      this.tag = tag;
    }

    @Override
    public TypeKind kind() {
      return kind;
    }

    @Override
    public String tag() {
      return tag;
    }

    /**
     * @return key of the symbol declaring the aggregate
     */
    public String symbolName() {
      return tagSymbolName(tag);
    }

    @Override
    public String toIdentifier() {
      switch (kind) {
        case STRUCT_TAG:
          return "struct_" + tag;
        case UNION_TAG:
          return "union_" + tag;
        default:
          return tag;
      }
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      switch (kind) {
        case STRUCT_TAG:
          return "struct_tag(" + tag + ")";
        case UNION_TAG:
          return "union_tag(" + tag + ")";
        case INCOMPLETE_STRUCT:
          return "incomplete_struct(" + tag + ")";
        default:
          return "incomplete_union(" + tag + ")";
      }
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof TagType))
        return false;
      TagType other = (TagType)o;
      return kind == other.kind && tag.equals(other.tag);
    }

    @Override
    public int hashCode() {
      return kind.hashCode() * 53 + tag.hashCode();
    }
  }

  /**
   * Field or padding inside a struct or union
   */
  public static class DatatypeComponent {
    private final String name;
    /** null for padding */
    private final Type type;
    /** only for padding */
    private final long paddingBits;

    private DatatypeComponent(String name, Type type, long paddingBits) {
      this.name = name;
      this.type = type;
      this.paddingBits = paddingBits;
    }

    public static DatatypeComponent field(String name, Type type) {
      assert(type != null);
      return new DatatypeComponent(name, type, 0);
    }

    public static DatatypeComponent padding(String name, long bits) {
      return new DatatypeComponent(name, null, bits);
    }

    public String name() {
      return name;
    }

    public boolean isPadding() {
      return type == null;
    }

    public long paddingBits() {
      return paddingBits;
    }

    /**
     * @return field type, or an unsigned bit vector of the padding width
     */
    public Type type() {
      if (type == null) {
        return unsignedInt(paddingBits);
      }
      return type;
    }

    @Override
    public String toString() {
      if (isPadding()) {
        return name + ": <padding " + paddingBits + ">";
      }
      return name + ": " + type;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof DatatypeComponent))
        return false;
      DatatypeComponent other = (DatatypeComponent)o;
      if (!name.equals(other.name) || paddingBits != other.paddingBits)
        return false;
      return type == null ? other.type == null : type.equals(other.type);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + (type == null ? (int)paddingBits
                                                  : type.hashCode());
    }
  }

  /**
   * Complete struct or union declaration
   */
  public static class AggregateType extends Type {
    private final TypeKind kind;
    private final String tag;
    private final List<DatatypeComponent> components;

    private AggregateType(TypeKind kind, String tag,
                          List<DatatypeComponent> components) {
      assert(kind == TypeKind.STRUCT || kind == TypeKind.UNION);
      this.kind = kind;
      this.tag = tag;
      this.components = Collections.unmodifiableList(
                      new ArrayList<DatatypeComponent>(components));
    }

    @Override
    public TypeKind kind() {
      return kind;
    }

    @Override
    public AggregateType asAggregate() {
      return this;
    }

    public boolean isStruct() {
      return kind == TypeKind.STRUCT;
    }

    @Override
    public String tag() {
      return tag;
    }

    public List<DatatypeComponent> components() {
      return components;
    }

    /**
     * @return only the non-padding components
     */
    public List<DatatypeComponent> fields() {
      List<DatatypeComponent> result = new ArrayList<DatatypeComponent>();
      for (DatatypeComponent c: components) {
        if (!c.isPadding()) {
          result.add(c);
        }
      }
      return result;
    }

    public DatatypeComponent lookupField(String name) {
      for (DatatypeComponent c: components) {
        if (c.name().equals(name)) {
          return c;
        }
      }
      return null;
    }

    /**
     * @return tag type that refers to this declaration
     */
    public TagType toTag() {
      return new TagType(isStruct() ? TypeKind.STRUCT_TAG
                                    : TypeKind.UNION_TAG, tag);
    }

    @Override
    public String toIdentifier() {
      return (isStruct() ? "struct_" : "union_") + tag;
    }

    @Override
    public List<Type> componentTypes() {
      List<Type> result = new ArrayList<Type>();
      for (DatatypeComponent c: components) {
        result.add(c.type());
      }
      return result;
    }

    @Override
    public String toString() {
      return (isStruct() ? "struct " : "union ") + tag + " " + components;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof AggregateType))
        return false;
      AggregateType other = (AggregateType)o;
      return kind == other.kind && tag.equals(other.tag) &&
              components.equals(other.components);
    }

    @Override
    public int hashCode() {
      return (kind.hashCode() * 59 + tag.hashCode()) * 31 +
              components.hashCode();
    }
  }

  public static class TypeDefType extends Type {
    private final String name;
    private final Type type;

    private TypeDefType(String name, Type type) {
      assert(type != null);
      this.name = name;
      this.type = type;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.TYPEDEF;
    }

    public String name() {
      return name;
    }

    public Type type() {
      return type;
    }

    @Override
    public String toIdentifier() {
      return "typedef_" + name;
    }

    @Override
    public List<Type> componentTypes() {
      return Collections.singletonList(type);
    }

    @Override
    public String toString() {
      return "typedef " + name + " = " + type;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof TypeDefType))
        return false;
      TypeDefType other = (TypeDefType)o;
      return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 61 + type.hashCode();
    }
  }

  private static final SimpleType BOOL = new SimpleType(TypeKind.BOOL);
  private static final SimpleType DOUBLE = new SimpleType(TypeKind.DOUBLE);
  private static final SimpleType EMPTY = new SimpleType(TypeKind.EMPTY);
  private static final SimpleType FLOAT = new SimpleType(TypeKind.FLOAT);

  public static Type bool() {
    return BOOL;
  }

  public static Type doubleType() {
    return DOUBLE;
  }

  public static Type floatType() {
    return FLOAT;
  }

  /** void */
  public static Type empty() {
    return EMPTY;
  }

  public static CIntegerType cInt() {
    return new CIntegerType(CIntKind.INT);
  }

  public static CIntegerType cBool() {
    return new CIntegerType(CIntKind.BOOL);
  }

  public static CIntegerType cChar() {
    return new CIntegerType(CIntKind.CHAR);
  }

  public static CIntegerType sizeT() {
    return new CIntegerType(CIntKind.SIZE_T);
  }

  public static CIntegerType ssizeT() {
    return new CIntegerType(CIntKind.SSIZE_T);
  }

  public static BitVectorType signedInt(long width) {
    return new BitVectorType(true, width);
  }

  public static BitVectorType unsignedInt(long width) {
    return new BitVectorType(false, width);
  }

  public static VectorType vector(Type elem, long size) {
    return new VectorType(elem, size);
  }

  public static CodeType code(List<Parameter> parameters, Type returnType) {
    return new CodeType(parameters, returnType, false);
  }

  public static CodeType variadicCode(List<Parameter> parameters,
                                      Type returnType) {
    return new CodeType(parameters, returnType, true);
  }

  /**
   * Function type with unnamed parameters of given types
   */
  public static CodeType codeWithUnnamedParameters(List<Type> paramTypes,
                                                   Type returnType) {
    List<Parameter> params = new ArrayList<Parameter>(paramTypes.size());
    for (Type t: paramTypes) {
      params.add(Parameter.unnamed(t));
    }
    return code(params, returnType);
  }

  public static TagType structTag(String tag) {
    return new TagType(TypeKind.STRUCT_TAG, tag);
  }

  public static TagType unionTag(String tag) {
    return new TagType(TypeKind.UNION_TAG, tag);
  }

  public static TagType incompleteStruct(String tag) {
    return new TagType(TypeKind.INCOMPLETE_STRUCT, tag);
  }

  public static TagType incompleteUnion(String tag) {
    return new TagType(TypeKind.INCOMPLETE_UNION, tag);
  }

  public static AggregateType structType(String tag,
                            List<DatatypeComponent> components) {
    return new AggregateType(TypeKind.STRUCT, tag, components);
  }

  public static AggregateType unionType(String tag,
                            List<DatatypeComponent> components) {
    return new AggregateType(TypeKind.UNION, tag, components);
  }
}
