package io.intellixity.typegraph.codegen;

import io.intellixity.typegraph.graph.*;

import java.util.Set;

/** Java spellings of type-graph types, as seen from inside one top-level type. */
final class JavaTypes {
  private static final Set<String> KEYWORDS = Set.of(
      "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
      "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
      "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
      "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
      "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
      "volatile", "while", "true", "false", "null", "var", "yield", "record", "sealed", "permits", "_");

  // Not allowed as record component names.
  private static final Set<String> OBJECT_METHODS = Set.of(
      "clone", "finalize", "getClass", "hashCode", "notify", "notifyAll", "toString", "wait");

  private final TypeGraph graph;
  private final String pkg;
  private final TypeName scope;

  /** @param scope the top-level type whose file is being written */
  JavaTypes(TypeGraph graph, String pkg, TypeName scope) {
    this.graph = graph;
    this.pkg = pkg;
    this.scope = scope;
  }

  String javaType(Field f) {
    String element = javaType(f.type());
    return f.cardinality() == Cardinality.LIST ? "java.util.List<" + element + ">" : element;
  }

  String javaType(ValueType t) {
    return t.accept(new ValueType.Visitor<>() {
      @Override public String visitText(ValueType.Text text) { return string(); }
      @Override public String visitTokens(ValueType.Tokens tokens) { return "java.util.List<" + string() + ">"; }
      @Override public String visitRef(ValueType.Ref ref) { return ref(ref.name()); }
    });
  }

  /**
   * Names are written with their owner path, package-qualified when a type
   * nested in the current scope hides their top-level segment.
   */
  String ref(TypeName name) {
    TypeName top = name.topLevel();
    if (!top.equals(scope) && hidden(top.simpleName())) return qualify(name.qualified());
    return name.qualified();
  }

  String string() {
    return hidden("String") || graph.contains(TypeName.of("String")) ? "java.lang.String" : "String";
  }

  static String identifier(String name) {
    return KEYWORDS.contains(name) || OBJECT_METHODS.contains(name) ? name + "_" : name;
  }

  private boolean hidden(String simpleName) {
    for (TypeDef d : graph.definitions().values()) {
      TypeName n = d.name();
      if (n.isNested() && n.topLevel().equals(scope) && n.simpleName().equals(simpleName)) return true;
    }
    return false;
  }

  private String qualify(String qualified) {
    return pkg == null || pkg.isBlank() ? qualified : pkg + "." + qualified;
  }
}
