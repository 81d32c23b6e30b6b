package io.intellixity.typegraph.codegen;

import io.intellixity.typegraph.codegen.internal.JavaFiles;
import io.intellixity.typegraph.graph.*;
import io.intellixity.typegraph.naming.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Writes Java sources for a {@link TypeGraph}: one file per top-level type, with
 * nested type names emitted as nested types of their owner.
 * <p>
 * Records become Java records, sums sealed interfaces, enums Java enums carrying
 * their wire literal. Wire names go into Jackson XML annotations.
 */
public final class JavaBindingGenerator {
  private static final Logger log = LoggerFactory.getLogger(JavaBindingGenerator.class);

  private static final String XML_ANN = "com.fasterxml.jackson.dataformat.xml.annotation.";
  private static final String JSON_ANN = "com.fasterxml.jackson.annotation.";

  private final String pkg;

  public JavaBindingGenerator(String pkg) {
    this.pkg = pkg == null ? "" : pkg.trim();
  }

  /** Writes every top-level type of {@code graph} under {@code outDir}; returns the files written. */
  public List<Path> generate(TypeGraph graph, Path outDir) throws IOException {
    List<Path> written = new ArrayList<>();
    for (TypeDef def : graph.topLevel()) {
      String type = def.name().simpleName();
      try (JavaFiles.IndentedWriter w = JavaFiles.open(outDir, pkg, type)) {
        writeFile(graph, def, w);
      }
      Path file = JavaFiles.filePath(outDir, pkg, type);
      written.add(file);
      log.debug("typegraph.codegen type={} file={}", def.name(), file);
    }
    return written;
  }

  /** Source text of the file for top-level type {@code name}. */
  public String render(TypeGraph graph, TypeName name) throws IOException {
    TypeDef def = graph.get(name);
    if (def.name().isNested()) throw new IllegalArgumentException("Nested types are rendered inside their owner: " + name);
    StringWriter out = new StringWriter();
    try (JavaFiles.IndentedWriter w = new JavaFiles.IndentedWriter(out)) {
      writeFile(graph, def, w);
    }
    return out.toString();
  }

  private void writeFile(TypeGraph graph, TypeDef def, JavaFiles.IndentedWriter w) throws IOException {
    FileEmitter body = new FileEmitter(graph, new JavaTypes(graph, pkg, def.name()));
    body.write(def);

    if (!pkg.isBlank()) {
      w.println("package " + pkg + ";");
      w.blank();
    }
    for (String imp : body.imports) {
      w.println("import " + imp + ";");
    }
    if (!body.imports.isEmpty()) w.blank();
    for (String line : body.lines()) {
      if (line.isEmpty()) w.blank();
      else w.println(line);
    }
  }

  private static final class FileEmitter {
    private final TypeGraph graph;
    private final JavaTypes types;
    private final Set<String> imports = new TreeSet<>();
    private final StringWriter buf = new StringWriter();
    private final JavaFiles.IndentedWriter w = new JavaFiles.IndentedWriter(buf);

    FileEmitter(TypeGraph graph, JavaTypes types) {
      this.graph = graph;
      this.types = types;
    }

    List<String> lines() {
      String s = buf.toString();
      if (s.endsWith("\n")) s = s.substring(0, s.length() - 1);
      return List.of(s.split("\n", -1));
    }

    void write(TypeDef def) throws IOException {
      try {
        writeAny(def);
      } catch (UncheckedIOException e) {
        throw e.getCause();
      }
    }

    private void writeAny(TypeDef def) {
      def.accept(new TypeDef.Visitor<Void>() {
        @Override
        public Void visitRecord(TypeDef.RecordType record) {
          io(() -> writeRecord(record));
          return null;
        }

        @Override
        public Void visitSum(TypeDef.SumType sum) {
          io(() -> writeSum(sum));
          return null;
        }

        @Override
        public Void visitEnum(TypeDef.EnumType enumType) {
          io(() -> writeEnum(enumType));
          return null;
        }
      });
    }

    private void writeRecord(TypeDef.RecordType r) throws IOException {
      String type = r.name().simpleName();
      w.println("@" + use(XML_ANN, "JacksonXmlRootElement") + "(localName = " + JavaFiles.literal(r.serializedName()) + ")");

      List<Field> inputs = r.constructorInputs();
      String implementsClause = implementsClause(r.name(), "implements");
      if (inputs.isEmpty()) {
        w.begin("public record " + type + "()" + implementsClause);
      } else {
        w.println("public record " + type + "(");
        w.indent();
        w.indent();
        for (int i = 0; i < inputs.size(); i++) {
          Field f = inputs.get(i);
          String sep = i + 1 < inputs.size() ? "," : "";
          w.println(annotations(f) + types.javaType(f) + " " + JavaTypes.identifier(f.name()) + sep);
        }
        w.outdent();
        w.outdent();
        w.begin(")" + implementsClause);
      }

      boolean first = true;
      if (r.isSingleton()) {
        w.println("public static final " + type + " INSTANCE = new " + type + "();");
        first = false;
      }
      for (Field f : r.fields()) {
        if (!f.constant()) continue;
        w.println("public static final " + types.javaType(f) + " " + constantName(f) + " = " + literalExpr(f, f.literal()) + ";");
        first = false;
      }

      List<String> normalize = new ArrayList<>();
      for (Field f : inputs) {
        String id = JavaTypes.identifier(f.name());
        if (f.hasDefault()) {
          normalize.add("if (" + id + " == null) " + id + " = " + literalExpr(f, f.literal()) + ";");
        } else if (f.cardinality() == Cardinality.LIST) {
          normalize.add(id + " = " + id + " == null ? java.util.List.of() : java.util.List.copyOf(" + id + ");");
        }
      }
      if (!normalize.isEmpty()) {
        if (!first) w.blank();
        w.begin("public " + type);
        for (String line : normalize) w.println(line);
        w.end("");
        first = false;
      }

      for (Field f : r.fields()) {
        if (!f.constant()) continue;
        if (!first) w.blank();
        w.println(annotations(f).trim());
        w.begin("public " + types.javaType(f) + " " + JavaTypes.identifier(f.name()) + "()");
        w.println("return " + constantName(f) + ";");
        w.end("");
        first = false;
      }

      for (TypeDef nested : graph.nestedIn(r.name())) {
        if (!first) w.blank();
        writeAny(nested);
        first = false;
      }
      w.end("");
    }

    private void writeSum(TypeDef.SumType s) throws IOException {
      String self = types.ref(s.name());
      List<String> permits = new ArrayList<>();
      List<String> subTypes = new ArrayList<>();
      for (Variant v : s.variants()) {
        if (v.isText()) {
          permits.add(self + "." + v.name());
          continue;
        }
        String ref = types.ref(v.payload());
        permits.add(ref);
        if (v.serializedName() != null) {
          subTypes.add("@" + use(JSON_ANN, "JsonSubTypes") + ".Type(value = " + ref + ".class, name = "
              + JavaFiles.literal(v.serializedName()) + ")");
        }
      }

      if (!subTypes.isEmpty()) {
        w.println("@" + use(JSON_ANN, "JsonTypeInfo") + "(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)");
        w.println("@JsonSubTypes({");
        w.indent();
        w.indent();
        for (int i = 0; i < subTypes.size(); i++) {
          w.println(subTypes.get(i) + (i + 1 < subTypes.size() ? "," : ""));
        }
        w.outdent();
        w.outdent();
        w.println("})");
      }
      String header = "public sealed interface " + s.name().simpleName() + implementsClause(s.name(), "extends")
          + " permits " + String.join(", ", permits);
      List<Variant> textVariants = s.variants().stream().filter(Variant::isText).toList();
      if (textVariants.isEmpty()) {
        w.println(header + " {}");
        return;
      }
      w.begin(header);
      for (Variant v : textVariants) {
        w.println("record " + v.name() + "(@" + use(XML_ANN, "JacksonXmlText") + " " + types.string() + " value) implements "
            + self + " {}");
      }
      w.end("");
    }

    private void writeEnum(TypeDef.EnumType e) throws IOException {
      String type = e.name().simpleName();
      w.begin("public enum " + type);
      List<EnumTag> tags = e.tags();
      for (int i = 0; i < tags.size(); i++) {
        EnumTag t = tags.get(i);
        w.println("@" + use(JSON_ANN, "JsonProperty") + "(" + JavaFiles.literal(t.literal()) + ")");
        w.println(t.identifier() + "(" + JavaFiles.literal(t.literal()) + ")" + (i + 1 < tags.size() ? "," : ";"));
      }
      w.blank();
      String string = types.string();
      w.println("private final " + string + " literal;");
      w.blank();
      w.begin(type + "(" + string + " literal)");
      w.println("this.literal = literal;");
      w.end("");
      w.blank();
      w.println("/** Value as written in the document. */");
      w.begin("public " + string + " literal()");
      w.println("return literal;");
      w.end("");
      w.blank();
      w.begin("public static " + type + " fromLiteral(" + string + " literal)");
      w.begin("for (" + type + " v : values())");
      w.println("if (v.literal.equals(literal)) return v;");
      w.end("");
      w.println("throw new IllegalArgumentException(\"Unknown " + type + " literal: \" + literal);");
      w.end("");
      w.end("");
    }

    private String implementsClause(TypeName name, String keyword) {
      List<String> sums = new ArrayList<>();
      for (TypeDef.SumType s : graph.sumsContaining(name)) sums.add(types.ref(s.name()));
      return sums.isEmpty() ? "" : " " + keyword + " " + String.join(", ", sums);
    }

    private String annotations(Field f) {
      return switch (f.role()) {
        case ATTRIBUTE -> "@" + use(XML_ANN, "JacksonXmlProperty") + "(isAttribute = true, localName = "
            + JavaFiles.literal(f.serializedName()) + ") ";
        case ELEMENT -> unwrapped(f) + "@" + use(XML_ANN, "JacksonXmlProperty") + "(localName = "
            + JavaFiles.literal(f.serializedName()) + ") ";
        case CHOICE -> unwrapped(f);
        case VALUE -> "@" + use(XML_ANN, "JacksonXmlText") + " ";
      };
    }

    private String unwrapped(Field f) {
      if (f.cardinality() != Cardinality.LIST) return "";
      return "@" + use(XML_ANN, "JacksonXmlElementWrapper") + "(useWrapping = false) ";
    }

    private String literalExpr(Field f, String literal) {
      return f.type().accept(new ValueType.Visitor<>() {
        @Override
        public String visitText(ValueType.Text text) {
          return JavaFiles.literal(literal);
        }

        @Override
        public String visitTokens(ValueType.Tokens tokens) {
          List<String> parts = new ArrayList<>();
          for (String t : literal.trim().split("\\s+")) {
            if (!t.isEmpty()) parts.add(JavaFiles.literal(t));
          }
          return "java.util.List.of(" + String.join(", ", parts) + ")";
        }

        @Override
        public String visitRef(ValueType.Ref ref) {
          TypeDef target = graph.get(ref.name());
          if (!(target instanceof TypeDef.EnumType e)) {
            throw new IllegalStateException("Field " + f.name() + " has a literal but refers to " + ref.name());
          }
          return types.ref(e.name()) + "." + e.tagForLiteral(literal).identifier();
        }
      });
    }

    private String use(String pkgPrefix, String simpleName) {
      imports.add(pkgPrefix + simpleName);
      return simpleName;
    }

    private static String constantName(Field f) {
      return Identifiers.upperSnake(f.name());
    }

    private interface IoAction {
      void run() throws IOException;
    }

    private static void io(IoAction action) {
      try {
        action.run();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}
