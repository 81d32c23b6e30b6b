package io.intellixity.typegraph.codegen;

import io.intellixity.typegraph.grammar.*;
import io.intellixity.typegraph.graph.TypeGraph;
import io.intellixity.typegraph.graph.TypeName;
import io.intellixity.typegraph.lower.LoweringEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.intellixity.typegraph.grammar.ChildRef.element;
import static org.junit.jupiter.api.Assertions.*;

final class JavaBindingGeneratorTest {
  private final JavaBindingGenerator generator = new JavaBindingGenerator("com.example.notes");

  @Test
  void recordWithDefaultedEnumAndMixedContent() throws Exception {
    TypeGraph g = noteGraph();

    String note = generator.render(g, TypeName.of("Note"));

    assertTrue(note.startsWith("package com.example.notes;\n"), note);
    assertTrue(note.contains("import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;"), note);
    assertTrue(note.contains("@JacksonXmlRootElement(localName = \"note\")\npublic record Note(\n"), note);
    assertTrue(note.contains("@JacksonXmlProperty(isAttribute = true, localName = \"lang\") Note.Lang lang,"), note);
    assertTrue(note.contains("@JacksonXmlText java.util.List<Note.Content> content\n"), note);
    assertTrue(note.contains("if (lang == null) lang = Note.Lang.EN;"), note);
    assertTrue(note.contains("content = content == null ? java.util.List.of() : java.util.List.copyOf(content);"), note);

    assertTrue(note.contains("public enum Lang {"), note);
    assertTrue(note.contains("@JsonProperty(\"en\")"), note);
    assertTrue(note.contains("EN(\"en\"),"), note);
    assertTrue(note.contains("DE(\"de\");"), note);
    assertTrue(note.contains("throw new IllegalArgumentException(\"Unknown Lang literal: \" + literal);"), note);

    assertTrue(note.contains("@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)"), note);
    assertTrue(note.contains("@JsonSubTypes.Type(value = Bold.class, name = \"bold\")"), note);
    assertTrue(note.contains("public sealed interface Content permits Bold, Note.Content.Text {"), note);
    assertTrue(note.contains("record Text(@JacksonXmlText String value) implements Note.Content {}"), note);
  }

  @Test
  void variantRecordImplementsItsSums() throws Exception {
    String bold = generator.render(noteGraph(), TypeName.of("Bold"));

    assertTrue(bold.contains("public record Bold(\n"), bold);
    assertTrue(bold.contains("@JacksonXmlText String content\n"), bold);
    assertTrue(bold.contains(") implements Note.Content {"), bold);
  }

  @Test
  void singletonsChoicesAndLists() throws Exception {
    ElementDefinition a = ElementDefinition.of("a", ContentModel.empty());
    ElementDefinition b = ElementDefinition.of("b", ContentModel.empty());
    ElementDefinition item = ElementDefinition.of("item", ContentModel.text());
    ElementDefinition r = ElementDefinition.of("r", ContentModel.sequence(
        element(item, Occurrence.ONE_OR_MORE), ChildRef.choice(Occurrence.OPTIONAL, element(a), element(b))));
    TypeGraph g = new LoweringEngine().lower(r);

    String aSrc = generator.render(g, TypeName.of("A"));
    assertTrue(aSrc.contains("public record A() implements AOrB {"), aSrc);
    assertTrue(aSrc.contains("public static final A INSTANCE = new A();"), aSrc);

    String sum = generator.render(g, TypeName.of("AOrB"));
    assertTrue(sum.contains("@JsonSubTypes.Type(value = A.class, name = \"a\"),"), sum);
    assertTrue(sum.contains("@JsonSubTypes.Type(value = B.class, name = \"b\")\n"), sum);
    assertTrue(sum.contains("public sealed interface AOrB permits A, B {}"), sum);

    String rSrc = generator.render(g, TypeName.of("R"));
    assertTrue(rSrc.contains("@JacksonXmlElementWrapper(useWrapping = false) @JacksonXmlProperty(localName = \"item\")"
        + " java.util.List<Item> items,"), rSrc);
    assertTrue(rSrc.contains("AOrB aOrB\n"), rSrc);
    assertTrue(rSrc.contains("items = items == null ? java.util.List.of() : java.util.List.copyOf(items);"), rSrc);
  }

  @Test
  void fixedAttributesBecomeConstantsAndKeywordsAreEscaped() throws Exception {
    ElementDefinition doc = ElementDefinition.of("doc", List.of(
        AttributeDefinition.of("version", AttributeType.Tokenized.CDATA, AttributePresence.fixed("1.0")),
        AttributeDefinition.of("class", AttributeType.Tokenized.NMTOKENS, AttributePresence.defaulted("x y"))
    ), ContentModel.empty());
    TypeGraph g = new LoweringEngine().lower(doc);

    String src = generator.render(g, TypeName.of("Doc"));

    assertTrue(src.contains("public static final String VERSION = \"1.0\";"), src);
    assertTrue(src.contains("public String version() {"), src);
    assertTrue(src.contains("return VERSION;"), src);
    assertFalse(src.contains("String version,"), src);
    assertTrue(src.contains("localName = \"class\") java.util.List<String> class_\n"), src);
    assertTrue(src.contains("if (class_ == null) class_ = java.util.List.of(\"x\", \"y\");"), src);
  }

  @Test
  void nestedTypesAreRenderedInsideTheirOwner() {
    assertThrows(IllegalArgumentException.class, () -> generator.render(noteGraph(), TypeName.parse("Note.Lang")));
  }

  @Test
  void writesOneFilePerTopLevelType(@TempDir Path out) throws Exception {
    TypeGraph g = noteGraph();

    List<Path> files = generator.generate(g, out);

    assertEquals(List.of(
        out.resolve("com/example/notes/Bold.java"),
        out.resolve("com/example/notes/Note.java")
    ), files);
    assertEquals(generator.render(g, TypeName.of("Note")), Files.readString(files.get(1)));
  }

  @Test
  void generatedSourcesCompile(@TempDir Path out) throws Exception {
    ElementDefinition a = ElementDefinition.of("a", ContentModel.empty());
    ElementDefinition b = ElementDefinition.of("b", ContentModel.empty());
    ElementDefinition c = ElementDefinition.of("c", ContentModel.text());
    ElementDefinition type = ElementDefinition.of("type", List.of(
        AttributeDefinition.of("type", AttributeType.enumerated("a", "b"), AttributePresence.required())
    ), ContentModel.empty());
    ElementDefinition content = ElementDefinition.of("content", ContentModel.mixed(true, b));
    ElementDefinition text = ElementDefinition.of("text", ContentModel.mixed(true, b));
    ElementDefinition title = ElementDefinition.of("title", ContentModel.text());
    ElementDefinition bold = ElementDefinition.of("bold", ContentModel.text());
    ElementDefinition body = ElementDefinition.of("body", ContentModel.mixed(true, bold));
    ElementDefinition note = ElementDefinition.of("note", List.of(
        AttributeDefinition.of("lang", AttributeType.enumerated("en", "de"), AttributePresence.defaulted("en")),
        AttributeDefinition.of("version", AttributeType.Tokenized.CDATA, AttributePresence.fixed("1.0")),
        AttributeDefinition.of("class", AttributeType.Tokenized.NMTOKENS, AttributePresence.defaulted("x y")),
        AttributeDefinition.of("refs", AttributeType.Tokenized.IDREFS, AttributePresence.implied())
    ), ContentModel.sequence(element(title), element(body, Occurrence.OPTIONAL)));
    ElementDefinition string = ElementDefinition.of("string", ContentModel.text());
    ElementDefinition doc = ElementDefinition.of("doc", List.of(
        AttributeDefinition.of("kind", AttributeType.enumerated("x", "y"), AttributePresence.fixed("x")),
        AttributeDefinition.of("hashCode", AttributeType.Tokenized.CDATA, AttributePresence.implied())
    ), ContentModel.empty());
    ElementDefinition root = ElementDefinition.of("root", ContentModel.sequence(
        element(type), element(content), element(text), element(note, Occurrence.OPTIONAL),
        ChildRef.choice(Occurrence.ZERO_OR_MORE, element(a), ChildRef.choice(Occurrence.ONCE, element(b), element(c))),
        element(string, Occurrence.ZERO_OR_MORE), element(doc)));
    TypeGraph g = new LoweringEngine().lower(root);

    List<Path> files = generator.generate(g, out.resolve("src"));

    String typeSrc = Files.readString(out.resolve("src/com/example/notes/Type.java"));
    assertTrue(typeSrc.contains("Type.TypeValue type\n"), typeSrc);
    assertTrue(typeSrc.contains("public enum TypeValue {"), typeSrc);
    assertTrue(typeSrc.contains("private final java.lang.String literal;"), typeSrc);
    String contentSrc = Files.readString(out.resolve("src/com/example/notes/Content.java"));
    assertTrue(contentSrc.contains("public sealed interface ContentValue permits B, Content.ContentValue.Text {"), contentSrc);
    String textSrc = Files.readString(out.resolve("src/com/example/notes/Text.java"));
    assertTrue(textSrc.contains("record TextValue(@JacksonXmlText java.lang.String value) implements Text.Content {}"), textSrc);
    String docSrc = Files.readString(out.resolve("src/com/example/notes/Doc.java"));
    assertTrue(docSrc.contains("java.lang.String hashCode_\n"), docSrc);

    JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
    assertNotNull(javac, "tests need a JDK");
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    Path classes = Files.createDirectories(out.resolve("classes"));
    try (StandardJavaFileManager fm = javac.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
      List<String> options = List.of("-proc:none", "-d", classes.toString(), "-classpath", String.join(File.pathSeparator,
          jarOf(com.fasterxml.jackson.annotation.JsonProperty.class),
          jarOf(com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement.class)));
      boolean ok = javac.getTask(null, fm, diagnostics, options, null, fm.getJavaFileObjectsFromPaths(files)).call();
      assertTrue(ok, diagnostics.getDiagnostics().toString());
    }
    assertTrue(Files.isRegularFile(classes.resolve("com/example/notes/Type$TypeValue.class")));
  }

  private static String jarOf(Class<?> type) throws Exception {
    return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
  }

  private static TypeGraph noteGraph() {
    ElementDefinition bold = ElementDefinition.of("bold", ContentModel.text());
    ElementDefinition note = ElementDefinition.of("note", List.of(
        AttributeDefinition.of("lang", AttributeType.enumerated("en", "de"), AttributePresence.defaulted("en"))
    ), ContentModel.mixed(true, bold));
    return new LoweringEngine().lower(note);
  }
}
