package io.intellixity.typegraph.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.typegraph.grammar.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the JSON form of a grammar model:
 *
 * <pre>
 * {
 *   "root": "note",
 *   "elements": [
 *     { "name": "note",
 *       "attributes": [ { "name": "lang", "type": { "enum": ["en", "de"] }, "presence": { "default": "en" } } ],
 *       "content": { "sequence": [ "title", { "element": "body", "occurs": "?" } ] } },
 *     { "name": "title", "content": "#PCDATA" },
 *     { "name": "body",  "content": { "mixed": ["b"], "text": true } },
 *     { "name": "b",     "content": "#PCDATA" }
 *   ],
 *   "entities": [ { "name": "n", "value": "noun" }, { "name": "x", "url": "x.ent" } ]
 * }
 * </pre>
 *
 * Content is {@code "EMPTY"}, {@code "ANY"}, {@code "#PCDATA"}, or an object with one of
 * {@code sequence}, {@code mixed} or {@code choice}. A child is an object with
 * {@code element} or {@code choice} plus an optional {@code occurs} suffix, or a
 * string such as {@code "sense+"}. Attribute types are the DTD keywords or
 * {@code {"enum": [...]}}; presence is {@code #REQUIRED}, {@code #IMPLIED} (the
 * default), {@code {"default": v}} or {@code {"fixed": v}}. Elements may be
 * referenced before they are listed.
 */
public final class GrammarJsonReader {
  private static final Logger log = LoggerFactory.getLogger(GrammarJsonReader.class);

  private final ObjectMapper json;

  public GrammarJsonReader() {
    this(new ObjectMapper());
  }

  public GrammarJsonReader(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public DocumentTypeDefinition read(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return read(in);
    }
  }

  /** @throws GrammarFormatException on malformed JSON; other {@link IOException}s propagate */
  public DocumentTypeDefinition read(InputStream in) throws IOException {
    JsonNode root;
    try {
      root = json.readTree(in);
    } catch (JsonProcessingException e) {
      throw notJson(e);
    }
    return read(root);
  }

  public DocumentTypeDefinition read(String text) {
    try {
      return read(json.readTree(text));
    } catch (JsonProcessingException e) {
      throw notJson(e);
    }
  }

  public DocumentTypeDefinition read(JsonNode root) {
    if (root == null || !root.isObject()) throw new GrammarFormatException("$", "grammar JSON must be an object");

    JsonNode elements = root.get("elements");
    if (elements == null || !elements.isArray() || elements.isEmpty()) {
      throw new GrammarFormatException("$.elements", "expected a non-empty array");
    }

    // Pass 1: declare every element so references can be resolved in any order.
    Map<String, ElementDefinition> byName = new LinkedHashMap<>();
    for (int i = 0; i < elements.size(); i++) {
      String path = "$.elements[" + i + "]";
      JsonNode e = elements.get(i);
      if (!e.isObject()) throw new GrammarFormatException(path, "expected an object");
      String name = requiredText(e, "name", path);
      List<AttributeDefinition> attributes = parseAttributes(e.get("attributes"), path + ".attributes");
      if (byName.putIfAbsent(name, ElementDefinition.declare(name, attributes)) != null) {
        throw new GrammarFormatException(path + ".name", "element '" + name + "' is declared twice");
      }
    }

    // Pass 2: define content models.
    for (int i = 0; i < elements.size(); i++) {
      String path = "$.elements[" + i + "]";
      JsonNode e = elements.get(i);
      ElementDefinition def = byName.get(e.get("name").asText());
      JsonNode content = e.get("content");
      if (content == null) throw new GrammarFormatException(path + ".content", "missing");
      def.define(parseContent(content, byName, path + ".content"));
    }

    String rootName = requiredText(root, "root", "$");
    ElementDefinition rootElement = byName.get(rootName);
    if (rootElement == null) throw new GrammarFormatException("$.root", "unknown element '" + rootName + "'");

    List<EntityDeclaration> entities = parseEntities(root.get("entities"));
    if (log.isDebugEnabled()) {
      log.debug("typegraph.grammar_read root={} elements={} entities={}", rootName, byName.size(), entities.size());
    }
    return new DocumentTypeDefinition(rootElement, entities);
  }

  private static ContentModel parseContent(JsonNode n, Map<String, ElementDefinition> byName, String path) {
    if (n.isTextual()) {
      return switch (n.asText().trim().toUpperCase(Locale.ROOT)) {
        case "EMPTY" -> ContentModel.empty();
        case "ANY" -> ContentModel.any();
        case "#PCDATA", "(#PCDATA)" -> ContentModel.text();
        default -> throw new GrammarFormatException(path, "unknown content keyword '" + n.asText() + "'");
      };
    }
    if (!n.isObject()) throw new GrammarFormatException(path, "expected a keyword or an object");

    if (n.has("sequence")) {
      return new ContentModel.Sequence(parseChildren(n.get("sequence"), byName, path + ".sequence"));
    }
    if (n.has("mixed")) {
      JsonNode m = n.get("mixed");
      if (!m.isArray()) throw new GrammarFormatException(path + ".mixed", "expected an array of element names");
      List<ElementDefinition> children = new ArrayList<>();
      for (int i = 0; i < m.size(); i++) {
        children.add(resolve(m.get(i).asText(), byName, path + ".mixed[" + i + "]"));
      }
      JsonNode text = n.get("text");
      return new ContentModel.Mixed(text == null || text.asBoolean(), children);
    }
    if (n.has("choice")) {
      return new ContentModel.Choice(parseChildren(n.get("choice"), byName, path + ".choice"),
          parseOccurrence(n.get("occurs"), path + ".occurs"));
    }
    throw new GrammarFormatException(path, "expected one of sequence, mixed, choice");
  }

  private static List<ChildRef> parseChildren(JsonNode arr, Map<String, ElementDefinition> byName, String path) {
    if (arr == null || !arr.isArray() || arr.isEmpty()) throw new GrammarFormatException(path, "expected a non-empty array");
    List<ChildRef> out = new ArrayList<>(arr.size());
    for (int i = 0; i < arr.size(); i++) {
      out.add(parseChild(arr.get(i), byName, path + "[" + i + "]"));
    }
    return out;
  }

  private static ChildRef parseChild(JsonNode n, Map<String, ElementDefinition> byName, String path) {
    if (n.isTextual()) {
      String s = n.asText().trim();
      Occurrence occ = Occurrence.ONCE;
      if (!s.isEmpty() && "?+*".indexOf(s.charAt(s.length() - 1)) >= 0) {
        occ = Occurrence.fromSuffix(s.substring(s.length() - 1));
        s = s.substring(0, s.length() - 1);
      }
      return new ChildRef.ElementRef(resolve(s, byName, path), occ);
    }
    if (!n.isObject()) throw new GrammarFormatException(path, "expected an element name or an object");

    Occurrence occ = parseOccurrence(n.get("occurs"), path + ".occurs");
    if (n.has("element")) {
      return new ChildRef.ElementRef(resolve(n.get("element").asText(), byName, path + ".element"), occ);
    }
    if (n.has("choice")) {
      return new ChildRef.ChoiceRef(parseChildren(n.get("choice"), byName, path + ".choice"), occ);
    }
    throw new GrammarFormatException(path, "expected 'element' or 'choice'");
  }

  private static Occurrence parseOccurrence(JsonNode n, String path) {
    if (n == null || n.isNull()) return Occurrence.ONCE;
    try {
      return Occurrence.fromSuffix(n.asText());
    } catch (IllegalArgumentException e) {
      throw new GrammarFormatException(path, "expected one of '', '?', '+', '*'", e);
    }
  }

  private static List<AttributeDefinition> parseAttributes(JsonNode arr, String path) {
    if (arr == null || arr.isNull()) return List.of();
    if (!arr.isArray()) throw new GrammarFormatException(path, "expected an array");
    List<AttributeDefinition> out = new ArrayList<>(arr.size());
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < arr.size(); i++) {
      String p = path + "[" + i + "]";
      JsonNode a = arr.get(i);
      String name = requiredText(a, "name", p);
      if (!seen.add(name)) throw new GrammarFormatException(p + ".name", "attribute '" + name + "' is declared twice");
      out.add(new AttributeDefinition(name, parseAttributeType(a.get("type"), p + ".type"),
          parsePresence(a.get("presence"), p + ".presence")));
    }
    return out;
  }

  private static AttributeType parseAttributeType(JsonNode n, String path) {
    if (n == null || n.isNull()) throw new GrammarFormatException(path, "missing");
    if (n.isObject()) {
      JsonNode opts = n.get("enum");
      if (opts == null || !opts.isArray() || opts.isEmpty()) {
        throw new GrammarFormatException(path + ".enum", "expected a non-empty array of options");
      }
      List<String> options = new ArrayList<>(opts.size());
      for (JsonNode o : opts) options.add(o.asText());
      return new AttributeType.Enumerated(options);
    }
    String kw = n.asText().trim().toUpperCase(Locale.ROOT);
    try {
      return AttributeType.Tokenized.valueOf(kw);
    } catch (IllegalArgumentException e) {
      throw new GrammarFormatException(path, "unknown attribute type '" + n.asText() + "'", e);
    }
  }

  private static AttributePresence parsePresence(JsonNode n, String path) {
    if (n == null || n.isNull()) return AttributePresence.implied();
    if (n.isObject()) {
      if (n.has("default")) return AttributePresence.defaulted(n.get("default").asText());
      if (n.has("fixed")) return AttributePresence.fixed(n.get("fixed").asText());
      throw new GrammarFormatException(path, "expected 'default' or 'fixed'");
    }
    return switch (n.asText().trim().toUpperCase(Locale.ROOT)) {
      case "#REQUIRED" -> AttributePresence.required();
      case "#IMPLIED" -> AttributePresence.implied();
      default -> throw new GrammarFormatException(path, "unknown presence '" + n.asText() + "'");
    };
  }

  private static List<EntityDeclaration> parseEntities(JsonNode arr) {
    if (arr == null || arr.isNull()) return List.of();
    if (!arr.isArray()) throw new GrammarFormatException("$.entities", "expected an array");
    List<EntityDeclaration> out = new ArrayList<>(arr.size());
    for (int i = 0; i < arr.size(); i++) {
      String p = "$.entities[" + i + "]";
      JsonNode e = arr.get(i);
      String name = requiredText(e, "name", p);
      if (e.has("value")) {
        out.add(new EntityDeclaration.Internal(name, e.get("value").asText()));
      } else if (e.has("url")) {
        out.add(new EntityDeclaration.External(name, e.get("url").asText()));
      } else {
        throw new GrammarFormatException(p, "expected 'value' or 'url'");
      }
    }
    return out;
  }

  private static GrammarFormatException notJson(JsonProcessingException e) {
    return new GrammarFormatException("$", "not valid JSON: " + e.getOriginalMessage(), e);
  }

  private static ElementDefinition resolve(String name, Map<String, ElementDefinition> byName, String path) {
    ElementDefinition e = byName.get(name);
    if (e == null) throw new GrammarFormatException(path, "unknown element '" + name + "'");
    return e;
  }

  private static String requiredText(JsonNode n, String field, String path) {
    JsonNode v = n == null ? null : n.get(field);
    if (v == null || !v.isTextual() || v.asText().isBlank()) {
      throw new GrammarFormatException(path + "." + field, "expected a non-blank string");
    }
    return v.asText();
  }
}
