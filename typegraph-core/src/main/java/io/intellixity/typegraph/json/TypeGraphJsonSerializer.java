package io.intellixity.typegraph.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.typegraph.graph.*;

import java.io.IOException;

/**
 * Canonical JSON for {@link TypeGraph}. Definitions, fields, variants and tags are
 * written in graph order, so equal graphs serialize to identical bytes.
 */
public final class TypeGraphJsonSerializer extends JsonSerializer<TypeGraph> {
  @Override
  public void serialize(TypeGraph graph, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (graph == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("root", graph.root().qualified());
    g.writeArrayFieldStart("types");
    for (TypeDef def : graph.all()) {
      g.writeStartObject();
      g.writeStringField("name", def.name().qualified());
      def.accept(BODY).write(g);
      g.writeEndObject();
    }
    g.writeEndArray();
    g.writeEndObject();
  }

  private interface JsonWrite {
    void write(JsonGenerator g) throws IOException;
  }

  private static final TypeDef.Visitor<JsonWrite> BODY = new TypeDef.Visitor<>() {
    @Override
    public JsonWrite visitRecord(TypeDef.RecordType r) {
      return g -> {
        g.writeStringField("kind", "record");
        g.writeStringField("serializedName", r.serializedName());
        if (r.isSingleton()) g.writeBooleanField("singleton", true);
        g.writeArrayFieldStart("fields");
        for (Field f : r.fields()) writeField(f, g);
        g.writeEndArray();
      };
    }

    @Override
    public JsonWrite visitSum(TypeDef.SumType s) {
      return g -> {
        g.writeStringField("kind", "sum");
        g.writeArrayFieldStart("variants");
        for (Variant v : s.variants()) {
          g.writeStartObject();
          g.writeStringField("name", v.name());
          if (v.isText()) {
            g.writeBooleanField("text", true);
          } else {
            if (v.serializedName() != null) g.writeStringField("serializedName", v.serializedName());
            g.writeStringField("payload", v.payload().qualified());
          }
          g.writeEndObject();
        }
        g.writeEndArray();
      };
    }

    @Override
    public JsonWrite visitEnum(TypeDef.EnumType e) {
      return g -> {
        g.writeStringField("kind", "enum");
        g.writeStringField("serializedName", e.serializedName());
        g.writeArrayFieldStart("tags");
        for (EnumTag t : e.tags()) {
          g.writeStartObject();
          g.writeStringField("identifier", t.identifier());
          g.writeStringField("literal", t.literal());
          g.writeEndObject();
        }
        g.writeEndArray();
      };
    }
  };

  private static final ValueType.Visitor<JsonWrite> TYPE = new ValueType.Visitor<>() {
    @Override
    public JsonWrite visitText(ValueType.Text text) {
      return g -> g.writeStringField("type", "text");
    }

    @Override
    public JsonWrite visitTokens(ValueType.Tokens tokens) {
      return g -> g.writeStringField("type", "tokens");
    }

    @Override
    public JsonWrite visitRef(ValueType.Ref ref) {
      return g -> {
        g.writeStringField("type", "ref");
        g.writeStringField("ref", ref.name().qualified());
      };
    }
  };

  private static void writeField(Field f, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeStringField("name", f.name());
    if (f.serializedName() != null) g.writeStringField("serializedName", f.serializedName());
    g.writeStringField("role", f.role().name());
    g.writeStringField("cardinality", f.cardinality().name());
    f.type().accept(TYPE).write(g);
    if (f.constant()) {
      g.writeStringField("fixed", f.literal());
    } else if (f.hasDefault()) {
      g.writeStringField("default", f.literal());
    }
    g.writeEndObject();
  }
}
