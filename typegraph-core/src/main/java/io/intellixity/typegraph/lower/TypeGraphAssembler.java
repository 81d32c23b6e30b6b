package io.intellixity.typegraph.lower;

import io.intellixity.typegraph.graph.TypeDef;
import io.intellixity.typegraph.graph.TypeGraph;
import io.intellixity.typegraph.graph.TypeName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects definitions for one lowering run into a flat map keyed by qualified name.
 * A second definition under a taken name is merged when equal to the first and
 * rejected otherwise.
 */
final class TypeGraphAssembler {
  private static final Logger log = LoggerFactory.getLogger(TypeGraphAssembler.class);

  private final Map<TypeName, TypeDef> definitions = new LinkedHashMap<>();
  private final Map<TypeName, String> origins = new LinkedHashMap<>();

  /** @param origin grammar construct the definition came from, for error messages */
  TypeName add(TypeDef def, String origin) {
    TypeDef existing = definitions.get(def.name());
    if (existing == null) {
      definitions.put(def.name(), def);
      origins.put(def.name(), origin);
      return def.name();
    }
    if (existing.equals(def)) {
      if (log.isTraceEnabled()) log.trace("typegraph.merge type={} origin={} first={}", def.name(), origin, origins.get(def.name()));
      return def.name();
    }
    throw new TypeNameCollisionException(def.name(),
        "Type name " + def.name() + " derived from " + origin + " is already used by a different definition derived from "
            + origins.get(def.name()));
  }

  TypeGraph build(TypeName root) {
    return new TypeGraph(root, definitions);
  }
}
