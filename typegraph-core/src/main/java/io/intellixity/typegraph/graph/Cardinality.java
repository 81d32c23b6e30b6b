package io.intellixity.typegraph.graph;

public enum Cardinality {
  REQUIRED,
  OPTIONAL,
  LIST
}
