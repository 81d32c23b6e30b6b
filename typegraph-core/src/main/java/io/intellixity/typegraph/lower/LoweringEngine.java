package io.intellixity.typegraph.lower;

import io.intellixity.typegraph.grammar.*;
import io.intellixity.typegraph.graph.*;
import io.intellixity.typegraph.naming.NamingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Lowers grammar elements into a {@link TypeGraph}.
 * <p>
 * Each call to {@link #lower} is an independent run with its own memo table and
 * assembler; the engine itself holds only immutable settings and may be shared.
 * Elements are memoized by identity, so an element referenced from several
 * parents yields one definition that every parent field refers to.
 */
public final class LoweringEngine {
  private static final Logger log = LoggerFactory.getLogger(LoweringEngine.class);

  private final LoweringOptions options;
  private final NamingResolver naming;
  private final EnumSynthesizer enums;

  public LoweringEngine() {
    this(LoweringOptions.defaults());
  }

  public LoweringEngine(LoweringOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.naming = options.namingResolver();
    this.enums = new EnumSynthesizer(naming);
  }

  public TypeGraph lower(DocumentTypeDefinition dtd) {
    return lower(dtd.rootElement());
  }

  /** Lowers {@code root} and everything reachable from it. */
  public TypeGraph lower(ElementDefinition root) {
    Objects.requireNonNull(root, "root");
    long t0 = System.nanoTime();
    Run run = new Run();
    TypeName rootName = run.lowerElement(root);
    TypeGraph graph = run.assembler.build(rootName);
    if (log.isDebugEnabled()) {
      log.debug("typegraph.lower_done root={} types={} elements={} durationMs={}",
          rootName, graph.size(), run.memo.size(), (System.nanoTime() - t0) / 1_000_000);
    }
    return graph;
  }

  /** Memo entry; {@code done == false} while the element's own fields are being lowered. */
  private record Lowered(TypeName name, boolean done) {}

  private final class Run {
    final Map<ElementDefinition, Lowered> memo = new IdentityHashMap<>();
    final Deque<String> path = new ArrayDeque<>();
    final TypeGraphAssembler assembler = new TypeGraphAssembler();

    TypeName lowerElement(ElementDefinition element) {
      Lowered seen = memo.get(element);
      if (seen != null) {
        if (!seen.done()) {
          throw new UnsupportedGrammarException("Cyclic element reference: " + cycle(element.name()));
        }
        return seen.name();
      }

      TypeName name = TypeName.of(identifier(() -> naming.typeName(element.name()), "element '" + element.name() + "'"));
      memo.put(element, new Lowered(name, false));
      path.addLast(element.name());

      List<Field> fields = new ArrayList<>();
      fields.addAll(lowerAttributes(element, name));
      fields.addAll(lowerContent(element, name));
      TypeDef.RecordType record = new TypeDef.RecordType(name, element.name(), distinctFieldNames(fields));
      assembler.add(record, "element '" + element.name() + "'");

      path.removeLast();
      memo.put(element, new Lowered(name, true));
      if (log.isDebugEnabled()) {
        log.debug("typegraph.lower element={} type={} fields={} singleton={}",
            element.name(), name, record.fields().size(), record.isSingleton());
      }
      return name;
    }

    List<Field> lowerAttributes(ElementDefinition element, TypeName owner) {
      List<Field> out = new ArrayList<>(element.attributes().size());
      for (AttributeDefinition a : element.attributes()) {
        out.add(lowerAttribute(element, owner, a));
      }
      return out;
    }

    Field lowerAttribute(ElementDefinition element, TypeName owner, AttributeDefinition a) {
      String fieldName = identifier(() -> naming.attributeFieldName(a.name()),
          "attribute '" + a.name() + "' on element '" + element.name() + "'");

      ValueType type = a.type().accept(new AttributeType.Visitor<>() {
        @Override
        public ValueType visitTokenized(AttributeType.Tokenized t) {
          return switch (t) {
            case CDATA, ID, IDREF, NMTOKEN, ENTITY, NOTATION -> ValueType.text();
            case IDREFS, NMTOKENS, ENTITIES, XML -> ValueType.tokens();
          };
        }

        @Override
        public ValueType visitEnumerated(AttributeType.Enumerated e) {
          TypeName enumName = identifier(() -> naming.enumTypeName(owner, a.name()),
              "attribute '" + a.name() + "' on element '" + element.name() + "'");
          TypeDef.EnumType et = enums.synthesize(enumName, element.name(), a.name(), e.options());
          assembler.add(et, "attribute '" + a.name() + "' on element '" + element.name() + "'");
          return ValueType.ref(et.name());
        }
      });

      Field base = Field.attribute(fieldName, a.name(), Cardinality.REQUIRED, type);
      return a.presence().accept(new AttributePresence.Visitor<>() {
        @Override
        public Field visitRequired(AttributePresence.Required required) {
          return base;
        }

        @Override
        public Field visitImplied(AttributePresence.Implied implied) {
          return Field.attribute(fieldName, a.name(), Cardinality.OPTIONAL, type);
        }

        @Override
        public Field visitDefaulted(AttributePresence.Defaulted d) {
          requireOption(d.value(), element, a);
          return base.withDefault(d.value());
        }

        @Override
        public Field visitFixed(AttributePresence.Fixed f) {
          requireOption(f.value(), element, a);
          return base.asConstant(f.value());
        }
      });
    }

    List<Field> lowerContent(ElementDefinition element, TypeName owner) {
      return element.content().accept(new ContentModel.Visitor<>() {
        @Override
        public List<Field> visitEmpty(ContentModel.Empty empty) {
          return List.of();
        }

        @Override
        public List<Field> visitText(ContentModel.Text text) {
          return List.of(Field.value(Cardinality.REQUIRED, ValueType.text()));
        }

        @Override
        public List<Field> visitAny(ContentModel.AnyContent any) {
          return List.of(Field.value(Cardinality.REQUIRED, ValueType.text()));
        }

        @Override
        public List<Field> visitSequence(ContentModel.Sequence sequence) {
          List<Field> out = new ArrayList<>(sequence.children().size());
          for (ChildRef child : sequence.children()) out.add(lowerChild(child));
          return out;
        }

        @Override
        public List<Field> visitMixed(ContentModel.Mixed mixed) {
          return lowerMixed(element, owner, mixed);
        }

        @Override
        public List<Field> visitChoice(ContentModel.Choice choice) {
          return switch (options.elementChoice()) {
            case REJECT -> throw new UnsupportedGrammarException("Element '" + element.name()
                + "' has a choice as its whole content model; set " + LoweringOptions.PREFIX
                + "elementChoice=WRAP to lower it as a single choice field");
            case WRAP -> List.of(lowerChild(new ChildRef.ChoiceRef(choice.options(), choice.occurrence())));
          };
        }
      });
    }

    List<Field> lowerMixed(ElementDefinition element, TypeName owner, ContentModel.Mixed mixed) {
      if (mixed.children().isEmpty()) {
        if (!mixed.allowsText()) {
          throw new UnsupportedGrammarException("Element '" + element.name() + "' has mixed content with neither text nor children");
        }
        return List.of(Field.value(Cardinality.LIST, ValueType.text()));
      }

      TypeName sumName = naming.contentTypeName(owner);
      Set<ElementDefinition> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
      List<Variant> variants = new ArrayList<>();
      for (ElementDefinition child : mixed.children()) {
        if (!distinct.add(child)) continue;
        TypeName payload = lowerElement(child);
        variants.add(Variant.of(payload.simpleName(), child.name(), payload));
      }
      if (mixed.allowsText()) variants.add(Variant.text(naming.textVariantName(sumName)));

      assembler.add(new TypeDef.SumType(sumName, requireDistinctVariants(sumName, variants)),
          "mixed content of element '" + element.name() + "'");
      return List.of(Field.value(Cardinality.LIST, ValueType.ref(sumName)));
    }

    Field lowerChild(ChildRef child) {
      return child.accept(new ChildRef.Visitor<>() {
        @Override
        public Field visitElement(ChildRef.ElementRef ref) {
          TypeName t = lowerElement(ref.element());
          Cardinality c = ref.occurrence().cardinality();
          return Field.element(naming.fieldName(t.simpleName(), c == Cardinality.LIST), ref.element().name(), c, ValueType.ref(t));
        }

        @Override
        public Field visitChoice(ChildRef.ChoiceRef ref) {
          TypeName sum = lowerChoice(ref);
          Cardinality c = ref.occurrence().cardinality();
          return Field.choice(naming.fieldName(sum.simpleName(), c == Cardinality.LIST), c, sum);
        }
      });
    }

    TypeName lowerChoice(ChildRef.ChoiceRef choice) {
      List<Variant> variants = new ArrayList<>(choice.options().size());
      for (ChildRef option : choice.options()) {
        if (option.occurrence() != Occurrence.ONCE) {
          throw new UnsupportedGrammarException("Choice option " + describe(option) + " carries its own occurrence '"
              + option.occurrence().suffix() + "'; only the whole choice group may be annotated");
        }
        variants.add(option.accept(new ChildRef.Visitor<>() {
          @Override
          public Variant visitElement(ChildRef.ElementRef ref) {
            TypeName t = lowerElement(ref.element());
            return Variant.of(t.simpleName(), ref.element().name(), t);
          }

          @Override
          public Variant visitChoice(ChildRef.ChoiceRef ref) {
            TypeName t = lowerChoice(ref);
            return Variant.of(t.simpleName(), null, t);
          }
        }));
      }

      List<String> members = variants.stream().map(Variant::name).toList();
      TypeName sumName = TypeName.of(naming.sumTypeName(members));
      assembler.add(new TypeDef.SumType(sumName, requireDistinctVariants(sumName, variants)), "choice " + describe(choice));
      return sumName;
    }

    private List<Variant> requireDistinctVariants(TypeName sum, List<Variant> variants) {
      Set<String> names = new HashSet<>();
      for (Variant v : variants) {
        if (!names.add(v.name())) {
          throw new TypeNameCollisionException(sum.nested(v.name()),
              "Sum type " + sum + " has two variants named " + v.name() + " (in " + String.join(" > ", path) + ")");
        }
      }
      return variants;
    }

    /** Attributes keep their names; later fields get a numeric suffix on clash. */
    private List<Field> distinctFieldNames(List<Field> fields) {
      Set<String> taken = new HashSet<>();
      List<Field> out = new ArrayList<>(fields.size());
      for (Field f : fields) {
        String unique = naming.uniqueFieldName(f.name(), taken);
        taken.add(unique);
        out.add(unique.equals(f.name()) ? f : f.withName(unique));
        if (!unique.equals(f.name()) && log.isDebugEnabled()) {
          log.debug("typegraph.rename_field element={} from={} to={}", path.peekLast(), f.name(), unique);
        }
      }
      return out;
    }

    private String cycle(String repeated) {
      List<String> loop = new ArrayList<>();
      boolean in = false;
      for (String p : path) {
        if (p.equals(repeated)) in = true;
        if (in) loop.add(p);
      }
      loop.add(repeated);
      return String.join(" -> ", loop);
    }
  }

  /** A default or fixed value of an enumerated attribute must name one of its tags. */
  private static void requireOption(String literal, ElementDefinition element, AttributeDefinition a) {
    if (a.type() instanceof AttributeType.Enumerated e && !e.options().contains(literal)) {
      throw new UnsupportedGrammarException("Value '" + literal + "' of attribute '" + a.name() + "' on element '"
          + element.name() + "' is not one of its options " + e.options());
    }
  }

  private static <T> T identifier(Supplier<T> derive, String source) {
    try {
      return derive.get();
    } catch (IllegalArgumentException e) {
      throw new UnsupportedGrammarException("Cannot derive an identifier for " + source, e);
    }
  }

  private static String describe(ChildRef ref) {
    return ref.accept(new ChildRef.Visitor<>() {
      @Override
      public String visitElement(ChildRef.ElementRef r) {
        return r.element().name() + r.occurrence().suffix();
      }

      @Override
      public String visitChoice(ChildRef.ChoiceRef r) {
        List<String> parts = new ArrayList<>();
        for (ChildRef o : r.options()) parts.add(describe(o));
        return "(" + String.join(" | ", parts) + ")" + r.occurrence().suffix();
      }
    });
  }
}
