package io.intellixity.typegraph.codegen;

import io.intellixity.typegraph.grammar.DocumentTypeDefinition;
import io.intellixity.typegraph.graph.TypeGraph;
import io.intellixity.typegraph.json.GrammarFormatException;
import io.intellixity.typegraph.json.GrammarJsonReader;
import io.intellixity.typegraph.lower.LoweringEngine;
import io.intellixity.typegraph.lower.LoweringException;
import io.intellixity.typegraph.lower.LoweringOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

/**
 * CLI:
 *   CodegenMain &lt;grammar.json&gt; &lt;generatedOutDir&gt; &lt;javaPackage&gt;
 *
 * Lowering options are read from {@code -Dtypegraph.*} system properties, see
 * {@link LoweringOptions#fromProperties}.
 */
public final class CodegenMain {
  private static final Logger log = LoggerFactory.getLogger(CodegenMain.class);

  private CodegenMain() {}

  public static void main(String[] args) throws Exception {
    if (args.length != 3) {
      System.err.println("Usage: CodegenMain <grammar.json> <generatedOutDir> <javaPackage>");
      System.exit(2);
    }

    try {
      generate(Paths.get(args[0]), Paths.get(args[1]), args[2], System.getProperties());
    } catch (GrammarFormatException | LoweringException e) {
      System.err.println("Cannot generate bindings from " + args[0] + ": " + e.getMessage());
      System.exit(1);
    }
  }

  static List<Path> generate(Path grammarFile, Path outDir, String javaPackage, Properties props) throws IOException {
    LoweringOptions options = LoweringOptions.fromProperties(props);
    DocumentTypeDefinition dtd = new GrammarJsonReader().read(grammarFile);
    TypeGraph graph = new LoweringEngine(options).lower(dtd);
    List<Path> files = new JavaBindingGenerator(javaPackage).generate(graph, outDir);

    log.info("Generated: {} types ({} files) from {} into: {}", graph.size(), files.size(), grammarFile, outDir);
    return files;
  }
}
