package io.intellixity.typegraph.codegen.internal;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

public final class JavaFiles {
  private JavaFiles() {}

  public static Path filePath(Path outDir, String pkg, String simpleName) {
    Path dir = outDir;
    if (pkg != null && !pkg.isBlank()) dir = outDir.resolve(pkg.replace('.', '/'));
    return dir.resolve(simpleName + ".java");
  }

  public static IndentedWriter open(Path outDir, String pkg, String simpleName) throws IOException {
    Path file = filePath(outDir, pkg, simpleName);
    Files.createDirectories(file.getParent());
    return new IndentedWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
  }

  /** Java string literal for {@code s}, quotes included. */
  public static String literal(String s) {
    StringBuilder out = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> {
          if (c < 0x20) out.append(String.format("\\u%04x", (int) c));
          else out.append(c);
        }
      }
    }
    return out.append('"').toString();
  }

  public static final class IndentedWriter implements Closeable {
    private final Writer w;
    private int indent;

    public IndentedWriter(Writer w) { this.w = w; }

    public void println(String s) throws IOException {
      for (int i = 0; i < indent; i++) w.write("  ");
      w.write(s);
      w.write("\n");
    }

    public void blank() throws IOException { w.write("\n"); }

    /** Prints {@code header + " {"} and indents. */
    public void begin(String header) throws IOException {
      println(header + " {");
      indent();
    }

    /** Outdents and prints {@code "}" + trailer}. */
    public void end(String trailer) throws IOException {
      outdent();
      println("}" + trailer);
    }

    public void indent() { indent++; }
    public void outdent() { indent = Math.max(0, indent - 1); }

    @Override public void close() throws IOException { w.close(); }
  }
}
