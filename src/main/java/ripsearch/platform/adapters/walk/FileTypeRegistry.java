package ripsearch.platform.adapters.walk;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import ripsearch.core.search.InvalidTypeFilterException;

final class FileTypeRegistry {
  private static final Map<String, List<String>> DEFAULT_TYPES = defaultTypes();

  private FileTypeRegistry() {}

  /** Returns {@code null} when no type is selected, meaning every file passes. */
  static TypeFilter select(List<String> typeNames) {
    if (typeNames == null || typeNames.isEmpty()) {
      return null;
    }

    FileSystem fileSystem = FileSystems.getDefault();
    List<PathMatcher> matchers = new ArrayList<>();
    for (String typeName : typeNames) {
      String normalized = typeName == null ? "" : typeName.trim().toLowerCase(Locale.ROOT);
      List<String> globs = DEFAULT_TYPES.get(normalized);
      if (globs == null) {
        throw new InvalidTypeFilterException(typeName);
      }
      for (String glob : globs) {
        matchers.add(fileSystem.getPathMatcher("glob:" + glob));
      }
    }
    return new TypeFilter(List.copyOf(matchers));
  }

  record TypeFilter(List<PathMatcher> matchers) {
    boolean matches(Path path) {
      Path name = path.getFileName();
      if (name == null) {
        return false;
      }
      for (PathMatcher matcher : matchers) {
        if (matcher.matches(name)) {
          return true;
        }
      }
      return false;
    }
  }

  private static Map<String, List<String>> defaultTypes() {
    Map<String, List<String>> types = new LinkedHashMap<>();
    types.put("c", List.of("*.c", "*.h"));
    types.put("cpp", List.of("*.cpp", "*.cc", "*.cxx", "*.hpp", "*.hh", "*.hxx", "*.h"));
    types.put("cs", List.of("*.cs"));
    types.put("css", List.of("*.css", "*.scss", "*.sass", "*.less"));
    types.put("go", List.of("*.go"));
    types.put("html", List.of("*.html", "*.htm"));
    types.put("java", List.of("*.java"));
    types.put("js", List.of("*.js", "*.jsx", "*.mjs", "*.cjs"));
    types.put("json", List.of("*.json"));
    types.put("kotlin", List.of("*.kt", "*.kts"));
    types.put("lua", List.of("*.lua"));
    types.put("make", List.of("Makefile", "makefile", "GNUmakefile", "*.mk"));
    types.put("markdown", List.of("*.md", "*.markdown"));
    types.put("md", List.of("*.md", "*.markdown"));
    types.put("py", List.of("*.py", "*.pyi"));
    types.put("ruby", List.of("*.rb", "Gemfile", "Rakefile"));
    types.put("rust", List.of("*.rs"));
    types.put("scala", List.of("*.scala", "*.sc"));
    types.put("sh", List.of("*.sh", "*.bash", "*.zsh"));
    types.put("sql", List.of("*.sql"));
    types.put("toml", List.of("*.toml"));
    types.put("ts", List.of("*.ts", "*.tsx", "*.mts", "*.cts"));
    types.put("txt", List.of("*.txt"));
    types.put("xml", List.of("*.xml", "*.xsd", "*.xsl"));
    types.put("yaml", List.of("*.yaml", "*.yml"));
    types.put("zig", List.of("*.zig"));
    return Map.copyOf(types);
  }
}
