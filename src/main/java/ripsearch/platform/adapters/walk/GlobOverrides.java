package ripsearch.platform.adapters.walk;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.jgit.errors.InvalidPatternException;
import org.eclipse.jgit.fnmatch.FileNameMatcher;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import ripsearch.core.search.InvalidGlobException;

/**
 * Include and exclude globs with gitignore semantics: a glob without a slash matches at any depth,
 * {@code **} spans zero or more directories and a trailing slash matches directories only.
 */
final class GlobOverrides {
  enum Decision {
    NONE,
    INCLUDE,
    EXCLUDE
  }

  private final List<FastIgnoreRule> includes;
  private final List<FastIgnoreRule> excludes;

  private GlobOverrides(List<FastIgnoreRule> includes, List<FastIgnoreRule> excludes) {
    this.includes = includes;
    this.excludes = excludes;
  }

  static GlobOverrides compile(List<String> includeGlobs, List<String> excludeGlobs) {
    return new GlobOverrides(compileAll(includeGlobs), compileAll(excludeGlobs));
  }

  boolean isEmpty() {
    return includes.isEmpty() && excludes.isEmpty();
  }

  boolean hasIncludes() {
    return !includes.isEmpty();
  }

  Decision match(Path relative, boolean isDirectory) {
    String path = relative.toString().replace(File.separatorChar, '/');
    if (path.isEmpty()) {
      return Decision.NONE;
    }
    for (FastIgnoreRule exclude : excludes) {
      if (exclude.isMatch(path, isDirectory)) {
        return Decision.EXCLUDE;
      }
    }
    for (FastIgnoreRule include : includes) {
      if (include.isMatch(path, isDirectory)) {
        return Decision.INCLUDE;
      }
    }
    return Decision.NONE;
  }

  private static List<FastIgnoreRule> compileAll(List<String> globs) {
    List<FastIgnoreRule> compiled = new ArrayList<>(globs.size());
    for (String glob : globs) {
      if (glob == null || glob.isBlank()) {
        continue;
      }
      compiled.add(compileRule(glob.trim()));
    }
    return List.copyOf(compiled);
  }

  private static FastIgnoreRule compileRule(String source) {
    // FastIgnoreRule logs and matches nothing on a bad pattern, so validate first.
    try {
      new FileNameMatcher(source, null);
    } catch (InvalidPatternException e) {
      throw new InvalidGlobException(
          source, "Invalid glob '" + source + "': " + e.getMessage(), e);
    }
    return new FastIgnoreRule(source);
  }
}
