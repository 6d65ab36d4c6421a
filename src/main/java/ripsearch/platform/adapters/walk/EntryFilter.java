package ripsearch.platform.adapters.walk;

import java.nio.file.Path;

/** Decides whether a walked entry is yielded: overrides, ignore files, types, then hidden. */
final class EntryFilter {
  private final Path root;
  private final GlobOverrides overrides;
  private final FileTypeRegistry.TypeFilter types;
  private final boolean includeHidden;

  EntryFilter(
      Path root,
      GlobOverrides overrides,
      FileTypeRegistry.TypeFilter types,
      boolean includeHidden) {
    this.root = root;
    this.overrides = overrides;
    this.types = types;
    this.includeHidden = includeHidden;
  }

  boolean accept(Path path, boolean isDirectory, IgnoreRules rules) {
    if (!overrides.isEmpty()) {
      GlobOverrides.Decision decision = overrides.match(root.relativize(path), isDirectory);
      if (decision == GlobOverrides.Decision.EXCLUDE) {
        return false;
      }
      if (decision == GlobOverrides.Decision.INCLUDE) {
        return true;
      }
      if (overrides.hasIncludes() && !isDirectory) {
        return false;
      }
    }

    Boolean ignored = rules.check(path, isDirectory);
    if (Boolean.TRUE.equals(ignored)) {
      return false;
    }
    if (!isDirectory && types != null && !types.matches(path)) {
      return false;
    }
    return includeHidden || ignored != null || !isHidden(path);
  }

  static boolean isHidden(Path path) {
    Path name = path.getFileName();
    return name != null && name.toString().startsWith(".");
  }
}
