package ripsearch.platform.adapters.walk;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.ignore.IgnoreNode;
import org.eclipse.jgit.lib.Config;
import org.eclipse.jgit.lib.ConfigConstants;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.util.SystemReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ripsearch.core.search.IoErrorMessages;
import ripsearch.core.walk.WalkError;

/**
 * Stack of ignore files along one branch of the walk. Deeper directories win; within one
 * directory {@code .ignore} wins over {@code .gitignore}. Repository-wide rules ({@code
 * .git/info/exclude}, then the global excludes file) are consulted last.
 */
final class IgnoreRules {
  private static final Logger log = LoggerFactory.getLogger(IgnoreRules.class);

  static final String GITIGNORE = ".gitignore";
  static final String DOT_IGNORE = ".ignore";

  private final IgnoreRules parent;
  private final Path directory;
  private final List<IgnoreNode> nodes;
  private final RepositoryRules repository;
  private final boolean gitIgnore;
  private final boolean ignoreFiles;

  private IgnoreRules(
      IgnoreRules parent,
      Path directory,
      List<IgnoreNode> nodes,
      RepositoryRules repository,
      boolean gitIgnore,
      boolean ignoreFiles) {
    this.parent = parent;
    this.directory = directory;
    this.nodes = nodes;
    this.repository = repository;
    this.gitIgnore = gitIgnore;
    this.ignoreFiles = ignoreFiles;
  }

  static IgnoreRules forRoot(Path root, boolean gitIgnore, boolean ignoreFiles) {
    Path absoluteRoot = root.toAbsolutePath().normalize();
    IgnoreRules rules =
        new IgnoreRules(null, null, List.of(), RepositoryRules.NONE, gitIgnore, ignoreFiles);
    if (!gitIgnore) {
      return rules;
    }

    Path workTree = null;
    IgnoreNode exclude = null;
    File gitDir = new FileRepositoryBuilder().findGitDir(absoluteRoot.toFile()).getGitDir();
    if (gitDir != null) {
      workTree = gitDir.toPath().toAbsolutePath().getParent();
      exclude = loadQuietly(gitDir.toPath().resolve("info").resolve("exclude"));
    }
    IgnoreNode global = loadQuietly(globalExcludesFile());
    rules =
        new IgnoreRules(
            null,
            null,
            List.of(),
            new RepositoryRules(workTree == null ? absoluteRoot : workTree, exclude, global),
            gitIgnore,
            ignoreFiles);

    if (workTree != null && absoluteRoot.startsWith(workTree) && !absoluteRoot.equals(workTree)) {
      List<Path> ancestors = new ArrayList<>();
      for (Path dir = absoluteRoot.getParent();
          dir != null && dir.startsWith(workTree);
          dir = dir.getParent()) {
        ancestors.add(0, dir);
      }
      for (Path ancestor : ancestors) {
        rules = rules.descend(ancestor, error -> log.debug("Ignoring unreadable {}", error));
      }
    }
    return rules;
  }

  IgnoreRules descend(Path dir, Consumer<WalkError> errors) {
    if (!gitIgnore && !ignoreFiles) {
      return this;
    }
    Path absoluteDir = dir.toAbsolutePath().normalize();
    List<IgnoreNode> loaded = new ArrayList<>(2);
    if (ignoreFiles) {
      addIfPresent(loaded, dir.resolve(DOT_IGNORE), errors);
    }
    if (gitIgnore) {
      addIfPresent(loaded, dir.resolve(GITIGNORE), errors);
    }
    if (loaded.isEmpty()) {
      return this;
    }
    return new IgnoreRules(
        this, absoluteDir, List.copyOf(loaded), repository, gitIgnore, ignoreFiles);
  }

  /** {@code TRUE} ignored, {@code FALSE} whitelisted by a negated rule, {@code null} no rule. */
  Boolean check(Path path, boolean isDirectory) {
    Path absolute = path.toAbsolutePath().normalize();
    for (IgnoreRules level = this; level != null; level = level.parent) {
      if (level.directory == null || !absolute.startsWith(level.directory)) {
        continue;
      }
      String relative = toGitPath(level.directory.relativize(absolute));
      for (IgnoreNode node : level.nodes) {
        Boolean result = node.checkIgnored(relative, isDirectory);
        if (result != null) {
          return result;
        }
      }
    }
    return repository.check(absolute, isDirectory);
  }

  private static void addIfPresent(List<IgnoreNode> target, Path file, Consumer<WalkError> errors) {
    if (!Files.isRegularFile(file)) {
      return;
    }
    try {
      target.add(load(file));
    } catch (IOException e) {
      errors.accept(new WalkError(file, 0, IoErrorMessages.describe(e)));
    }
  }

  private static IgnoreNode load(Path file) throws IOException {
    IgnoreNode node = new IgnoreNode();
    try (InputStream in = Files.newInputStream(file)) {
      node.parse(in);
    }
    return node;
  }

  private static IgnoreNode loadQuietly(Path file) {
    if (file == null || !Files.isRegularFile(file)) {
      return null;
    }
    try {
      return load(file);
    } catch (IOException e) {
      log.debug("Failed to read ignore file {}", file, e);
      return null;
    }
  }

  static Path globalExcludesFile() {
    try {
      Config config = SystemReader.getInstance().getUserConfig();
      String configured =
          config.getString(
              ConfigConstants.CONFIG_CORE_SECTION, null, ConfigConstants.CONFIG_KEY_EXCLUDESFILE);
      if (configured != null && !configured.isBlank()) {
        return expandHome(configured.trim());
      }
    } catch (IOException | ConfigInvalidException e) {
      log.debug("Failed to read git user configuration", e);
    }

    String xdgConfigHome = System.getenv("XDG_CONFIG_HOME");
    if (xdgConfigHome != null && !xdgConfigHome.isBlank()) {
      return Path.of(xdgConfigHome, "git", "ignore");
    }
    String home = System.getProperty("user.home");
    return home == null ? null : Path.of(home, ".config", "git", "ignore");
  }

  private static Path expandHome(String value) {
    String home = System.getProperty("user.home");
    if (home != null && (value.equals("~") || value.startsWith("~/"))) {
      return Path.of(home).resolve(value.substring(Math.min(2, value.length())));
    }
    return Path.of(value);
  }

  private static String toGitPath(Path relative) {
    return relative.toString().replace(File.separatorChar, '/');
  }

  private record RepositoryRules(Path base, IgnoreNode exclude, IgnoreNode global) {
    private static final RepositoryRules NONE = new RepositoryRules(null, null, null);

    Boolean check(Path absolute, boolean isDirectory) {
      if (base == null || !absolute.startsWith(base)) {
        return null;
      }
      String relative = toGitPath(base.relativize(absolute));
      if (exclude != null) {
        Boolean result = exclude.checkIgnored(relative, isDirectory);
        if (result != null) {
          return result;
        }
      }
      return global == null ? null : global.checkIgnored(relative, isDirectory);
    }
  }
}
