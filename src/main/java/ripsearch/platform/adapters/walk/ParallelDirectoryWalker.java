package ripsearch.platform.adapters.walk;

import java.nio.file.Path;
import org.springframework.stereotype.Component;
import ripsearch.core.search.SearchOptions;
import ripsearch.core.walk.DirectoryWalkerPort;
import ripsearch.core.walk.WalkPlan;

@Component
public class ParallelDirectoryWalker implements DirectoryWalkerPort {
  @Override
  public WalkPlan build(Path root, SearchOptions options) {
    if (root == null) {
      throw new IllegalArgumentException("root must be non-null.");
    }

    GlobOverrides overrides = GlobOverrides.compile(options.globInclude(), options.globExclude());
    FileTypeRegistry.TypeFilter types = FileTypeRegistry.select(options.fileTypes());
    EntryFilter filter = new EntryFilter(root, overrides, types, options.hidden());
    IgnoreRules rootRules = IgnoreRules.forRoot(root, options.gitIgnore(), options.ignoreFiles());

    return new ParallelWalkPlan(
        root,
        options.resolvedThreads(),
        options.maxDepth(),
        options.followSymlinks(),
        options.sameFileSystem(),
        filter,
        rootRules);
  }
}
