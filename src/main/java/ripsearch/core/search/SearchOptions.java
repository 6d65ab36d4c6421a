package ripsearch.core.search;

import java.util.ArrayList;
import java.util.List;

public record SearchOptions(
    boolean caseInsensitive,
    boolean smartCase,
    boolean wordBoundary,
    int contextBefore,
    int contextAfter,
    boolean invertMatch,
    boolean hidden,
    boolean followSymlinks,
    boolean gitIgnore,
    boolean ignoreFiles,
    boolean sameFileSystem,
    Integer maxDepth,
    int threads,
    List<String> fileTypes,
    List<String> globInclude,
    List<String> globExclude,
    Long maxFilesize,
    boolean mmap,
    boolean fixedStrings,
    boolean multiline,
    Long maxCount) {

  public SearchOptions {
    if (contextBefore < 0 || contextAfter < 0) {
      throw new IllegalArgumentException("context line counts must be >= 0.");
    }
    if (threads < 0) {
      throw new IllegalArgumentException("threads must be >= 0.");
    }
    if (maxDepth != null && maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be >= 0.");
    }
    fileTypes = fileTypes == null ? List.of() : List.copyOf(fileTypes);
    globInclude = globInclude == null ? List.of() : List.copyOf(globInclude);
    globExclude = globExclude == null ? List.of() : List.copyOf(globExclude);
  }

  public static SearchOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .caseInsensitive(caseInsensitive)
        .smartCase(smartCase)
        .wordBoundary(wordBoundary)
        .contextBefore(contextBefore)
        .contextAfter(contextAfter)
        .invertMatch(invertMatch)
        .hidden(hidden)
        .followSymlinks(followSymlinks)
        .gitIgnore(gitIgnore)
        .ignoreFiles(ignoreFiles)
        .sameFileSystem(sameFileSystem)
        .maxDepth(maxDepth)
        .threads(threads)
        .fileTypes(fileTypes)
        .globInclude(globInclude)
        .globExclude(globExclude)
        .maxFilesize(maxFilesize)
        .mmap(mmap)
        .fixedStrings(fixedStrings)
        .multiline(multiline)
        .maxCount(maxCount);
  }

  public boolean hasMaxFilesize() {
    return maxFilesize != null && maxFilesize > 0;
  }

  public boolean hasMaxCount() {
    return maxCount != null && maxCount > 0;
  }

  public int resolvedThreads() {
    return threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  public static final class Builder {
    private boolean caseInsensitive;
    private boolean smartCase = true;
    private boolean wordBoundary;
    private int contextBefore;
    private int contextAfter;
    private boolean invertMatch;
    private boolean hidden;
    private boolean followSymlinks;
    private boolean gitIgnore = true;
    private boolean ignoreFiles = true;
    private boolean sameFileSystem = true;
    private Integer maxDepth;
    private int threads;
    private final List<String> fileTypes = new ArrayList<>();
    private final List<String> globInclude = new ArrayList<>();
    private final List<String> globExclude = new ArrayList<>();
    private Long maxFilesize;
    private boolean mmap = true;
    private boolean fixedStrings;
    private boolean multiline;
    private Long maxCount;

    private Builder() {}

    public Builder caseInsensitive(boolean value) {
      this.caseInsensitive = value;
      return this;
    }

    public Builder smartCase(boolean value) {
      this.smartCase = value;
      return this;
    }

    public Builder wordBoundary(boolean value) {
      this.wordBoundary = value;
      return this;
    }

    public Builder contextBefore(int value) {
      this.contextBefore = value;
      return this;
    }

    public Builder contextAfter(int value) {
      this.contextAfter = value;
      return this;
    }

    public Builder invertMatch(boolean value) {
      this.invertMatch = value;
      return this;
    }

    public Builder hidden(boolean value) {
      this.hidden = value;
      return this;
    }

    public Builder followSymlinks(boolean value) {
      this.followSymlinks = value;
      return this;
    }

    public Builder gitIgnore(boolean value) {
      this.gitIgnore = value;
      return this;
    }

    public Builder ignoreFiles(boolean value) {
      this.ignoreFiles = value;
      return this;
    }

    public Builder sameFileSystem(boolean value) {
      this.sameFileSystem = value;
      return this;
    }

    public Builder maxDepth(Integer value) {
      this.maxDepth = value;
      return this;
    }

    public Builder threads(int value) {
      this.threads = value;
      return this;
    }

    public Builder fileTypes(List<String> values) {
      this.fileTypes.clear();
      if (values != null) {
        this.fileTypes.addAll(values);
      }
      return this;
    }

    public Builder globInclude(List<String> values) {
      this.globInclude.clear();
      if (values != null) {
        this.globInclude.addAll(values);
      }
      return this;
    }

    public Builder globExclude(List<String> values) {
      this.globExclude.clear();
      if (values != null) {
        this.globExclude.addAll(values);
      }
      return this;
    }

    public Builder maxFilesize(Long value) {
      this.maxFilesize = value;
      return this;
    }

    public Builder mmap(boolean value) {
      this.mmap = value;
      return this;
    }

    public Builder fixedStrings(boolean value) {
      this.fixedStrings = value;
      return this;
    }

    public Builder multiline(boolean value) {
      this.multiline = value;
      return this;
    }

    public Builder maxCount(Long value) {
      this.maxCount = value;
      return this;
    }

    public SearchOptions build() {
      return new SearchOptions(
          caseInsensitive,
          smartCase,
          wordBoundary,
          contextBefore,
          contextAfter,
          invertMatch,
          hidden,
          followSymlinks,
          gitIgnore,
          ignoreFiles,
          sameFileSystem,
          maxDepth,
          threads,
          fileTypes,
          globInclude,
          globExclude,
          maxFilesize,
          mmap,
          fixedStrings,
          multiline,
          maxCount);
    }
  }
}
