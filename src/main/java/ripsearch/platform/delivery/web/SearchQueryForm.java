package ripsearch.platform.delivery.web;

import java.util.List;
import ripsearch.core.search.SearchOptions;

public class SearchQueryForm {
  private String pattern;
  private String root;

  private Boolean caseInsensitive;
  private Boolean smartCase;
  private Boolean wordBoundary;
  private Integer contextBefore;
  private Integer contextAfter;
  private Boolean invertMatch;
  private Boolean hidden;
  private Boolean followSymlinks;
  private Boolean gitIgnore;
  private Boolean ignoreFiles;
  private Boolean sameFileSystem;
  private Integer maxDepth;
  private Integer threads;
  private List<String> fileTypes;
  private List<String> globInclude;
  private List<String> globExclude;
  private Long maxFilesize;
  private Boolean mmap;
  private Boolean fixedStrings;
  private Boolean multiline;
  private Long maxCount;

  /** Unset fields keep the {@link SearchOptions#defaults()} value. */
  public SearchOptions toOptions(int defaultThreads) {
    SearchOptions.Builder builder = SearchOptions.builder().threads(defaultThreads);
    if (caseInsensitive != null) {
      builder.caseInsensitive(caseInsensitive);
    }
    if (smartCase != null) {
      builder.smartCase(smartCase);
    }
    if (wordBoundary != null) {
      builder.wordBoundary(wordBoundary);
    }
    if (contextBefore != null) {
      builder.contextBefore(contextBefore);
    }
    if (contextAfter != null) {
      builder.contextAfter(contextAfter);
    }
    if (invertMatch != null) {
      builder.invertMatch(invertMatch);
    }
    if (hidden != null) {
      builder.hidden(hidden);
    }
    if (followSymlinks != null) {
      builder.followSymlinks(followSymlinks);
    }
    if (gitIgnore != null) {
      builder.gitIgnore(gitIgnore);
    }
    if (ignoreFiles != null) {
      builder.ignoreFiles(ignoreFiles);
    }
    if (sameFileSystem != null) {
      builder.sameFileSystem(sameFileSystem);
    }
    if (threads != null) {
      builder.threads(threads);
    }
    if (mmap != null) {
      builder.mmap(mmap);
    }
    if (fixedStrings != null) {
      builder.fixedStrings(fixedStrings);
    }
    if (multiline != null) {
      builder.multiline(multiline);
    }
    return builder
        .maxDepth(maxDepth)
        .fileTypes(fileTypes)
        .globInclude(globInclude)
        .globExclude(globExclude)
        .maxFilesize(maxFilesize)
        .maxCount(maxCount)
        .build();
  }

  public String getPattern() {
    return pattern;
  }

  public void setPattern(String pattern) {
    this.pattern = pattern;
  }

  public String getRoot() {
    return root;
  }

  public void setRoot(String root) {
    this.root = root;
  }

  public Boolean getCaseInsensitive() {
    return caseInsensitive;
  }

  public void setCaseInsensitive(Boolean caseInsensitive) {
    this.caseInsensitive = caseInsensitive;
  }

  public Boolean getSmartCase() {
    return smartCase;
  }

  public void setSmartCase(Boolean smartCase) {
    this.smartCase = smartCase;
  }

  public Boolean getWordBoundary() {
    return wordBoundary;
  }

  public void setWordBoundary(Boolean wordBoundary) {
    this.wordBoundary = wordBoundary;
  }

  public Integer getContextBefore() {
    return contextBefore;
  }

  public void setContextBefore(Integer contextBefore) {
    this.contextBefore = contextBefore;
  }

  public Integer getContextAfter() {
    return contextAfter;
  }

  public void setContextAfter(Integer contextAfter) {
    this.contextAfter = contextAfter;
  }

  public Boolean getInvertMatch() {
    return invertMatch;
  }

  public void setInvertMatch(Boolean invertMatch) {
    this.invertMatch = invertMatch;
  }

  public Boolean getHidden() {
    return hidden;
  }

  public void setHidden(Boolean hidden) {
    this.hidden = hidden;
  }

  public Boolean getFollowSymlinks() {
    return followSymlinks;
  }

  public void setFollowSymlinks(Boolean followSymlinks) {
    this.followSymlinks = followSymlinks;
  }

  public Boolean getGitIgnore() {
    return gitIgnore;
  }

  public void setGitIgnore(Boolean gitIgnore) {
    this.gitIgnore = gitIgnore;
  }

  public Boolean getIgnoreFiles() {
    return ignoreFiles;
  }

  public void setIgnoreFiles(Boolean ignoreFiles) {
    this.ignoreFiles = ignoreFiles;
  }

  public Boolean getSameFileSystem() {
    return sameFileSystem;
  }

  public void setSameFileSystem(Boolean sameFileSystem) {
    this.sameFileSystem = sameFileSystem;
  }

  public Integer getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(Integer maxDepth) {
    this.maxDepth = maxDepth;
  }

  public Integer getThreads() {
    return threads;
  }

  public void setThreads(Integer threads) {
    this.threads = threads;
  }

  public List<String> getFileTypes() {
    return fileTypes;
  }

  public void setFileTypes(List<String> fileTypes) {
    this.fileTypes = fileTypes;
  }

  public List<String> getGlobInclude() {
    return globInclude;
  }

  public void setGlobInclude(List<String> globInclude) {
    this.globInclude = globInclude;
  }

  public List<String> getGlobExclude() {
    return globExclude;
  }

  public void setGlobExclude(List<String> globExclude) {
    this.globExclude = globExclude;
  }

  public Long getMaxFilesize() {
    return maxFilesize;
  }

  public void setMaxFilesize(Long maxFilesize) {
    this.maxFilesize = maxFilesize;
  }

  public Boolean getMmap() {
    return mmap;
  }

  public void setMmap(Boolean mmap) {
    this.mmap = mmap;
  }

  public Boolean getFixedStrings() {
    return fixedStrings;
  }

  public void setFixedStrings(Boolean fixedStrings) {
    this.fixedStrings = fixedStrings;
  }

  public Boolean getMultiline() {
    return multiline;
  }

  public void setMultiline(Boolean multiline) {
    this.multiline = multiline;
  }

  public Long getMaxCount() {
    return maxCount;
  }

  public void setMaxCount(Long maxCount) {
    this.maxCount = maxCount;
  }
}
