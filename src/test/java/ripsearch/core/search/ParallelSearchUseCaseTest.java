package ripsearch.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.MalformedInputException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ripsearch.core.walk.DirectoryWalkerPort;
import ripsearch.core.walk.WalkEntry;
import ripsearch.core.walk.WalkError;
import ripsearch.core.walk.WalkPlan;
import ripsearch.core.walk.WalkState;
import ripsearch.core.walk.WalkVisitor;

@ExtendWith(MockitoExtension.class)
class ParallelSearchUseCaseTest {
  private static final Path ROOT = Path.of("root");

  @Mock private PatternCompilerPort patternCompiler;
  @Mock private DirectoryWalkerPort directoryWalker;
  @Mock private FileSearcherPort fileSearcher;
  @Mock private PatternMatcher matcher;
  @Mock private WalkPlan plan;

  private ParallelSearchUseCase useCase;

  @BeforeEach
  void setUp() {
    useCase = new ParallelSearchUseCase(patternCompiler, directoryWalker, fileSearcher);
  }

  @Test
  void invalidPattern_failsBeforeWalking() {
    when(patternCompiler.compile(eq("foo("), any()))
        .thenThrow(new InvalidPatternException("foo(", "Invalid pattern: Unclosed group"));

    InvalidPatternException e =
        assertThrows(
            InvalidPatternException.class,
            () -> useCase.searchParallel("foo(", ROOT, SearchOptions.defaults()));

    assertEquals("foo(", e.pattern());
    verifyNoInteractions(directoryWalker, fileSearcher);
  }

  @Test
  void invalidTypeFilter_failsBeforeSearchingFiles() {
    when(patternCompiler.compile(any(), any())).thenReturn(matcher);
    when(directoryWalker.build(any(), any())).thenThrow(new InvalidTypeFilterException("nope"));

    assertThrows(
        InvalidTypeFilterException.class,
        () -> useCase.searchParallel("foo", ROOT, SearchOptions.defaults()));

    verifyNoInteractions(fileSearcher);
  }

  @Test
  void perFileErrors_areRecorded_andOtherFilesStillSearched() throws Exception {
    Path good = ROOT.resolve("a.txt");
    Path denied = ROOT.resolve("b.txt");
    stubWalk(visitor -> {
      visitor.visit(file(good));
      visitor.visit(file(denied));
    });
    when(fileSearcher.search(any(), eq(good), any()))
        .thenReturn(List.of(SearchMatch.match(good, 1, 0, "foo")));
    when(fileSearcher.search(any(), eq(denied), any()))
        .thenThrow(new AccessDeniedException(denied.toString()));

    SearchResult result = useCase.searchParallel("foo", ROOT, SearchOptions.defaults());

    assertEquals(List.of(SearchMatch.match(good, 1, 0, "foo")), result.matches());
    assertEquals(List.of(denied + ": Permission denied"), result.errors());
    assertEquals(1, result.stats().matches());
    assertEquals(2, result.stats().filesSearched());
    assertEquals(1, result.stats().filesMatched());
    assertFalse(result.cancelled());
  }

  @Test
  void binaryAndUndecodableFiles_areSkippedSilently() throws Exception {
    Path binary = ROOT.resolve("image.bin");
    Path latin1 = ROOT.resolve("legacy.txt");
    stubWalk(visitor -> {
      visitor.visit(file(binary));
      visitor.visit(file(latin1));
    });
    when(fileSearcher.search(any(), eq(binary), any()))
        .thenThrow(new BinaryFileException(binary));
    when(fileSearcher.search(any(), eq(latin1), any()))
        .thenThrow(new MalformedInputException(1));

    SearchResult result = useCase.searchParallel("foo", ROOT, SearchOptions.defaults());

    assertTrue(result.matches().isEmpty());
    assertTrue(result.errors().isEmpty());
    assertEquals(2, result.stats().filesSearched());
    assertEquals(0, result.stats().filesMatched());
  }

  @Test
  void enumerationErrors_areRecordedAsPathAndMessage() {
    Path locked = ROOT.resolve("locked");
    stubWalk(visitor -> visitor.visitError(new WalkError(locked, 1, "Permission denied")));

    SearchResult result = useCase.searchParallel("foo", ROOT, SearchOptions.defaults());

    assertEquals(List.of(locked + ": Permission denied"), result.errors());
    assertEquals(0, result.stats().filesSearched());
  }

  @Test
  void contextLines_doNotCountAsMatches() throws Exception {
    Path path = ROOT.resolve("a.txt");
    stubWalk(visitor -> visitor.visit(file(path)));
    when(fileSearcher.search(any(), eq(path), any()))
        .thenReturn(
            List.of(
                SearchMatch.contextLine(path, 1, "before"),
                SearchMatch.match(path, 2, 0, "foo"),
                SearchMatch.contextLine(path, 3, "after")));

    SearchResult result =
        useCase.searchParallel(
            "foo", ROOT, SearchOptions.builder().contextBefore(1).contextAfter(1).build());

    assertEquals(3, result.matches().size());
    assertEquals(1, result.stats().matches());
    assertEquals(1, result.stats().filesMatched());
  }

  @Test
  void filesWithOnlyContextLines_areNotCollected() throws Exception {
    Path path = ROOT.resolve("a.txt");
    stubWalk(visitor -> visitor.visit(file(path)));
    when(fileSearcher.search(any(), eq(path), any()))
        .thenReturn(List.of(SearchMatch.contextLine(path, 1, "before")));

    SearchResult result = useCase.searchParallel("foo", ROOT, SearchOptions.defaults());

    assertTrue(result.matches().isEmpty());
    assertEquals(0, result.stats().filesMatched());
  }

  @Test
  void maxFilesize_isCheckedAgainstTheWalkedSize() throws Exception {
    Path small = ROOT.resolve("small.txt");
    Path large = ROOT.resolve("large.txt");
    stubWalk(visitor -> {
      visitor.visit(new WalkEntry(small, 1, false, 4));
      visitor.visit(new WalkEntry(large, 1, false, 5));
    });
    when(fileSearcher.search(any(), eq(small), any())).thenReturn(List.of());

    SearchResult result =
        useCase.searchParallel("foo", ROOT, SearchOptions.builder().maxFilesize(4L).build());

    assertEquals(1, result.stats().filesSearched());
    verify(fileSearcher, never()).search(any(), eq(large), any());
  }

  @Test
  void cancelledToken_quitsBeforeSearching() throws Exception {
    CancellationToken cancellation = new CancellationToken();
    cancellation.cancel();
    Path path = ROOT.resolve("a.txt");
    stubWalk(visitor -> assertEquals(WalkState.QUIT, visitor.visit(file(path))));

    SearchResult result =
        useCase.searchParallel("foo", ROOT, SearchOptions.defaults(), cancellation);

    assertTrue(result.cancelled());
    assertTrue(result.matches().isEmpty());
    verify(fileSearcher, never()).search(any(), any(), any());
  }

  @Test
  void unexpectedFailure_cancelsTheRun() throws Exception {
    Path broken = ROOT.resolve("broken.txt");
    Path later = ROOT.resolve("later.txt");
    stubWalk(visitor -> {
      assertEquals(WalkState.QUIT, visitor.visit(file(broken)));
      assertEquals(WalkState.QUIT, visitor.visit(file(later)));
    });
    when(fileSearcher.search(any(), eq(broken), any()))
        .thenThrow(new IllegalStateException("boom"));

    SearchResult result = useCase.searchParallel("foo", ROOT, SearchOptions.defaults());

    assertTrue(result.cancelled());
    assertEquals(1, result.errors().size());
    assertTrue(result.errors().get(0).startsWith(broken + ": "));
    verify(fileSearcher, never()).search(any(), eq(later), any());
  }

  @Test
  void directories_areWalkedButNotSearched() throws Exception {
    stubWalk(visitor ->
        assertEquals(
            WalkState.CONTINUE, visitor.visit(new WalkEntry(ROOT.resolve("sub"), 1, true, 0))));

    SearchResult result = useCase.searchParallel("foo", ROOT, SearchOptions.defaults());

    assertEquals(0, result.stats().filesSearched());
    verify(fileSearcher, never()).search(any(), any(), any());
  }

  private void stubWalk(Consumer<WalkVisitor> walk) {
    when(patternCompiler.compile(any(), any())).thenReturn(matcher);
    when(directoryWalker.build(any(), any())).thenReturn(plan);
    lenient().when(plan.root()).thenReturn(ROOT);
    lenient().when(plan.threads()).thenReturn(1);
    doAnswer(
            invocation -> {
              Supplier<WalkVisitor> factory = invocation.getArgument(0);
              walk.accept(factory.get());
              return null;
            })
        .when(plan)
        .run(any());
  }

  private static WalkEntry file(Path path) {
    return new WalkEntry(path, 1, false, 4);
  }
}
