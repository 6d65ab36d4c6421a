package ripsearch.platform.adapters.scan;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import org.springframework.stereotype.Component;
import ripsearch.core.search.BinaryFileException;
import ripsearch.core.search.FileSearcherPort;
import ripsearch.core.search.PatternMatcher;
import ripsearch.core.search.SearchMatch;
import ripsearch.core.search.SearchOptions;

/**
 * Scans a file one line at a time straight from its byte buffer. Lines are decoded individually;
 * a line that is not valid UTF-8 only fails the file when it would be reported.
 */
@Component
public class LineFileSearcher implements FileSearcherPort {
  static final long MMAP_THRESHOLD_BYTES = 1L << 20;
  static final long MAX_FILE_BYTES = Integer.MAX_VALUE - 8;

  @Override
  public List<SearchMatch> search(PatternMatcher matcher, Path path, SearchOptions options)
      throws IOException {
    ByteBuffer content = read(path, options.mmap());
    if (containsNul(content)) {
      throw new BinaryFileException(path);
    }

    LineReader lines = new LineReader(content, skipByteOrderMark(content));
    BitSet matched = options.multiline() ? multilineMatches(matcher, lines) : null;
    long maxCount = options.hasMaxCount() ? options.maxCount() : Long.MAX_VALUE;

    List<SearchMatch> results = new ArrayList<>();
    Deque<Line> before = new ArrayDeque<>(options.contextBefore());
    long emitted = 0;
    int afterRemaining = 0;

    for (Line line = lines.next(); line != null; line = lines.next()) {
      boolean hit = matched != null ? matched.get(line.index()) : matcher.isMatch(line.text());
      if (hit != options.invertMatch()) {
        for (Line context : before) {
          results.add(SearchMatch.contextLine(path, context.number(), reportable(context)));
        }
        before.clear();
        int column = options.invertMatch() ? 0 : matcher.locate(line.text()).orElse(0);
        results.add(SearchMatch.match(path, line.number(), column, reportable(line)));
        afterRemaining = options.contextAfter();
        if (++emitted >= maxCount) {
          break;
        }
      } else if (afterRemaining > 0) {
        results.add(SearchMatch.contextLine(path, line.number(), reportable(line)));
        afterRemaining--;
      } else if (options.contextBefore() > 0) {
        if (before.size() == options.contextBefore()) {
          before.removeFirst();
        }
        before.addLast(line);
      }
    }

    return results;
  }

  private static String reportable(Line line) throws CharacterCodingException {
    if (line.malformed()) {
      throw new MalformedInputException(line.byteLength());
    }
    return line.text();
  }

  private static BitSet multilineMatches(PatternMatcher matcher, LineReader lines)
      throws CharacterCodingException {
    String text = lines.decodeRemaining();
    int[] starts = lineStarts(text);
    BitSet matched = new BitSet(starts.length);
    for (PatternMatcher.MatchRegion region : matcher.findAll(text)) {
      if (region.start() >= text.length()) {
        continue;
      }
      int first = lineAt(starts, region.start());
      int last = lineAt(starts, Math.max(region.start(), region.end() - 1));
      matched.set(first, last + 1);
    }
    return matched;
  }

  private static int[] lineStarts(String text) {
    int[] starts = new int[16];
    int count = 0;
    int position = 0;
    while (position < text.length()) {
      if (count == starts.length) {
        int[] grown = new int[starts.length * 2];
        System.arraycopy(starts, 0, grown, 0, starts.length);
        starts = grown;
      }
      starts[count++] = position;
      int newline = text.indexOf('\n', position);
      position = newline < 0 ? text.length() : newline + 1;
    }
    int[] trimmed = new int[count];
    System.arraycopy(starts, 0, trimmed, 0, count);
    return trimmed;
  }

  private static int lineAt(int[] starts, int offset) {
    int low = 0;
    int high = starts.length - 1;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (starts[mid] <= offset) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  private static ByteBuffer read(Path path, boolean mmap) throws IOException {
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      long size = channel.size();
      if (size > MAX_FILE_BYTES) {
        throw new IOException("File too large to search (" + size + " bytes)");
      }
      if (mmap && size >= MMAP_THRESHOLD_BYTES) {
        return channel.map(FileChannel.MapMode.READ_ONLY, 0, size);
      }
    }
    return ByteBuffer.wrap(Files.readAllBytes(path));
  }

  private static boolean containsNul(ByteBuffer content) {
    for (int i = content.position(); i < content.limit(); i++) {
      if (content.get(i) == 0) {
        return true;
      }
    }
    return false;
  }

  private static int skipByteOrderMark(ByteBuffer content) {
    int start = content.position();
    if (content.limit() - start >= 3
        && content.get(start) == (byte) 0xEF
        && content.get(start + 1) == (byte) 0xBB
        && content.get(start + 2) == (byte) 0xBF) {
      return start + 3;
    }
    return start;
  }

  private record Line(int index, String text, boolean malformed, int byteLength) {
    long number() {
      return index + 1L;
    }
  }

  private static final class LineReader {
    private final ByteBuffer content;
    private final CharsetDecoder strict =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private final CharsetDecoder lenient =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private int position;
    private int index;

    private LineReader(ByteBuffer content, int start) {
      this.content = content;
      this.position = start;
    }

    Line next() throws CharacterCodingException {
      int limit = content.limit();
      if (position >= limit) {
        return null;
      }
      int end = position;
      while (end < limit && content.get(end) != '\n') {
        end++;
      }
      int following = end < limit ? end + 1 : end;
      while (end > position && content.get(end - 1) == '\r') {
        end--;
      }

      Line line = decode(position, end);
      position = following;
      index++;
      return line;
    }

    /** Decodes the rest of the content with replacement characters; line breaks are kept. */
    String decodeRemaining() throws CharacterCodingException {
      return lenient.decode(window(position, content.limit())).toString();
    }

    private Line decode(int start, int end) throws CharacterCodingException {
      try {
        return new Line(index, strict.decode(window(start, end)).toString(), false, end - start);
      } catch (MalformedInputException e) {
        return new Line(index, lenient.decode(window(start, end)).toString(), true, end - start);
      }
    }

    private ByteBuffer window(int start, int end) {
      ByteBuffer window = content.duplicate();
      window.limit(end);
      window.position(start);
      return window;
    }
  }
}
