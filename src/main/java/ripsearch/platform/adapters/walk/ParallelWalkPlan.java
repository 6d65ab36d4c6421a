package ripsearch.platform.adapters.walk;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ripsearch.core.search.IoErrorMessages;
import ripsearch.core.walk.WalkEntry;
import ripsearch.core.walk.WalkError;
import ripsearch.core.walk.WalkPlan;
import ripsearch.core.walk.WalkState;
import ripsearch.core.walk.WalkVisitor;

/**
 * Fixed pool of walker threads sharing one LIFO deque of directories. A directory is listed by
 * whichever worker takes it; subdirectories are pushed back so idle workers pick them up. The run
 * ends when no directory is pending or any visitor answers {@link WalkState#QUIT}.
 */
final class ParallelWalkPlan implements WalkPlan {
  private static final Logger log = LoggerFactory.getLogger(ParallelWalkPlan.class);

  private final Path root;
  private final int threads;
  private final Integer maxDepth;
  private final boolean followSymlinks;
  private final boolean sameFileSystem;
  private final EntryFilter filter;
  private final IgnoreRules rootRules;

  ParallelWalkPlan(
      Path root,
      int threads,
      Integer maxDepth,
      boolean followSymlinks,
      boolean sameFileSystem,
      EntryFilter filter,
      IgnoreRules rootRules) {
    this.root = root;
    this.threads = threads;
    this.maxDepth = maxDepth;
    this.followSymlinks = followSymlinks;
    this.sameFileSystem = sameFileSystem;
    this.filter = filter;
    this.rootRules = rootRules;
  }

  @Override
  public Path root() {
    return root;
  }

  @Override
  public int threads() {
    return threads;
  }

  @Override
  public void run(Supplier<WalkVisitor> visitorFactory) {
    new Execution(visitorFactory).start();
  }

  private record DirectoryWork(Path path, int depth, IgnoreRules rules, Ancestors ancestors) {}

  /** Real paths of the directories above a work item; only tracked when following links. */
  private record Ancestors(Path realPath, Ancestors parent) {
    boolean contains(Path candidate) {
      for (Ancestors node = this; node != null; node = node.parent) {
        if (node.realPath.equals(candidate)) {
          return true;
        }
      }
      return false;
    }
  }

  private final class Execution {
    private final DirectoryWork stop = new DirectoryWork(null, -1, null, null);

    private final Supplier<WalkVisitor> visitorFactory;
    private final BlockingDeque<DirectoryWork> queue = new LinkedBlockingDeque<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean quit = new AtomicBoolean();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private FileStore rootStore;

    private Execution(Supplier<WalkVisitor> visitorFactory) {
      this.visitorFactory = visitorFactory;
    }

    private void start() {
      pending.set(1);
      List<Thread> workers = new ArrayList<>(threads);
      for (int i = 0; i < threads; i++) {
        boolean first = i == 0;
        Thread worker = new Thread(() -> work(first), "search-walker-" + i);
        worker.setDaemon(true);
        workers.add(worker);
      }
      workers.forEach(Thread::start);

      try {
        for (Thread worker : workers) {
          worker.join();
        }
      } catch (InterruptedException e) {
        quit.set(true);
        workers.forEach(Thread::interrupt);
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while walking " + root, e);
      }

      RuntimeException workerFailure = failure.get();
      if (workerFailure != null) {
        throw workerFailure;
      }
    }

    private void work(boolean visitsRoot) {
      WalkVisitor visitor;
      try {
        visitor = visitorFactory.get();
      } catch (RuntimeException e) {
        fail(e);
        if (visitsRoot) {
          finishOne();
        }
        return;
      }

      if (visitsRoot) {
        try {
          visitRoot(visitor);
        } catch (RuntimeException e) {
          fail(e);
        } finally {
          finishOne();
        }
      }

      while (true) {
        DirectoryWork work;
        try {
          work = queue.takeFirst();
        } catch (InterruptedException e) {
          quit.set(true);
          Thread.currentThread().interrupt();
          return;
        }
        if (work == stop) {
          return;
        }
        try {
          if (!quit.get()) {
            listDirectory(work, visitor);
          }
        } catch (RuntimeException e) {
          fail(e);
        } finally {
          finishOne();
        }
      }
    }

    private void visitRoot(WalkVisitor visitor) {
      BasicFileAttributes attributes;
      try {
        attributes = Files.readAttributes(root, BasicFileAttributes.class);
      } catch (IOException e) {
        apply(visitor.visitError(new WalkError(root, 0, IoErrorMessages.describe(e))));
        return;
      }

      boolean directory = attributes.isDirectory();
      WalkState state = apply(visitor.visit(new WalkEntry(root, 0, directory, attributes.size())));
      if (!directory || state != WalkState.CONTINUE || !canDescend(0)) {
        return;
      }

      Ancestors ancestors = null;
      try {
        if (sameFileSystem) {
          rootStore = Files.getFileStore(root);
        }
        if (followSymlinks) {
          ancestors = new Ancestors(root.toRealPath(), null);
        }
      } catch (IOException e) {
        apply(visitor.visitError(new WalkError(root, 0, IoErrorMessages.describe(e))));
        return;
      }
      push(new DirectoryWork(root, 0, rootRules, ancestors));
    }

    private void listDirectory(DirectoryWork work, WalkVisitor visitor) {
      IgnoreRules rules =
          work.rules().descend(work.path(), error -> apply(visitor.visitError(error)));
      int childDepth = work.depth() + 1;

      try (DirectoryStream<Path> children = Files.newDirectoryStream(work.path())) {
        for (Path child : children) {
          if (quit.get()) {
            return;
          }
          visitChild(child, childDepth, rules, work.ancestors(), visitor);
        }
      } catch (IOException e) {
        apply(
            visitor.visitError(
                new WalkError(work.path(), work.depth(), IoErrorMessages.describe(e))));
      } catch (DirectoryIteratorException e) {
        apply(
            visitor.visitError(
                new WalkError(work.path(), work.depth(), IoErrorMessages.describe(e.getCause()))));
      }
    }

    private void visitChild(
        Path child, int depth, IgnoreRules rules, Ancestors ancestors, WalkVisitor visitor) {
      BasicFileAttributes attributes;
      try {
        attributes =
            Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        if (attributes.isSymbolicLink()) {
          if (!followSymlinks) {
            return;
          }
          attributes = Files.readAttributes(child, BasicFileAttributes.class);
        }
      } catch (IOException e) {
        apply(visitor.visitError(new WalkError(child, depth, IoErrorMessages.describe(e))));
        return;
      }

      boolean directory = attributes.isDirectory();
      if (!directory && !attributes.isRegularFile()) {
        return;
      }
      if (!filter.accept(child, directory, rules)) {
        return;
      }

      Path realPath = null;
      if (directory) {
        try {
          if (sameFileSystem && rootStore != null && !rootStore.equals(Files.getFileStore(child))) {
            log.debug("Not crossing into another file system at {}", child);
            return;
          }
          if (followSymlinks) {
            realPath = child.toRealPath();
            if (ancestors != null && ancestors.contains(realPath)) {
              String message = "File system loop found: " + child + " points to " + realPath;
              apply(visitor.visitError(new WalkError(child, depth, message)));
              return;
            }
          }
        } catch (IOException e) {
          apply(visitor.visitError(new WalkError(child, depth, IoErrorMessages.describe(e))));
          return;
        }
      }

      WalkState state =
          apply(visitor.visit(new WalkEntry(child, depth, directory, attributes.size())));
      if (directory && state == WalkState.CONTINUE && canDescend(depth)) {
        Ancestors childAncestors = realPath == null ? null : new Ancestors(realPath, ancestors);
        push(new DirectoryWork(child, depth, rules, childAncestors));
      }
    }

    private boolean canDescend(int depth) {
      return maxDepth == null || depth < maxDepth;
    }

    private WalkState apply(WalkState state) {
      if (state == WalkState.QUIT) {
        quit.set(true);
      }
      return state;
    }

    private void push(DirectoryWork work) {
      pending.incrementAndGet();
      queue.addFirst(work);
    }

    private void finishOne() {
      if (pending.decrementAndGet() == 0) {
        for (int i = 0; i < threads; i++) {
          queue.addLast(stop);
        }
      }
    }

    private void fail(RuntimeException e) {
      failure.compareAndSet(null, e);
      quit.set(true);
    }
  }
}
