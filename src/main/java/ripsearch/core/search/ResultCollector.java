package ripsearch.core.search;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single consumer of per-file batches. Workers {@link #submit} whole batches; the collector thread
 * appends them in arrival order until {@link #close()} has been called and the queue is drained.
 */
public class ResultCollector implements Runnable {
  private static final FileBatch END = new FileBatch(Path.of(""), List.of());

  private final BlockingQueue<FileBatch> queue = new LinkedBlockingQueue<>();
  private final List<SearchMatch> matches = new ArrayList<>();
  private final Lock lock = new ReentrantLock();

  public void submit(FileBatch batch) {
    if (batch.matches().isEmpty()) {
      return;
    }
    queue.offer(batch);
  }

  public void close() {
    queue.offer(END);
  }

  @Override
  public void run() {
    try {
      while (true) {
        FileBatch batch = queue.take();
        if (batch == END) {
          return;
        }
        append(batch);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public List<SearchMatch> matches() {
    lock.lock();
    try {
      return List.copyOf(matches);
    } finally {
      lock.unlock();
    }
  }

  private void append(FileBatch batch) {
    lock.lock();
    try {
      matches.addAll(batch.matches());
    } finally {
      lock.unlock();
    }
  }
}
