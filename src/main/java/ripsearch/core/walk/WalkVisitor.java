package ripsearch.core.walk;

/**
 * Per-worker callback of a parallel walk. One instance is created for each worker thread, so
 * implementations may keep unsynchronized worker-local state.
 */
public interface WalkVisitor {
  WalkState visit(WalkEntry entry);

  WalkState visitError(WalkError error);
}
