package ripsearch.core.walk;

public enum WalkState {
  CONTINUE,
  SKIP,
  QUIT
}
