package cal.sync.types;

/**
 * The stages of {@link cal.sync.impls.SyncCoordinator}, in the order it passes through them.
 */
public enum SyncState {
  UNINITIALIZED,
  ALIGNING,
  LINKING,
  RESTORING,
  STEADY,
  STOPPED
}
