package automaton;

/**
 * A transition was asked of a machine which is not in any state.
 */
public final class NoCurrentStateException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public NoCurrentStateException() {
    super("machine has no current state");
  }
}
