package automaton;

/**
 * The current state has no transition for the requested label.
 */
public final class UndefinedTransitionException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final String stateId;
  private final String label;

  public UndefinedTransitionException(String stateId, String label) {
    super("no transition '" + label + "' from state '" + stateId + "'");
    this.stateId = stateId;
    this.label = label;
  }

  public String stateId() {
    return stateId;
  }

  public String label() {
    return label;
  }
}
