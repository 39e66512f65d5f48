package automaton.graph;

/**
 * Malformed node found while computing equivalence classes.
 *
 * <p>The node is left out of the class map, so it is never merged with any
 * other node.
 *
 * @param node offending node
 * @param message what was wrong with it
 * @param cause exception raised by the node, if any
 */
public record StructuralError(
  Object node,
  String message,
  Throwable cause
) { }
