package automaton.graph;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

/**
 * Partition of the nodes reachable from a root into equivalence classes.
 *
 * <p>Nodes are kept in an arena: each node has an integer handle (its position
 * in {@link #nodes()}) and class ids live in a side table indexed by handle.
 *
 * @param <N> node type
 */
public final class EquivalenceClasses<N extends MinimizableNode<N>> {

  private final List<N> nodes;
  private final Map<N, Integer> handles;
  private final int[] classOf;
  private final int classCount;
  private final int refinementPasses;
  private final List<StructuralError> structuralErrors;

  EquivalenceClasses(
    List<N> nodes,
    Map<N, Integer> handles,
    int[] classOf,
    int classCount,
    int refinementPasses,
    List<StructuralError> structuralErrors
  ) {
    this.nodes = Collections.unmodifiableList(nodes);
    this.handles = handles;
    this.classOf = classOf;
    this.classCount = classCount;
    this.refinementPasses = refinementPasses;
    this.structuralErrors = Collections.unmodifiableList(structuralErrors);
  }

  /**
   * Class of a node.
   *
   * @param node node to look up (compared by identity)
   * @return class id, or empty if the node was not reachable or was malformed
   */
  public OptionalInt classOf(N node) {
    final Integer handle = handles.get(node);
    return handle == null ? OptionalInt.empty() : OptionalInt.of(classOf[handle]);
  }

  /**
   * Check whether two nodes landed in the same class.
   *
   * @param first some node
   * @param second some other node
   * @return whether both are classified and share a class
   */
  public boolean equivalent(N first, N second) {
    final OptionalInt a = classOf(first);
    final OptionalInt b = classOf(second);
    return a.isPresent() && b.isPresent() && a.getAsInt() == b.getAsInt();
  }

  /**
   * Members of every class.
   *
   * @return class ids (ascending) mapped to identity sets of members
   */
  public Map<Integer, Set<N>> classes() {
    final var classes = new TreeMap<Integer, Set<N>>();
    for (int handle = 0; handle < nodes.size(); handle++) {
      classes
        .computeIfAbsent(classOf[handle], k -> Collections.newSetFromMap(new IdentityHashMap<>()))
        .add(nodes.get(handle));
    }
    return classes;
  }

  /**
   * Classified nodes, in the order they were first reached.
   *
   * @return nodes, indexed by handle
   */
  public List<N> nodes() {
    return nodes;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int classCount() {
    return classCount;
  }

  /**
   * Number of refinement passes run, including the final pass which found
   * nothing left to split.
   *
   * @return pass count (never more than the node count)
   */
  public int refinementPasses() {
    return refinementPasses;
  }

  public List<StructuralError> structuralErrors() {
    return structuralErrors;
  }

  @Override
  public String toString() {
    return "EquivalenceClasses(nodes = " + nodes.size() + ", classes = " + classCount
      + ", passes = " + refinementPasses + ", errors = " + structuralErrors.size() + ")";
  }
}
