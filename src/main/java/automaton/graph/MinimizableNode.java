package automaton.graph;

import java.util.Collection;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Vertex of a labeled transition graph which can be collapsed into
 * equivalence classes.
 *
 * <p>Identity is object identity: two distinct node objects are two distinct
 * vertices, even if they compare equal. Successors are shared references, so
 * graphs may converge and contain cycles (including self loops).
 *
 * @param <N> concrete node type
 */
public interface MinimizableNode<N extends MinimizableNode<N>> {

  /**
   * Structural signature of the node.
   *
   * <p>This is derived only from intrinsic properties of the node (its kind
   * and local attributes) and never from its transitions.
   *
   * @return signature (must not be {@code null})
   */
  String signature();

  /**
   * Labels on the outgoing transitions.
   *
   * @return labels for which the node may have a successor
   */
  Collection<String> transitionLabels();

  /**
   * Successor along a label.
   *
   * @param label transition label
   * @return successor, or empty if the label has no transition
   */
  Optional<N> transitionTarget(String label);

  /**
   * Equivalence class last assigned to this node.
   *
   * @return class id, or empty if none was ever assigned
   */
  OptionalInt equivalenceClass();

  /**
   * Record the equivalence class of the node.
   *
   * @param classId class id
   */
  void setEquivalenceClass(int classId);
}
