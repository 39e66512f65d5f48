package automaton.graph;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.Stack;
import java.util.TreeMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses behaviourally equivalent nodes of a labeled transition graph.
 *
 * <p>Two nodes are equivalent if they have the same structural signature and,
 * for every label, either both lack a successor or both have successors which
 * are themselves equivalent. This is computed with Moore-style partition
 * refinement:
 *
 * <ol>
 *   <li>collect every node reachable from the root (cycles are fine)
 *   <li>seed one class per distinct structural signature
 *   <li>split classes whose members disagree on the classes of their
 *       successors (the first sub-group keeps the old id)
 *   <li>stop after a pass which splits nothing
 * </ol>
 *
 * <p>Classes only ever split, so each partition refines the previous one and
 * there are at most as many passes as there are nodes.
 */
public final class EquivalenceClassComputer {

  private static final Logger log = LoggerFactory.getLogger(EquivalenceClassComputer.class);

  /**
   * Class id of a node which has not been classified.
   *
   * <p>Successors outside the class map get ids below this one, distinct per
   * successor, so two nodes only agree on such a transition if it leads to the
   * very same node.
   */
  public static final int UNKNOWN_CLASS = -1;

  private EquivalenceClassComputer() { }

  /**
   * Compute equivalence classes for everything reachable from a root.
   *
   * @param root node from which to start
   * @return partition of the reachable nodes
   */
  public static <N extends MinimizableNode<N>> EquivalenceClasses<N> compute(N root) {
    return compute(root, partition -> { });
  }

  /**
   * Compute equivalence classes for everything reachable from a root.
   *
   * @param root node from which to start
   * @param onPartition invoked with a copy of the class table (indexed by node
   *   handle) after the initial partition and after every pass which split
   *   something
   * @return partition of the reachable nodes
   */
  public static <N extends MinimizableNode<N>> EquivalenceClasses<N> compute(
    N root,
    Consumer<int[]> onPartition
  ) {
    Objects.requireNonNull(root, "root node");

    final var structuralErrors = new ArrayList<StructuralError>();
    final var nodes = new ArrayList<N>();
    final var handles = new IdentityHashMap<N, Integer>();
    final var signatures = new ArrayList<String>();
    final var successors = new ArrayList<TreeMap<String, N>>();

    // Reachability: each node is pushed at most once
    final Set<N> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    final var toVisit = new Stack<N>();
    toVisit.push(root);
    seen.add(root);

    while (!toVisit.empty()) {
      final N node = toVisit.pop();
      final String signature;
      final var edges = new TreeMap<String, N>();
      try {
        signature = node.signature();
        if (signature == null) {
          structuralErrors.add(new StructuralError(node, "node has no structural signature", null));
          continue;
        }
        for (String label : node.transitionLabels()) {
          node.transitionTarget(label).ifPresent(target -> edges.put(label, target));
        }
      } catch (RuntimeException err) {
        structuralErrors.add(new StructuralError(node, "malformed node: " + err.getMessage(), err));
        continue;
      }

      handles.put(node, nodes.size());
      nodes.add(node);
      signatures.add(signature);
      successors.add(edges);

      for (N target : edges.values()) {
        if (seen.add(target)) {
          toVisit.push(target);
        }
      }
    }

    // Resolve successors to handles, in label order
    final var outsiders = new IdentityHashMap<N, Integer>();
    final int nodeCount = nodes.size();
    final String[][] labels = new String[nodeCount][];
    final int[][] targets = new int[nodeCount][];
    for (int handle = 0; handle < nodeCount; handle++) {
      final var edges = successors.get(handle);
      labels[handle] = new String[edges.size()];
      targets[handle] = new int[edges.size()];
      int i = 0;
      for (var edge : edges.entrySet()) {
        labels[handle][i] = edge.getKey();
        final Integer target = handles.get(edge.getValue());
        targets[handle][i] = target != null
          ? target
          : outsiders.computeIfAbsent(edge.getValue(), outsider -> UNKNOWN_CLASS - 1 - outsiders.size());
        i++;
      }
    }

    // Initial partition, by structural signature
    final int[] classOf = new int[nodeCount];
    final var signatureClasses = new HashMap<String, Integer>();
    int nextClassId = 0;
    for (int handle = 0; handle < nodeCount; handle++) {
      final Integer existing = signatureClasses.get(signatures.get(handle));
      if (existing == null) {
        signatureClasses.put(signatures.get(handle), nextClassId);
        classOf[handle] = nextClassId++;
      } else {
        classOf[handle] = existing;
      }
    }
    onPartition.accept(classOf.clone());

    // Refine until nothing splits
    int passes = 0;
    boolean changed = nodeCount > 0;
    while (changed) {
      passes++;
      changed = false;
      final int[] previous = classOf.clone();

      final var members = new TreeMap<Integer, List<Integer>>();
      for (int handle = 0; handle < nodeCount; handle++) {
        members.computeIfAbsent(previous[handle], k -> new ArrayList<>()).add(handle);
      }

      for (List<Integer> klass : members.values()) {
        if (klass.size() <= 1) {
          continue;
        }

        final var groups = new LinkedHashMap<List<SimpleImmutableEntry<String, Integer>>, List<Integer>>();
        for (int handle : klass) {
          groups
            .computeIfAbsent(transitionSignature(labels[handle], targets[handle], previous), k -> new ArrayList<>())
            .add(handle);
        }

        boolean keepsOldId = true;
        for (List<Integer> group : groups.values()) {
          if (keepsOldId) {
            keepsOldId = false;
            continue;
          }
          final int freshId = nextClassId++;
          for (int handle : group) {
            classOf[handle] = freshId;
          }
          changed = true;
        }
      }

      if (changed) {
        onPartition.accept(classOf.clone());
      }
    }

    for (int handle = 0; handle < nodeCount; handle++) {
      nodes.get(handle).setEquivalenceClass(classOf[handle]);
    }

    log.debug(
      "Partitioned {} nodes into {} classes in {} passes ({} structural errors)",
      nodeCount,
      nextClassId,
      passes,
      structuralErrors.size()
    );

    return new EquivalenceClasses<>(nodes, handles, classOf, nextClassId, passes, structuralErrors);
  }

  /**
   * Sorted sequence of (label, successor class) pairs.
   *
   * @param labels labels of the node, sorted
   * @param targets handles of the successors (negative outside the class map),
   *   aligned with {@code labels}
   * @param classOf class table against which successors are resolved
   * @return transition signature
   */
  private static List<SimpleImmutableEntry<String, Integer>> transitionSignature(
    String[] labels,
    int[] targets,
    int[] classOf
  ) {
    final var signature = new ArrayList<SimpleImmutableEntry<String, Integer>>(labels.length);
    for (int i = 0; i < labels.length; i++) {
      final int target = targets[i];
      signature.add(new SimpleImmutableEntry<>(labels[i], target < 0 ? target : classOf[target]));
    }
    return signature;
  }
}
