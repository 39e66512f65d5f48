package automaton.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EquivalenceClassComputer")
class EquivalenceClassComputerTest {

  /**
   * Free-standing node, so that graphs can be malformed in ways a machine
   * never is.
   */
  static final class TestNode implements MinimizableNode<TestNode> {

    final String name;
    String signature;
    final Map<String, TestNode> successors = new LinkedHashMap<>();
    boolean broken = false;
    private Integer equivalenceClass;

    TestNode(String name, String signature) {
      this.name = name;
      this.signature = signature;
    }

    TestNode to(String label, TestNode target) {
      successors.put(label, target);
      return this;
    }

    @Override
    public String signature() {
      if (broken) {
        throw new IllegalStateException("broken node " + name);
      }
      return signature;
    }

    @Override
    public Collection<String> transitionLabels() {
      return successors.keySet();
    }

    @Override
    public Optional<TestNode> transitionTarget(String label) {
      return Optional.ofNullable(successors.get(label));
    }

    @Override
    public OptionalInt equivalenceClass() {
      return equivalenceClass == null ? OptionalInt.empty() : OptionalInt.of(equivalenceClass);
    }

    @Override
    public void setEquivalenceClass(int classId) {
      this.equivalenceClass = classId;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  @Nested
  @DisplayName("Partitioning")
  class Partitioning {

    @Test
    @DisplayName("Single node with a self loop")
    void selfLoop() {
      final var node = new TestNode("n", "x");
      node.to("a", node);
      final var classes = EquivalenceClassComputer.compute(node);
      assertEquals(1, classes.nodeCount());
      assertEquals(1, classes.classCount());
      assertEquals(OptionalInt.of(0), node.equivalenceClass());
    }

    @Test
    @DisplayName("Distinct signatures are never merged")
    void signaturesSeparate() {
      final var a = new TestNode("a", "x");
      final var b = new TestNode("b", "y");
      a.to("next", b);
      final var classes = EquivalenceClassComputer.compute(a);
      assertFalse(classes.equivalent(a, b));
      assertEquals(2, classes.classCount());
    }

    @Test
    @DisplayName("Same signature, different successor classes are split")
    void successorsSplit() {
      final var root = new TestNode("root", "r");
      final var left = new TestNode("left", "x");
      final var right = new TestNode("right", "x");
      final var leftEnd = new TestNode("leftEnd", "end1");
      final var rightEnd = new TestNode("rightEnd", "end2");
      root.to("l", left).to("r", right);
      left.to("a", leftEnd);
      right.to("a", rightEnd);

      final var classes = EquivalenceClassComputer.compute(root);
      assertFalse(classes.equivalent(left, right));
      assertEquals(5, classes.classCount());
    }

    @Test
    @DisplayName("Missing transitions differ from present ones")
    void missingTransition() {
      final var root = new TestNode("root", "r");
      final var withEdge = new TestNode("with", "x");
      final var without = new TestNode("without", "x");
      root.to("a", withEdge).to("b", without);
      withEdge.to("loop", withEdge);

      final var classes = EquivalenceClassComputer.compute(root);
      assertFalse(classes.equivalent(withEdge, without));
    }

    @Test
    @DisplayName("Converging cycles collapse")
    void cyclesCollapse() {
      final var a = new TestNode("a", "x");
      final var b = new TestNode("b", "x");
      final var c = new TestNode("c", "x");
      a.to("n", b);
      b.to("n", c);
      c.to("n", a);

      final var classes = EquivalenceClassComputer.compute(a);
      assertEquals(1, classes.classCount());
      assertTrue(classes.equivalent(a, c));
    }

    @Test
    @DisplayName("Nodes unreachable from the root are not classified")
    void unreachable() {
      final var root = new TestNode("root", "x");
      final var stray = new TestNode("stray", "x");
      stray.to("a", root);

      final var classes = EquivalenceClassComputer.compute(root);
      assertEquals(1, classes.nodeCount());
      assertTrue(classes.classOf(stray).isEmpty());
      assertTrue(stray.equivalenceClass().isEmpty());
    }
  }

  @Nested
  @DisplayName("Malformed nodes")
  class Malformed {

    @Test
    @DisplayName("Throwing node is reported and left out")
    void throwingNode() {
      final var root = new TestNode("root", "r");
      final var broken = new TestNode("broken", "x");
      broken.broken = true;
      root.to("a", broken);

      final var classes = EquivalenceClassComputer.compute(root);
      assertEquals(1, classes.nodeCount());
      assertEquals(1, classes.structuralErrors().size());
      assertSame(broken, classes.structuralErrors().get(0).node());
      assertNotNull(classes.structuralErrors().get(0).cause());
    }

    @Test
    @DisplayName("Node without signature is reported and left out")
    void nullSignature() {
      final var root = new TestNode("root", "r");
      final var unsigned = new TestNode("unsigned", null);
      root.to("a", unsigned);

      final var classes = EquivalenceClassComputer.compute(root);
      assertEquals(1, classes.structuralErrors().size());
      assertTrue(classes.classOf(unsigned).isEmpty());
    }

    @Test
    @DisplayName("Successors outside the class map resolve to the unknown class")
    void unknownSuccessor() {
      final var root = new TestNode("root", "r");
      final var first = new TestNode("first", "x");
      final var second = new TestNode("second", "x");
      final var broken = new TestNode("broken", "y");
      final var fine = new TestNode("fine", "y");
      broken.broken = true;
      root.to("a", first).to("b", second);
      first.to("c", broken);
      second.to("c", fine);

      final var classes = EquivalenceClassComputer.compute(root);
      assertFalse(classes.equivalent(first, second));
      assertEquals(1, classes.structuralErrors().size());
    }

    @Test
    @DisplayName("Nodes leading into different malformed nodes stay apart")
    void distinctMalformedSuccessors() {
      final var root = new TestNode("root", "r");
      final var first = new TestNode("first", "x");
      final var second = new TestNode("second", "x");
      final var firstBroken = new TestNode("firstBroken", "y");
      final var secondBroken = new TestNode("secondBroken", "y");
      firstBroken.broken = true;
      secondBroken.broken = true;
      root.to("a", first).to("b", second);
      first.to("c", firstBroken);
      second.to("c", secondBroken);

      final var classes = EquivalenceClassComputer.compute(root);
      assertEquals(2, classes.structuralErrors().size());
      assertFalse(classes.equivalent(first, second));
    }

    @Test
    @DisplayName("Nodes leading into the same malformed node may merge")
    void sharedMalformedSuccessor() {
      final var root = new TestNode("root", "r");
      final var first = new TestNode("first", "x");
      final var second = new TestNode("second", "x");
      final var broken = new TestNode("broken", "y");
      broken.broken = true;
      root.to("a", first).to("b", second);
      first.to("c", broken);
      second.to("c", broken);

      final var classes = EquivalenceClassComputer.compute(root);
      assertEquals(1, classes.structuralErrors().size());
      assertTrue(classes.equivalent(first, second));
    }
  }

  @Nested
  @DisplayName("Refinement")
  class Refinement {

    @Test
    @DisplayName("Each partition refines the previous one")
    void monotonic() {
      final var partitions = new ArrayList<int[]>();
      final var root = chain(12);
      EquivalenceClassComputer.compute(root, partitions::add);

      assertFalse(partitions.isEmpty());
      for (int p = 1; p < partitions.size(); p++) {
        assertRefines(partitions.get(p - 1), partitions.get(p));
      }
    }

    @Test
    @DisplayName("A chain needs one pass per node")
    void chainPasses() {
      final var classes = EquivalenceClassComputer.compute(chain(6));
      assertEquals(6, classes.classCount());
      assertTrue(classes.refinementPasses() <= classes.nodeCount());
    }
  }

  /**
   * Chain {@code n0 -> n1 -> ... -> n(k-1)} where only the last node has a
   * distinct signature.
   */
  private static TestNode chain(int length) {
    final var nodes = new ArrayList<TestNode>();
    for (int i = 0; i < length; i++) {
      nodes.add(new TestNode("n" + i, i == length - 1 ? "end" : "x"));
    }
    for (int i = 0; i + 1 < length; i++) {
      nodes.get(i).to("next", nodes.get(i + 1));
    }
    return nodes.get(0);
  }

  /**
   * Every class of {@code finer} must fit inside a class of {@code coarser}.
   */
  private static void assertRefines(int[] coarser, int[] finer) {
    assertEquals(coarser.length, finer.length);
    final var parent = new LinkedHashMap<Integer, Integer>();
    for (int handle = 0; handle < finer.length; handle++) {
      final Integer previous = parent.putIfAbsent(finer[handle], coarser[handle]);
      if (previous != null) {
        assertEquals(previous.intValue(), coarser[handle], "class " + finer[handle] + " straddles two classes");
      }
    }
  }
}
