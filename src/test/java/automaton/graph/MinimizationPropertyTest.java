package automaton.graph;

import static org.junit.jupiter.api.Assertions.*;

import automaton.Machines;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

class MinimizationPropertyTest {

  @Property(tries = 100)
  @Label("Minimized machine accepts exactly the same inputs")
  void sameLanguage(
    @ForAll @IntRange(min = 1, max = 20) int size,
    @ForAll long seed
  ) {
    final Machine<String> machine = Machines.random(size, seed);
    final Machine<String> minimized = MachineMinimizer.minimize(machine).machine();

    for (List<String> input : inputs(List.of("a", "b"), 5)) {
      assertEquals(machine.accepts(input), minimized.accepts(input), "input " + input);
    }
  }

  @Property(tries = 100)
  @Label("Inputs of up to twenty labels end in corresponding states")
  void sameFinalClass(
    @ForAll @IntRange(min = 1, max = 30) int size,
    @ForAll long seed
  ) {
    final Machine<String> machine = Machines.random(size, seed);
    final MinimizationResult<String> result = MachineMinimizer.minimize(machine);
    final var random = new Random(seed);

    for (int i = 0; i < 50; i++) {
      final List<String> input = randomInput(random, List.of("a", "b"), random.nextInt(21));
      final String original = Machine.run(machine, input).get().id();
      final String minimized = Machine.run(result.machine(), input).get().id();
      assertEquals(result.stateMapping().get(original), minimized, "input " + input);
      assertEquals(
        machine.classOf(original),
        machine.classOf(result.stateMapping().get(original))
      );
    }
  }

  @Property(tries = 100)
  @Label("No two states of a minimized machine are equivalent")
  void minimal(
    @ForAll @IntRange(min = 1, max = 20) int size,
    @ForAll long seed
  ) {
    final Machine<String> minimized = MachineMinimizer.minimize(Machines.random(size, seed)).machine();
    assertEquals(minimized.size(), minimized.equivalenceClasses().classCount());
  }

  @Property(tries = 100)
  @Label("Removing a transition still minimizes consistently")
  void partialMachines(
    @ForAll @IntRange(min = 2, max = 20) int size,
    @ForAll long seed,
    @ForAll @IntRange(min = 0, max = 19) int dropped
  ) {
    final Machine<String> machine = Machines.random(size, seed).withoutTransition("q" + (dropped % size), "a");
    final var result = MachineMinimizer.minimize(machine);

    assertTrue(MachineMinimizer.isConsistent(machine, result));
    for (List<String> input : inputs(List.of("a", "b"), 4)) {
      assertEquals(machine.accepts(input), result.machine().accepts(input), "input " + input);
    }
  }

  static List<String> randomInput(Random random, List<String> alphabet, int length) {
    final var input = new ArrayList<String>(length);
    for (int i = 0; i < length; i++) {
      input.add(alphabet.get(random.nextInt(alphabet.size())));
    }
    return input;
  }

  /**
   * Every input over an alphabet up to some length.
   */
  static List<List<String>> inputs(List<String> alphabet, int maxLength) {
    final var all = new ArrayList<List<String>>();
    all.add(List.of());
    int start = 0;
    for (int length = 1; length <= maxLength; length++) {
      final int end = all.size();
      for (int i = start; i < end; i++) {
        for (String label : alphabet) {
          final var longer = new ArrayList<>(all.get(i));
          longer.add(label);
          all.add(longer);
        }
      }
      start = end;
    }
    return all;
  }
}
