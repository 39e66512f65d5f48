package automaton;

import automaton.codegen.CompiledMachine;
import automaton.codegen.MachineCompiler;
import automaton.graph.Machine;
import automaton.graph.MachineMinimizer;
import automaton.graph.MinimizationResult;
import automaton.graph.State;
import automaton.runtime.OptimizationLevel;
import automaton.runtime.OptimizerConfig;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Charged with running test cases.
 *
 * <p>Every case is run four ways: on the machine as written, on its minimized
 * form, through an optimized session, and through the compiled transition
 * function. All four have to agree with the expected output.
 */
public class TestRunner implements Consumer<TestCase> {

  private static final OptimizerConfig SESSION_CONFIG = OptimizerConfig
    .builder()
    .level(OptimizationLevel.AGGRESSIVE)
    .interval(Duration.ZERO)
    .build();

  /**
   * How are test outcomes reported?
   */
  final TestReporter reporter;

  public TestRunner(TestReporter reporter) {
    this.reporter = reporter;
  }

  /**
   * Accept a new test case.
   *
   * @param testCase test to run
   */
  public void accept(TestCase testCase) {

    // Build the machine
    final Machine<Void> machine;
    final MinimizationResult<Void> minimized;
    final CompiledMachine<Void> compiled;
    try {
      machine = parseMachine(testCase.machine);
      minimized = MachineMinimizer.minimize(machine);
      compiled = MachineCompiler.compile(minimized.machine());
    } catch (Exception error) {
      if (testCase.output.startsWith("error")) {
        reporter.onSuccess(testCase, true);
      } else {
        reporter.onMachineError(testCase, error);
      }
      return;
    }

    final int minimizedStates = minimized.minimizedStates();
    final String interpreted = TestCase.createOutput(outcome(Machine.run(machine, testCase.input)), minimizedStates);
    final String reduced = TestCase.createOutput(outcome(Machine.run(minimized.machine(), testCase.input)), minimizedStates);
    final String viaCompiled = TestCase.createOutput(outcome(compiled.run(testCase.input)), minimizedStates);
    final String optimized = TestCase.createOutput(runSession(machine, testCase.input), minimizedStates);

    // Compare the outputs
    if (!testCase.output.equals(interpreted)) {
      reporter.onUnexpectedOutput(testCase, "interpreted", interpreted);
    } else if (!testCase.output.equals(reduced)) {
      reporter.onUnexpectedOutput(testCase, "minimized", reduced);
    } else if (!testCase.output.equals(optimized)) {
      reporter.onUnexpectedOutput(testCase, "optimized", optimized);
    } else if (!testCase.output.equals(viaCompiled)) {
      reporter.onUnexpectedOutput(testCase, "compiled", viaCompiled);
    } else {
      reporter.onSuccess(testCase, false);
    }
  }

  private static String outcome(Optional<? extends State<?>> end) {
    return end.map(state -> state.accepting() ? "accept" : "reject").orElse("undefined");
  }

  /**
   * Run the input twice through a session, with a pass in between, so that
   * the second run goes through the cache and direct dispatch.
   */
  private static String runSession(Machine<Void> machine, List<String> input) {
    try (var session = OptimizedStateMachine.builder(machine).config(SESSION_CONFIG).passExecutor(Runnable::run).build()) {
      String first = sessionOutcome(session, input);
      session.optimizeNow(OptimizationLevel.AGGRESSIVE);
      session.reset();
      String second = sessionOutcome(session, input);
      return first.equals(second) ? first : first + "/" + second;
    }
  }

  private static String sessionOutcome(OptimizedStateMachine<Void> session, List<String> input) {
    try {
      return session.processSequence(input).accepting() ? "accept" : "reject";
    } catch (UndefinedTransitionException err) {
      return "undefined";
    }
  }

  /**
   * Parse a machine written as {@code q0:a=q1,b=q2 q1*:a=q1 q2*}.
   *
   * @param description machine description
   * @return machine, with the first state as initial state
   */
  static Machine<Void> parseMachine(String description) {
    final Machine.Builder<Void> builder = Machine.builder();
    for (String stateSpec : description.split("\\s+")) {
      final int colon = stateSpec.indexOf(':');
      String id = colon < 0 ? stateSpec : stateSpec.substring(0, colon);
      final boolean accepting = id.endsWith("*");
      if (accepting) {
        id = id.substring(0, id.length() - 1);
      }
      builder.state(id, null, accepting);
      if (colon < 0 || colon == stateSpec.length() - 1) {
        continue;
      }
      for (String transition : stateSpec.substring(colon + 1).split(",")) {
        final int equals = transition.indexOf('=');
        if (equals <= 0) {
          throw new IllegalArgumentException("malformed transition '" + transition + "'");
        }
        builder.transition(id, transition.substring(0, equals), transition.substring(equals + 1));
      }
    }
    return builder.build();
  }
}
