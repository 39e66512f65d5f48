package automaton;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Minimization case files")
class MinimizationCasesTest {

  @Test
  @DisplayName("Every case passes on every variant of its machine")
  void caseFile() throws IOException {
    final List<String> failures = new ArrayList<>();
    final int[] passed = { 0 };
    final var reporter = new TestReporter() {
      @Override
      public void onMachineError(TestCase testCase, Exception error) {
        failures.add(testCase.getSummary() + ": " + error);
      }

      @Override
      public void onUnexpectedOutput(TestCase testCase, String variant, String foundOutput) {
        failures.add(testCase.getSummary() + ": " + variant + " gave '" + foundOutput + "', expected '" + testCase.output + "'");
      }

      @Override
      public void onSuccess(TestCase testCase, boolean expectedFailure) {
        passed[0]++;
      }
    };

    try (var reader = new TestFileReader(Path.of("tester", "cases", "minimization.txt"))) {
      reader.forEachTestCase(new TestRunner(reporter));
    }
    assertEquals(List.of(), failures);
    assertEquals(11, passed[0]);
  }

  @Test
  @DisplayName("Machine descriptions parse into states and transitions")
  void parse() {
    final var machine = TestRunner.parseMachine("q0:a=q1,b=q0 q1*:a=q1");
    assertEquals("q0", machine.initialId());
    assertTrue(machine.state("q1").get().accepting());
    assertEquals(3, machine.transitionCount());
    assertThrows(IllegalArgumentException.class, () -> TestRunner.parseMachine("q0:a"));
  }
}
