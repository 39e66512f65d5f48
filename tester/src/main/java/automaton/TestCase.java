package automaton;

import java.util.List;

/**
 * Test case in a test file.
 *
 * <p>A test case takes three lines: the machine, the input and the expected
 * output. Machines are written as space-separated states, the first of which
 * is initial, like {@code q0:a=q1,b=q2 q1*:a=q1 q2*} (a {@code *} marks an
 * accepting state). Inputs are space-separated labels, with {@code -} for the
 * empty input. Outputs are {@code accept}, {@code reject} or {@code undefined}
 * followed by the state count of the minimized machine.
 */
public class TestCase {

  /**
   * Machine description.
   */
  public final String machine;

  /**
   * Labels to feed to the machine.
   */
  public final List<String> input;

  /**
   * Expected output.
   */
  public final String output;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    String machine,
    List<String> input,
    String output,
    String filePath,
    int lineNumber
  ) {
    this.machine = machine;
    this.input = input;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Construct an output string from a run.
   *
   * @param outcome {@code accept}, {@code reject} or {@code undefined}
   * @param minimizedStates states left after minimization
   * @return output string
   */
  public static String createOutput(String outcome, int minimizedStates) {
    return outcome + " " + minimizedStates;
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return "[" + machine + "] (at " + filePath + ":" + lineNumber + ")";
  }
}
