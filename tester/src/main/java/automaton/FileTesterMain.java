package automaton;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Runs the case files named on the command line (see {@link TestCase} for
 * the format) and exits with {@code 1} if any case failed.
 */
class FileTesterMain {

  /**
   * Prints failures to {@code System.err} and keeps a tally.
   */
  static final class ConsoleReporter implements TestReporter {
    int passed = 0;
    int failed = 0;

    @Override
    public void onMachineError(TestCase testCase, Exception error) {
      System.err.println("Could not build " + testCase.getSummary() + ": " + error.getMessage());
      failed++;
    }

    @Override
    public void onUnexpectedOutput(TestCase testCase, String variant, String foundOutput) {
      System.err.println(
        testCase.getSummary() + " (" + variant + "): expected '" + testCase.output + "', got '" + foundOutput + "'"
      );
      failed++;
    }

    @Override
    public void onSuccess(TestCase testCase, boolean expectedFailure) {
      passed++;
    }
  }

  public static void main(String[] caseFiles) throws IOException {
    final var reporter = new ConsoleReporter();
    final var runner = new TestRunner(reporter);
    for (String caseFile : caseFiles) {
      try (var reader = new TestFileReader(Path.of(caseFile))) {
        reader.forEachTestCase(runner);
      } catch (NoSuchFileException err) {
        System.err.println("No such case file: " + caseFile);
        reporter.failed++;
      }
    }

    System.err.println();
    System.err.println("PASSED: " + reporter.passed + ", FAILED: " + reporter.failed);
    if (reporter.failed > 0) {
      System.exit(1);
    }
  }
}
