package automaton;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads test cases from a case file.
 *
 * <p>A case is three consecutive significant lines: the machine, the input
 * labels separated by spaces ({@code -} for no input) and the expected output.
 * Blank lines and lines starting with {@code //} are skipped.
 */
public class TestFileReader implements Closeable {

  private static final String COMMENT = "//";
  private static final String EMPTY_INPUT = "-";

  private final BufferedReader reader;
  private final Path path;
  private int lineNumber = 0;

  public TestFileReader(Path path) throws IOException {
    this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    this.path = path;
  }

  private Optional<String> nextSignificantLine() throws IOException {
    for (String line = reader.readLine(); line != null; line = reader.readLine()) {
      lineNumber++;
      final String stripped = line.strip();
      if (!stripped.isEmpty() && !stripped.startsWith(COMMENT)) {
        return Optional.of(stripped);
      }
    }
    return Optional.empty();
  }

  /**
   * Read the next test case.
   *
   * @return the case, or empty at the end of the file
   * @throws IOException if the file ends in the middle of a case
   */
  public Optional<TestCase> readTestCase() throws IOException {
    final Optional<String> machine = nextSignificantLine();
    if (machine.isEmpty()) {
      return Optional.empty();
    }
    final int caseLine = lineNumber;
    final String input = nextSignificantLine().orElse(null);
    final String output = nextSignificantLine().orElse(null);
    if (input == null || output == null) {
      throw new IOException("Truncated test case at " + path + ":" + caseLine);
    }

    final List<String> labels = input.equals(EMPTY_INPUT) ? List.of() : List.of(input.split("\\s+"));
    return Optional.of(new TestCase(machine.get(), labels, output, path.toString(), caseLine));
  }

  /**
   * Run an action on every remaining case.
   */
  public void forEachTestCase(Consumer<? super TestCase> action) throws IOException {
    for (var testCase = readTestCase(); testCase.isPresent(); testCase = readTestCase()) {
      action.accept(testCase.get());
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
