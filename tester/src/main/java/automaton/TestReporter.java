package automaton;

/**
 * Receives the outcome of every case run by a {@link TestRunner}.
 */
interface TestReporter {

  /**
   * The machine of a case could not be built, minimized or compiled, and the
   * case did not expect an error.
   */
  public void onMachineError(TestCase testCase, Exception error);

  /**
   * One variant of the machine produced the wrong output.
   *
   * @param testCase failing case
   * @param variant {@code interpreted}, {@code minimized}, {@code optimized} or {@code compiled}
   * @param foundOutput output that variant produced
   */
  public void onUnexpectedOutput(TestCase testCase, String variant, String foundOutput);

  /**
   * Every variant agreed with the expected output.
   *
   * @param testCase passing case
   * @param expectedFailure whether the expected output was an error
   */
  public void onSuccess(TestCase testCase, boolean expectedFailure);
}
