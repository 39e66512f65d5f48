package automaton.codegen;

import java.util.Map;
import java.util.TreeMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Generates the body of a static {@code int nextStatic(int state, int symbol)}
 * method.
 *
 * <p>States map onto blocks of the method: a switch on the state index jumps
 * to the block of the state, which switches on the symbol index and returns
 * the index of the target state. Anything not matched returns {@code -1}.
 */
class MachineMethodCodegen extends BytecodeHelpers {

  private static final int STATE_LOCAL = 0;
  private static final int SYMBOL_LOCAL = 1;

  /**
   * For every state index, its transitions as symbol index to target index.
   */
  private final int[][] symbols;
  private final int[][] targets;

  /**
   * If set, the generated method prints every state it is asked about to
   * "standard" error.
   */
  private final boolean printDebugInfo;

  /**
   * @param mv visitor for the method body
   * @param transitions per state index, symbol index to target state index
   * @param printDebugInfo generate code printing the state index on every call
   */
  MachineMethodCodegen(MethodVisitor mv, Map<Integer, Integer>[] transitions, boolean printDebugInfo) {
    super(mv);
    this.symbols = new int[transitions.length][];
    this.targets = new int[transitions.length][];
    for (int state = 0; state < transitions.length; state++) {
      final var sorted = new TreeMap<>(transitions[state]);
      symbols[state] = new int[sorted.size()];
      targets[state] = new int[sorted.size()];
      int i = 0;
      for (var transition : sorted.entrySet()) {
        symbols[state][i] = transition.getKey();
        targets[state][i] = transition.getValue();
        i++;
      }
    }
    this.printDebugInfo = printDebugInfo;
  }

  void visitNextMethod() {
    final var noTransition = new Label();

    if (printDebugInfo) {
      visitTraceInt("[machine] state ", STATE_LOCAL);
    }

    // Jump to the block of the state
    final int stateCount = symbols.length;
    final int[] stateIndices = new int[stateCount];
    final Label[] stateBlocks = new Label[stateCount];
    for (int state = 0; state < stateCount; state++) {
      stateIndices[state] = state;
      stateBlocks[state] = new Label();
    }
    mv.visitVarInsn(Opcodes.ILOAD, STATE_LOCAL);
    visitLookupBranch(noTransition, stateIndices, stateBlocks);

    // One block per state
    for (int state = 0; state < stateCount; state++) {
      mv.visitLabel(stateBlocks[state]);
      final Label[] targetBlocks = new Label[symbols[state].length];
      for (int i = 0; i < targetBlocks.length; i++) {
        targetBlocks[i] = new Label();
      }
      mv.visitVarInsn(Opcodes.ILOAD, SYMBOL_LOCAL);
      visitLookupBranch(noTransition, symbols[state], targetBlocks);

      for (int i = 0; i < targetBlocks.length; i++) {
        mv.visitLabel(targetBlocks[i]);
        visitConstantInt(targets[state][i]);
        mv.visitInsn(Opcodes.IRETURN);
      }
    }

    mv.visitLabel(noTransition);
    visitConstantInt(-1);
    mv.visitInsn(Opcodes.IRETURN);
  }
}
