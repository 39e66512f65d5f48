package automaton.codegen;

import java.io.PrintStream;
import java.util.Arrays;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Shared emitters for generated method bodies.
 *
 * <p>A method body holds at most 64KB of code and a machine emits a branch
 * per transition, so the helpers keep every instruction as short as it can be.
 */
class BytecodeHelpers {

  private static final String PRINT_STREAM_DESC = Type.getDescriptor(PrintStream.class);

  /**
   * A {@code tableswitch} is used when at most this many slots per value are
   * wasted on gaps.
   */
  private static final int MAX_TABLE_SLOTS_PER_VALUE = 2;

  protected final MethodVisitor mv;

  BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Print {@code prefix} followed by an {@code int} local and a newline to
   * {@code System.err}.
   *
   * @param prefix constant text printed first
   * @param local slot of the {@code int} local
   */
  protected void visitTraceInt(String prefix, int local) {
    mv.visitFieldInsn(Opcodes.GETSTATIC, Type.getInternalName(System.class), "err", PRINT_STREAM_DESC);
    mv.visitInsn(Opcodes.DUP);
    mv.visitLdcInsn(prefix);
    Method.PRINT_STRING.invoke(mv);
    mv.visitVarInsn(Opcodes.ILOAD, local);
    Method.PRINTLN_INT.invoke(mv);
  }

  /**
   * Pop the {@code int} on top of the stack and jump to the label paired with
   * its value, or to {@code dflt}.
   *
   * <p>One or two values become comparisons. Larger sets become a
   * {@code tableswitch} when their range is dense enough (gaps go to
   * {@code dflt}) and a {@code lookupswitch} otherwise.
   *
   * @param dflt label for values not listed
   * @param values values, sorted in ascending order
   * @param labels label for each value
   */
  protected void visitLookupBranch(Label dflt, int[] values, Label[] labels) {
    switch (values.length) {
      case 0:
        mv.visitInsn(Opcodes.POP);
        mv.visitJumpInsn(Opcodes.GOTO, dflt);
        return;

      case 1:
        visitCompareJump(values[0], labels[0]);
        mv.visitJumpInsn(Opcodes.GOTO, dflt);
        return;

      default:
        final int min = values[0];
        final int max = values[values.length - 1];
        final long span = (long) max - min + 1;
        if (span > (long) values.length * MAX_TABLE_SLOTS_PER_VALUE) {
          mv.visitLookupSwitchInsn(dflt, values, labels);
          return;
        }

        final Label[] table = new Label[(int) span];
        Arrays.fill(table, dflt);
        for (int i = 0; i < values.length; i++) {
          table[values[i] - min] = labels[i];
        }
        mv.visitTableSwitchInsn(min, max, dflt, table);
    }
  }

  private void visitCompareJump(int value, Label target) {
    if (value == 0) {
      mv.visitJumpInsn(Opcodes.IFEQ, target);
    } else {
      visitConstantInt(value);
      mv.visitJumpInsn(Opcodes.IF_ICMPEQ, target);
    }
  }

  /**
   * Push an {@code int} constant with the shortest instruction available.
   */
  protected void visitConstantInt(int constant) {
    if (constant >= -1 && constant <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + constant);
    } else if (constant == (byte) constant) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (constant == (short) constant) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }
}
