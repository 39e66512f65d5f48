package automaton.codegen;

import java.io.PrintStream;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Method referenced by generated code.
 *
 * @param owner internal name of the class declaring the method
 * @param name name of the method
 * @param type type of the method (without the receiver)
 * @param opcode one of the {@code Opcodes.INVOKE*} codes
 */
record Method(
  String owner,
  String name,
  MethodType type,
  int opcode
) {

  static final String OBJECT = Type.getInternalName(Object.class);
  static final String TRANSITION_FUNCTION = Type.getInternalName(TransitionFunction.class);
  static final String PRINT_STREAM = Type.getInternalName(PrintStream.class);

  /**
   * {@code (int state, int symbol) -> int target}
   */
  static final MethodType TRANSITION = MethodType.methodType(int.class, int.class, int.class);

  static final Method OBJECT_INIT = new Method(
    OBJECT,
    "<init>",
    MethodType.methodType(void.class),
    Opcodes.INVOKESPECIAL
  );
  static final Method NEXT = new Method(TRANSITION_FUNCTION, "next", TRANSITION, Opcodes.INVOKEINTERFACE);
  static final Method PRINT_STRING = onPrintStream("print", String.class);
  static final Method PRINTLN_INT = onPrintStream("println", int.class);

  static Method staticOn(String owner, String name, MethodType type) {
    return new Method(owner, name, type, Opcodes.INVOKESTATIC);
  }

  private static Method onPrintStream(String name, Class<?> argument) {
    return new Method(PRINT_STREAM, name, MethodType.methodType(void.class, argument), Opcodes.INVOKEVIRTUAL);
  }

  boolean isStatic() {
    return opcode == Opcodes.INVOKESTATIC;
  }

  /**
   * Declare a method with this name and type on the class being generated.
   *
   * <p>{@code ACC_STATIC} is added for static methods.
   *
   * @param cv class being generated
   * @param access access flags
   * @return visitor for the method body
   */
  MethodVisitor declare(ClassVisitor cv, int access) {
    return cv.visitMethod(
      isStatic() ? access | Opcodes.ACC_STATIC : access,
      name,
      type.descriptorString(),
      null, // signature
      null  // exceptions
    );
  }

  /**
   * Call this method. The receiver (unless static) and the arguments must
   * already be on the stack.
   */
  void invoke(MethodVisitor mv) {
    mv.visitMethodInsn(opcode, owner, name, type.descriptorString(), opcode == Opcodes.INVOKEINTERFACE);
  }
}
