package automaton.codegen;

import automaton.graph.Machine;
import automaton.graph.State;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodTooLargeException;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a machine into a hidden class implementing {@link TransitionFunction}.
 *
 * <p>States are numbered in machine order and labels in sorted order. The
 * generated class has no fields: the whole transition table lives in the
 * branches of its {@code next} method.
 */
public final class MachineCompiler {

  private static final Logger log = LoggerFactory.getLogger(MachineCompiler.class);

  private static final String CLASS_NAME = "automaton/codegen/MachineCompiler$Compiled";
  private static final Method NEXT_STATIC = Method.staticOn(CLASS_NAME, "nextStatic", Method.TRANSITION);

  private MachineCompiler() { }

  public static <V> CompiledMachine<V> compile(Machine<V> machine) {
    return compile(machine, false);
  }

  /**
   * Compile a machine.
   *
   * @param machine machine to compile
   * @param printDebugInfo generate code which prints every state visited to STDERR
   * @return compiled machine
   * @throws IllegalArgumentException if the machine is too large for one method
   */
  public static <V> CompiledMachine<V> compile(Machine<V> machine, boolean printDebugInfo) {
    final List<String> stateIds = new ArrayList<>(machine.stateIds());
    final Map<String, Integer> stateIndices = new HashMap<>();
    for (int i = 0; i < stateIds.size(); i++) {
      stateIndices.put(stateIds.get(i), i);
    }
    final Map<String, Integer> symbolIndices = new LinkedHashMap<>();
    for (String label : machine.alphabet()) {
      symbolIndices.put(label, symbolIndices.size());
    }

    @SuppressWarnings("unchecked")
    final Map<Integer, Integer>[] transitions = new Map[stateIds.size()];
    for (State<V> state : machine.states()) {
      final var indexed = new HashMap<Integer, Integer>();
      for (var transition : state.transitions().entrySet()) {
        indexed.put(symbolIndices.get(transition.getKey()), stateIndices.get(transition.getValue()));
      }
      transitions[stateIndices.get(state.id())] = indexed;
    }

    final byte[] classBytes;
    try {
      classBytes = generateTransitionFunction(transitions, printDebugInfo).toByteArray();
    } catch (MethodTooLargeException err) {
      throw new IllegalArgumentException("machine with " + machine.size() + " states is too large to compile", err);
    }

    final TransitionFunction function;
    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      function = (TransitionFunction) lookup.lookupClass().getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException err) {
      throw new IllegalStateException("could not load compiled machine", err);
    }

    log.debug("Compiled {} into {} bytes of bytecode", machine, classBytes.length);
    return new CompiledMachine<>(machine, function, stateIds, stateIndices, symbolIndices);
  }

  /**
   * Code generator for a class implementing {@link TransitionFunction}.
   *
   * @param transitions per state index, symbol index to target state index
   * @param printDebugInfo generate code which prints debug info to STDERR
   * @return class writer holding the generated class
   */
  static ClassWriter generateTransitionFunction(
    Map<Integer, Integer>[] transitions,
    boolean printDebugInfo
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      CLASS_NAME,
      null, // signature
      Method.OBJECT,
      new String[] { Method.TRANSITION_FUNCTION }
    );

    // Constructor (the class has no state)
    {
      final var mv = Method.OBJECT_INIT.declare(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.OBJECT_INIT.invoke(mv);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `nextStatic` helper holding the transition table
    {
      final var mv = NEXT_STATIC.declare(cw, Opcodes.ACC_PRIVATE);
      mv.visitCode();
      new MachineMethodCodegen(mv, transitions, printDebugInfo).visitNextMethod();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `next` method (just calls out to `nextStatic`)
    {
      final var mv = Method.NEXT.declare(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ILOAD, 1);
      mv.visitVarInsn(Opcodes.ILOAD, 2);
      NEXT_STATIC.invoke(mv);
      mv.visitInsn(Opcodes.IRETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }
}
