package fsa.codegen;

import fsa.Alphabet;
import fsa.Automaton;
import fsa.NoEntryPointException;
import fsa.NotDeterministicException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Arrays;
import java.util.List;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

/**
 * DFA compiled into a JVM class.
 *
 * <p>The states and transitions of the DFA are turned into the control flow of
 * a generated method (see {@link DfaMethodCodegen}), loaded as a hidden class.
 * The compiled form is a snapshot: later changes to the automaton are not
 * reflected.
 *
 * @param <T> type of the alphabet symbols
 */
public final class CompiledDfa<T> {

  private final Alphabet<T> alphabet;
  private final IndexMatcher matcher;

  private CompiledDfa(Alphabet<T> alphabet, IndexMatcher matcher) {
    this.alphabet = alphabet;
    this.matcher = matcher;
  }

  /**
   * Compile a DFA.
   *
   * @param dfa deterministic automaton with an entry point
   * @return compiled matcher for the DFA
   */
  public static <T> CompiledDfa<T> compile(Automaton<T> dfa)
  throws IllegalAccessException, NoSuchMethodException {
    return compile(dfa, false);
  }

  /**
   * Compile a DFA.
   *
   * @param dfa deterministic automaton with an entry point
   * @param printDebugInfo generate code which prints the states entered to STDERR
   * @return compiled matcher for the DFA
   * @throws NotDeterministicException if the automaton is nondeterministic
   * @throws NoEntryPointException if the automaton has no entry point
   */
  public static <T> CompiledDfa<T> compile(Automaton<T> dfa, boolean printDebugInfo)
  throws IllegalAccessException, NoSuchMethodException {
    if (!dfa.isDeterministic()) {
      throw new NotDeterministicException("Compilation");
    }
    if (dfa.entryPoint().isEmpty()) {
      throw new NoEntryPointException();
    }

    final byte[] classBytes = generateMatcherClass(dfa, printDebugInfo).toByteArray();

    // Load the class and get a handle on the constructor
    final MethodHandles.Lookup lookup = MethodHandles
      .lookup()
      .defineHiddenClass(classBytes, true);
    final MethodHandle constructor = lookup.findConstructor(
      lookup.lookupClass(),
      MethodType.methodType(void.class)
    );

    final IndexMatcher matcher;
    try {
      matcher = (IndexMatcher) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct matcher", error);
    }
    return new CompiledDfa<T>(dfa.alphabet(), matcher);
  }

  /**
   * Code generator for a class implementing {@link IndexMatcher}.
   *
   * <p>The DFA itself becomes a private static method, which {@code accepts}
   * calls straight away.
   *
   * @param dfa deterministic automaton with an entry point
   * @param printDebugInfo generate code which prints debug info to STDERR
   * @return class writer holding the generated class
   */
  static <T> ClassWriter generateMatcherClass(Automaton<T> dfa, boolean printDebugInfo) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      Method.MATCHER_CLASS_NAME,
      null, // signature
      Method.OBJECT_INIT.owner(),
      new String[] { Method.ACCEPTS.owner() }
    );

    // No-argument constructor
    {
      final var mv = Method.OBJECT_INIT.declareOn(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.OBJECT_INIT.call(mv);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // The DFA
    {
      final var mv = Method.RUN_DFA.declareOn(cw, Opcodes.ACC_PRIVATE);
      mv.visitCode();
      new DfaMethodCodegen<T>(mv, dfa, printDebugInfo).visitDfa();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` forwards its argument to the DFA
    {
      final var mv = Method.ACCEPTS.declareOn(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 1);
      Method.RUN_DFA.call(mv);
      mv.visitInsn(Opcodes.IRETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  public Alphabet<T> alphabet() {
    return alphabet;
  }

  /**
   * Run the compiled DFA over an input.
   *
   * @param string input symbols
   * @return whether the DFA accepts the input
   * @throws fsa.InvalidSymbolException if a symbol is not in the alphabet
   */
  public boolean accepts(List<? extends T> string) {
    return matcher.accepts(alphabet.indicesOf(string));
  }

  @SafeVarargs
  public final boolean accepts(T... string) {
    return accepts(Arrays.asList(string));
  }

  @Override
  public String toString() {
    return "CompiledDfa(" + alphabet + ")";
  }
}
