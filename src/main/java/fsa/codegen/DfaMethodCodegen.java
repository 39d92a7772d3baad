package fsa.codegen;

import fsa.Alphabet;
import fsa.Automaton;
import fsa.State;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Functionality for generating the body of a DFA membership function.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * bytecode method: states are represented by blocks with transitions encoded
 * as jumps to other blocks. Each block first checks whether the input is
 * exhausted (returning whether the state accepts), then reads the next symbol
 * index and dispatches on it. A symbol with no transition means the DFA is
 * stuck and can never accept, so it jumps to the failure block.
 *
 * <p>The generated method has the signature {@code boolean (int[] input)}.
 * Every element of the input must be an index into the alphabet, so the
 * dispatch only ever covers {@code 0} to {@code alphabet.size() - 1}.
 *
 * @param <T> type of the alphabet symbols
 */
class DfaMethodCodegen<T> {

  private static final String SYSTEM_CLASS_NAME = Type.getInternalName(System.class);
  private static final String PRINTSTREAM_DESC = Type.getDescriptor(PrintStream.class);

  private final MethodVisitor mv;

  /**
   * DFA for which code is generated.
   */
  private final Automaton<T> dfa;

  /**
   * If set, the generated method will include code that prints to "standard"
   * error output for: states entered, final output.
   */
  private final boolean printDebugInfo;

  /**
   * Offset for argument of type {@code int[]}, corresponding to the input.
   */
  private final int inputLocal;

  /**
   * Offset for a local of type {@code int} tracking the offset of the next
   * symbol to read.
   */
  private final int offsetLocal;

  /**
   * Labels associated with DFA states, sorted by state name.
   *
   * <p>Each DFA state has a label and going to a new state is as simple as
   * jumping to that label.
   */
  private final Map<State<T>, Label> stateLabels;

  /**
   * Label for the block which ends in a negative match being returned.
   */
  private final Label returnFailure;

  public DfaMethodCodegen(
    MethodVisitor mv,
    Automaton<T> dfa,
    boolean printDebugInfo
  ) {
    this.mv = mv;
    this.dfa = dfa;
    this.printDebugInfo = printDebugInfo;

    // The method is static, so the input is the first local
    int nextLocal = 0;
    this.inputLocal = nextLocal++;
    this.offsetLocal = nextLocal++;

    // Initialize labels
    final var sortedStates = new ArrayList<State<T>>(dfa.allStates());
    sortedStates.sort(Comparator.comparing(State::name));
    final var labels = new LinkedHashMap<State<T>, Label>();
    for (State<T> state : sortedStates) {
      labels.put(state, new Label());
    }
    this.stateLabels = labels;
    this.returnFailure = new Label();
  }

  public void visitDfa() {
    final State<T> entryPoint = dfa.entryPoint().orElseThrow();

    // Start reading at offset 0
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);

    if (printDebugInfo) {
      visitDebugLine("[DFA] starting run");
    }

    // Jump to the first state
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(entryPoint));

    // Lay out the blocks for each state
    for (Map.Entry<State<T>, Label> entry : stateLabels.entrySet()) {
      mv.visitLabel(entry.getValue());
      final State<T> state = entry.getKey();

      if (printDebugInfo) {
        visitDebugLine("[DFA] entering " + state.name());
      }

      // If the input is exhausted, return whether we are in an accepting state
      final var notDone = new Label();
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitInsn(Opcodes.ARRAYLENGTH);
      mv.visitJumpInsn(Opcodes.IF_ICMPLT, notDone);
      if (printDebugInfo) {
        visitDebugLine("[DFA] exiting run at " + state.name());
      }
      mv.visitInsn(state.isAccepting() ? Opcodes.ICONST_1 : Opcodes.ICONST_0);
      mv.visitInsn(Opcodes.IRETURN);
      mv.visitLabel(notDone);

      // Read the next symbol index and advance the offset
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitInsn(Opcodes.IALOAD);
      mv.visitIincInsn(offsetLocal, 1);

      visitTransition(state);
    }

    visitReturnFailure();
  }

  /**
   * Dispatch on the symbol index at the top of the stack.
   *
   * <p>With two or more symbols this is a {@code tableswitch} over every
   * symbol index, with missing transitions going to {@link #returnFailure}.
   * With a single symbol the index is necessarily {@code 0}, so it is dropped
   * and there is one unconditional jump.
   *
   * @param state state whose outgoing transitions are encoded
   */
  private void visitTransition(State<T> state) {
    final Alphabet<T> alphabet = dfa.alphabet();
    final var targets = new Label[alphabet.size()];
    for (int symbol = 0; symbol < targets.length; symbol++) {
      final Set<State<T>> next = state.transitionsFor(alphabet.symbol(symbol));
      targets[symbol] = next.isEmpty() ? returnFailure : stateLabels.get(next.iterator().next());
    }

    if (targets.length < 2) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, targets.length == 0 ? returnFailure : targets[0]);
    } else {
      mv.visitTableSwitchInsn(0, targets.length - 1, returnFailure, targets);
    }
  }

  /**
   * Emit code for the {@link #returnFailure} block.
   */
  private void visitReturnFailure() {
    mv.visitLabel(returnFailure);

    if (printDebugInfo) {
      visitDebugLine("[DFA] exiting run (stuck)");
    }

    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
  }

  /**
   * Emit code printing a fixed line to "standard" error.
   *
   * @param message line to print
   */
  private void visitDebugLine(String message) {
    mv.visitFieldInsn(Opcodes.GETSTATIC, SYSTEM_CLASS_NAME, "err", PRINTSTREAM_DESC);
    mv.visitLdcInsn(message);
    Method.PRINTLN.call(mv);
  }
}
