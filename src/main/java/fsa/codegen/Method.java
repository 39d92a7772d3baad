package fsa.codegen;

import java.io.PrintStream;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Method declared or called by a generated matcher class.
 *
 * @param owner internal name of the class which declares the method
 * @param name name of the method
 * @param descriptor JVM descriptor of the method
 * @param opcode one of the {@code Opcodes.INVOKE*} codes, used to call it
 */
record Method(
  String owner,
  String name,
  String descriptor,
  int opcode
) {

  /**
   * Internal name of every generated matcher class (they are hidden classes,
   * so the name does not need to be unique).
   */
  static final String MATCHER_CLASS_NAME = "fsa/codegen/CompiledDfa$Generated";

  // `boolean (int[] input)`, shared by the interface method and the DFA body
  private static final String INDICES_TO_BOOLEAN =
    Type.getMethodDescriptor(Type.BOOLEAN_TYPE, Type.getType(int[].class));

  static final Method OBJECT_INIT = new Method(
    Type.getInternalName(Object.class),
    "<init>",
    Type.getMethodDescriptor(Type.VOID_TYPE),
    Opcodes.INVOKESPECIAL
  );
  static final Method ACCEPTS = new Method(
    Type.getInternalName(IndexMatcher.class),
    "accepts",
    INDICES_TO_BOOLEAN,
    Opcodes.INVOKEINTERFACE
  );
  static final Method RUN_DFA = new Method(
    MATCHER_CLASS_NAME,
    "runDfa",
    INDICES_TO_BOOLEAN,
    Opcodes.INVOKESTATIC
  );
  static final Method PRINTLN = new Method(
    Type.getInternalName(PrintStream.class),
    "println",
    Type.getMethodDescriptor(Type.VOID_TYPE, Type.getType(String.class)),
    Opcodes.INVOKEVIRTUAL
  );

  /**
   * Declare this method on the class being generated.
   *
   * @param cv generated class
   * @param access visibility flags ({@code static} is added for static calls)
   * @return visitor for the body of the method
   */
  MethodVisitor declareOn(ClassVisitor cv, int access) {
    final int flags = opcode == Opcodes.INVOKESTATIC ? access | Opcodes.ACC_STATIC : access;
    return cv.visitMethod(flags, name, descriptor, null, null);
  }

  /**
   * Emit a call to this method. Arguments (and receiver) must be on the stack.
   *
   * @param mv body in which the call is emitted
   */
  void call(MethodVisitor mv) {
    mv.visitMethodInsn(opcode, owner, name, descriptor, opcode == Opcodes.INVOKEINTERFACE);
  }
}
