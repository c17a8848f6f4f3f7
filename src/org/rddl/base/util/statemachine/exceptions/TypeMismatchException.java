package org.rddl.base.util.statemachine.exceptions;

/**
 * An operator has been applied to operands of incompatible types (e.g. adding a bool to a real).  Raised by the
 * static checker at load time and by the evaluator.
 */
public class TypeMismatchException extends EvaluationException
{
  private static final long serialVersionUID = 1L;

  public TypeMismatchException(String xiMessage, String xiOffendingName, int xiLine)
  {
    super(xiMessage, xiLine, xiOffendingName);
  }
}
