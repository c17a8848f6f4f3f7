package org.rddl.base.util.statemachine.exceptions;

/**
 * A variable (or object) name has been used without being declared.
 */
public class UnknownVariableException extends RddlException
{
  private static final long serialVersionUID = 1L;

  public UnknownVariableException(String xiName, int xiLine)
  {
    super("Unknown variable '" + xiName + "'", xiLine, xiName);
  }

  public UnknownVariableException(String xiMessage, String xiName, int xiLine)
  {
    super(xiMessage, xiLine, xiName);
  }
}
