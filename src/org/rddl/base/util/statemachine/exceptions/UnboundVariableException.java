package org.rddl.base.util.statemachine.exceptions;

/**
 * The evaluation environment has no value for a referenced grounded variable (or parameter).
 */
public class UnboundVariableException extends EvaluationException
{
  private static final long serialVersionUID = 1L;

  public UnboundVariableException(String xiName, int xiLine)
  {
    super("No value bound for '" + xiName + "'", xiLine, xiName);
  }
}
