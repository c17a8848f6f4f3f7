package org.rddl.base.util.statemachine.exceptions;

/**
 * A distribution parameter (or arithmetic operand) is outside the range for which it is defined - e.g. a negative
 * variance for a normal sample.
 */
public class DomainOutOfRangeException extends EvaluationException
{
  private static final long serialVersionUID = 1L;

  public DomainOutOfRangeException(String xiMessage, String xiOffendingName, int xiLine)
  {
    super(xiMessage, xiLine, xiOffendingName);
  }
}
