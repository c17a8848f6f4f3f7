package org.rddl.base.util.statemachine.exceptions;

/**
 * Abstract class for problems found while evaluating an expression.  A model that passes validation should never
 * produce one of these - their occurrence indicates a modelling or grounding bug, not a transient condition.
 */
public abstract class EvaluationException extends RddlException
{
  private static final long serialVersionUID = 1L;

  protected EvaluationException(String xiMessage, int xiLine, String xiOffendingName)
  {
    super(xiMessage, xiLine, xiOffendingName);
  }
}
