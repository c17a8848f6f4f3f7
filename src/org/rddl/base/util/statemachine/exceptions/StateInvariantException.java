package org.rddl.base.util.statemachine.exceptions;

/**
 * A state invariant does not hold.  Since invariants constrain the model rather than the decision maker, this is
 * fatal.
 */
public class StateInvariantException extends EvaluationException
{
  private static final long serialVersionUID = 1L;

  public StateInvariantException(String xiInvariant, int xiEpoch, int xiLine)
  {
    super("State invariant " + xiInvariant + " violated at epoch " + xiEpoch, xiLine, xiInvariant);
  }
}
