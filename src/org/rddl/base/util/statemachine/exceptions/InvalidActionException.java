package org.rddl.base.util.statemachine.exceptions;

/**
 * The proposed action assignment is not permitted in the current state.  This is recoverable - the caller may propose
 * a different assignment (the state is unchanged) or abandon the episode.
 */
public class InvalidActionException extends RddlException
{
  private static final long serialVersionUID = 1L;

  public InvalidActionException(String xiMessage, String xiOffendingName, int xiLine)
  {
    super(xiMessage, xiLine, xiOffendingName);
  }
}
