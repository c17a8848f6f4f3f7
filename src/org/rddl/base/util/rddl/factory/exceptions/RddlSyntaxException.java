package org.rddl.base.util.rddl.factory.exceptions;

import org.rddl.base.util.statemachine.exceptions.RddlException;

/**
 * The source text is not well-formed RDDL.  No partial description is ever returned alongside one of these.
 */
public class RddlSyntaxException extends RddlException
{
  private static final long serialVersionUID = 1L;

  private final int mColumn;

  /**
   * Create a syntax exception.
   *
   * @param xiMessage - what was wrong.
   * @param xiToken   - the offending token text.
   * @param xiLine    - the line on which the token starts.
   * @param xiColumn  - the column at which the token starts.
   */
  public RddlSyntaxException(String xiMessage, String xiToken, int xiLine, int xiColumn)
  {
    super(xiMessage + " at '" + xiToken + "' (column " + xiColumn + ")", xiLine, xiToken);
    mColumn = xiColumn;
  }

  public int getColumn()
  {
    return mColumn;
  }
}
