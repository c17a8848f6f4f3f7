package org.rddl.base.util.statemachine.exceptions;

/**
 * Abstract class for exceptions that are a result of a bad RDDL model or a bad request against one.
 *
 * Every exception records the source line it relates to (0 if unknown) and the offending name (null if none), so that
 * problems can be diagnosed without re-parsing.
 */
public abstract class RddlException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final int    mLine;
  private final String mOffendingName;

  protected RddlException(String xiMessage, int xiLine, String xiOffendingName)
  {
    super(xiMessage);
    mLine = xiLine;
    mOffendingName = xiOffendingName;
  }

  protected RddlException(String xiMessage, int xiLine, String xiOffendingName, Throwable xiCause)
  {
    super(xiMessage, xiCause);
    mLine = xiLine;
    mOffendingName = xiOffendingName;
  }

  /**
   * @return the source line to which this problem relates, or 0 if unknown.
   */
  public int getLine()
  {
    return mLine;
  }

  /**
   * @return the offending name (variable, type, token...) or null.
   */
  public String getOffendingName()
  {
    return mOffendingName;
  }

  @Override
  public String getMessage()
  {
    return (mLine > 0) ? ("line " + mLine + ": " + super.getMessage()) : super.getMessage();
  }
}
