package org.rddl.base.util.rddl.factory.exceptions;

/**
 * A top-level keyword is not one of <code>domain</code>, <code>non-fluents</code> or <code>instance</code>.
 */
public class UnknownBlockException extends RddlSyntaxException
{
  private static final long serialVersionUID = 1L;

  public UnknownBlockException(String xiKeyword, int xiLine, int xiColumn)
  {
    super("Unknown top-level block", xiKeyword, xiLine, xiColumn);
  }
}
