package org.rddl.base.util.statemachine.exceptions;

/**
 * A type name has been used without being declared.
 */
public class UnknownTypeException extends RddlException
{
  private static final long serialVersionUID = 1L;

  public UnknownTypeException(String xiTypeName, int xiLine)
  {
    super("Unknown type '" + xiTypeName + "'", xiLine, xiTypeName);
  }
}
