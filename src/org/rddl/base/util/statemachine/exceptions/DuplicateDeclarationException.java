package org.rddl.base.util.statemachine.exceptions;

/**
 * A type, variable, object or CPF has been declared more than once.
 */
public class DuplicateDeclarationException extends RddlException
{
  private static final long serialVersionUID = 1L;

  public DuplicateDeclarationException(String xiWhat, String xiName, int xiLine)
  {
    super("Duplicate declaration of " + xiWhat + " '" + xiName + "'", xiLine, xiName);
  }
}
