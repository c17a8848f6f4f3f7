package org.rddl.base.util.statemachine.exceptions;

/**
 * A structural problem with a model that isn't covered by a more specific exception - e.g. a state fluent with no
 * CPF, or a CPF whose parameters don't match the declaration.
 */
public class ModelDefinitionException extends RddlException
{
  private static final long serialVersionUID = 1L;

  public ModelDefinitionException(String xiMessage, String xiName, int xiLine)
  {
    super(xiMessage, xiLine, xiName);
  }
}
