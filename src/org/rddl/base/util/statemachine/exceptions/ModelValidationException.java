package org.rddl.base.util.statemachine.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Thrown when a model fails load-time validation.  Carries every problem found, not just the first, so that model
 * authors see them all at once.
 */
public class ModelValidationException extends RddlException
{
  private static final long serialVersionUID = 1L;

  private final ImmutableList<RddlException> mProblems;

  public ModelValidationException(String xiModelName, List<? extends RddlException> xiProblems)
  {
    super(describe(xiModelName, xiProblems), 0, xiModelName);
    mProblems = ImmutableList.copyOf(xiProblems);
  }

  /**
   * @return all the problems found, in the order they were found.
   */
  public List<RddlException> getProblems()
  {
    return mProblems;
  }

  /**
   * @return whether any of the problems is of the specified class.
   */
  public boolean hasProblem(Class<? extends RddlException> xiClass)
  {
    for (RddlException lProblem : mProblems)
    {
      if (xiClass.isInstance(lProblem))
      {
        return true;
      }
    }
    return false;
  }

  private static String describe(String xiModelName, List<? extends RddlException> xiProblems)
  {
    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append(xiProblems.size()).append(" problem(s) in ").append(xiModelName);
    for (RddlException lProblem : xiProblems)
    {
      lBuilder.append("\n  ").append(lProblem.getMessage());
    }
    return lBuilder.toString();
  }
}
