package org.rddl.base.util.rddl.grammar;

import java.util.Set;

/**
 * A literal bool, int or real.
 *
 * See {@link RddlExpression} for a complete description of the expression hierarchy.
 */
public final class RddlConstant extends RddlExpression
{
  private final RddlValue mValue;

  public RddlConstant(RddlValue xiValue, int xiLine)
  {
    super(xiLine);
    mValue = xiValue;
  }

  public RddlValue getValue()
  {
    return mValue;
  }

  @Override
  public void collectFreeParameters(Set<String> xoFree)
  {
    // Constants have no parameters.
  }

  @Override
  public String toString()
  {
    return mValue.toString();
  }
}
