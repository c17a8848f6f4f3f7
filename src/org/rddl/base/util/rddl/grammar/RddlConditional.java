package org.rddl.base.util.rddl.grammar;

import java.util.Set;

/**
 * <code>if (condition) then a else b</code>.
 *
 * See {@link RddlExpression} for a complete description of the expression hierarchy.
 */
public final class RddlConditional extends RddlExpression
{
  private final RddlExpression mCondition;
  private final RddlExpression mThen;
  private final RddlExpression mElse;

  public RddlConditional(RddlExpression xiCondition, RddlExpression xiThen, RddlExpression xiElse, int xiLine)
  {
    super(xiLine);
    mCondition = xiCondition;
    mThen = xiThen;
    mElse = xiElse;
  }

  public RddlExpression getCondition()
  {
    return mCondition;
  }

  public RddlExpression getThen()
  {
    return mThen;
  }

  public RddlExpression getElse()
  {
    return mElse;
  }

  @Override
  public void collectFreeParameters(Set<String> xoFree)
  {
    mCondition.collectFreeParameters(xoFree);
    mThen.collectFreeParameters(xoFree);
    mElse.collectFreeParameters(xoFree);
  }

  /**
   * Written in parentheses, since an unbracketed else branch would absorb any operator that follows.
   */
  @Override
  public String toString()
  {
    return "(if (" + mCondition + ") then [" + mThen + "] else [" + mElse + "])";
  }
}
