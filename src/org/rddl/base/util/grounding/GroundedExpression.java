package org.rddl.base.util.grounding;

import org.rddl.base.util.evaluation.VariableBindings;
import org.rddl.base.util.rddl.grammar.RddlExpression;

/**
 * A lifted expression together with the bindings that ground it, and (for CPFs) the grounded variable it defines.
 *
 * The expression itself is shared between all groundings of a CPF.  Only the bindings differ.
 */
public final class GroundedExpression
{
  private final RddlExpression   mExpression;
  private final VariableBindings mBindings;
  private final GroundedVariable mTarget;

  public GroundedExpression(RddlExpression xiExpression, VariableBindings xiBindings, GroundedVariable xiTarget)
  {
    mExpression = xiExpression;
    mBindings = xiBindings;
    mTarget = xiTarget;
  }

  public RddlExpression getExpression()
  {
    return mExpression;
  }

  public VariableBindings getBindings()
  {
    return mBindings;
  }

  /**
   * @return the variable that this expression defines, or null for a constraint, invariant or reward.
   */
  public GroundedVariable getTarget()
  {
    return mTarget;
  }

  @Override
  public String toString()
  {
    String lBody = mExpression + (mBindings.isEmpty() ? "" : " " + mBindings);
    return (mTarget == null) ? lBody : mTarget + " = " + lBody;
  }
}
