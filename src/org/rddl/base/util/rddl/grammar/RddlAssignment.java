package org.rddl.base.util.rddl.grammar;

/**
 * A literal assignment to a ground variable, from a <code>non-fluents</code> or <code>init-state</code> section, e.g.
 * <code>PICT_XPOS(p1) = 1.0;</code>.
 */
public final class RddlAssignment
{
  private final RddlVariableReference mTarget;
  private final RddlValue             mValue;

  public RddlAssignment(RddlVariableReference xiTarget, RddlValue xiValue)
  {
    mTarget = xiTarget;
    mValue = xiValue;
  }

  public RddlVariableReference getTarget()
  {
    return mTarget;
  }

  public RddlValue getValue()
  {
    return mValue;
  }

  public int getLine()
  {
    return mTarget.getLine();
  }

  @Override
  public String toString()
  {
    return mTarget + " = " + mValue + ";";
  }
}
