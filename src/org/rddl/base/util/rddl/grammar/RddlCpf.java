package org.rddl.base.util.rddl.grammar;

/**
 * A conditional probability function: <code>xPos' = xPos + xMove;</code>.  The head names the state fluent (primed)
 * or derived fluent (unprimed) being defined, with one parameter per declared parameter type.
 */
public final class RddlCpf
{
  private final RddlVariableReference mHead;
  private final RddlExpression        mBody;

  public RddlCpf(RddlVariableReference xiHead, RddlExpression xiBody)
  {
    mHead = xiHead;
    mBody = xiBody;
  }

  public RddlVariableReference getHead()
  {
    return mHead;
  }

  public RddlExpression getBody()
  {
    return mBody;
  }

  public int getLine()
  {
    return mHead.getLine();
  }

  @Override
  public String toString()
  {
    return mHead + " = " + mBody + ";";
  }
}
