package org.rddl.base.util.rddl.grammar;

import java.util.Set;

/**
 * Arithmetic negation or logical not.
 *
 * See {@link RddlExpression} for a complete description of the expression hierarchy.
 */
public final class RddlUnaryExpression extends RddlExpression
{
  /**
   * Unary operators.
   */
  public enum Operator
  {
    NEGATE("-"),
    NOT("~");

    private final String mSymbol;

    private Operator(String xiSymbol)
    {
      mSymbol = xiSymbol;
    }

    public String getSymbol()
    {
      return mSymbol;
    }
  }

  private final Operator       mOperator;
  private final RddlExpression mOperand;

  public RddlUnaryExpression(Operator xiOperator, RddlExpression xiOperand, int xiLine)
  {
    super(xiLine);
    mOperator = xiOperator;
    mOperand = xiOperand;
  }

  public Operator getOperator()
  {
    return mOperator;
  }

  public RddlExpression getOperand()
  {
    return mOperand;
  }

  @Override
  public void collectFreeParameters(Set<String> xoFree)
  {
    mOperand.collectFreeParameters(xoFree);
  }

  @Override
  public String toString()
  {
    return mOperator.getSymbol() + mOperand;
  }
}
