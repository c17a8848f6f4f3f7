package org.rddl.base.util.rddl.grammar;

import java.util.Set;

/**
 * A binary arithmetic, logical or relational operation.
 *
 * See {@link RddlExpression} for a complete description of the expression hierarchy.
 */
public final class RddlBinaryExpression extends RddlExpression
{
  /**
   * Broad classes of operator, which determine the operand and result types.
   */
  public enum Category
  {
    /**
     * Numeric operands, numeric result.
     */
    ARITHMETIC,

    /**
     * Boolean operands, boolean result.
     */
    LOGICAL,

    /**
     * Operands of the same type, boolean result.
     */
    EQUALITY,

    /**
     * Numeric operands, boolean result.
     */
    ORDERING;
  }

  /**
   * Binary operators.
   */
  public enum Operator
  {
    PLUS("+", Category.ARITHMETIC),
    MINUS("-", Category.ARITHMETIC),
    TIMES("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    AND("^", Category.LOGICAL),
    OR("|", Category.LOGICAL),
    IMPLY("=>", Category.LOGICAL),
    EQUIV("<=>", Category.LOGICAL),
    EQ("==", Category.EQUALITY),
    NEQ("~=", Category.EQUALITY),
    LT("<", Category.ORDERING),
    LE("<=", Category.ORDERING),
    GT(">", Category.ORDERING),
    GE(">=", Category.ORDERING);

    private final String   mSymbol;
    private final Category mCategory;

    private Operator(String xiSymbol, Category xiCategory)
    {
      mSymbol = xiSymbol;
      mCategory = xiCategory;
    }

    public String getSymbol()
    {
      return mSymbol;
    }

    public Category getCategory()
    {
      return mCategory;
    }
  }

  private final Operator       mOperator;
  private final RddlExpression mLeft;
  private final RddlExpression mRight;

  public RddlBinaryExpression(Operator xiOperator, RddlExpression xiLeft, RddlExpression xiRight, int xiLine)
  {
    super(xiLine);
    mOperator = xiOperator;
    mLeft = xiLeft;
    mRight = xiRight;
  }

  public Operator getOperator()
  {
    return mOperator;
  }

  public RddlExpression getLeft()
  {
    return mLeft;
  }

  public RddlExpression getRight()
  {
    return mRight;
  }

  @Override
  public void collectFreeParameters(Set<String> xoFree)
  {
    mLeft.collectFreeParameters(xoFree);
    mRight.collectFreeParameters(xoFree);
  }

  @Override
  public String toString()
  {
    return "(" + mLeft + " " + mOperator.getSymbol() + " " + mRight + ")";
  }
}
