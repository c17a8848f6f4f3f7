package org.rddl.base.util.rddl.grammar;

import java.util.Set;

/**
 * Class at the root of the RDDL expression hierarchy.  Every right hand side of a CPF, the reward and every constraint
 * is represented by objects that are part of this hierarchy.
 *
 * <h1>The expression hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Constant</b>: a literal bool, int or real ({@link RddlConstant}).
 *
 * <li><b>Variable reference</b>: the name of a fluent followed (optionally) by an argument list.  Each argument is
 *     either a <i>parameter</i> (a name starting with ?, bound by a CPF head or an aggregation), an object name or a
 *     member of an enumerated type (a name starting with @).  A reference may be <i>primed</i>, meaning the
 *     next-state value - which is only permitted on the left hand side of a CPF.  A reference with no arguments whose
 *     name is not a fluent is an object or enum literal.  ({@link RddlVariableReference})
 *
 * <li><b>Unary</b> and <b>binary</b> operators: arithmetic, logical and relational ({@link RddlUnaryExpression},
 *     {@link RddlBinaryExpression}).
 *
 * <li><b>Conditional</b>: <code>if (c) then a else b</code>.  Only the taken branch is ever evaluated
 *     ({@link RddlConditional}).
 *
 * <li><b>Aggregation</b>: <code>sum_{?p : type} e</code> and its relatives <code>prod_</code>, <code>exists_</code>,
 *     <code>forall_</code>, <code>max_</code> and <code>min_</code> ({@link RddlAggregation}).
 *
 * <li><b>Distribution</b>: a sample drawn from a named distribution, e.g. <code>Normal(mean, variance)</code>
 *     ({@link RddlDistribution}).
 *
 * </ul>
 *
 * <h1>Other terms</h1>
 *
 * <ul>
 *   <li><b>Free parameter</b>: a parameter that is referenced by an expression but not bound by an aggregation inside
 *       that expression.  The free parameters of a CPF body must all be bound by the CPF head.
 *   <li><b>Closed</b>: an expression with no free parameters.  The reward and every constraint must be closed.
 * </ul>
 *
 * Expressions are immutable.  Each remembers the source line it started on, for diagnostics.
 */
public abstract class RddlExpression
{
  private final int mLine;

  protected RddlExpression(int xiLine)
  {
    mLine = xiLine;
  }

  /**
   * @return the source line on which this expression starts (0 if not parsed from source).
   */
  public int getLine()
  {
    return mLine;
  }

  /**
   * Add the names of all free parameters of this expression to the specified set.
   *
   * @param xoFree - the set to add to.
   */
  public abstract void collectFreeParameters(Set<String> xoFree);

  @Override
  public abstract String toString();
}
