package org.rddl.base.util.rddl.grammar;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * An aggregation over typed object ranges, e.g. <code>sum_{?p : picture-point} [PICT_VALUE(?p)]</code>.  With more
 * than one parameter, the body is evaluated for every combination of bindings.
 *
 * See {@link RddlExpression} for a complete description of the expression hierarchy.
 */
public final class RddlAggregation extends RddlExpression
{
  /**
   * Aggregation operators.  The keyword is written with a trailing underscore in source.
   */
  public enum Operator
  {
    SUM("sum", false),
    PROD("prod", false),
    MAX("max", false),
    MIN("min", false),
    EXISTS("exists", true),
    FORALL("forall", true);

    private final String  mKeyword;
    private final boolean mLogical;

    private Operator(String xiKeyword, boolean xiLogical)
    {
      mKeyword = xiKeyword;
      mLogical = xiLogical;
    }

    public String getKeyword()
    {
      return mKeyword;
    }

    /**
     * @return whether this operator reduces booleans (rather than numbers).
     */
    public boolean isLogical()
    {
      return mLogical;
    }

    /**
     * @return the operator for the specified source keyword (e.g. "sum_"), or null if there isn't one.
     */
    public static Operator forKeyword(String xiKeyword)
    {
      for (Operator lOperator : values())
      {
        if (xiKeyword.equals(lOperator.mKeyword + "_"))
        {
          return lOperator;
        }
      }
      return null;
    }
  }

  private final Operator                          mOperator;
  private final ImmutableList<RddlTypedParameter> mParameters;
  private final RddlExpression                    mBody;

  public RddlAggregation(Operator xiOperator,
                         List<RddlTypedParameter> xiParameters,
                         RddlExpression xiBody,
                         int xiLine)
  {
    super(xiLine);
    mOperator = xiOperator;
    mParameters = ImmutableList.copyOf(xiParameters);
    mBody = xiBody;
  }

  public Operator getOperator()
  {
    return mOperator;
  }

  public List<RddlTypedParameter> getParameters()
  {
    return mParameters;
  }

  public RddlExpression getBody()
  {
    return mBody;
  }

  @Override
  public void collectFreeParameters(Set<String> xoFree)
  {
    Set<String> lBodyFree = new HashSet<>();
    mBody.collectFreeParameters(lBodyFree);
    for (RddlTypedParameter lParameter : mParameters)
    {
      lBodyFree.remove(lParameter.getName());
    }
    xoFree.addAll(lBodyFree);
  }

  @Override
  public String toString()
  {
    return mOperator.getKeyword() + "_{" + StringUtils.join(mParameters, ", ") + "} [" + mBody + "]";
  }
}
