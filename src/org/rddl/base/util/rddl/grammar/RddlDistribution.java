package org.rddl.base.util.rddl.grammar;

import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A sample drawn from a named distribution, e.g. <code>Normal(xPos + xMove, 0.5)</code>.
 *
 * See {@link RddlExpression} for a complete description of the expression hierarchy.
 */
public final class RddlDistribution extends RddlExpression
{
  /**
   * The supported distributions.
   */
  public enum Kind
  {
    /**
     * Normal(mean, variance) - real.
     */
    NORMAL("Normal", 2),

    /**
     * DiracDelta(value) - a point mass on a real value.
     */
    DIRAC_DELTA("DiracDelta", 1),

    /**
     * KronDelta(value) - a point mass on a bool, int or object value.
     */
    KRON_DELTA("KronDelta", 1),

    /**
     * Bernoulli(p) - bool, true with probability p.
     */
    BERNOULLI("Bernoulli", 1),

    /**
     * Uniform(low, high) - real.
     */
    UNIFORM("Uniform", 2);

    private final String mName;
    private final int    mArity;

    private Kind(String xiName, int xiArity)
    {
      mName = xiName;
      mArity = xiArity;
    }

    public String getName()
    {
      return mName;
    }

    public int getArity()
    {
      return mArity;
    }

    /**
     * @return the distribution with the specified source name, or null if there isn't one.
     */
    public static Kind forName(String xiName)
    {
      for (Kind lKind : values())
      {
        if (lKind.mName.equals(xiName))
        {
          return lKind;
        }
      }
      return null;
    }
  }

  private final Kind                          mKind;
  private final ImmutableList<RddlExpression> mArguments;

  public RddlDistribution(Kind xiKind, List<RddlExpression> xiArguments, int xiLine)
  {
    super(xiLine);
    mKind = xiKind;
    mArguments = ImmutableList.copyOf(xiArguments);
  }

  public Kind getKind()
  {
    return mKind;
  }

  public List<RddlExpression> getArguments()
  {
    return mArguments;
  }

  public RddlExpression getArgument(int xiIndex)
  {
    return mArguments.get(xiIndex);
  }

  @Override
  public void collectFreeParameters(Set<String> xoFree)
  {
    for (RddlExpression lArgument : mArguments)
    {
      lArgument.collectFreeParameters(xoFree);
    }
  }

  @Override
  public String toString()
  {
    return mKind.getName() + "(" + StringUtils.join(mArguments, ", ") + ")";
  }
}
