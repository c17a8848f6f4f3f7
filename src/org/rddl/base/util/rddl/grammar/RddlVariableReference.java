package org.rddl.base.util.rddl.grammar;

import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A reference to a fluent, e.g. <code>PICT_XPOS(?p)</code> or <code>xPos'</code>.  A reference without arguments
 * may also name an object or an enumerated value - the checker decides which.
 *
 * See {@link RddlExpression} for a complete description of the expression hierarchy.
 */
public final class RddlVariableReference extends RddlExpression
{
  private final String                mName;
  private final boolean               mPrimed;
  private final ImmutableList<String> mArguments;

  public RddlVariableReference(String xiName, boolean xiPrimed, List<String> xiArguments, int xiLine)
  {
    super(xiLine);
    mName = xiName.intern();
    mPrimed = xiPrimed;
    mArguments = ImmutableList.copyOf(xiArguments);
  }

  /**
   * @return whether the specified argument is a parameter (rather than an object or enum value).
   */
  public static boolean isParameter(String xiArgument)
  {
    return xiArgument.startsWith("?");
  }

  /**
   * @return whether the specified name is a member of an enumerated type.
   */
  public static boolean isEnumValue(String xiArgument)
  {
    return xiArgument.startsWith("@");
  }

  public String getName()
  {
    return mName;
  }

  /**
   * @return whether this is a reference to the next-state value.
   */
  public boolean isPrimed()
  {
    return mPrimed;
  }

  public List<String> getArguments()
  {
    return mArguments;
  }

  public int arity()
  {
    return mArguments.size();
  }

  /**
   * @return whether every argument is an object or enum value.
   */
  public boolean isGround()
  {
    for (String lArgument : mArguments)
    {
      if (isParameter(lArgument))
      {
        return false;
      }
    }
    return true;
  }

  @Override
  public void collectFreeParameters(Set<String> xoFree)
  {
    for (String lArgument : mArguments)
    {
      if (isParameter(lArgument))
      {
        xoFree.add(lArgument);
      }
    }
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder(mName);
    if (mPrimed)
    {
      lBuilder.append('\'');
    }
    if (!mArguments.isEmpty())
    {
      lBuilder.append('(').append(StringUtils.join(mArguments, ", ")).append(')');
    }
    return lBuilder.toString();
  }
}
