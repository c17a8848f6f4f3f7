package org.rddl.base.util.rddl.grammar;

/**
 * A parameter bound by an aggregation, e.g. <code>?p : picture-point</code>.
 */
public final class RddlTypedParameter
{
  private final String mName;
  private final String mTypeName;

  public RddlTypedParameter(String xiName, String xiTypeName)
  {
    mName = xiName.intern();
    mTypeName = xiTypeName.intern();
  }

  /**
   * @return the parameter name, including the leading '?'.
   */
  public String getName()
  {
    return mName;
  }

  public String getTypeName()
  {
    return mTypeName;
  }

  @Override
  public String toString()
  {
    return mName + " : " + mTypeName;
  }
}
