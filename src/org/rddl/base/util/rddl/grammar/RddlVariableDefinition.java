package org.rddl.base.util.rddl.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A variable declaration from the <code>pvariables</code> section of a domain, e.g.
 * <code>PICT_XPOS(picture-point) : { non-fluent, real, default = 0.0 };</code>.
 *
 * Declarations are immutable and lifted - they say nothing about the objects the parameters range over.
 */
public final class RddlVariableDefinition
{
  private final String                mName;
  private final FluentClass           mFluentClass;
  private final RddlValueType         mValueType;
  private final ImmutableList<String> mParameterTypes;
  private final RddlValue             mDefaultValue;
  private final int                   mLevel;
  private final int                   mLine;

  /**
   * Create a variable declaration.
   *
   * @param xiName           - the variable name.
   * @param xiFluentClass    - the fluent class.
   * @param xiValueType      - the value type.
   * @param xiParameterTypes - the parameter types, in order.
   * @param xiDefaultValue   - the default value (null for derived fluents).
   * @param xiLevel          - evaluation level (derived fluents only, otherwise 0).
   * @param xiLine           - the source line.
   */
  public RddlVariableDefinition(String xiName,
                                FluentClass xiFluentClass,
                                RddlValueType xiValueType,
                                List<String> xiParameterTypes,
                                RddlValue xiDefaultValue,
                                int xiLevel,
                                int xiLine)
  {
    mName = xiName.intern();
    mFluentClass = xiFluentClass;
    mValueType = xiValueType;
    mParameterTypes = ImmutableList.copyOf(xiParameterTypes);
    mDefaultValue = xiDefaultValue;
    mLevel = xiLevel;
    mLine = xiLine;
  }

  public String getName()
  {
    return mName;
  }

  public FluentClass getFluentClass()
  {
    return mFluentClass;
  }

  public RddlValueType getValueType()
  {
    return mValueType;
  }

  public List<String> getParameterTypes()
  {
    return mParameterTypes;
  }

  public int arity()
  {
    return mParameterTypes.size();
  }

  /**
   * @return the default value, or null if none was declared.
   */
  public RddlValue getDefaultValue()
  {
    return mDefaultValue;
  }

  public int getLevel()
  {
    return mLevel;
  }

  public int getLine()
  {
    return mLine;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof RddlVariableDefinition))
    {
      return false;
    }

    // Source position doesn't contribute to identity.
    RddlVariableDefinition lOther = (RddlVariableDefinition)xiOther;
    return mName.equals(lOther.mName) &&
           (mFluentClass == lOther.mFluentClass) &&
           mValueType.equals(lOther.mValueType) &&
           mParameterTypes.equals(lOther.mParameterTypes) &&
           ((mDefaultValue == null) ? (lOther.mDefaultValue == null) : mDefaultValue.equals(lOther.mDefaultValue)) &&
           (mLevel == lOther.mLevel);
  }

  @Override
  public int hashCode()
  {
    return mName.hashCode() * 31 + mFluentClass.hashCode();
  }

  @Override
  public String toString()
  {
    return mName + mParameterTypes + " : " + mFluentClass.getKeyword() + ", " + mValueType;
  }
}
