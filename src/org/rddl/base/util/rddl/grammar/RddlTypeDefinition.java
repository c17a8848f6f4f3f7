package org.rddl.base.util.rddl.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A type declaration from the <code>types</code> section of a domain.  Either an object type, whose members come from
 * the <code>objects</code> section of a non-fluents or instance block, or an enumerated type whose members are fixed
 * here.
 */
public final class RddlTypeDefinition
{
  private final String                mName;
  private final ImmutableList<String> mEnumValues;
  private final int                   mLine;

  /**
   * Create a type definition.
   *
   * @param xiName       - the type name.
   * @param xiEnumValues - the enumerated values (each starting '@'), or null for an object type.
   * @param xiLine       - the source line.
   */
  public RddlTypeDefinition(String xiName, List<String> xiEnumValues, int xiLine)
  {
    mName = xiName.intern();
    mEnumValues = (xiEnumValues == null) ? null : ImmutableList.copyOf(xiEnumValues);
    mLine = xiLine;
  }

  public String getName()
  {
    return mName;
  }

  public boolean isEnum()
  {
    return mEnumValues != null;
  }

  /**
   * @return the enumerated values, or null for an object type.
   */
  public List<String> getEnumValues()
  {
    return mEnumValues;
  }

  public int getLine()
  {
    return mLine;
  }

  @Override
  public String toString()
  {
    return mName + " : " + (isEnum() ? "{" + StringUtils.join(mEnumValues, ", ") + "}" : "object") + ";";
  }
}
