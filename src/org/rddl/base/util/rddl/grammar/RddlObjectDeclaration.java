package org.rddl.base.util.rddl.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * One line of an <code>objects</code> section: <code>picture-point : {p1, p2, p3};</code>.
 */
public final class RddlObjectDeclaration
{
  private final String                mTypeName;
  private final ImmutableList<String> mObjects;
  private final int                   mLine;

  public RddlObjectDeclaration(String xiTypeName, List<String> xiObjects, int xiLine)
  {
    mTypeName = xiTypeName.intern();
    mObjects = ImmutableList.copyOf(xiObjects);
    mLine = xiLine;
  }

  public String getTypeName()
  {
    return mTypeName;
  }

  /**
   * @return the objects, in declared order.
   */
  public List<String> getObjects()
  {
    return mObjects;
  }

  public int getLine()
  {
    return mLine;
  }

  @Override
  public String toString()
  {
    return mTypeName + " : {" + StringUtils.join(mObjects, ", ") + "};";
  }
}
