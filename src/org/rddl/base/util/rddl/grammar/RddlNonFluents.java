package org.rddl.base.util.rddl.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A parsed <code>non-fluents</code> block: the objects of a problem and the values of its per-instance constants.
 */
public final class RddlNonFluents extends RddlBlock
{
  private final String                             mDomainName;
  private final ImmutableList<RddlObjectDeclaration> mObjects;
  private final ImmutableList<RddlAssignment>        mValues;

  public RddlNonFluents(String xiName,
                        String xiDomainName,
                        List<RddlObjectDeclaration> xiObjects,
                        List<RddlAssignment> xiValues,
                        int xiLine)
  {
    super(xiName, xiLine);
    mDomainName = xiDomainName;
    mObjects = ImmutableList.copyOf(xiObjects);
    mValues = ImmutableList.copyOf(xiValues);
  }

  @Override
  public String getKeyword()
  {
    return "non-fluents";
  }

  public String getDomainName()
  {
    return mDomainName;
  }

  public List<RddlObjectDeclaration> getObjects()
  {
    return mObjects;
  }

  public List<RddlAssignment> getValues()
  {
    return mValues;
  }
}
