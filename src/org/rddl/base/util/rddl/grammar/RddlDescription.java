package org.rddl.base.util.rddl.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Everything parsed from one source text: any number of domains, non-fluents blocks and instances, in source order.
 * References between blocks are not resolved here.
 */
public final class RddlDescription
{
  private final ImmutableList<RddlDomain>     mDomains;
  private final ImmutableList<RddlNonFluents> mNonFluents;
  private final ImmutableList<RddlInstance>   mInstances;

  public RddlDescription(List<RddlDomain> xiDomains,
                         List<RddlNonFluents> xiNonFluents,
                         List<RddlInstance> xiInstances)
  {
    mDomains = ImmutableList.copyOf(xiDomains);
    mNonFluents = ImmutableList.copyOf(xiNonFluents);
    mInstances = ImmutableList.copyOf(xiInstances);
  }

  public List<RddlDomain> getDomains()
  {
    return mDomains;
  }

  public List<RddlNonFluents> getNonFluents()
  {
    return mNonFluents;
  }

  public List<RddlInstance> getInstances()
  {
    return mInstances;
  }

  /**
   * @return the domain with the specified name, or null if there isn't one.
   */
  public RddlDomain getDomain(String xiName)
  {
    return find(mDomains, xiName);
  }

  /**
   * @return the non-fluents block with the specified name, or null if there isn't one.
   */
  public RddlNonFluents getNonFluents(String xiName)
  {
    return find(mNonFluents, xiName);
  }

  /**
   * @return the instance with the specified name, or null if there isn't one.
   */
  public RddlInstance getInstance(String xiName)
  {
    return find(mInstances, xiName);
  }

  private static <T extends RddlBlock> T find(List<T> xiBlocks, String xiName)
  {
    for (T lBlock : xiBlocks)
    {
      if (lBlock.getName().equals(xiName))
      {
        return lBlock;
      }
    }
    return null;
  }
}
