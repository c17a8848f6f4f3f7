package org.rddl.base.util.rddl.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A parsed <code>instance</code> block.
 */
public final class RddlInstance extends RddlBlock
{
  /**
   * Value of max-nondef-actions when written as <code>pos-inf</code>.
   */
  public static final int UNLIMITED_ACTIONS = Integer.MAX_VALUE;

  private final String                               mDomainName;
  private final String                               mNonFluentsName;
  private final ImmutableList<RddlObjectDeclaration> mObjects;
  private final ImmutableList<RddlAssignment>        mInitState;
  private final int                                  mMaxNondefActions;
  private final int                                  mHorizon;
  private final double                               mDiscount;

  /**
   * Create an instance.
   *
   * @param xiName             - the instance name.
   * @param xiDomainName       - the domain it refers to.
   * @param xiNonFluentsName   - the non-fluents block it refers to (may be null).
   * @param xiObjects          - any objects declared in the instance itself.
   * @param xiInitState        - initial values for state fluents.
   * @param xiMaxNondefActions - maximum number of actions that may take non-default values in an epoch.
   * @param xiHorizon          - number of epochs in an episode.
   * @param xiDiscount         - the discount factor.
   * @param xiLine             - the source line.
   */
  public RddlInstance(String xiName,
                      String xiDomainName,
                      String xiNonFluentsName,
                      List<RddlObjectDeclaration> xiObjects,
                      List<RddlAssignment> xiInitState,
                      int xiMaxNondefActions,
                      int xiHorizon,
                      double xiDiscount,
                      int xiLine)
  {
    super(xiName, xiLine);
    mDomainName = xiDomainName;
    mNonFluentsName = xiNonFluentsName;
    mObjects = ImmutableList.copyOf(xiObjects);
    mInitState = ImmutableList.copyOf(xiInitState);
    mMaxNondefActions = xiMaxNondefActions;
    mHorizon = xiHorizon;
    mDiscount = xiDiscount;
  }

  @Override
  public String getKeyword()
  {
    return "instance";
  }

  public String getDomainName()
  {
    return mDomainName;
  }

  /**
   * @return the name of the non-fluents block, or null if the instance doesn't use one.
   */
  public String getNonFluentsName()
  {
    return mNonFluentsName;
  }

  public List<RddlObjectDeclaration> getObjects()
  {
    return mObjects;
  }

  public List<RddlAssignment> getInitState()
  {
    return mInitState;
  }

  public int getMaxNondefActions()
  {
    return mMaxNondefActions;
  }

  public int getHorizon()
  {
    return mHorizon;
  }

  public double getDiscount()
  {
    return mDiscount;
  }
}
