package org.rddl.base.util.rddl.grammar;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A parsed <code>domain</code> block.
 */
public final class RddlDomain extends RddlBlock
{
  private final ImmutableSet<String>                 mRequirements;
  private final ImmutableList<RddlTypeDefinition>     mTypes;
  private final ImmutableList<RddlVariableDefinition> mVariables;
  private final ImmutableList<RddlCpf>                mCpfs;
  private final RddlExpression                        mReward;
  private final ImmutableList<RddlExpression>         mConstraints;
  private final ImmutableList<RddlExpression>         mInvariants;

  /**
   * Create a domain.
   *
   * @param xiName         - the domain name.
   * @param xiRequirements - the requirement flags.
   * @param xiTypes        - type declarations, in source order.
   * @param xiVariables    - variable declarations, in source order.
   * @param xiCpfs         - CPFs, in source order.
   * @param xiReward       - the reward expression (null if the domain didn't declare one).
   * @param xiConstraints  - state-action constraints and action preconditions.
   * @param xiInvariants   - state invariants.
   * @param xiLine         - the source line.
   */
  public RddlDomain(String xiName,
                    Set<String> xiRequirements,
                    List<RddlTypeDefinition> xiTypes,
                    List<RddlVariableDefinition> xiVariables,
                    List<RddlCpf> xiCpfs,
                    RddlExpression xiReward,
                    List<RddlExpression> xiConstraints,
                    List<RddlExpression> xiInvariants,
                    int xiLine)
  {
    super(xiName, xiLine);
    mRequirements = ImmutableSet.copyOf(xiRequirements);
    mTypes = ImmutableList.copyOf(xiTypes);
    mVariables = ImmutableList.copyOf(xiVariables);
    mCpfs = ImmutableList.copyOf(xiCpfs);
    mReward = xiReward;
    mConstraints = ImmutableList.copyOf(xiConstraints);
    mInvariants = ImmutableList.copyOf(xiInvariants);
  }

  @Override
  public String getKeyword()
  {
    return "domain";
  }

  public Set<String> getRequirements()
  {
    return mRequirements;
  }

  public List<RddlTypeDefinition> getTypes()
  {
    return mTypes;
  }

  public List<RddlVariableDefinition> getVariables()
  {
    return mVariables;
  }

  public List<RddlCpf> getCpfs()
  {
    return mCpfs;
  }

  public RddlExpression getReward()
  {
    return mReward;
  }

  public List<RddlExpression> getConstraints()
  {
    return mConstraints;
  }

  public List<RddlExpression> getInvariants()
  {
    return mInvariants;
  }
}
