package org.rddl.base.util.grounding;

import java.util.List;

import org.rddl.base.util.rddl.grammar.RddlExpression;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.symbol.SymbolTable;

import com.google.common.collect.ImmutableList;

/**
 * The output of the {@link Grounder}: everything needed to simulate a problem.
 */
public final class GroundedModel
{
  private final SymbolTable                       mSymbols;
  private final GroundedVariableTable             mVariables;
  private final RddlValue[]                       mInitialValues;
  private final ImmutableList<GroundedExpression> mDerivedCpfs;
  private final ImmutableList<GroundedExpression> mStateCpfs;
  private final RddlExpression                    mReward;
  private final ImmutableList<RddlExpression>     mConstraints;
  private final ImmutableList<RddlExpression>     mInvariants;
  private final RddlInstance                      mInstance;

  GroundedModel(SymbolTable xiSymbols,
                GroundedVariableTable xiVariables,
                RddlValue[] xiInitialValues,
                List<GroundedExpression> xiDerivedCpfs,
                List<GroundedExpression> xiStateCpfs,
                RddlExpression xiReward,
                List<RddlExpression> xiConstraints,
                List<RddlExpression> xiInvariants,
                RddlInstance xiInstance)
  {
    mSymbols = xiSymbols;
    mVariables = xiVariables;
    mInitialValues = xiInitialValues;
    mDerivedCpfs = ImmutableList.copyOf(xiDerivedCpfs);
    mStateCpfs = ImmutableList.copyOf(xiStateCpfs);
    mReward = xiReward;
    mConstraints = ImmutableList.copyOf(xiConstraints);
    mInvariants = ImmutableList.copyOf(xiInvariants);
    mInstance = xiInstance;
  }

  public SymbolTable getSymbolTable()
  {
    return mSymbols;
  }

  public GroundedVariableTable getVariableTable()
  {
    return mVariables;
  }

  /**
   * @return a fresh copy of the initial value of every grounded variable, by index.  Non-fluents hold their
   *         instance values, state fluents their initial state, action fluents their defaults.  Derived fluents are
   *         null.
   */
  public RddlValue[] getInitialValues()
  {
    return mInitialValues.clone();
  }

  /**
   * @return the grounded CPFs of derived fluents, in the order they must be evaluated.
   */
  public List<GroundedExpression> getDerivedCpfs()
  {
    return mDerivedCpfs;
  }

  /**
   * @return the grounded CPFs of state fluents, in index order of their targets.
   */
  public List<GroundedExpression> getStateCpfs()
  {
    return mStateCpfs;
  }

  public RddlExpression getReward()
  {
    return mReward;
  }

  /**
   * @return the state-action constraints (including action preconditions).
   */
  public List<RddlExpression> getConstraints()
  {
    return mConstraints;
  }

  public List<RddlExpression> getInvariants()
  {
    return mInvariants;
  }

  public String getInstanceName()
  {
    return mInstance.getName();
  }

  public int getHorizon()
  {
    return mInstance.getHorizon();
  }

  public double getDiscount()
  {
    return mInstance.getDiscount();
  }

  /**
   * @return the maximum number of action fluents that may take non-default values in one epoch.
   */
  public int getMaxNondefActions()
  {
    return mInstance.getMaxNondefActions();
  }
}
