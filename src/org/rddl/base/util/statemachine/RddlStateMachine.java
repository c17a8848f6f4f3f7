package org.rddl.base.util.statemachine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rddl.base.util.configuration.SimulatorConfiguration;
import org.rddl.base.util.configuration.SimulatorConfiguration.CfgItem;
import org.rddl.base.util.evaluation.Environment;
import org.rddl.base.util.evaluation.Evaluator;
import org.rddl.base.util.evaluation.RandomSource;
import org.rddl.base.util.grounding.GroundedExpression;
import org.rddl.base.util.grounding.GroundedModel;
import org.rddl.base.util.grounding.GroundedVariable;
import org.rddl.base.util.grounding.GroundedVariableTable;
import org.rddl.base.util.grounding.Grounder;
import org.rddl.base.util.rddl.factory.Problem;
import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlExpression;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlNonFluents;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.rddl.grammar.RddlValueType;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.statemachine.exceptions.EvaluationException;
import org.rddl.base.util.statemachine.exceptions.InvalidActionException;
import org.rddl.base.util.statemachine.exceptions.ModelValidationException;
import org.rddl.base.util.statemachine.exceptions.StateInvariantException;
import org.rddl.base.util.symbol.ModelChecker;
import org.rddl.base.util.symbol.SymbolTable;

/**
 * Simulates an RDDL instance one epoch at a time.
 *
 * Each call to {@link #step} takes the actions for the epoch and
 * <ol>
 * <li>checks the actions are known, well typed and within max-nondef-actions;</li>
 * <li>computes the derived fluents, then checks every state-action constraint;</li>
 * <li>computes the reward;</li>
 * <li>computes every state CPF against the (frozen) current state and actions;</li>
 * <li>replaces the state wholesale and moves to the next epoch;</li>
 * <li>checks the state invariants.</li>
 * </ol>
 *
 * An assignment that fails step 1 or 2 raises an {@link InvalidActionException} and leaves the machine untouched,
 * so the caller may try again.  Any other failure is fatal: the machine is TERMINATED.
 *
 * A state machine isn't thread-safe.  The evaluator only ever sees snapshots, so nothing it does can change the state
 * part way through a step.
 */
public class RddlStateMachine
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Phases of a simulation.
   */
  public enum Phase
  {
    /**
     * No steps taken yet.
     */
    INITIALIZED,

    /**
     * At least one step taken and the horizon not yet reached.
     */
    STEPPING,

    /**
     * The horizon has been reached or a step failed.  No further steps are possible.
     */
    TERMINATED;
  }

  private final GroundedModel         mModel;
  private final GroundedVariableTable mVariables;
  private final Evaluator             mEvaluator;
  private final boolean               mEnforceMaxNondefActions;
  private final boolean               mCheckInvariants;
  private final boolean               mTraceTransitions;

  // Value of every grounded variable.  Action fluents hold their defaults and derived fluents are null between steps.
  private RddlValue[]                 mValues;
  private int                         mEpoch = 0;
  private Phase                       mPhase = Phase.INITIALIZED;

  /**
   * Create a state machine for a loaded problem.
   *
   * @param xiProblem - the problem.
   * @param xiRandom  - the source of random numbers for distribution samples.
   *
   * @throws StateInvariantException if the initial state violates a state invariant.
   * @throws EvaluationException if a state invariant can't be evaluated.
   */
  public RddlStateMachine(Problem xiProblem, RandomSource xiRandom) throws EvaluationException
  {
    this(xiProblem.getSymbolTable(),
         xiProblem.getDomain(),
         xiProblem.getNonFluents(),
         xiProblem.getInstance(),
         xiRandom);
  }

  /**
   * Create a state machine from parsed blocks, validating them first.
   *
   * @param xiDomain     - the domain.
   * @param xiNonFluents - the non-fluents (may be null if the instance doesn't use any).
   * @param xiInstance   - the instance.
   * @param xiRandom     - the source of random numbers for distribution samples.
   *
   * @throws ModelValidationException if the model is invalid.
   * @throws EvaluationException if the initial state violates (or can't be checked against) a state invariant.
   */
  public RddlStateMachine(RddlDomain xiDomain,
                          RddlNonFluents xiNonFluents,
                          RddlInstance xiInstance,
                          RandomSource xiRandom) throws ModelValidationException, EvaluationException
  {
    this(ModelChecker.check(xiDomain, xiNonFluents, xiInstance), xiDomain, xiNonFluents, xiInstance, xiRandom);
  }

  private RddlStateMachine(SymbolTable xiSymbols,
                           RddlDomain xiDomain,
                           RddlNonFluents xiNonFluents,
                           RddlInstance xiInstance,
                           RandomSource xiRandom) throws EvaluationException
  {
    mModel = Grounder.ground(xiSymbols, xiDomain, xiNonFluents, xiInstance);
    mVariables = mModel.getVariableTable();
    mEvaluator = new Evaluator(xiSymbols, mVariables, xiRandom);
    mValues = mModel.getInitialValues();

    mEnforceMaxNondefActions = SimulatorConfiguration.getCfgBool(CfgItem.ENFORCE_MAX_NONDEF_ACTIONS);
    mCheckInvariants = SimulatorConfiguration.getCfgBool(CfgItem.CHECK_STATE_INVARIANTS);
    mTraceTransitions = SimulatorConfiguration.getCfgBool(CfgItem.TRACE_TRANSITIONS);

    if (mCheckInvariants)
    {
      checkInvariants(new Environment(mValues));
    }
    if (mModel.getHorizon() == 0)
    {
      mPhase = Phase.TERMINATED;
    }

    LOGGER.debug("Created state machine for " + mModel.getInstanceName() + " with horizon " + mModel.getHorizon());
  }

  /**
   * Advance the simulation by one epoch.
   *
   * @param xiActions - the actions for this epoch.
   *
   * @return the reward, the new state and whether the simulation has now terminated.
   *
   * @throws InvalidActionException if the actions are unknown, ill-typed, too many or violate a state-action
   *                                constraint.  The machine is unchanged.
   * @throws EvaluationException if the model can't be evaluated.  The machine is TERMINATED.
   * @throws IllegalStateException if the machine is already TERMINATED.
   */
  public StepResult step(ActionAssignment xiActions) throws InvalidActionException, EvaluationException
  {
    if (mPhase == Phase.TERMINATED)
    {
      throw new IllegalStateException("Can't step " + mModel.getInstanceName() + " - already terminated at epoch " +
                                      mEpoch);
    }

    RddlValue[] lWorking = mValues.clone();
    applyActions(xiActions, lWorking);

    try
    {
      Environment lEnvironment = computeDerived(lWorking);
      checkConstraints(lEnvironment, xiActions);

      double lReward = mEvaluator.evaluate(mModel.getReward(), lEnvironment).asDouble();

      // Every CPF sees the same snapshot.  Non-state values carry over from the current values.
      RddlValue[] lNext = mValues.clone();
      for (GroundedExpression lCpf : mModel.getStateCpfs())
      {
        GroundedVariable lTarget = lCpf.getTarget();
        RddlValue lValue = mEvaluator.evaluate(lCpf.getExpression(), lEnvironment, lCpf.getBindings());
        lNext[lTarget.getIndex()] = lValue.coerceTo(lTarget.getDefinition().getValueType());
      }

      mValues = lNext;
      mEpoch++;

      if (mCheckInvariants)
      {
        checkInvariants(new Environment(mValues));
      }

      mPhase = (mEpoch >= mModel.getHorizon()) ? Phase.TERMINATED : Phase.STEPPING;

      StepResult lResult = new StepResult(lReward, getCurrentState(), mPhase == Phase.TERMINATED);
      if (mTraceTransitions)
      {
        LOGGER.trace(mModel.getInstanceName() + ": " + xiActions + " -> " + lResult);
      }
      return lResult;
    }
    catch (EvaluationException lEx)
    {
      mPhase = Phase.TERMINATED;
      LOGGER.error("Evaluation failed at epoch " + mEpoch + " of " + mModel.getInstanceName() + ": " +
                   lEx.getMessage());
      throw lEx;
    }
  }

  private void applyActions(ActionAssignment xiActions, RddlValue[] xoValues) throws InvalidActionException
  {
    int lNonDefault = 0;

    for (Entry<String, RddlValue> lEntry : xiActions.getValues().entrySet())
    {
      String lName = lEntry.getKey();
      int lIndex = mVariables.indexOf(lName);
      if ((lIndex < 0) || (mVariables.get(lIndex).getFluentClass() != FluentClass.ACTION_FLUENT))
      {
        throw reject(new InvalidActionException("Unknown action " + lName, lName, 0));
      }

      RddlVariableDefinition lDefinition = mVariables.get(lIndex).getDefinition();
      RddlValue lValue = lEntry.getValue();
      if (!isValid(lValue, lDefinition.getValueType()))
      {
        throw reject(new InvalidActionException("Value " + lValue + " is not a valid " +
                                                lDefinition.getValueType() + " for action " + lName,
                                                lName,
                                                lDefinition.getLine()));
      }

      xoValues[lIndex] = lValue.coerceTo(lDefinition.getValueType());
      if (!xoValues[lIndex].equals(mValues[lIndex]))
      {
        lNonDefault++;
      }
    }

    if (mEnforceMaxNondefActions && (lNonDefault > mModel.getMaxNondefActions()))
    {
      throw reject(new InvalidActionException(lNonDefault + " non-default actions exceeds the maximum of " +
                                              mModel.getMaxNondefActions(),
                                              "max-nondef-actions",
                                              0));
    }
  }

  private boolean isValid(RddlValue xiValue, RddlValueType xiType)
  {
    if (xiValue == null)
    {
      return false;
    }
    if (xiType.isObject())
    {
      return (xiValue.getKind() == RddlValueType.Kind.OBJECT) &&
             (mModel.getSymbolTable().getObjectIndex(xiType.getName(), xiValue.asObject()) >= 0);
    }
    switch (xiValue.getKind())
    {
      case BOOL:
        return xiType.equals(RddlValueType.BOOL);
      case INT:
        return xiType.isNumeric();
      case REAL:
        return xiType.equals(RddlValueType.REAL);
      default:
        return false;
    }
  }

  /**
   * Compute every derived fluent into the working values.
   *
   * @return a snapshot including the derived values.
   */
  private Environment computeDerived(RddlValue[] xoWorking) throws EvaluationException
  {
    Environment lEnvironment = new Environment(xoWorking);
    RddlVariableDefinition lCurrent = null;

    for (GroundedExpression lCpf : mModel.getDerivedCpfs())
    {
      GroundedVariable lTarget = lCpf.getTarget();

      // Later declarations may depend on earlier ones, so refresh the snapshot between declarations.
      if ((lCurrent != null) && !lCurrent.equals(lTarget.getDefinition()))
      {
        lEnvironment = new Environment(xoWorking);
      }
      lCurrent = lTarget.getDefinition();

      RddlValue lValue = mEvaluator.evaluate(lCpf.getExpression(), lEnvironment, lCpf.getBindings());
      xoWorking[lTarget.getIndex()] = lValue.coerceTo(lCurrent.getValueType());
    }

    return (lCurrent == null) ? lEnvironment : new Environment(xoWorking);
  }

  private void checkConstraints(Environment xiEnvironment, ActionAssignment xiActions)
    throws InvalidActionException, EvaluationException
  {
    for (RddlExpression lConstraint : mModel.getConstraints())
    {
      if (!mEvaluator.evaluate(lConstraint, xiEnvironment).asBoolean())
      {
        throw reject(new InvalidActionException("Actions " + xiActions + " violate constraint " + lConstraint,
                                                lConstraint.toString(),
                                                lConstraint.getLine()));
      }
    }
  }

  private void checkInvariants(Environment xiEnvironment) throws EvaluationException
  {
    for (RddlExpression lInvariant : mModel.getInvariants())
    {
      if (!mEvaluator.evaluate(lInvariant, xiEnvironment).asBoolean())
      {
        mPhase = Phase.TERMINATED;
        throw new StateInvariantException(lInvariant.toString(), mEpoch, lInvariant.getLine());
      }
    }
  }

  private InvalidActionException reject(InvalidActionException xiException)
  {
    LOGGER.warn("Rejected actions at epoch " + mEpoch + " of " + mModel.getInstanceName() + ": " +
                xiException.getMessage());
    return xiException;
  }

  /**
   * @return the current state.
   */
  public MachineState getCurrentState()
  {
    Map<String, RddlValue> lState = new LinkedHashMap<>();
    for (GroundedVariable lVariable : mVariables.getVariables(FluentClass.STATE_FLUENT))
    {
      lState.put(lVariable.getName(), mValues[lVariable.getIndex()]);
    }
    return new MachineState(mEpoch, lState);
  }

  /**
   * @return the number of steps taken so far.
   */
  public int getEpoch()
  {
    return mEpoch;
  }

  public Phase getPhase()
  {
    return mPhase;
  }

  public boolean isTerminated()
  {
    return mPhase == Phase.TERMINATED;
  }

  public int getHorizon()
  {
    return mModel.getHorizon();
  }

  public double getDiscount()
  {
    return mModel.getDiscount();
  }

  /**
   * @return the value of a grounded non-fluent, or null if there's no such non-fluent.
   */
  public RddlValue getNonFluent(String xiName)
  {
    int lIndex = mVariables.indexOf(xiName);
    if ((lIndex < 0) || (mVariables.get(lIndex).getFluentClass() != FluentClass.NON_FLUENT))
    {
      return null;
    }
    return mValues[lIndex];
  }

  /**
   * @return the grounded model being simulated.
   */
  public GroundedModel getModel()
  {
    return mModel;
  }

  public String getName()
  {
    return mModel.getInstanceName();
  }
}
