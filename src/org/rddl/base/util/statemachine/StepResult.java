package org.rddl.base.util.statemachine;

/**
 * The outcome of one call to {@link RddlStateMachine#step}.
 */
public final class StepResult
{
  private final double       mReward;
  private final MachineState mNextState;
  private final boolean      mTerminated;

  public StepResult(double xiReward, MachineState xiNextState, boolean xiTerminated)
  {
    mReward = xiReward;
    mNextState = xiNextState;
    mTerminated = xiTerminated;
  }

  /**
   * @return the reward for the transition, computed from the state and actions before it.
   */
  public double getReward()
  {
    return mReward;
  }

  public MachineState getNextState()
  {
    return mNextState;
  }

  /**
   * @return whether the horizon has now been reached.
   */
  public boolean isTerminated()
  {
    return mTerminated;
  }

  @Override
  public String toString()
  {
    return "reward " + mReward + " -> " + mNextState + (mTerminated ? " (terminated)" : "");
  }
}
