package org.rddl.base.apps.simulator;

import org.rddl.base.util.statemachine.ActionAssignment;
import org.rddl.base.util.statemachine.MachineState;

/**
 * Policy that leaves every action at its default.  Useful as a baseline.
 */
public class NoopPolicy implements Policy
{
  @Override
  public void startEpisode(int xiEpisode)
  {
    // Stateless.
  }

  @Override
  public ActionAssignment chooseActions(MachineState xiState)
  {
    return new ActionAssignment();
  }
}
