package org.rddl.base.apps.simulator;

import org.rddl.base.util.statemachine.ActionAssignment;
import org.rddl.base.util.statemachine.MachineState;

/**
 * Chooses the actions for each epoch of an episode.
 */
public interface Policy
{
  /**
   * Called at the start of each episode.
   *
   * @param xiEpisode - the episode number (from 0).
   */
  void startEpisode(int xiEpisode);

  /**
   * @return the actions to take in the specified state.
   *
   * @param xiState - the current state.
   */
  ActionAssignment chooseActions(MachineState xiState);
}
