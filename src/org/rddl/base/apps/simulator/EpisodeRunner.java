package org.rddl.base.apps.simulator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rddl.base.util.configuration.SimulatorConfiguration;
import org.rddl.base.util.configuration.SimulatorConfiguration.CfgItem;
import org.rddl.base.util.evaluation.SeededRandomSource;
import org.rddl.base.util.rddl.factory.Problem;
import org.rddl.base.util.statemachine.RddlStateMachine;
import org.rddl.base.util.statemachine.StepResult;
import org.rddl.base.util.statemachine.exceptions.EvaluationException;
import org.rddl.base.util.statemachine.exceptions.InvalidActionException;
import org.rddl.base.util.stats.SampledStatistic;

/**
 * Runs whole episodes of a problem under a policy, recording the discounted return of each.
 *
 * Episode <i>n</i> uses a random source seeded with <i>seed + n</i>, so a run is reproducible.  If the policy picks
 * invalid actions, the episode ends early with the return accumulated so far.
 */
public class EpisodeRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  static
  {
    SimulatorConfiguration.logConfig();
  }

  private final Problem          mProblem;
  private final Policy           mPolicy;
  private final long             mSeed;
  private final SampledStatistic mReturns = new SampledStatistic();

  /**
   * Create a runner that uses the configured default seed.
   */
  public EpisodeRunner(Problem xiProblem, Policy xiPolicy)
  {
    this(xiProblem, xiPolicy, SimulatorConfiguration.getCfgLong(CfgItem.DEFAULT_RANDOM_SEED));
  }

  public EpisodeRunner(Problem xiProblem, Policy xiPolicy, long xiSeed)
  {
    mProblem = xiProblem;
    mPolicy = xiPolicy;
    mSeed = xiSeed;
  }

  /**
   * Run a number of episodes.
   *
   * @param xiNumEpisodes - the number of episodes.
   *
   * @return the discounted returns of all the episodes run by this runner so far.
   *
   * @throws EvaluationException if the model can't be evaluated.
   */
  public SampledStatistic run(int xiNumEpisodes) throws EvaluationException
  {
    for (int lii = 0; lii < xiNumEpisodes; lii++)
    {
      mReturns.sample(runEpisode(mReturns.getNumSamples()));
    }
    LOGGER.info("Returns for " + mProblem + ": " + mReturns);
    return mReturns;
  }

  /**
   * Run a single episode.
   *
   * @param xiEpisode - the episode number, which determines the seed.
   *
   * @return the discounted return.
   *
   * @throws EvaluationException if the model can't be evaluated.
   */
  public double runEpisode(int xiEpisode) throws EvaluationException
  {
    RddlStateMachine lMachine = new RddlStateMachine(mProblem, new SeededRandomSource(mSeed + xiEpisode));
    mPolicy.startEpisode(xiEpisode);

    double lReturn = 0;
    double lDiscount = 1;
    while (!lMachine.isTerminated())
    {
      StepResult lResult;
      try
      {
        lResult = lMachine.step(mPolicy.chooseActions(lMachine.getCurrentState()));
      }
      catch (InvalidActionException lEx)
      {
        LOGGER.warn("Episode " + xiEpisode + " ended early at epoch " + lMachine.getEpoch() + ": " +
                    lEx.getMessage());
        break;
      }

      lReturn += lDiscount * lResult.getReward();
      lDiscount *= lMachine.getDiscount();
    }

    LOGGER.debug("Episode " + xiEpisode + " of " + mProblem + " returned " + lReturn);
    return lReturn;
  }

  /**
   * @return the discounted returns of all the episodes run so far.
   */
  public SampledStatistic getReturns()
  {
    return mReturns;
  }
}
