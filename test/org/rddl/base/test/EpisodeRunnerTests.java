package org.rddl.base.test;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.rddl.base.apps.simulator.EpisodeRunner;
import org.rddl.base.apps.simulator.NoopPolicy;
import org.rddl.base.apps.simulator.Policy;
import org.rddl.base.util.configuration.SimulatorConfiguration;
import org.rddl.base.util.configuration.SimulatorConfiguration.CfgItem;
import org.rddl.base.util.rddl.factory.Problem;
import org.rddl.base.util.statemachine.ActionAssignment;
import org.rddl.base.util.statemachine.MachineState;
import org.rddl.base.util.stats.SampledStatistic;

public class EpisodeRunnerTests extends Assert
{
  /**
   * Always photographs where it stands.
   */
  private static class SnapPolicy implements Policy
  {
    int mEpisodes = 0;

    @Override
    public void startEpisode(int xiEpisode)
    {
      mEpisodes++;
    }

    @Override
    public ActionAssignment chooseActions(MachineState xiState)
    {
      return new ActionAssignment().with("snapPicture", true);
    }
  }

  /**
   * Heads for picture point p2, photographing it on every other epoch.
   */
  private static class WanderPolicy implements Policy
  {
    @Override
    public void startEpisode(int xiEpisode)
    {
      // Stateless.
    }

    @Override
    public ActionAssignment chooseActions(MachineState xiState)
    {
      if (xiState.getEpoch() % 2 == 1)
      {
        return new ActionAssignment().with("snapPicture", true);
      }
      return new ActionAssignment().with("xMove", 1.0 - xiState.getDouble("xPos"))
                                   .with("yMove", 1.0 - xiState.getDouble("yPos"));
    }
  }

  private final TestModelRepository mRepository = new TestModelRepository();

  @After
  public void tearDown()
  {
    SimulatorConfiguration.utResetCfgVal(CfgItem.DEFAULT_RANDOM_SEED);
  }

  private static double snapReturn()
  {
    double lExpected = 0;
    for (int lii = 0; lii < 10; lii++)
    {
      lExpected += 10.0 * Math.pow(0.9, lii);
    }
    return lExpected;
  }

  @Test
  public void testNoopReturnsNothing() throws Exception
  {
    EpisodeRunner lRunner = new EpisodeRunner(mRepository.getProblem("mars_rover_pics3"), new NoopPolicy());
    assertEquals(0.0, lRunner.runEpisode(0), 0);
  }

  @Test
  public void testDiscountedReturn() throws Exception
  {
    Problem lProblem = mRepository.getProblem("mars_rover_pics3", "inst_simple_mars_rover_pics3_at_p2");
    SnapPolicy lPolicy = new SnapPolicy();
    EpisodeRunner lRunner = new EpisodeRunner(lProblem, lPolicy, 99);

    SampledStatistic lReturns = lRunner.run(3);
    assertEquals(3, lPolicy.mEpisodes);
    assertEquals(3, lReturns.getNumSamples());
    assertEquals(snapReturn(), lReturns.getMean(), 1e-9);
    assertEquals(0.0, lReturns.getStdDev(), 1e-6);

    // Further runs add to the same statistic.
    lRunner.run(2);
    assertSame(lReturns, lRunner.getReturns());
    assertEquals(5, lReturns.getNumSamples());
    assertEquals(5 * snapReturn(), lReturns.getTotal(), 1e-9);
  }

  @Test
  public void testInvalidActionsEndEpisode() throws Exception
  {
    Policy lCheat = new Policy()
    {
      @Override
      public void startEpisode(int xiEpisode)
      {
        // Stateless.
      }

      @Override
      public ActionAssignment chooseActions(MachineState xiState)
      {
        if (xiState.getEpoch() == 0)
        {
          return new ActionAssignment().with("snapPicture", true);
        }
        return new ActionAssignment().with("snapPicture", true).with("xMove", 0.5);
      }
    };

    Problem lProblem = mRepository.getProblem("mars_rover_pics3", "inst_simple_mars_rover_pics3_at_p2");
    EpisodeRunner lRunner = new EpisodeRunner(lProblem, lCheat, 1);
    assertEquals(10.0, lRunner.runEpisode(0), 0);
  }

  @Test
  public void testSeededEpisodesRepeat() throws Exception
  {
    Problem lProblem = mRepository.getProblem("mars_rover_pics3");

    EpisodeRunner lFirst = new EpisodeRunner(lProblem, new WanderPolicy(), 42);
    EpisodeRunner lSecond = new EpisodeRunner(lProblem, new WanderPolicy(), 42);
    for (int lii = 0; lii < 4; lii++)
    {
      assertEquals(lFirst.runEpisode(lii), lSecond.runEpisode(lii), 0);
    }

    // Without a seed, the configured default is used.
    SimulatorConfiguration.utOverrideCfgVal(CfgItem.DEFAULT_RANDOM_SEED, 42);
    EpisodeRunner lDefault = new EpisodeRunner(lProblem, new WanderPolicy());
    assertEquals(lFirst.runEpisode(3), lDefault.runEpisode(3), 0);
  }
}
