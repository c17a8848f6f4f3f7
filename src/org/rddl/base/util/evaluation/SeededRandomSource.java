package org.rddl.base.util.evaluation;

import java.util.Random;

/**
 * Random source backed by {@link Random}.  Two sources created with the same seed produce the same sequence, so a
 * simulation run with a fixed seed is reproducible.
 */
public class SeededRandomSource implements RandomSource
{
  private final Random mRandom;
  private final long   mSeed;

  public SeededRandomSource(long xiSeed)
  {
    mSeed = xiSeed;
    mRandom = new Random(xiSeed);
  }

  public long getSeed()
  {
    return mSeed;
  }

  @Override
  public double nextGaussian()
  {
    return mRandom.nextGaussian();
  }

  @Override
  public double nextUniform()
  {
    return mRandom.nextDouble();
  }

  @Override
  public String toString()
  {
    return "SeededRandomSource(" + mSeed + ")";
  }
}
