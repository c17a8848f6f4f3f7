package org.rddl.base.util.evaluation;

/**
 * Source of the random numbers behind distribution samples.
 *
 * Implementations need not be thread-safe.  Each state machine owns its source.
 */
public interface RandomSource
{
  /**
   * @return a sample from the standard normal distribution (mean 0, variance 1).
   */
  double nextGaussian();

  /**
   * @return a sample drawn uniformly from [0, 1).
   */
  double nextUniform();
}
