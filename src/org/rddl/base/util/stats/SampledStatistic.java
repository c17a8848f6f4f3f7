package org.rddl.base.util.stats;

/**
 * Keep track of a statistic based on a number of real-valued samples, such as the discounted returns of a series of
 * episodes.
 *
 * The variance is accumulated incrementally from deviations about the running mean, so that a long run of nearly equal
 * returns doesn't lose precision.
 */
public class SampledStatistic
{
  private int    mNumSamples        = 0;
  private double mSum               = 0;
  private double mMean              = 0;
  private double mSumOfSquaredDiffs = 0;
  private double mMin               = Double.POSITIVE_INFINITY;
  private double mMax               = Double.NEGATIVE_INFINITY;

  /**
   * Record a sample.
   *
   * @param xiValue - the sample value.
   */
  public void sample(double xiValue)
  {
    mNumSamples++;
    mSum += xiValue;

    double lDelta = xiValue - mMean;
    mMean += lDelta / mNumSamples;
    mSumOfSquaredDiffs += lDelta * (xiValue - mMean);

    mMin = Math.min(mMin, xiValue);
    mMax = Math.max(mMax, xiValue);
  }

  public int getNumSamples()
  {
    return mNumSamples;
  }

  /**
   * @return the sum of the recorded samples.
   */
  public double getTotal()
  {
    return mSum;
  }

  /**
   * @return the mean of the recorded samples, or NaN if there are none.
   */
  public double getMean()
  {
    return (mNumSamples == 0) ? Double.NaN : mMean;
  }

  /**
   * @return the smallest sample, or +infinity if there are none.
   */
  public double getMin()
  {
    return mMin;
  }

  /**
   * @return the largest sample, or -infinity if there are none.
   */
  public double getMax()
  {
    return mMax;
  }

  /**
   * @return the sample standard deviation, or 0 if there are fewer than two samples.
   */
  public double getStdDev()
  {
    if (mNumSamples < 2)
    {
      return 0;
    }

    double lStdDev = Math.sqrt(Math.max(0, mSumOfSquaredDiffs) / (mNumSamples - 1));
    assert(!Double.isNaN(lStdDev));
    return lStdDev;
  }

  @Override
  public String toString()
  {
    if (mNumSamples == 0)
    {
      return "<No samples>";
    }

    return String.format("%.3f +/- %.3f (%d samples, range %.3f to %.3f)",
                         getMean(),
                         getStdDev(),
                         mNumSamples,
                         mMin,
                         mMax);
  }
}
