package org.rddl.base.util.statemachine;

import java.util.Map;

import org.rddl.base.util.rddl.grammar.RddlValue;

import com.google.common.collect.ImmutableMap;

/**
 * The value of every grounded state fluent at a particular epoch.  Immutable.
 */
public final class MachineState
{
  private final int                             mEpoch;
  private final ImmutableMap<String, RddlValue> mValues;

  public MachineState(int xiEpoch, Map<String, RddlValue> xiValues)
  {
    mEpoch = xiEpoch;
    mValues = ImmutableMap.copyOf(xiValues);
  }

  /**
   * @return the epoch (number of transitions since the initial state).
   */
  public int getEpoch()
  {
    return mEpoch;
  }

  /**
   * @return the value of a grounded state fluent, e.g. <code>xPos</code>, or null if there's no such fluent.
   */
  public RddlValue get(String xiName)
  {
    return mValues.get(xiName.replaceAll("\\s", ""));
  }

  /**
   * @return the numeric value of a grounded state fluent.
   *
   * @throws IllegalArgumentException if there's no such fluent or it isn't numeric.
   */
  public double getDouble(String xiName)
  {
    RddlValue lValue = get(xiName);
    if ((lValue == null) || !lValue.isNumeric())
    {
      throw new IllegalArgumentException("No numeric state fluent " + xiName);
    }
    return lValue.asDouble();
  }

  /**
   * @return every grounded state fluent and its value, in grounding order.
   */
  public Map<String, RddlValue> getValues()
  {
    return mValues;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof MachineState))
    {
      return false;
    }
    MachineState lOther = (MachineState)xiOther;
    return (mEpoch == lOther.mEpoch) && mValues.equals(lOther.mValues);
  }

  @Override
  public int hashCode()
  {
    return mEpoch * 31 + mValues.hashCode();
  }

  @Override
  public String toString()
  {
    return "epoch " + mEpoch + ": " + mValues;
  }
}
