package org.rddl.base.util.evaluation;

import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.statemachine.exceptions.UnboundVariableException;

/**
 * A read-only snapshot of the values of grounded variables, indexed as in a
 * {@link org.rddl.base.util.grounding.GroundedVariableTable}.
 *
 * Variables with no value (derived fluents that haven't been computed yet) are held as null.
 */
public final class Environment
{
  private final RddlValue[] mValues;

  /**
   * Create a snapshot.  The values are copied, so later changes to the array are not seen.
   *
   * @param xiValues - value of each grounded variable, by index.
   */
  public Environment(RddlValue[] xiValues)
  {
    mValues = xiValues.clone();
  }

  /**
   * @return the value of a grounded variable.
   *
   * @param xiIndex - the variable's index.
   * @param xiName  - its name (for diagnostics).
   * @param xiLine  - line of the referring expression (for diagnostics).
   *
   * @throws UnboundVariableException if the variable has no value in this snapshot.
   */
  public RddlValue get(int xiIndex, String xiName, int xiLine) throws UnboundVariableException
  {
    RddlValue lValue = mValues[xiIndex];
    if (lValue == null)
    {
      throw new UnboundVariableException(xiName, xiLine);
    }
    return lValue;
  }

  /**
   * @return whether the variable has a value in this snapshot.
   */
  public boolean isBound(int xiIndex)
  {
    return mValues[xiIndex] != null;
  }

  public int size()
  {
    return mValues.length;
  }
}
