package org.rddl.base.util.statemachine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.rddl.base.util.rddl.grammar.RddlValue;

/**
 * Values for some of the grounded action fluents for one epoch, keyed by grounded name (e.g. <code>xMove</code> or
 * <code>move(r1,up)</code>).  Actions that aren't assigned take their defaults.
 *
 * Built up with the <code>with</code> methods:
 *
 * <pre>
 * new ActionAssignment().with("xMove", 1.0).with("yMove", -1.0)
 * </pre>
 */
public final class ActionAssignment
{
  private final Map<String, RddlValue> mValues = new LinkedHashMap<>();

  public ActionAssignment with(String xiAction, RddlValue xiValue)
  {
    mValues.put(xiAction.replaceAll("\\s", ""), xiValue);
    return this;
  }

  public ActionAssignment with(String xiAction, boolean xiValue)
  {
    return with(xiAction, RddlValue.ofBool(xiValue));
  }

  public ActionAssignment with(String xiAction, int xiValue)
  {
    return with(xiAction, RddlValue.ofInt(xiValue));
  }

  public ActionAssignment with(String xiAction, double xiValue)
  {
    return with(xiAction, RddlValue.ofReal(xiValue));
  }

  /**
   * @return the assigned values, in assignment order.
   */
  public Map<String, RddlValue> getValues()
  {
    return Collections.unmodifiableMap(mValues);
  }

  public boolean isEmpty()
  {
    return mValues.isEmpty();
  }

  @Override
  public String toString()
  {
    return mValues.isEmpty() ? "<noop>" : mValues.toString();
  }
}
