package org.rddl.base.util.evaluation;

/**
 * Bindings of parameters (<code>?p</code>) to objects.
 *
 * Bindings are immutable.  Binding a parameter returns a new set of bindings that shares its tail with this one, so
 * the evaluator can cheaply extend the bindings for each iteration of an aggregation.  The newest binding of a
 * parameter shadows any older one.
 */
public final class VariableBindings
{
  /**
   * Bindings with nothing bound.
   */
  public static final VariableBindings EMPTY = new VariableBindings(null, null, null);

  private final VariableBindings mParent;
  private final String           mParameter;
  private final String           mObject;

  private VariableBindings(VariableBindings xiParent, String xiParameter, String xiObject)
  {
    mParent = xiParent;
    mParameter = xiParameter;
    mObject = xiObject;
  }

  /**
   * @return these bindings extended with a binding of the specified parameter.
   *
   * @param xiParameter - the parameter, including its leading '?'.
   * @param xiObject    - the object it is bound to.
   */
  public VariableBindings bind(String xiParameter, String xiObject)
  {
    return new VariableBindings(this, xiParameter, xiObject);
  }

  /**
   * @return the object that the parameter is bound to, or null if it is unbound.
   */
  public String lookup(String xiParameter)
  {
    for (VariableBindings lBindings = this; lBindings.mParent != null; lBindings = lBindings.mParent)
    {
      if (lBindings.mParameter.equals(xiParameter))
      {
        return lBindings.mObject;
      }
    }
    return null;
  }

  public boolean isEmpty()
  {
    return mParent == null;
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder("{");
    for (VariableBindings lBindings = this; lBindings.mParent != null; lBindings = lBindings.mParent)
    {
      if (lBindings != this)
      {
        lBuilder.append(", ");
      }
      lBuilder.append(lBindings.mParameter).append('=').append(lBindings.mObject);
    }
    return lBuilder.append('}').toString();
  }
}
