package org.rddl.base.util.rddl.grammar;

/**
 * The class of a variable declaration.
 */
public enum FluentClass
{
  /**
   * Per-instance constant.
   */
  NON_FLUENT("non-fluent"),

  /**
   * Part of the simulation state.  Defined for the next epoch by a CPF.
   */
  STATE_FLUENT("state-fluent"),

  /**
   * Supplied by the decision maker each epoch.
   */
  ACTION_FLUENT("action-fluent"),

  /**
   * Computed within an epoch from state and action (also written "interm-fluent").  Has no default.
   */
  DERIVED_FLUENT("derived-fluent");

  private final String mKeyword;

  private FluentClass(String xiKeyword)
  {
    mKeyword = xiKeyword;
  }

  public String getKeyword()
  {
    return mKeyword;
  }

  /**
   * @return the fluent class for a source keyword, or null if not recognised.
   */
  public static FluentClass forKeyword(String xiKeyword)
  {
    if ("interm-fluent".equals(xiKeyword))
    {
      return DERIVED_FLUENT;
    }

    for (FluentClass lClass : values())
    {
      if (lClass.mKeyword.equals(xiKeyword))
      {
        return lClass;
      }
    }
    return null;
  }

  /**
   * @return whether declarations of this class must supply a default value.
   */
  public boolean requiresDefault()
  {
    return this != DERIVED_FLUENT;
  }

  /**
   * @return whether variables of this class are defined by a CPF.
   */
  public boolean hasCpf()
  {
    return (this == STATE_FLUENT) || (this == DERIVED_FLUENT);
  }
}
