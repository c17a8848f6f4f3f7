package org.rddl.base.util.grounding;

import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;

import com.google.common.collect.ImmutableList;

/**
 * A variable declaration applied to a concrete tuple of objects, e.g. <code>PICT_XPOS(p1)</code>.
 */
public final class GroundedVariable
{
  private final int                    mIndex;
  private final RddlVariableDefinition mDefinition;
  private final ImmutableList<String>  mArguments;
  private final String                 mName;

  GroundedVariable(int xiIndex, RddlVariableDefinition xiDefinition, List<String> xiArguments)
  {
    mIndex = xiIndex;
    mDefinition = xiDefinition;
    mArguments = ImmutableList.copyOf(xiArguments);
    mName = xiArguments.isEmpty() ? xiDefinition.getName() :
                                    xiDefinition.getName() + "(" + StringUtils.join(xiArguments, ",") + ")";
  }

  /**
   * @return the position of this variable in its {@link GroundedVariableTable}.
   */
  public int getIndex()
  {
    return mIndex;
  }

  public RddlVariableDefinition getDefinition()
  {
    return mDefinition;
  }

  public FluentClass getFluentClass()
  {
    return mDefinition.getFluentClass();
  }

  public List<String> getArguments()
  {
    return mArguments;
  }

  /**
   * @return the name of the grounded variable - the declaration name, followed by the objects (comma separated, no
   *         spaces) in brackets if there are any.
   */
  public String getName()
  {
    return mName;
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
