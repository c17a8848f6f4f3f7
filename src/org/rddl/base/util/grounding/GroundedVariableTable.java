package org.rddl.base.util.grounding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.symbol.SymbolTable;

import com.google.common.collect.ImmutableList;

/**
 * Arena of every grounded variable of a problem, addressed by integer index.
 *
 * Declarations are laid out in declaration order.  Within a declaration, the groundings enumerate the cross product
 * of the parameter types' objects in declared order, with the last parameter varying fastest.  The index of any
 * grounding can therefore be computed from its objects' positions without a search.
 */
public final class GroundedVariableTable
{
  private final SymbolTable                     mSymbols;
  private final ImmutableList<GroundedVariable> mVariables;
  private final Map<String, Integer>            mOffsets     = new HashMap<>();
  private final Map<String, Integer>            mCounts      = new HashMap<>();
  private final Map<String, int[]>              mStrides     = new HashMap<>();
  private final Map<String, Integer>            mIndexByName = new HashMap<>();

  /**
   * Ground every declaration in a symbol table.
   */
  public GroundedVariableTable(SymbolTable xiSymbols)
  {
    mSymbols = xiSymbols;
    List<GroundedVariable> lVariables = new ArrayList<>();

    for (RddlVariableDefinition lDefinition : xiSymbols.getVariables())
    {
      int lArity = lDefinition.arity();
      int[] lSizes = new int[lArity];
      int[] lStrides = new int[lArity];
      int lCount = 1;
      for (int lii = lArity - 1; lii >= 0; lii--)
      {
        lSizes[lii] = xiSymbols.getObjects(lDefinition.getParameterTypes().get(lii)).size();
        lStrides[lii] = lCount;
        lCount *= lSizes[lii];
      }

      mOffsets.put(lDefinition.getName(), lVariables.size());
      mCounts.put(lDefinition.getName(), lCount);
      mStrides.put(lDefinition.getName(), lStrides);

      // Odometer over the parameter positions.
      int[] lPositions = new int[lArity];
      for (int lGrounding = 0; lGrounding < lCount; lGrounding++)
      {
        List<String> lArguments = new ArrayList<>(lArity);
        for (int lii = 0; lii < lArity; lii++)
        {
          lArguments.add(xiSymbols.getObjects(lDefinition.getParameterTypes().get(lii)).get(lPositions[lii]));
        }

        GroundedVariable lVariable = new GroundedVariable(lVariables.size(), lDefinition, lArguments);
        lVariables.add(lVariable);
        mIndexByName.put(lVariable.getName(), lVariable.getIndex());

        for (int lii = lArity - 1; lii >= 0; lii--)
        {
          if (++lPositions[lii] < lSizes[lii])
          {
            break;
          }
          lPositions[lii] = 0;
        }
      }
    }

    mVariables = ImmutableList.copyOf(lVariables);
  }

  /**
   * @return the number of grounded variables.
   */
  public int size()
  {
    return mVariables.size();
  }

  public GroundedVariable get(int xiIndex)
  {
    return mVariables.get(xiIndex);
  }

  /**
   * @return every grounded variable, in index order.
   */
  public List<GroundedVariable> getVariables()
  {
    return mVariables;
  }

  /**
   * @return the groundings of a single declaration, in index order.
   */
  public List<GroundedVariable> getGroundings(RddlVariableDefinition xiDefinition)
  {
    int lOffset = mOffsets.get(xiDefinition.getName());
    return mVariables.subList(lOffset, lOffset + mCounts.get(xiDefinition.getName()));
  }

  /**
   * @return the groundings of every declaration of the specified class, in index order.
   */
  public List<GroundedVariable> getVariables(FluentClass xiClass)
  {
    List<GroundedVariable> lResult = new ArrayList<>();
    for (GroundedVariable lVariable : mVariables)
    {
      if (lVariable.getFluentClass() == xiClass)
      {
        lResult.add(lVariable);
      }
    }
    return lResult;
  }

  /**
   * @return the index of a grounding, or -1 if any argument isn't an object of the corresponding parameter type.
   *
   * @param xiDefinition - the declaration.
   * @param xiArguments  - the objects, one per parameter.
   */
  public int indexOf(RddlVariableDefinition xiDefinition, List<String> xiArguments)
  {
    int lIndex = mOffsets.get(xiDefinition.getName());
    int[] lStrides = mStrides.get(xiDefinition.getName());

    for (int lii = 0; lii < lStrides.length; lii++)
    {
      int lPosition = mSymbols.getObjectIndex(xiDefinition.getParameterTypes().get(lii), xiArguments.get(lii));
      if (lPosition < 0)
      {
        return -1;
      }
      lIndex += lPosition * lStrides[lii];
    }
    return lIndex;
  }

  /**
   * @return the index of a grounding given its name (as returned by {@link GroundedVariable#getName()}), or -1 if
   *         there's no such grounding.  Whitespace in the name is ignored.
   */
  public int indexOf(String xiName)
  {
    Integer lIndex = mIndexByName.get(xiName.replaceAll("\\s", ""));
    return (lIndex == null) ? -1 : lIndex;
  }
}
