package org.rddl.base.util.symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlTypeDefinition;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.statemachine.exceptions.DuplicateDeclarationException;
import org.rddl.base.util.statemachine.exceptions.ModelDefinitionException;
import org.rddl.base.util.statemachine.exceptions.UnknownTypeException;
import org.rddl.base.util.statemachine.exceptions.UnknownVariableException;

/**
 * Registry of the types, objects and variables of a problem.
 *
 * Every type's objects are held in declared order, which is the order used for grounding and for iterating
 * aggregations.  For enumerated types that's the order the values were listed in the domain.
 *
 * The table is populated once at load time and is read-only afterwards.
 */
public final class SymbolTable
{
  private final Map<String, RddlTypeDefinition>     mTypes         = new LinkedHashMap<>();
  private final Map<String, List<String>>           mObjects       = new HashMap<>();
  private final Map<String, Map<String, Integer>>   mObjectIndices = new HashMap<>();
  private final Map<String, String>                 mTypeOfObject  = new HashMap<>();
  private final Map<String, RddlVariableDefinition> mVariables     = new LinkedHashMap<>();
  private final List<RddlVariableDefinition>        mDerivedOrder  = new ArrayList<>();

  /**
   * Declare a type.  The values of an enumerated type are registered as its objects.
   *
   * @throws DuplicateDeclarationException if the type (or one of its enumerated values) is already declared.
   */
  public void declareType(RddlTypeDefinition xiType) throws DuplicateDeclarationException
  {
    if (mTypes.containsKey(xiType.getName()))
    {
      throw new DuplicateDeclarationException("type", xiType.getName(), xiType.getLine());
    }
    mTypes.put(xiType.getName(), xiType);
    mObjects.put(xiType.getName(), new ArrayList<String>());
    mObjectIndices.put(xiType.getName(), new HashMap<String, Integer>());

    if (xiType.isEnum())
    {
      for (String lValue : xiType.getEnumValues())
      {
        addObject(xiType.getName(), lValue, xiType.getLine());
      }
    }
  }

  /**
   * Declare objects of an object type, appending them to the type's enumeration.
   *
   * @param xiTypeName - the type.
   * @param xiObjects  - the objects, in order.
   * @param xiLine     - source line of the declaration.
   *
   * @throws UnknownTypeException if the type isn't declared.
   * @throws ModelDefinitionException if the type is enumerated (its members are fixed by the domain).
   * @throws DuplicateDeclarationException if an object is declared twice for the type.
   */
  public void declareObjects(String xiTypeName, List<String> xiObjects, int xiLine)
    throws UnknownTypeException, ModelDefinitionException, DuplicateDeclarationException
  {
    RddlTypeDefinition lType = resolveType(xiTypeName, xiLine);
    if (lType.isEnum())
    {
      throw new ModelDefinitionException("Objects cannot be declared for enumerated type '" + xiTypeName + "'",
                                         xiTypeName,
                                         xiLine);
    }

    for (String lObject : xiObjects)
    {
      addObject(xiTypeName, lObject, xiLine);
    }
  }

  private void addObject(String xiTypeName, String xiObject, int xiLine) throws DuplicateDeclarationException
  {
    Map<String, Integer> lIndices = mObjectIndices.get(xiTypeName);
    if (lIndices.containsKey(xiObject))
    {
      throw new DuplicateDeclarationException("object", xiObject, xiLine);
    }
    List<String> lObjects = mObjects.get(xiTypeName);
    lIndices.put(xiObject, lObjects.size());
    lObjects.add(xiObject);

    // Object names are normally unique across types.  If not, references without context resolve to the first.
    if (!mTypeOfObject.containsKey(xiObject))
    {
      mTypeOfObject.put(xiObject, xiTypeName);
    }
  }

  /**
   * Declare a variable.
   *
   * @throws DuplicateDeclarationException if a variable of the same name is already declared.
   */
  public void declare(RddlVariableDefinition xiVariable) throws DuplicateDeclarationException
  {
    if (mVariables.containsKey(xiVariable.getName()))
    {
      throw new DuplicateDeclarationException("variable", xiVariable.getName(), xiVariable.getLine());
    }
    mVariables.put(xiVariable.getName(), xiVariable);
  }

  /**
   * @return the named type.
   *
   * @param xiTypeName - the type name.
   * @param xiLine     - the source line at which the type is used (for diagnostics).
   *
   * @throws UnknownTypeException if the type isn't declared.
   */
  public RddlTypeDefinition resolveType(String xiTypeName, int xiLine) throws UnknownTypeException
  {
    RddlTypeDefinition lType = mTypes.get(xiTypeName);
    if (lType == null)
    {
      throw new UnknownTypeException(xiTypeName, xiLine);
    }
    return lType;
  }

  /**
   * @return the named variable's declaration.
   *
   * @param xiName - the variable name.
   * @param xiLine - the source line at which the variable is used (for diagnostics).
   *
   * @throws UnknownVariableException if the variable isn't declared.
   */
  public RddlVariableDefinition lookup(String xiName, int xiLine) throws UnknownVariableException
  {
    RddlVariableDefinition lVariable = mVariables.get(xiName);
    if (lVariable == null)
    {
      throw new UnknownVariableException(xiName, xiLine);
    }
    return lVariable;
  }

  /**
   * @return the named variable's declaration, or null if there's no such variable.
   */
  public RddlVariableDefinition getVariable(String xiName)
  {
    return mVariables.get(xiName);
  }

  public boolean isType(String xiName)
  {
    return mTypes.containsKey(xiName);
  }

  public boolean isVariable(String xiName)
  {
    return mVariables.containsKey(xiName);
  }

  /**
   * @return whether the name is an object (or enumerated value) of any type.
   */
  public boolean isObject(String xiName)
  {
    return mTypeOfObject.containsKey(xiName);
  }

  /**
   * @return the type of the named object, or null if there's no such object.
   */
  public String getTypeOfObject(String xiName)
  {
    return mTypeOfObject.get(xiName);
  }

  /**
   * @return the objects of the specified type, in grounding order.  Empty for an undeclared type.
   */
  public List<String> getObjects(String xiTypeName)
  {
    List<String> lObjects = mObjects.get(xiTypeName);
    if (lObjects == null)
    {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(lObjects);
  }

  /**
   * @return the position of the object within its type's enumeration, or -1 if it isn't a member of the type.
   */
  public int getObjectIndex(String xiTypeName, String xiObject)
  {
    Map<String, Integer> lIndices = mObjectIndices.get(xiTypeName);
    if (lIndices == null)
    {
      return -1;
    }
    Integer lIndex = lIndices.get(xiObject);
    return (lIndex == null) ? -1 : lIndex;
  }

  public Collection<RddlTypeDefinition> getTypes()
  {
    return Collections.unmodifiableCollection(mTypes.values());
  }

  /**
   * @return all variable declarations, in declaration order.
   */
  public Collection<RddlVariableDefinition> getVariables()
  {
    return Collections.unmodifiableCollection(mVariables.values());
  }

  /**
   * @return the declarations of the specified class, in declaration order.
   */
  public List<RddlVariableDefinition> getVariables(FluentClass xiClass)
  {
    List<RddlVariableDefinition> lResult = new ArrayList<>();
    for (RddlVariableDefinition lVariable : mVariables.values())
    {
      if (lVariable.getFluentClass() == xiClass)
      {
        lResult.add(lVariable);
      }
    }
    return lResult;
  }

  /**
   * Record the order in which derived fluents must be evaluated (dependencies first).
   */
  void setDerivedOrder(List<RddlVariableDefinition> xiOrder)
  {
    mDerivedOrder.clear();
    mDerivedOrder.addAll(xiOrder);
  }

  /**
   * @return the derived fluents in the order in which they must be evaluated within an epoch.
   */
  public List<RddlVariableDefinition> getDerivedOrder()
  {
    return Collections.unmodifiableList(mDerivedOrder);
  }
}
