package org.rddl.base.util.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlAggregation;
import org.rddl.base.util.rddl.grammar.RddlAssignment;
import org.rddl.base.util.rddl.grammar.RddlBinaryExpression;
import org.rddl.base.util.rddl.grammar.RddlConditional;
import org.rddl.base.util.rddl.grammar.RddlConstant;
import org.rddl.base.util.rddl.grammar.RddlCpf;
import org.rddl.base.util.rddl.grammar.RddlDistribution;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlExpression;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlNonFluents;
import org.rddl.base.util.rddl.grammar.RddlObjectDeclaration;
import org.rddl.base.util.rddl.grammar.RddlTypeDefinition;
import org.rddl.base.util.rddl.grammar.RddlTypedParameter;
import org.rddl.base.util.rddl.grammar.RddlUnaryExpression;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.rddl.grammar.RddlValueType;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.rddl.grammar.RddlVariableReference;
import org.rddl.base.util.statemachine.exceptions.DuplicateDeclarationException;
import org.rddl.base.util.statemachine.exceptions.ModelDefinitionException;
import org.rddl.base.util.statemachine.exceptions.ModelValidationException;
import org.rddl.base.util.statemachine.exceptions.RddlException;
import org.rddl.base.util.statemachine.exceptions.TypeMismatchException;
import org.rddl.base.util.statemachine.exceptions.UnknownTypeException;
import org.rddl.base.util.statemachine.exceptions.UnknownVariableException;

/**
 * Load-time validation of a domain, its non-fluents and an instance.
 *
 * Builds the {@link SymbolTable} and statically types every expression.  Checking continues past the first problem,
 * so that a single {@link ModelValidationException} reports everything wrong with the model.  Within a single
 * expression only the first problem is reported.
 */
public final class ModelChecker
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final RddlDomain          mDomain;
  private final RddlNonFluents      mNonFluents;
  private final RddlInstance        mInstance;
  private final SymbolTable         mTable    = new SymbolTable();
  private final List<RddlException> mProblems = new ArrayList<>();

  private ModelChecker(RddlDomain xiDomain, RddlNonFluents xiNonFluents, RddlInstance xiInstance)
  {
    mDomain = xiDomain;
    mNonFluents = xiNonFluents;
    mInstance = xiInstance;
  }

  /**
   * Validate a model.
   *
   * @param xiDomain     - the domain.
   * @param xiNonFluents - the non-fluents block, or null if the instance doesn't use one.
   * @param xiInstance   - the instance.
   *
   * @return the populated symbol table.
   *
   * @throws ModelValidationException if there is anything wrong with the model.
   */
  public static SymbolTable check(RddlDomain xiDomain,
                                  RddlNonFluents xiNonFluents,
                                  RddlInstance xiInstance) throws ModelValidationException
  {
    ModelChecker lChecker = new ModelChecker(xiDomain, xiNonFluents, xiInstance);
    lChecker.run();

    if (!lChecker.mProblems.isEmpty())
    {
      LOGGER.debug("Model " + xiInstance.getName() + " failed validation with " + lChecker.mProblems.size() +
                   " problem(s)");
      throw new ModelValidationException(xiInstance.getName(), lChecker.mProblems);
    }

    LOGGER.debug("Model " + xiInstance.getName() + " validated: " + lChecker.mTable.getTypes().size() + " type(s), " +
                 lChecker.mTable.getVariables().size() + " variable(s)");
    return lChecker.mTable;
  }

  private void run()
  {
    checkBlockReferences();

    for (RddlTypeDefinition lType : mDomain.getTypes())
    {
      try
      {
        mTable.declareType(lType);
      }
      catch (DuplicateDeclarationException lEx)
      {
        mProblems.add(lEx);
      }
    }

    for (RddlVariableDefinition lVariable : mDomain.getVariables())
    {
      try
      {
        mTable.declare(lVariable);
      }
      catch (DuplicateDeclarationException lEx)
      {
        mProblems.add(lEx);
      }
    }

    if (mNonFluents != null)
    {
      declareObjects(mNonFluents.getObjects());
    }
    declareObjects(mInstance.getObjects());

    for (RddlVariableDefinition lVariable : mTable.getVariables())
    {
      checkDeclaration(lVariable);
    }
    orderDerivedFluents();

    checkCpfs();
    checkReward();

    for (RddlExpression lConstraint : mDomain.getConstraints())
    {
      checkCondition(lConstraint, false);
    }
    for (RddlExpression lInvariant : mDomain.getInvariants())
    {
      checkCondition(lInvariant, true);
    }

    if (mNonFluents != null)
    {
      checkAssignments(mNonFluents.getValues(), FluentClass.NON_FLUENT);
    }
    checkAssignments(mInstance.getInitState(), FluentClass.STATE_FLUENT);
  }

  //////////////////////////////////////////////////
  // Declarations.
  //////////////////////////////////////////////////

  private void checkBlockReferences()
  {
    if (!mDomain.getName().equals(mInstance.getDomainName()))
    {
      mProblems.add(new ModelDefinitionException("Instance " + mInstance.getName() + " refers to domain " +
                                                 mInstance.getDomainName() + ", not " + mDomain.getName(),
                                                 mInstance.getDomainName(),
                                                 mInstance.getLine()));
    }

    if ((mNonFluents != null) && !mDomain.getName().equals(mNonFluents.getDomainName()))
    {
      mProblems.add(new ModelDefinitionException("Non-fluents " + mNonFluents.getName() + " refer to domain " +
                                                 mNonFluents.getDomainName() + ", not " + mDomain.getName(),
                                                 mNonFluents.getDomainName(),
                                                 mNonFluents.getLine()));
    }

    String lWanted = mInstance.getNonFluentsName();
    if ((lWanted != null) && ((mNonFluents == null) || !lWanted.equals(mNonFluents.getName())))
    {
      mProblems.add(new ModelDefinitionException("Instance " + mInstance.getName() + " requires non-fluents " +
                                                 lWanted,
                                                 lWanted,
                                                 mInstance.getLine()));
    }
  }

  private void declareObjects(List<RddlObjectDeclaration> xiDeclarations)
  {
    for (RddlObjectDeclaration lDeclaration : xiDeclarations)
    {
      try
      {
        mTable.declareObjects(lDeclaration.getTypeName(), lDeclaration.getObjects(), lDeclaration.getLine());
      }
      catch (RddlException lEx)
      {
        mProblems.add(lEx);
      }
    }
  }

  private void checkDeclaration(RddlVariableDefinition xiVariable)
  {
    for (String lTypeName : xiVariable.getParameterTypes())
    {
      if (!mTable.isType(lTypeName))
      {
        mProblems.add(new UnknownTypeException(lTypeName, xiVariable.getLine()));
      }
    }

    RddlValueType lValueType = xiVariable.getValueType();
    if (lValueType.isObject() && !mTable.isType(lValueType.getName()))
    {
      mProblems.add(new UnknownTypeException(lValueType.getName(), xiVariable.getLine()));
      return;
    }

    RddlValue lDefault = xiVariable.getDefaultValue();
    if (lDefault == null)
    {
      if (xiVariable.getFluentClass().requiresDefault())
      {
        mProblems.add(new ModelDefinitionException("Missing default value for " + xiVariable.getName(),
                                                   xiVariable.getName(),
                                                   xiVariable.getLine()));
      }
    }
    else
    {
      try
      {
        checkValue(lDefault, xiVariable, xiVariable.getLine());
      }
      catch (TypeMismatchException lEx)
      {
        mProblems.add(lEx);
      }
    }
  }

  private void orderDerivedFluents()
  {
    List<RddlVariableDefinition> lDerived = mTable.getVariables(FluentClass.DERIVED_FLUENT);

    // Stable, so declaration order is kept within a level.
    Collections.sort(lDerived, new Comparator<RddlVariableDefinition>()
    {
      @Override
      public int compare(RddlVariableDefinition xiA, RddlVariableDefinition xiB)
      {
        return Integer.compare(xiA.getLevel(), xiB.getLevel());
      }
    });
    mTable.setDerivedOrder(lDerived);
  }

  //////////////////////////////////////////////////
  // CPFs, reward and conditions.
  //////////////////////////////////////////////////

  private void checkCpfs()
  {
    Set<String> lDefined = new HashSet<>();

    for (RddlCpf lCpf : mDomain.getCpfs())
    {
      try
      {
        RddlVariableDefinition lVariable = checkCpfHead(lCpf.getHead());
        if (!lDefined.add(lVariable.getName()))
        {
          throw new DuplicateDeclarationException("CPF", lVariable.getName(), lCpf.getLine());
        }

        Map<String, String> lParameters = new HashMap<>();
        for (int lii = 0; lii < lVariable.arity(); lii++)
        {
          lParameters.put(lCpf.getHead().getArguments().get(lii), lVariable.getParameterTypes().get(lii));
        }

        Set<RddlVariableDefinition> lReferenced = new LinkedHashSet<>();
        RddlValueType lType = typeOf(lCpf.getBody(), lParameters, lReferenced);
        if (!lVariable.getValueType().accepts(lType))
        {
          throw new TypeMismatchException("CPF for " + lVariable.getName() + " has type " + lType + ", expected " +
                                          lVariable.getValueType(),
                                          lVariable.getName(),
                                          lCpf.getLine());
        }

        if (lVariable.getFluentClass() == FluentClass.DERIVED_FLUENT)
        {
          checkDerivedDependencies(lVariable, lReferenced, lCpf.getLine());
        }
      }
      catch (RddlException lEx)
      {
        mProblems.add(lEx);
      }
    }

    for (RddlVariableDefinition lVariable : mTable.getVariables())
    {
      if (lVariable.getFluentClass().hasCpf() && !lDefined.contains(lVariable.getName()))
      {
        mProblems.add(new ModelDefinitionException("No CPF for " + lVariable.getFluentClass().getKeyword() + " " +
                                                   lVariable.getName(),
                                                   lVariable.getName(),
                                                   lVariable.getLine()));
      }
    }
  }

  private RddlVariableDefinition checkCpfHead(RddlVariableReference xiHead) throws RddlException
  {
    RddlVariableDefinition lVariable = mTable.lookup(xiHead.getName(), xiHead.getLine());
    FluentClass lClass = lVariable.getFluentClass();

    if (!lClass.hasCpf())
    {
      throw new ModelDefinitionException("A CPF may not be given for " + lClass.getKeyword() + " " +
                                         lVariable.getName(),
                                         lVariable.getName(),
                                         xiHead.getLine());
    }
    if ((lClass == FluentClass.STATE_FLUENT) != xiHead.isPrimed())
    {
      throw new ModelDefinitionException((lClass == FluentClass.STATE_FLUENT) ?
                                           "The CPF for state fluent " + lVariable.getName() + " must define " +
                                           lVariable.getName() + "'" :
                                           "The CPF for " + lVariable.getName() + " must not be primed",
                                         lVariable.getName(),
                                         xiHead.getLine());
    }
    if (xiHead.arity() != lVariable.arity())
    {
      throw new ModelDefinitionException("The CPF for " + lVariable.getName() + " has " + xiHead.arity() +
                                         " parameter(s), expected " + lVariable.arity(),
                                         lVariable.getName(),
                                         xiHead.getLine());
    }

    Set<String> lSeen = new HashSet<>();
    for (String lArgument : xiHead.getArguments())
    {
      if (!RddlVariableReference.isParameter(lArgument) || !lSeen.add(lArgument))
      {
        throw new ModelDefinitionException("The CPF for " + lVariable.getName() +
                                           " must be defined over distinct parameters",
                                           lArgument,
                                           xiHead.getLine());
      }
    }
    return lVariable;
  }

  private void checkDerivedDependencies(RddlVariableDefinition xiVariable,
                                        Set<RddlVariableDefinition> xiReferenced,
                                        int xiLine) throws ModelDefinitionException
  {
    List<RddlVariableDefinition> lOrder = mTable.getDerivedOrder();
    int lOwnPosition = lOrder.indexOf(xiVariable);
    for (RddlVariableDefinition lReferenced : xiReferenced)
    {
      if ((lReferenced.getFluentClass() == FluentClass.DERIVED_FLUENT) &&
          (lOrder.indexOf(lReferenced) >= lOwnPosition))
      {
        throw new ModelDefinitionException("Derived fluent " + xiVariable.getName() + " depends on " +
                                           lReferenced.getName() + ", which is not evaluated before it (use a " +
                                           "lower level)",
                                           lReferenced.getName(),
                                           xiLine);
      }
    }
  }

  private void checkReward()
  {
    RddlExpression lReward = mDomain.getReward();
    if (lReward == null)
    {
      mProblems.add(new ModelDefinitionException("Domain " + mDomain.getName() + " has no reward",
                                                 mDomain.getName(),
                                                 mDomain.getLine()));
      return;
    }

    try
    {
      RddlValueType lType = typeOf(lReward,
                                   Collections.<String, String>emptyMap(),
                                   new HashSet<RddlVariableDefinition>());
      if (!lType.isNumeric())
      {
        throw new TypeMismatchException("Reward must be numeric, not " + lType, "reward", lReward.getLine());
      }
    }
    catch (RddlException lEx)
    {
      mProblems.add(lEx);
    }
  }

  private void checkCondition(RddlExpression xiCondition, boolean xiStateOnly)
  {
    try
    {
      Set<RddlVariableDefinition> lReferenced = new HashSet<>();
      RddlValueType lType = typeOf(xiCondition, Collections.<String, String>emptyMap(), lReferenced);
      if (!lType.equals(RddlValueType.BOOL))
      {
        throw new TypeMismatchException("Condition must be boolean, not " + lType,
                                        xiCondition.toString(),
                                        xiCondition.getLine());
      }

      if (xiStateOnly)
      {
        for (RddlVariableDefinition lVariable : lReferenced)
        {
          FluentClass lClass = lVariable.getFluentClass();
          if ((lClass != FluentClass.STATE_FLUENT) && (lClass != FluentClass.NON_FLUENT))
          {
            throw new ModelDefinitionException("State invariants may only refer to state and non-fluents, not " +
                                               lVariable.getName(),
                                               lVariable.getName(),
                                               xiCondition.getLine());
          }
        }
      }
    }
    catch (RddlException lEx)
    {
      mProblems.add(lEx);
    }
  }

  //////////////////////////////////////////////////
  // Literal assignments.
  //////////////////////////////////////////////////

  private void checkAssignments(List<RddlAssignment> xiAssignments, FluentClass xiClass)
  {
    Set<String> lAssigned = new HashSet<>();

    for (RddlAssignment lAssignment : xiAssignments)
    {
      RddlVariableReference lTarget = lAssignment.getTarget();
      try
      {
        RddlVariableDefinition lVariable = mTable.lookup(lTarget.getName(), lTarget.getLine());
        if (lVariable.getFluentClass() != xiClass)
        {
          throw new ModelDefinitionException(lVariable.getName() + " is a " +
                                             lVariable.getFluentClass().getKeyword() + " and can't be assigned here",
                                             lVariable.getName(),
                                             lTarget.getLine());
        }
        if (lTarget.arity() != lVariable.arity())
        {
          throw new ModelDefinitionException(lVariable.getName() + " takes " + lVariable.arity() +
                                             " argument(s)",
                                             lVariable.getName(),
                                             lTarget.getLine());
        }
        for (int lii = 0; lii < lTarget.arity(); lii++)
        {
          checkObjectArgument(lTarget.getArguments().get(lii),
                              lVariable.getParameterTypes().get(lii),
                              lTarget.getLine());
        }
        if (!lAssigned.add(lTarget.toString()))
        {
          throw new DuplicateDeclarationException("assignment to", lTarget.toString(), lTarget.getLine());
        }
        checkValue(lAssignment.getValue(), lVariable, lTarget.getLine());
      }
      catch (RddlException lEx)
      {
        mProblems.add(lEx);
      }
    }
  }

  private void checkObjectArgument(String xiArgument, String xiTypeName, int xiLine) throws UnknownVariableException
  {
    if (mTable.getObjectIndex(xiTypeName, xiArgument) < 0)
    {
      throw new UnknownVariableException("Unknown object " + xiArgument + " of type " + xiTypeName,
                                         xiArgument,
                                         xiLine);
    }
  }

  private void checkValue(RddlValue xiValue,
                          RddlVariableDefinition xiVariable,
                          int xiLine) throws TypeMismatchException
  {
    RddlValueType lExpected = xiVariable.getValueType();
    boolean lOK;
    if (xiValue.getKind() == RddlValueType.Kind.OBJECT)
    {
      lOK = lExpected.isObject() && (mTable.getObjectIndex(lExpected.getName(), xiValue.asObject()) >= 0);
    }
    else
    {
      lOK = lExpected.accepts(primitiveType(xiValue.getKind()));
    }

    if (!lOK)
    {
      throw new TypeMismatchException("Value " + xiValue + " is not a valid " + lExpected + " for " +
                                      xiVariable.getName(),
                                      xiVariable.getName(),
                                      xiLine);
    }
  }

  //////////////////////////////////////////////////
  // Expression typing.
  //////////////////////////////////////////////////

  /**
   * @return the static type of an expression.
   *
   * @param xiExpression - the expression.
   * @param xiParameters - the types of the parameters in scope.
   * @param xoReferenced - every variable that the expression refers to is added to this set.
   */
  private RddlValueType typeOf(RddlExpression xiExpression,
                               Map<String, String> xiParameters,
                               Set<RddlVariableDefinition> xoReferenced) throws RddlException
  {
    if (xiExpression instanceof RddlConstant)
    {
      RddlValue lValue = ((RddlConstant)xiExpression).getValue();
      if (lValue.getKind() != RddlValueType.Kind.OBJECT)
      {
        return primitiveType(lValue.getKind());
      }
      String lTypeName = mTable.getTypeOfObject(lValue.asObject());
      if (lTypeName == null)
      {
        throw new UnknownVariableException("Unknown enumerated value " + lValue,
                                           lValue.asObject(),
                                           xiExpression.getLine());
      }
      return RddlValueType.ofObject(lTypeName);
    }

    if (xiExpression instanceof RddlVariableReference)
    {
      return typeOfReference((RddlVariableReference)xiExpression, xiParameters, xoReferenced);
    }

    if (xiExpression instanceof RddlUnaryExpression)
    {
      RddlUnaryExpression lUnary = (RddlUnaryExpression)xiExpression;
      RddlValueType lOperand = typeOf(lUnary.getOperand(), xiParameters, xoReferenced);
      if (lUnary.getOperator() == RddlUnaryExpression.Operator.NEGATE)
      {
        requireNumeric(lOperand, lUnary, "-");
        return lOperand;
      }
      requireBool(lOperand, lUnary, "~");
      return RddlValueType.BOOL;
    }

    if (xiExpression instanceof RddlBinaryExpression)
    {
      return typeOfBinary((RddlBinaryExpression)xiExpression, xiParameters, xoReferenced);
    }

    if (xiExpression instanceof RddlConditional)
    {
      RddlConditional lConditional = (RddlConditional)xiExpression;
      requireBool(typeOf(lConditional.getCondition(), xiParameters, xoReferenced), lConditional, "if");
      RddlValueType lThen = typeOf(lConditional.getThen(), xiParameters, xoReferenced);
      RddlValueType lElse = typeOf(lConditional.getElse(), xiParameters, xoReferenced);
      if (lThen.isNumeric() && lElse.isNumeric())
      {
        return lThen.promote(lElse);
      }
      if (!lThen.equals(lElse))
      {
        throw new TypeMismatchException("Branches of conditional have different types (" + lThen + " and " +
                                        lElse + ")",
                                        "if",
                                        xiExpression.getLine());
      }
      return lThen;
    }

    if (xiExpression instanceof RddlAggregation)
    {
      RddlAggregation lAggregation = (RddlAggregation)xiExpression;
      Map<String, String> lInner = new HashMap<>(xiParameters);
      for (RddlTypedParameter lParameter : lAggregation.getParameters())
      {
        RddlTypeDefinition lType = mTable.resolveType(lParameter.getTypeName(), xiExpression.getLine());
        lInner.put(lParameter.getName(), lType.getName());
      }

      RddlValueType lBody = typeOf(lAggregation.getBody(), lInner, xoReferenced);
      String lKeyword = lAggregation.getOperator().getKeyword() + "_";
      if (lAggregation.getOperator().isLogical())
      {
        requireBool(lBody, lAggregation, lKeyword);
        return RddlValueType.BOOL;
      }
      requireNumeric(lBody, lAggregation, lKeyword);
      return lBody;
    }

    if (xiExpression instanceof RddlDistribution)
    {
      return typeOfDistribution((RddlDistribution)xiExpression, xiParameters, xoReferenced);
    }

    throw new IllegalArgumentException("Unknown expression class: " + xiExpression.getClass().getName());
  }

  private RddlValueType typeOfReference(RddlVariableReference xiReference,
                                        Map<String, String> xiParameters,
                                        Set<RddlVariableDefinition> xoReferenced) throws RddlException
  {
    String lName = xiReference.getName();

    if (!mTable.isVariable(lName))
    {
      // A bare name may be an object.
      if ((xiReference.arity() == 0) && !xiReference.isPrimed() && mTable.isObject(lName))
      {
        return RddlValueType.ofObject(mTable.getTypeOfObject(lName));
      }
      throw new UnknownVariableException(lName, xiReference.getLine());
    }

    RddlVariableDefinition lVariable = mTable.lookup(lName, xiReference.getLine());
    if (xiReference.isPrimed())
    {
      throw new ModelDefinitionException("Primed reference " + xiReference + " is only permitted as a CPF target",
                                         lName,
                                         xiReference.getLine());
    }
    if (xiReference.arity() != lVariable.arity())
    {
      throw new ModelDefinitionException(lName + " takes " + lVariable.arity() + " argument(s), not " +
                                         xiReference.arity(),
                                         lName,
                                         xiReference.getLine());
    }

    for (int lii = 0; lii < xiReference.arity(); lii++)
    {
      String lArgument = xiReference.getArguments().get(lii);
      String lExpected = lVariable.getParameterTypes().get(lii);
      if (RddlVariableReference.isParameter(lArgument))
      {
        String lActual = xiParameters.get(lArgument);
        if (lActual == null)
        {
          throw new ModelDefinitionException("Parameter " + lArgument + " is not bound",
                                             lArgument,
                                             xiReference.getLine());
        }
        if (!lActual.equals(lExpected))
        {
          throw new TypeMismatchException("Parameter " + lArgument + " has type " + lActual + " but " + lName +
                                          " expects " + lExpected,
                                          lArgument,
                                          xiReference.getLine());
        }
      }
      else
      {
        checkObjectArgument(lArgument, lExpected, xiReference.getLine());
      }
    }

    xoReferenced.add(lVariable);
    return lVariable.getValueType();
  }

  private RddlValueType typeOfBinary(RddlBinaryExpression xiBinary,
                                     Map<String, String> xiParameters,
                                     Set<RddlVariableDefinition> xoReferenced) throws RddlException
  {
    RddlValueType lLeft = typeOf(xiBinary.getLeft(), xiParameters, xoReferenced);
    RddlValueType lRight = typeOf(xiBinary.getRight(), xiParameters, xoReferenced);
    String lSymbol = xiBinary.getOperator().getSymbol();

    switch (xiBinary.getOperator().getCategory())
    {
      case ARITHMETIC:
        requireNumeric(lLeft, xiBinary, lSymbol);
        requireNumeric(lRight, xiBinary, lSymbol);
        return lLeft.promote(lRight);

      case LOGICAL:
        requireBool(lLeft, xiBinary, lSymbol);
        requireBool(lRight, xiBinary, lSymbol);
        return RddlValueType.BOOL;

      case EQUALITY:
        if (!(lLeft.isNumeric() && lRight.isNumeric()) && !lLeft.equals(lRight))
        {
          throw new TypeMismatchException("Can't compare " + lLeft + " with " + lRight, lSymbol, xiBinary.getLine());
        }
        return RddlValueType.BOOL;

      default:
        requireNumeric(lLeft, xiBinary, lSymbol);
        requireNumeric(lRight, xiBinary, lSymbol);
        return RddlValueType.BOOL;
    }
  }

  private RddlValueType typeOfDistribution(RddlDistribution xiDistribution,
                                           Map<String, String> xiParameters,
                                           Set<RddlVariableDefinition> xoReferenced) throws RddlException
  {
    List<RddlValueType> lArguments = new ArrayList<>();
    for (RddlExpression lArgument : xiDistribution.getArguments())
    {
      lArguments.add(typeOf(lArgument, xiParameters, xoReferenced));
    }

    String lName = xiDistribution.getKind().getName();
    switch (xiDistribution.getKind())
    {
      case KRON_DELTA:
        if (lArguments.get(0).equals(RddlValueType.REAL))
        {
          throw new TypeMismatchException("KronDelta requires a discrete argument", lName, xiDistribution.getLine());
        }
        return lArguments.get(0);

      case BERNOULLI:
        requireNumeric(lArguments.get(0), xiDistribution, lName);
        return RddlValueType.BOOL;

      default:
        for (RddlValueType lArgument : lArguments)
        {
          requireNumeric(lArgument, xiDistribution, lName);
        }
        return RddlValueType.REAL;
    }
  }

  private static void requireNumeric(RddlValueType xiType,
                                     RddlExpression xiExpression,
                                     String xiOperator) throws TypeMismatchException
  {
    if (!xiType.isNumeric())
    {
      throw new TypeMismatchException("Operator " + xiOperator + " requires a numeric operand, not " + xiType,
                                      xiOperator,
                                      xiExpression.getLine());
    }
  }

  private static void requireBool(RddlValueType xiType,
                                  RddlExpression xiExpression,
                                  String xiOperator) throws TypeMismatchException
  {
    if (!xiType.equals(RddlValueType.BOOL))
    {
      throw new TypeMismatchException("Operator " + xiOperator + " requires a boolean operand, not " + xiType,
                                      xiOperator,
                                      xiExpression.getLine());
    }
  }

  /**
   * @return the value type for a primitive kind of value.
   */
  static RddlValueType primitiveType(RddlValueType.Kind xiKind)
  {
    switch (xiKind)
    {
      case BOOL:
        return RddlValueType.BOOL;
      case INT:
        return RddlValueType.INT;
      case REAL:
        return RddlValueType.REAL;
      default:
        throw new IllegalArgumentException("Not a primitive kind: " + xiKind);
    }
  }
}
