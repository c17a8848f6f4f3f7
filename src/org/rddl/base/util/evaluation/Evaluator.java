package org.rddl.base.util.evaluation;

import java.util.ArrayList;
import java.util.List;

import org.rddl.base.util.grounding.GroundedVariableTable;
import org.rddl.base.util.rddl.grammar.RddlAggregation;
import org.rddl.base.util.rddl.grammar.RddlBinaryExpression;
import org.rddl.base.util.rddl.grammar.RddlConditional;
import org.rddl.base.util.rddl.grammar.RddlConstant;
import org.rddl.base.util.rddl.grammar.RddlDistribution;
import org.rddl.base.util.rddl.grammar.RddlExpression;
import org.rddl.base.util.rddl.grammar.RddlTypedParameter;
import org.rddl.base.util.rddl.grammar.RddlUnaryExpression;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.rddl.grammar.RddlValueType.Kind;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.rddl.grammar.RddlVariableReference;
import org.rddl.base.util.statemachine.exceptions.DomainOutOfRangeException;
import org.rddl.base.util.statemachine.exceptions.EvaluationException;
import org.rddl.base.util.statemachine.exceptions.TypeMismatchException;
import org.rddl.base.util.statemachine.exceptions.UnboundVariableException;
import org.rddl.base.util.symbol.SymbolTable;

/**
 * Evaluates expressions against an {@link Environment}.
 *
 * <ul>
 * <li>Conditionals evaluate only the taken branch.  <code>^</code>, <code>|</code> and <code>=&gt;</code>
 *     short-circuit, so the right operand is only evaluated when it can affect the result.</li>
 * <li>Aggregations visit every object of each parameter type exactly once, in declared order.</li>
 * <li>Integer arithmetic stays integer (division truncates).  Mixing int and real gives real.  Booleans are never
 *     treated as numbers.</li>
 * <li>Distribution nodes draw from the {@link RandomSource} supplied at construction.</li>
 * </ul>
 *
 * Evaluation has no side effects other than consuming random numbers.
 */
public final class Evaluator
{
  private final SymbolTable           mSymbols;
  private final GroundedVariableTable mVariables;
  private final RandomSource          mRandom;

  public Evaluator(SymbolTable xiSymbols, GroundedVariableTable xiVariables, RandomSource xiRandom)
  {
    mSymbols = xiSymbols;
    mVariables = xiVariables;
    mRandom = xiRandom;
  }

  /**
   * Evaluate a closed expression.
   *
   * @param xiExpression  - the expression.
   * @param xiEnvironment - values of the grounded variables.
   *
   * @return the value.
   *
   * @throws EvaluationException if the expression can't be evaluated.
   */
  public RddlValue evaluate(RddlExpression xiExpression, Environment xiEnvironment) throws EvaluationException
  {
    return evaluate(xiExpression, xiEnvironment, VariableBindings.EMPTY);
  }

  /**
   * Evaluate an expression with its free parameters bound.
   *
   * @param xiExpression  - the expression.
   * @param xiEnvironment - values of the grounded variables.
   * @param xiBindings    - parameter bindings.
   *
   * @return the value.
   *
   * @throws TypeMismatchException if an operator is applied to a value of the wrong type.
   * @throws UnboundVariableException if the expression refers to an unbound parameter or a variable with no value.
   * @throws DomainOutOfRangeException if a distribution parameter is out of range, or on integer division by zero.
   */
  public RddlValue evaluate(RddlExpression xiExpression,
                            Environment xiEnvironment,
                            VariableBindings xiBindings) throws EvaluationException
  {
    if (xiExpression instanceof RddlConstant)
    {
      return ((RddlConstant)xiExpression).getValue();
    }

    if (xiExpression instanceof RddlVariableReference)
    {
      return evaluateReference((RddlVariableReference)xiExpression, xiEnvironment, xiBindings);
    }

    if (xiExpression instanceof RddlBinaryExpression)
    {
      return evaluateBinary((RddlBinaryExpression)xiExpression, xiEnvironment, xiBindings);
    }

    if (xiExpression instanceof RddlUnaryExpression)
    {
      RddlUnaryExpression lUnary = (RddlUnaryExpression)xiExpression;
      RddlValue lOperand = evaluate(lUnary.getOperand(), xiEnvironment, xiBindings);
      if (lUnary.getOperator() == RddlUnaryExpression.Operator.NOT)
      {
        return RddlValue.ofBool(!asBoolean(lOperand, lUnary, "~"));
      }
      requireNumeric(lOperand, lUnary, "-");
      if (lOperand.getKind() == Kind.INT)
      {
        if (lOperand.asInt() == Integer.MIN_VALUE)
        {
          throw overflow("-" + lOperand, "-", lUnary);
        }
        return RddlValue.ofInt(-lOperand.asInt());
      }
      return RddlValue.ofReal(-lOperand.asDouble());
    }

    if (xiExpression instanceof RddlConditional)
    {
      RddlConditional lConditional = (RddlConditional)xiExpression;
      boolean lCondition = asBoolean(evaluate(lConditional.getCondition(), xiEnvironment, xiBindings),
                                     lConditional,
                                     "if");
      return evaluate(lCondition ? lConditional.getThen() : lConditional.getElse(), xiEnvironment, xiBindings);
    }

    if (xiExpression instanceof RddlAggregation)
    {
      return evaluateAggregation((RddlAggregation)xiExpression, xiEnvironment, xiBindings);
    }

    if (xiExpression instanceof RddlDistribution)
    {
      return sample((RddlDistribution)xiExpression, xiEnvironment, xiBindings);
    }

    throw new IllegalArgumentException("Unknown expression class: " + xiExpression.getClass().getName());
  }

  private RddlValue evaluateReference(RddlVariableReference xiReference,
                                      Environment xiEnvironment,
                                      VariableBindings xiBindings) throws EvaluationException
  {
    RddlVariableDefinition lDefinition = mSymbols.getVariable(xiReference.getName());
    if (lDefinition == null)
    {
      if ((xiReference.arity() == 0) && mSymbols.isObject(xiReference.getName()))
      {
        return RddlValue.ofObject(xiReference.getName());
      }
      throw new UnboundVariableException(xiReference.getName(), xiReference.getLine());
    }

    List<String> lObjects = new ArrayList<>(xiReference.arity());
    for (String lArgument : xiReference.getArguments())
    {
      if (RddlVariableReference.isParameter(lArgument))
      {
        String lObject = xiBindings.lookup(lArgument);
        if (lObject == null)
        {
          throw new UnboundVariableException(lArgument, xiReference.getLine());
        }
        lObjects.add(lObject);
      }
      else
      {
        lObjects.add(lArgument);
      }
    }

    if (lObjects.size() != lDefinition.arity())
    {
      throw new TypeMismatchException(lDefinition.getName() + " takes " + lDefinition.arity() + " argument(s)",
                                      lDefinition.getName(),
                                      xiReference.getLine());
    }

    int lIndex = mVariables.indexOf(lDefinition, lObjects);
    if (lIndex < 0)
    {
      throw new TypeMismatchException("Arguments " + lObjects + " don't match the parameters of " +
                                      lDefinition.getName(),
                                      lDefinition.getName(),
                                      xiReference.getLine());
    }
    return xiEnvironment.get(lIndex, mVariables.get(lIndex).getName(), xiReference.getLine());
  }

  private RddlValue evaluateBinary(RddlBinaryExpression xiBinary,
                                   Environment xiEnvironment,
                                   VariableBindings xiBindings) throws EvaluationException
  {
    RddlBinaryExpression.Operator lOperator = xiBinary.getOperator();
    String lSymbol = lOperator.getSymbol();
    RddlValue lLeft = evaluate(xiBinary.getLeft(), xiEnvironment, xiBindings);

    // Short-circuit where the left operand decides the result.
    switch (lOperator)
    {
      case AND:
        if (!asBoolean(lLeft, xiBinary, lSymbol))
        {
          return RddlValue.FALSE;
        }
        return RddlValue.ofBool(asBoolean(evaluate(xiBinary.getRight(), xiEnvironment, xiBindings),
                                          xiBinary,
                                          lSymbol));
      case OR:
        if (asBoolean(lLeft, xiBinary, lSymbol))
        {
          return RddlValue.TRUE;
        }
        return RddlValue.ofBool(asBoolean(evaluate(xiBinary.getRight(), xiEnvironment, xiBindings),
                                          xiBinary,
                                          lSymbol));
      case IMPLY:
        if (!asBoolean(lLeft, xiBinary, lSymbol))
        {
          return RddlValue.TRUE;
        }
        return RddlValue.ofBool(asBoolean(evaluate(xiBinary.getRight(), xiEnvironment, xiBindings),
                                          xiBinary,
                                          lSymbol));
      default:
        break;
    }

    RddlValue lRight = evaluate(xiBinary.getRight(), xiEnvironment, xiBindings);

    switch (lOperator.getCategory())
    {
      case LOGICAL:
        // Only <=> gets here.
        return RddlValue.ofBool(asBoolean(lLeft, xiBinary, lSymbol) == asBoolean(lRight, xiBinary, lSymbol));

      case EQUALITY:
        boolean lEqual;
        if (lLeft.isNumeric() && lRight.isNumeric())
        {
          lEqual = (lLeft.asDouble() == lRight.asDouble());
        }
        else if (lLeft.getKind() == lRight.getKind())
        {
          lEqual = lLeft.equals(lRight);
        }
        else
        {
          throw new TypeMismatchException("Can't compare " + lLeft + " with " + lRight, lSymbol, xiBinary.getLine());
        }
        return RddlValue.ofBool((lOperator == RddlBinaryExpression.Operator.EQ) == lEqual);

      case ORDERING:
        requireNumeric(lLeft, xiBinary, lSymbol);
        requireNumeric(lRight, xiBinary, lSymbol);
        switch (lOperator)
        {
          case LT:
            return RddlValue.ofBool(lLeft.asDouble() < lRight.asDouble());
          case LE:
            return RddlValue.ofBool(lLeft.asDouble() <= lRight.asDouble());
          case GT:
            return RddlValue.ofBool(lLeft.asDouble() > lRight.asDouble());
          default:
            return RddlValue.ofBool(lLeft.asDouble() >= lRight.asDouble());
        }

      default:
        return arithmetic(lOperator, lLeft, lRight, xiBinary);
    }
  }

  private static RddlValue arithmetic(RddlBinaryExpression.Operator xiOperator,
                                      RddlValue xiLeft,
                                      RddlValue xiRight,
                                      RddlExpression xiExpression) throws EvaluationException
  {
    requireNumeric(xiLeft, xiExpression, xiOperator.getSymbol());
    requireNumeric(xiRight, xiExpression, xiOperator.getSymbol());

    if ((xiLeft.getKind() == Kind.INT) && (xiRight.getKind() == Kind.INT))
    {
      int lLeft = xiLeft.asInt();
      int lRight = xiRight.asInt();
      try
      {
        switch (xiOperator)
        {
          case PLUS:
            return RddlValue.ofInt(Math.addExact(lLeft, lRight));
          case MINUS:
            return RddlValue.ofInt(Math.subtractExact(lLeft, lRight));
          case TIMES:
            return RddlValue.ofInt(Math.multiplyExact(lLeft, lRight));
          default:
            if (lRight == 0)
            {
              throw new DomainOutOfRangeException("Integer division by zero", "/", xiExpression.getLine());
            }
            // MIN_VALUE / -1 is the only quotient that doesn't fit.
            return RddlValue.ofInt((lRight == -1) ? Math.negateExact(lLeft) : lLeft / lRight);
        }
      }
      catch (ArithmeticException lEx)
      {
        throw overflow(lLeft + " " + xiOperator.getSymbol() + " " + lRight, xiOperator.getSymbol(), xiExpression);
      }
    }

    double lLeft = xiLeft.asDouble();
    double lRight = xiRight.asDouble();
    switch (xiOperator)
    {
      case PLUS:
        return RddlValue.ofReal(lLeft + lRight);
      case MINUS:
        return RddlValue.ofReal(lLeft - lRight);
      case TIMES:
        return RddlValue.ofReal(lLeft * lRight);
      default:
        return RddlValue.ofReal(lLeft / lRight);
    }
  }

  private RddlValue evaluateAggregation(RddlAggregation xiAggregation,
                                        Environment xiEnvironment,
                                        VariableBindings xiBindings) throws EvaluationException
  {
    List<RddlTypedParameter> lParameters = xiAggregation.getParameters();
    List<List<String>> lRanges = new ArrayList<>(lParameters.size());
    for (RddlTypedParameter lParameter : lParameters)
    {
      List<String> lObjects = mSymbols.getObjects(lParameter.getTypeName());
      if (lObjects.isEmpty())
      {
        return emptyAggregate(xiAggregation);
      }
      lRanges.add(lObjects);
    }

    RddlAggregation.Operator lOperator = xiAggregation.getOperator();
    String lKeyword = lOperator.getKeyword() + "_";
    RddlValue lResult = null;
    int[] lPositions = new int[lRanges.size()];

    // Odometer over the parameter ranges, last parameter fastest.
    while (true)
    {
      VariableBindings lBindings = xiBindings;
      for (int lii = 0; lii < lPositions.length; lii++)
      {
        lBindings = lBindings.bind(lParameters.get(lii).getName(), lRanges.get(lii).get(lPositions[lii]));
      }

      RddlValue lValue = evaluate(xiAggregation.getBody(), xiEnvironment, lBindings);
      if (lOperator.isLogical())
      {
        asBoolean(lValue, xiAggregation, lKeyword);
      }
      else
      {
        requireNumeric(lValue, xiAggregation, lKeyword);
      }
      lResult = (lResult == null) ? lValue : combine(xiAggregation, lResult, lValue);

      int lii = lPositions.length - 1;
      while ((lii >= 0) && (++lPositions[lii] == lRanges.get(lii).size()))
      {
        lPositions[lii] = 0;
        lii--;
      }
      if (lii < 0)
      {
        return lResult;
      }
    }
  }

  private static DomainOutOfRangeException overflow(String xiWhat, String xiOperator, RddlExpression xiExpression)
  {
    return new DomainOutOfRangeException("Integer overflow in " + xiWhat, xiOperator, xiExpression.getLine());
  }

  private static RddlValue combine(RddlAggregation xiAggregation, RddlValue xiSoFar, RddlValue xiNext)
    throws DomainOutOfRangeException
  {
    boolean lInt = (xiSoFar.getKind() == Kind.INT) && (xiNext.getKind() == Kind.INT);
    String lKeyword = xiAggregation.getOperator().getKeyword() + "_";
    switch (xiAggregation.getOperator())
    {
      case SUM:
        if (lInt)
        {
          try
          {
            return RddlValue.ofInt(Math.addExact(xiSoFar.asInt(), xiNext.asInt()));
          }
          catch (ArithmeticException lEx)
          {
            throw overflow(lKeyword + " reaching " + xiSoFar + " + " + xiNext, lKeyword, xiAggregation);
          }
        }
        return RddlValue.ofReal(xiSoFar.asDouble() + xiNext.asDouble());
      case PROD:
        if (lInt)
        {
          try
          {
            return RddlValue.ofInt(Math.multiplyExact(xiSoFar.asInt(), xiNext.asInt()));
          }
          catch (ArithmeticException lEx)
          {
            throw overflow(lKeyword + " reaching " + xiSoFar + " * " + xiNext, lKeyword, xiAggregation);
          }
        }
        return RddlValue.ofReal(xiSoFar.asDouble() * xiNext.asDouble());
      case MAX:
        return (xiNext.asDouble() > xiSoFar.asDouble()) ? xiNext : xiSoFar;
      case MIN:
        return (xiNext.asDouble() < xiSoFar.asDouble()) ? xiNext : xiSoFar;
      case EXISTS:
        return RddlValue.ofBool(xiSoFar.asBoolean() || xiNext.asBoolean());
      default:
        return RddlValue.ofBool(xiSoFar.asBoolean() && xiNext.asBoolean());
    }
  }

  private static RddlValue emptyAggregate(RddlAggregation xiAggregation) throws DomainOutOfRangeException
  {
    switch (xiAggregation.getOperator())
    {
      case SUM:
        return RddlValue.ZERO;
      case PROD:
        return RddlValue.ofInt(1);
      case EXISTS:
        return RddlValue.FALSE;
      case FORALL:
        return RddlValue.TRUE;
      default:
        throw new DomainOutOfRangeException(xiAggregation.getOperator().getKeyword() + "_ over an empty range",
                                            xiAggregation.getOperator().getKeyword() + "_",
                                            xiAggregation.getLine());
    }
  }

  private RddlValue sample(RddlDistribution xiDistribution,
                           Environment xiEnvironment,
                           VariableBindings xiBindings) throws EvaluationException
  {
    String lName = xiDistribution.getKind().getName();
    List<RddlValue> lArguments = new ArrayList<>();
    for (RddlExpression lArgument : xiDistribution.getArguments())
    {
      lArguments.add(evaluate(lArgument, xiEnvironment, xiBindings));
    }

    switch (xiDistribution.getKind())
    {
      case NORMAL:
      {
        double lMean = asDouble(lArguments.get(0), xiDistribution, lName);
        double lVariance = asDouble(lArguments.get(1), xiDistribution, lName);
        if (lVariance < 0)
        {
          throw new DomainOutOfRangeException("Normal variance must not be negative, was " + lVariance,
                                              lName,
                                              xiDistribution.getLine());
        }
        if (lVariance == 0)
        {
          return RddlValue.ofReal(lMean);
        }
        return RddlValue.ofReal(lMean + Math.sqrt(lVariance) * mRandom.nextGaussian());
      }

      case DIRAC_DELTA:
        return RddlValue.ofReal(asDouble(lArguments.get(0), xiDistribution, lName));

      case KRON_DELTA:
        return lArguments.get(0);

      case BERNOULLI:
      {
        double lProbability = asDouble(lArguments.get(0), xiDistribution, lName);
        if ((lProbability < 0) || (lProbability > 1))
        {
          throw new DomainOutOfRangeException("Bernoulli probability must be in [0, 1], was " + lProbability,
                                              lName,
                                              xiDistribution.getLine());
        }
        return RddlValue.ofBool(mRandom.nextUniform() < lProbability);
      }

      default:
      {
        double lLow = asDouble(lArguments.get(0), xiDistribution, lName);
        double lHigh = asDouble(lArguments.get(1), xiDistribution, lName);
        if (lLow > lHigh)
        {
          throw new DomainOutOfRangeException("Uniform lower bound " + lLow + " exceeds upper bound " + lHigh,
                                              lName,
                                              xiDistribution.getLine());
        }
        return RddlValue.ofReal(lLow + (lHigh - lLow) * mRandom.nextUniform());
      }
    }
  }

  private static boolean asBoolean(RddlValue xiValue,
                                   RddlExpression xiExpression,
                                   String xiOperator) throws TypeMismatchException
  {
    if (xiValue.getKind() != Kind.BOOL)
    {
      throw new TypeMismatchException("Operator " + xiOperator + " requires a boolean, not " + xiValue,
                                      xiOperator,
                                      xiExpression.getLine());
    }
    return xiValue.asBoolean();
  }

  private static double asDouble(RddlValue xiValue,
                                 RddlExpression xiExpression,
                                 String xiOperator) throws TypeMismatchException
  {
    requireNumeric(xiValue, xiExpression, xiOperator);
    return xiValue.asDouble();
  }

  private static void requireNumeric(RddlValue xiValue,
                                     RddlExpression xiExpression,
                                     String xiOperator) throws TypeMismatchException
  {
    if (!xiValue.isNumeric())
    {
      throw new TypeMismatchException("Operator " + xiOperator + " requires a number, not " + xiValue,
                                      xiOperator,
                                      xiExpression.getLine());
    }
  }
}
