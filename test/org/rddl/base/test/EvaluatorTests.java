package org.rddl.base.test;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.rddl.base.util.evaluation.Environment;
import org.rddl.base.util.evaluation.Evaluator;
import org.rddl.base.util.evaluation.RandomSource;
import org.rddl.base.util.evaluation.SeededRandomSource;
import org.rddl.base.util.evaluation.VariableBindings;
import org.rddl.base.util.grounding.GroundedModel;
import org.rddl.base.util.grounding.Grounder;
import org.rddl.base.util.rddl.factory.Problem;
import org.rddl.base.util.rddl.factory.RddlFactory;
import org.rddl.base.util.rddl.factory.RddlLoader;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.statemachine.exceptions.DomainOutOfRangeException;
import org.rddl.base.util.statemachine.exceptions.EvaluationException;
import org.rddl.base.util.statemachine.exceptions.TypeMismatchException;
import org.rddl.base.util.statemachine.exceptions.UnboundVariableException;

/**
 * Expression evaluation against the initial state of the Mars rover problem.
 */
public class EvaluatorTests extends Assert
{
  /**
   * Random source returning fixed values and counting the draws.
   */
  private static class FixedRandomSource implements RandomSource
  {
    int mGaussianDraws = 0;
    int mUniformDraws  = 0;

    @Override
    public double nextGaussian()
    {
      mGaussianDraws++;
      return 1.0;
    }

    @Override
    public double nextUniform()
    {
      mUniformDraws++;
      return 0.25;
    }
  }

  private final TestModelRepository mRepository = new TestModelRepository();

  private GroundedModel     mModel;
  private FixedRandomSource mRandom;
  private Evaluator         mEvaluator;
  private RddlValue[]       mValues;

  @Before
  public void setUp() throws Exception
  {
    mModel = ground(mRepository.getProblem("mars_rover_pics3"));
    mRandom = new FixedRandomSource();
    mEvaluator = new Evaluator(mModel.getSymbolTable(), mModel.getVariableTable(), mRandom);
    mValues = mModel.getInitialValues();
  }

  private static GroundedModel ground(Problem xiProblem)
  {
    return Grounder.ground(xiProblem.getSymbolTable(),
                           xiProblem.getDomain(),
                           xiProblem.getNonFluents(),
                           xiProblem.getInstance());
  }

  private RddlValue eval(String xiExpression) throws Exception
  {
    return mEvaluator.evaluate(RddlFactory.createExpression(xiExpression), new Environment(mValues));
  }

  private void assertFails(String xiExpression, Class<? extends EvaluationException> xiExpected) throws Exception
  {
    try
    {
      RddlValue lValue = eval(xiExpression);
      fail(xiExpression + " evaluated to " + lValue);
    }
    catch (EvaluationException lEx)
    {
      assertTrue(xiExpression + " failed with " + lEx, xiExpected.isInstance(lEx));
    }
  }

  @Test
  public void testQuantifierTotality() throws Exception
  {
    assertEquals(RddlValue.ofInt(3), eval("sum_{?p : picture-point} [1]"));
    assertEquals(RddlValue.ofInt(9), eval("sum_{?p : picture-point, ?q : picture-point} [1]"));
    assertEquals(RddlValue.ofReal(22.0), eval("sum_{?p : picture-point} [PICT_VALUE(?p)]"));
    assertEquals(RddlValue.ofInt(8), eval("prod_{?p : picture-point} [2]"));
    assertEquals(RddlValue.ofReal(10.0), eval("max_{?p : picture-point} [PICT_VALUE(?p)]"));
    assertEquals(RddlValue.ofReal(5.0), eval("min_{?p : picture-point} [PICT_VALUE(?p)]"));
    assertEquals(RddlValue.TRUE, eval("exists_{?p : picture-point} [PICT_VALUE(?p) > 9.0]"));
    assertEquals(RddlValue.FALSE, eval("forall_{?p : picture-point} [PICT_VALUE(?p) > 5.0]"));

    // Pairs (p, q) with p worth more than q.
    assertEquals(RddlValue.ofInt(3),
                 eval("sum_{?p : picture-point} [sum_{?q : picture-point} " +
                      "[if (PICT_VALUE(?p) > PICT_VALUE(?q)) then 1 else 0]]"));
  }

  @Test
  public void testQuantifiersVisitEveryObject() throws Exception
  {
    assertEquals(RddlValue.ofReal(0.75), eval("sum_{?p : picture-point} [Uniform(0.0, 1.0)]"));
    assertEquals(3, mRandom.mUniformDraws);

    // No short-circuit: the first object already decides the result, but every object is visited.
    assertEquals(RddlValue.TRUE, eval("exists_{?p : picture-point} [Bernoulli(1.0)]"));
    assertEquals(6, mRandom.mUniformDraws);
    assertEquals(RddlValue.FALSE, eval("forall_{?p : picture-point} [Bernoulli(0.0)]"));
    assertEquals(9, mRandom.mUniformDraws);
  }

  @Test
  public void testEmptyRanges() throws Exception
  {
    Problem lProblem = RddlLoader.load("domain e {\n" +
                                       "  types { ghost : object; };\n" +
                                       "  pvariables { x : { state-fluent, int, default = 0 }; };\n" +
                                       "  cpfs { x' = x; };\n" +
                                       "  reward = x;\n" +
                                       "}\n" +
                                       "instance ei { domain = e; horizon = 1; }\n");
    mModel = ground(lProblem);
    mEvaluator = new Evaluator(mModel.getSymbolTable(), mModel.getVariableTable(), mRandom);
    mValues = mModel.getInitialValues();

    assertEquals(RddlValue.ZERO, eval("sum_{?g : ghost} [1]"));
    assertEquals(RddlValue.ofInt(1), eval("prod_{?g : ghost} [2]"));
    assertEquals(RddlValue.FALSE, eval("exists_{?g : ghost} [true]"));
    assertEquals(RddlValue.TRUE, eval("forall_{?g : ghost} [false]"));
    assertFails("max_{?g : ghost} [1]", DomainOutOfRangeException.class);
    assertFails("min_{?g : ghost} [1]", DomainOutOfRangeException.class);
  }

  @Test
  public void testConditionalShortCircuit() throws Exception
  {
    mValues[mModel.getVariableTable().indexOf("xMove")] = null;
    mValues[mModel.getVariableTable().indexOf("snapPicture")] = RddlValue.TRUE;

    assertEquals(RddlValue.ofReal(1.0), eval("if (snapPicture) then 1.0 else xMove"));
    assertEquals(RddlValue.FALSE, eval("~snapPicture ^ (xMove > 0)"));
    assertEquals(RddlValue.TRUE, eval("snapPicture | (xMove > 0)"));
    assertEquals(RddlValue.TRUE, eval("~snapPicture => (xMove > 0)"));

    assertFails("if (~snapPicture) then 1.0 else xMove", UnboundVariableException.class);
    assertFails("(xMove > 0) ^ ~snapPicture", UnboundVariableException.class);
    assertFails("snapPicture <=> (xMove > 0)", UnboundVariableException.class);
  }

  @Test
  public void testArithmetic() throws Exception
  {
    assertEquals(RddlValue.ofInt(7), eval("2 * 3 + 1"));
    assertEquals(RddlValue.ofInt(3), eval("7 / 2"));
    assertEquals(RddlValue.ofInt(-3), eval("-7 / 2"));
    assertEquals(RddlValue.ofReal(3.5), eval("7 / 2.0"));
    assertEquals(RddlValue.ofReal(10.0), eval("MAX_TIME - 2"));
    assertEquals(RddlValue.ofReal(-12.0), eval("-MAX_TIME"));
    assertEquals(Double.POSITIVE_INFINITY, eval("1.0 / 0").asDouble(), 0);
    assertFails("1 / 0", DomainOutOfRangeException.class);
    assertFails("1 / (2 - 2)", DomainOutOfRangeException.class);
  }

  @Test
  public void testIntegerOverflow() throws Exception
  {
    assertEquals(RddlValue.ofInt(Integer.MAX_VALUE), eval("2147483646 + 1"));
    assertEquals(RddlValue.ofInt(Integer.MIN_VALUE), eval("-2147483647 - 1"));
    assertEquals(RddlValue.ofInt(7), eval("-7 / -1"));
    assertEquals(RddlValue.ofReal(2147483648.0), eval("2147483647 + 1.0"));
    assertEquals(RddlValue.ofInt(2147483646), eval("sum_{?p : picture-point} [715827882]"));

    assertFails("2147483647 + 1", DomainOutOfRangeException.class);
    assertFails("-2147483648 - 1", DomainOutOfRangeException.class);
    assertFails("65536 * 65536", DomainOutOfRangeException.class);
    assertFails("-2147483648 / -1", DomainOutOfRangeException.class);
    assertFails("-[-2147483647 - 1]", DomainOutOfRangeException.class);
    assertFails("sum_{?p : picture-point} [1073741824]", DomainOutOfRangeException.class);
    assertFails("prod_{?p : picture-point} [2048]", DomainOutOfRangeException.class);
  }

  @Test
  public void testComparisons() throws Exception
  {
    assertEquals(RddlValue.TRUE, eval("1 == 1.0"));
    assertEquals(RddlValue.TRUE, eval("PICT_XPOS(p1) == PICT_XPOS(p2)"));
    assertEquals(RddlValue.FALSE, eval("PICT_XPOS(p1) ~= PICT_XPOS(p2)"));
    assertEquals(RddlValue.TRUE, eval("p1 ~= p2"));
    assertEquals(RddlValue.TRUE, eval("@left == @left"));
    assertEquals(RddlValue.TRUE, eval("PICT_YPOS(p3) < 0 ^ PICT_YPOS(p3) <= -1 ^ MAX_TIME >= 12"));
    assertEquals(RddlValue.TRUE, eval("(true <=> false) == false"));
  }

  @Test
  public void testTypeMismatches() throws Exception
  {
    assertFails("true + 1", TypeMismatchException.class);
    assertFails("true == 1", TypeMismatchException.class);
    assertFails("p1 < p2", TypeMismatchException.class);
    assertFails("~1", TypeMismatchException.class);
    assertFails("-true", TypeMismatchException.class);
    assertFails("if (1) then 2 else 3", TypeMismatchException.class);
    assertFails("1 ^ true", TypeMismatchException.class);
    assertFails("sum_{?p : picture-point} [true]", TypeMismatchException.class);
    assertFails("exists_{?p : picture-point} [1]", TypeMismatchException.class);
    assertFails("Normal(true, 1.0)", TypeMismatchException.class);
    assertFails("PICT_VALUE", TypeMismatchException.class);
    assertFails("PICT_VALUE(p9)", TypeMismatchException.class);
  }

  @Test
  public void testReferences() throws Exception
  {
    assertEquals(RddlValue.ofReal(7.0), eval("PICT_VALUE(p3)"));
    assertEquals(RddlValue.ofObject("p1"), eval("p1"));
    assertFails("PICT_VALUE(?p)", UnboundVariableException.class);
    assertFails("nothing", UnboundVariableException.class);

    RddlValue lValue = mEvaluator.evaluate(RddlFactory.createExpression("PICT_VALUE(?p) + PICT_XPOS(?p)"),
                                           new Environment(mValues),
                                           VariableBindings.EMPTY.bind("?p", "p2"));
    assertEquals(RddlValue.ofReal(11.0), lValue);

    // Inner bindings shadow outer ones.
    lValue = mEvaluator.evaluate(RddlFactory.createExpression("sum_{?p : picture-point} [PICT_VALUE(?p)]"),
                                 new Environment(mValues),
                                 VariableBindings.EMPTY.bind("?p", "p2"));
    assertEquals(RddlValue.ofReal(22.0), lValue);
  }

  @Test
  public void testDistributions() throws Exception
  {
    assertEquals(RddlValue.ofReal(4.0), eval("Normal(2.0, 4.0)"));
    assertEquals(1, mRandom.mGaussianDraws);

    // Zero variance is deterministic and draws nothing.
    assertEquals(RddlValue.ofReal(2.0), eval("Normal(2, 0.0)"));
    assertEquals(1, mRandom.mGaussianDraws);

    assertEquals(RddlValue.TRUE, eval("Bernoulli(0.3)"));
    assertEquals(RddlValue.FALSE, eval("Bernoulli(0.2)"));
    assertEquals(RddlValue.ofReal(1.5), eval("Uniform(1.0, 3)"));
    assertEquals(RddlValue.ofReal(3.0), eval("DiracDelta(3)"));
    assertEquals(RddlValue.TRUE, eval("KronDelta(true)"));
    assertEquals(RddlValue.ofInt(4), eval("KronDelta(2 + 2)"));
    assertEquals(RddlValue.ofObject("@left"), eval("KronDelta(@left)"));
  }

  @Test
  public void testDistributionParametersOutOfRange() throws Exception
  {
    assertFails("Normal(0.0, -1.0)", DomainOutOfRangeException.class);
    assertFails("Bernoulli(1.5)", DomainOutOfRangeException.class);
    assertFails("Bernoulli(-0.1)", DomainOutOfRangeException.class);
    assertFails("Uniform(3.0, 1.0)", DomainOutOfRangeException.class);
  }

  @Test
  public void testSeededRandomSourceIsReproducible() throws Exception
  {
    SeededRandomSource lFirst = new SeededRandomSource(42);
    SeededRandomSource lSecond = new SeededRandomSource(42);
    for (int lii = 0; lii < 10; lii++)
    {
      assertEquals(lFirst.nextGaussian(), lSecond.nextGaussian(), 0);
      double lUniform = lFirst.nextUniform();
      assertEquals(lUniform, lSecond.nextUniform(), 0);
      assertTrue((lUniform >= 0) && (lUniform < 1));
    }
    assertEquals(42, lFirst.getSeed());
  }
}
