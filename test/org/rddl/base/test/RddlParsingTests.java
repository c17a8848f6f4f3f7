package org.rddl.base.test;

import org.junit.Assert;
import org.junit.Test;
import org.rddl.base.util.rddl.factory.RddlFactory;
import org.rddl.base.util.rddl.factory.exceptions.RddlSyntaxException;
import org.rddl.base.util.rddl.factory.exceptions.UnknownBlockException;
import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlBinaryExpression;
import org.rddl.base.util.rddl.grammar.RddlDescription;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlExpression;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.rddl.grammar.RddlValueType;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.rddl.grammar.RddlVariableReference;

public class RddlParsingTests extends Assert
{
  private final TestModelRepository mRepository = new TestModelRepository();

  @Test
  public void testParseMarsRover() throws Exception
  {
    RddlDescription lDescription = RddlFactory.create(mRepository.getSource("mars_rover_pics3"));
    assertEquals(1, lDescription.getDomains().size());
    assertEquals(1, lDescription.getNonFluents().size());
    assertEquals(2, lDescription.getInstances().size());

    RddlDomain lDomain = lDescription.getDomain("simple_mars_rover");
    assertNotNull(lDomain);
    assertEquals(4, lDomain.getRequirements().size());
    assertTrue(lDomain.getRequirements().contains("reward-deterministic"));
    assertEquals(1, lDomain.getTypes().size());
    assertEquals("picture-point", lDomain.getTypes().get(0).getName());
    assertEquals(12, lDomain.getVariables().size());
    assertEquals(3, lDomain.getCpfs().size());
    assertNotNull(lDomain.getReward());
    assertEquals(1, lDomain.getConstraints().size());
    assertTrue(lDomain.getInvariants().isEmpty());

    RddlVariableDefinition lValue = lDomain.getVariables().get(4);
    assertEquals("PICT_VALUE", lValue.getName());
    assertEquals(FluentClass.NON_FLUENT, lValue.getFluentClass());
    assertEquals(RddlValueType.REAL, lValue.getValueType());
    assertEquals(1, lValue.arity());
    assertEquals("picture-point", lValue.getParameterTypes().get(0));
    assertEquals(RddlValue.ofReal(1.0), lValue.getDefaultValue());

    RddlInstance lInstance = lDescription.getInstances().get(0);
    assertEquals("inst_simple_mars_rover_pics3", lInstance.getName());
    assertEquals("simple_mars_rover", lInstance.getDomainName());
    assertEquals("pics3", lInstance.getNonFluentsName());
    assertEquals(RddlInstance.UNLIMITED_ACTIONS, lInstance.getMaxNondefActions());
    assertEquals(40, lInstance.getHorizon());
    assertEquals(1.0, lInstance.getDiscount(), 0);
    assertEquals(3, lInstance.getInitState().size());

    assertEquals(14, lDescription.getNonFluents("pics3").getValues().size());
    assertEquals(RddlValue.ofReal(-1.0), lDescription.getNonFluents("pics3").getValues().get(3).getValue());
  }

  @Test
  public void testParseEnumsAndDerivedFluents() throws Exception
  {
    RddlDescription lDescription = RddlFactory.create(mRepository.getSource("counter_grid"));
    RddlDomain lDomain = lDescription.getDomain("counter_grid");

    assertTrue(lDomain.getTypes().get(1).isEnum());
    assertEquals("@right", lDomain.getTypes().get(1).getEnumValues().get(1));

    RddlVariableDefinition lNumFull = lDomain.getVariables().get(8);
    assertEquals("numFull", lNumFull.getName());
    assertEquals(FluentClass.DERIVED_FLUENT, lNumFull.getFluentClass());
    assertEquals(2, lNumFull.getLevel());
    assertNull(lNumFull.getDefaultValue());

    assertEquals(RddlValue.ofObject("@left"), lDomain.getVariables().get(3).getDefaultValue());
    assertEquals(1, lDescription.getInstances().get(0).getMaxNondefActions());
  }

  @Test
  public void testOperatorPrecedence() throws Exception
  {
    assertEquals("(a + (b * c))", parse("a + b * c"));
    assertEquals("((a - b) - c)", parse("a - b - c"));
    assertEquals("((a / b) * c)", parse("a / b * c"));
    assertEquals("((a ^ b) | (c ^ d))", parse("a ^ b | c & d"));
    assertEquals("(a => (b => c))", parse("a => b => c"));
    assertEquals("((a | b) => c)", parse("a | b => c"));
    assertEquals("(a <=> (b ^ c))", parse("a <=> b ^ c"));
    assertEquals("((x + 1) > (y * 2))", parse("x + 1 > y * 2"));
    assertEquals("(x ~= y)", parse("x != y"));
    assertEquals("(~a ^ b)", parse("~a ^ b"));
    assertEquals("(-x * y)", parse("-x * y"));
    assertEquals("-2.5", parse("-2.5"));
  }

  @Test
  public void testAggregationBindsLikeUnaryOperand() throws Exception
  {
    assertEquals("(sum_{?p : t} [f(?p)] + 1)", parse("sum_{?p : t} f(?p) + 1"));
    assertEquals("sum_{?p : t} [(f(?p) + 1)]", parse("sum_{?p : t} [f(?p) + 1]"));
    assertEquals("exists_{?a : t, ?b : u} [g(?a, ?b)]", parse("exists_{?a : t, ?b : u} [g(?a, ?b)]"));
  }

  @Test
  public void testConditionalElseExtendsAsFarAsPossible() throws Exception
  {
    assertEquals("(if (a) then [b] else [(c + 1)])", parse("if (a) then b else c + 1"));
    assertEquals("((if (a) then [b] else [c]) + 1)", parse("[if (a) then b else c] + 1"));
  }

  @Test
  public void testHyphenatedNames() throws Exception
  {
    RddlExpression lExpression = RddlFactory.createExpression("picture-point");
    assertTrue(lExpression instanceof RddlVariableReference);
    assertEquals("picture-point", ((RddlVariableReference)lExpression).getName());

    // A hyphen followed by anything other than a letter is a minus sign.
    lExpression = RddlFactory.createExpression("x-1");
    assertTrue(lExpression instanceof RddlBinaryExpression);
    assertEquals(RddlBinaryExpression.Operator.MINUS, ((RddlBinaryExpression)lExpression).getOperator());
  }

  @Test
  public void testPrimedReference() throws Exception
  {
    RddlVariableReference lReference = (RddlVariableReference)RddlFactory.createExpression("count'(?c, @left)");
    assertTrue(lReference.isPrimed());
    assertEquals(2, lReference.arity());
    assertFalse(lReference.isGround());
    assertEquals("count'(?c, @left)", lReference.toString());
  }

  @Test
  public void testExpressionsReparse() throws Exception
  {
    String[] lSources = {"if (snapPicture) then DiracDelta(time + 0.25) else DiracDelta(time - -1)",
                         "Normal(xPos + xMove, MOVE_VARIANCE_MULT * [if (xMove >= 0) then xMove else -xMove])",
                         "forall_{?c : cell} [add(?c) => ~full(?c)]",
                         "max_{?p : picture-point} PICT_VALUE(?p) - 1.5e-3",
                         "KronDelta(@left) == heading | Bernoulli(.3)",
                         "-[if (a) then 1 else 2] * 3"};
    for (String lSource : lSources)
    {
      String lWritten = parse(lSource);
      assertEquals(lWritten, parse(lWritten));
    }
  }

  @Test
  public void testMissingSemicolon() throws Exception
  {
    String lSource = "domain d {\n" +
                     "  pvariables {\n" +
                     "    x : { state-fluent, real, default = 0.0 }\n" +
                     "  };\n" +
                     "}\n";
    try
    {
      RddlFactory.create(lSource);
      fail("Parsed source with a missing semicolon");
    }
    catch (RddlSyntaxException lEx)
    {
      assertEquals(4, lEx.getLine());
      assertEquals(3, lEx.getColumn());
      assertEquals("}", lEx.getOffendingName());
      assertTrue(lEx.getMessage().startsWith("line 4: "));
    }
  }

  @Test
  public void testUnknownBlock() throws Exception
  {
    try
    {
      RddlFactory.create("// A comment\n\nworld w { }\n");
      fail("Parsed an unknown block");
    }
    catch (UnknownBlockException lEx)
    {
      assertEquals(3, lEx.getLine());
      assertEquals("world", lEx.getOffendingName());
    }
  }

  @Test
  public void testUnterminatedComment() throws Exception
  {
    try
    {
      RddlFactory.create("domain d {\n  /* never closed\n}\n");
      fail("Parsed an unterminated comment");
    }
    catch (RddlSyntaxException lEx)
    {
      assertEquals(2, lEx.getLine());
    }
  }

  @Test
  public void testUnsupportedFluentClass() throws Exception
  {
    try
    {
      RddlFactory.create("domain d {\n  pvariables {\n    o : { observ-fluent, bool };\n  };\n}\n");
      fail("Parsed an observation fluent");
    }
    catch (RddlSyntaxException lEx)
    {
      assertEquals(3, lEx.getLine());
      assertEquals("observ-fluent", lEx.getOffendingName());
    }
  }

  @Test
  public void testBadInstanceSettings() throws Exception
  {
    assertSyntaxError("instance i { domain = d; horizon = 10; discount = 1.5; }");
    assertSyntaxError("instance i { domain = d; discount = 0.5; }");
    assertSyntaxError("instance i { horizon = 10; }");
    assertSyntaxError("instance i { domain = d; horizon = -1; }");
    assertSyntaxError("instance i { domain = d; horizon = 10; discount = true; }");
    assertSyntaxError("instance i { domain = d; horizon = 10; discount = @high; }");
    assertSyntaxError("instance i { domain = d; horizon = 10; discount = p1; }");
  }

  @Test
  public void testIntegerLimits() throws Exception
  {
    assertEquals("-2147483648", parse("-2147483648"));
    assertEquals("2147483647", parse("2147483647"));
    assertEquals("(x - -2147483648)", parse("x - -2147483648"));
    assertExpressionError("2147483648");
    assertExpressionError("-2147483649");
    assertExpressionError("--2147483648");

    RddlDescription lDescription = RddlFactory.create(
      "domain d { pvariables { x : { state-fluent, int, default = -2147483648 }; }; }");
    assertEquals(RddlValue.ofInt(Integer.MIN_VALUE),
                 lDescription.getDomains().get(0).getVariables().get(0).getDefaultValue());
  }

  @Test
  public void testMalformedExpressions() throws Exception
  {
    assertExpressionError("3abc");
    assertExpressionError("Normal(1.0)");
    assertExpressionError("Bernoulli(0.1, 0.2)");
    assertExpressionError("a b");
    assertExpressionError("(a + b");
    assertExpressionError("if (a) then b");
    assertExpressionError("sum_{p : t} [1]");
    assertExpressionError("f(1)");
    assertExpressionError("a # b");
  }

  private static String parse(String xiSource) throws RddlSyntaxException
  {
    return RddlFactory.createExpression(xiSource).toString();
  }

  private static void assertSyntaxError(String xiSource)
  {
    try
    {
      RddlFactory.create(xiSource);
      fail("Parsed malformed source: " + xiSource);
    }
    catch (RddlSyntaxException lEx)
    {
      assertTrue(lEx.getLine() > 0);
    }
  }

  private static void assertExpressionError(String xiSource)
  {
    try
    {
      RddlFactory.createExpression(xiSource);
      fail("Parsed malformed expression: " + xiSource);
    }
    catch (RddlSyntaxException lEx)
    {
      assertTrue(lEx.getLine() > 0);
    }
  }
}
