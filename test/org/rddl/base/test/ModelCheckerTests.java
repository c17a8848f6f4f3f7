package org.rddl.base.test;

import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.junit.Assert;
import org.junit.Test;
import org.rddl.base.util.rddl.factory.Problem;
import org.rddl.base.util.rddl.factory.RddlLoader;
import org.rddl.base.util.statemachine.exceptions.DuplicateDeclarationException;
import org.rddl.base.util.statemachine.exceptions.ModelDefinitionException;
import org.rddl.base.util.statemachine.exceptions.ModelValidationException;
import org.rddl.base.util.statemachine.exceptions.RddlException;
import org.rddl.base.util.statemachine.exceptions.TypeMismatchException;
import org.rddl.base.util.statemachine.exceptions.UnknownTypeException;
import org.rddl.base.util.statemachine.exceptions.UnknownVariableException;
import org.rddl.base.util.symbol.SymbolTable;

/**
 * Load-time validation.  Each test breaks a small valid model in one or more ways.
 */
public class ModelCheckerTests extends Assert
{
  private static final String BASE =
    "domain d {\n" +
    "  types { thing : object; colour : {@red, @blue}; };\n" +
    "  pvariables {\n" +
    "    K : { non-fluent, int, default = 2 };\n" +
    "    on(thing) : { state-fluent, bool, default = false };\n" +
    "    paint : { state-fluent, colour, default = @red };\n" +
    "    flip(thing) : { action-fluent, bool, default = false };\n" +
    "    $VARS\n" +
    "  };\n" +
    "  cpfs {\n" +
    "    $ON_CPF\n" +
    "    paint' = paint;\n" +
    "    $CPFS\n" +
    "  };\n" +
    "  reward = $REWARD;\n" +
    "  $SECTIONS\n" +
    "}\n" +
    "non-fluents nf {\n" +
    "  domain = d;\n" +
    "  objects { thing : {t1, t2}; $OBJECTS };\n" +
    "  non-fluents { $NON_FLUENTS };\n" +
    "}\n" +
    "instance i {\n" +
    "  domain = d;\n" +
    "  non-fluents = nf;\n" +
    "  init-state { $INIT };\n" +
    "  horizon = 3;\n" +
    "}\n";

  /**
   * Builds variants of the base model.
   */
  private static class Model
  {
    private final Map<String, String> mParts = new HashMap<>();

    Model()
    {
      mParts.put("$VARS", "");
      mParts.put("$ON_CPF", "on'(?t) = if (flip(?t)) then ~on(?t) else on(?t);");
      mParts.put("$CPFS", "");
      mParts.put("$REWARD", "sum_{?t : thing} [if (on(?t)) then 1 else 0]");
      mParts.put("$SECTIONS", "");
      mParts.put("$OBJECTS", "");
      mParts.put("$NON_FLUENTS", "");
      mParts.put("$INIT", "");
    }

    Model with(String xiPart, String xiText)
    {
      assertTrue(xiPart, mParts.containsKey(xiPart));
      mParts.put(xiPart, xiText);
      return this;
    }

    String build()
    {
      String lSource = BASE;
      for (Entry<String, String> lPart : mParts.entrySet())
      {
        lSource = lSource.replace(lPart.getKey(), lPart.getValue());
      }
      return lSource;
    }
  }

  @Test
  public void testValidModel() throws Exception
  {
    Problem lProblem = RddlLoader.load(new Model().with("$NON_FLUENTS", "K = 3;")
                                                  .with("$INIT", "on(t2); paint = @blue;")
                                                  .build());
    SymbolTable lSymbols = lProblem.getSymbolTable();
    assertEquals(2, lSymbols.getObjects("thing").size());
    assertEquals(1, lSymbols.getObjectIndex("thing", "t2"));
    assertEquals("colour", lSymbols.getTypeOfObject("@blue"));
    assertTrue(lSymbols.isVariable("flip"));
    assertEquals("i", lProblem.getInstance().getName());
    assertEquals("nf", lProblem.getNonFluents().getName());
  }

  @Test
  public void testAllProblemsReported() throws Exception
  {
    ModelValidationException lEx = expectInvalid(new Model().with("$VARS",
                                                                  "W(widget) : { non-fluent, real, default = 0.0 }; " +
                                                                  "s : { state-fluent, int };")
                                                            .with("$CPFS", "s' = s + 1; K = 3;")
                                                            .build());
    assertEquals(3, lEx.getProblems().size());
    assertTrue(lEx.hasProblem(UnknownTypeException.class));
    assertTrue(lEx.hasProblem(ModelDefinitionException.class));
    assertFalse(lEx.hasProblem(TypeMismatchException.class));
    assertTrue(lEx.getMessage().startsWith("3 problem(s) in i"));

    RddlException lUnknownType = lEx.getProblems().get(0);
    assertEquals(8, lUnknownType.getLine());
    assertEquals("widget", lUnknownType.getOffendingName());
  }

  @Test
  public void testDuplicateDeclarations() throws Exception
  {
    assertProblem(new Model().with("$VARS", "K : { non-fluent, real, default = 1.0 };"),
                  DuplicateDeclarationException.class);
    assertProblem(new Model().with("$CPFS", "paint' = @blue;"), DuplicateDeclarationException.class);
    assertProblem(new Model().with("$OBJECTS", "thing : {t1};"), DuplicateDeclarationException.class);
    assertProblem(new Model().with("$INIT", "on(t1) = true; on(t1) = false;"), DuplicateDeclarationException.class);
  }

  @Test
  public void testBadCpfs() throws Exception
  {
    // No CPF for a state fluent.
    assertProblem(new Model().with("$ON_CPF", ""), ModelDefinitionException.class);

    // Unprimed head for a state fluent.
    assertProblem(new Model().with("$ON_CPF", "on(?t) = on(?t);"), ModelDefinitionException.class);

    // Primed reference in a body.
    assertProblem(new Model().with("$ON_CPF", "on'(?t) = on'(?t);"), ModelDefinitionException.class);

    // Wrong number of parameters.
    assertProblem(new Model().with("$ON_CPF", "on' = true;"), ModelDefinitionException.class);

    // Repeated parameter.
    assertProblem(new Model().with("$VARS", "adj(thing, thing) : { state-fluent, bool, default = false };")
                             .with("$CPFS", "adj'(?a, ?a) = false;"),
                  ModelDefinitionException.class);

    // Unbound parameter in the body.
    assertProblem(new Model().with("$ON_CPF", "on'(?t) = on(?u);"), ModelDefinitionException.class);

    // CPF for an action.
    assertProblem(new Model().with("$CPFS", "flip(?t) = true;"), ModelDefinitionException.class);

    // Undeclared variable.
    assertProblem(new Model().with("$ON_CPF", "on'(?t) = lit(?t);"), UnknownVariableException.class);
  }

  @Test
  public void testTypeErrors() throws Exception
  {
    assertProblem(new Model().with("$REWARD", "on(t1)"), TypeMismatchException.class);
    assertProblem(new Model().with("$CPFS", "").with("$ON_CPF", "on'(?t) = K + 1;"), TypeMismatchException.class);
    assertProblem(new Model().with("$ON_CPF", "on'(?t) = if (flip(?t)) then 1 else false;"),
                  TypeMismatchException.class);
    assertProblem(new Model().with("$ON_CPF", "on'(?t) = on(?t) + 1 > 0;"), TypeMismatchException.class);
    assertProblem(new Model().with("$REWARD", "sum_{?c : colour} [if (on(?c)) then 1 else 0]"),
                  TypeMismatchException.class);
    assertProblem(new Model().with("$VARS", "n : { state-fluent, int, default = 0 };")
                             .with("$CPFS", "n' = KronDelta(1.5);"),
                  TypeMismatchException.class);
    assertProblem(new Model().with("$VARS", "p : { state-fluent, colour, default = @green };")
                             .with("$CPFS", "p' = p;"),
                  TypeMismatchException.class);
    assertProblem(new Model().with("$SECTIONS", "state-action-constraints { K; };"), TypeMismatchException.class);
  }

  @Test
  public void testIntegerDivisionIsWellTyped() throws Exception
  {
    RddlLoader.load(new Model().with("$VARS", "n : { state-fluent, int, default = 7 };")
                               .with("$CPFS", "n' = n / K;")
                               .build());
  }

  @Test
  public void testDerivedFluentOrdering() throws Exception
  {
    String lVariables = "a : { derived-fluent, bool, level = 1 }; b : { derived-fluent, bool, level = LEVEL };";
    String lCpfs = "a = b; b = exists_{?t : thing} [on(?t)];";

    // b at a lower level than a is fine.
    RddlLoader.load(new Model().with("$VARS", lVariables.replace("LEVEL", "0")).with("$CPFS", lCpfs).build());

    // Same level, declared later.
    assertProblem(new Model().with("$VARS", lVariables.replace("LEVEL", "1")).with("$CPFS", lCpfs),
                  ModelDefinitionException.class);

    // Self-reference.
    assertProblem(new Model().with("$VARS", "a : { derived-fluent, bool, level = 1 };").with("$CPFS", "a = ~a;"),
                  ModelDefinitionException.class);

    // Derived fluents have no default but must have a CPF.
    assertProblem(new Model().with("$VARS", "a : { derived-fluent, bool };"), ModelDefinitionException.class);
  }

  @Test
  public void testConditions() throws Exception
  {
    RddlLoader.load(new Model().with("$SECTIONS",
                                     "action-preconditions { forall_{?t : thing} [flip(?t) => ~on(?t)]; }; " +
                                     "state-invariants { paint ~= @blue | exists_{?t : thing} [on(?t)]; };")
                               .build());

    // Invariants are about the state alone.
    assertProblem(new Model().with("$SECTIONS", "state-invariants { ~flip(t1); };"), ModelDefinitionException.class);
  }

  @Test
  public void testBadAssignments() throws Exception
  {
    assertProblem(new Model().with("$INIT", "K = 4;"), ModelDefinitionException.class);
    assertProblem(new Model().with("$NON_FLUENTS", "on(t1) = true;"), ModelDefinitionException.class);
    assertProblem(new Model().with("$INIT", "on(t9) = true;"), UnknownVariableException.class);
    assertProblem(new Model().with("$INIT", "on = true;"), ModelDefinitionException.class);
    assertProblem(new Model().with("$INIT", "nothing = true;"), UnknownVariableException.class);
    assertProblem(new Model().with("$NON_FLUENTS", "K = true;"), TypeMismatchException.class);
    assertProblem(new Model().with("$NON_FLUENTS", "K = 2.5;"), TypeMismatchException.class);
    assertProblem(new Model().with("$INIT", "paint = @green;"), TypeMismatchException.class);
  }

  @Test
  public void testObjectsOfEnumeratedType() throws Exception
  {
    assertProblem(new Model().with("$OBJECTS", "colour : {green};"), ModelDefinitionException.class);
    assertProblem(new Model().with("$OBJECTS", "shape : {circle};"), UnknownTypeException.class);
  }

  @Test
  public void testUnresolvedBlocks() throws Exception
  {
    String lSource = new Model().build();
    assertProblem(lSource.replace("non-fluents = nf;", "non-fluents = other;"), ModelDefinitionException.class);
    assertProblem(lSource.replace("instance i {\n  domain = d;", "instance i {\n  domain = e;"),
                  ModelDefinitionException.class);

    try
    {
      RddlLoader.load(lSource, "no_such_instance");
      fail("Loaded a missing instance");
    }
    catch (ModelValidationException lEx)
    {
      assertEquals("no_such_instance", lEx.getProblems().get(0).getOffendingName());
    }
  }

  @Test
  public void testMissingReward() throws Exception
  {
    String lSource = new Model().build().replace("reward = sum_{?t : thing} [if (on(?t)) then 1 else 0];", "");
    assertProblem(lSource, ModelDefinitionException.class);
  }

  private static void assertProblem(Model xiModel, Class<? extends RddlException> xiExpected) throws Exception
  {
    assertProblem(xiModel.build(), xiExpected);
  }

  private static void assertProblem(String xiSource, Class<? extends RddlException> xiExpected) throws Exception
  {
    ModelValidationException lEx = expectInvalid(xiSource);
    assertTrue("Expected " + xiExpected.getSimpleName() + " but got " + lEx.getMessage(), lEx.hasProblem(xiExpected));
  }

  private static ModelValidationException expectInvalid(String xiSource) throws Exception
  {
    try
    {
      RddlLoader.load(xiSource);
    }
    catch (ModelValidationException lEx)
    {
      return lEx;
    }
    fail("Model should have been rejected:\n" + xiSource);
    return null;
  }
}
