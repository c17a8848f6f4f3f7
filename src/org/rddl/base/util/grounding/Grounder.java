package org.rddl.base.util.grounding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rddl.base.util.evaluation.VariableBindings;
import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlAssignment;
import org.rddl.base.util.rddl.grammar.RddlCpf;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlNonFluents;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.rddl.grammar.RddlVariableReference;
import org.rddl.base.util.symbol.SymbolTable;

/**
 * Instantiates a validated model over its objects.
 *
 * Grounding is deterministic: the same input always produces the same variable indices and the same CPF order.
 */
public final class Grounder
{
  private static final Logger LOGGER = LogManager.getLogger();

  private Grounder()
  {
    // Static methods only.
  }

  /**
   * Ground a model that has passed {@link org.rddl.base.util.symbol.ModelChecker#check}.
   *
   * @param xiSymbols    - the symbol table produced by the checker.
   * @param xiDomain     - the domain.
   * @param xiNonFluents - the non-fluents block (may be null).
   * @param xiInstance   - the instance.
   *
   * @return the grounded model.
   */
  public static GroundedModel ground(SymbolTable xiSymbols,
                                     RddlDomain xiDomain,
                                     RddlNonFluents xiNonFluents,
                                     RddlInstance xiInstance)
  {
    GroundedVariableTable lTable = new GroundedVariableTable(xiSymbols);

    // Defaults first, then explicit values on top.
    RddlValue[] lValues = new RddlValue[lTable.size()];
    for (GroundedVariable lVariable : lTable.getVariables())
    {
      RddlVariableDefinition lDefinition = lVariable.getDefinition();
      if (lDefinition.getDefaultValue() != null)
      {
        lValues[lVariable.getIndex()] = lDefinition.getDefaultValue().coerceTo(lDefinition.getValueType());
      }
    }
    if (xiNonFluents != null)
    {
      applyAssignments(lTable, xiSymbols, xiNonFluents.getValues(), lValues);
    }
    applyAssignments(lTable, xiSymbols, xiInstance.getInitState(), lValues);

    Map<String, RddlCpf> lCpfs = new HashMap<>();
    for (RddlCpf lCpf : xiDomain.getCpfs())
    {
      lCpfs.put(lCpf.getHead().getName(), lCpf);
    }

    List<GroundedExpression> lDerived = new ArrayList<>();
    for (RddlVariableDefinition lDefinition : xiSymbols.getDerivedOrder())
    {
      groundCpf(lTable, lDefinition, lCpfs.get(lDefinition.getName()), lDerived);
    }

    List<GroundedExpression> lState = new ArrayList<>();
    for (RddlVariableDefinition lDefinition : xiSymbols.getVariables(FluentClass.STATE_FLUENT))
    {
      groundCpf(lTable, lDefinition, lCpfs.get(lDefinition.getName()), lState);
    }

    LOGGER.debug("Grounded " + xiInstance.getName() + ": " + lTable.size() + " variable(s), " + lDerived.size() +
                 " derived and " + lState.size() + " state CPF(s), " + xiDomain.getConstraints().size() +
                 " constraint(s)");

    return new GroundedModel(xiSymbols,
                             lTable,
                             lValues,
                             lDerived,
                             lState,
                             xiDomain.getReward(),
                             xiDomain.getConstraints(),
                             xiDomain.getInvariants(),
                             xiInstance);
  }

  private static void applyAssignments(GroundedVariableTable xiTable,
                                       SymbolTable xiSymbols,
                                       List<RddlAssignment> xiAssignments,
                                       RddlValue[] xoValues)
  {
    for (RddlAssignment lAssignment : xiAssignments)
    {
      RddlVariableReference lTarget = lAssignment.getTarget();
      RddlVariableDefinition lDefinition = xiSymbols.getVariable(lTarget.getName());
      int lIndex = xiTable.indexOf(lDefinition, lTarget.getArguments());
      xoValues[lIndex] = lAssignment.getValue().coerceTo(lDefinition.getValueType());
      LOGGER.trace("  " + xiTable.get(lIndex) + " := " + xoValues[lIndex]);
    }
  }

  private static void groundCpf(GroundedVariableTable xiTable,
                                RddlVariableDefinition xiDefinition,
                                RddlCpf xiCpf,
                                List<GroundedExpression> xoGrounded)
  {
    List<String> lParameters = xiCpf.getHead().getArguments();
    for (GroundedVariable lTarget : xiTable.getGroundings(xiDefinition))
    {
      VariableBindings lBindings = VariableBindings.EMPTY;
      for (int lii = 0; lii < lParameters.size(); lii++)
      {
        lBindings = lBindings.bind(lParameters.get(lii), lTarget.getArguments().get(lii));
      }
      xoGrounded.add(new GroundedExpression(xiCpf.getBody(), lBindings, lTarget));
    }
  }
}
