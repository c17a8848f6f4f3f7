package org.rddl.base.test;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({RddlParsingTests.class,
                     RddlWriterTests.class,
                     SymbolTableTests.class,
                     ModelCheckerTests.class,
                     GroundingTests.class,
                     EvaluatorTests.class,
                     RddlStateMachineTests.class,
                     KnownModelTest.class,
                     NoTabsInModelsTest.class,
                     SampledStatisticTests.class,
                     SimulatorConfigurationTests.class})
public class FastTests
{

}
