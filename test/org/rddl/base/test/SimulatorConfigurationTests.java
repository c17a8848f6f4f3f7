package org.rddl.base.test;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.rddl.base.util.configuration.SimulatorConfiguration;
import org.rddl.base.util.configuration.SimulatorConfiguration.CfgItem;

public class SimulatorConfigurationTests extends Assert
{
  @After
  public void tearDown()
  {
    SimulatorConfiguration.utResetCfgVal(CfgItem.TRACE_TRANSITIONS);
    SimulatorConfiguration.utResetCfgVal(CfgItem.DEFAULT_RANDOM_SEED);
  }

  @Test
  public void testDefaults()
  {
    assertEquals(20141122L, SimulatorConfiguration.getCfgLong(CfgItem.DEFAULT_RANDOM_SEED));
    assertTrue(SimulatorConfiguration.getCfgBool(CfgItem.ENFORCE_MAX_NONDEF_ACTIONS));
    assertTrue(SimulatorConfiguration.getCfgBool(CfgItem.CHECK_STATE_INVARIANTS));
    assertFalse(SimulatorConfiguration.getCfgBool(CfgItem.TRACE_TRANSITIONS));
    SimulatorConfiguration.logConfig();
  }

  @Test
  public void testOverrideAndReset()
  {
    SimulatorConfiguration.utOverrideCfgVal(CfgItem.TRACE_TRANSITIONS, true);
    SimulatorConfiguration.utOverrideCfgVal(CfgItem.DEFAULT_RANDOM_SEED, 7);
    assertTrue(SimulatorConfiguration.getCfgBool(CfgItem.TRACE_TRANSITIONS));
    assertEquals("7", SimulatorConfiguration.getCfgStr(CfgItem.DEFAULT_RANDOM_SEED));

    SimulatorConfiguration.utResetCfgVal(CfgItem.TRACE_TRANSITIONS);
    SimulatorConfiguration.utResetCfgVal(CfgItem.DEFAULT_RANDOM_SEED);
    assertFalse(SimulatorConfiguration.getCfgBool(CfgItem.TRACE_TRANSITIONS));
    assertEquals(20141122L, SimulatorConfiguration.getCfgLong(CfgItem.DEFAULT_RANDOM_SEED));
  }
}
