package simboard.simulation;

import org.junit.Test;

import static org.junit.Assert.*;

public class SimulationEnumsTest {

    @Test
    public void statusParsingNeverFails() {
        assertEquals(SimulationStatus.COMPLETED, SimulationStatus.parse("completed"));
        assertEquals(SimulationStatus.FAILED, SimulationStatus.parse(" FAILED "));
        assertEquals(SimulationStatus.CREATED, SimulationStatus.parse(null));
        assertEquals(SimulationStatus.CREATED, SimulationStatus.parse(""));
        assertEquals(SimulationStatus.CREATED, SimulationStatus.parse("on fire"));
        assertEquals("running", SimulationStatus.RUNNING.toString());
    }

    @Test
    public void typeParsingNeverFails() {
        assertEquals(SimulationType.TEST, SimulationType.parse("test"));
        assertEquals(SimulationType.EXPERIMENTAL, SimulationType.parse("Experimental"));
        assertEquals(SimulationType.UNKNOWN, SimulationType.parse(null));
        assertEquals(SimulationType.UNKNOWN, SimulationType.parse("benchmark"));
    }

    @Test
    public void experimentTypeVocabulary() {
        assertTrue(ExperimentType.isKnown("abrupt-4xCO2"));
        assertTrue(ExperimentType.isKnown("esm-piControl"));
        assertFalse(ExperimentType.isKnown("PICONTROL"));
        assertFalse(ExperimentType.isKnown(null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void runConfigDeltasAreOnlyAddedThroughTheirOwnMethod() {
        new SimulationCreate().putExtra(SimulationCreate.RUN_CONFIG_DELTAS, "nope");
    }
}
