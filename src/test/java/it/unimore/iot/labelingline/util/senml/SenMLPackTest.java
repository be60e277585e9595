package it.unimore.iot.labelingline.util.senml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.SimulationStats;
import it.unimore.iot.labelingline.model.StatsDelta;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SenMLPackTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void robotStatus_isSerializedAsSenMLArray() throws Exception {
        RobotStatus status = new RobotStatus(2, 5_000L, RobotState.LABELING, 7, false, null, 187.5, false);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(SenMLPack.fromRobotStatus("line-01/robots/2/", status)));

        assertTrue(json.isArray());
        assertEquals("line-01/robots/2/", json.get(0).get("bn").asText());
        assertEquals(5, json.get(0).get("t").asLong());
        assertEquals("LABELING", json.get(0).get("vs").asText());
        assertEquals(7, json.get(1).get("v").asInt());
        assertFalse(json.get(1).has("bn"));
        assertEquals(187.5, json.get(3).get("v").asDouble());
    }

    @Test
    void stats_includeEfficiency() throws Exception {
        SimulationStats stats = new SimulationStats();
        stats.apply(new StatsDelta(2, 20, 15, 5, 0, 0, 0, 0L));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(SenMLPack.fromStats("line-01/stats/", stats, 1_000L)));

        assertEquals(7, json.size());
        assertEquals("efficiency", json.get(6).get("n").asText());
        assertEquals(75.0, json.get(6).get("v").asDouble(), 1e-9);
    }
}
