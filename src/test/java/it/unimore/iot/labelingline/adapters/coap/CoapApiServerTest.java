package it.unimore.iot.labelingline.adapters.coap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimore.iot.labelingline.domain.LineController;
import it.unimore.iot.labelingline.domain.StateRepository;
import it.unimore.iot.labelingline.model.LineCommand;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.model.SystemParameters;
import org.eclipse.californium.core.CoapClient;
import org.eclipse.californium.core.CoapResponse;
import org.eclipse.californium.core.coap.CoAP;
import org.eclipse.californium.core.coap.MediaTypeRegistry;
import org.eclipse.californium.core.network.CoapEndpoint;
import org.eclipse.californium.elements.config.Configuration;
import org.eclipse.californium.elements.exception.ConnectorException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CoapApiServerTest {

    private static final int PORT = 5699;

    private static StateRepository repository;
    private static CoapApiServer server;
    private static final AtomicBoolean stopped = new AtomicBoolean();
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeAll
    static void startServer() {
        repository = new StateRepository("line-coap", SystemParameters.builder().seed(1).build());
        repository.registerController(new LineController() {
            @Override
            public void stop() {
                stopped.set(true);
            }

            @Override
            public boolean injectFailure(int robotId) {
                return robotId == 0;
            }

            @Override
            public boolean isRunning() {
                return true;
            }
        });
        repository.publishRobotStatus(new RobotStatus(0, 1_000L, RobotState.ACTIVE, 3, false, null, 37.5, false));
        repository.publishStats(new StatsDelta(1, 10, 9, 1, 0, 0, 0, 1_000L));
        server = new CoapApiServer(repository, PORT);
        server.start();
    }

    @AfterAll
    static void stopServer() {
        server.stop();
    }

    // Client con endpoint dedicato e configurazione senza file
    private static CoapClient client(String path) {
        CoapClient client = new CoapClient("coap://localhost:" + PORT + path);
        client.setEndpoint(new CoapEndpoint.Builder()
                .setConfiguration(Configuration.createStandardWithoutFile())
                .build());
        client.setTimeout(3000L);
        return client;
    }

    private static CoapResponse get(String path, int accept) {
        CoapClient client = client(path);
        try {
            CoapResponse response = accept < 0 ? client.get() : client.get(accept);
            Assumptions.assumeTrue(response != null, "CoAP server non raggiungibile su " + path);
            return response;
        } catch (ConnectorException | IOException e) {
            Assumptions.abort("CoAP non disponibile: " + e.getMessage());
            return null;
        } finally {
            client.shutdown();
        }
    }

    @Test
    void line_returnsSummary() throws Exception {
        CoapResponse response = get("/line", -1);

        assertEquals(CoAP.ResponseCode.CONTENT, response.getCode());
        JsonNode json = mapper.readTree(response.getResponseText());
        assertEquals("line-coap", json.get("lineId").asText());
        assertTrue(json.get("running").asBoolean());
    }

    @Test
    void robotState_supportsContentNegotiation() throws Exception {
        CoapResponse text = get("/line/robots/0/state", MediaTypeRegistry.TEXT_PLAIN);
        assertEquals("ACTIVE", text.getResponseText());

        CoapResponse senml = get("/line/robots/0/state", MediaTypeRegistry.APPLICATION_SENML_JSON);
        JsonNode pack = mapper.readTree(senml.getResponseText());
        assertEquals("line-coap/robots/0/", pack.get(0).get("bn").asText());

        CoapResponse missing = get("/line/robots/9/state", -1);
        assertEquals(CoAP.ResponseCode.NOT_FOUND, missing.getCode());
    }

    @Test
    void stats_returnsCountersAndEfficiency() throws Exception {
        CoapResponse response = get("/line/stats", MediaTypeRegistry.APPLICATION_JSON);

        JsonNode json = mapper.readTree(response.getResponseText());
        assertEquals(10, json.get("totalItems").asInt());
        assertEquals(90.0, json.get("efficiency").asDouble(), 1e-9);
    }

    @Test
    void cmd_postReturnsAck() throws Exception {
        CoapClient client = client("/line/cmd");
        try {
            String payload = mapper.writeValueAsString(new LineCommand(LineCommand.FAIL, 0, 0L, "m-7"));
            CoapResponse accepted = client.post(payload, MediaTypeRegistry.APPLICATION_JSON);
            Assumptions.assumeTrue(accepted != null, "CoAP server non raggiungibile");
            assertEquals(CoAP.ResponseCode.CHANGED, accepted.getCode());
            assertEquals("ACCEPTED", mapper.readTree(accepted.getResponseText()).get("status").asText());
            assertEquals("m-7", mapper.readTree(accepted.getResponseText()).get("msgId").asText());

            CoapResponse rejected = client.post("{\"type\":\"FAIL\",\"robotId\":3}", MediaTypeRegistry.APPLICATION_JSON);
            assertEquals(CoAP.ResponseCode.BAD_REQUEST, rejected.getCode());

            CoapResponse missingType = client.post("{\"robotId\":3}", MediaTypeRegistry.APPLICATION_JSON);
            assertEquals(CoAP.ResponseCode.BAD_REQUEST, missingType.getCode());
        } catch (ConnectorException | IOException e) {
            Assumptions.abort("CoAP non disponibile: " + e.getMessage());
        } finally {
            client.shutdown();
        }
    }
}
