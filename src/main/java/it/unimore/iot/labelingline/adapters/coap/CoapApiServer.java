package it.unimore.iot.labelingline.adapters.coap;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimore.iot.labelingline.domain.StateRepository;
import it.unimore.iot.labelingline.model.CommandAck;
import it.unimore.iot.labelingline.model.LineCommand;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.util.senml.SenMLPack;
import org.eclipse.californium.core.CoapResource;
import org.eclipse.californium.core.CoapServer;
import org.eclipse.californium.core.coap.CoAP;
import org.eclipse.californium.core.coap.MediaTypeRegistry;
import org.eclipse.californium.core.server.resources.CoapExchange;
import org.eclipse.californium.core.server.resources.Resource;
import org.eclipse.californium.elements.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Server CoAP di monitoraggio e controllo della linea di etichettatura.
 * Le risorse sono annidate sotto {@code /line}:
 * {@code /line/stats}, {@code /line/robots/{id}/state} e {@code /line/cmd}.
 */
public class CoapApiServer {

    private static final Logger log = LoggerFactory.getLogger(CoapApiServer.class);
    private static final List<String> SUPPORTED_COMMANDS = List.of(LineCommand.STOP, LineCommand.FAIL);
    private final CoapServer server;

    /**
     * Inizializza il server sulla porta CoAP di default (5683).
     *
     * @param repo Il repository dello stato della linea.
     */
    public CoapApiServer(StateRepository repo) {
        this(repo, 5683);
    }

    /**
     * Inizializza il server sulla porta specificata.
     *
     * @param repo Il repository dello stato della linea.
     * @param port La porta di ascolto per il server CoAP.
     */
    public CoapApiServer(StateRepository repo, int port) {
        Configuration cfg = Configuration.createStandardWithoutFile();
        this.server = new CoapServer(cfg, port);
        server.add(new LineResource(repo));
        log.info("Risorse CoAP registrate per la linea {}", repo.getLineId());
    }

    /**
     * Avvia il server CoAP e si mette in ascolto sulla porta configurata.
     */
    public void start() {
        try {
            log.info("Avvio del server CoAP...");
            server.start();
            server.getEndpoints().forEach(ep ->
                    log.info("Server CoAP in ascolto su {}:{}", ep.getAddress().getHostString(), ep.getAddress().getPort())
            );
        } catch (Exception e) {
            log.error("ERRORE CRITICO: Impossibile avviare il server CoAP", e);
            throw new IllegalStateException("Impossibile avviare il server CoAP", e);
        }
    }

    /**
     * Ferma il server CoAP e rilascia le risorse.
     */
    public void stop() {
        log.info("Arresto del server CoAP...");
        server.stop();
        server.destroy();
        log.info("Server CoAP arrestato.");
    }

    /**
     * Risorsa radice della linea, endpoint {@code /line}.
     * GET: riepilogo con identificativo, stato di esecuzione e parametri.
     */
    static class LineResource extends CoapResource {
        private final StateRepository repo;

        LineResource(StateRepository repo) {
            super("line");
            this.repo = repo;
            getAttributes().setTitle("Labeling Line " + repo.getLineId());
            getAttributes().addResourceType("it.unimore.line");
            getAttributes().addInterfaceDescription("core.ll");
            getAttributes().addContentType(MediaTypeRegistry.APPLICATION_JSON);

            add(new StatsResource("stats", repo));
            add(new RobotsResource("robots", repo));
            add(new CommandResource("cmd", repo));
        }

        @Override
        public void handleGET(CoapExchange exchange) {
            exchange.respond(CoAP.ResponseCode.CONTENT, repo.getLineSummaryJson(), MediaTypeRegistry.APPLICATION_JSON);
        }
    }

    /**
     * Contatori aggregati, endpoint {@code /line/stats}.
     * GET: JSON o SenML+JSON. OBSERVABLE: notifica a ogni incremento dei contatori.
     */
    static class StatsResource extends CoapResource {
        private final StateRepository repo;
        private final ObjectMapper mapper = new ObjectMapper();

        StatsResource(String name, StateRepository repo) {
            super(name);
            this.repo = repo;
            setObservable(true);
            setObserveType(CoAP.Type.CON);
            getAttributes().setObservable();
            getAttributes().setTitle("Line statistics");
            getAttributes().addResourceType("it.unimore.line.stats");
            getAttributes().addInterfaceDescription("core.s");
            getAttributes().addContentType(MediaTypeRegistry.APPLICATION_JSON);
            getAttributes().addContentType(MediaTypeRegistry.APPLICATION_SENML_JSON);

            repo.addStatsListener(stats -> changed());
        }

        @Override
        public void handleGET(CoapExchange exchange) {
            int accept = exchange.getRequestOptions().getAccept();
            try {
                if (accept == -1 || accept == MediaTypeRegistry.APPLICATION_JSON) {
                    exchange.respond(CoAP.ResponseCode.CONTENT, mapper.writeValueAsString(repo.getStats()),
                            MediaTypeRegistry.APPLICATION_JSON);
                } else if (accept == MediaTypeRegistry.APPLICATION_SENML_JSON) {
                    SenMLPack pack = SenMLPack.fromStats(repo.getLineId() + "/stats/", repo.getStats(),
                            System.currentTimeMillis());
                    exchange.respond(CoAP.ResponseCode.CONTENT, mapper.writeValueAsString(pack),
                            MediaTypeRegistry.APPLICATION_SENML_JSON);
                } else {
                    exchange.respond(CoAP.ResponseCode.NOT_ACCEPTABLE);
                }
            } catch (Exception e) {
                log.error("Errore durante la serializzazione delle statistiche", e);
                exchange.respond(CoAP.ResponseCode.INTERNAL_SERVER_ERROR);
            }
        }
    }

    /**
     * Elenco dei robot, endpoint {@code /line/robots}.
     * FIGLI DINAMICI: {@code {robotId}} viene creato alla prima richiesta e poi mantenuto,
     * così le relazioni di observe restano valide.
     */
    static class RobotsResource extends CoapResource {
        private final StateRepository repo;

        RobotsResource(String name, StateRepository repo) {
            super(name);
            this.repo = repo;
            getAttributes().setTitle("Robot List");
            getAttributes().addResourceType("it.unimore.line.robots");
            getAttributes().addInterfaceDescription("core.ll");
            getAttributes().addContentType(MediaTypeRegistry.APPLICATION_JSON);
        }

        @Override
        public void handleGET(CoapExchange exchange) {
            exchange.respond(CoAP.ResponseCode.CONTENT, repo.listRobotsJson(), MediaTypeRegistry.APPLICATION_JSON);
        }

        @Override
        public synchronized Resource getChild(String name) {
            Resource existing = super.getChild(name);
            if (existing != null) {
                return existing;
            }
            int robotId;
            try {
                robotId = Integer.parseInt(name);
            } catch (NumberFormatException e) {
                log.debug("Identificativo robot non valido: {}", name);
                return null;
            }
            if (repo.getRobotStatus(robotId).isEmpty()) {
                return null;
            }
            RobotResource robot = new RobotResource(name, robotId, repo);
            add(robot);
            return robot;
        }
    }

    /**
     * Singolo robot, endpoint {@code /line/robots/{robotId}}: contenitore della risorsa {@code state}.
     */
    static class RobotResource extends CoapResource {
        RobotResource(String name, int robotId, StateRepository repo) {
            super(name);
            getAttributes().setTitle("Robot " + robotId);
            getAttributes().addResourceType("it.unimore.line.robot");
            getAttributes().addInterfaceDescription("core.ll");
            add(new RobotStateResource("state", robotId, repo));
        }
    }

    /**
     * Stato real-time di un robot, endpoint {@code .../{robotId}/state}.
     * GET: content negotiation fra JSON, SenML+JSON e testo. OBSERVABLE.
     */
    static class RobotStateResource extends CoapResource {
        private final StateRepository repo;
        private final int robotId;
        private final ObjectMapper mapper = new ObjectMapper();

        RobotStateResource(String name, int robotId, StateRepository repo) {
            super(name);
            this.repo = repo;
            this.robotId = robotId;

            setObservable(true);
            setObserveType(CoAP.Type.CON);
            getAttributes().setObservable();
            getAttributes().addContentType(MediaTypeRegistry.APPLICATION_SENML_JSON);
            getAttributes().addContentType(MediaTypeRegistry.TEXT_PLAIN);
            getAttributes().addContentType(MediaTypeRegistry.APPLICATION_JSON);
            getAttributes().addResourceType("it.unimore.line.robot.state");
            getAttributes().addInterfaceDescription("core.a");
            getAttributes().setTitle("State of robot " + robotId);

            repo.addRobotListener(robotId, status -> changed());
        }

        @Override
        public void handleGET(CoapExchange exchange) {
            repo.getRobotStatus(robotId).ifPresentOrElse(
                    status -> {
                        int accept = exchange.getRequestOptions().getAccept();
                        if (accept == -1 || accept == MediaTypeRegistry.APPLICATION_JSON) {
                            respondJson(exchange, status);
                        } else if (accept == MediaTypeRegistry.APPLICATION_SENML_JSON) {
                            respondSenML(exchange, status);
                        } else if (accept == MediaTypeRegistry.TEXT_PLAIN) {
                            exchange.respond(CoAP.ResponseCode.CONTENT, String.valueOf(status.getState()),
                                    MediaTypeRegistry.TEXT_PLAIN);
                        } else {
                            exchange.respond(CoAP.ResponseCode.NOT_ACCEPTABLE);
                        }
                    },
                    () -> exchange.respond(CoAP.ResponseCode.NOT_FOUND, "Robot non trovato")
            );
        }

        private void respondJson(CoapExchange exchange, RobotStatus status) {
            try {
                exchange.respond(CoAP.ResponseCode.CONTENT, mapper.writeValueAsString(status),
                        MediaTypeRegistry.APPLICATION_JSON);
            } catch (Exception e) {
                log.error("Errore durante la serializzazione JSON per il robot {}", robotId, e);
                exchange.respond(CoAP.ResponseCode.INTERNAL_SERVER_ERROR);
            }
        }

        private void respondSenML(CoapExchange exchange, RobotStatus status) {
            try {
                String baseName = "%s/robots/%d/".formatted(repo.getLineId(), robotId);
                SenMLPack pack = SenMLPack.fromRobotStatus(baseName, status);
                exchange.respond(CoAP.ResponseCode.CONTENT, mapper.writeValueAsString(pack),
                        MediaTypeRegistry.APPLICATION_SENML_JSON);
            } catch (Exception e) {
                log.error("Errore durante la serializzazione SenML per il robot {}", robotId, e);
                exchange.respond(CoAP.ResponseCode.INTERNAL_SERVER_ERROR);
            }
        }
    }

    /**
     * Comandi della linea, endpoint {@code /line/cmd}.
     * POST: {@code STOP} o {@code FAIL} con {@code robotId}; risponde con un {@link CommandAck}.
     * GET: elenco dei comandi supportati con un esempio di payload.
     */
    static class CommandResource extends CoapResource {
        private final StateRepository repo;
        private final ObjectMapper mapper = new ObjectMapper();

        CommandResource(String name, StateRepository repo) {
            super(name);
            this.repo = repo;
            getAttributes().setTitle("Line Command");
            getAttributes().addResourceType("it.unimore.line.command");
            getAttributes().addInterfaceDescription("core.a");
            getAttributes().addContentType(MediaTypeRegistry.APPLICATION_JSON);
        }

        @Override
        public void handlePOST(CoapExchange exchange) {
            try {
                int ct = exchange.getRequestOptions().getContentFormat();
                if (ct != -1 && ct != MediaTypeRegistry.APPLICATION_JSON) {
                    log.warn("Content-Format non supportato: {} ({})", ct, MediaTypeRegistry.toString(ct));
                    exchange.respond(CoAP.ResponseCode.NOT_ACCEPTABLE,
                            "Supportato solo application/json con payload LineCommand");
                    return;
                }

                byte[] payload = exchange.getRequestPayload();
                if (payload == null || payload.length == 0) {
                    exchange.respond(CoAP.ResponseCode.BAD_REQUEST, "Payload LineCommand mancante");
                    return;
                }
                LineCommand command = mapper.readValue(payload, LineCommand.class);
                if (command.getType() == null || command.getType().isBlank()) {
                    exchange.respond(CoAP.ResponseCode.BAD_REQUEST, "Campo 'type' mancante nel payload LineCommand");
                    return;
                }
                log.info("COAP CMD -> line={}, cmd={}, robot={}", repo.getLineId(), command.getType(),
                        command.getRobotId());

                CommandAck ack = repo.dispatchCommand(command);
                CoAP.ResponseCode code;
                if (ack.isAccepted()) {
                    code = CoAP.ResponseCode.CHANGED;
                } else if (!repo.isRunning()) {
                    code = CoAP.ResponseCode.SERVICE_UNAVAILABLE;
                } else {
                    code = CoAP.ResponseCode.BAD_REQUEST;
                }
                exchange.respond(code, mapper.writeValueAsString(ack), MediaTypeRegistry.APPLICATION_JSON);
            } catch (Exception e) {
                log.error("Errore durante la gestione di POST /line/cmd", e);
                exchange.respond(CoAP.ResponseCode.BAD_REQUEST, "Richiesta non valida: " + e.getMessage());
            }
        }

        @Override
        public void handleGET(CoapExchange exchange) {
            try {
                var body = mapper.createObjectNode();
                var supported = mapper.createArrayNode();
                SUPPORTED_COMMANDS.forEach(supported::add);
                body.set("supported", supported);

                var example = mapper.createObjectNode();
                example.put("type", LineCommand.FAIL);
                example.put("robotId", 0);
                example.put("ts", System.currentTimeMillis());
                body.set("payloadExample", example);

                exchange.respond(CoAP.ResponseCode.CONTENT, mapper.writeValueAsString(body),
                        MediaTypeRegistry.APPLICATION_JSON);
            } catch (Exception e) {
                log.error("Errore durante la serializzazione della risposta GET /line/cmd", e);
                exchange.respond(CoAP.ResponseCode.INTERNAL_SERVER_ERROR, "Errore di serializzazione");
            }
        }
    }
}
