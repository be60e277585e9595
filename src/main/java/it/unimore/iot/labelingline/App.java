package it.unimore.iot.labelingline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import it.unimore.iot.labelingline.adapters.coap.CoapApiServer;
import it.unimore.iot.labelingline.config.LineConfiguration;
import it.unimore.iot.labelingline.domain.StateRepository;
import it.unimore.iot.labelingline.engine.BatchEstimator;
import it.unimore.iot.labelingline.engine.BoxGeneratorAgent;
import it.unimore.iot.labelingline.engine.FailureSweepRecord;
import it.unimore.iot.labelingline.engine.LineContext;
import it.unimore.iot.labelingline.engine.LiveSimulation;
import it.unimore.iot.labelingline.engine.LiveSimulationResult;
import it.unimore.iot.labelingline.engine.RobotSweepRecord;
import it.unimore.iot.labelingline.engine.SimulationClock;
import it.unimore.iot.labelingline.engine.SweepAnalyzer;
import it.unimore.iot.labelingline.exception.InvalidConfigurationException;
import it.unimore.iot.labelingline.model.SystemParameters;
import it.unimore.iot.labelingline.transport.InMemoryBoxChannel;
import it.unimore.iot.labelingline.transport.mqtt.MqttBoxPublisher;
import it.unimore.iot.labelingline.transport.mqtt.MqttBoxReceiver;
import it.unimore.iot.labelingline.transport.mqtt.MqttClientManager;
import it.unimore.iot.labelingline.transport.mqtt.MqttStatusPublisher;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

public class App {

    // Punto di ingresso della linea di etichettatura: simulazione live, analisi batch o processi MQTT separati
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static final String MODE_LIVE = "live";
    private static final String MODE_SWEEP = "sweep";
    private static final String MODE_GENERATOR = "generator";
    private static final String MODE_CONTROLLER = "controller";

    // La modalità si legge dal primo argomento, in alternativa da LINE_MODE
    public static void main(String[] args) {
        String mode = args.length > 0 ? args[0] : Optional.ofNullable(System.getenv("LINE_MODE")).orElse(MODE_LIVE);
        logger.info("Starting Smart Labeling Line in '{}' mode...", mode);

        try {
            LineConfiguration configuration = LineConfiguration.fromEnvironment();
            switch (mode.toLowerCase(Locale.ROOT)) {
                case MODE_LIVE:
                    runLive(configuration);
                    break;
                case MODE_SWEEP:
                    runSweep(configuration.getParameters());
                    break;
                case MODE_GENERATOR:
                    runGenerator(configuration);
                    break;
                case MODE_CONTROLLER:
                    runController(configuration);
                    break;
                default:
                    logger.error("Unknown mode '{}'. Supported: live, sweep, generator, controller", mode);
            }
        } catch (InvalidConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
        } catch (MqttException e) {
            logger.error("An error occurred during MQTT setup.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Simulation interrupted.");
        }
    }

    // Generatore e controllore nello stesso processo, collegati da un canale in memoria
    private static void runLive(LineConfiguration configuration) throws MqttException, InterruptedException {
        SystemParameters params = configuration.getParameters();
        StateRepository stateRepository = new StateRepository(configuration.getLineId(), params);
        MqttClientManager statusClient = attachStatusMirror(configuration, stateRepository);

        CoapApiServer coapApiServer = new CoapApiServer(stateRepository, configuration.getCoapPort());
        coapApiServer.start();

        LineContext context = new LineContext(configuration.getLineId(), params, stateRepository);
        InMemoryBoxChannel channel = new InMemoryBoxChannel();
        BoxGeneratorAgent generator = new BoxGeneratorAgent("vision", params, context.newRandom(), channel,
                context.getClock());
        Thread generatorThread = new Thread(generator, "vision-thread");

        LiveSimulation simulation = new LiveSimulation(context, channel);
        Thread hook = registerShutdownHook(simulation, generator, generatorThread);

        try {
            generatorThread.start();
            LiveSimulationResult result = simulation.run();
            logResult(result);
        } finally {
            generator.shutdown();
            generatorThread.join(2000);
            coapApiServer.stop();
            closeQuietly(statusClient);
            removeShutdownHook(hook);
        }
    }

    // Solo il sistema di visione: pubblica le scatole sul broker
    private static void runGenerator(LineConfiguration configuration) throws MqttException, InterruptedException {
        SystemParameters params = configuration.getParameters();
        MqttClientManager client = new MqttClientManager(brokerUrl(configuration), configuration.getLineId(),
                "vision");
        client.connect();

        BoxGeneratorAgent generator = new BoxGeneratorAgent("vision", params, new Random(params.getSeed()),
                new MqttBoxPublisher(client), new SimulationClock(params.getTimeScale()));
        Thread generatorThread = new Thread(generator, "vision-thread");
        Thread hook = registerShutdownHook(null, generator, generatorThread);
        try {
            generatorThread.start();
            generatorThread.join();
            logger.info("Generator finished: {} box(es) sent, {} failed", generator.getSent(),
                    generator.getFailedSends());
        } finally {
            closeQuietly(client);
            removeShutdownHook(hook);
        }
    }

    // Solo il controllore: riceve le scatole dal broker ed espone l'API CoAP
    private static void runController(LineConfiguration configuration) throws MqttException, InterruptedException {
        SystemParameters params = configuration.getParameters();
        StateRepository stateRepository = new StateRepository(configuration.getLineId(), params);

        MqttClientManager client = new MqttClientManager(brokerUrl(configuration), configuration.getLineId(),
                "controller");
        client.connect();
        stateRepository.registerStatusPublisher(new MqttStatusPublisher(client));
        MqttBoxReceiver receiver = new MqttBoxReceiver(configuration.getLineId());
        receiver.start(client);

        CoapApiServer coapApiServer = new CoapApiServer(stateRepository, configuration.getCoapPort());
        coapApiServer.start();

        LiveSimulation simulation = new LiveSimulation(
                new LineContext(configuration.getLineId(), params, stateRepository), receiver);
        Thread hook = registerShutdownHook(simulation, null, null);
        try {
            logResult(simulation.run());
        } finally {
            coapApiServer.stop();
            closeQuietly(client);
            removeShutdownHook(hook);
        }
    }

    // Analisi batch: numero di robot ottimale e dimensionamento dei ricambi
    private static void runSweep(SystemParameters params) {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        SweepAnalyzer analyzer = new SweepAnalyzer(params, new BatchEstimator());

        List<RobotSweepRecord> robotSweep = analyzer.robotSweep();
        List<FailureSweepRecord> failureSweep = analyzer.failureSweep();
        try {
            logger.info("Robot sweep:\n{}", mapper.writeValueAsString(robotSweep));
            logger.info("Failure sweep:\n{}", mapper.writeValueAsString(failureSweep));
        } catch (Exception e) {
            logger.error("Error serializing sweep results", e);
        }
    }

    private static MqttClientManager attachStatusMirror(LineConfiguration configuration,
                                                        StateRepository stateRepository) throws MqttException {
        if (configuration.getBrokerUrl().isEmpty()) {
            logger.info("No MQTT broker configured, status updates stay local");
            return null;
        }
        MqttClientManager client = new MqttClientManager(configuration.getBrokerUrl().get(),
                configuration.getLineId(), "controller");
        client.connect();
        stateRepository.registerStatusPublisher(new MqttStatusPublisher(client));
        return client;
    }

    private static String brokerUrl(LineConfiguration configuration) {
        return configuration.getBrokerUrl().orElse("tcp://localhost:1883");
    }

    private static void logResult(LiveSimulationResult result) {
        logger.info("Boxes: {}, items: {}, labeled: {}, missed: {}, failures: {}, backups activated: {}",
                result.getStats().getTotalBoxes(), result.getStats().getTotalItems(),
                result.getStats().getItemsLabeled(), result.getStats().getItemsMissed(),
                result.getStats().getRobotFailures(), result.getStats().getBackupActivations());
        logger.info("Efficiency: {}%{}", String.format("%.2f", result.getEfficiency()),
                result.isStopped() ? " (stopped)" : "");
    }

    // Registra una shutdown hook che arresta i componenti in modo ordinato
    private static Thread registerShutdownHook(LiveSimulation simulation, BoxGeneratorAgent generator,
                                               Thread generatorThread) {
        Thread hook = new Thread(() -> {
            logger.info("Shutdown hook triggered. Stopping all components...");
            if (generator != null) {
                generator.shutdown();
            }
            if (simulation != null && simulation.isRunning()) {
                simulation.stop();
            }
            if (generatorThread != null) {
                try {
                    generatorThread.join(2000);
                } catch (InterruptedException e) {
                    logger.error("Interrupted while waiting for thread {} to finish.", generatorThread.getName(), e);
                }
            }
            logger.info("Simulation shut down gracefully.");
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM already shutting down, hook left in place");
        }
    }

    private static void closeQuietly(MqttClientManager client) {
        if (client == null) {
            return;
        }
        try {
            client.disconnect();
        } catch (MqttException e) {
            logger.error("Error closing MQTT client", e);
        }
    }
}
