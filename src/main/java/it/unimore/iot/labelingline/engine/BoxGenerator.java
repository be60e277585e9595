package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;
import it.unimore.iot.labelingline.model.SystemParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Genera scatole con un numero casuale di oggetti in posizioni non sovrapposte.
 * Non mantiene stato: a parità di sorgente casuale produce sempre le stesse scatole.
 */
public class BoxGenerator {

    private static final Logger logger = LoggerFactory.getLogger(BoxGenerator.class);

    /**
     * Tentativi massimi di campionamento per la posizione di un singolo oggetto.
     */
    public static final int MAX_PLACEMENT_ATTEMPTS = 100;

    private final SystemParameters params;

    public BoxGenerator(SystemParameters params) {
        this.params = params;
    }

    public Box generate(int boxId, Random random) {
        return generate(boxId, random, 0.0);
    }

    /**
     * Genera la scatola {@code boxId}. Se un oggetto non trova una posizione abbastanza
     * distante dagli altri entro {@link #MAX_PLACEMENT_ATTEMPTS} tentativi, viene accettato
     * l'ultimo campione e l'oggetto è marcato come {@link Item#isPlacementDegraded()}.
     */
    public Box generate(int boxId, Random random, double entryTime) {
        int numItems = params.getItemsMin() + random.nextInt(params.getItemsMax() - params.getItemsMin() + 1);
        double limit = getCoordinateLimit();
        double minSeparation = getMinSeparation();

        List<Item> items = new ArrayList<>(numItems);
        for (int i = 0; i < numItems; i++) {
            double x = 0;
            double y = 0;
            boolean placed = false;
            for (int attempt = 0; attempt < MAX_PLACEMENT_ATTEMPTS && !placed; attempt++) {
                x = uniform(random, -limit, limit);
                y = uniform(random, -limit, limit);
                placed = isFarFromAll(items, x, y, minSeparation);
            }
            if (!placed) {
                logger.warn("Box {}: no free position for item {} after {} attempts, keeping last sample ({}, {})",
                        boxId, i, MAX_PLACEMENT_ATTEMPTS, x, y);
            }
            items.add(new Item(i, x, y, !placed));
        }
        logger.debug("Generated box {} with {} items", boxId, numItems);
        return new Box(boxId, items, entryTime);
    }

    /**
     * Semilato dell'area utile: metà scatola meno il margine di un decimo della dimensione.
     */
    public double getCoordinateLimit() {
        return params.getBoxSize() / 2.0 - params.getBoxSize() / 10.0;
    }

    public double getMinSeparation() {
        return params.getBoxSize() / 15.0;
    }

    private static boolean isFarFromAll(List<Item> placed, double x, double y, double minSeparation) {
        for (Item other : placed) {
            if (Math.hypot(x - other.getX(), y - other.getY()) <= minSeparation) {
                return false;
            }
        }
        return true;
    }

    private static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
