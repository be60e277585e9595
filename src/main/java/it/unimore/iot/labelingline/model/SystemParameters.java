package it.unimore.iot.labelingline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import it.unimore.iot.labelingline.exception.InvalidConfigurationException;

/**
 * Parametri operativi della linea, in sola lettura dopo la costruzione.
 * Le grandezze derivate (velocità del braccio, spaziature, tempi di transito)
 * sono calcolate a partire da quelle fisiche.
 * <p>
 * Unità: cm per le lunghezze, cm/s per le velocità, secondi simulati per i tempi.
 */
public final class SystemParameters {

    /**
     * Numero massimo di robot (principali più ricambi) supportati dalla linea.
     */
    public static final int MAX_ROBOTS = 32;

    private final double beltSpeed;
    private final double boxSize;
    private final double beltLength;
    private final int itemsMin;
    private final int itemsMax;
    private final int robots;
    private final int backups;
    private final double failureProbability;
    private final int boxCount;
    private final long seed;
    private final double timeScale;

    private SystemParameters(Builder b) {
        this.beltSpeed = b.beltSpeed;
        this.boxSize = b.boxSize;
        this.beltLength = b.beltLength;
        this.itemsMin = b.itemsMin;
        this.itemsMax = b.itemsMax;
        this.robots = b.robots;
        this.backups = b.backups;
        this.failureProbability = b.failureProbability;
        this.boxCount = b.boxCount;
        this.seed = b.seed;
        this.timeScale = b.timeScale;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Nuovo builder precompilato con questi valori, per le varianti usate nelle analisi
    public Builder toBuilder() {
        return new Builder()
                .beltSpeed(beltSpeed)
                .boxSize(boxSize)
                .beltLength(beltLength)
                .itemsRange(itemsMin, itemsMax)
                .robots(robots)
                .backups(backups)
                .failureProbability(failureProbability)
                .boxCount(boxCount)
                .seed(seed)
                .timeScale(timeScale);
    }

    public double getBeltSpeed() {
        return beltSpeed;
    }

    public double getBoxSize() {
        return boxSize;
    }

    public double getBeltLength() {
        return beltLength;
    }

    public int getItemsMin() {
        return itemsMin;
    }

    public int getItemsMax() {
        return itemsMax;
    }

    public int getRobots() {
        return robots;
    }

    public int getBackups() {
        return backups;
    }

    public double getFailureProbability() {
        return failureProbability;
    }

    public int getBoxCount() {
        return boxCount;
    }

    public long getSeed() {
        return seed;
    }

    public double getTimeScale() {
        return timeScale;
    }

    /**
     * Velocità del braccio robotico: un decimo della dimensione della scatola al secondo.
     */
    public double getRobotSpeed() {
        return boxSize / 10.0;
    }

    /**
     * Distanza fra gli assi di due robot principali adiacenti.
     */
    public double getRobotSpacing() {
        return beltLength / robots;
    }

    /**
     * Distanza fra due scatole consecutive sul nastro.
     */
    public double getBoxSpacing() {
        return boxSize * 1.5;
    }

    @JsonIgnore
    public double getTransitTime() {
        return beltLength / beltSpeed;
    }

    @JsonIgnore
    public double getBoxInterval() {
        return getBoxSpacing() / beltSpeed;
    }

    @JsonIgnore
    public int getTotalRobots() {
        return robots + backups;
    }

    @Override
    public String toString() {
        return "SystemParameters{" +
                "beltSpeed=" + beltSpeed +
                ", boxSize=" + boxSize +
                ", beltLength=" + beltLength +
                ", items=" + itemsMin + ".." + itemsMax +
                ", robots=" + robots +
                ", backups=" + backups +
                ", failureProbability=" + failureProbability +
                ", boxCount=" + boxCount +
                ", timeScale=" + timeScale +
                '}';
    }

    /**
     * Builder con i valori predefiniti della linea di riferimento
     * (nastro a 10 cm/s, scatole da 50 cm, 300 cm di lavoro, 10-12 oggetti per scatola).
     */
    public static final class Builder {
        private double beltSpeed = 10.0;
        private double boxSize = 50.0;
        private double beltLength = 300.0;
        private int itemsMin = 10;
        private int itemsMax = 12;
        private int robots = 4;
        private int backups = 1;
        private double failureProbability = 0.0;
        private int boxCount = 20;
        private long seed = System.nanoTime();
        private double timeScale = 0.01;

        private Builder() {
        }

        public Builder beltSpeed(double beltSpeed) {
            this.beltSpeed = beltSpeed;
            return this;
        }

        public Builder boxSize(double boxSize) {
            this.boxSize = boxSize;
            return this;
        }

        public Builder beltLength(double beltLength) {
            this.beltLength = beltLength;
            return this;
        }

        public Builder itemsRange(int itemsMin, int itemsMax) {
            this.itemsMin = itemsMin;
            this.itemsMax = itemsMax;
            return this;
        }

        public Builder robots(int robots) {
            this.robots = robots;
            return this;
        }

        public Builder backups(int backups) {
            this.backups = backups;
            return this;
        }

        public Builder failureProbability(double failureProbability) {
            this.failureProbability = failureProbability;
            return this;
        }

        public Builder boxCount(int boxCount) {
            this.boxCount = boxCount;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder timeScale(double timeScale) {
            this.timeScale = timeScale;
            return this;
        }

        // Valida i parametri e restituisce l'istanza immutabile
        public SystemParameters build() {
            validate();
            return new SystemParameters(this);
        }

        private void validate() {
            requirePositive("beltSpeed", beltSpeed);
            requirePositive("boxSize", boxSize);
            requirePositive("beltLength", beltLength);
            requirePositive("timeScale", timeScale);
            if (itemsMin < 1 || itemsMin > Box.MAX_ITEMS) {
                throw new InvalidConfigurationException("itemsMin", itemsMin,
                        "must be between 1 and " + Box.MAX_ITEMS);
            }
            if (itemsMax < itemsMin || itemsMax > Box.MAX_ITEMS) {
                throw new InvalidConfigurationException("itemsMax", itemsMax,
                        "must be between itemsMin (" + itemsMin + ") and " + Box.MAX_ITEMS);
            }
            if (robots < 1 || robots > MAX_ROBOTS) {
                throw new InvalidConfigurationException("robots", robots, "must be between 1 and " + MAX_ROBOTS);
            }
            if (backups < 0 || robots + backups > MAX_ROBOTS) {
                throw new InvalidConfigurationException("backups", backups,
                        "must be non-negative and robots + backups must not exceed " + MAX_ROBOTS);
            }
            if (failureProbability < 0.0 || failureProbability > 1.0 || Double.isNaN(failureProbability)) {
                throw new InvalidConfigurationException("failureProbability", failureProbability,
                        "must be between 0 and 1");
            }
            if (boxCount < 1) {
                throw new InvalidConfigurationException("boxCount", boxCount, "must be positive");
            }
        }

        private static void requirePositive(String name, double value) {
            if (!(value > 0.0) || Double.isInfinite(value)) {
                throw new InvalidConfigurationException(name, value, "must be a positive number");
            }
        }
    }
}
