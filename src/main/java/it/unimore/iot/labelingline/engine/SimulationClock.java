package it.unimore.iot.labelingline.engine;

import java.util.concurrent.TimeUnit;

/**
 * Orologio simulato: un secondo simulato dura {@code timeScale} secondi reali.
 */
public class SimulationClock {

    private final double timeScale;
    private final long originNanos;

    public SimulationClock(double timeScale) {
        if (!(timeScale > 0.0)) {
            throw new IllegalArgumentException("timeScale must be positive, got " + timeScale);
        }
        this.timeScale = timeScale;
        this.originNanos = System.nanoTime();
    }

    /**
     * Secondi simulati trascorsi dalla creazione dell'orologio.
     */
    public double now() {
        return (System.nanoTime() - originNanos) / 1e9 / timeScale;
    }

    public void sleep(double simulatedSeconds) throws InterruptedException {
        if (simulatedSeconds <= 0) {
            return;
        }
        TimeUnit.NANOSECONDS.sleep((long) (simulatedSeconds * timeScale * 1e9));
    }

    public long toWallMillis(double simulatedSeconds) {
        return (long) Math.ceil(simulatedSeconds * timeScale * 1000.0);
    }

    public double getTimeScale() {
        return timeScale;
    }
}
