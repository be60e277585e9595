package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;
import it.unimore.iot.labelingline.model.ItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutua esclusione sugli oggetti della scatola in lavorazione.
 * <p>
 * Sulla linea c'è una sola scatola aperta alla volta: un unico lock protegge tutti
 * gli stati dei suoi oggetti e il contatore delle etichette. Ogni accesso segue la
 * sequenza acquisisci, verifica, modifica, rilascia. Una scatola chiusa rifiuta
 * nuove prenotazioni ma lascia completare quelle in corso.
 */
public class ClaimProtocol {

    private static final Logger logger = LoggerFactory.getLogger(ClaimProtocol.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition settled = lock.newCondition();

    private Box current;
    private boolean accepting;
    private int inFlight;

    // Apre la scatola alle prenotazioni dei robot
    public void open(Box box) {
        lock.lock();
        try {
            if (inFlight > 0) {
                throw new IllegalStateException("Box " + current.getId() + " still has " + inFlight
                        + " label(s) in progress");
            }
            this.current = box;
            this.accepting = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Prenota atomicamente l'oggetto per il robot. Fallisce senza effetti se l'oggetto
     * non è libero, se la scatola non è quella aperta o se è già stata chiusa.
     */
    public boolean tryClaim(Box box, int itemId, int robotId) {
        if (itemId < 0 || itemId >= box.getNumItems()) {
            throw new IllegalArgumentException("Box " + box.getId() + " has no item " + itemId);
        }
        lock.lock();
        try {
            if (box != current || !accepting) {
                return false;
            }
            boolean claimed = box.getItem(itemId).claim(robotId);
            if (claimed) {
                inFlight++;
                logger.debug("Robot {} claimed item {} of box {}", robotId, itemId, box.getId());
            }
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Oggetto libero più vicino all'origine del braccio; a parità di distanza vince l'id più basso.
     * Vuoto se non restano oggetti liberi o la scatola non accetta prenotazioni.
     */
    public Optional<Item> selectNearestUnclaimed(Box box) {
        lock.lock();
        try {
            if (box != current || !accepting) {
                return Optional.empty();
            }
            Item nearest = null;
            double best = Double.POSITIVE_INFINITY;
            for (Item item : box.getItems()) {
                if (item.getState() == ItemState.UNCLAIMED) {
                    double distance = item.distanceFromOrigin();
                    if (distance < best) {
                        best = distance;
                        nearest = item;
                    }
                }
            }
            return Optional.ofNullable(nearest);
        } finally {
            lock.unlock();
        }
    }

    // Completa l'etichetta: l'oggetto passa a LABELED e il contatore della scatola cresce di uno
    public void markLabeled(Box box, int itemId, int robotId, double time) {
        lock.lock();
        try {
            if (box != current) {
                throw new IllegalStateException("Box " + box.getId() + " is not the open box");
            }
            box.getItem(itemId).markLabeled(robotId, time);
            box.recordLabel();
            inFlight--;
            if (inFlight == 0) {
                settled.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    // Rifiuta nuove prenotazioni: la scatola ha lasciato la linea
    public void close(Box box) {
        lock.lock();
        try {
            if (box == current) {
                this.accepting = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attende che le etichette già prenotate sulla scatola siano completate.
     *
     * @return {@code false} se il tempo massimo è scaduto con etichette ancora in corso
     */
    public boolean awaitSettled(Box box, long timeoutMillis) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        lock.lock();
        try {
            while (box == current && inFlight > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = settled.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }
}
