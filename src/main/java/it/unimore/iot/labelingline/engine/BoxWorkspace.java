package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;

import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Punto di incontro fra il nastro e i robot: espone la scatola disponibile e
 * sveglia gli agenti a ogni nuovo arrivo o alla cancellazione dell'esecuzione.
 * Ogni scatola ha un numero di sequenza, così un agente la lavora al più una volta.
 */
public class BoxWorkspace {

    /**
     * Scatola disponibile con il suo numero di sequenza.
     */
    public record BoxSlot(long sequence, Box box) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition boxAvailable = lock.newCondition();

    private long sequence;
    private Box current;
    private boolean cancelled;

    public void publish(Box box) {
        lock.lock();
        try {
            sequence++;
            current = box;
            boxAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void withdraw() {
        lock.lock();
        try {
            current = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attende una scatola più recente di {@code lastSequence}.
     *
     * @return la scatola, vuoto se l'esecuzione è stata cancellata
     */
    public Optional<BoxSlot> awaitNext(long lastSequence) throws InterruptedException {
        lock.lock();
        try {
            while (!cancelled && (current == null || sequence <= lastSequence)) {
                boxAvailable.await();
            }
            if (cancelled) {
                return Optional.empty();
            }
            return Optional.of(new BoxSlot(sequence, current));
        } finally {
            lock.unlock();
        }
    }

    // Imposta il flag di cancellazione e sveglia tutti gli agenti in attesa
    public void cancel() {
        lock.lock();
        try {
            cancelled = true;
            current = null;
            boxAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }
}
