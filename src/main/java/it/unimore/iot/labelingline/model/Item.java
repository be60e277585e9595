package it.unimore.iot.labelingline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rappresenta un oggetto (mango) da etichettare all'interno di una scatola.
 * Le coordinate sono relative al centroide della scatola e restano immutabili
 * dopo la generazione; cambiano solo stato, robot assegnatario e istante di etichettatura.
 * <p>
 * La classe non è thread-safe: gli accessi concorrenti passano dal lock della scatola.
 */
public class Item {

    /**
     * Valore di {@link #getClaimedBy()} quando nessun robot ha prenotato l'oggetto.
     */
    public static final int NO_ROBOT = -1;

    /**
     * Identificativo dell'oggetto, univoco all'interno della scatola.
     */
    private final int id;

    /**
     * Coordinata orizzontale relativa al centroide, in cm.
     */
    private final double x;

    /**
     * Coordinata verticale relativa al centroide, in cm.
     */
    private final double y;

    /**
     * {@code true} se il generatore non ha trovato una posizione abbastanza distante
     * dagli altri oggetti entro il numero massimo di tentativi.
     */
    private final boolean placementDegraded;

    private volatile ItemState state;
    private volatile int claimedBy;
    private volatile double labelTime;

    public Item(int id, double x, double y, boolean placementDegraded) {
        this(id, x, y, placementDegraded, ItemState.UNCLAIMED, NO_ROBOT, 0.0);
    }

    @JsonCreator
    public Item(@JsonProperty("id") int id,
                @JsonProperty("x") double x,
                @JsonProperty("y") double y,
                @JsonProperty("placementDegraded") boolean placementDegraded,
                @JsonProperty("state") ItemState state,
                @JsonProperty("claimedBy") int claimedBy,
                @JsonProperty("labelTime") double labelTime) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.placementDegraded = placementDegraded;
        this.state = state != null ? state : ItemState.UNCLAIMED;
        this.claimedBy = claimedBy;
        this.labelTime = labelTime;
    }

    // Prenota l'oggetto per il robot indicato; fallisce senza effetti se non è più libero
    public boolean claim(int robotId) {
        if (state != ItemState.UNCLAIMED) {
            return false;
        }
        this.state = ItemState.CLAIMED;
        this.claimedBy = robotId;
        return true;
    }

    // Completa l'etichettatura: ammessa solo dal robot che detiene la prenotazione
    public void markLabeled(int robotId, double time) {
        if (state != ItemState.CLAIMED) {
            throw new IllegalStateException("Item " + id + " cannot be labeled from state " + state);
        }
        if (claimedBy != robotId) {
            throw new IllegalStateException("Item " + id + " is claimed by robot " + claimedBy + ", not " + robotId);
        }
        this.state = ItemState.LABELED;
        this.labelTime = time;
    }

    // Distanza euclidea dall'origine del braccio (centro della scatola)
    @JsonIgnore
    public double distanceFromOrigin() {
        return Math.hypot(x, y);
    }

    // Distanza euclidea da un altro oggetto della stessa scatola
    public double distanceTo(Item other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    // Copia profonda usata per consegnare a ogni esecuzione una scatola intatta
    public Item copy() {
        return new Item(id, x, y, placementDegraded, state, claimedBy, labelTime);
    }

    public int getId() {
        return id;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public boolean isPlacementDegraded() {
        return placementDegraded;
    }

    public ItemState getState() {
        return state;
    }

    public int getClaimedBy() {
        return claimedBy;
    }

    public double getLabelTime() {
        return labelTime;
    }

    @Override
    public String toString() {
        return "Item{" +
                "id=" + id +
                ", x=" + x +
                ", y=" + y +
                ", state=" + state +
                ", claimedBy=" + claimedBy +
                '}';
    }
}
