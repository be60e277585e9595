package it.unimore.iot.labelingline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rappresenta una scatola che attraversa la linea con il suo carico di oggetti.
 * Numero e coordinate degli oggetti sono fissati alla generazione; durante la
 * lavorazione cambiano solo gli stati degli oggetti e il contatore delle etichette.
 * Una scatola si costruisce solo con oggetti liberi e nessuna etichetta applicata.
 */
public class Box {

    /**
     * Numero massimo di oggetti che una scatola può contenere.
     */
    public static final int MAX_ITEMS = 100;

    /**
     * Identificativo progressivo della scatola.
     */
    private final int id;

    /**
     * Oggetti contenuti, ordinati per identificativo.
     */
    private final List<Item> items;

    /**
     * Posizione della scatola lungo il nastro (cm dall'inizio).
     */
    private volatile double position;

    /**
     * Istante (secondi simulati) in cui la scatola è entrata nel sistema.
     */
    private final double entryTime;

    private volatile int labeledCount;

    public Box(int id, List<Item> items, double entryTime) {
        this(id, items, 0.0, entryTime, 0);
    }

    @JsonCreator
    public Box(@JsonProperty("id") int id,
               @JsonProperty("items") List<Item> items,
               @JsonProperty("position") double position,
               @JsonProperty("entryTime") double entryTime,
               @JsonProperty("labeledCount") int labeledCount) {
        if (items == null) {
            throw new IllegalArgumentException("Box " + id + " has no item list");
        }
        if (items.size() > MAX_ITEMS) {
            throw new IllegalArgumentException("Box " + id + " holds " + items.size()
                    + " items, maximum is " + MAX_ITEMS);
        }
        if (labeledCount != 0) {
            throw new IllegalArgumentException("Box " + id + " arrives with " + labeledCount + " labels already placed");
        }
        // l'identificativo di un oggetto è anche il suo indice nella scatola
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            if (item == null || item.getId() != i) {
                throw new IllegalArgumentException("Box " + id + " has item "
                        + (item == null ? "null" : item.getId()) + " at position " + i);
            }
            if (item.getState() != ItemState.UNCLAIMED) {
                throw new IllegalArgumentException("Box " + id + " has item " + i + " in state " + item.getState());
            }
        }
        this.id = id;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.position = position;
        this.entryTime = entryTime;
        this.labeledCount = labeledCount;
    }

    // Registra una nuova etichetta; il chiamante possiede il lock della scatola
    public void recordLabel() {
        if (labeledCount >= items.size()) {
            throw new IllegalStateException("Box " + id + " is already fully labeled");
        }
        labeledCount++;
    }

    // Restituisce una copia con tutti gli oggetti nello stato originale di generazione
    public Box freshCopy() {
        List<Item> copies = new ArrayList<>(items.size());
        for (Item item : items) {
            copies.add(new Item(item.getId(), item.getX(), item.getY(), item.isPlacementDegraded()));
        }
        return new Box(id, copies, position, entryTime, 0);
    }

    public int getId() {
        return id;
    }

    public List<Item> getItems() {
        return items;
    }

    @JsonIgnore
    public int getNumItems() {
        return items.size();
    }

    public Item getItem(int itemId) {
        return items.get(itemId);
    }

    public double getPosition() {
        return position;
    }

    public void setPosition(double position) {
        this.position = position;
    }

    public double getEntryTime() {
        return entryTime;
    }

    public int getLabeledCount() {
        return labeledCount;
    }

    @JsonIgnore
    public int getMissedCount() {
        return items.size() - labeledCount;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return labeledCount == items.size();
    }

    @Override
    public String toString() {
        return "Box{" +
                "id=" + id +
                ", numItems=" + items.size() +
                ", labeledCount=" + labeledCount +
                ", position=" + position +
                '}';
    }
}
