package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;
import it.unimore.iot.labelingline.model.ItemState;

import java.util.Optional;

/**
 * Politica della stima sequenziale: primo oggetto libero nell'ordine della scatola.
 * Usata da un solo thread, quindi senza lock.
 */
public class ArrayOrderPolicy implements LabelingPolicy {

    @Override
    public Optional<Item> selectNextItem(Box box) {
        return box.getItems().stream()
                .filter(item -> item.getState() == ItemState.UNCLAIMED)
                .findFirst();
    }

    @Override
    public boolean claimItem(Box box, Item item, int robotId) {
        return item.claim(robotId);
    }

    @Override
    public void completeItem(Box box, Item item, int robotId, double time) {
        item.markLabeled(robotId, time);
        box.recordLabel();
    }

    // Finestra uniforme di stazione, indipendente dalla zona
    @Override
    public double timeBudget(ZonePlan plan, int zoneIndex) {
        return plan.getStationWindow();
    }
}
