package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;

import java.util.Optional;

/**
 * Politica di assegnazione degli oggetti ai robot, comune alla simulazione concorrente
 * e alla stima sequenziale.
 * <p>
 * Le due implementazioni sono volutamente diverse: {@link NearestFirstPolicy} sceglie
 * l'oggetto più vicino sotto il lock della scatola, {@link ArrayOrderPolicy} scorre gli
 * oggetti nell'ordine della scatola senza sincronizzazione.
 */
public interface LabelingPolicy {

    Optional<Item> selectNextItem(Box box);

    boolean claimItem(Box box, Item item, int robotId);

    void completeItem(Box box, Item item, int robotId, double time);

    /**
     * Tempo (secondi simulati) che il robot della zona può dedicare a ciascuna scatola.
     */
    double timeBudget(ZonePlan plan, int zoneIndex);
}
