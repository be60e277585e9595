package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;

import java.util.Optional;

/**
 * Politica della simulazione concorrente: oggetto libero più vicino, prenotato tramite
 * {@link ClaimProtocol}. Se un altro robot vince la corsa il chiamante ripete la scelta.
 */
public class NearestFirstPolicy implements LabelingPolicy {

    private final ClaimProtocol claims;

    public NearestFirstPolicy(ClaimProtocol claims) {
        this.claims = claims;
    }

    @Override
    public Optional<Item> selectNextItem(Box box) {
        return claims.selectNearestUnclaimed(box);
    }

    @Override
    public boolean claimItem(Box box, Item item, int robotId) {
        return claims.tryClaim(box, item.getId(), robotId);
    }

    @Override
    public void completeItem(Box box, Item item, int robotId, double time) {
        claims.markLabeled(box, item.getId(), robotId, time);
    }

    @Override
    public double timeBudget(ZonePlan plan, int zoneIndex) {
        return plan.window(zoneIndex);
    }
}
