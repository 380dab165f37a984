package healrun.locator;

import healrun.model.HealEvent;

/** Receives heal events, typically to forward them to the reporting layer. */
@FunctionalInterface
public interface HealEventListener {

    /**
     * @param event   the heal that occurred
     * @param context description of the step whose element was healed
     */
    void onHeal(HealEvent event, String context);
}
