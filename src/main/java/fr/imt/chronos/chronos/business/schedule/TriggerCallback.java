package fr.imt.chronos.chronos.business.schedule;

@FunctionalInterface
public interface TriggerCallback {

    void onFire(TriggerFiring firing);

}
