package fr.imt.chronos.chronos.business.schedule;

public enum TriggerState {
    ARMED,
    FIRING,
    REMOVED
}
