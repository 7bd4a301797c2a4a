package fr.imt.chronos.chronos.business.model;

public enum ExecutionStatus {
    SUCCESS,
    FAILED
}
