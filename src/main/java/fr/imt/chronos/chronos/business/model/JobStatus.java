package fr.imt.chronos.chronos.business.model;

public enum JobStatus {
    ACTIVE,
    DELETED
}
