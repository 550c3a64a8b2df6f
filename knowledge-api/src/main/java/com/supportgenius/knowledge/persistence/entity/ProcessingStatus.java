package com.supportgenius.knowledge.persistence.entity;

public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
