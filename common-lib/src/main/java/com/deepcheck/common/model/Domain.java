package com.deepcheck.common.model;

/**
 * Kind of artifact under verification. Selects the verdict vocabulary and the classifier prompt.
 */
public enum Domain {
    CLAIM,
    MEDIA
}
