package com.pseudo.buster.model;

/**
 * Kinds of logic defect, in the order they are checked.
 */
public enum FindingType {
    REDUNDANT,
    CONTRADICTION,
    TYPO,
    ILLOGICAL
}
