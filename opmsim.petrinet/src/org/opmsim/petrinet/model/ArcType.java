package org.opmsim.petrinet.model;

public enum ArcType {
    /** place to transition; tokens are removed on firing */
    INPUT,
    /** transition to place; tokens are added on firing */
    OUTPUT,
    /** place to transition; tokens must be present but stay */
    TEST
}
