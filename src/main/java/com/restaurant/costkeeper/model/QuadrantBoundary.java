package com.restaurant.costkeeper.model;

/**
 * Which side of the average a dish lands on when its margin or volume equals the average exactly.
 */
public enum QuadrantBoundary {
    /** Equal to the average counts as high. */
    INCLUSIVE,
    /** Only strictly above the average counts as high. */
    EXCLUSIVE;

    public boolean isHigh(int comparedToAverage) {
        return this == INCLUSIVE ? comparedToAverage >= 0 : comparedToAverage > 0;
    }
}
