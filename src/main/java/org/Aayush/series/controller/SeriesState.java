package org.Aayush.series.controller;

/**
 * Lifecycle of one {@link SeriesController}.
 */
public enum SeriesState {
    /** Nothing described yet, or the last describe failed. */
    IDLE,
    /** Probing inputs and rebuilding the registry. */
    DESCRIBING,
    /** Aggregate timeline published; selections may be made. */
    READY,
    /** Local time info of the selected input is visible while the reader produces data. */
    FETCHING
}
