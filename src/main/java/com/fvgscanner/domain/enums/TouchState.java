package com.fvgscanner.domain.enums;

/**
 * Fill state of a fair value gap after formation.
 *
 * <p>The only legal transition is UNTOUCHED to TOUCHED. Once a later bar's range
 * re-enters the gap the state never goes back.
 */
public enum TouchState {
    UNTOUCHED,
    TOUCHED
}
