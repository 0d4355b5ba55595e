package com.lelantos.domain;

/**
 * Parts of a wallet profile fetched separately during deep analysis. A section listed as unavailable on a record was
 * replaced by its default because the fetch failed.
 */
public enum ProfileSection {
    PORTFOLIO,
    TRADES,
    PNL
}
