package com.eainde.vendorrisk.model;

import java.io.Serializable;

/**
 * The four component scores, each 0-100 where higher means riskier.
 */
public record ScoreBreakdown(double dataSecurity, double privacy, double compliance, double operational)
        implements Serializable {

    public static ScoreBreakdown neutral() {
        return new ScoreBreakdown(50.0, 50.0, 50.0, 50.0);
    }
}
