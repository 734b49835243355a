package com.relationalizer.model;

import lombok.Value;

/**
 * Observations of one path of the aggregate schema relative to its owner.
 */
@Value
public class PathStatistic {
    String path;
    TypeProfile profile;
    long ownerObservations;

    public long getObservations() {
        return profile.total();
    }

    public boolean isAlwaysPresent() {
        return ownerObservations > 0 && profile.total() == ownerObservations;
    }
}
