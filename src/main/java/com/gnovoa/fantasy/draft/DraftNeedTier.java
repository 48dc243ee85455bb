package com.gnovoa.fantasy.draft;

import com.gnovoa.fantasy.model.Position;
import com.gnovoa.fantasy.model.PositionQuota;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Ordered roster-need tiers for a skater pick. The draft walks them top to bottom and fills the
 * first tier that still has an open position.
 */
public enum DraftNeedTier {

    /** Positions below what a valid starting lineup requires. */
    STARTING_MINIMUM {
        @Override int threshold(PositionQuota quota, Position position) {
            return quota.startingMinimum(position);
        }
    },

    /** Positions below the roster-target minimum. */
    ROSTER_MINIMUM {
        @Override int threshold(PositionQuota quota, Position position) {
            return quota.target(position).min();
        }
    },

    /** Positions below the roster-target maximum. */
    ROSTER_MAXIMUM {
        @Override int threshold(PositionQuota quota, Position position) {
            return quota.target(position).max();
        }
    };

    abstract int threshold(PositionQuota quota, Position position);

    /**
     * @param counts players already on the roster, per position
     * @return skater positions whose count is still under this tier's threshold
     */
    public Set<Position> unmetPositions(PositionQuota quota, Map<Position, Integer> counts) {
        Set<Position> unmet = EnumSet.noneOf(Position.class);
        for (Position p : Position.SKATERS) {
            if (counts.getOrDefault(p, 0) < threshold(quota, p)) unmet.add(p);
        }
        return unmet;
    }
}
