package com.gnovoa.fantasy.draft;

import com.gnovoa.fantasy.model.Player;

import java.util.Comparator;

/**
 * Turns a player into a single comparable value.
 *
 * <p>Skaters are worth their fantasy points. Goalies are worth
 * {@code wins * winWeight + saves * saveWeight}; a goalie with no recorded wins or saves gets
 * {@code goalieBaseline} instead so it stays draftable early in a season.
 */
public final class PlayerValuation {

    private final double goalieBaseline;
    private final double winWeight;
    private final double saveWeight;

    private final Comparator<Player> ranking;

    public PlayerValuation(double goalieBaseline, double winWeight, double saveWeight) {
        this.goalieBaseline = goalieBaseline;
        this.winWeight = winWeight;
        this.saveWeight = saveWeight;
        this.ranking = Comparator.comparingDouble(this::valueOf).reversed()
                .thenComparing(Player::playerId);
    }

    public double valueOf(Player p) {
        if (!p.position().isGoalie()) return p.points();
        if (p.wins() == 0 && p.saves() == 0) return goalieBaseline;
        return p.wins() * winWeight + p.saves() * saveWeight;
    }

    /** Best first; equal values fall back to player id so the order is reproducible. */
    public Comparator<Player> ranking() {
        return ranking;
    }
}
