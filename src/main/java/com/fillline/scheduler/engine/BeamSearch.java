package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded look-ahead used by the scored strategies. From a packing state it grows partial
 * sequences one placement at a time, keeps only the {@code beamWidth} best by cumulative score at
 * each depth, and after {@code lookaheadHorizon} depths returns the first lot of the best
 * survivor. Work per decision is O(beamWidth x horizon x candidates).
 *
 * <p>Step score: {@code -slackWaste - changeoverWeight * changeoverHours - forcedCleanPenalty}, the
 * penalty applying only when the placement forces a clean while another candidate would still
 * fit the current window. Slack waste is the budget left after the placement plus, when a clean
 * is forced, the budget abandoned in the closed window.
 */
final class BeamSearch {

    private static final Comparator<Node> RANKING = Comparator.comparingDouble((Node n) -> n.score)
            .reversed()
            .thenComparing(n -> n.path);

    private final SchedulerConfig config;
    private final int width;
    private final int horizon;

    BeamSearch(SchedulerConfig config) {
        this.config = config;
        this.width = Math.max(1, config.getBeamWidth());
        this.horizon = Math.max(1, config.getLookaheadHorizon());
    }

    /**
     * @param candidates lots still to place, in a stable order
     */
    Lot selectNext(PackingState state, List<Lot> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to select from");
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        List<Node> beam = List.of(new Node(null, null, state, 0.0));
        int depth = Math.min(horizon, candidates.size());
        for (int d = 0; d < depth; d++) {
            List<Node> children = new ArrayList<>();
            for (Node node : beam) {
                expand(node, candidates, children);
            }
            children.sort(RANKING);
            beam = new ArrayList<>(children.subList(0, Math.min(width, children.size())));
        }
        return beam.get(0).first();
    }

    double stepScore(Placement placement, boolean anotherFits) {
        double slackWaste = Math.max(0.0, placement.getBudgetAfter()) + placement.getAbandonedBudget();
        double penalty = placement.isForcedClean() && anotherFits ? config.getForcedCleanPenalty() : 0.0;
        return -slackWaste - config.getChangeoverWeight() * placement.getChangeoverHours() - penalty;
    }

    private void expand(Node node, List<Lot> candidates, List<Node> out) {
        Set<String> used = node.placedIds();
        List<Lot> remaining = new ArrayList<>(candidates.size() - used.size());
        for (Lot lot : candidates) {
            if (!used.contains(lot.getId())) {
                remaining.add(lot);
            }
        }
        boolean anyFits = false;
        for (Lot lot : remaining) {
            if (node.state.fits(lot, config)) {
                anyFits = true;
                break;
            }
        }
        for (Lot lot : remaining) {
            Placement p = node.state.evaluate(lot, config);
            // a lot that needs a forced clean does not fit, so anyFits means some other lot does
            out.add(new Node(node, lot, node.state.after(p, config), node.score + stepScore(p, anyFits)));
        }
    }

    private static final class Node {
        final Node parent;
        final Lot lot;
        final PackingState state;
        final double score;
        final String path;

        Node(Node parent, Lot lot, PackingState state, double score) {
            this.parent = parent;
            this.lot = lot;
            this.state = state;
            this.score = score;
            this.path = parent == null ? "" : parent.path + lot.getId() + '\u001f';
        }

        Lot first() {
            Node n = this;
            while (n.parent.parent != null) {
                n = n.parent;
            }
            return n.lot;
        }

        Set<String> placedIds() {
            Set<String> ids = new HashSet<>();
            for (Node n = this; n.parent != null; n = n.parent) {
                ids.add(n.lot.getId());
            }
            return ids;
        }
    }
}
