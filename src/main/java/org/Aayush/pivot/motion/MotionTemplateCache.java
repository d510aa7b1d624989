package org.Aayush.pivot.motion;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.Aayush.pivot.agent.HeadingMath;
import org.Aayush.pivot.grid.GridPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Precomputed motion primitives for every heading increment.
 * <p>
 * <strong>Build:</strong>
 * </p>
 * <ol>
 * <li><strong>Cardinal headings:</strong> for each of the eight compass steps the heading
 * with the largest dot product against that step is marked cardinal. Holding a cardinal
 * heading moves the agent straight along a grid-aligned line.</li>
 * <li><strong>Forward candidates:</strong> for heading {@code r} and turn {@code i} in
 * {@code [-arc, arc]}, the agent turns to {@code r+i} and steps one neighbor cell along it.</li>
 * <li><strong>Reverse candidates:</strong> over the doubled range {@code [-2*arc, 2*arc]}
 * the agent turns to {@code r+i} and steps one cell against it.</li>
 * <li><strong>Filter:</strong> a candidate survives if it turns, holds a cardinal
 * heading, or reverses. Straight forward moves along oblique headings would skip cells
 * and are dropped.</li>
 * </ol>
 * <p>
 * Immutable after construction and safe to share across concurrent searches.
 * </p>
 */
public final class MotionTemplateCache {
    private static final Logger log = LoggerFactory.getLogger(MotionTemplateCache.class);

    public static final String REASON_INVALID_INCREMENTS = "M_INVALID_INCREMENTS";
    public static final String REASON_INVALID_ARC = "M_INVALID_ARC";
    public static final String REASON_ZERO_OFFSET = "M_ZERO_OFFSET_TEMPLATE";

    private static final GridPosition[] COMPASS = {
            new GridPosition(0, 1),
            new GridPosition(1, 0),
            new GridPosition(0, -1),
            new GridPosition(-1, 0),
            new GridPosition(1, 1),
            new GridPosition(1, -1),
            new GridPosition(-1, 1),
            new GridPosition(-1, -1)
    };

    private final int maxIncrements;
    private final int arc;
    private final boolean[] cardinal;
    private final IntList cardinalHeadings;
    private final List<List<MotionTemplate>> templates;
    private final int templateCount;

    /**
     * Builds templates for all headings.
     *
     * @param maxIncrements heading discretization, must be positive.
     * @param arc maximum forward turn per step in increments; {@code 2*arc < maxIncrements}.
     * @throws MotionConfigurationException when the parameters are inconsistent.
     */
    public MotionTemplateCache(int maxIncrements, int arc) {
        if (maxIncrements <= 0) {
            throw new MotionConfigurationException(
                    REASON_INVALID_INCREMENTS,
                    "maxIncrements must be > 0, got " + maxIncrements
            );
        }
        if (arc < 0 || 2 * arc >= maxIncrements) {
            throw new MotionConfigurationException(
                    REASON_INVALID_ARC,
                    "arc must satisfy 0 <= 2*arc < maxIncrements, got arc=" + arc
                            + " maxIncrements=" + maxIncrements
            );
        }
        this.maxIncrements = maxIncrements;
        this.arc = arc;
        this.cardinal = computeCardinalHeadings(maxIncrements);

        IntArrayList cardinalList = new IntArrayList();
        for (int heading = 0; heading < maxIncrements; heading++) {
            if (cardinal[heading]) {
                cardinalList.add(heading);
            }
        }
        this.cardinalHeadings = IntLists.unmodifiable(cardinalList);

        List<List<MotionTemplate>> built = new ArrayList<>(maxIncrements);
        int total = 0;
        for (int heading = 0; heading < maxIncrements; heading++) {
            List<MotionTemplate> forHeading = buildTemplates(heading);
            total += forHeading.size();
            built.add(forHeading);
        }
        this.templates = Collections.unmodifiableList(built);
        this.templateCount = total;

        if (log.isDebugEnabled()) {
            log.debug("Built {} motion templates for {} headings (arc={}, cardinal={})",
                    total, maxIncrements, arc, cardinalHeadings);
        }
    }

    /**
     * Candidate moves from a heading, in build order: forward turns first, then reverse.
     *
     * @throws IllegalArgumentException when heading is outside {@code [0, maxIncrements)}.
     */
    public List<MotionTemplate> templatesFor(int heading) {
        if (heading < 0 || heading >= maxIncrements) {
            throw new IllegalArgumentException(
                    "heading out of range: " + heading + " [0, " + maxIncrements + ")"
            );
        }
        return templates.get(heading);
    }

    /**
     * Returns whether holding this heading is a grid-aligned straight move.
     */
    public boolean isCardinal(int heading) {
        return heading >= 0 && heading < maxIncrements && cardinal[heading];
    }

    /**
     * Cardinal headings in ascending order.
     */
    public IntList cardinalHeadings() {
        return cardinalHeadings;
    }

    /**
     * Number of discrete headings.
     */
    public int maxIncrements() {
        return maxIncrements;
    }

    /**
     * Largest forward turn per move, in heading increments.
     */
    public int arc() {
        return arc;
    }

    /**
     * Total number of templates across all headings.
     */
    public int templateCount() {
        return templateCount;
    }

    private List<MotionTemplate> buildTemplates(int heading) {
        Set<MotionTemplate> candidates = new LinkedHashSet<>();
        double incrementSize = HeadingMath.incrementSize(maxIncrements);

        for (int turn = -arc; turn <= arc; turn++) {
            int target = HeadingMath.clampHeading(heading + turn, maxIncrements);
            GridPosition step = HeadingMath.stepFor(target * incrementSize);
            candidates.add(new MotionTemplate(step, target, false));
        }

        int reverseArc = arc * 2;
        for (int turn = -reverseArc; turn <= reverseArc; turn++) {
            int target = HeadingMath.clampHeading(heading + turn, maxIncrements);
            GridPosition step = HeadingMath.stepFor(target * incrementSize + Math.PI);
            candidates.add(new MotionTemplate(step, target, true));
        }

        List<MotionTemplate> kept = new ArrayList<>(candidates.size());
        for (MotionTemplate candidate : candidates) {
            boolean turned = candidate.targetHeading() != heading;
            if (turned || cardinal[candidate.targetHeading()] || candidate.reverse()) {
                requireNonZeroOffset(candidate, heading);
                kept.add(candidate);
            }
        }
        return List.copyOf(kept);
    }

    /**
     * Rejects a template that would leave the agent in place.
     */
    static void requireNonZeroOffset(MotionTemplate template, int heading) {
        if (template.offset().isZero()) {
            throw new MotionConfigurationException(
                    REASON_ZERO_OFFSET,
                    "heading " + heading + " produced a zero-offset move to heading "
                            + template.targetHeading() + "; arc and maxIncrements are mismatched"
            );
        }
    }

    private static boolean[] computeCardinalHeadings(int maxIncrements) {
        boolean[] cardinal = new boolean[maxIncrements];
        double incrementSize = HeadingMath.incrementSize(maxIncrements);
        for (GridPosition direction : COMPASS) {
            int closest = 0;
            double closestDot = Double.NEGATIVE_INFINITY;
            for (int heading = 0; heading < maxIncrements; heading++) {
                double angle = heading * incrementSize;
                double dot = Math.cos(angle) * direction.x() + Math.sin(angle) * direction.y();
                if (dot > closestDot) {
                    closestDot = dot;
                    closest = heading;
                }
            }
            cardinal[closest] = true;
        }
        return cardinal;
    }
}
