package com.rinkstats.application.enrich;

import java.awt.geom.Path2D;
import java.util.Set;

/**
 * Rink coordinates in feet, centre ice at the origin, goal lines at x = ±89. Coordinates passed
 * here are normalised so the shooting team attacks the net at x = +89.
 */
public final class RinkGeometry {

    public static final double GOAL_LINE_X = 89.0;
    public static final double BLUE_LINE_X = 25.0;

    /** Shot types whose reported distance can exceed the goal line legitimately. */
    private static final Set<String> CLOSE_RANGE_SHOT_TYPES =
        Set.of("TIP-IN", "WRAP-AROUND", "WRAP", "DEFLECTED", "BAT", "BETWEEN LEGS", "POKE");

    private static final Path2D HIGH_DANGER = polygon(new double[][] {
        {69, -9}, {89, -9}, {89, 9}, {69, 9}
    });

    private static final Path2D DANGER = polygon(new double[][] {
        {89, 9}, {89, -9}, {69, -22}, {54, -22}, {54, -9}, {44, -9}, {44, 9}, {54, 9}, {54, 22}, {69, 22}
    });

    private RinkGeometry() {
    }

    public static double distance(double x, double y) {
        return Math.hypot(GOAL_LINE_X - x, y);
    }

    /**
     * Angle off the goal line's perpendicular in degrees, 90 for a shot from the goal line.
     */
    public static double angle(double x, double y) {
        double depth = Math.abs(GOAL_LINE_X - x);
        if (depth == 0) {
            return 90.0;
        }
        return Math.toDegrees(Math.atan(Math.abs(y) / depth));
    }

    /**
     * Whether the report's distance says the shot was taken from the other half although the
     * coordinates put it near the attacked net, which happens when the direction was wrong.
     */
    public static boolean isLongDistanceMislabel(Integer reportedDistance, String shotType, String zone) {
        return reportedDistance != null && reportedDistance > GOAL_LINE_X
            && !CLOSE_RANGE_SHOT_TYPES.contains(shotType == null ? "WRIST" : shotType)
            && !"OFF".equals(zone);
    }

    public static String zone(double x) {
        if (x > BLUE_LINE_X) {
            return "OFF";
        }
        if (x < -BLUE_LINE_X) {
            return "DEF";
        }
        return "NEU";
    }

    public static boolean isHighDanger(double x, double y) {
        return HIGH_DANGER.contains(x, y);
    }

    /**
     * Danger area excluding the high-danger slot.
     */
    public static boolean isDanger(double x, double y) {
        return DANGER.contains(x, y) && !isHighDanger(x, y);
    }

    private static Path2D polygon(double[][] points) {
        Path2D.Double path = new Path2D.Double();
        path.moveTo(points[0][0], points[0][1]);
        for (int i = 1; i < points.length; i++) {
            path.lineTo(points[i][0], points[i][1]);
        }
        path.closePath();
        return path;
    }
}
