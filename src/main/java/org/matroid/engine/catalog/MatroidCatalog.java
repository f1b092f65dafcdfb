package org.matroid.engine.catalog;

import lombok.experimental.UtilityClass;
import org.matroid.core.MatroidException;
import org.matroid.engine.core.CircuitsMatroid;
import org.matroid.engine.core.FlatsMatroid;
import org.matroid.engine.core.Matroid;
import org.matroid.engine.core.RankFunctionMatroid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Small named matroids used as references and smoke checks.
 */
@UtilityClass
public class MatroidCatalog {

    private static final String SEVEN_POINTS = "abcdefg";

    private static final List<String> FANO_LINES = List.of("abf", "ace", "adg", "bcd", "beg", "cfg", "def");

    /**
     * Uniform matroid {@code U(r, n)} on {@code 0..n-1}: every subset of size at most {@code r}
     * is independent.
     *
     * @throws MatroidException with {@link MatroidException#INVALID_INPUT} unless {@code 0 <= r <= n}.
     */
    public static Matroid<Integer> uniform(int r, int n) {
        if (r < 0 || n < r) {
            throw new MatroidException(MatroidException.INVALID_INPUT, "uniform matroid needs 0 <= r <= n, got r=" + r + ", n=" + n);
        }
        return RankFunctionMatroid.of(range(n), subset -> Math.min(subset.size(), r))
                .withName("U(" + r + ", " + n + ")");
    }

    /**
     * The four-point line {@code U(2, 4)} on {@code a..d}, stored by circuits.
     */
    public static Matroid<String> u24() {
        List<Set<String>> circuits = new ArrayList<>();
        String points = "abcd";
        for (int skip = 0; skip < points.length(); skip++) {
            Set<String> circuit = new TreeSet<>();
            for (int i = 0; i < points.length(); i++) {
                if (i != skip) {
                    circuit.add(String.valueOf(points.charAt(i)));
                }
            }
            circuits.add(circuit);
        }
        return CircuitsMatroid.of(labels(points), circuits).withName("U24");
    }

    /**
     * Fano plane {@code F7} on {@code a..g}, stored by flats.
     */
    public static Matroid<String> fano() {
        return plane(FANO_LINES).withName("Fano");
    }

    /**
     * Non-Fano matroid {@code F7-}: the Fano plane with the line {@code def} relaxed.
     */
    public static Matroid<String> nonFano() {
        return plane(FANO_LINES.subList(0, FANO_LINES.size() - 1)).withName("NonFano");
    }

    /**
     * Free matroid on {@code 0..n-1}: every subset is independent.
     */
    public static Matroid<Integer> freeMatroid(int n) {
        if (n < 0) {
            throw new MatroidException(MatroidException.INVALID_INPUT, "free matroid needs n >= 0, got " + n);
        }
        return CircuitsMatroid.<Integer>of(range(n), List.<Set<Integer>>of()).withName("Free(" + n + ")");
    }

    /**
     * Rank-3 matroid on seven points whose rank-2 flats are the given lines plus every
     * point pair no line covers.
     */
    private static FlatsMatroid<String> plane(List<String> lines) {
        List<String> points = labels(SEVEN_POINTS);
        Map<Integer, List<Set<String>>> flats = new TreeMap<>();
        flats.put(0, List.of(Set.of()));

        List<Set<String>> singletons = new ArrayList<>();
        for (String point : points) {
            singletons.add(Set.of(point));
        }
        flats.put(1, singletons);

        List<Set<String>> rankTwo = new ArrayList<>();
        Set<Set<String>> coveredPairs = new HashSet<>();
        for (String line : lines) {
            Set<String> flat = new TreeSet<>(labels(line));
            rankTwo.add(flat);
            for (String p : flat) {
                for (String q : flat) {
                    if (p.compareTo(q) < 0) {
                        coveredPairs.add(Set.of(p, q));
                    }
                }
            }
        }
        for (int i = 0; i < points.size(); i++) {
            for (int j = i + 1; j < points.size(); j++) {
                Set<String> pair = Set.of(points.get(i), points.get(j));
                if (!coveredPairs.contains(pair)) {
                    rankTwo.add(pair);
                }
            }
        }
        flats.put(2, rankTwo);
        flats.put(3, List.of(new TreeSet<>(points)));
        return FlatsMatroid.of(points, flats);
    }

    private static List<String> labels(String points) {
        List<String> out = new ArrayList<>(points.length());
        for (int i = 0; i < points.length(); i++) {
            out.add(String.valueOf(points.charAt(i)));
        }
        return out;
    }

    private static Collection<Integer> range(int n) {
        List<Integer> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(i);
        }
        return out;
    }
}
