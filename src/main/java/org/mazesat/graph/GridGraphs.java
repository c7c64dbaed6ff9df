package org.mazesat.graph;

import java.util.HashSet;
import java.util.Set;

/**
 * Griglie quadrate pronte all'uso con le metriche di limite inferiore coerenti.
 *
 * I nodi si chiamano {@code "riga,colonna"} e gli archi {@code "r1,c1|r2,c2"}.
 * Sulle griglie avvolte (toro) le coppie ripetute e i cappi prodotti dalle
 * dimensioni piccole vengono scartati.
 */
public final class GridGraphs {

    /** Forma dell'adiacenza. */
    public enum Adjacency {
        /** Nord, sud, est, ovest. */
        FOUR,
        /** Anche le diagonali. */
        EIGHT
    }

    private static final int[][] ORTHOGONAL = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    private static final int[][] DIAGONAL = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};

    private GridGraphs() {
    }

    public static String nodeId(int row, int col) {
        return row + "," + col;
    }

    /**
     * Griglia di {@code width} colonne per {@code height} righe.
     *
     * @param wrap true per avvolgere i bordi (toro)
     */
    public static Graph square(int width, int height, Adjacency adjacency, boolean wrap) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Dimensioni griglia non valide: " + width + "x" + height);
        }
        Graph.Builder builder = Graph.builder();
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                builder.addNode(nodeId(row, col));
            }
        }

        Set<String> pairs = new HashSet<>();
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                addNeighbors(builder, pairs, row, col, width, height, ORTHOGONAL, wrap);
                if (adjacency == Adjacency.EIGHT) {
                    addNeighbors(builder, pairs, row, col, width, height, DIAGONAL, wrap);
                }
            }
        }
        return builder.build();
    }

    private static void addNeighbors(Graph.Builder builder, Set<String> pairs, int row, int col,
                                     int width, int height, int[][] offsets, boolean wrap) {
        for (int[] offset : offsets) {
            int r = row + offset[0];
            int c = col + offset[1];
            if (wrap) {
                r = Math.floorMod(r, height);
                c = Math.floorMod(c, width);
            } else if (r < 0 || r >= height || c < 0 || c >= width) {
                continue;
            }
            if (r == row && c == col) continue;

            String a = nodeId(row, col);
            String b = nodeId(r, c);
            String key = a.compareTo(b) < 0 ? a + "|" + b : b + "|" + a;
            if (pairs.add(key)) {
                builder.addEdge(key, a, b, "");
            }
        }
    }

    /**
     * Metrica coerente con la griglia: Manhattan per 4 vicini, Chebyshev per 8,
     * con le varianti toroidali sulle griglie avvolte.
     */
    public static DistanceLowerBound metric(Graph grid, int width, int height, Adjacency adjacency, boolean wrap) {
        return (from, to) -> {
            int[] a = coordinates(grid.nodeId(from));
            int[] b = coordinates(grid.nodeId(to));
            int dr = Math.abs(a[0] - b[0]);
            int dc = Math.abs(a[1] - b[1]);
            if (wrap) {
                dr = Math.min(dr, height - dr);
                dc = Math.min(dc, width - dc);
            }
            return adjacency == Adjacency.FOUR ? dr + dc : Math.max(dr, dc);
        };
    }

    /**
     * @return {riga, colonna} da un identificatore {@code "riga,colonna"}
     */
    public static int[] coordinates(String nodeId) {
        int comma = nodeId.indexOf(',');
        if (comma < 0) {
            throw new IllegalArgumentException("Identificatore di cella non valido: " + nodeId);
        }
        return new int[]{
                Integer.parseInt(nodeId.substring(0, comma).trim()),
                Integer.parseInt(nodeId.substring(comma + 1).trim())
        };
    }
}
