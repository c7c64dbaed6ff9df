package org.mazesat.graph;

/**
 * Arco non orientato del grafo.
 *
 * Gli estremi sono indici densi dei nodi; {@code tag} è un'etichetta opaca
 * (per i grafi quoziente contiene la trasformazione associata all'arco) che il
 * motore di codifica non interpreta mai.
 *
 * @param index posizione dell'arco nella lista del grafo
 * @param id identificatore stabile esposto al chiamante
 * @param u primo estremo
 * @param v secondo estremo
 * @param tag etichetta opaca, mai null (stringa vuota se assente)
 */
public record Edge(int index, String id, int u, int v, String tag) {

    public Edge {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identificatore arco vuoto");
        }
        if (u < 0 || v < 0) {
            throw new IllegalArgumentException("Estremi arco non validi: " + u + ", " + v);
        }
        tag = tag == null ? "" : tag;
    }

    /**
     * @return true se l'arco collega un nodo a se stesso
     */
    public boolean isLoop() {
        return u == v;
    }

    /**
     * Restituisce l'estremo opposto a {@code node}.
     */
    public int other(int node) {
        if (node == u) return v;
        if (node == v) return u;
        throw new IllegalArgumentException("Il nodo " + node + " non appartiene all'arco " + id);
    }

    /**
     * @return true se l'arco unisce i due nodi, in qualunque verso
     */
    public boolean connects(int a, int b) {
        return (u == a && v == b) || (u == b && v == a);
    }
}
