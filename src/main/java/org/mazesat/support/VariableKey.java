package org.mazesat.support;

/**
 * CHIAVI STRUTTURATE DELLE VARIABILI
 *
 * Ogni variabile booleana della codifica è legata a una chiave immutabile con
 * uguaglianza strutturale. Le chiavi sostituiscono i nomi costruiti per
 * concatenazione: due chiavi uguali producono sempre la stessa variabile.
 *
 * Gli indici di nodi e archi sono quelli densi del grafo su cui lavora il
 * codificatore che li crea.
 */
public interface VariableKey {

    //region ALBERI E FORESTE

    /** Il nodo {@code parent} è genitore di {@code child} nell'albero del gruppo. */
    record Parent(int group, int parent, int child) implements VariableKey {
    }

    /** Il nodo libero {@code node} appartiene al gruppo. */
    record Member(int node, int group) implements VariableKey {
    }

    /** L'arco è aperto (passaggio) invece che bloccato (muro). */
    record EdgeKept(int edge) implements VariableKey {
    }

    /** Bit {@code bit} del livello binario di {@code node} nel gruppo. */
    record LevelBit(int group, int node, int bit) implements VariableKey {
    }

    /** Profondità unaria: la distanza dell'albero da radice a {@code node} è almeno {@code d}. */
    record DistAtLeast(int group, int node, int d) implements VariableKey {
    }

    //endregion

    //region RAGGIUNGIBILITÀ LIMITATA

    /** {@code node} è raggiungibile dalla radice del vincolo in al più {@code step} archi aperti. */
    record Reach(int constraint, int step, int node) implements VariableKey {
    }

    /** Variabile di supporto: {@code node} raggiunto al passo {@code step} attraverso l'arco {@code edge}. */
    record ReachThrough(int constraint, int step, int edge, int node) implements VariableKey {
    }

    //endregion

    //region CICLI

    /** Il passo {@code step} del ciclo visita {@code node}. */
    record Visit(int step, int node) implements VariableKey {
    }

    //endregion

    //region ARBORESCENZA SU QUOZIENTE

    /** Il nodo quoziente sceglie l'arco quoziente come arco genitore. */
    record Choose(int quotientNode, int quotientEdge) implements VariableKey {
    }

    /** Genitore del nodo sollevato nell'arborescenza. */
    record LiftedParent(int node, int parent) implements VariableKey {
    }

    /** Il nodo sollevato ha un genitore. */
    record HasParent(int node) implements VariableKey {
    }

    /** Profondità unaria del nodo sollevato: almeno {@code d}. */
    record Depth(int node, int d) implements VariableKey {
    }

    //endregion

    /** Variabile ausiliaria anonima (registri Sinz, comparatori). */
    record Aux(String tag, int index) implements VariableKey {
    }
}
