package org.mazesat.support;

import org.mazesat.backend.SatBackend;

import java.io.IOException;
import java.io.Writer;
import java.util.*;
import java.util.logging.Logger;

/**
 * SESSIONE DI CODIFICA - Registro delle variabili e costruttore di clausole
 *
 * Raccoglie la formula CNF prodotta da un codificatore per una singola richiesta.
 * Le variabili sono legate a chiavi strutturate ({@link VariableKey}) e numerate
 * a partire da 1 nell'ordine di primo utilizzo; le clausole sono array di
 * letterali con segno in stile DIMACS.
 *
 * INVARIANTI MANTENUTE:
 * - Ogni chiave ha un solo identificatore, mai riutilizzato
 * - Nessuna clausola memorizzata contiene letterali duplicati o è tautologica
 * - Ogni letterale nomina una variabile già allocata
 * - La clausola vuota è ammessa e rende la formula insoddisfacibile
 *
 * La sessione è usata da un solo thread e scartata dopo l'estrazione.
 */
public class EncodingSession {

    private static final Logger LOGGER = Logger.getLogger(EncodingSession.class.getName());

    /** Fino a questa dimensione at-most-one usa la codifica a coppie, oltre usa Sinz. */
    public static final int PAIRWISE_THRESHOLD = 6;

    //region STRUTTURE DATI

    private final Map<VariableKey, Integer> variables = new HashMap<>();
    private final List<VariableKey> keysById = new ArrayList<>();
    private final List<int[]> clauses = new ArrayList<>();
    private final List<String> impossibilityReasons = new ArrayList<>();
    private final Map<String, Integer> auxCounters = new HashMap<>();
    private long literalCount = 0;

    //endregion

    //region REGISTRO VARIABILI

    /**
     * Restituisce la variabile legata alla chiave, allocandola al primo uso.
     */
    public int variable(VariableKey key) {
        Objects.requireNonNull(key, "Chiave variabile null");
        return variables.computeIfAbsent(key, k -> {
            keysById.add(k);
            return keysById.size();
        });
    }

    /**
     * Variabile legata alla chiave senza allocazione, oppure null se la chiave non è mai stata usata.
     */
    public Integer lookup(VariableKey key) {
        return variables.get(key);
    }

    /**
     * Alloca una variabile ausiliaria anonima con etichetta {@code tag}.
     */
    public int freshVariable(String tag) {
        int index = auxCounters.merge(tag, 1, Integer::sum);
        return variable(new VariableKey.Aux(tag, index));
    }

    /**
     * @return chiave della variabile (1-based)
     */
    public VariableKey keyOf(int variable) {
        if (variable < 1 || variable > keysById.size()) {
            throw new IllegalArgumentException("Variabile non allocata: " + variable);
        }
        return keysById.get(variable - 1);
    }

    public int variableCount() {
        return keysById.size();
    }

    //endregion

    //region COSTRUZIONE CLAUSOLE

    /**
     * Aggiunge una clausola semplificata: letterali duplicati rimossi, tautologie scartate.
     *
     * @throws IllegalArgumentException se un letterale è 0 o nomina una variabile non allocata
     */
    public void addClause(int... literals) {
        LinkedHashSet<Integer> distinct = new LinkedHashSet<>();
        for (int literal : literals) {
            int variable = Math.abs(literal);
            if (literal == 0 || variable > keysById.size()) {
                throw new IllegalArgumentException("Letterale non valido: " + literal);
            }
            if (distinct.contains(-literal)) {
                LOGGER.finest("Clausola tautologica scartata");
                return;
            }
            distinct.add(literal);
        }

        int[] clause = distinct.stream().mapToInt(Integer::intValue).toArray();
        if (clause.length == 0) {
            LOGGER.fine("Clausola vuota aggiunta: formula insoddisfacibile");
        }
        clauses.add(clause);
        literalCount += clause.length;
    }

    public void addClause(Collection<Integer> literals) {
        addClause(literals.stream().mapToInt(Integer::intValue).toArray());
    }

    public void addUnit(int literal) {
        addClause(literal);
    }

    /** a ⇒ b */
    public void implies(int a, int b) {
        addClause(-a, b);
    }

    /** a ⇔ b */
    public void equivalent(int a, int b) {
        addClause(-a, b);
        addClause(a, -b);
    }

    public void atLeastOne(Collection<Integer> literals) {
        addClause(literals);
    }

    /**
     * Al più un letterale vero: codifica a coppie per insiemi piccoli,
     * contatore sequenziale di Sinz per insiemi grandi.
     */
    public void atMostOne(Collection<Integer> literals) {
        if (literals.size() <= PAIRWISE_THRESHOLD) {
            atMostOnePairwise(literals);
        } else {
            atMostOneSequential(literals);
        }
    }

    public void atMostOnePairwise(Collection<Integer> literals) {
        int[] lits = literals.stream().mapToInt(Integer::intValue).toArray();
        for (int i = 0; i < lits.length; i++) {
            for (int j = i + 1; j < lits.length; j++) {
                addClause(-lits[i], -lits[j]);
            }
        }
    }

    /**
     * Contatore sequenziale di Sinz con n-1 registri r_i ("uno tra x_1..x_i è vero"):
     * x_i ⇒ r_i, r_i ⇒ r_{i+1}, r_i ⇒ ¬x_{i+1}.
     */
    public void atMostOneSequential(Collection<Integer> literals) {
        int[] lits = literals.stream().mapToInt(Integer::intValue).toArray();
        if (lits.length <= 1) {
            return;
        }
        int[] registers = new int[lits.length - 1];
        for (int i = 0; i < registers.length; i++) {
            registers[i] = freshVariable("amo");
        }
        for (int i = 0; i < registers.length; i++) {
            addClause(-lits[i], registers[i]);
            if (i + 1 < registers.length) {
                addClause(-registers[i], registers[i + 1]);
            }
            addClause(-lits[i + 1], -registers[i]);
        }
    }

    public void exactlyOne(Collection<Integer> literals) {
        atMostOne(literals);
        atLeastOne(literals);
    }

    /**
     * Registra un'impossibilità strutturale rilevata durante la codifica e
     * aggiunge la clausola vuota.
     */
    public void declareImpossible(String reason) {
        LOGGER.info("Impossibilità strutturale: " + reason);
        impossibilityReasons.add(reason);
        addClause();
    }

    public boolean isProvablyImpossible() {
        return !impossibilityReasons.isEmpty();
    }

    public List<String> impossibilityReasons() {
        return Collections.unmodifiableList(impossibilityReasons);
    }

    //endregion

    //region ESPORTAZIONE

    public List<int[]> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    public int clauseCount() {
        return clauses.size();
    }

    public FormulaStats stats() {
        return new FormulaStats(variableCount(), clauses.size(), literalCount);
    }

    /**
     * Carica la formula in un motore nuovo: prima tutte le variabili, poi tutte le clausole.
     */
    public void loadInto(SatBackend backend) {
        for (int i = 1; i <= variableCount(); i++) {
            int allocated = backend.newVariable();
            if (allocated != i) {
                throw new IllegalStateException("Il motore " + backend.name()
                        + " non è vuoto: variabile " + allocated + " invece di " + i);
            }
        }
        for (int[] clause : clauses) {
            backend.addClause(clause);
        }
        LOGGER.fine("Formula caricata nel motore " + backend.name() + ": " + stats());
    }

    /**
     * Scrive la formula in formato DIMACS CNF con intestazione di commento.
     */
    public void writeDimacs(Writer writer) throws IOException {
        writer.write("c mazesat\n");
        writer.write("c " + stats() + "\n");
        for (String reason : impossibilityReasons) {
            writer.write("c impossibile: " + reason + "\n");
        }
        writer.write("p cnf " + variableCount() + " " + clauses.size() + "\n");
        StringBuilder line = new StringBuilder();
        for (int[] clause : clauses) {
            line.setLength(0);
            for (int literal : clause) {
                line.append(literal).append(' ');
            }
            line.append("0\n");
            writer.write(line.toString());
        }
        writer.flush();
    }

    //endregion
}
