package org.mazesat.cdcl;

import org.mazesat.backend.SatBackend;
import org.mazesat.backend.SolveStatus;
import org.mazesat.optionalfeatures.RestartTechnique;

import java.util.*;
import java.util.logging.Logger;

/**
 * SOLUTORE CDCL - Motore nativo con watched literals, apprendimento 1-UIP e VSIDS
 *
 * Implementazione dell'algoritmo CDCL usata come motore predefinito della
 * codifica:
 * - Propagazione unitaria con due letterali osservati per clausola
 * - Analisi dei conflitti al primo punto di implicazione unico (1-UIP)
 * - Backjump non cronologico al secondo livello più alto della clausola appresa
 * - Euristica VSIDS con decadimento e salvataggio della fase
 * - Restart opzionale tramite {@link RestartTechnique}
 * - Budget di conflitti e interruzione cooperativa tramite il flag del thread
 *
 * RAPPRESENTAZIONE:
 * - Letterali DIMACS con segno; indice di watch = 2*var + (negativo ? 1 : 0)
 * - Valori: 1 vero, -1 falso, 0 non assegnato
 * - Le clausole unitarie in ingresso sono tenute a parte e assegnate al livello 0
 */
public class CDCLSolver implements SatBackend {

    private static final Logger LOGGER = Logger.getLogger(CDCLSolver.class.getName());

    private static final double ACTIVITY_DECAY = 0.95;
    private static final double RESCALE_LIMIT = 1e100;
    private static final int INTERRUPT_CHECK_INTERVAL = 256;

    //region STRUTTURE DATI CORE

    private int variableCount = 0;
    private int originalClauseCount = 0;

    /** Clausole con almeno due letterali: originali seguite dalle apprese */
    private final List<int[]> clauses = new ArrayList<>();

    /** Letterali delle clausole unitarie in ingresso */
    private final List<Integer> unitLiterals = new ArrayList<>();

    /** Lista di clausole che osservano ciascun letterale */
    private final List<List<Integer>> watches = new ArrayList<>();

    /** true se è stata aggiunta la clausola vuota */
    private boolean trivialUnsat = false;

    //endregion

    //region STATO DI RICERCA

    private byte[] values = new byte[1];
    private int[] levels = new int[1];
    private int[] reasons = new int[1];
    private boolean[] savedPhase = new boolean[1];
    private double[] activity = new double[1];
    private boolean[] seen = new boolean[1];

    private int[] trail = new int[0];
    private int trailSize = 0;
    private int propagationHead = 0;
    private final List<Integer> levelStarts = new ArrayList<>();

    private double activityIncrement = 1.0;

    private boolean[] model;
    private SolveStatus lastStatus;

    //endregion

    //region CONFIGURAZIONE E MONITORAGGIO

    private final boolean enableRestart;
    private RestartTechnique restartTechnique;
    private long conflictBudget = -1;
    private SATStatistics statistics = new SATStatistics();

    //endregion

    //region INIZIALIZZAZIONE

    public CDCLSolver() {
        this(false);
    }

    /**
     * @param enableRestart true per attivare i restart con sequenza di Luby
     */
    public CDCLSolver(boolean enableRestart) {
        this.enableRestart = enableRestart;
        watches.add(new ArrayList<>());
        watches.add(new ArrayList<>());
    }

    /**
     * Limita il numero di conflitti di una chiamata a {@link #solve()}; oltre il
     * limite l'esito è {@link SolveStatus#UNKNOWN}. Un valore negativo toglie il limite.
     */
    public void setConflictBudget(long conflictBudget) {
        this.conflictBudget = conflictBudget;
    }

    //endregion

    //region INTERFACCIA SatBackend

    @Override
    public int newVariable() {
        variableCount++;
        ensureCapacity(variableCount);
        watches.add(new ArrayList<>());
        watches.add(new ArrayList<>());
        return variableCount;
    }

    @Override
    public void addClause(int... literals) {
        LinkedHashSet<Integer> distinct = new LinkedHashSet<>();
        for (int literal : literals) {
            if (literal == 0 || Math.abs(literal) > variableCount) {
                throw new IllegalArgumentException("Letterale non valido: " + literal);
            }
            if (distinct.contains(-literal)) {
                originalClauseCount++;
                return;
            }
            distinct.add(literal);
        }
        originalClauseCount++;

        int[] clause = distinct.stream().mapToInt(Integer::intValue).toArray();
        switch (clause.length) {
            case 0 -> trivialUnsat = true;
            case 1 -> unitLiterals.add(clause[0]);
            default -> attachClause(clause);
        }
    }

    @Override
    public SolveStatus solve() {
        statistics = new SATStatistics();
        restartTechnique = enableRestart ? new RestartTechnique() : null;
        model = null;

        LOGGER.info("=== AVVIO RISOLUZIONE CDCL: " + variableCount + " variabili, "
                + originalClauseCount + " clausole ===");

        lastStatus = search();
        statistics.stopTimer();

        LOGGER.info("Esito CDCL: " + lastStatus + " - " + statistics.toCompactString());
        return lastStatus;
    }

    @Override
    public boolean valueOf(int variable) {
        if (lastStatus != SolveStatus.SATISFIABLE || model == null) {
            throw new IllegalStateException("Nessun modello disponibile: ultimo esito " + lastStatus);
        }
        if (variable < 1 || variable > variableCount) {
            throw new IllegalArgumentException("Variabile non allocata: " + variable);
        }
        return model[variable];
    }

    @Override
    public int variableCount() {
        return variableCount;
    }

    @Override
    public int clauseCount() {
        return originalClauseCount;
    }

    @Override
    public String name() {
        return enableRestart ? "cdcl+restart" : "cdcl";
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region CICLO PRINCIPALE

    private SolveStatus search() {
        if (trivialUnsat) {
            LOGGER.fine("Clausola vuota presente: formula insoddisfacibile");
            return SolveStatus.UNSATISFIABLE;
        }

        resetAssignments();
        for (int literal : unitLiterals) {
            int value = valueOfLiteral(literal);
            if (value < 0) {
                return SolveStatus.UNSATISFIABLE;
            }
            if (value == 0) {
                enqueue(literal, -1);
            }
        }

        long conflictsThisCall = 0;
        long iterations = 0;

        while (true) {
            if (++iterations % INTERRUPT_CHECK_INTERVAL == 0 && isInterruptRequested()) {
                LOGGER.warning("Risoluzione CDCL interrotta dopo " + iterations + " iterazioni");
                return SolveStatus.UNKNOWN;
            }

            int conflict = propagate();
            if (conflict >= 0) {
                statistics.incrementConflicts();
                conflictsThisCall++;
                if (decisionLevel() == 0) {
                    return SolveStatus.UNSATISFIABLE;
                }
                if (conflictBudget >= 0 && conflictsThisCall > conflictBudget) {
                    LOGGER.warning("Budget di conflitti esaurito: " + conflictBudget);
                    return SolveStatus.UNKNOWN;
                }

                int[] learned = analyze(conflict);
                int backtrackLevel = learned.length == 1 ? 0 : levels[Math.abs(learned[1])];
                if (decisionLevel() - backtrackLevel > 1) {
                    statistics.incrementBackjumps();
                }
                backtrack(backtrackLevel);
                learnAndAssert(learned);
                decayActivities();

                if (restartTechnique != null && restartTechnique.registerConflictAndCheckRestart()) {
                    backtrack(0);
                    restartTechnique.completeRestart();
                    statistics.incrementRestarts();
                }
            } else {
                int variable = pickBranchVariable();
                if (variable == 0) {
                    saveModel();
                    return SolveStatus.SATISFIABLE;
                }
                statistics.incrementDecisions();
                levelStarts.add(trailSize);
                enqueue(savedPhase[variable] ? variable : -variable, -1);
            }
        }
    }

    private boolean isInterruptRequested() {
        return Thread.currentThread().isInterrupted();
    }

    //endregion

    //region PROPAGAZIONE UNITARIA

    /**
     * Propaga i letterali in coda.
     *
     * @return indice della clausola in conflitto, -1 se nessun conflitto
     */
    private int propagate() {
        while (propagationHead < trailSize) {
            int falseLiteral = -trail[propagationHead++];
            List<Integer> watchList = watches.get(watchIndex(falseLiteral));

            int read = 0;
            int write = 0;
            while (read < watchList.size()) {
                int clauseIndex = watchList.get(read++);
                int[] clause = clauses.get(clauseIndex);

                if (clause[0] == falseLiteral) {
                    clause[0] = clause[1];
                    clause[1] = falseLiteral;
                }

                if (valueOfLiteral(clause[0]) > 0) {
                    watchList.set(write++, clauseIndex);
                    continue;
                }

                boolean moved = false;
                for (int k = 2; k < clause.length; k++) {
                    if (valueOfLiteral(clause[k]) >= 0) {
                        clause[1] = clause[k];
                        clause[k] = falseLiteral;
                        watches.get(watchIndex(clause[1])).add(clauseIndex);
                        moved = true;
                        break;
                    }
                }
                if (moved) {
                    continue;
                }

                watchList.set(write++, clauseIndex);
                if (valueOfLiteral(clause[0]) < 0) {
                    while (read < watchList.size()) {
                        watchList.set(write++, watchList.get(read++));
                    }
                    watchList.subList(write, watchList.size()).clear();
                    propagationHead = trailSize;
                    return clauseIndex;
                }
                enqueue(clause[0], clauseIndex);
                statistics.incrementPropagations();
            }
            watchList.subList(write, watchList.size()).clear();
        }
        return -1;
    }

    //endregion

    //region ANALISI DEI CONFLITTI

    /**
     * Analisi 1-UIP. In posizione 0 della clausola restituita c'è il letterale
     * asserito, in posizione 1 un letterale del livello di backjump.
     */
    private int[] analyze(int conflictIndex) {
        List<Integer> learned = new ArrayList<>();
        learned.add(0);

        int pathCount = 0;
        int pivot = 0;
        int index = trailSize - 1;
        int clauseIndex = conflictIndex;
        int currentLevel = decisionLevel();

        do {
            int[] clause = clauses.get(clauseIndex);
            for (int k = (pivot == 0 ? 0 : 1); k < clause.length; k++) {
                int literal = clause[k];
                int variable = Math.abs(literal);
                if (!seen[variable] && levels[variable] > 0) {
                    seen[variable] = true;
                    bumpActivity(variable);
                    if (levels[variable] >= currentLevel) {
                        pathCount++;
                    } else {
                        learned.add(literal);
                    }
                }
            }
            while (!seen[Math.abs(trail[index])]) {
                index--;
            }
            pivot = trail[index];
            index--;
            clauseIndex = reasons[Math.abs(pivot)];
            seen[Math.abs(pivot)] = false;
            pathCount--;
        } while (pathCount > 0);

        learned.set(0, -pivot);
        int[] result = learned.stream().mapToInt(Integer::intValue).toArray();
        for (int i = 1; i < result.length; i++) {
            seen[Math.abs(result[i])] = false;
        }

        if (result.length > 2) {
            int maxPosition = 1;
            for (int i = 2; i < result.length; i++) {
                if (levels[Math.abs(result[i])] > levels[Math.abs(result[maxPosition])]) {
                    maxPosition = i;
                }
            }
            int swap = result[1];
            result[1] = result[maxPosition];
            result[maxPosition] = swap;
        }
        return result;
    }

    private void learnAndAssert(int[] learned) {
        statistics.incrementLearnedClauses();
        if (learned.length == 1) {
            enqueue(learned[0], -1);
            return;
        }
        int clauseIndex = attachClause(learned);
        enqueue(learned[0], clauseIndex);
    }

    //endregion

    //region EURISTICA VSIDS

    private void bumpActivity(int variable) {
        activity[variable] += activityIncrement;
        if (activity[variable] > RESCALE_LIMIT) {
            for (int v = 1; v <= variableCount; v++) {
                activity[v] *= 1.0 / RESCALE_LIMIT;
            }
            activityIncrement *= 1.0 / RESCALE_LIMIT;
        }
    }

    private void decayActivities() {
        activityIncrement /= ACTIVITY_DECAY;
    }

    /**
     * @return variabile non assegnata con attività massima, 0 se tutte assegnate
     */
    private int pickBranchVariable() {
        int best = 0;
        double bestActivity = -1.0;
        for (int v = 1; v <= variableCount; v++) {
            if (values[v] == 0 && activity[v] > bestActivity) {
                best = v;
                bestActivity = activity[v];
            }
        }
        return best;
    }

    //endregion

    //region GESTIONE ASSEGNAMENTI

    private void enqueue(int literal, int reason) {
        int variable = Math.abs(literal);
        values[variable] = (byte) (literal > 0 ? 1 : -1);
        levels[variable] = decisionLevel();
        reasons[variable] = reason;
        trail[trailSize++] = literal;
    }

    private void backtrack(int level) {
        if (decisionLevel() <= level) {
            return;
        }
        int start = levelStarts.get(level);
        for (int i = trailSize - 1; i >= start; i--) {
            int variable = Math.abs(trail[i]);
            savedPhase[variable] = trail[i] > 0;
            values[variable] = 0;
            reasons[variable] = -1;
        }
        trailSize = start;
        propagationHead = start;
        levelStarts.subList(level, levelStarts.size()).clear();
    }

    private void resetAssignments() {
        Arrays.fill(values, (byte) 0);
        Arrays.fill(reasons, -1);
        trailSize = 0;
        propagationHead = 0;
        levelStarts.clear();
    }

    private int decisionLevel() {
        return levelStarts.size();
    }

    private int valueOfLiteral(int literal) {
        int value = values[Math.abs(literal)];
        return literal > 0 ? value : -value;
    }

    private void saveModel() {
        model = new boolean[variableCount + 1];
        for (int v = 1; v <= variableCount; v++) {
            model[v] = values[v] > 0;
        }
    }

    //endregion

    //region SUPPORTO

    private int attachClause(int[] clause) {
        int clauseIndex = clauses.size();
        clauses.add(clause);
        watches.get(watchIndex(clause[0])).add(clauseIndex);
        watches.get(watchIndex(clause[1])).add(clauseIndex);
        return clauseIndex;
    }

    private static int watchIndex(int literal) {
        return 2 * Math.abs(literal) + (literal < 0 ? 1 : 0);
    }

    private void ensureCapacity(int variables) {
        if (variables < values.length) {
            return;
        }
        int capacity = Math.max(variables + 1, values.length * 2);
        values = Arrays.copyOf(values, capacity);
        levels = Arrays.copyOf(levels, capacity);
        reasons = Arrays.copyOf(reasons, capacity);
        savedPhase = Arrays.copyOf(savedPhase, capacity);
        activity = Arrays.copyOf(activity, capacity);
        seen = Arrays.copyOf(seen, capacity);
        trail = Arrays.copyOf(trail, capacity);
    }

    //endregion
}
