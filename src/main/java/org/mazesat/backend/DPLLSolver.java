package org.mazesat.backend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * SOLUTORE DPLL CLASSICO - Ricerca ricorsiva con propagazione unitaria ed eliminazione dei letterali puri
 *
 * Motore di riferimento senza apprendimento: a ogni nodo della ricerca propaga
 * le clausole unitarie fino al punto fisso, assegna i letterali puri e poi
 * dirama sulla prima variabile libera di una clausola non soddisfatta (prima
 * vero, poi falso). Adatto a formule piccole e ai confronti con gli altri motori.
 *
 * Le variabili che non compaiono in nessuna clausola aperta restano false nel modello.
 *
 * Ogni clausola falsificata durante la propagazione conta come conflitto: oltre
 * il budget di conflitti la ricerca si ferma con esito UNKNOWN.
 */
public class DPLLSolver implements SatBackend {

    private static final Logger LOGGER = Logger.getLogger(DPLLSolver.class.getName());

    private int variableCount = 0;
    private final List<int[]> clauses = new ArrayList<>();
    private boolean[] model;
    private SolveStatus lastStatus;
    private long branches;
    private long conflicts;
    private final long conflictBudget;

    public DPLLSolver() {
        this(-1);
    }

    /**
     * @param conflictBudget numero massimo di conflitti, negativo per nessun limite
     */
    public DPLLSolver(long conflictBudget) {
        this.conflictBudget = conflictBudget;
    }

    @Override
    public int newVariable() {
        return ++variableCount;
    }

    @Override
    public void addClause(int... literals) {
        for (int literal : literals) {
            if (literal == 0 || Math.abs(literal) > variableCount) {
                throw new IllegalArgumentException("Letterale non valido: " + literal);
            }
        }
        clauses.add(literals.clone());
    }

    @Override
    public SolveStatus solve() {
        branches = 0;
        conflicts = 0;
        model = null;
        byte[] assignment = new byte[variableCount + 1];
        try {
            byte[] solution = search(assignment);
            if (solution == null) {
                lastStatus = SolveStatus.UNSATISFIABLE;
            } else {
                model = new boolean[variableCount + 1];
                for (int v = 1; v <= variableCount; v++) {
                    model[v] = solution[v] > 0;
                }
                lastStatus = SolveStatus.SATISFIABLE;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Risoluzione DPLL interrotta dopo " + branches + " diramazioni");
            lastStatus = SolveStatus.UNKNOWN;
        } catch (ConflictBudgetExceededException e) {
            LOGGER.warning("Budget di conflitti DPLL esaurito: " + conflictBudget);
            lastStatus = SolveStatus.UNKNOWN;
        } catch (StackOverflowError e) {
            LOGGER.warning("Profondità di ricorsione DPLL esaurita con " + variableCount + " variabili");
            lastStatus = SolveStatus.UNKNOWN;
        }
        LOGGER.fine("Esito DPLL: " + lastStatus + " (" + branches + " diramazioni, " + conflicts + " conflitti)");
        return lastStatus;
    }

    //region RICERCA

    private byte[] search(byte[] assignment) throws InterruptedException, ConflictBudgetExceededException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("DPLL interrotto");
        }
        if (!propagateUnits(assignment)) {
            conflicts++;
            if (conflictBudget >= 0 && conflicts > conflictBudget) {
                throw new ConflictBudgetExceededException();
            }
            return null;
        }
        assignPureLiterals(assignment);

        int branchVariable = firstOpenVariable(assignment);
        if (branchVariable == 0) {
            return assignment;
        }

        branches++;
        for (byte value : new byte[]{1, -1}) {
            byte[] child = Arrays.copyOf(assignment, assignment.length);
            child[branchVariable] = value;
            byte[] result = search(child);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /**
     * @return false se una clausola risulta falsificata
     */
    private boolean propagateUnits(byte[] assignment) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int[] clause : clauses) {
                int open = 0;
                int unit = 0;
                boolean satisfied = false;
                for (int literal : clause) {
                    int value = literalValue(assignment, literal);
                    if (value > 0) {
                        satisfied = true;
                        break;
                    }
                    if (value == 0) {
                        open++;
                        unit = literal;
                    }
                }
                if (satisfied) continue;
                if (open == 0) return false;
                if (open == 1) {
                    assignment[Math.abs(unit)] = (byte) (unit > 0 ? 1 : -1);
                    changed = true;
                }
            }
        }
        return true;
    }

    private void assignPureLiterals(byte[] assignment) {
        boolean[] positive = new boolean[variableCount + 1];
        boolean[] negative = new boolean[variableCount + 1];
        for (int[] clause : clauses) {
            if (isSatisfied(assignment, clause)) continue;
            for (int literal : clause) {
                if (assignment[Math.abs(literal)] == 0) {
                    if (literal > 0) positive[literal] = true;
                    else negative[-literal] = true;
                }
            }
        }
        for (int v = 1; v <= variableCount; v++) {
            if (positive[v] != negative[v]) {
                assignment[v] = (byte) (positive[v] ? 1 : -1);
            }
        }
    }

    private int firstOpenVariable(byte[] assignment) {
        for (int[] clause : clauses) {
            if (isSatisfied(assignment, clause)) continue;
            for (int literal : clause) {
                if (assignment[Math.abs(literal)] == 0) {
                    return Math.abs(literal);
                }
            }
        }
        return 0;
    }

    private static boolean isSatisfied(byte[] assignment, int[] clause) {
        for (int literal : clause) {
            if (literalValue(assignment, literal) > 0) return true;
        }
        return false;
    }

    private static int literalValue(byte[] assignment, int literal) {
        int value = assignment[Math.abs(literal)];
        return literal > 0 ? value : -value;
    }

    private static final class ConflictBudgetExceededException extends Exception {

        private static final long serialVersionUID = 1L;
    }

    //endregion

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
        return clauses.size();
    }

    @Override
    public String name() {
        return "dpll";
    }
}
