package org.mazesat.backend;

import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.IConstr;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.ISolverService;
import org.sat4j.specs.TimeoutException;
import org.sat4j.specs.SearchListenerAdapter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adattatore verso il motore MiniSat di Sat4j.
 *
 * Sat4j segnala le contraddizioni rilevate già in fase di inserimento con
 * {@link ContradictionException}: l'adattatore le registra e risponde
 * UNSATISFIABLE senza avviare la ricerca. Il budget di conflitti è mappato su
 * {@link ISolver#setTimeoutOnConflicts(int)}.
 *
 * INTERRUZIONE:
 * Sat4j non controlla il flag di interruzione del thread. Un ascoltatore di
 * ricerca lo verifica a ogni decisione e a ogni conflitto e, se il thread è
 * stato interrotto, forza la scadenza con {@link ISolver#expireTimeout()}: la
 * ricerca termina con {@link TimeoutException} e l'esito è UNKNOWN.
 */
public class Sat4jBackend implements SatBackend {

    private static final Logger LOGGER = Logger.getLogger(Sat4jBackend.class.getName());

    private final ISolver solver;
    private int variableCount = 0;
    private int clauseCount = 0;
    private boolean contradiction = false;
    private SolveStatus lastStatus;

    public Sat4jBackend() {
        this.solver = SolverFactory.newDefault();
        this.solver.setSearchListener(new InterruptWatcher());
    }

    /**
     * @param conflictBudget numero massimo di conflitti, negativo per nessun limite
     */
    public Sat4jBackend(int conflictBudget) {
        this();
        if (conflictBudget >= 0) {
            solver.setTimeoutOnConflicts(conflictBudget);
        }
    }

    @Override
    public int newVariable() {
        variableCount++;
        solver.newVar(variableCount);
        return variableCount;
    }

    @Override
    public void addClause(int... literals) {
        for (int literal : literals) {
            if (literal == 0 || Math.abs(literal) > variableCount) {
                throw new IllegalArgumentException("Letterale non valido: " + literal);
            }
        }
        clauseCount++;
        if (literals.length == 0) {
            contradiction = true;
            return;
        }
        try {
            solver.addClause(new VecInt(literals.clone()));
        } catch (ContradictionException e) {
            LOGGER.fine("Contraddizione rilevata in inserimento: " + e.getMessage());
            contradiction = true;
        }
    }

    @Override
    public SolveStatus solve() {
        if (contradiction) {
            lastStatus = SolveStatus.UNSATISFIABLE;
            return lastStatus;
        }
        if (Thread.currentThread().isInterrupted()) {
            LOGGER.warning("Risoluzione Sat4j interrotta prima dell'avvio");
            lastStatus = SolveStatus.UNKNOWN;
            return lastStatus;
        }
        try {
            lastStatus = solver.isSatisfiable() ? SolveStatus.SATISFIABLE : SolveStatus.UNSATISFIABLE;
        } catch (TimeoutException e) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warning("Risoluzione Sat4j interrotta");
            } else {
                LOGGER.log(Level.WARNING, "Sat4j ha esaurito il budget", e);
            }
            lastStatus = SolveStatus.UNKNOWN;
        }
        return lastStatus;
    }

    /**
     * Fa scadere la ricerca quando il thread che la esegue viene interrotto.
     */
    private final class InterruptWatcher extends SearchListenerAdapter<ISolverService> {

        private static final long serialVersionUID = 1L;

        @Override
        public void assuming(int p) {
            checkInterrupt();
        }

        @Override
        public void conflictFound(IConstr confl, int dlevel, int trailLevel) {
            checkInterrupt();
        }

        private void checkInterrupt() {
            if (Thread.currentThread().isInterrupted()) {
                solver.expireTimeout();
            }
        }
    }

    @Override
    public boolean valueOf(int variable) {
        if (lastStatus != SolveStatus.SATISFIABLE) {
            throw new IllegalStateException("Nessun modello disponibile: ultimo esito " + lastStatus);
        }
        return solver.model(variable);
    }

    @Override
    public int variableCount() {
        return variableCount;
    }

    @Override
    public int clauseCount() {
        return clauseCount;
    }

    @Override
    public String name() {
        return "sat4j";
    }
}
