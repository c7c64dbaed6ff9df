package org.mazesat.puzzle;

import java.util.List;

/**
 * File di descrizione non leggibile: errori lessicali, sintattici o di
 * dichiarazione, ciascuno con la riga in cui compare.
 */
public class PuzzleSyntaxException extends Exception {

    private final List<String> errors;

    public PuzzleSyntaxException(List<String> errors) {
        super(errors.size() == 1 ? errors.get(0) : errors.size() + " errori nel file: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
