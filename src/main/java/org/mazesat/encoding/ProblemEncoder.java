package org.mazesat.encoding;

import org.mazesat.backend.SatBackend;
import org.mazesat.support.EncodingSession;

/**
 * Codificatore di un singolo problema strutturale.
 *
 * Ciclo di vita: {@link #validate()} → {@link #encode(EncodingSession)} →
 * risoluzione esterna → {@link #decode(EncodingSession, SatBackend)} se
 * soddisfacibile. Un'istanza serve una sola richiesta.
 *
 * @param <R> tipo della soluzione decodificata
 */
public interface ProblemEncoder<R> {

    /**
     * Controlla la richiesta senza produrre clausole.
     */
    void validate() throws InvalidRequestException;

    /**
     * Traduce la richiesta in clausole. Le impossibilità strutturali si
     * registrano con {@link EncodingSession#declareImpossible(String)}.
     */
    void encode(EncodingSession session);

    /**
     * Ricostruisce la soluzione da un modello soddisfacente.
     */
    R decode(EncodingSession session, SatBackend backend);

    /**
     * Descrizione breve per log e messaggi di avanzamento.
     */
    String describe();
}
