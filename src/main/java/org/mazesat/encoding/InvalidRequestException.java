package org.mazesat.encoding;

/**
 * Richiesta del chiamante non valida: nodo sconosciuto, radice fuori dal
 * gruppo, lunghezza di ciclo troppo corta e simili. Sollevata dalla
 * validazione prima che venga costruita qualunque clausola.
 */
public class InvalidRequestException extends Exception {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
