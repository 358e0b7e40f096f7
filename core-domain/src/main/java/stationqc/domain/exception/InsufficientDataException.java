package stationqc.domain.exception;

/**
 * Los datos no permiten ejecutar un detector: frecuencia de muestreo no inferible,
 * series demasiado cortas para el orden autorregresivo pedido, etc.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
