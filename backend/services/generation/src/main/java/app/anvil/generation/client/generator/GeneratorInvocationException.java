package app.anvil.generation.client.generator;

/**
 * The generator could not be reached or rejected the request.
 */
public class GeneratorInvocationException extends Exception {

    public GeneratorInvocationException(String message) {
        super(message);
    }

    public GeneratorInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
