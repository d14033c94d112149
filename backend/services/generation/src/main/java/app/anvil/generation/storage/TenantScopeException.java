package app.anvil.generation.storage;

public class TenantScopeException extends RuntimeException {

    public TenantScopeException(String message) {
        super(message);
    }

    public TenantScopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
