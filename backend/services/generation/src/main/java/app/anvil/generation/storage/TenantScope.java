package app.anvil.generation.storage;

import java.util.UUID;

public interface TenantScope extends StorageScope {

    UUID tenantId();
}
