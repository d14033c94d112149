package app.anvil.generation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param tenantRole  database role assumed inside tenant-scoped transactions
 * @param rowSecurity whether to apply the session context that row policies read
 */
@ConfigurationProperties(prefix = "app.storage")
public record StorageProps(
        String tenantRole,
        boolean rowSecurity
) {
    public StorageProps {
        if (tenantRole == null || tenantRole.isBlank()) {
            tenantRole = "authenticated";
        }
    }
}
