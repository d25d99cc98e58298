package ai.vmhost.virtualizer.catalog;

import ai.vmhost.model.db.StorageImpl;
import ai.vmhost.virtualizer.config.VirtualizerConfig;
import jakarta.inject.Singleton;

@Singleton
public class CatalogStorage extends StorageImpl {
    public CatalogStorage(VirtualizerConfig config) {
        super(config.getDatabase(), "classpath:db/catalog/migrations");
    }
}
