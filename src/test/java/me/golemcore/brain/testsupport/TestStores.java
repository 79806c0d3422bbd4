package me.golemcore.brain.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.brain.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.brain.domain.store.RecordStore;
import me.golemcore.brain.infrastructure.config.BrainConfiguration;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.StoragePort;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public final class TestStores {

    public static final ObjectMapper OBJECT_MAPPER = BrainConfiguration.objectMapper();

    private static final List<RecordStore> OPENED = new ArrayList<>();

    private TestStores() {
    }

    public static StoragePort storage(Path baseDir) {
        BrainProperties properties = new BrainProperties();
        properties.getStorage().setBasePath(baseDir.toString());
        LocalStorageAdapter adapter = new LocalStorageAdapter(properties);
        adapter.init();
        return adapter;
    }

    public static RecordStore open(String name, StoragePort storage, Clock clock) {
        RecordStore store = new RecordStore(name, name, storage, OBJECT_MAPPER, clock, true);
        store.open();
        synchronized (OPENED) {
            OPENED.add(store);
        }
        return store;
    }

    public static void closeAll() {
        synchronized (OPENED) {
            OPENED.forEach(RecordStore::close);
            OPENED.clear();
        }
    }
}
