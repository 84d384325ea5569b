package com.notegraph.core.service.persistence.store;

import com.notegraph.core.service.persistence.StorageDomain;
import com.notegraph.core.service.persistence.StoragePayload;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps every storage domain to the store its payload is written to.
 *
 * A domain has either a text or a bytes destination; a payload of the other kind is rejected.
 */
public class StorageDestinations {

    private final Map<StorageDomain, TextStore> textStores = new EnumMap<>(StorageDomain.class);
    private final Map<StorageDomain, BytesStore> bytesStores = new EnumMap<>(StorageDomain.class);

    public StorageDestinations text(StorageDomain domain, TextStore store) {
        bytesStores.remove(domain);
        textStores.put(domain, store);
        return this;
    }

    public StorageDestinations bytes(StorageDomain domain, BytesStore store) {
        textStores.remove(domain);
        bytesStores.put(domain, store);
        return this;
    }

    /**
     * Writes one payload to the destination of its domain.
     *
     * @throws IllegalStateException when the domain has no destination for this payload kind
     */
    public void write(StorageDomain domain, StoragePayload payload) {
        if (payload instanceof StoragePayload.Text text) {
            requireText(domain).save(text.content());
        } else if (payload instanceof StoragePayload.Binary binary) {
            requireBytes(domain).save(binary.content());
        }
    }

    public Optional<String> readText(StorageDomain domain) {
        return Optional.ofNullable(textStores.get(domain)).flatMap(TextStore::load);
    }

    public Optional<byte[]> readBytes(StorageDomain domain) {
        return Optional.ofNullable(bytesStores.get(domain)).flatMap(BytesStore::load);
    }

    private TextStore requireText(StorageDomain domain) {
        var store = textStores.get(domain);
        if (store == null) {
            throw new IllegalStateException("No text destination for " + domain);
        }
        return store;
    }

    private BytesStore requireBytes(StorageDomain domain) {
        var store = bytesStores.get(domain);
        if (store == null) {
            throw new IllegalStateException("No bytes destination for " + domain);
        }
        return store;
    }
}
