package com.notegraph.core.service.persistence;

/**
 * Serialized content of one storage domain, ready to be written.
 */
public sealed interface StoragePayload permits StoragePayload.Text, StoragePayload.Binary {

    record Text(String content) implements StoragePayload {

        public Text {
            if (content == null) {
                throw new IllegalArgumentException("content must not be null");
            }
        }
    }

    record Binary(byte[] content) implements StoragePayload {

        public Binary {
            if (content == null) {
                throw new IllegalArgumentException("content must not be null");
            }
        }
    }
}
