package com.notegraph.core.service.ingest;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * A changed document as reported by the host.
 *
 * @param id           stable document id; defaults to the path, which is what graph boosts match on
 * @param path         vault-relative path
 * @param title        display title; defaults to the path
 * @param content      raw markdown
 * @param docType      document type, e.g. {@code markdown}
 * @param categories   categories assigned by the host
 * @param modifiedTime last modification, epoch millis
 * @param embedding    precomputed content embedding, optional
 */
@Builder
public record DocumentPayload(
        String id,
        String path,
        String title,
        String content,
        String docType,
        List<String> categories,
        long modifiedTime,
        float[] embedding
) {

    public DocumentPayload {
        Objects.requireNonNull(path, "path");
        if (id == null) {
            id = path;
        }
        if (content == null) {
            content = "";
        }
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
