package io.intellixity.activa.persistence.relation;

/**
 * Reported (not thrown) when a loaded relation's parent and child live on different backends; the
 * batch was issued as an independent round trip against the child backend.
 */
public record CrossBackendRelation(String path, String parentBackend, String childBackend) {
}
