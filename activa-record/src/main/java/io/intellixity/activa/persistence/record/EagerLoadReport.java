package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.CrossBackendRelation;

import java.util.List;

/** Outcome of one eager load: relation batches issued and relations that crossed backends. */
public record EagerLoadReport(int queriesIssued, List<CrossBackendRelation> crossBackend) {
  public EagerLoadReport {
    crossBackend = crossBackend == null ? List.of() : List.copyOf(crossBackend);
  }

  public static EagerLoadReport empty() {
    return new EagerLoadReport(0, List.of());
  }

  public boolean hasCrossBackend() { return !crossBackend.isEmpty(); }
}
