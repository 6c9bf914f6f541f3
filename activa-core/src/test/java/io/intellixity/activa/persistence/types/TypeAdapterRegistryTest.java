package io.intellixity.activa.persistence.types;

import io.intellixity.activa.persistence.types.adapters.BooleanAdapter;
import io.intellixity.activa.persistence.types.adapters.DefaultTypeAdapterProvider;
import io.intellixity.activa.persistence.types.adapters.InstantAdapter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class TypeAdapterRegistryTest {
  enum Status { ACTIVE, SUSPENDED }

  static final class Money {}

  static TypeAdapterProvider provider(String dialectId, TypeAdapter<?>... adapters) {
    return new TypeAdapterProvider() {
      @Override public String dialectId() { return dialectId; }
      @Override public Collection<TypeAdapter<?>> adapters() { return List.of(adapters); }
    };
  }

  private static TypeAdapterRegistry registry(String dialectId, TypeAdapterProvider... dialectProviders) {
    List<TypeAdapterProvider> providers = new java.util.ArrayList<>(List.of(dialectProviders));
    providers.add(new DefaultTypeAdapterProvider());
    return new TypeAdapterRegistry(dialectId, providers);
  }

  @Test
  void roundTripsBuiltInTypes() {
    TypeAdapterRegistry types = registry("*");
    Instant now = Instant.parse("2024-05-01T10:15:30Z");
    UUID id = UUID.fromString("6f1c2a4e-3c11-4b7e-9b1a-2f0c8d9e1a77");

    assertEquals(now, types.fromDatabase(types.toDatabase(now), Instant.class));
    assertEquals(id, types.fromDatabase(types.toDatabase(id), UUID.class));
    assertEquals(new BigDecimal("12.50"), types.fromDatabase(types.toDatabase(new BigDecimal("12.50")), BigDecimal.class));
    assertEquals(LocalDate.of(2024, 2, 29), types.fromDatabase(types.toDatabase(LocalDate.of(2024, 2, 29)), LocalDate.class));
    assertEquals(Status.SUSPENDED, types.fromDatabase(types.toDatabase(Status.SUSPENDED), Status.class));
    assertEquals(Boolean.TRUE, types.fromDatabase(types.toDatabase(true), Boolean.class));
  }

  @Test
  void jsonMapRoundTripsThroughText() {
    TypeAdapterRegistry types = registry("*");
    Map<String, Object> doc = new HashMap<>();
    doc.put("name", "ada");
    doc.put("tags", List.of("a", "b"));
    Object encoded = types.toDatabase(doc);
    assertInstanceOf(String.class, encoded);
    assertEquals(doc, types.fromDatabase(encoded, Map.class));
  }

  @Test
  void readsDriverSpecificRepresentations() {
    TypeAdapterRegistry types = registry("*");
    assertEquals(42L, types.fromDatabase(42, Long.class));
    assertEquals(Boolean.FALSE, types.fromDatabase(0, Boolean.class));
    assertEquals(Status.ACTIVE, types.fromDatabase(0, Status.class));
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), types.fromDatabase("2024-01-01 00:00:00", Instant.class));
    assertEquals(7, types.fromDatabase(7L, int.class));
  }

  @Test
  void nullsPassThroughWithoutResolution() {
    TypeAdapterRegistry types = registry("*");
    assertNull(types.toDatabase(null, Money.class, null));
    assertNull(types.fromDatabase(null, Money.class));
  }

  @Test
  void dialectSuggestionBeatsGlobal() {
    TypeAdapterRegistry sqlite = registry("sqlite", provider("sqlite", new BooleanAdapter(true)));
    TypeAdapterRegistry other = registry("postgres", provider("sqlite", new BooleanAdapter(true)));
    assertEquals(1, sqlite.toDatabase(true));
    assertEquals(Boolean.TRUE, other.toDatabase(true));
  }

  @Test
  void explicitOverrideWins() {
    TypeAdapterRegistry types = registry("*");
    Instant t = Instant.parse("2024-05-01T10:15:30Z");
    assertInstanceOf(Timestamp.class, types.toDatabase(t));
    assertEquals("2024-05-01T10:15:30Z", types.toDatabase(t, Instant.class, new InstantAdapter(true)));
  }

  @Test
  void registrationAffectsLaterCallsOnly() {
    TypeAdapterRegistry types = registry("*");
    Object before = types.toDatabase(false);
    types.register(new BooleanAdapter(true));
    assertEquals(Boolean.FALSE, before);
    assertEquals(0, types.toDatabase(false));
    assertInstanceOf(BooleanAdapter.class, types.find(Boolean.class).orElseThrow());
  }

  @Test
  void unknownTypeFailsAtResolution() {
    TypeAdapterRegistry types = registry("*");
    UnregisteredTypeException ex = assertThrows(UnregisteredTypeException.class, () -> types.toDatabase(new Money()));
    assertEquals(Money.class, ex.javaType());
    assertTrue(types.find(Money.class).isEmpty());
  }

  @Test
  void discoversGlobalProvidersFromFactories() {
    TypeAdapterRegistry types = new TypeAdapterRegistry("*");
    assertTrue(types.find(String.class).isPresent());
    assertTrue(types.find(UUID.class).isPresent());
  }
}
